package surfacetopography.parallel;

/**
 * Contrato del colaborador externo de reducciones colectivas.
 * <p>
 * El núcleo nunca implementa la comunicación entre procesos: cualquier resultado que dependa
 * del estado global (media de toda la topografía, "¿algún proceso tiene datos indefinidos?")
 * se expresa como una llamada a este contrato.
 * <p>
 * <b>Obligación del llamador:</b> las reducciones son colectivas. Todos los procesos que poseen
 * un fragmento de la topografía deben invocar la misma reducción, en el mismo orden; de lo
 * contrario el grupo queda bloqueado. El núcleo documenta esta obligación pero no puede imponerla.
 */
public interface Reduction {

    /**
     * Rango de este proceso dentro del grupo (0 .. size-1).
     */
    int rank();

    /**
     * Número de procesos del grupo.
     */
    int size();

    double sum(double localValue);

    long sum(long localValue);

    /**
     * Suma elemento a elemento de un vector local (todas las longitudes deben coincidir).
     */
    double[] sum(double[] localValues);

    double min(double localValue);

    double max(double localValue);

    boolean any(boolean localValue);
}
