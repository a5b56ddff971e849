package surfacetopography.registry;

/**
 * Naturaleza de una operación registrada.
 */
public enum OperationKind {
    /**
     * Se evalúa inmediatamente y devuelve un escalar o un array.
     */
    ANALYSIS,

    /**
     * Devuelve una nueva entidad decorada que difiere el cálculo hasta que se piden las alturas.
     */
    PIPELINE
}
