package surfacetopography.physics.solver;

/**
 * Contrato base para cualquier componente numérico del motor.
 * Permite identificar los kernels en logs sin importar lo que calculen.
 */
public interface SolverComponent {
    /**
     * Nombre corto del algoritmo (ej: "FD_Uniform_Forward").
     */
    String getName();

    /**
     * Descripción técnica del esquema numérico.
     */
    default String getDescription() {
        return "Sin descripción disponible.";
    }
}
