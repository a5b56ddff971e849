package surfacetopography.domain.pipeline;

import lombok.Getter;

/**
 * Modos de eliminación de tendencia, por grado del polinomio que se elimina.
 */
@Getter
public enum DetrendMode {
    /** Grado 0: resta la media. Conserva la periodicidad. */
    CENTER("center"),
    /** Grado 1 por mínimos cuadrados sobre las alturas. */
    HEIGHT("height"),
    /** Grado 1 estimando el gradiente como la media de la derivada medida. */
    SLOPE("slope"),
    /** Grado 2 por mínimos cuadrados (cuadrática o bicuadrática). */
    CURVATURE("curvature");

    private final String id;

    DetrendMode(String id) {
        this.id = id;
    }

    /**
     * @throws IllegalArgumentException si el modo no existe, indicando si la entidad es un line scan o un mapa 2D.
     */
    public static DetrendMode fromId(String id, int dim) {
        for (DetrendMode mode : values()) {
            if (mode.id.equals(id)) {
                return mode;
            }
        }
        throw new IllegalArgumentException(String.format(
                "Modo de detrend '%s' no soportado para %s.", id, dim == 1 ? "line scans" : "topografías 2D"));
    }
}
