package surfacetopography.registry;

import lombok.Getter;

/**
 * Conjunto cerrado de operaciones que pueden invocarse sobre cualquier topografía.
 * <p>
 * La implementación concreta de cada operación no vive aquí ni en las entidades: se asocia
 * en tiempo de arranque a través del {@link OperationRegistry}. Las extensiones que no encajan
 * en esta enumeración usan la ranura de operaciones personalizadas del registro.
 */
@Getter
public enum Operation {
    MEAN("mean", OperationKind.ANALYSIS),
    MIN("min", OperationKind.ANALYSIS),
    MAX("max", OperationKind.ANALYSIS),
    SCALE("scale", OperationKind.PIPELINE),
    DETREND("detrend", OperationKind.PIPELINE),
    TRANSPOSE("transpose", OperationKind.PIPELINE),
    TRANSLATE("translate", OperationKind.PIPELINE),
    TO_UNIFORM("to_uniform", OperationKind.PIPELINE),
    TO_NONUNIFORM("to_nonuniform", OperationKind.ANALYSIS),
    DERIVATIVE("derivative", OperationKind.ANALYSIS),
    RMS_HEIGHT("rms_height", OperationKind.ANALYSIS),
    RMS_SLOPE("rms_slope", OperationKind.ANALYSIS),
    RMS_LAPLACIAN("rms_laplacian", OperationKind.ANALYSIS),
    RMS_CURVATURE("rms_curvature", OperationKind.ANALYSIS);

    private final String id;
    private final OperationKind kind;

    Operation(String id, OperationKind kind) {
        this.id = id;
        this.kind = kind;
    }

    /**
     * Busca una operación por su identificador textual ("mean", "detrend"...).
     */
    public static Operation fromId(String id) {
        for (Operation op : values()) {
            if (op.id.equals(id)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Operación desconocida: '" + id + "'.");
    }
}
