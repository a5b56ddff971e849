package surfacetopography.config;

import lombok.Builder;
import lombok.With;

/**
 * Objeto de valor inmutable con los parámetros globales del pipeline de análisis.
 * <p>
 * Agrupa los valores por defecto que usan las operaciones registradas cuando el llamador
 * no especifica un argumento, así como los umbrales de ejecución de los kernels numéricos.
 *
 * @param defaultDetrendMode    Modo de eliminación de tendencia por defecto ("center", "height", "slope", "curvature").
 * @param defaultRmsHeightKind  Tipo de altura rms por defecto: "Sq" (área completa) o "Rq" (por perfil).
 * @param physicalSizeTolerance Tolerancia relativa al comparar el tamaño físico indicado por el llamador con el
 *                              que declaran los metadatos del lector. Por encima de ella se emite un aviso.
 * @param useParallelExecution  Si es true, los kernels de derivadas reparten las filas en un ForkJoinPool.
 * @param parallelThreshold     Número mínimo de muestras para que compense la ejecución en paralelo.
 */
@Builder
@With
public record AnalysisConfig(
        String defaultDetrendMode,
        String defaultRmsHeightKind,
        double physicalSizeTolerance,
        boolean useParallelExecution,
        int parallelThreshold
) {

    public AnalysisConfig {
        if (defaultDetrendMode == null || defaultDetrendMode.isBlank()) {
            throw new IllegalArgumentException("El modo de detrend por defecto no puede estar vacío.");
        }
        if (defaultRmsHeightKind == null || defaultRmsHeightKind.isBlank()) {
            throw new IllegalArgumentException("El tipo de altura rms por defecto no puede estar vacío.");
        }
        if (physicalSizeTolerance < 0) {
            throw new IllegalArgumentException("La tolerancia de tamaño físico no puede ser negativa.");
        }
        if (parallelThreshold < 0) {
            throw new IllegalArgumentException("El umbral de paralelismo no puede ser negativo.");
        }
    }

    public static AnalysisConfig getDefault() {
        return AnalysisConfig.builder()
                .defaultDetrendMode("height")
                .defaultRmsHeightKind("Sq")
                .physicalSizeTolerance(0.0)
                .useParallelExecution(false)
                .parallelThreshold(10_000)
                .build();
    }
}
