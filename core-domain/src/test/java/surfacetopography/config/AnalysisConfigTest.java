package surfacetopography.config;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

@Slf4j
class AnalysisConfigTest {

    @Test
    @DisplayName("Valores por defecto: detrend 'height', altura rms 'Sq' y ejecución secuencial")
    void getDefault_values() {
        AnalysisConfig config = AnalysisConfig.getDefault();

        assertEquals("height", config.defaultDetrendMode());
        assertEquals("Sq", config.defaultRmsHeightKind());
        assertFalse(config.useParallelExecution());
        assertEquals(10_000, config.parallelThreshold());
    }

    @Test
    @DisplayName("Validación: valores vacíos o negativos se rechazan también al derivar con 'with'")
    void invalidValues_shouldFail() {
        AnalysisConfig config = AnalysisConfig.getDefault();

        assertThatThrownBy(() -> config.withDefaultDetrendMode(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.withPhysicalSizeTolerance(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.withParallelThreshold(-5)).isInstanceOf(IllegalArgumentException.class);
        assertEquals("Rq", config.withDefaultRmsHeightKind("Rq").defaultRmsHeightKind());
    }
}
