package surfacetopography.registry;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import surfacetopography.domain.pipeline.ScaledTopography;
import surfacetopography.domain.topography.HeightContainer;
import surfacetopography.domain.topography.NonuniformLineScan;
import surfacetopography.domain.topography.Topography;
import surfacetopography.domain.topography.TopographyKind;
import surfacetopography.domain.topography.UniformLineScan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
class OperationRegistryTest {

    private static final String CUSTOM = "peak_to_valley";

    private final OperationRegistry registry = OperationRegistry.getInstance();

    @AfterEach
    void tearDown() {
        registry.unregisterCustom(CUSTOM);
    }

    @Test
    @DisplayName("Despacho: la misma operación se resuelve para entidades base y decoradas")
    void dispatch_shouldResolveByKind() {
        // ARRANGE
        UniformLineScan scan = new UniformLineScan(new double[]{1, 2, 3}, 3.0);
        Topography map = new Topography(new double[][]{{1, 2}, {3, 6}}, 1, 1);

        // ACT & ASSERT
        assertEquals(2.0, scan.mean(), 1e-12);
        assertEquals(3.0, map.mean(), 1e-12);
        assertEquals(6.0, map.max(), 1e-12);
        assertEquals(1.0, map.min(), 1e-12);
        HeightContainer scaled = scan.scale(2.0);
        assertThat(scaled).isInstanceOf(ScaledTopography.class);
        assertEquals(4.0, scaled.mean(), 1e-12, "El decorador hereda el tipo del padre para el despacho.");
    }

    @Test
    @DisplayName("Par no registrado: falla con UnsupportedOperationException nombrando operación y tipo")
    void dispatch_unsupportedPair_shouldFail() {
        NonuniformLineScan scan = new NonuniformLineScan(new double[]{0, 1, 3}, new double[]{0, 1, 0});

        assertFalse(registry.isSupported(TopographyKind.NONUNIFORM_LINE_SCAN, Operation.TRANSPOSE));
        assertThatThrownBy(scan::transpose)
                .isInstanceOf(UnsupportedOperationException.class)
                .hasMessageContaining("transpose")
                .hasMessageContaining(TopographyKind.NONUNIFORM_LINE_SCAN.getLabel());
    }

    @Test
    @DisplayName("Ranura personalizada: una operación registrada por nombre solo existe para los tipos indicados")
    void customSlot_shouldDispatchByName() {
        // ARRANGE
        registry.registerCustom(CUSTOM, (t, args) -> t.max() - t.min(), TopographyKind.TOPOGRAPHY);
        Topography map = new Topography(new double[][]{{1, 2}, {3, 7}}, 1, 1);
        UniformLineScan scan = new UniformLineScan(new double[]{1, 2, 3}, 3.0);

        // ACT
        Object result = map.callCustom(CUSTOM);

        // ASSERT
        assertEquals(6.0, (Double) result, 1e-12);
        assertTrue(registry.isCustomSupported(TopographyKind.TOPOGRAPHY, "  " + CUSTOM + " "));
        assertThatThrownBy(() -> scan.callCustom(CUSTOM)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Ranura personalizada: un registro posterior sustituye al anterior")
    void customSlot_laterRegistrationWins() {
        registry.registerCustom(CUSTOM, (t, args) -> 1.0, TopographyKind.UNIFORM_LINE_SCAN);
        registry.registerCustom(CUSTOM, (t, args) -> 2.0, TopographyKind.UNIFORM_LINE_SCAN);

        Object result = new UniformLineScan(new double[]{0, 0}, 1.0).callCustom(CUSTOM);

        assertEquals(2.0, (Double) result, 1e-12);
        assertThatThrownBy(() -> registry.registerCustom(" ", (t, args) -> null, TopographyKind.TOPOGRAPHY))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Argumentos: un tipo incorrecto es un error de entrada")
    void arguments_wrongType_shouldFail() {
        Topography map = new Topography(new double[][]{{1, 2}, {3, 7}}, 1, 1);

        assertThatThrownBy(() -> map.call(Operation.SCALE, "dos"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("scaleFactor");
        assertThatThrownBy(() -> map.call(Operation.SCALE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Falta");
        assertThat(Arguments.asIntVector(new Object[]{1, 2}, 0, "offset")).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Identificadores: cada operación se recupera por su nombre textual")
    void operation_fromId() {
        assertEquals(Operation.RMS_CURVATURE, Operation.fromId("rms_curvature"));
        assertEquals(OperationKind.PIPELINE, Operation.DETREND.getKind());
        assertThatThrownBy(() -> Operation.fromId("fft")).isInstanceOf(IllegalArgumentException.class);
    }
}
