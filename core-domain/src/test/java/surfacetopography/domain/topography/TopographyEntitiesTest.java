package surfacetopography.domain.topography;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
class TopographyEntitiesTest {

    @Test
    @DisplayName("Line scan uniforme: posiciones i·L/n, píxel L/n y entidad sin descomponer")
    void uniformLineScan_shouldExposeGridAttributes() {
        // ARRANGE
        UniformLineScan scan = new UniformLineScan(new double[]{1, 2, 3, 4}, 2.0);

        // ACT
        List<HeightArray> positions = scan.positions();

        // ASSERT
        assertThat(positions).hasSize(1);
        assertThat(positions.get(0).toArray()).containsExactly(0.0, 0.5, 1.0, 1.5);
        assertThat(scan.pixelSize()).containsExactly(0.5);
        assertEquals(0.5, scan.areaPerPt(), 1e-12);
        assertThat(scan.nbGridPts()).containsExactly(4);
        assertFalse(scan.isDomainDecomposed());
        assertTrue(scan.isUniform());
        assertSame(scan, scan.squeeze());
        assertEquals(TopographyKind.UNIFORM_LINE_SCAN, scan.kind());
    }

    @Test
    @DisplayName("Line scan uniforme: rechaza alturas 2D y tamaños físicos no positivos")
    void uniformLineScan_invalidInput_shouldFail() {
        assertThatThrownBy(() -> new UniformLineScan(HeightArray.zeros(2, 2), 1.0, false, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unidimensional");
        assertThatThrownBy(() -> new UniformLineScan(new double[]{1, 2}, 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new UniformLineScan(new double[]{1, 2}, Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Topografía 2D: malla de posiciones con indexado 'ij'")
    void topography_positions_shouldUseIjIndexing() {
        Topography t = new Topography(new double[][]{{0, 1, 2}, {3, 4, 5}}, 4.0, 6.0);

        List<HeightArray> xy = t.positions();

        assertThat(t.nbGridPts()).containsExactly(2, 3);
        assertThat(t.pixelSize()).containsExactly(2.0, 2.0);
        assertEquals(2.0, xy.get(0).get(1, 2), 1e-12, "x depende solo del primer índice.");
        assertEquals(4.0, xy.get(1).get(1, 2), 1e-12, "y depende solo del segundo índice.");
        assertEquals(4.0, t.areaPerPt(), 1e-12);
    }

    @Test
    @DisplayName("Topografía 2D en serie: nbGridPts distinto de la forma es un error")
    void topography_serialWithInconsistentGrid_shouldFail() {
        assertThatThrownBy(() -> Topography.builder()
                .heights(HeightArray.zeros(4, 4))
                .physicalSizes(new double[]{1, 1})
                .nbGridPts(new int[]{8, 8})
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("(8, 8)");
    }

    @Test
    @DisplayName("Tamaño físico y periodicidad son mutables; los metadatos son una copia")
    void topography_mutableAttributes() {
        Map<String, Object> info = new HashMap<>(Map.of("unit", "µm"));
        Topography t = new Topography(HeightArray.zeros(2, 2), new double[]{1, 1}, false, info);
        info.put("unit", "nm");

        t.setPhysicalSizes(3, 4);
        t.setPeriodic(true);

        assertThat(t.physicalSizes()).containsExactly(3.0, 4.0);
        assertTrue(t.isPeriodic());
        assertEquals("µm", t.info().get("unit"));
        assertThatThrownBy(() -> t.setPhysicalSizes(1.0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Line scan no uniforme: x creciente, sin periodicidad ni tamaño de píxel")
    void nonuniformLineScan_invariants() {
        NonuniformLineScan scan = new NonuniformLineScan(new double[]{1, 1.5, 3, 4}, new double[]{0, 1, 0, 1});

        assertThat(scan.physicalSizes()).containsExactly(3.0);
        assertThat(scan.xRange()).containsExactly(1.0, 4.0);
        assertFalse(scan.isUniform());
        assertFalse(scan.isPeriodic());
        assertThatThrownBy(() -> scan.setPeriodic(true)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(scan::pixelSize).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> scan.setPhysicalSizes(2.0)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Line scan no uniforme: posiciones no crecientes o longitudes distintas son un error")
    void nonuniformLineScan_invalidPositions_shouldFail() {
        assertThatThrownBy(() -> new NonuniformLineScan(new double[]{0, 2, 1}, new double[]{0, 0, 0}))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new NonuniformLineScan(new double[]{0, 1, 2}, new double[]{0, 0}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Posiciones y alturas: un line scan no expone coordenada y")
    void positionsAndHeights_lineScanHasNoY() {
        PositionsAndHeights ph = new UniformLineScan(new double[]{1, 2}, 1.0).positionsAndHeights();

        assertThat(ph.x().toArray()).containsExactly(0.0, 0.5);
        assertThatThrownBy(ph::y).isInstanceOf(IllegalStateException.class);
    }
}
