package surfacetopography.domain.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import surfacetopography.domain.topography.HeightArray;
import surfacetopography.domain.topography.HeightContainer;
import surfacetopography.domain.topography.NonuniformLineScan;
import surfacetopography.domain.topography.Topography;
import surfacetopography.domain.topography.UniformLineScan;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
class DetrendedTopographyTest {

    private static final double TOL = 1e-10;

    /**
     * h = a0 + ax·(i/nx) + ay·(j/ny) sobre una malla nx × ny.
     */
    private static Topography plane(int nx, int ny, double a0, double ax, double ay, boolean periodic) {
        double[][] h = new double[nx][ny];
        for (int i = 0; i < nx; i++) {
            for (int j = 0; j < ny; j++) {
                h[i][j] = a0 + ax * i / nx + ay * j / ny;
            }
        }
        return new Topography(HeightArray.of(h), new double[]{2.0, 3.0}, periodic, null);
    }

    private static double maxAbs(HeightArray h) {
        return Math.max(Math.abs(h.max()), Math.abs(h.min()));
    }

    private static double sumOfSquares(HeightArray h) {
        return h.meanSquare() * h.count();
    }

    @Test
    @DisplayName("Modo height: elimina exactamente un plano y los coeficientes lo reproducen")
    void heightMode_shouldRemovePlane() {
        // ARRANGE
        Topography t = plane(6, 5, 1.0, 2.0, 3.0, false);

        // ACT
        DetrendedTopography d = new DetrendedTopography(t, "height");

        // ASSERT
        log.info("Coeficientes: {}", d.stringifyPlane());
        assertThat(d.getCoeffs()).containsExactly(new double[]{2.0, 3.0, 1.0}, within(TOL));
        assertEquals(0.0, maxAbs(d.heights()), TOL);
        assertEquals("1.0 + 2.0 x + 3.0 y", d.stringifyPlane(c -> String.format(Locale.ROOT, "%.1f", c)));
        assertFalse(d.isPeriodic());
    }

    @Test
    @DisplayName("Modo center: es idempotente y conserva la periodicidad del padre")
    void centerMode_shouldBeIdempotent() {
        Topography t = plane(4, 4, 5.0, 1.0, -1.0, true);

        HeightContainer once = t.detrend("center");
        DetrendedTopography twice = (DetrendedTopography) once.detrend("center");

        assertEquals(0.0, once.mean(), TOL);
        assertEquals(0.0, twice.getCoeffs()[0], TOL);
        assertTrue(once.isPeriodic(), "Restar la media no rompe la periodicidad.");
        assertFalse(t.detrend("height").isPeriodic());
    }

    @Test
    @DisplayName("Modo height: el residuo nunca es mayor que el de restar solo la media")
    void heightMode_residualNotLargerThanCenter() {
        double[][] h = new double[8][8];
        for (int i = 0; i < 8; i++) {
            for (int j = 0; j < 8; j++) {
                h[i][j] = Math.sin(i * 0.7) * Math.cos(j * 1.3) + 0.2 * i;
            }
        }
        Topography t = new Topography(HeightArray.of(h), new double[]{1, 1}, false, null);

        double centered = sumOfSquares(t.detrend("center").heights());
        double tilted = sumOfSquares(t.detrend("height").heights());

        log.info("Suma de cuadrados: center={} height={}", centered, tilted);
        assertThat(tilted).isLessThanOrEqualTo(centered + TOL);
    }

    @Test
    @DisplayName("Modo curvature: recupera la curvatura física de una parábola")
    void curvatureMode_shouldRecoverCurvature() {
        // ARRANGE: h = 3 + 2u + 4u², u = i/n, L = 5
        int n = 10;
        double[] h = new double[n];
        for (int i = 0; i < n; i++) {
            double u = (double) i / n;
            h[i] = 3 + 2 * u + 4 * u * u;
        }
        UniformLineScan scan = new UniformLineScan(h, 5.0);

        // ACT
        DetrendedTopography d = new DetrendedTopography(scan, "curvature");

        // ASSERT
        assertThat(d.getCoeffs()).containsExactly(new double[]{3.0, 2.0, 4.0}, within(TOL));
        assertThat(d.curvatures()).containsExactly(new double[]{2 * 4.0 / 25.0}, within(TOL));
        assertEquals(0.0, maxAbs(d.heights()), TOL);
    }

    @Test
    @DisplayName("Modo curvature 2D: bicuadrática con curvaturas (ρxx, ρyy, ρxy)")
    void curvatureMode_biquadratic() {
        int nx = 7;
        int ny = 6;
        double[][] h = new double[nx][ny];
        for (int i = 0; i < nx; i++) {
            for (int j = 0; j < ny; j++) {
                double u = (double) i / nx;
                double v = (double) j / ny;
                h[i][j] = 1 + 0.5 * u - v + 2 * u * u + 3 * v * v + 0.5 * u * v;
            }
        }
        Topography t = new Topography(HeightArray.of(h), new double[]{2.0, 3.0}, false, null);

        DetrendedTopography d = new DetrendedTopography(t, "curvature");

        assertThat(d.getCoeffs()).containsExactly(new double[]{0.5, -1.0, 2.0, 3.0, 0.5, 1.0}, within(1e-8));
        assertThat(d.curvatures()).containsExactly(
                new double[]{2 * 2.0 / 4.0, 2 * 3.0 / 9.0, 2 * 0.5 / 6.0}, within(1e-8));
    }

    @Test
    @DisplayName("Reasignar el modo vuelve a ajustar los coeficientes")
    void setDetrendMode_shouldRefit() {
        DetrendedTopography d = new DetrendedTopography(plane(5, 5, 1.0, 2.0, 3.0, false), "center");
        assertThat(d.getCoeffs()).hasSize(1);
        assertThat(d.curvatures()).containsExactly(0.0, 0.0, 0.0);

        d.setDetrendMode("height");

        assertEquals("height", d.getDetrendMode());
        assertThat(d.getCoeffs()).hasSize(3);
    }

    @Test
    @DisplayName("Modo desconocido: el mensaje distingue line scans de topografías 2D")
    void unknownMode_shouldFail() {
        UniformLineScan scan = new UniformLineScan(new double[]{1, 2, 3}, 1.0);

        assertThatThrownBy(() -> scan.detrend("quartic"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("quartic")
                .hasMessageContaining("line scans");
        assertThatThrownBy(() -> plane(3, 3, 0, 0, 0, false).detrend("quartic"))
                .hasMessageContaining("topografías 2D");
    }

    @Test
    @DisplayName("Line scan no uniforme: el modo height usa x/L para ajustar y reconstruir")
    void heightMode_nonuniform() {
        double[] x = {0.0, 1.0, 3.0, 4.0, 8.0};
        double[] h = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            h[i] = 2 + 0.5 * x[i];
        }
        NonuniformLineScan scan = new NonuniformLineScan(x, h);

        DetrendedTopography d = new DetrendedTopography(scan, "height");

        // Pendiente por unidad de x/L: 0.5 · L
        assertThat(d.getCoeffs()).containsExactly(new double[]{2.0, 4.0}, within(TOL));
        assertEquals(0.0, maxAbs(d.heights()), TOL);
        assertThat(d.squeeze()).isInstanceOf(NonuniformLineScan.class);
    }

    @Test
    @DisplayName("Line scan no uniforme y perfil no lineal: el residuo 'height' es ortogonal a 1 y a x sobre el perfil lineal a trozos")
    void heightMode_nonuniform_weightedNormalEquations() {
        // ARRANGE: separación muy irregular, un tramo corto con un salto grande
        double[] x = {8, 27, 82, 83};
        NonuniformLineScan scan = new NonuniformLineScan(x, new double[]{0.464, 0.233, 0.394, -1.656});

        // ACT
        HeightArray r = new DetrendedTopography(scan, "height").heights();

        // ASSERT: ∫ r dx = 0 y ∫ r·x dx = 0 con r interpolado linealmente entre muestras
        double zeroth = 0;
        double first = 0;
        for (int i = 0; i < x.length - 1; i++) {
            double dx = x[i + 1] - x[i];
            zeroth += dx * (r.get(i) + r.get(i + 1)) / 2;
            first += dx * (r.get(i) * (2 * x[i] + x[i + 1]) + r.get(i + 1) * (x[i] + 2 * x[i + 1])) / 6;
        }
        assertEquals(0.0, zeroth, 1e-9);
        assertEquals(0.0, first, 1e-7);
    }

    @Test
    @DisplayName("Detrend por defecto: usa el modo configurado en el registro")
    void defaultMode_fromConfiguration() {
        DetrendedTopography d = (DetrendedTopography) plane(4, 4, 1, 1, 1, false).detrend();

        assertEquals("height", d.getDetrendMode());
    }
}
