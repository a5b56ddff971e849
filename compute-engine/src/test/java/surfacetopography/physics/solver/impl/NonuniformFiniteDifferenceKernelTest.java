package surfacetopography.physics.solver.impl;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import surfacetopography.domain.topography.HeightArray;
import surfacetopography.domain.topography.NonuniformLineScan;
import surfacetopography.domain.topography.UniformLineScan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Slf4j
class NonuniformFiniteDifferenceKernelTest {

    private final NonuniformFiniteDifferenceKernel kernel = new NonuniformFiniteDifferenceKernel();

    @Test
    @DisplayName("Separación variable: la segunda derivada de x² es exactamente 2")
    void secondDerivative_quadraticIsExact() {
        // ARRANGE
        double[] x = {0.0, 0.3, 1.0, 1.2, 2.5, 4.0};
        double[] h = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            h[i] = x[i] * x[i];
        }
        NonuniformLineScan scan = new NonuniformLineScan(x, h);

        // ACT
        HeightArray d1 = kernel.derivative(scan, 1, null, 1).get(0);
        HeightArray d2 = kernel.derivative(scan, 2, null, 1).get(0);

        // ASSERT
        assertEquals(5, d1.size());
        assertEquals(4, d2.size());
        // Δ(x²)/Δx = x[i] + x[i+1]
        assertEquals(1.3, d1.get(1), 1e-12);
        for (int i = 0; i < d2.size(); i++) {
            assertEquals(2.0, d2.get(i), 1e-10);
        }
    }

    @Test
    @DisplayName("Separación constante: coincide con el kernel uniforme no periódico")
    void equalSpacing_matchesUniformKernel() {
        int n = 200;
        double dx = 0.05;
        double[] x = new double[n];
        double[] h = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = i * dx;
            h[i] = Math.sin(x[i]) + 0.1 * x[i] * x[i];
        }
        UniformLineScan uniform = new UniformLineScan(h, n * dx);
        NonuniformLineScan nonuniform = new NonuniformLineScan(x, h);
        UniformFiniteDifferenceKernel uniformKernel = new UniformFiniteDifferenceKernel();

        for (int order = 1; order <= 2; order++) {
            HeightArray expected = uniformKernel.derivative(uniform, order, false, 1).get(0);
            HeightArray actual = kernel.derivative(nonuniform, order, null, 1).get(0);
            assertEquals(expected.size(), actual.size());
            for (int i = 0; i < expected.size(); i++) {
                assertEquals(expected.get(i), actual.get(i), 1e-8, "Orden " + order + ", i=" + i);
            }
        }
    }

    @Test
    @DisplayName("Datos indefinidos: marcan indefinidas las diferencias que los tocan")
    void undefinedData_propagates() {
        NonuniformLineScan scan = new NonuniformLineScan(new double[]{0, 1, 2, 4, 5},
                HeightArray.of(new double[]{0, 1, Double.NaN, 3, 4}), null);

        HeightArray d2 = kernel.derivative(scan, 2, null, 1).get(0);

        assertThat(d2.validMask()).containsExactly(false, false, false);
    }

    @Test
    @DisplayName("Entrada inválida: periodicidad, separación distinta de 1 u orden no soportado")
    void invalidInput_shouldFail() {
        NonuniformLineScan scan = new NonuniformLineScan(new double[]{0, 1, 3}, new double[]{0, 1, 0});

        assertThatThrownBy(() -> kernel.derivative(scan, 1, true, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> kernel.derivative(scan, 1, null, 2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> kernel.derivative(scan, 3, null, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unsupported derivative order 3");
        assertEquals("FD_Nonuniform", kernel.getName());
    }
}
