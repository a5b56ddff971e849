package surfacetopography.physics.statistics;

import surfacetopography.domain.topography.HeightArray;
import surfacetopography.domain.topography.HeightContainer;

/**
 * Estadísticas de line scans no uniformes como integrales sobre la longitud del scan.
 * <p>
 * Las alturas se interpretan como lineales a trozos entre muestras. Los tramos que tocan
 * una muestra indefinida no participan; la normalización usa la longitud de los tramos válidos.
 */
public final class NonuniformStatistics {

    private NonuniformStatistics() {}

    /**
     * Media ponderada por la regla del trapecio.
     */
    public static double mean(HeightContainer topography) {
        HeightArray x = topography.positions().get(0);
        HeightArray h = topography.heights();
        double integral = 0;
        double length = 0;
        for (int i = 0; i < h.size() - 1; i++) {
            if (h.isValid(i) && h.isValid(i + 1)) {
                double dx = x.get(i + 1) - x.get(i);
                integral += dx * (h.get(i) + h.get(i + 1)) / 2;
                length += dx;
            }
        }
        return integral / length;
    }

    /**
     * Integral exacta del cuadrado de la desviación lineal a trozos: en cada tramo,
     * {@code Δx·(a² + ab + b²)/3}.
     */
    public static double rmsHeight(HeightContainer topography, String kind) {
        if (!ScalarParameters.SQ.equals(kind) && !ScalarParameters.RQ.equals(kind)) {
            throw new IllegalArgumentException("Tipo de altura rms desconocido '" + kind + "'.");
        }
        HeightArray x = topography.positions().get(0);
        HeightArray h = topography.heights();
        double mean = mean(topography);
        double integral = 0;
        double length = 0;
        for (int i = 0; i < h.size() - 1; i++) {
            if (h.isValid(i) && h.isValid(i + 1)) {
                double dx = x.get(i + 1) - x.get(i);
                double a = h.get(i) - mean;
                double b = h.get(i + 1) - mean;
                integral += dx * (a * a + a * b + b * b) / 3;
                length += dx;
            }
        }
        return Math.sqrt(integral / length);
    }

    /**
     * La pendiente es constante en cada tramo; se pondera por su longitud.
     */
    public static double rmsSlope(HeightContainer topography) {
        HeightArray x = topography.positions().get(0);
        HeightArray slopes = topography.derivative(1).get(0);
        double integral = 0;
        double length = 0;
        for (int i = 0; i < slopes.size(); i++) {
            if (slopes.isValid(i)) {
                double dx = x.get(i + 1) - x.get(i);
                integral += dx * slopes.get(i) * slopes.get(i);
                length += dx;
            }
        }
        return Math.sqrt(integral / length);
    }

    /**
     * La segunda derivada en la muestra interior {@code i} se pondera con la mitad de la
     * distancia entre sus vecinos.
     */
    public static double rmsCurvature(HeightContainer topography) {
        HeightArray x = topography.positions().get(0);
        HeightArray curvature = topography.derivative(2).get(0);
        double integral = 0;
        double weight = 0;
        for (int i = 0; i < curvature.size(); i++) {
            if (curvature.isValid(i)) {
                double w = (x.get(i + 2) - x.get(i)) / 2;
                integral += w * curvature.get(i) * curvature.get(i);
                weight += w;
            }
        }
        return Math.sqrt(integral / weight);
    }
}
