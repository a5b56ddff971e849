package surfacetopography.domain.topography;

import surfacetopography.domain.state.NonuniformLineScanState;
import surfacetopography.domain.state.StateBuffers;
import surfacetopography.domain.state.TopographyState;
import surfacetopography.utils.Metadata;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Line scan con posiciones arbitrarias (estrictamente crecientes).
 * <p>
 * Nunca es periódico. El tamaño físico es la extensión {@code x[n-1] - x[0]} y no se puede reasignar,
 * porque está determinado por las posiciones. No tiene tamaño de píxel.
 */
public class NonuniformLineScan implements HeightContainer {

    private final HeightArray x;
    private final HeightArray heights;
    private final Map<String, Object> info;

    public NonuniformLineScan(double[] x, HeightArray heights, Map<String, ?> info) {
        Objects.requireNonNull(x, "Las posiciones no pueden ser nulas.");
        Objects.requireNonNull(heights, "El array de alturas no puede ser nulo.");
        if (heights.dim() != 1) {
            throw new IllegalArgumentException("El array de alturas debe ser unidimensional.");
        }
        if (x.length != heights.size()) {
            throw new IllegalArgumentException(String.format(
                    "Posiciones (%d) y alturas (%d) deben tener la misma longitud.", x.length, heights.size()));
        }
        if (x.length < 2) {
            throw new IllegalArgumentException("Un line scan no uniforme necesita al menos dos muestras.");
        }
        for (int i = 0; i < x.length; i++) {
            if (!Double.isFinite(x[i])) {
                throw new IllegalArgumentException("La posición " + i + " no es finita.");
            }
            if (i > 0 && x[i] <= x[i - 1]) {
                throw new IllegalArgumentException(String.format(
                        "Las posiciones deben ser estrictamente crecientes (x[%d] = %s, x[%d] = %s).",
                        i - 1, x[i - 1], i, x[i]));
            }
        }
        this.x = HeightArray.of(x);
        this.heights = heights;
        this.info = Metadata.copyOf(info);
    }

    public NonuniformLineScan(double[] x, double[] heights) {
        this(x, HeightArray.of(heights), null);
    }

    @Override
    public int dim() {
        return 1;
    }

    @Override
    public double[] physicalSizes() {
        return new double[]{x.get(x.size() - 1) - x.get(0)};
    }

    @Override
    public void setPhysicalSizes(double... physicalSizes) {
        throw new UnsupportedOperationException(
                "El tamaño físico de un line scan no uniforme lo determinan sus posiciones.");
    }

    @Override
    public int[] nbGridPts() {
        return new int[]{x.size()};
    }

    @Override
    public double[] pixelSize() {
        throw new UnsupportedOperationException("Un line scan no uniforme no tiene tamaño de píxel.");
    }

    @Override
    public boolean isPeriodic() {
        return false;
    }

    @Override
    public void setPeriodic(boolean periodic) {
        if (periodic) {
            throw new IllegalArgumentException("Un line scan no uniforme no puede ser periódico.");
        }
    }

    @Override
    public boolean isUniform() {
        return false;
    }

    @Override
    public boolean hasUndefinedData() {
        return heights.hasUndefinedData();
    }

    @Override
    public List<HeightArray> positions() {
        return List.of(x);
    }

    /**
     * @return Posición de la primera y de la última muestra.
     */
    public double[] xRange() {
        return new double[]{x.get(0), x.get(x.size() - 1)};
    }

    @Override
    public HeightArray heights() {
        return heights;
    }

    @Override
    public Map<String, Object> info() {
        return info;
    }

    @Override
    public TopographyKind kind() {
        return TopographyKind.NONUNIFORM_LINE_SCAN;
    }

    @Override
    public TopographyState exportState() {
        return new NonuniformLineScanState(x.toArray(), StateBuffers.values(heights), StateBuffers.mask(heights), info);
    }

    @Override
    public HeightContainer squeeze() {
        return this;
    }

    @Override
    public String toString() {
        return "NonuniformLineScan[n=" + x.size() + ", range=(" + x.get(0) + ", " + x.get(x.size() - 1) + ")]";
    }
}
