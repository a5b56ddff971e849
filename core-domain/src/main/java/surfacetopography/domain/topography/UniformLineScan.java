package surfacetopography.domain.topography;

import surfacetopography.domain.state.StateBuffers;
import surfacetopography.domain.state.TopographyState;
import surfacetopography.domain.state.UniformLineScanState;
import surfacetopography.utils.Metadata;
import surfacetopography.utils.PhysicalSizes;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Line scan sobre una malla uniforme unidimensional.
 * Las posiciones son {@code i * pixelSize}, empezando en 0.
 */
public class UniformLineScan implements HeightContainer {

    private final HeightArray heights;
    private final Map<String, Object> info;
    private double physicalSize;
    private boolean periodic;

    public UniformLineScan(HeightArray heights, double physicalSize, boolean periodic, Map<String, ?> info) {
        Objects.requireNonNull(heights, "El array de alturas no puede ser nulo.");
        if (heights.dim() != 1) {
            throw new IllegalArgumentException("El array de alturas debe ser unidimensional.");
        }
        if (heights.size() == 0) {
            throw new IllegalArgumentException("Un line scan necesita al menos una muestra.");
        }
        this.heights = heights;
        this.physicalSize = PhysicalSizes.validate(1, physicalSize)[0];
        this.periodic = periodic;
        this.info = Metadata.copyOf(info);
    }

    public UniformLineScan(double[] heights, double physicalSize, boolean periodic, Map<String, ?> info) {
        this(HeightArray.of(heights), physicalSize, periodic, info);
    }

    public UniformLineScan(double[] heights, double physicalSize) {
        this(heights, physicalSize, false, null);
    }

    @Override
    public int dim() {
        return 1;
    }

    @Override
    public double[] physicalSizes() {
        return new double[]{physicalSize};
    }

    @Override
    public void setPhysicalSizes(double... physicalSizes) {
        this.physicalSize = PhysicalSizes.validate(1, physicalSizes)[0];
    }

    @Override
    public int[] nbGridPts() {
        return new int[]{heights.size()};
    }

    @Override
    public boolean isPeriodic() {
        return periodic;
    }

    @Override
    public void setPeriodic(boolean periodic) {
        this.periodic = periodic;
    }

    @Override
    public boolean isUniform() {
        return true;
    }

    @Override
    public boolean hasUndefinedData() {
        return heights.hasUndefinedData();
    }

    @Override
    public List<HeightArray> positions() {
        int n = heights.size();
        double p = physicalSize / n;
        double[] x = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = i * p;
        }
        return List.of(HeightArray.of(x));
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
        return TopographyKind.UNIFORM_LINE_SCAN;
    }

    @Override
    public TopographyState exportState() {
        return new UniformLineScanState(
                StateBuffers.values(heights), StateBuffers.mask(heights), physicalSize, periodic, info);
    }

    /**
     * Una entidad base ya posee su buffer; no hay nada que materializar.
     */
    @Override
    public HeightContainer squeeze() {
        return this;
    }

    @Override
    public String toString() {
        return "UniformLineScan[n=" + heights.size() + ", size=" + physicalSize + ", periodic=" + periodic + "]";
    }
}
