package surfacetopography.domain.state;

import surfacetopography.domain.topography.HeightContainer;
import surfacetopography.domain.topography.UniformLineScan;
import surfacetopography.parallel.Reduction;

import java.util.Map;

public record UniformLineScanState(double[] heights, boolean[] mask, double physicalSize, boolean periodic,
                                   Map<String, Object> info) implements TopographyState {

    @Override
    public HeightContainer restore(Reduction reduction) {
        return new UniformLineScan(StateBuffers.toHeights(new int[]{heights.length}, heights, mask),
                physicalSize, periodic, info);
    }
}
