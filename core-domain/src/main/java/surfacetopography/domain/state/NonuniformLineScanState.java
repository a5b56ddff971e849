package surfacetopography.domain.state;

import surfacetopography.domain.topography.HeightContainer;
import surfacetopography.domain.topography.NonuniformLineScan;
import surfacetopography.parallel.Reduction;

import java.util.Map;

public record NonuniformLineScanState(double[] x, double[] heights, boolean[] mask,
                                      Map<String, Object> info) implements TopographyState {

    @Override
    public HeightContainer restore(Reduction reduction) {
        return new NonuniformLineScan(x, StateBuffers.toHeights(new int[]{heights.length}, heights, mask), info);
    }
}
