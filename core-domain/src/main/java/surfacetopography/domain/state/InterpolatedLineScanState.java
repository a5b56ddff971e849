package surfacetopography.domain.state;

import surfacetopography.domain.pipeline.UniformlyInterpolatedLineScan;
import surfacetopography.domain.topography.HeightContainer;
import surfacetopography.parallel.Reduction;

import java.util.Map;

public record InterpolatedLineScanState(TopographyState parent, int nbPoints, int padding, Map<String, Object> info)
        implements TopographyState {

    @Override
    public HeightContainer restore(Reduction reduction) {
        return new UniformlyInterpolatedLineScan(parent.restore(reduction), nbPoints, padding, info);
    }
}
