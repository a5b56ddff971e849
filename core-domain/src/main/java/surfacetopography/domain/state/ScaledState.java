package surfacetopography.domain.state;

import surfacetopography.domain.pipeline.ScaledTopography;
import surfacetopography.domain.topography.HeightContainer;
import surfacetopography.parallel.Reduction;

import java.util.Map;

public record ScaledState(TopographyState parent, double scaleFactor, Map<String, Object> info)
        implements TopographyState {

    @Override
    public HeightContainer restore(Reduction reduction) {
        return new ScaledTopography(parent.restore(reduction), scaleFactor, info);
    }
}
