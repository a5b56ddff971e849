package surfacetopography.domain.state;

import surfacetopography.domain.pipeline.TransposedTopography;
import surfacetopography.domain.topography.HeightContainer;
import surfacetopography.parallel.Reduction;

import java.util.Map;

public record TransposedState(TopographyState parent, Map<String, Object> info) implements TopographyState {

    @Override
    public HeightContainer restore(Reduction reduction) {
        return new TransposedTopography(parent.restore(reduction), info);
    }
}
