package surfacetopography.domain.state;

import surfacetopography.domain.pipeline.TranslatedTopography;
import surfacetopography.domain.topography.HeightContainer;
import surfacetopography.parallel.Reduction;

import java.util.Map;

public record TranslatedState(TopographyState parent, int[] offset, Map<String, Object> info)
        implements TopographyState {

    @Override
    public HeightContainer restore(Reduction reduction) {
        return new TranslatedTopography(parent.restore(reduction), offset, info);
    }
}
