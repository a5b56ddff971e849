package surfacetopography.domain.state;

import surfacetopography.domain.pipeline.CompoundTopography;
import surfacetopography.domain.topography.HeightContainer;
import surfacetopography.parallel.Reduction;

public record CompoundState(TopographyState first, TopographyState second) implements TopographyState {

    @Override
    public HeightContainer restore(Reduction reduction) {
        return new CompoundTopography(first.restore(reduction), second.restore(reduction));
    }
}
