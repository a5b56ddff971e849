package surfacetopography.domain.state;

import surfacetopography.domain.pipeline.MemoizedTopography;
import surfacetopography.domain.topography.HeightContainer;
import surfacetopography.parallel.Reduction;

/**
 * La caché no forma parte del estado; se reconstruye vacía.
 */
public record MemoizedState(TopographyState parent) implements TopographyState {

    @Override
    public HeightContainer restore(Reduction reduction) {
        return new MemoizedTopography(parent.restore(reduction));
    }
}
