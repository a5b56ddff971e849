package surfacetopography.domain.pipeline;

import surfacetopography.domain.state.MemoizedState;
import surfacetopography.domain.state.TopographyState;
import surfacetopography.domain.topography.HeightArray;
import surfacetopography.domain.topography.HeightContainer;

/**
 * Guarda en caché las alturas del padre hasta que se invoca {@link #invalidate()}.
 * <p>
 * Es opcional: el resto de decoradores recalcula en cada lectura. Un cambio en la entidad base
 * (por ejemplo, reasignar el tamaño físico de la que depende un detrend) no se observa hasta invalidar.
 */
public class MemoizedTopography extends DecoratedTopography {

    private volatile HeightArray cached;

    public MemoizedTopography(HeightContainer parent) {
        super(parent, null);
    }

    @Override
    public HeightArray heights() {
        HeightArray heights = cached;
        if (heights == null) {
            heights = parent.heights();
            cached = heights;
        }
        return heights;
    }

    public void invalidate() {
        cached = null;
    }

    public boolean isCached() {
        return cached != null;
    }

    @Override
    public TopographyState exportState() {
        return new MemoizedState(parent.exportState());
    }
}
