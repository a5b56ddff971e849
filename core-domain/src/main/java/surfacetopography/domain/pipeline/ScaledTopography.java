package surfacetopography.domain.pipeline;

import surfacetopography.domain.state.ScaledState;
import surfacetopography.domain.state.TopographyState;
import surfacetopography.domain.topography.HeightArray;
import surfacetopography.domain.topography.HeightContainer;

import java.util.Map;

/**
 * Escala las alturas por un factor constante. Nada más cambia.
 */
public class ScaledTopography extends DecoratedTopography {

    private final double scaleFactor;

    public ScaledTopography(HeightContainer parent, double scaleFactor, Map<String, ?> info) {
        super(parent, info);
        if (!Double.isFinite(scaleFactor)) {
            throw new IllegalArgumentException("El factor de escala debe ser finito, recibido " + scaleFactor + ".");
        }
        this.scaleFactor = scaleFactor;
    }

    public ScaledTopography(HeightContainer parent, double scaleFactor) {
        this(parent, scaleFactor, null);
    }

    public double getScaleFactor() {
        return scaleFactor;
    }

    @Override
    public HeightArray heights() {
        return parent.heights().times(scaleFactor);
    }

    @Override
    public TopographyState exportState() {
        return new ScaledState(parent.exportState(), scaleFactor, ownInfo());
    }
}
