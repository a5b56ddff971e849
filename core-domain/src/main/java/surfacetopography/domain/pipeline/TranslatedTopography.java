package surfacetopography.domain.pipeline;

import surfacetopography.domain.state.TopographyState;
import surfacetopography.domain.state.TranslatedState;
import surfacetopography.domain.topography.HeightArray;
import surfacetopography.domain.topography.HeightContainer;
import surfacetopography.utils.Tuples;

import java.util.Map;

/**
 * Desplazamiento circular del mapa 2D por un número entero de puntos en cada eje.
 * Solo está definido para mapas uniformes 2D completos: el desplazamiento circular necesita la malla global.
 */
public class TranslatedTopography extends DecoratedTopography {

    private int[] offset;

    public TranslatedTopography(HeightContainer parent, int[] offset, Map<String, ?> info) {
        super(parent, info);
        if (parent.dim() != 2 || !parent.isUniform()) {
            throw new IllegalArgumentException("La traslación solo está definida para topografías 2D uniformes.");
        }
        if (parent.isDomainDecomposed()) {
            throw new IllegalArgumentException("La traslación de una topografía repartida entre procesos no está soportada.");
        }
        setOffset(offset);
    }

    public TranslatedTopography(HeightContainer parent, int... offset) {
        this(parent, offset, null);
    }

    public int[] getOffset() {
        return offset.clone();
    }

    public void setOffset(int... offset) {
        if (offset == null || offset.length != 2) {
            throw new IllegalArgumentException(
                    "El desplazamiento debe tener dos componentes, recibido " + Tuples.format(offset) + ".");
        }
        this.offset = offset.clone();
    }

    @Override
    public HeightArray heights() {
        return parent.heights().roll(offset);
    }

    @Override
    public TopographyState exportState() {
        return new TranslatedState(parent.exportState(), offset.clone(), ownInfo());
    }
}
