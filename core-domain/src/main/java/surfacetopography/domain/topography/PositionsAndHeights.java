package surfacetopography.domain.topography;

import java.util.List;

/**
 * Posiciones (una componente por eje, con la forma del buffer de alturas) y alturas de una topografía.
 */
public record PositionsAndHeights(List<HeightArray> positions, HeightArray heights) {

    public PositionsAndHeights {
        positions = List.copyOf(positions);
    }

    public HeightArray x() {
        return positions.get(0);
    }

    public HeightArray y() {
        if (positions.size() < 2) {
            throw new IllegalStateException("Un line scan no tiene coordenada y.");
        }
        return positions.get(1);
    }
}
