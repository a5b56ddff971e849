package surfacetopography.domain.pipeline;

import surfacetopography.domain.state.TopographyState;
import surfacetopography.domain.state.TransposedState;
import surfacetopography.domain.topography.HeightArray;
import surfacetopography.domain.topography.HeightContainer;

import java.util.List;
import java.util.Map;

/**
 * Intercambia los ejes del buffer, la resolución, el tamaño físico y las posiciones.
 * Los line scans pasan sin cambios.
 */
public class TransposedTopography extends DecoratedTopography {

    public TransposedTopography(HeightContainer parent, Map<String, ?> info) {
        super(parent, info);
    }

    public TransposedTopography(HeightContainer parent) {
        this(parent, null);
    }

    @Override
    public double[] physicalSizes() {
        return swap(parent.physicalSizes());
    }

    /**
     * Los tamaños llegan en el orden de esta entidad y se reenvían en el del padre.
     */
    @Override
    public void setPhysicalSizes(double... physicalSizes) {
        parent.setPhysicalSizes(swap(physicalSizes.clone()));
    }

    @Override
    public int[] nbGridPts() {
        return swap(parent.nbGridPts());
    }

    @Override
    public int[] nbSubdomainGridPts() {
        return swap(parent.nbSubdomainGridPts());
    }

    @Override
    public int[] subdomainLocations() {
        return swap(parent.subdomainLocations());
    }

    @Override
    public double[] pixelSize() {
        return swap(parent.pixelSize());
    }

    @Override
    public HeightArray heights() {
        return parent.heights().transpose();
    }

    @Override
    public List<HeightArray> positions() {
        List<HeightArray> positions = parent.positions();
        if (dim() == 1) {
            return positions;
        }
        return List.of(positions.get(1).transpose(), positions.get(0).transpose());
    }

    @Override
    public TopographyState exportState() {
        return new TransposedState(parent.exportState(), ownInfo());
    }

    private static int[] swap(int[] values) {
        if (values.length == 2) {
            return new int[]{values[1], values[0]};
        }
        return values;
    }

    private static double[] swap(double[] values) {
        if (values.length == 2) {
            return new double[]{values[1], values[0]};
        }
        return values;
    }
}
