package surfacetopography.domain.state;

import surfacetopography.domain.topography.HeightContainer;
import surfacetopography.domain.topography.Topography;
import surfacetopography.parallel.DecompositionMode;
import surfacetopography.parallel.Reduction;

import java.util.Map;

/**
 * Estado de un mapa 2D. En ejecuciones paralelas guarda solo el subdominio local,
 * junto con la malla global y el origen del subdominio.
 *
 * @param shape Forma del buffer local.
 */
public record TopographyMapState(int[] shape, double[] heights, boolean[] mask, double[] physicalSizes,
                                 boolean periodic, int[] nbGridPts, int[] subdomainLocations,
                                 Map<String, Object> info) implements TopographyState {

    @Override
    public HeightContainer restore(Reduction reduction) {
        Topography.TopographyBuilder builder = Topography.builder()
                .heights(StateBuffers.toHeights(shape, heights, mask))
                .physicalSizes(physicalSizes)
                .periodic(periodic)
                .reduction(reduction)
                .info(info);
        if (reduction.size() > 1) {
            builder.decomposition(DecompositionMode.SUBDOMAIN)
                    .nbGridPts(nbGridPts)
                    .subdomainLocations(subdomainLocations);
        }
        return builder.build();
    }
}
