package surfacetopography.domain.state;

import surfacetopography.domain.pipeline.DetrendedTopography;
import surfacetopography.domain.topography.HeightContainer;
import surfacetopography.parallel.Reduction;

import java.util.Map;

/**
 * Incluye los coeficientes ajustados: la restauración no vuelve a ajustar.
 */
public record DetrendedState(TopographyState parent, String detrendMode, double[] coeffs, Map<String, Object> info)
        implements TopographyState {

    @Override
    public HeightContainer restore(Reduction reduction) {
        return new DetrendedTopography(parent.restore(reduction), detrendMode, coeffs, info);
    }
}
