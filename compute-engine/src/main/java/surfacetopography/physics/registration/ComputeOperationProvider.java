package surfacetopography.physics.registration;

import lombok.extern.slf4j.Slf4j;
import surfacetopography.config.AnalysisConfig;
import surfacetopography.physics.solver.DerivativeKernel;
import surfacetopography.physics.solver.impl.NonuniformFiniteDifferenceKernel;
import surfacetopography.physics.solver.impl.UniformFiniteDifferenceKernel;
import surfacetopography.physics.statistics.NonuniformStatistics;
import surfacetopography.physics.statistics.ScalarParameters;
import surfacetopography.registry.Arguments;
import surfacetopography.registry.Operation;
import surfacetopography.registry.OperationProvider;
import surfacetopography.registry.OperationRegistry;

import static surfacetopography.domain.topography.TopographyKind.NONUNIFORM_LINE_SCAN;
import static surfacetopography.domain.topography.TopographyKind.TOPOGRAPHY;
import static surfacetopography.domain.topography.TopographyKind.UNIFORM_LINE_SCAN;

/**
 * Acopla al registro las derivadas por diferencias finitas y los parámetros escalares de rugosidad.
 * Se descubre mediante {@link java.util.ServiceLoader}.
 */
@Slf4j
public class ComputeOperationProvider implements OperationProvider {

    private final DerivativeKernel nonuniformKernel = new NonuniformFiniteDifferenceKernel();

    @Override
    public String getName() {
        return "compute-engine";
    }

    @Override
    public void register(OperationRegistry registry) {
        // --- Derivadas ---
        registry.register(Operation.DERIVATIVE,
                (t, args) -> uniformKernel(registry.getConfig()).derivative(t, order(args),
                        Arguments.asOptionalBoolean(args, 1, "periodic"),
                        Arguments.asInt(args, 2, "scaleFactor", 1)),
                UNIFORM_LINE_SCAN, TOPOGRAPHY);
        registry.register(Operation.DERIVATIVE,
                (t, args) -> nonuniformKernel.derivative(t, order(args),
                        Arguments.asOptionalBoolean(args, 1, "periodic"),
                        Arguments.asInt(args, 2, "scaleFactor", 1)),
                NONUNIFORM_LINE_SCAN);

        // --- Parámetros escalares, mallas uniformes ---
        registry.register(Operation.RMS_HEIGHT,
                (t, args) -> ScalarParameters.rmsHeight(t, rmsKind(registry, args)), UNIFORM_LINE_SCAN, TOPOGRAPHY);
        registry.register(Operation.RMS_SLOPE, (t, args) -> ScalarParameters.rmsSlope(t), UNIFORM_LINE_SCAN, TOPOGRAPHY);
        registry.register(Operation.RMS_LAPLACIAN,
                (t, args) -> ScalarParameters.rmsLaplacian(t), UNIFORM_LINE_SCAN, TOPOGRAPHY);
        registry.register(Operation.RMS_CURVATURE,
                (t, args) -> ScalarParameters.rmsCurvature(t), UNIFORM_LINE_SCAN, TOPOGRAPHY);

        // --- Parámetros escalares, line scans no uniformes ---
        registry.register(Operation.MEAN, (t, args) -> NonuniformStatistics.mean(t), NONUNIFORM_LINE_SCAN);
        registry.register(Operation.RMS_HEIGHT,
                (t, args) -> NonuniformStatistics.rmsHeight(t, rmsKind(registry, args)), NONUNIFORM_LINE_SCAN);
        registry.register(Operation.RMS_SLOPE, (t, args) -> NonuniformStatistics.rmsSlope(t), NONUNIFORM_LINE_SCAN);
        registry.register(Operation.RMS_LAPLACIAN,
                (t, args) -> NonuniformStatistics.rmsCurvature(t), NONUNIFORM_LINE_SCAN);
        registry.register(Operation.RMS_CURVATURE,
                (t, args) -> NonuniformStatistics.rmsCurvature(t), NONUNIFORM_LINE_SCAN);

        log.debug("Kernels registrados: {}, {}", uniformKernel(registry.getConfig()).getName(), nonuniformKernel.getName());
    }

    // La configuración puede cambiar tras el arranque; el kernel se ajusta en cada llamada
    private static DerivativeKernel uniformKernel(AnalysisConfig config) {
        return UniformFiniteDifferenceKernel.builder()
                .useParallelExecution(config.useParallelExecution())
                .parallelThreshold(config.parallelThreshold())
                .build();
    }

    private static int order(Object[] args) {
        return Arguments.asInt(args, 0, "n");
    }

    private static String rmsKind(OperationRegistry registry, Object[] args) {
        return Arguments.asString(args, 0, "kind", registry.getConfig().defaultRmsHeightKind());
    }

}
