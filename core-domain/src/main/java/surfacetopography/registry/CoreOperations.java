package surfacetopography.registry;

import surfacetopography.domain.pipeline.DetrendedTopography;
import surfacetopography.domain.pipeline.ScaledTopography;
import surfacetopography.domain.pipeline.TranslatedTopography;
import surfacetopography.domain.pipeline.TransposedTopography;
import surfacetopography.domain.pipeline.UniformlyInterpolatedLineScan;
import surfacetopography.domain.topography.HeightArray;
import surfacetopography.domain.topography.HeightContainer;
import surfacetopography.domain.topography.NonuniformLineScan;
import surfacetopography.domain.topography.TopographyKind;
import surfacetopography.parallel.Reduction;

import static surfacetopography.domain.topography.TopographyKind.NONUNIFORM_LINE_SCAN;
import static surfacetopography.domain.topography.TopographyKind.TOPOGRAPHY;
import static surfacetopography.domain.topography.TopographyKind.UNIFORM_LINE_SCAN;

/**
 * Operaciones que el propio núcleo aporta al registro: estadísticas elementales y constructores de la pipeline.
 * Las reducciones pasan siempre por el colaborador de la entidad, de modo que el resultado es global.
 */
final class CoreOperations {

    private static final TopographyKind[] ALL = TopographyKind.values();

    private CoreOperations() {}

    static void register(OperationRegistry registry) {
        // --- Análisis ---
        registry.register(Operation.MEAN, (t, args) -> mean(t), ALL);
        registry.register(Operation.MIN, (t, args) -> t.reduction().min(t.heights().min()), ALL);
        registry.register(Operation.MAX, (t, args) -> t.reduction().max(t.heights().max()), ALL);
        registry.register(Operation.TO_NONUNIFORM, (t, args) -> toNonuniform(t), UNIFORM_LINE_SCAN);

        // --- Pipeline ---
        registry.register(Operation.SCALE,
                (t, args) -> new ScaledTopography(t, Arguments.asDouble(args, 0, "scaleFactor")), ALL);
        registry.register(Operation.DETREND,
                (t, args) -> new DetrendedTopography(t, Arguments.asString(args, 0, "detrendMode",
                        registry.getConfig().defaultDetrendMode())), ALL);
        registry.register(Operation.TRANSPOSE, (t, args) -> new TransposedTopography(t),
                UNIFORM_LINE_SCAN, TOPOGRAPHY);
        registry.register(Operation.TRANSLATE,
                (t, args) -> new TranslatedTopography(t, Arguments.asIntVector(args, 0, "offset")), TOPOGRAPHY);
        registry.register(Operation.TO_UNIFORM,
                (t, args) -> new UniformlyInterpolatedLineScan(t, Arguments.asInt(args, 0, "nbPoints"),
                        Arguments.asInt(args, 1, "padding", 0)),
                UNIFORM_LINE_SCAN, NONUNIFORM_LINE_SCAN);
    }

    private static double mean(HeightContainer topography) {
        HeightArray heights = topography.heights();
        Reduction reduction = topography.reduction();
        double sum = reduction.sum(heights.sum());
        long count = reduction.sum(heights.count());
        return sum / count;
    }

    /**
     * Las posiciones pasan a ser explícitas. Un line scan periódico añade el punto {@code x = L}
     * con la altura de la primera muestra, para que la extensión física se conserve.
     */
    private static NonuniformLineScan toNonuniform(HeightContainer topography) {
        double[] x = topography.positions().get(0).toArray();
        HeightArray heights = topography.heights();
        if (!topography.isPeriodic()) {
            return new NonuniformLineScan(x, heights, topography.info());
        }
        int n = x.length;
        double[] xp = new double[n + 1];
        double[] hp = new double[n + 1];
        boolean[] mask = new boolean[n + 1];
        System.arraycopy(x, 0, xp, 0, n);
        System.arraycopy(heights.toArray(), 0, hp, 0, n);
        System.arraycopy(heights.validMask(), 0, mask, 0, n);
        xp[n] = topography.physicalSizes()[0];
        hp[n] = hp[0];
        mask[n] = mask[0];
        return new NonuniformLineScan(xp, HeightArray.of(new int[]{n + 1}, hp, mask), topography.info());
    }
}
