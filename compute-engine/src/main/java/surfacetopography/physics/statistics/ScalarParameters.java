package surfacetopography.physics.statistics;

import surfacetopography.domain.topography.HeightArray;
import surfacetopography.domain.topography.HeightContainer;
import surfacetopography.parallel.Reduction;

import java.util.List;

/**
 * Parámetros escalares de rugosidad sobre mallas uniformes.
 * <p>
 * La altura rms reduce sumas y recuentos a través del colaborador de la topografía, así que admite
 * topografías repartidas. Las magnitudes basadas en derivadas piden las derivadas a la propia
 * entidad, de modo que funcionan sobre cualquier cadena de decoradores.
 */
public final class ScalarParameters {

    public static final String SQ = "Sq";
    public static final String RQ = "Rq";

    private ScalarParameters() {}

    /**
     * @param kind {@code "Sq"}: desviación respecto de la media de toda la malla.
     *             {@code "Rq"}: desviación respecto de la media de cada perfil a lo largo del eje 0.
     */
    public static double rmsHeight(HeightContainer topography, String kind) {
        if (SQ.equals(kind)) {
            return rmsHeightFromArea(topography);
        }
        if (RQ.equals(kind)) {
            return topography.dim() == 1 ? rmsHeightFromArea(topography) : rmsHeightFromProfiles(topography);
        }
        throw new IllegalArgumentException("Tipo de altura rms desconocido '" + kind + "'.");
    }

    private static double rmsHeightFromArea(HeightContainer topography) {
        HeightArray h = topography.heights();
        Reduction reduction = topography.reduction();
        long count = reduction.sum(h.count());
        double mean = reduction.sum(h.sum()) / count;
        double squares = 0;
        for (int k = 0; k < h.size(); k++) {
            if (h.isValid(k)) {
                double d = h.get(k) - mean;
                squares += d * d;
            }
        }
        return Math.sqrt(reduction.sum(squares) / count);
    }

    private static double rmsHeightFromProfiles(HeightContainer topography) {
        HeightArray h = topography.heights();
        Reduction reduction = topography.reduction();
        int globalNy = topography.nbGridPts()[1];
        int offset = topography.subdomainLocations()[1];
        int nx = h.nx();
        int ny = h.ny();

        double[] sums = reduction.sum(h.columnSums(offset, globalNy));
        double[] counts = reduction.sum(h.columnCounts(offset, globalNy));

        double squares = 0;
        for (int i = 0; i < nx; i++) {
            for (int j = 0; j < ny; j++) {
                if (h.isValid(i, j)) {
                    double d = h.get(i, j) - sums[offset + j] / counts[offset + j];
                    squares += d * d;
                }
            }
        }
        long count = reduction.sum(h.count());
        return Math.sqrt(reduction.sum(squares) / count);
    }

    /**
     * {@code sqrt(mean(dx²) + mean(dy²))} con derivadas primeras por eje.
     */
    public static double rmsSlope(HeightContainer topography) {
        double total = 0;
        for (HeightArray component : topography.derivative(1)) {
            total += component.meanSquare();
        }
        return Math.sqrt(total);
    }

    /**
     * {@code sqrt(mean((d²x + d²y)²))}. Las dos componentes tienen rangos válidos distintos,
     * así que solo se suman en su región de solape.
     */
    public static double rmsLaplacian(HeightContainer topography) {
        List<HeightArray> curvature = topography.derivative(2);
        if (curvature.size() == 1) {
            return Math.sqrt(curvature.get(0).meanSquare());
        }
        HeightArray dxx = curvature.get(0);
        HeightArray dyy = curvature.get(1);
        int rows = dxx.nx();
        int cols = dyy.ny();
        int rowOffset = (dyy.nx() - rows) / 2;
        int colOffset = (dxx.ny() - cols) / 2;

        double squares = 0;
        long count = 0;
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                if (dxx.isValid(i, j + colOffset) && dyy.isValid(i + rowOffset, j)) {
                    double laplacian = dxx.get(i, j + colOffset) + dyy.get(i + rowOffset, j);
                    squares += laplacian * laplacian;
                    count++;
                }
            }
        }
        return Math.sqrt(squares / count);
    }

    /**
     * En mapas 2D, la mitad del Laplaciano rms (relación isótropa entre curvatura media y Laplaciano).
     * En line scans, el valor rms de la segunda derivada.
     */
    public static double rmsCurvature(HeightContainer topography) {
        double laplacian = rmsLaplacian(topography);
        return topography.dim() == 1 ? laplacian : laplacian / 2;
    }
}
