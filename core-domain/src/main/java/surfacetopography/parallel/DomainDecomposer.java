package surfacetopography.parallel;

import java.util.ArrayList;
import java.util.List;

/**
 * Genera particiones rectangulares de una malla global entre varios procesos.
 * <p>
 * Los puntos sobrantes de una división no exacta se asignan a los primeros procesos,
 * de modo que los tamaños locales difieren como mucho en un punto por eje.
 */
public final class DomainDecomposer {

    private DomainDecomposer() {}

    /**
     * Divide la malla en franjas a lo largo del eje 0.
     */
    public static List<Decomposition> stripes(int[] nbGridPts, int nbProcesses) {
        return grid(nbGridPts, nbProcesses, 1);
    }

    /**
     * Divide la malla en una rejilla de {@code px × py} subdominios, ordenados por filas.
     * Para mallas 1D se ignora {@code py}.
     */
    public static List<Decomposition> grid(int[] nbGridPts, int px, int py) {
        if (px < 1 || py < 1) {
            throw new IllegalArgumentException("El número de procesos por eje debe ser positivo.");
        }
        if (px > nbGridPts[0] || (nbGridPts.length == 2 && py > nbGridPts[1])) {
            throw new IllegalArgumentException("Hay más procesos que puntos de malla en algún eje.");
        }
        int[][] xs = split(nbGridPts[0], px);
        List<Decomposition> result = new ArrayList<>();
        if (nbGridPts.length == 1) {
            for (int[] x : xs) {
                result.add(new Decomposition(nbGridPts, new int[]{x[0]}, new int[]{x[1]}));
            }
            return result;
        }
        int[][] ys = split(nbGridPts[1], py);
        for (int[] x : xs) {
            for (int[] y : ys) {
                result.add(new Decomposition(nbGridPts, new int[]{x[0], y[0]}, new int[]{x[1], y[1]}));
            }
        }
        return result;
    }

    // Devuelve pares (origen, extensión) por proceso
    private static int[][] split(int n, int parts) {
        int[][] ranges = new int[parts][2];
        int base = n / parts;
        int remainder = n % parts;
        int origin = 0;
        for (int p = 0; p < parts; p++) {
            int extent = base + (p < remainder ? 1 : 0);
            ranges[p][0] = origin;
            ranges[p][1] = extent;
            origin += extent;
        }
        return ranges;
    }
}
