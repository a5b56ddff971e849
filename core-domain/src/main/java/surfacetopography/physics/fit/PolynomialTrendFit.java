package surfacetopography.physics.fit;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import surfacetopography.domain.topography.HeightArray;
import surfacetopography.parallel.Reduction;

import java.util.List;

/**
 * Ajuste por mínimos cuadrados de un polinomio de tendencia a un campo de alturas.
 * <p>
 * Se acumulan las ecuaciones normales {@code AᵀA c = Aᵀh} sobre las muestras válidas locales.
 * Las sumas parciales de cada proceso se combinan con una única reducción vectorial, así que el ajuste
 * de una topografía repartida es idéntico al de la malla completa. El sistema se resuelve con
 * una descomposición LU de commons-math.
 */
@Slf4j
public final class PolynomialTrendFit {

    private PolynomialTrendFit() {}

    /**
     * Rellena la fila de la matriz de diseño correspondiente a una muestra.
     */
    @FunctionalInterface
    public interface Basis {
        void fill(double[] coordinates, double[] row);
    }

    /** Polinomio 1D {@code a0 + a1 u (+ a2 u²)}; coeficientes en orden de grado creciente. */
    public static Basis polynomial(int degree) {
        return (c, row) -> {
            double power = 1;
            for (int k = 0; k <= degree; k++) {
                row[k] = power;
                power *= c[0];
            }
        };
    }

    /** Plano {@code a1x x + a1y y + a0}; coeficientes {@code [a1x, a1y, a0]}. */
    public static Basis plane() {
        return (c, row) -> {
            row[0] = c[0];
            row[1] = c[1];
            row[2] = 1;
        };
    }

    /** Superficie bicuadrática; coeficientes {@code [m, n, mm, nn, mn, h0]}. */
    public static Basis biquadratic() {
        return (c, row) -> {
            row[0] = c[0];
            row[1] = c[1];
            row[2] = c[0] * c[0];
            row[3] = c[1] * c[1];
            row[4] = c[0] * c[1];
            row[5] = 1;
        };
    }

    /**
     * @param coordinates Coordenadas normalizadas de cada muestra, una componente por eje.
     * @param heights     Alturas locales; las muestras indefinidas no participan.
     * @param nbTerms     Número de coeficientes de la base.
     * @param reduction   Colaborador de reducción (reducción colectiva).
     * @return Coeficientes en el orden de la base.
     * @throws IllegalArgumentException si no hay suficientes muestras válidas para determinar el ajuste.
     */
    public static double[] fit(List<HeightArray> coordinates, HeightArray heights, Basis basis, int nbTerms,
                               Reduction reduction) {
        int dim = coordinates.size();
        double[] packed = new double[nbTerms * nbTerms + nbTerms];
        double[] point = new double[dim];
        double[] row = new double[nbTerms];
        for (int k = 0; k < heights.size(); k++) {
            if (!heights.isValid(k)) continue;
            for (int a = 0; a < dim; a++) {
                point[a] = coordinates.get(a).get(k);
            }
            basis.fill(point, row);
            double h = heights.get(k);
            for (int a = 0; a < nbTerms; a++) {
                for (int b = 0; b < nbTerms; b++) {
                    packed[a * nbTerms + b] += row[a] * row[b];
                }
                packed[nbTerms * nbTerms + a] += row[a] * h;
            }
        }
        return solve(reduction.sum(packed), nbTerms);
    }

    /**
     * Ajuste de un line scan no uniforme, interpretado como lineal a trozos entre muestras.
     * <p>
     * Minimiza {@code Σ Δx·(a² + ab + b²)/3} sobre los tramos con ambos extremos válidos, donde
     * {@code a} y {@code b} son los residuos en los extremos del tramo. Es la misma integral que usa la
     * altura rms de los line scans no uniformes, de modo que el residuo nunca supera a la constante media.
     *
     * @param coordinate Coordenada normalizada de cada muestra; los tramos se ponderan con su diferencia.
     * @param heights    Alturas; los tramos que tocan una muestra indefinida no participan.
     * @param nbTerms    Número de coeficientes de la base.
     * @return Coeficientes en el orden de la base.
     * @throws IllegalArgumentException si los tramos válidos no determinan el ajuste.
     */
    public static double[] fitPiecewiseLinear(HeightArray coordinate, HeightArray heights, Basis basis, int nbTerms) {
        double[] packed = new double[nbTerms * nbTerms + nbTerms];
        double[] left = new double[nbTerms];
        double[] right = new double[nbTerms];
        for (int k = 0; k < heights.size() - 1; k++) {
            if (!heights.isValid(k) || !heights.isValid(k + 1)) continue;
            double weight = (coordinate.get(k + 1) - coordinate.get(k)) / 3;
            basis.fill(new double[]{coordinate.get(k)}, left);
            basis.fill(new double[]{coordinate.get(k + 1)}, right);
            double ha = heights.get(k);
            double hb = heights.get(k + 1);
            // Forma cuadrática a² + ab + b² = [a b]·[[1, ½], [½, 1]]·[a b]ᵀ
            for (int a = 0; a < nbTerms; a++) {
                for (int b = 0; b < nbTerms; b++) {
                    packed[a * nbTerms + b] += weight * (left[a] * left[b] + right[a] * right[b]
                            + (left[a] * right[b] + right[a] * left[b]) / 2);
                }
                packed[nbTerms * nbTerms + a] += weight * (left[a] * ha + right[a] * hb
                        + (left[a] * hb + right[a] * ha) / 2);
            }
        }
        return solve(packed, nbTerms);
    }

    private static double[] solve(double[] total, int nbTerms) {
        RealMatrix normal = new Array2DRowRealMatrix(nbTerms, nbTerms);
        RealVector rhs = new ArrayRealVector(nbTerms);
        for (int a = 0; a < nbTerms; a++) {
            for (int b = 0; b < nbTerms; b++) {
                normal.setEntry(a, b, total[a * nbTerms + b]);
            }
            rhs.setEntry(a, total[nbTerms * nbTerms + a]);
        }
        DecompositionSolver solver = new LUDecomposition(normal).getSolver();
        if (!solver.isNonSingular()) {
            throw new IllegalArgumentException(
                    "No hay suficientes datos válidos para ajustar un polinomio de " + nbTerms + " coeficientes.");
        }
        double[] coeffs = solver.solve(rhs).toArray();
        log.trace("Ajuste polinómico de {} términos resuelto.", nbTerms);
        return coeffs;
    }

    /**
     * Evalúa el polinomio de coeficientes {@code coeffs} en las coordenadas dadas.
     */
    public static HeightArray evaluate(List<HeightArray> coordinates, Basis basis, double[] coeffs) {
        HeightArray first = coordinates.get(0);
        int dim = coordinates.size();
        double[] point = new double[dim];
        double[] row = new double[coeffs.length];
        double[] out = new double[first.size()];
        for (int k = 0; k < out.length; k++) {
            for (int a = 0; a < dim; a++) {
                point[a] = coordinates.get(a).get(k);
            }
            basis.fill(point, row);
            double value = 0;
            for (int t = 0; t < coeffs.length; t++) {
                value += coeffs[t] * row[t];
            }
            out[k] = value;
        }
        return HeightArray.of(first.shape(), out);
    }
}
