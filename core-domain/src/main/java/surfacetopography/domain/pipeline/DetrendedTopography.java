package surfacetopography.domain.pipeline;

import lombok.extern.slf4j.Slf4j;
import surfacetopography.domain.state.DetrendedState;
import surfacetopography.domain.state.TopographyState;
import surfacetopography.domain.topography.HeightArray;
import surfacetopography.domain.topography.HeightContainer;
import surfacetopography.physics.fit.PolynomialTrendFit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleFunction;

/**
 * Elimina una tendencia polinómica ajustada a las alturas del padre.
 * <p>
 * Los coeficientes se ajustan al construir el decorador y cada vez que se reasigna el modo.
 * Su longitud determina el grado:
 * <ul>
 *     <li>Line scans: 1 (constante), 2 {@code [a0, a1]}, 3 {@code [a0, a1, a2]}.</li>
 *     <li>Mapas 2D: 1 (constante), 3 {@code [a1x, a1y, a0]}, 6 {@code [m, n, mm, nn, mn, h0]}.</li>
 * </ul>
 * Los modos {@code height} y {@code curvature} ajustan contra la posición dividida por el tamaño físico;
 * la reconstrucción evalúa el polinomio en índice de malla global dividido por la resolución.
 * En mallas uniformes ambas coordenadas coinciden. En line scans no uniformes se usa {@code x / L} en los dos pasos
 * y el ajuste pondera cada tramo con su longitud, igual que la altura rms de esos line scans.
 * <p>
 * El resultado solo es periódico con el modo {@code center} sobre un padre periódico.
 */
@Slf4j
public class DetrendedTopography extends DecoratedTopography {

    private DetrendMode detrendMode;
    private double[] coeffs;

    public DetrendedTopography(HeightContainer parent, String detrendMode, Map<String, ?> info) {
        super(parent, info);
        this.detrendMode = DetrendMode.fromId(detrendMode, parent.dim());
        this.coeffs = fitCoefficients();
    }

    public DetrendedTopography(HeightContainer parent, String detrendMode) {
        this(parent, detrendMode, null);
    }

    /**
     * Restaura un decorador con coeficientes ya ajustados, sin volver a ajustar.
     */
    public DetrendedTopography(HeightContainer parent, String detrendMode, double[] coeffs, Map<String, ?> info) {
        super(parent, info);
        this.detrendMode = DetrendMode.fromId(detrendMode, parent.dim());
        this.coeffs = coeffs.clone();
    }

    public String getDetrendMode() {
        return detrendMode.getId();
    }

    /**
     * Cambia el modo y vuelve a ajustar los coeficientes.
     */
    public void setDetrendMode(String detrendMode) {
        this.detrendMode = DetrendMode.fromId(detrendMode, dim());
        this.coeffs = fitCoefficients();
    }

    public double[] getCoeffs() {
        return coeffs.clone();
    }

    @Override
    public boolean isPeriodic() {
        return detrendMode == DetrendMode.CENTER && parent.isPeriodic();
    }

    private double[] fitCoefficients() {
        double[] fitted = switch (detrendMode) {
            case CENTER -> new double[]{parent.mean()};
            case HEIGHT -> polynomialFit(dim() == 1 ? PolynomialTrendFit.polynomial(1) : PolynomialTrendFit.plane(),
                    dim() == 1 ? 2 : 3);
            case CURVATURE -> polynomialFit(dim() == 1 ? PolynomialTrendFit.polynomial(2) : PolynomialTrendFit.biquadratic(),
                    dim() == 1 ? 3 : 6);
            case SLOPE -> isUniform() ? slopeCoefficients() : nonuniformSlopeCoefficients();
        };
        log.debug("Coeficientes de detrend '{}': {}", detrendMode.getId(), Arrays.toString(fitted));
        return fitted;
    }

    /**
     * Mallas uniformes: mínimos cuadrados por muestra. Line scans no uniformes: mínimos cuadrados sobre
     * el perfil lineal a trozos, ponderando cada tramo con su longitud.
     */
    private double[] polynomialFit(PolynomialTrendFit.Basis basis, int nbTerms) {
        if (!isUniform()) {
            return PolynomialTrendFit.fitPiecewiseLinear(fitCoordinates().get(0), parent.heights(), basis, nbTerms);
        }
        return PolynomialTrendFit.fit(fitCoordinates(), parent.heights(), basis, nbTerms, reduction());
    }

    /**
     * El gradiente es la media de la derivada medida (no periódica). Como la derivada se muestrea en los puntos
     * medios, el término independiente se corrige con {@code gradiente · (n - 1) / (2n)} por eje.
     */
    private double[] slopeCoefficients() {
        List<HeightArray> slopes = parent.derivative(1, false);
        double mean = parent.mean();
        if (dim() == 1) {
            double grad = slopes.get(0).mean() * physicalSizes()[0];
            int n = nbGridPts()[0];
            return new double[]{mean - grad * (n - 1) / (2.0 * n), grad};
        }
        int[] n = nbGridPts();
        double[] s = physicalSizes();
        double gx = slopes.get(0).mean() * s[0];
        double gy = slopes.get(1).mean() * s[1];
        return new double[]{gx, gy,
                mean - gx * (n[0] - 1) / (2.0 * n[0]) - gy * (n[1] - 1) / (2.0 * n[1])};
    }

    /**
     * Pendiente media ponderada por la longitud de los tramos válidos; el término independiente anula
     * la media integral del residuo lineal a trozos.
     */
    private double[] nonuniformSlopeCoefficients() {
        HeightArray u = fitCoordinates().get(0);
        HeightArray h = parent.heights();
        double rise = 0;
        double run = 0;
        double heightIntegral = 0;
        double coordinateIntegral = 0;
        for (int k = 0; k < h.size() - 1; k++) {
            if (!h.isValid(k) || !h.isValid(k + 1)) continue;
            double du = u.get(k + 1) - u.get(k);
            rise += h.get(k + 1) - h.get(k);
            run += du;
            heightIntegral += du * (h.get(k) + h.get(k + 1)) / 2;
            coordinateIntegral += du * (u.get(k) + u.get(k + 1)) / 2;
        }
        if (run == 0) {
            throw new IllegalArgumentException("No hay tramos válidos para estimar la pendiente.");
        }
        double grad = rise / run;
        return new double[]{(heightIntegral - grad * coordinateIntegral) / run, grad};
    }

    /**
     * Posición dividida por el tamaño físico, por eje.
     */
    private List<HeightArray> fitCoordinates() {
        List<HeightArray> positions = parent.positions();
        double[] sizes = physicalSizes();
        List<HeightArray> coordinates = new ArrayList<>(positions.size());
        for (int a = 0; a < positions.size(); a++) {
            double size = sizes[a];
            coordinates.add(positions.get(a).map(x -> x / size));
        }
        return coordinates;
    }

    /**
     * Índice global dividido por la resolución (mallas uniformes) o {@code x / L} (no uniformes).
     */
    private List<HeightArray> reconstructionCoordinates(int[] localShape) {
        if (!isUniform()) {
            return fitCoordinates();
        }
        int[] n = nbGridPts();
        int[] location = subdomainLocations();
        if (dim() == 1) {
            double[] u = new double[localShape[0]];
            for (int i = 0; i < u.length; i++) {
                u[i] = (double) (location[0] + i) / n[0];
            }
            return List.of(HeightArray.of(u));
        }
        int lnx = localShape[0];
        int lny = localShape[1];
        double[] u = new double[lnx * lny];
        double[] v = new double[lnx * lny];
        for (int i = 0; i < lnx; i++) {
            for (int j = 0; j < lny; j++) {
                u[i * lny + j] = (double) (location[0] + i) / n[0];
                v[i * lny + j] = (double) (location[1] + j) / n[1];
            }
        }
        return List.of(HeightArray.of(localShape, u), HeightArray.of(localShape, v));
    }

    @Override
    public HeightArray heights() {
        HeightArray heights = parent.heights();
        if (coeffs.length == 1) {
            double a0 = coeffs[0];
            return heights.map(h -> h - a0);
        }
        PolynomialTrendFit.Basis basis = basisFor(coeffs.length);
        HeightArray trend = PolynomialTrendFit.evaluate(reconstructionCoordinates(heights.shape()), basis, coeffs);
        return heights.minus(trend);
    }

    private PolynomialTrendFit.Basis basisFor(int nbCoeffs) {
        if (dim() == 1) {
            return switch (nbCoeffs) {
                case 2 -> PolynomialTrendFit.polynomial(1);
                case 3 -> PolynomialTrendFit.polynomial(2);
                default -> throw unknownCoefficients();
            };
        }
        return switch (nbCoeffs) {
            case 3 -> PolynomialTrendFit.plane();
            case 6 -> PolynomialTrendFit.biquadratic();
            default -> throw unknownCoefficients();
        };
    }

    /**
     * Curvaturas físicas {@code 1/R} de la tendencia ajustada: una en line scans,
     * {@code (ρxx, ρyy, ρxy)} en mapas 2D. Son nulas para tendencias de grado menor que 2.
     */
    public double[] curvatures() {
        double[] s = physicalSizes();
        if (dim() == 1) {
            return switch (coeffs.length) {
                case 3 -> new double[]{2 * coeffs[2] / (s[0] * s[0])};
                case 1, 2 -> new double[]{0};
                default -> throw unknownCoefficients();
            };
        }
        return switch (coeffs.length) {
            case 6 -> new double[]{2 * coeffs[2] / (s[0] * s[0]), 2 * coeffs[3] / (s[1] * s[1]),
                    2 * coeffs[4] / (s[0] * s[1])};
            case 1, 3 -> new double[]{0, 0, 0};
            default -> throw unknownCoefficients();
        };
    }

    /**
     * Expresión legible de la tendencia eliminada, p. ej. {@code "0.5 + 1.2 x + -0.3 y"}.
     */
    public String stringifyPlane(DoubleFunction<String> fmt) {
        String[] c = Arrays.stream(coeffs).mapToObj(fmt).toArray(String[]::new);
        if (c.length == 1) {
            return c[0];
        }
        if (dim() == 1) {
            return switch (c.length) {
                case 2 -> String.format("%s + %s x", c[0], c[1]);
                case 3 -> String.format("%s + %s x + %s x^2", c[0], c[1], c[2]);
                default -> throw unknownCoefficients();
            };
        }
        return switch (c.length) {
            case 3 -> String.format("%s + %s x + %s y", c[2], c[0], c[1]);
            case 6 -> String.format("%s + %s x + %s y + %s x^2 + %s y^2 + %s xy", c[5], c[0], c[1], c[2], c[3], c[4]);
            default -> throw unknownCoefficients();
        };
    }

    public String stringifyPlane() {
        return stringifyPlane(String::valueOf);
    }

    private IllegalStateException unknownCoefficients() {
        return new IllegalStateException(String.format(
                "Longitud de coeficientes desconocida (%d) para %s.",
                coeffs.length, dim() == 1 ? "line scans" : "topografías 2D"));
    }

    @Override
    public TopographyState exportState() {
        return new DetrendedState(parent.exportState(), detrendMode.getId(), coeffs.clone(), ownInfo());
    }
}
