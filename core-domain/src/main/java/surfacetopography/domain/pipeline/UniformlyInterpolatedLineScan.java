package surfacetopography.domain.pipeline;

import surfacetopography.domain.state.InterpolatedLineScanState;
import surfacetopography.domain.state.TopographyState;
import surfacetopography.domain.topography.HeightArray;
import surfacetopography.domain.topography.HeightContainer;
import surfacetopography.domain.topography.TopographyKind;

import java.util.List;
import java.util.Map;

/**
 * Interpolación lineal de un line scan sobre una malla uniforme de {@code nbPoints} puntos,
 * ampliada con {@code padding} puntos repartidos a ambos lados.
 * <p>
 * Cada altura se evalúa en la posición que devuelve {@link #positions()}. Fuera del rango del padre
 * (la zona de relleno) la interpolación toma el valor del extremo más cercano.
 * El tamaño físico crece en proporción al relleno: {@code L · (nbPoints + padding) / nbPoints}, con
 * {@code L} el tamaño físico del padre. La periodicidad es la del padre.
 */
public class UniformlyInterpolatedLineScan extends DecoratedTopography {

    private final int nbPoints;
    private final int padding;

    public UniformlyInterpolatedLineScan(HeightContainer parent, int nbPoints, int padding, Map<String, ?> info) {
        super(parent, info);
        if (parent.dim() != 1) {
            throw new IllegalArgumentException("Solo se pueden interpolar line scans.");
        }
        if (nbPoints < 2) {
            throw new IllegalArgumentException("La interpolación necesita al menos dos puntos, recibidos " + nbPoints + ".");
        }
        if (padding < 0) {
            throw new IllegalArgumentException("El relleno no puede ser negativo, recibido " + padding + ".");
        }
        if (parent.hasUndefinedData()) {
            throw new IllegalArgumentException("No se puede interpolar un line scan con datos indefinidos.");
        }
        this.nbPoints = nbPoints;
        this.padding = padding;
    }

    public UniformlyInterpolatedLineScan(HeightContainer parent, int nbPoints, int padding) {
        this(parent, nbPoints, padding, null);
    }

    public int getNbPoints() {
        return nbPoints;
    }

    public int getPadding() {
        return padding;
    }

    @Override
    public TopographyKind kind() {
        return TopographyKind.UNIFORM_LINE_SCAN;
    }

    @Override
    public boolean isUniform() {
        return true;
    }

    @Override
    public boolean isPeriodic() {
        return parent.isPeriodic();
    }

    @Override
    public int[] nbGridPts() {
        return new int[]{nbPoints + padding};
    }

    @Override
    public int[] nbSubdomainGridPts() {
        return nbGridPts();
    }

    @Override
    public int[] subdomainLocations() {
        return new int[]{0};
    }

    @Override
    public boolean isDomainDecomposed() {
        return false;
    }

    @Override
    public double[] physicalSizes() {
        return new double[]{parent.physicalSizes()[0] * (nbPoints + padding) / nbPoints};
    }

    @Override
    public void setPhysicalSizes(double... physicalSizes) {
        throw new UnsupportedOperationException(
                "El tamaño físico de un line scan interpolado se deriva del tamaño del padre.");
    }

    @Override
    public double[] pixelSize() {
        return new double[]{physicalSizes()[0] / (nbPoints + padding)};
    }

    @Override
    public double areaPerPt() {
        return pixelSize()[0];
    }

    @Override
    public boolean hasUndefinedData() {
        return false;
    }

    @Override
    public List<HeightArray> positions() {
        double[] bounds = bounds();
        double margin = (bounds[1] - bounds[0]) * padding / (2.0 * nbPoints);
        return List.of(HeightArray.of(linspace(bounds[0] - margin, bounds[1] + margin, nbPoints + padding)));
    }

    @Override
    public HeightArray heights() {
        HeightArray x = parent.positions().get(0);
        HeightArray h = parent.heights();
        double[] grid = positions().get(0).toArray();
        double[] out = new double[grid.length];
        int k = 0;
        for (int i = 0; i < grid.length; i++) {
            double xi = grid[i];
            while (k < x.size() - 2 && x.get(k + 1) < xi) {
                k++;
            }
            out[i] = interpolate(x, h, k, xi);
        }
        return HeightArray.of(out);
    }

    private static double interpolate(HeightArray x, HeightArray h, int k, double xi) {
        int last = x.size() - 1;
        if (xi <= x.get(0)) return h.get(0);
        if (xi >= x.get(last)) return h.get(last);
        double x0 = x.get(k);
        double x1 = x.get(k + 1);
        double t = (xi - x0) / (x1 - x0);
        return h.get(k) + t * (h.get(k + 1) - h.get(k));
    }

    private double[] bounds() {
        HeightArray x = parent.positions().get(0);
        return new double[]{x.get(0), x.get(x.size() - 1)};
    }

    private static double[] linspace(double start, double stop, int n) {
        double[] values = new double[n];
        double step = (stop - start) / (n - 1);
        for (int i = 0; i < n; i++) {
            values[i] = start + i * step;
        }
        values[n - 1] = stop;
        return values;
    }

    @Override
    public TopographyState exportState() {
        return new InterpolatedLineScanState(parent.exportState(), nbPoints, padding, ownInfo());
    }
}
