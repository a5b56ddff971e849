package surfacetopography.physics.solver.impl;

import lombok.Builder;
import lombok.With;
import surfacetopography.domain.topography.HeightArray;
import surfacetopography.domain.topography.HeightContainer;
import surfacetopography.physics.solver.DerivativeKernel;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Diferencias finitas sobre mallas uniformes (line scans y mapas 2D).
 * <p>
 * Con separación de stencil {@code s} y tamaño de píxel {@code p}:
 * <ul>
 *     <li>Primera derivada: {@code (h[i+s] - h[i]) / (s·p)}.</li>
 *     <li>Segunda derivada: {@code (h[i+s] - 2h[i] + h[i-s]) / (s·p)²}.</li>
 * </ul>
 * En mallas periódicas los índices se envuelven y no se pierde ningún punto. En mallas no periódicas
 * se descartan los {@code s·n} puntos sin stencil completo, de modo que la salida {@code i} de la
 * segunda derivada corresponde al punto {@code i+s}.
 * Una muestra de salida es indefinida si su stencil toca alguna muestra indefinida.
 */
@Builder
@With
public class UniformFiniteDifferenceKernel implements DerivativeKernel {

    private final boolean useParallelExecution;
    private final int parallelThreshold;

    public UniformFiniteDifferenceKernel() {
        this(false, 10_000);
    }

    /**
     * @param useParallelExecution Si es true, reparte las líneas de la malla en un ForkJoinPool.
     * @param parallelThreshold    Número mínimo de muestras para activar el reparto.
     */
    public UniformFiniteDifferenceKernel(boolean useParallelExecution, int parallelThreshold) {
        this.useParallelExecution = useParallelExecution;
        this.parallelThreshold = parallelThreshold;
    }

    @Override
    public String getName() {
        return "FD_Uniform";
    }

    @Override
    public String getDescription() {
        return "Diferencias hacia delante (orden 1) y centradas de tres puntos (orden 2) con separación entera.";
    }

    @Override
    public List<HeightArray> derivative(HeightContainer topography, int n, Boolean periodic, int scaleFactor) {
        DerivativeKernel.checkOrder(n);
        if (scaleFactor < 1) {
            throw new IllegalArgumentException("La separación del stencil debe ser al menos 1, recibido " + scaleFactor + ".");
        }
        if (topography.isDomainDecomposed()) {
            throw new UnsupportedOperationException(
                    "Las derivadas de topografías repartidas entre procesos requieren intercambio de halos y no están soportadas.");
        }
        boolean wrap = periodic != null ? periodic : topography.isPeriodic();
        HeightArray heights = topography.heights();
        double[] pixelSize = topography.pixelSize();

        List<HeightArray> components = new ArrayList<>(heights.dim());
        for (int axis = 0; axis < heights.dim(); axis++) {
            components.add(alongAxis(heights, axis, n, scaleFactor, pixelSize[axis], wrap));
        }
        return components;
    }

    private HeightArray alongAxis(HeightArray h, int axis, int n, int s, double pixel, boolean wrap) {
        int nx = h.nx();
        int ny = h.ny();
        int along = axis == 0 ? nx : ny;
        int across = axis == 0 ? ny : nx;
        int outAlong = wrap ? along : along - n * s;
        if (outAlong < 1) {
            throw new IllegalArgumentException(String.format(
                    "Se necesitan más de %d puntos a lo largo del eje %d para la derivada de orden %d.", n * s, axis, n));
        }

        int[] outShape = h.shape();
        outShape[axis] = outAlong;
        double[] out = new double[outAlong * across];
        boolean[] valid = new boolean[out.length];
        double step = s * pixel;
        double denominator = n == 1 ? step : step * step;

        Line line = new Line(h, axis, along, outAlong);
        if (useParallelExecution && h.size() > parallelThreshold) {
            IntStream.range(0, across).parallel()
                    .forEach(l -> computeLine(line, l, n, s, wrap, denominator, out, valid));
        } else {
            for (int l = 0; l < across; l++) {
                computeLine(line, l, n, s, wrap, denominator, out, valid);
            }
        }

        boolean allValid = true;
        for (boolean v : valid) {
            if (!v) {
                allValid = false;
                break;
            }
        }
        return HeightArray.of(outShape, out, allValid ? null : valid);
    }

    // Una línea es una fila o una columna del buffer, según el eje de diferenciación
    private void computeLine(Line line, int l, int n, int s, boolean wrap, double denominator,
                             double[] out, boolean[] valid) {
        for (int i = 0; i < line.outAlong; i++) {
            int target = line.outputIndex(l, i);
            int[] stencil = stencil(i, n, s, wrap, line.along);
            boolean ok = true;
            for (int idx : stencil) {
                ok &= line.isValid(l, idx);
            }
            valid[target] = ok;
            if (!ok) {
                out[target] = Double.NaN;
                continue;
            }
            if (n == 1) {
                out[target] = (line.get(l, stencil[1]) - line.get(l, stencil[0])) / denominator;
            } else {
                out[target] = (line.get(l, stencil[2]) - 2 * line.get(l, stencil[1]) + line.get(l, stencil[0]))
                        / denominator;
            }
        }
    }

    /**
     * Índices (a lo largo del eje) que toca la salida {@code i}, en orden creciente de posición.
     */
    private static int[] stencil(int i, int n, int s, boolean wrap, int along) {
        if (n == 1) {
            return wrap
                    ? new int[]{i, Math.floorMod(i + s, along)}
                    : new int[]{i, i + s};
        }
        return wrap
                ? new int[]{Math.floorMod(i - s, along), i, Math.floorMod(i + s, along)}
                : new int[]{i, i + s, i + 2 * s};
    }

    private static final class Line {
        private final HeightArray h;
        private final int axis;
        private final int along;
        private final int ny;
        private final int outAlong;
        private final int outNy;

        private Line(HeightArray h, int axis, int along, int outAlong) {
            this.h = h;
            this.axis = axis;
            this.along = along;
            this.ny = h.ny();
            this.outAlong = outAlong;
            this.outNy = axis == 0 ? ny : outAlong;
        }

        private int flat(int l, int idx) {
            return axis == 0 ? idx * ny + l : l * ny + idx;
        }

        private double get(int l, int idx) {
            return h.get(flat(l, idx));
        }

        private boolean isValid(int l, int idx) {
            return h.isValid(flat(l, idx));
        }

        private int outputIndex(int l, int i) {
            return axis == 0 ? i * outNy + l : l * outNy + i;
        }
    }
}
