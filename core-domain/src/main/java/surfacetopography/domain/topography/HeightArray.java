package surfacetopography.domain.topography;

import surfacetopography.utils.Tuples;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * Buffer inmutable de alturas de rango 1 o 2, almacenado en orden row-major.
 * <p>
 * Los datos indefinidos (huecos de medida) no se representan con un valor centinela,
 * sino con una máscara de validez paralela. Cualquier muestra no finita recibida en la
 * construcción se marca como indefinida. Las operaciones elemento a elemento propagan
 * la máscara: el resultado es indefinido si algún operando lo es.
 * <p>
 * Los accesores devuelven siempre copias, de modo que ningún consumidor puede alterar
 * el estado interno de una topografía a través de este objeto.
 */
public final class HeightArray {

    private final int[] shape;
    private final double[] values;
    // null cuando todas las muestras son válidas
    private final boolean[] valid;

    private HeightArray(int[] shape, double[] values, boolean[] valid) {
        this.shape = shape;
        this.values = values;
        this.valid = valid;
    }

    // --- FACTORÍAS ---

    public static HeightArray of(double[] values) {
        Objects.requireNonNull(values, "El array de alturas no puede ser nulo.");
        return of(new int[]{values.length}, values, null);
    }

    public static HeightArray of(double[][] rows) {
        Objects.requireNonNull(rows, "El array de alturas no puede ser nulo.");
        int nx = rows.length;
        int ny = nx == 0 ? 0 : rows[0].length;
        double[] flat = new double[nx * ny];
        for (int i = 0; i < nx; i++) {
            if (rows[i].length != ny) {
                throw new IllegalArgumentException(String.format(
                        "El array bidimensional no es rectangular: la fila %d tiene %d columnas en lugar de %d.",
                        i, rows[i].length, ny));
            }
            System.arraycopy(rows[i], 0, flat, i * ny, ny);
        }
        return of(new int[]{nx, ny}, flat, null);
    }

    public static HeightArray of(int[] shape, double[] flat) {
        return of(shape, flat, null);
    }

    /**
     * Construye un buffer a partir de datos planos y una máscara opcional.
     *
     * @param shape     Forma (1 o 2 ejes).
     * @param flat      Valores en orden row-major.
     * @param validMask Máscara de validez (puede ser null). Una muestra es válida si la máscara
     *                  lo indica y además su valor es finito.
     */
    public static HeightArray of(int[] shape, double[] flat, boolean[] validMask) {
        Objects.requireNonNull(shape, "La forma no puede ser nula.");
        Objects.requireNonNull(flat, "El array de alturas no puede ser nulo.");
        if (shape.length < 1 || shape.length > 2) {
            throw new IllegalArgumentException("Solo se admiten buffers de rango 1 o 2, recibido rango " + shape.length + ".");
        }
        int expected = 1;
        for (int n : shape) {
            if (n < 0) {
                throw new IllegalArgumentException("La forma " + Tuples.format(shape) + " contiene dimensiones negativas.");
            }
            expected *= n;
        }
        if (flat.length != expected) {
            throw new IllegalArgumentException(String.format(
                    "La forma %s requiere %d valores, recibidos %d.", Tuples.format(shape), expected, flat.length));
        }
        if (validMask != null && validMask.length != expected) {
            throw new IllegalArgumentException("La máscara de validez no coincide con la forma " + Tuples.format(shape) + ".");
        }

        double[] copy = flat.clone();
        boolean[] mask = null;
        for (int k = 0; k < copy.length; k++) {
            boolean ok = Double.isFinite(copy[k]) && (validMask == null || validMask[k]);
            if (!ok) {
                if (mask == null) {
                    mask = new boolean[copy.length];
                    Arrays.fill(mask, true);
                }
                mask[k] = false;
                copy[k] = Double.NaN;
            }
        }
        return new HeightArray(shape.clone(), copy, mask);
    }

    public static HeightArray zeros(int... shape) {
        int n = 1;
        for (int s : shape) n *= s;
        return of(shape, new double[n]);
    }

    // --- FORMA ---

    public int dim() {
        return shape.length;
    }

    public int[] shape() {
        return shape.clone();
    }

    /**
     * Número de filas (eje 0).
     */
    public int nx() {
        return shape[0];
    }

    /**
     * Número de columnas (eje 1). Para buffers 1D vale 1.
     */
    public int ny() {
        return shape.length == 2 ? shape[1] : 1;
    }

    public int size() {
        return values.length;
    }

    // --- ACCESO ---

    public double get(int flatIndex) {
        return values[flatIndex];
    }

    public double get(int i, int j) {
        return values[i * ny() + j];
    }

    public boolean isValid(int flatIndex) {
        return valid == null || valid[flatIndex];
    }

    public boolean isValid(int i, int j) {
        return isValid(i * ny() + j);
    }

    public boolean hasUndefinedData() {
        return valid != null;
    }

    public double[] toArray() {
        return values.clone();
    }

    public double[][] toArray2D() {
        int nx = nx();
        int ny = ny();
        double[][] rows = new double[nx][ny];
        for (int i = 0; i < nx; i++) {
            System.arraycopy(values, i * ny, rows[i], 0, ny);
        }
        return rows;
    }

    /**
     * @return Copia de la máscara de validez (todo true si no hay datos indefinidos).
     */
    public boolean[] validMask() {
        if (valid == null) {
            boolean[] all = new boolean[values.length];
            Arrays.fill(all, true);
            return all;
        }
        return valid.clone();
    }

    // --- OPERACIONES ELEMENTO A ELEMENTO ---

    public HeightArray map(DoubleUnaryOperator operator) {
        double[] out = new double[values.length];
        for (int k = 0; k < out.length; k++) {
            out[k] = isValid(k) ? operator.applyAsDouble(values[k]) : Double.NaN;
        }
        return new HeightArray(shape.clone(), out, valid == null ? null : valid.clone());
    }

    public HeightArray times(double factor) {
        return map(h -> factor * h);
    }

    public HeightArray plus(HeightArray other) {
        return combine(other, Double::sum);
    }

    public HeightArray minus(HeightArray other) {
        return combine(other, (a, b) -> a - b);
    }

    public HeightArray combine(HeightArray other, DoubleBinaryOperator operator) {
        if (!Arrays.equals(shape, other.shape)) {
            throw new IllegalArgumentException(String.format(
                    "Formas incompatibles: %s <-> %s", Tuples.format(shape), Tuples.format(other.shape)));
        }
        double[] out = new double[values.length];
        boolean[] mask = null;
        for (int k = 0; k < out.length; k++) {
            if (isValid(k) && other.isValid(k)) {
                out[k] = operator.applyAsDouble(values[k], other.values[k]);
            } else {
                if (mask == null) {
                    mask = new boolean[out.length];
                    Arrays.fill(mask, true);
                }
                mask[k] = false;
                out[k] = Double.NaN;
            }
        }
        return new HeightArray(shape.clone(), out, mask);
    }

    /**
     * Intercambia los ejes. Un buffer 1D se devuelve sin cambios.
     */
    public HeightArray transpose() {
        if (dim() == 1) {
            return this;
        }
        int nx = nx();
        int ny = ny();
        double[] out = new double[values.length];
        boolean[] mask = valid == null ? null : new boolean[values.length];
        for (int i = 0; i < nx; i++) {
            for (int j = 0; j < ny; j++) {
                out[j * nx + i] = values[i * ny + j];
                if (mask != null) mask[j * nx + i] = valid[i * ny + j];
            }
        }
        return new HeightArray(new int[]{ny, nx}, out, mask);
    }

    /**
     * Desplazamiento circular por un número entero de puntos en cada eje,
     * con la misma semántica que un "roll": el elemento i pasa a la posición i + offset.
     */
    public HeightArray roll(int... offsets) {
        if (offsets.length != dim()) {
            throw new IllegalArgumentException(String.format(
                    "Se esperaban %d desplazamientos, recibidos %d.", dim(), offsets.length));
        }
        int nx = nx();
        int ny = ny();
        int ox = offsets[0];
        int oy = dim() == 2 ? offsets[1] : 0;
        double[] out = new double[values.length];
        boolean[] mask = valid == null ? null : new boolean[values.length];
        for (int i = 0; i < nx; i++) {
            int ti = Math.floorMod(i + ox, nx);
            for (int j = 0; j < ny; j++) {
                int tj = Math.floorMod(j + oy, ny);
                out[ti * ny + tj] = values[i * ny + j];
                if (mask != null) mask[ti * ny + tj] = valid[i * ny + j];
            }
        }
        return new HeightArray(shape.clone(), out, mask);
    }

    /**
     * Extrae un bloque rectangular contiguo.
     *
     * @param origin Índice de la esquina del bloque.
     * @param extent Número de puntos del bloque por eje.
     */
    public HeightArray block(int[] origin, int[] extent) {
        if (origin.length != dim() || extent.length != dim()) {
            throw new IllegalArgumentException("El origen y la extensión del bloque deben tener rango " + dim() + ".");
        }
        for (int a = 0; a < dim(); a++) {
            if (origin[a] < 0 || extent[a] < 0 || origin[a] + extent[a] > shape[a]) {
                throw new IllegalArgumentException(String.format(
                        "El bloque %s + %s excede la forma %s.",
                        Tuples.format(origin), Tuples.format(extent), Tuples.format(shape)));
            }
        }
        int bx = extent[0];
        int by = dim() == 2 ? extent[1] : 1;
        int ox = origin[0];
        int oy = dim() == 2 ? origin[1] : 0;
        int ny = ny();
        double[] out = new double[bx * by];
        boolean[] mask = null;
        for (int i = 0; i < bx; i++) {
            for (int j = 0; j < by; j++) {
                int src = (ox + i) * ny + (oy + j);
                out[i * by + j] = values[src];
                if (!isValid(src)) {
                    if (mask == null) {
                        mask = new boolean[out.length];
                        Arrays.fill(mask, true);
                    }
                    mask[i * by + j] = false;
                }
            }
        }
        return new HeightArray(extent.clone(), out, mask);
    }

    // --- REDUCCIONES (solo sobre muestras válidas) ---

    public double sum() {
        double s = 0;
        for (int k = 0; k < values.length; k++) {
            if (isValid(k)) s += values[k];
        }
        return s;
    }

    public long count() {
        if (valid == null) return values.length;
        long c = 0;
        for (boolean v : valid) {
            if (v) c++;
        }
        return c;
    }

    public double mean() {
        return sum() / count();
    }

    public double min() {
        double m = Double.POSITIVE_INFINITY;
        for (int k = 0; k < values.length; k++) {
            if (isValid(k) && values[k] < m) m = values[k];
        }
        return m;
    }

    public double max() {
        double m = Double.NEGATIVE_INFINITY;
        for (int k = 0; k < values.length; k++) {
            if (isValid(k) && values[k] > m) m = values[k];
        }
        return m;
    }

    /**
     * Media de los cuadrados de las muestras válidas.
     */
    public double meanSquare() {
        double s = 0;
        for (int k = 0; k < values.length; k++) {
            if (isValid(k)) s += values[k] * values[k];
        }
        return s / count();
    }

    /**
     * Suma de las muestras válidas de cada columna (a lo largo del eje 0), colocada a partir de {@code offset}
     * en un vector de longitud {@code length}. Con el desplazamiento del subdominio, los vectores de todos los
     * procesos se pueden sumar directamente en una reducción.
     */
    public double[] columnSums(int offset, int length) {
        return accumulateColumns(offset, length, false);
    }

    /**
     * Número de muestras válidas de cada columna, con la misma colocación que {@link #columnSums(int, int)}.
     */
    public double[] columnCounts(int offset, int length) {
        return accumulateColumns(offset, length, true);
    }

    private double[] accumulateColumns(int offset, int length, boolean count) {
        int nx = nx();
        int ny = ny();
        if (offset < 0 || offset + ny > length) {
            throw new IllegalArgumentException(String.format(
                    "Las %d columnas desde %d no caben en un vector de %d.", ny, offset, length));
        }
        double[] out = new double[length];
        for (int i = 0; i < nx; i++) {
            for (int j = 0; j < ny; j++) {
                int k = i * ny + j;
                if (isValid(k)) {
                    out[offset + j] += count ? 1 : values[k];
                }
            }
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HeightArray other)) return false;
        return Arrays.equals(shape, other.shape)
                && Arrays.equals(validMask(), other.validMask())
                && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(shape) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "HeightArray" + Tuples.format(shape) + (hasUndefinedData() ? " (con datos indefinidos)" : "");
    }
}
