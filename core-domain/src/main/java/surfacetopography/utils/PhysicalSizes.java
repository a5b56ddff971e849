package surfacetopography.utils;

/**
 * Validación de tamaños físicos: uno por eje, finito y estrictamente positivo.
 */
public final class PhysicalSizes {

    private PhysicalSizes() {}

    /**
     * @return Copia validada de los tamaños.
     * @throws IllegalArgumentException si el número de ejes no coincide o algún tamaño no es positivo.
     */
    public static double[] validate(int dim, double... sizes) {
        if (sizes == null) {
            throw new IllegalArgumentException("El tamaño físico no puede ser nulo.");
        }
        if (sizes.length != dim) {
            throw new IllegalArgumentException(String.format(
                    "Se esperaban %d tamaños físicos, recibidos %s.", dim, Tuples.format(sizes)));
        }
        for (double s : sizes) {
            if (!Double.isFinite(s) || s <= 0) {
                throw new IllegalArgumentException(
                        "El tamaño físico debe ser positivo, recibido " + Tuples.format(sizes) + ".");
            }
        }
        return sizes.clone();
    }
}
