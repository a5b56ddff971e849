package surfacetopography.io;

import lombok.extern.slf4j.Slf4j;
import surfacetopography.utils.Tuples;

/**
 * Decide qué tamaño físico usar cuando lo indican tanto el llamador como los metadatos del fichero.
 * <p>
 * El valor del llamador siempre prevalece. Si difiere del de los metadatos más allá de la tolerancia
 * relativa, se emite un aviso y se continúa. Si no hay ninguno de los dos, es un error de entrada.
 */
@Slf4j
public class PhysicalSizeResolver {

    private final double tolerance;

    public PhysicalSizeResolver(double tolerance) {
        if (tolerance < 0) {
            throw new IllegalArgumentException("La tolerancia no puede ser negativa.");
        }
        this.tolerance = tolerance;
    }

    public double[] resolve(double[] fromCaller, double[] fromMetadata) {
        if (fromCaller == null) {
            if (fromMetadata == null) {
                throw new IllegalArgumentException(
                        "El fichero no indica el tamaño físico y el llamador tampoco lo ha proporcionado.");
            }
            return fromMetadata.clone();
        }
        if (fromMetadata != null && differs(fromCaller, fromMetadata)) {
            log.warn("El fichero declara un tamaño físico distinto del indicado por el llamador; "
                            + "se ignora el del fichero. Indicado: {}; fichero: {}",
                    Tuples.format(fromCaller), Tuples.format(fromMetadata));
        }
        return fromCaller.clone();
    }

    private boolean differs(double[] a, double[] b) {
        if (a.length != b.length) {
            return true;
        }
        for (int k = 0; k < a.length; k++) {
            double scale = Math.max(Math.abs(a[k]), Math.abs(b[k]));
            if (Math.abs(a[k] - b[k]) > tolerance * scale) {
                return true;
            }
        }
        return false;
    }
}
