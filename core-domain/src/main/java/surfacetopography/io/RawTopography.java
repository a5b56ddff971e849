package surfacetopography.io;

import lombok.Builder;
import surfacetopography.domain.topography.HeightArray;

import java.util.Map;

/**
 * Datos en bruto que un lector entrega al núcleo.
 *
 * @param heights           Alturas leídas (rango 1 o 2). Las muestras no finitas se consideran indefinidas.
 * @param x                 Posiciones explícitas de un line scan no uniforme, o null si la malla es uniforme.
 * @param physicalSizes     Tamaño físico declarado en los metadatos, o null si el fichero no lo indica.
 * @param periodic          Periodicidad declarada en los metadatos.
 * @param heightScaleFactor Factor que convierte los valores en bruto a alturas, o null si no hay.
 * @param info              Metadatos del fichero.
 */
@Builder
public record RawTopography(
        HeightArray heights,
        double[] x,
        double[] physicalSizes,
        boolean periodic,
        Double heightScaleFactor,
        Map<String, Object> info
) {

    public RawTopography {
        if (heights == null) {
            throw new IllegalArgumentException("El lector no ha proporcionado alturas.");
        }
    }

    public int dim() {
        return heights.dim();
    }
}
