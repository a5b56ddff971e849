package surfacetopography.io;

import lombok.Builder;
import surfacetopography.utils.Metadata;

import java.util.Map;

/**
 * Descripción de un canal de datos de un fichero, obtenida sin leer las alturas.
 * Los campos que el fichero no declara son null.
 *
 * @param index Índice del canal en el fichero, empezando en 0.
 * @param name  Nombre del canal; si falta se usa {@code "channel <index>"}.
 */
@Builder
public record ChannelInfo(
        int index,
        String name,
        Integer dim,
        int[] nbGridPts,
        double[] physicalSizes,
        Boolean periodic,
        Map<String, Object> info
) {

    public ChannelInfo {
        if (index < 0) {
            throw new IllegalArgumentException("El índice de canal no puede ser negativo.");
        }
        name = name == null ? "channel " + index : name;
        nbGridPts = nbGridPts == null ? null : nbGridPts.clone();
        physicalSizes = physicalSizes == null ? null : physicalSizes.clone();
        info = Metadata.copyOf(info);
    }

    /**
     * @return Tamaño físico dividido por la resolución, o null si falta alguno de los dos.
     */
    public double[] pixelSize() {
        if (physicalSizes == null || nbGridPts == null) {
            return null;
        }
        double[] pixel = new double[physicalSizes.length];
        for (int a = 0; a < pixel.length; a++) {
            pixel[a] = physicalSizes[a] / nbGridPts[a];
        }
        return pixel;
    }

    /**
     * @return Producto de los tamaños de píxel, o null si no se conoce el tamaño de píxel.
     */
    public Double areaPerPt() {
        double[] pixel = pixelSize();
        if (pixel == null) {
            return null;
        }
        double area = 1;
        for (double p : pixel) {
            area *= p;
        }
        return area;
    }
}
