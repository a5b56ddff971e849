package surfacetopography.io;

import lombok.Builder;
import surfacetopography.parallel.Reduction;

import java.util.Map;

/**
 * Valores con los que el llamador sustituye o completa lo que declara el fichero.
 *
 * @param physicalSizes      Tamaño físico; prevalece sobre el de los metadatos (con aviso si difieren).
 * @param heightScaleFactor  Sustituye al factor de escala del fichero.
 * @param periodic           Sustituye a la periodicidad del fichero si no es null.
 * @param info               Entradas añadidas a los metadatos del fichero.
 * @param subdomainLocations Origen del subdominio local (ejecuciones paralelas).
 * @param nbSubdomainGridPts Resolución del subdominio local (ejecuciones paralelas).
 * @param reduction          Colaborador de reducción del grupo (null en serie).
 */
@Builder
public record IngestOptions(
        double[] physicalSizes,
        Double heightScaleFactor,
        Boolean periodic,
        Map<String, Object> info,
        int[] subdomainLocations,
        int[] nbSubdomainGridPts,
        Reduction reduction
) {

    public static IngestOptions defaults() {
        return IngestOptions.builder().build();
    }
}
