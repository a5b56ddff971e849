package surfacetopography.parallel;

import lombok.extern.slf4j.Slf4j;
import surfacetopography.utils.Tuples;

import java.util.Arrays;
import java.util.Collection;

/**
 * Comprueba el invariante de partición: el conjunto de subdominios cubre la malla global
 * exactamente una vez, sin solapes ni huecos.
 * <p>
 * Una violación indica un error de programación en el reparto, no una entrada incorrecta,
 * por lo que se señaliza con {@link IllegalStateException}.
 */
@Slf4j
public final class DecompositionValidator {

    private DecompositionValidator() {}

    public static void validatePartition(int[] nbGridPts, Collection<Decomposition> subdomains) {
        int nx = nbGridPts[0];
        int ny = nbGridPts.length == 2 ? nbGridPts[1] : 1;
        int[] coverage = new int[nx * ny];

        for (Decomposition d : subdomains) {
            if (!Arrays.equals(d.nbGridPts(), nbGridPts)) {
                fail(String.format("El subdominio %s declara una malla global distinta de %s.", d, Tuples.format(nbGridPts)));
            }
            int[] loc = d.subdomainLocations();
            int[] ext = d.nbSubdomainGridPts();
            int lx = loc[0];
            int ly = loc.length == 2 ? loc[1] : 0;
            int ex = ext[0];
            int ey = ext.length == 2 ? ext[1] : 1;
            for (int i = lx; i < lx + ex; i++) {
                for (int j = ly; j < ly + ey; j++) {
                    if (++coverage[i * ny + j] > 1) {
                        fail(String.format("El punto (%d, %d) está cubierto por más de un subdominio.", i, j));
                    }
                }
            }
        }

        for (int k = 0; k < coverage.length; k++) {
            if (coverage[k] == 0) {
                fail(String.format("El punto (%d, %d) no pertenece a ningún subdominio.", k / ny, k % ny));
            }
        }
        log.debug("Partición válida de {} en {} subdominios.", Tuples.format(nbGridPts), subdomains.size());
    }

    private static void fail(String message) {
        log.error("Descomposición inválida: {}", message);
        throw new IllegalStateException(message);
    }
}
