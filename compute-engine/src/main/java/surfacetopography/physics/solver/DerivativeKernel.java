package surfacetopography.physics.solver;

import surfacetopography.domain.topography.HeightArray;
import surfacetopography.domain.topography.HeightContainer;

import java.util.List;

public interface DerivativeKernel extends SolverComponent {
    /**
     * Calcula la derivada de orden {@code n} por diferencias finitas.
     *
     * @param topography  Entidad a derivar.
     * @param n           Orden (1 o 2).
     * @param periodic    Si no es null, sustituye a la periodicidad de la entidad.
     * @param scaleFactor Separación del stencil en píxeles.
     * @return Una componente por eje, cada una recortada solo a lo largo de su eje de diferenciación.
     */
    List<HeightArray> derivative(HeightContainer topography, int n, Boolean periodic, int scaleFactor);

    static void checkOrder(int n) {
        if (n != 1 && n != 2) {
            throw new IllegalArgumentException(
                    "unsupported derivative order " + n + ": solo se admiten derivadas primera y segunda.");
        }
    }
}
