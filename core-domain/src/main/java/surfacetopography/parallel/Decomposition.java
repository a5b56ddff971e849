package surfacetopography.parallel;

import surfacetopography.utils.Tuples;

import java.util.Arrays;
import java.util.Objects;

/**
 * Descriptor del subdominio rectangular que gestiona un proceso dentro de la malla global.
 *
 * @param nbGridPts           Número de puntos de la malla global por eje.
 * @param subdomainLocations  Origen del subdominio local en índices globales.
 * @param nbSubdomainGridPts  Número de puntos del subdominio local por eje.
 */
public record Decomposition(int[] nbGridPts, int[] subdomainLocations, int[] nbSubdomainGridPts) {

    public Decomposition {
        Objects.requireNonNull(nbGridPts, "nbGridPts no puede ser nulo.");
        Objects.requireNonNull(subdomainLocations, "subdomainLocations no puede ser nulo.");
        Objects.requireNonNull(nbSubdomainGridPts, "nbSubdomainGridPts no puede ser nulo.");
        if (nbGridPts.length != subdomainLocations.length || nbGridPts.length != nbSubdomainGridPts.length) {
            throw new IllegalStateException(String.format(
                    "Descomposición malformada: rangos distintos en %s, %s y %s.",
                    Tuples.format(nbGridPts), Tuples.format(subdomainLocations), Tuples.format(nbSubdomainGridPts)));
        }
        for (int a = 0; a < nbGridPts.length; a++) {
            if (subdomainLocations[a] < 0 || nbSubdomainGridPts[a] < 0
                    || subdomainLocations[a] + nbSubdomainGridPts[a] > nbGridPts[a]) {
                throw new IllegalStateException(String.format(
                        "Descomposición malformada: el subdominio %s + %s excede la malla global %s.",
                        Tuples.format(subdomainLocations), Tuples.format(nbSubdomainGridPts), Tuples.format(nbGridPts)));
            }
        }
        nbGridPts = nbGridPts.clone();
        subdomainLocations = subdomainLocations.clone();
        nbSubdomainGridPts = nbSubdomainGridPts.clone();
    }

    /**
     * Descomposición trivial: un único subdominio que cubre toda la malla.
     */
    public static Decomposition serial(int... nbGridPts) {
        return new Decomposition(nbGridPts, new int[nbGridPts.length], nbGridPts);
    }

    @Override
    public int[] nbGridPts() {
        return nbGridPts.clone();
    }

    @Override
    public int[] subdomainLocations() {
        return subdomainLocations.clone();
    }

    @Override
    public int[] nbSubdomainGridPts() {
        return nbSubdomainGridPts.clone();
    }

    public int dim() {
        return nbGridPts.length;
    }

    /**
     * @return true si el subdominio local no cubre la malla global completa.
     */
    public boolean isDecomposed() {
        return !Arrays.equals(nbGridPts, nbSubdomainGridPts);
    }

    public long nbSubdomainPoints() {
        long n = 1;
        for (int v : nbSubdomainGridPts) n *= v;
        return n;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Decomposition other)) return false;
        return Arrays.equals(nbGridPts, other.nbGridPts)
                && Arrays.equals(subdomainLocations, other.subdomainLocations)
                && Arrays.equals(nbSubdomainGridPts, other.nbSubdomainGridPts);
    }

    @Override
    public int hashCode() {
        int h = Arrays.hashCode(nbGridPts);
        h = 31 * h + Arrays.hashCode(subdomainLocations);
        return 31 * h + Arrays.hashCode(nbSubdomainGridPts);
    }

    @Override
    public String toString() {
        return "Decomposition[global=" + Tuples.format(nbGridPts)
                + ", location=" + Tuples.format(subdomainLocations)
                + ", local=" + Tuples.format(nbSubdomainGridPts) + "]";
    }
}
