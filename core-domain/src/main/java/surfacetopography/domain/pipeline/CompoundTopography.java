package surfacetopography.domain.pipeline;

import surfacetopography.domain.state.CompoundState;
import surfacetopography.domain.state.TopographyState;
import surfacetopography.domain.topography.HeightArray;
import surfacetopography.domain.topography.HeightContainer;
import surfacetopography.utils.Tuples;

import java.util.Arrays;
import java.util.Objects;

/**
 * Suma de dos topografías.
 * <p>
 * La dimensión, la resolución y el tamaño físico de ambas deben coincidir exactamente; si solo una
 * de ellas define el atributo, se adopta su valor. Es periódica solo si ambas lo son, y tiene datos
 * indefinidos si cualquiera de las dos los tiene. Los setters se reenvían a las dos.
 */
public class CompoundTopography extends DecoratedTopography {

    private final HeightContainer second;

    public CompoundTopography(HeightContainer first, HeightContainer second) {
        super(first, null);
        this.second = Objects.requireNonNull(second, "La segunda topografía no puede ser nula.");
        combinedValue(first.dim(), second.dim(), "dim");
        combinedValue(first.nbGridPts(), second.nbGridPts(), "nb_grid_pts");
        combinedValue(first.physicalSizes(), second.physicalSizes(), "physical_sizes");
    }

    public HeightContainer getFirst() {
        return parent;
    }

    public HeightContainer getSecond() {
        return second;
    }

    @Override
    public void setPhysicalSizes(double... physicalSizes) {
        parent.setPhysicalSizes(physicalSizes);
        second.setPhysicalSizes(physicalSizes);
    }

    @Override
    public boolean isPeriodic() {
        return parent.isPeriodic() && second.isPeriodic();
    }

    @Override
    public void setPeriodic(boolean periodic) {
        parent.setPeriodic(periodic);
        second.setPeriodic(periodic);
    }

    @Override
    public boolean hasUndefinedData() {
        // Ambas reducciones se ejecutan siempre para mantener el orden colectivo
        boolean first = parent.hasUndefinedData();
        boolean other = second.hasUndefinedData();
        return first || other;
    }

    @Override
    public HeightArray heights() {
        return parent.heights().plus(second.heights());
    }

    @Override
    public TopographyState exportState() {
        return new CompoundState(parent.exportState(), second.exportState());
    }

    static Integer combinedValue(Integer a, Integer b, String name) {
        if (a == null) return b;
        if (b != null && !a.equals(b)) {
            throw new IllegalArgumentException(String.format("%s incompatible: %d <-> %d", name, a, b));
        }
        return a;
    }

    static int[] combinedValue(int[] a, int[] b, String name) {
        if (a == null) return b;
        if (b != null && !Arrays.equals(a, b)) {
            throw new IllegalArgumentException(String.format(
                    "%s incompatible: %s <-> %s", name, Tuples.format(a), Tuples.format(b)));
        }
        return a;
    }

    static double[] combinedValue(double[] a, double[] b, String name) {
        if (a == null) return b;
        if (b != null && !Arrays.equals(a, b)) {
            throw new IllegalArgumentException(String.format(
                    "%s incompatible: %s <-> %s", name, Tuples.format(a), Tuples.format(b)));
        }
        return a;
    }
}
