package surfacetopography.domain.topography;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import surfacetopography.domain.state.StateBuffers;
import surfacetopography.domain.state.TopographyMapState;
import surfacetopography.domain.state.TopographyState;
import surfacetopography.parallel.Decomposition;
import surfacetopography.parallel.DecompositionMode;
import surfacetopography.parallel.Reduction;
import surfacetopography.parallel.SerialReduction;
import surfacetopography.utils.Metadata;
import surfacetopography.utils.PhysicalSizes;
import surfacetopography.utils.Tuples;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Mapa de alturas sobre una malla uniforme bidimensional.
 * <p>
 * En ejecuciones paralelas cada proceso guarda solo su subdominio. El constructor admite tres casos:
 * <ol>
 *     <li><b>Serie</b> (grupo de reducción de tamaño 1): el buffer es la malla completa. Si se indican
 *     {@code nbGridPts}, {@code subdomainLocations} o {@code nbSubdomainGridPts}, deben ser triviales.</li>
 *     <li><b>{@link DecompositionMode#SUBDOMAIN}</b>: el buffer contiene solo los datos locales;
 *     {@code nbGridPts} y {@code subdomainLocations} son obligatorios.</li>
 *     <li><b>{@link DecompositionMode#DOMAIN}</b>: el buffer contiene la malla global y se recorta el bloque
 *     local; {@code subdomainLocations} y {@code nbSubdomainGridPts} son obligatorios.</li>
 * </ol>
 * Con más de un proceso, el modo {@link DecompositionMode#SERIAL} es un error.
 */
@Slf4j
public class Topography implements HeightContainer {

    private final HeightArray heights;
    private final int[] nbGridPts;
    private final int[] subdomainLocations;
    private final Reduction reduction;
    private final Map<String, Object> info;
    private double[] physicalSizes;
    private boolean periodic;

    @Builder
    public Topography(HeightArray heights, double[] physicalSizes, boolean periodic,
                      DecompositionMode decomposition, int[] nbGridPts, int[] subdomainLocations,
                      int[] nbSubdomainGridPts, Reduction reduction, Map<String, ?> info) {
        Objects.requireNonNull(heights, "El array de alturas no puede ser nulo.");
        if (heights.dim() != 2) {
            throw new IllegalArgumentException("El array de alturas debe ser bidimensional.");
        }
        this.reduction = reduction == null ? SerialReduction.INSTANCE : reduction;
        DecompositionMode mode = decomposition == null ? DecompositionMode.SERIAL : decomposition;
        int[] shape = heights.shape();

        if (this.reduction.size() == 1) {
            if (nbGridPts != null && !Arrays.equals(nbGridPts, shape)) {
                throw new IllegalArgumentException(String.format(
                        "Ejecución en serie, pero nbGridPts %s no coincide con la forma de las alturas %s.",
                        Tuples.format(nbGridPts), Tuples.format(shape)));
            }
            if (subdomainLocations != null && !Arrays.equals(subdomainLocations, new int[]{0, 0})) {
                throw new IllegalArgumentException(String.format(
                        "Ejecución en serie, pero subdomainLocations %s no es el origen.",
                        Tuples.format(subdomainLocations)));
            }
            if (nbSubdomainGridPts != null && !Arrays.equals(nbSubdomainGridPts, shape)) {
                throw new IllegalArgumentException(String.format(
                        "Ejecución en serie, pero nbSubdomainGridPts %s no coincide con la forma de las alturas %s.",
                        Tuples.format(nbSubdomainGridPts), Tuples.format(shape)));
            }
            this.nbGridPts = shape;
            this.subdomainLocations = new int[]{0, 0};
            this.heights = heights;
        } else {
            switch (mode) {
                case SUBDOMAIN -> {
                    if (nbGridPts == null) {
                        throw new IllegalArgumentException(
                                "Ejecución paralela con descomposición SUBDOMAIN: indique nbGridPts, no se puede inferir.");
                    }
                    if (subdomainLocations == null) {
                        throw new IllegalArgumentException("Ejecución paralela: indique subdomainLocations.");
                    }
                    if (nbSubdomainGridPts != null && !Arrays.equals(nbSubdomainGridPts, shape)) {
                        throw new IllegalArgumentException(String.format(
                                "Descomposición SUBDOMAIN, pero nbSubdomainGridPts %s no coincide con la forma de las alturas %s.",
                                Tuples.format(nbSubdomainGridPts), Tuples.format(shape)));
                    }
                    Decomposition local = new Decomposition(nbGridPts, subdomainLocations, shape);
                    this.nbGridPts = local.nbGridPts();
                    this.subdomainLocations = local.subdomainLocations();
                    this.heights = heights;
                }
                case DOMAIN -> {
                    if (nbGridPts != null && !Arrays.equals(nbGridPts, shape)) {
                        throw new IllegalArgumentException(String.format(
                                "Descomposición DOMAIN, pero nbGridPts %s no coincide con la forma de las alturas %s.",
                                Tuples.format(nbGridPts), Tuples.format(shape)));
                    }
                    if (subdomainLocations == null) {
                        throw new IllegalArgumentException("Ejecución paralela: indique subdomainLocations.");
                    }
                    if (nbSubdomainGridPts == null) {
                        throw new IllegalArgumentException(
                                "Descomposición DOMAIN: indique nbSubdomainGridPts, no se puede inferir.");
                    }
                    Decomposition local = new Decomposition(shape, subdomainLocations, nbSubdomainGridPts);
                    this.nbGridPts = shape;
                    this.subdomainLocations = local.subdomainLocations();
                    this.heights = heights.block(local.subdomainLocations(), local.nbSubdomainGridPts());
                }
                default -> throw new IllegalArgumentException(
                        "La descomposición es SERIAL, pero el grupo tiene " + this.reduction.size() + " procesos.");
            }
            log.debug("Topografía local del rango {}: origen {}, {} puntos de una malla {}.",
                    this.reduction.rank(), Tuples.format(this.subdomainLocations),
                    Tuples.format(this.heights.shape()), Tuples.format(this.nbGridPts));
        }
        this.physicalSizes = PhysicalSizes.validate(2, physicalSizes);
        this.periodic = periodic;
        this.info = Metadata.copyOf(info);
    }

    public Topography(HeightArray heights, double[] physicalSizes, boolean periodic, Map<String, ?> info) {
        this(heights, physicalSizes, periodic, DecompositionMode.SERIAL, null, null, null, null, info);
    }

    public Topography(double[][] heights, double sx, double sy) {
        this(HeightArray.of(heights), new double[]{sx, sy}, false, null);
    }

    @Override
    public int dim() {
        return 2;
    }

    @Override
    public double[] physicalSizes() {
        return physicalSizes.clone();
    }

    @Override
    public void setPhysicalSizes(double... physicalSizes) {
        this.physicalSizes = PhysicalSizes.validate(2, physicalSizes);
    }

    @Override
    public int[] nbGridPts() {
        return nbGridPts.clone();
    }

    @Override
    public int[] nbSubdomainGridPts() {
        return heights.shape();
    }

    @Override
    public int[] subdomainLocations() {
        return subdomainLocations.clone();
    }

    @Override
    public Reduction reduction() {
        return reduction;
    }

    @Override
    public boolean isPeriodic() {
        return periodic;
    }

    @Override
    public void setPeriodic(boolean periodic) {
        this.periodic = periodic;
    }

    @Override
    public boolean isUniform() {
        return true;
    }

    /**
     * Reducción colectiva: todos los procesos del grupo deben invocarla.
     */
    @Override
    public boolean hasUndefinedData() {
        return reduction.any(heights.hasUndefinedData());
    }

    /**
     * Malla de posiciones con indexado 'ij', desplazada por el origen del subdominio local.
     */
    @Override
    public List<HeightArray> positions() {
        int lnx = heights.nx();
        int lny = heights.ny();
        double px = physicalSizes[0] / nbGridPts[0];
        double py = physicalSizes[1] / nbGridPts[1];
        double[] x = new double[lnx * lny];
        double[] y = new double[lnx * lny];
        for (int i = 0; i < lnx; i++) {
            for (int j = 0; j < lny; j++) {
                x[i * lny + j] = (subdomainLocations[0] + i) * px;
                y[i * lny + j] = (subdomainLocations[1] + j) * py;
            }
        }
        int[] shape = heights.shape();
        return List.of(HeightArray.of(shape, x), HeightArray.of(shape, y));
    }

    @Override
    public HeightArray heights() {
        return heights;
    }

    @Override
    public Map<String, Object> info() {
        return info;
    }

    @Override
    public TopographyKind kind() {
        return TopographyKind.TOPOGRAPHY;
    }

    @Override
    public TopographyState exportState() {
        return new TopographyMapState(heights.shape(), StateBuffers.values(heights), StateBuffers.mask(heights),
                physicalSizes.clone(), periodic, nbGridPts.clone(), subdomainLocations.clone(), info);
    }

    @Override
    public HeightContainer squeeze() {
        return this;
    }

    @Override
    public String toString() {
        return "Topography[nbGridPts=" + Tuples.format(nbGridPts)
                + ", local=" + Tuples.format(heights.shape())
                + ", size=" + Tuples.format(physicalSizes) + ", periodic=" + periodic + "]";
    }
}
