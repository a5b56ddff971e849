package surfacetopography.domain.pipeline;

import surfacetopography.domain.topography.HeightArray;
import surfacetopography.domain.topography.HeightContainer;
import surfacetopography.domain.topography.NonuniformLineScan;
import surfacetopography.domain.topography.Topography;
import surfacetopography.domain.topography.TopographyKind;
import surfacetopography.domain.topography.UniformLineScan;
import surfacetopography.parallel.DecompositionMode;
import surfacetopography.parallel.Reduction;
import surfacetopography.utils.Metadata;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base de los decoradores de la pipeline.
 * <p>
 * Guarda una referencia compartida (no propia) al padre, que puede ser a su vez la raíz de otras cadenas.
 * Nunca lo modifica, salvo para reenviar los setters de tamaño físico y periodicidad, cuyo efecto
 * es visible para todos los que comparten la entidad base. Todo lo que una subclase no sobrescribe
 * se delega en el padre; {@link #heights()} se recalcula en cada llamada.
 */
public abstract class DecoratedTopography implements HeightContainer {

    protected final HeightContainer parent;
    private final Map<String, Object> ownInfo;

    protected DecoratedTopography(HeightContainer parent, Map<String, ?> info) {
        this.parent = Objects.requireNonNull(parent, "La topografía padre no puede ser nula.");
        this.ownInfo = Metadata.copyOf(info);
    }

    public HeightContainer getParent() {
        return parent;
    }

    /**
     * Metadatos añadidos por este decorador (sin los heredados del padre).
     */
    protected Map<String, Object> ownInfo() {
        return ownInfo;
    }

    @Override
    public int dim() {
        return parent.dim();
    }

    @Override
    public double[] physicalSizes() {
        return parent.physicalSizes();
    }

    @Override
    public void setPhysicalSizes(double... physicalSizes) {
        parent.setPhysicalSizes(physicalSizes);
    }

    @Override
    public int[] nbGridPts() {
        return parent.nbGridPts();
    }

    @Override
    public int[] nbSubdomainGridPts() {
        return parent.nbSubdomainGridPts();
    }

    @Override
    public int[] subdomainLocations() {
        return parent.subdomainLocations();
    }

    @Override
    public boolean isDomainDecomposed() {
        return parent.isDomainDecomposed();
    }

    @Override
    public Reduction reduction() {
        return parent.reduction();
    }

    @Override
    public double[] pixelSize() {
        return parent.pixelSize();
    }

    @Override
    public double areaPerPt() {
        return parent.areaPerPt();
    }

    @Override
    public boolean isPeriodic() {
        return parent.isPeriodic();
    }

    @Override
    public void setPeriodic(boolean periodic) {
        parent.setPeriodic(periodic);
    }

    @Override
    public boolean isUniform() {
        return parent.isUniform();
    }

    @Override
    public boolean hasUndefinedData() {
        return parent.hasUndefinedData();
    }

    @Override
    public List<HeightArray> positions() {
        return parent.positions();
    }

    @Override
    public Map<String, Object> info() {
        return Metadata.merge(parent.info(), ownInfo);
    }

    @Override
    public TopographyKind kind() {
        return parent.kind();
    }

    /**
     * Evalúa la cadena y devuelve una entidad base independiente con el buffer materializado.
     * Un mapa 2D repartido entre varios procesos conserva su subdominio.
     */
    @Override
    public HeightContainer squeeze() {
        HeightArray heights = heights();
        Map<String, Object> info = info();
        if (!isUniform()) {
            return new NonuniformLineScan(positions().get(0).toArray(), heights, info);
        }
        if (dim() == 1) {
            return new UniformLineScan(heights, physicalSizes()[0], isPeriodic(), info);
        }
        Topography.TopographyBuilder builder = Topography.builder()
                .heights(heights)
                .physicalSizes(physicalSizes())
                .periodic(isPeriodic())
                .reduction(reduction())
                .info(info);
        if (reduction().size() > 1) {
            builder.decomposition(DecompositionMode.SUBDOMAIN)
                    .nbGridPts(nbGridPts())
                    .subdomainLocations(subdomainLocations());
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + parent + "]";
    }
}
