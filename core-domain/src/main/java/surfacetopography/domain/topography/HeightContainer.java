package surfacetopography.domain.topography;

import surfacetopography.domain.state.TopographyState;
import surfacetopography.parallel.Reduction;
import surfacetopography.parallel.SerialReduction;
import surfacetopography.registry.Operation;
import surfacetopography.registry.OperationRegistry;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Contrato de capacidades que cumple toda representación de un campo de alturas,
 * tanto las entidades base como las decoradas.
 * <p>
 * La parte obligatoria es de solo lectura (dimensión, tamaño, resolución, posiciones, alturas).
 * Las únicas propiedades mutables son el tamaño físico y la periodicidad; al reasignarlas a
 * través de un decorador, el cambio se propaga hacia la entidad base y lo observan todos los
 * que la referencian.
 * <p>
 * Los métodos por defecto del final ({@link #mean()}, {@link #detrend(String)}, {@link #derivative(int)}...)
 * no contienen lógica propia: delegan en el {@link OperationRegistry}, que resuelve la implementación
 * según el tipo de entidad. Si ningún módulo la ha registrado, la llamada falla con
 * {@link UnsupportedOperationException}.
 */
public interface HeightContainer {

    // --- CONTRATO OBLIGATORIO ---

    int dim();

    double[] physicalSizes();

    void setPhysicalSizes(double... physicalSizes);

    /**
     * Resolución global (número de puntos de la malla completa por eje).
     */
    int[] nbGridPts();

    boolean isPeriodic();

    void setPeriodic(boolean periodic);

    boolean isUniform();

    boolean hasUndefinedData();

    /**
     * Posiciones de las muestras locales, una componente por eje con la forma del buffer de alturas.
     */
    List<HeightArray> positions();

    HeightArray heights();

    Map<String, Object> info();

    TopographyKind kind();

    TopographyState exportState();

    /**
     * Materializa la cadena de decoradores en una entidad base independiente que posee su buffer.
     */
    HeightContainer squeeze();

    // --- DESCOMPOSICIÓN DE DOMINIO ---

    default int[] nbSubdomainGridPts() {
        return nbGridPts();
    }

    default int[] subdomainLocations() {
        return new int[dim()];
    }

    default boolean isDomainDecomposed() {
        return !Arrays.equals(nbGridPts(), nbSubdomainGridPts());
    }

    /**
     * Colaborador de reducciones colectivas. Las ejecuciones serie usan {@link SerialReduction}.
     */
    default Reduction reduction() {
        return SerialReduction.INSTANCE;
    }

    // --- DERIVADOS ---

    default double[] pixelSize() {
        double[] sizes = physicalSizes();
        int[] n = nbGridPts();
        double[] pixel = new double[sizes.length];
        for (int a = 0; a < sizes.length; a++) {
            pixel[a] = sizes[a] / n[a];
        }
        return pixel;
    }

    default double areaPerPt() {
        double area = 1;
        for (double p : pixelSize()) {
            area *= p;
        }
        return area;
    }

    default PositionsAndHeights positionsAndHeights() {
        return new PositionsAndHeights(positions(), heights());
    }

    // --- DESPACHO A TRAVÉS DEL REGISTRO ---

    default Object call(Operation operation, Object... args) {
        return OperationRegistry.getInstance().dispatch(this, operation, args);
    }

    default Object callCustom(String name, Object... args) {
        return OperationRegistry.getInstance().dispatchCustom(this, name, args);
    }

    default double mean() {
        return (Double) call(Operation.MEAN);
    }

    default double min() {
        return (Double) call(Operation.MIN);
    }

    default double max() {
        return (Double) call(Operation.MAX);
    }

    default HeightContainer scale(double scaleFactor) {
        return (HeightContainer) call(Operation.SCALE, scaleFactor);
    }

    /**
     * Elimina la tendencia con el modo por defecto de la configuración activa.
     */
    default HeightContainer detrend() {
        return (HeightContainer) call(Operation.DETREND);
    }

    default HeightContainer detrend(String detrendMode) {
        return (HeightContainer) call(Operation.DETREND, detrendMode);
    }

    default HeightContainer transpose() {
        return (HeightContainer) call(Operation.TRANSPOSE);
    }

    default HeightContainer translate(int... offset) {
        return (HeightContainer) call(Operation.TRANSLATE, offset);
    }

    default HeightContainer toUniform(int nbPoints, int padding) {
        return (HeightContainer) call(Operation.TO_UNIFORM, nbPoints, padding);
    }

    default HeightContainer toNonuniform() {
        return (HeightContainer) call(Operation.TO_NONUNIFORM);
    }

    /**
     * Derivada de orden n, una componente por eje.
     */
    default List<HeightArray> derivative(int n) {
        return derivative(n, null, 1);
    }

    /**
     * @param periodic Si no es null, sustituye a la periodicidad de la entidad.
     */
    default List<HeightArray> derivative(int n, Boolean periodic) {
        return derivative(n, periodic, 1);
    }

    /**
     * @param periodic    Si no es null, sustituye a la periodicidad de la entidad.
     * @param scaleFactor Separación del stencil en píxeles (solo mallas uniformes).
     */
    @SuppressWarnings("unchecked")
    default List<HeightArray> derivative(int n, Boolean periodic, int scaleFactor) {
        return (List<HeightArray>) call(Operation.DERIVATIVE, n, periodic, scaleFactor);
    }

    default double rmsHeight() {
        return (Double) call(Operation.RMS_HEIGHT);
    }

    default double rmsHeight(String kind) {
        return (Double) call(Operation.RMS_HEIGHT, kind);
    }

    default double rmsSlope() {
        return (Double) call(Operation.RMS_SLOPE);
    }

    default double rmsLaplacian() {
        return (Double) call(Operation.RMS_LAPLACIAN);
    }

    default double rmsCurvature() {
        return (Double) call(Operation.RMS_CURVATURE);
    }
}
