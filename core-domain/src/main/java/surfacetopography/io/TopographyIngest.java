package surfacetopography.io;

import lombok.extern.slf4j.Slf4j;
import surfacetopography.config.AnalysisConfig;
import surfacetopography.domain.topography.HeightContainer;
import surfacetopography.domain.topography.NonuniformLineScan;
import surfacetopography.domain.topography.Topography;
import surfacetopography.domain.topography.UniformLineScan;
import surfacetopography.parallel.DecompositionMode;
import surfacetopography.registry.OperationRegistry;
import surfacetopography.utils.Metadata;

import java.util.Map;

/**
 * Convierte los datos en bruto de un lector en una entidad base.
 * <p>
 * Aplica las sustituciones del llamador (tamaño físico, periodicidad, factor de escala, metadatos).
 * El factor de escala de alturas se aplica como decorador de escala y queda registrado en
 * {@code info} con la clave {@value #HEIGHT_SCALE_FACTOR_KEY}.
 */
@Slf4j
public class TopographyIngest {

    public static final String HEIGHT_SCALE_FACTOR_KEY = "height_scale_factor";

    private final PhysicalSizeResolver sizeResolver;

    public TopographyIngest(AnalysisConfig config) {
        this.sizeResolver = new PhysicalSizeResolver(config.physicalSizeTolerance());
    }

    public TopographyIngest() {
        this(OperationRegistry.getInstance().getConfig());
    }

    public HeightContainer ingest(TopographySource source, int channelIndex, IngestOptions options) {
        log.debug("Leyendo el canal {} de {}", channelIndex, source.getClass().getSimpleName());
        return ingest(source.read(channelIndex), options);
    }

    public HeightContainer ingest(TopographySource source) {
        return ingest(source, source.defaultChannelIndex(), IngestOptions.defaults());
    }

    public HeightContainer ingest(RawTopography raw, IngestOptions options) {
        Double scaleFactor = options.heightScaleFactor() != null ? options.heightScaleFactor() : raw.heightScaleFactor();
        Map<String, Object> info = Metadata.merge(raw.info(), options.info());
        if (scaleFactor != null) {
            info = Metadata.merge(info, Map.of(HEIGHT_SCALE_FACTOR_KEY, scaleFactor));
        }
        boolean periodic = options.periodic() != null ? options.periodic() : raw.periodic();

        HeightContainer topography;
        if (raw.x() != null) {
            if (periodic) {
                throw new IllegalArgumentException("Un line scan no uniforme no puede ser periódico.");
            }
            topography = new NonuniformLineScan(raw.x(), raw.heights(), info);
        } else {
            double[] sizes = sizeResolver.resolve(options.physicalSizes(), raw.physicalSizes());
            topography = switch (raw.dim()) {
                case 1 -> new UniformLineScan(raw.heights(), sizes[0], periodic, info);
                case 2 -> mapTopography(raw, options, sizes, periodic, info);
                default -> throw new IllegalArgumentException("Rango de alturas no soportado: " + raw.dim() + ".");
            };
        }

        if (scaleFactor != null) {
            log.debug("Aplicando factor de escala de alturas {}", scaleFactor);
            return topography.scale(scaleFactor);
        }
        return topography;
    }

    private static Topography mapTopography(RawTopography raw, IngestOptions options, double[] sizes,
                                            boolean periodic, Map<String, Object> info) {
        Topography.TopographyBuilder builder = Topography.builder()
                .heights(raw.heights())
                .physicalSizes(sizes)
                .periodic(periodic)
                .reduction(options.reduction())
                .info(info);
        // El lector entrega siempre la malla completa; cada proceso recorta su bloque
        if (options.subdomainLocations() != null || options.nbSubdomainGridPts() != null) {
            builder.decomposition(DecompositionMode.DOMAIN)
                    .subdomainLocations(options.subdomainLocations())
                    .nbSubdomainGridPts(options.nbSubdomainGridPts());
        }
        return builder.build();
    }
}
