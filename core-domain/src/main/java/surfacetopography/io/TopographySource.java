package surfacetopography.io;

import java.util.List;

/**
 * Contrato de un lector de topografías. El análisis del formato queda fuera del núcleo:
 * el lector solo describe sus canales y entrega los datos en bruto de uno de ellos.
 */
public interface TopographySource extends AutoCloseable {

    List<ChannelInfo> channels();

    /**
     * Lee los datos del canal indicado.
     *
     * @throws IllegalArgumentException si el índice no corresponde a ningún canal.
     */
    RawTopography read(int channelIndex);

    default int defaultChannelIndex() {
        return 0;
    }

    default ChannelInfo defaultChannel() {
        return channels().get(defaultChannelIndex());
    }

    @Override
    default void close() {
    }
}
