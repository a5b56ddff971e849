package surfacetopography.domain.state;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import surfacetopography.domain.topography.HeightContainer;
import surfacetopography.parallel.Reduction;
import surfacetopography.parallel.SerialReduction;

/**
 * Estado exportado de una entidad: identidad del tipo más los argumentos de su constructor,
 * con los estados de los padres anidados. Basta para reconstruir la cadena de decoradores completa.
 * <p>
 * El contrato es independiente del transporte; {@link TopographyStateCodec} lo lleva a JSON.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = UniformLineScanState.class, name = "uniform_line_scan"),
        @JsonSubTypes.Type(value = TopographyMapState.class, name = "topography"),
        @JsonSubTypes.Type(value = NonuniformLineScanState.class, name = "nonuniform_line_scan"),
        @JsonSubTypes.Type(value = ScaledState.class, name = "scaled"),
        @JsonSubTypes.Type(value = DetrendedState.class, name = "detrended"),
        @JsonSubTypes.Type(value = TranslatedState.class, name = "translated"),
        @JsonSubTypes.Type(value = TransposedState.class, name = "transposed"),
        @JsonSubTypes.Type(value = CompoundState.class, name = "compound"),
        @JsonSubTypes.Type(value = InterpolatedLineScanState.class, name = "uniformly_interpolated"),
        @JsonSubTypes.Type(value = MemoizedState.class, name = "memoized")
})
public interface TopographyState {

    /**
     * Reconstruye la entidad. Los mapas 2D descompuestos se vinculan al colaborador de reducción indicado,
     * que debe tener el mismo tamaño de grupo que el que los exportó.
     */
    HeightContainer restore(Reduction reduction);

    default HeightContainer restore() {
        return restore(SerialReduction.INSTANCE);
    }
}
