package surfacetopography.domain.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import surfacetopography.domain.topography.HeightContainer;

import java.io.UncheckedIOException;

/**
 * Traslada estados exportados a JSON (texto o árbol) y de vuelta.
 * <p>
 * No define ningún formato de fichero: el llamador decide dónde guarda o envía el resultado.
 * La identidad del tipo viaja en la propiedad {@code "type"} de cada nivel de la cadena.
 */
@Slf4j
public class TopographyStateCodec {

    // Costoso de crear y thread-safe: se comparte
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.findAndRegisterModules();
        return mapper;
    }

    public String toJson(HeightContainer topography) {
        return toJson(topography.exportState());
    }

    public String toJson(TopographyState state) {
        try {
            String json = objectMapper.writeValueAsString(state);
            log.debug("Estado {} serializado ({} caracteres).", state.getClass().getSimpleName(), json.length());
            return json;
        } catch (JsonProcessingException e) {
            log.error("Error al serializar el estado {}", state.getClass().getSimpleName(), e);
            throw new UncheckedIOException(e);
        }
    }

    public TopographyState fromJson(String json) {
        try {
            return objectMapper.readValue(json, TopographyState.class);
        } catch (JsonProcessingException e) {
            log.error("Error al leer un estado de topografía desde JSON", e);
            throw new UncheckedIOException(e);
        }
    }

    public JsonNode toTree(TopographyState state) {
        return objectMapper.valueToTree(state);
    }

    public TopographyState fromTree(JsonNode tree) {
        try {
            return objectMapper.treeToValue(tree, TopographyState.class);
        } catch (JsonProcessingException e) {
            log.error("Error al convertir un árbol JSON en estado de topografía", e);
            throw new UncheckedIOException(e);
        }
    }
}
