package surfacetopography.utils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Copias defensivas del diccionario de metadatos ({@code info}) de las topografías.
 * Cada entidad guarda su propia copia inmodificable; nunca comparte el mapa del llamador.
 */
public final class Metadata {

    private Metadata() {}

    public static Map<String, Object> copyOf(Map<String, ?> info) {
        if (info == null || info.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(info));
    }

    /**
     * Combina los metadatos del padre con los propios; los propios prevalecen.
     */
    public static Map<String, Object> merge(Map<String, ?> parent, Map<String, ?> own) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (parent != null) merged.putAll(parent);
        if (own != null) merged.putAll(own);
        return Collections.unmodifiableMap(merged);
    }
}
