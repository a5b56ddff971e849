package surfacetopography.registry;

import lombok.extern.slf4j.Slf4j;
import surfacetopography.config.AnalysisConfig;
import surfacetopography.domain.topography.HeightContainer;
import surfacetopography.domain.topography.TopographyKind;

import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tabla de despacho de operaciones, única para todo el proceso.
 * <p>
 * Asocia cada par (tipo de entidad, {@link Operation}) con la función que la implementa.
 * Las operaciones del núcleo se registran al crear el registro; las de otros módulos se descubren
 * mediante {@link OperationProvider} y {@link ServiceLoader} en el primer acceso. Así, el motor de
 * derivadas o las estadísticas de rugosidad se acoplan a las entidades base sin que éstas los conozcan.
 * <p>
 * Además de la tabla cerrada existe una ranura de operaciones personalizadas, indexada por nombre,
 * para extensiones registradas en tiempo de ejecución.
 * <p>
 * Las escrituras se esperan durante el arranque; las lecturas son concurrentes y sin bloqueo.
 */
@Slf4j
public final class OperationRegistry {

    private final Map<Key, TopographyFunction> table = new ConcurrentHashMap<>();
    private final Map<String, Map<TopographyKind, TopographyFunction>> customOperations = new ConcurrentHashMap<>();
    private volatile AnalysisConfig config = AnalysisConfig.getDefault();
    private volatile boolean providersLoaded;
    // Evita la recursión si un proveedor accede al registro mientras se registra
    private boolean loadingProviders;

    private OperationRegistry() {
        CoreOperations.register(this);
    }

    private static final class Holder {
        private static final OperationRegistry INSTANCE = new OperationRegistry();
    }

    public static OperationRegistry getInstance() {
        OperationRegistry registry = Holder.INSTANCE;
        registry.loadProviders();
        return registry;
    }

    // --- CONFIGURACIÓN ---

    public AnalysisConfig getConfig() {
        return config;
    }

    public void configure(AnalysisConfig config) {
        this.config = Objects.requireNonNull(config, "La configuración no puede ser nula.");
        log.info("Configuración del registro actualizada: {}", config);
    }

    // --- REGISTRO ---

    /**
     * Asocia una función a una operación para los tipos de entidad indicados.
     * Un registro posterior para el mismo par sustituye al anterior.
     */
    public void register(Operation operation, TopographyFunction function, TopographyKind... kinds) {
        Objects.requireNonNull(operation, "La operación no puede ser nula.");
        Objects.requireNonNull(function, "La función no puede ser nula.");
        for (TopographyKind kind : kinds) {
            TopographyFunction previous = table.put(new Key(kind, operation), function);
            if (previous != null) {
                log.debug("Operación '{}' redefinida para {}.", operation.getId(), kind.getLabel());
            } else {
                log.debug("Operación '{}' registrada para {}.", operation.getId(), kind.getLabel());
            }
        }
    }

    public void registerCustom(String name, TopographyFunction function, TopographyKind... kinds) {
        Objects.requireNonNull(name, "El nombre de la operación no puede ser nulo.");
        Objects.requireNonNull(function, "La función no puede ser nula.");
        String key = name.trim();
        if (key.isEmpty()) {
            throw new IllegalArgumentException("El nombre de la operación no puede estar vacío.");
        }
        Map<TopographyKind, TopographyFunction> byKind =
                customOperations.computeIfAbsent(key, k -> new ConcurrentHashMap<>());
        for (TopographyKind kind : kinds) {
            byKind.put(kind, function);
        }
        log.debug("Operación personalizada '{}' registrada para {} tipos de entidad.", key, kinds.length);
    }

    public void unregisterCustom(String name) {
        customOperations.remove(name.trim());
    }

    public boolean isSupported(TopographyKind kind, Operation operation) {
        return table.containsKey(new Key(kind, operation));
    }

    public boolean isCustomSupported(TopographyKind kind, String name) {
        Map<TopographyKind, TopographyFunction> byKind = customOperations.get(name.trim());
        return byKind != null && byKind.containsKey(kind);
    }

    // --- DESPACHO ---

    public Object dispatch(HeightContainer topography, Operation operation, Object... args) {
        TopographyFunction function = table.get(new Key(topography.kind(), operation));
        if (function == null) {
            throw notSupported(operation.getId(), topography);
        }
        return function.apply(topography, args);
    }

    public Object dispatchCustom(HeightContainer topography, String name, Object... args) {
        Map<TopographyKind, TopographyFunction> byKind = customOperations.get(name.trim());
        TopographyFunction function = byKind == null ? null : byKind.get(topography.kind());
        if (function == null) {
            throw notSupported(name, topography);
        }
        return function.apply(topography, args);
    }

    private static UnsupportedOperationException notSupported(String name, HeightContainer topography) {
        return new UnsupportedOperationException(String.format(
                "La operación '%s' no está soportada para %s (%s).",
                name, topography.kind().getLabel(), topography.getClass().getSimpleName()));
    }

    // --- DESCUBRIMIENTO DE PROVEEDORES ---

    private void loadProviders() {
        if (providersLoaded) {
            return;
        }
        synchronized (this) {
            if (providersLoaded || loadingProviders) {
                return;
            }
            loadingProviders = true;
            try {
                for (OperationProvider provider : ServiceLoader.load(OperationProvider.class)) {
                    log.info("Registrando operaciones del proveedor '{}'.", provider.getName());
                    provider.register(this);
                }
                providersLoaded = true;
            } finally {
                loadingProviders = false;
            }
        }
    }

    private record Key(TopographyKind kind, Operation operation) {}
}
