package surfacetopography.registry;

import surfacetopography.domain.topography.HeightContainer;

/**
 * Función asociable a una operación del registro. Recibe la entidad sobre la que se invoca
 * y los argumentos posicionales del llamador.
 * <p>
 * Las funciones de análisis devuelven un valor; las de pipeline, una nueva {@link HeightContainer}.
 */
@FunctionalInterface
public interface TopographyFunction {
    Object apply(HeightContainer topography, Object... args);
}
