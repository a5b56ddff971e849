package surfacetopography.registry;

/**
 * SPI para módulos que aportan operaciones al registro sin que las entidades los conozcan.
 * <p>
 * Las implementaciones se declaran en {@code META-INF/services/surfacetopography.registry.OperationProvider}
 * y se descubren con {@link java.util.ServiceLoader} la primera vez que se usa el registro.
 */
public interface OperationProvider {

    /**
     * Nombre corto del proveedor, usado en logs.
     */
    String getName();

    void register(OperationRegistry registry);
}
