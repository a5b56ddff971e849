package surfacetopography.parallel;

/**
 * Forma en que un lector entrega el buffer de alturas a una {@code Topography}.
 */
public enum DecompositionMode {
    /**
     * Ejecución de un solo proceso. Falla si el grupo de reducción tiene más de un proceso.
     */
    SERIAL,

    /**
     * El buffer contiene la topografía global; cada proceso recorta su subdominio.
     */
    DOMAIN,

    /**
     * El buffer contiene solo el subdominio local; la resolución global debe indicarse.
     */
    SUBDOMAIN
}
