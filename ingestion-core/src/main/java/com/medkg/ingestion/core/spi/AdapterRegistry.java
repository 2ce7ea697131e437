package com.medkg.ingestion.core.spi;

import java.util.Set;

/**
 * Lookup of adapters by source name.
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public interface AdapterRegistry {

    /**
     * Creates a new adapter for the source.
     *
     * @param source the source name
     * @param context the adapter context
     * @param transport the HTTP transport the adapter should use
     * @return a new adapter instance
     * @throws IllegalArgumentException if the source is unknown
     */
    Adapter getAdapter(String source, AdapterContext context, HttpTransport transport);

    /**
     * Returns the registered source names.
     */
    Set<String> availableSources();

    /**
     * Reports whether the source is registered.
     */
    default boolean supports(String source) {
        return source != null && availableSources().contains(source);
    }
}
