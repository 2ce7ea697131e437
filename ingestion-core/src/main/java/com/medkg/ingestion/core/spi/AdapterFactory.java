package com.medkg.ingestion.core.spi;

/**
 * Creates an adapter bound to a context and a transport.
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface AdapterFactory {

    Adapter create(AdapterContext context, HttpTransport transport);
}
