/**
 * HTTP transport handed to adapters by the streaming runner.
 *
 * <p>{@link com.medkg.ingestion.adapter.runner.transport.JdkHttpTransport} wraps the JDK
 * HTTP client with retry and backoff and reports each retry to the bound
 * {@link com.medkg.ingestion.core.spi.HttpTransport.RetryListener}.</p>
 */
package com.medkg.ingestion.adapter.runner.transport;
