package com.medkg.ingestion.core.spi;

import java.util.Map;

/**
 * HTTP client shared by the adapters of one pipeline run.
 *
 * <p>The orchestrator opens one transport per run and closes it on every exit path.</p>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public interface HttpTransport extends AutoCloseable {

    /**
     * Performs a GET request and returns the body as text.
     *
     * @param url the request URL
     * @param query query parameters (may be empty)
     * @return the response body
     */
    String getText(String url, Map<String, String> query);

    /**
     * Performs a GET request and parses the body as a JSON object.
     *
     * @param url the request URL
     * @param query query parameters (may be empty)
     * @return the parsed body
     */
    Map<String, Object> getJson(String url, Map<String, String> query);

    /**
     * Binds (or unbinds with {@code null}) a listener notified before each retry.
     */
    default void bindRetryListener(RetryListener listener) {
    }

    @Override
    void close();

    /**
     * Receives transport retry notifications.
     */
    @FunctionalInterface
    interface RetryListener {

        /**
         * @param attempt the retry number, starting at 1
         * @param error the error of the previous attempt
         * @param statusCode the HTTP status of the previous attempt, or null if none was received
         */
        void onRetry(int attempt, String error, Integer statusCode);
    }
}
