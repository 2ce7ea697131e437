/**
 * Micrometer backend for the ingestion metrics SPI.
 *
 * <p>Bind {@link com.medkg.ingestion.adapter.micrometer.MicrometerIngestionMetrics} to any
 * {@code MeterRegistry} and pass it to the ledger store and the streaming runner.</p>
 */
package com.medkg.ingestion.adapter.micrometer;
