/**
 * Metrics SPI for the ledger and the streaming orchestrator.
 *
 * <p>No-op implementation lives in {@code noop}; a Micrometer backend is provided by
 * the {@code ingestion-adapter-micrometer} module.</p>
 *
 * @since 1.0.0
 * @author Ingestion Team
 */
package com.medkg.ingestion.core.metrics;
