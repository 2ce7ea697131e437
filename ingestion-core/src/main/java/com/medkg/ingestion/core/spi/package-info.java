/**
 * Service Provider Interfaces (SPI).
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.medkg.ingestion.core.spi.Ledger} - Durable per-document state store</li>
 *   <li>{@link com.medkg.ingestion.core.spi.CompactableLedger} - Ledger with snapshot compaction</li>
 *   <li>{@link com.medkg.ingestion.core.spi.Adapter} - Source-specific document producer</li>
 *   <li>{@link com.medkg.ingestion.core.spi.AdapterRegistry} - Adapter lookup by source</li>
 *   <li>{@link com.medkg.ingestion.core.spi.HttpTransport} - HTTP client shared by adapters</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Ingestion Team
 */
package com.medkg.ingestion.core.spi;
