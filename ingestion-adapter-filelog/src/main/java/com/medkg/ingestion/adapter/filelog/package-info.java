/**
 * File-backed ledger adapter.
 *
 * <p>Persists ledger transitions as one JSON object per line, compacts the log into
 * snapshot files and recovers the document map on startup.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.medkg.ingestion.adapter.filelog.DurableLedgerStore} - Durable, compactable ledger</li>
 *   <li>{@link com.medkg.ingestion.adapter.filelog.LedgerReplayer} - Side-effect-free log replay</li>
 *   <li>{@link com.medkg.ingestion.adapter.filelog.LedgerConfig} - File layout and durability settings</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Ingestion Team
 */
package com.medkg.ingestion.adapter.filelog;
