/**
 * Ledger data model and exceptions.
 *
 * <p>{@link com.medkg.ingestion.core.ledger.LedgerAuditRecord} is the unit persisted to the
 * append-only log; {@link com.medkg.ingestion.core.ledger.DocumentLedgerEntry} is the per-document
 * fold over those records. All ledger failures extend
 * {@link com.medkg.ingestion.core.ledger.LedgerException}.</p>
 *
 * @since 1.0.0
 * @author Ingestion Team
 */
package com.medkg.ingestion.core.ledger;
