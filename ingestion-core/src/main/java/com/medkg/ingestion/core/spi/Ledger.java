package com.medkg.ingestion.core.spi;

import com.medkg.ingestion.core.ledger.DocumentLedgerEntry;
import com.medkg.ingestion.core.ledger.LedgerAuditRecord;
import com.medkg.ingestion.core.ledger.TransitionContext;
import com.medkg.ingestion.core.statemachine.LedgerState;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable per-document state ledger SPI.
 *
 * <p>The ledger records, for every document, which processing stage it has reached.
 * Every change is validated against the state graph and durably persisted before it
 * becomes visible to readers.</p>
 *
 * <p><strong>Write Path:</strong></p>
 * <pre>
 * 1. validate(current, new)        → InvalidStateTransitionException on violation
 * 2. append audit record + fsync   → durable
 * 3. update in-memory entry        → visible to readers
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: concurrent writers and readers within one process</li>
 *   <li>Atomic visibility: readers never observe a partially applied transition</li>
 *   <li>Unseen documents are implicitly {@link LedgerState#PENDING}</li>
 * </ul>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public interface Ledger {

    /**
     * Moves a document to a new state.
     *
     * @param docId the document ID
     * @param newState the target state
     * @param context adapter, metadata, parameters and error details recorded with the transition
     * @return the persisted audit record
     * @throws IllegalArgumentException if docId is blank or newState is null
     * @throws com.medkg.ingestion.core.ledger.InvalidStateTransitionException if the edge is not allowed
     * @throws com.medkg.ingestion.core.ledger.LedgerIOException if the record cannot be persisted
     */
    LedgerAuditRecord updateState(String docId, LedgerState newState, TransitionContext context);

    /**
     * Moves a document to a new state without additional context.
     *
     * @see #updateState(String, LedgerState, TransitionContext)
     */
    default LedgerAuditRecord updateState(String docId, LedgerState newState) {
        return updateState(docId, newState, TransitionContext.empty());
    }

    /**
     * Legacy string-based write path.
     *
     * <p>Resolves {@code state} through the legacy alias table and delegates to
     * {@link #updateState(String, LedgerState, TransitionContext)}.</p>
     *
     * @param docId the document ID
     * @param state a state label (enum name in any case, or a legacy alias)
     * @param metadata metadata to record
     * @return the persisted audit record
     * @throws IllegalArgumentException if the label cannot be resolved
     * @deprecated use {@link #updateState(String, LedgerState, TransitionContext)}
     */
    @Deprecated
    LedgerAuditRecord record(String docId, String state, Map<String, Object> metadata);

    /**
     * Returns the current entry of a document.
     *
     * @param docId the document ID
     * @return the entry, or empty if the document has never transitioned
     */
    Optional<DocumentLedgerEntry> get(String docId);

    /**
     * Returns the current state of a document.
     *
     * @param docId the document ID
     * @return the state, or empty if the document has never transitioned
     */
    default Optional<LedgerState> getState(String docId) {
        return get(docId).map(DocumentLedgerEntry::state);
    }

    /**
     * Returns an immutable snapshot of all entries.
     */
    Collection<DocumentLedgerEntry> entries();

    /**
     * Returns all entries currently in the given state.
     *
     * @param state the state filter
     * @return matching entries
     */
    List<DocumentLedgerEntry> entries(LedgerState state);

    /**
     * Returns non-terminal documents whose last update is at least {@code threshold} old.
     *
     * @param threshold minimum age of the last update
     * @return stuck entries, oldest first
     */
    List<DocumentLedgerEntry> getStuckDocuments(Duration threshold);

    /**
     * Returns the audit records of a document since the loaded snapshot baseline.
     *
     * @param docId the document ID
     * @return records in write order (empty if none)
     */
    List<LedgerAuditRecord> history(String docId);
}
