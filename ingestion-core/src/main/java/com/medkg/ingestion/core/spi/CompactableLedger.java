package com.medkg.ingestion.core.spi;

import java.nio.file.Path;

/**
 * Ledger that can fold its log into a snapshot.
 *
 * <p>After {@link #createSnapshot()} the log contains only transitions made after
 * the snapshot, so startup replays a bounded tail instead of the full history.</p>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public interface CompactableLedger extends Ledger {

    /**
     * Writes a snapshot of all entries and truncates the log.
     *
     * @return the path of the new snapshot file
     * @throws com.medkg.ingestion.core.ledger.LedgerIOException if the snapshot cannot be written
     */
    Path createSnapshot();

    /**
     * Reports whether the configured snapshot interval has elapsed since the last snapshot.
     *
     * @return true if a snapshot should be taken now
     */
    boolean isSnapshotDue();
}
