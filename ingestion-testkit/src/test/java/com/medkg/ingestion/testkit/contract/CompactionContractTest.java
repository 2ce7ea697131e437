package com.medkg.ingestion.testkit.contract;

import com.medkg.ingestion.adapter.filelog.DurableLedgerStore;
import com.medkg.ingestion.adapter.filelog.LedgerConfig;
import com.medkg.ingestion.adapter.micrometer.MicrometerIngestionMetrics;
import com.medkg.ingestion.adapter.runner.LedgerCompactor;
import com.medkg.ingestion.adapter.runner.LedgerCompactorConfig;
import com.medkg.ingestion.core.ledger.TransitionContext;
import com.medkg.ingestion.core.statemachine.LedgerState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: snapshots compact the log without changing what a restart sees.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>After a snapshot the log is empty and a restart loads from the snapshot</li>
 *   <li>A restart replays only the records written after the snapshot</li>
 *   <li>Retention keeps the newest snapshots, the current one included</li>
 *   <li>Loading from a snapshot is faster than replaying a long history</li>
 *   <li>LedgerCompactor snapshots only when the interval has elapsed</li>
 * </ul>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
class CompactionContractTest extends AbstractContractTest {

    private void seed(int documents) {
        for (int i = 0; i < documents; i++) {
            String docId = "doc-" + i;
            ledger.updateState(docId, LedgerState.FETCHING, TransitionContext.ofAdapter("pmc"));
            ledger.updateState(docId, LedgerState.FETCHED, TransitionContext.ofAdapter("pmc"));
        }
    }

    @Test
    void testSnapshot_EmptiesLog_AndRestartLoadsFromSnapshot() throws IOException {
        // Given
        seed(50);
        assertTrue(Files.size(ledger.config().logPath()) > 0);

        // When
        Path snapshot = ledger.createSnapshot();

        // Then
        assertEquals(0, Files.size(ledger.config().logPath()));
        assertTrue(Files.exists(snapshot));

        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        LedgerConfig config = ledger.config();
        ledger.close();
        ledger = new DurableLedgerStore(config, clock, new MicrometerIngestionMetrics(meters));

        assertEquals(50, ledger.entries(LedgerState.FETCHED).size());
        assertEquals(1, meters.get("ingest.ledger.initialization").tag("method", "snapshot").timer().count());
        assertEquals(50.0, meters.get("ingest.ledger.documents").tag("state", "FETCHED").gauge().value());
    }

    @Test
    void testRestartAfterSnapshot_ReplaysOnlyDelta() {
        // Given
        seed(3);
        ledger.createSnapshot();
        ledger.updateState("doc-0", LedgerState.PARSING);

        // When
        restartLedger();

        // Then: history covers only records since the snapshot baseline
        assertLedgerState("doc-0", LedgerState.PARSING);
        assertLedgerState("doc-1", LedgerState.FETCHED);
        assertEquals(1, ledger.history("doc-0").size());
        assertTrue(ledger.history("doc-1").isEmpty());
    }

    @Test
    void testRetention_KeepsNewestSnapshots() {
        // Given
        ledger.close();
        ledger = openLedger(defaultLedgerConfig().withSnapshotRetention(2));
        seed(1);

        // When
        ledger.createSnapshot();
        clock.advance(Duration.ofMinutes(1));
        ledger.updateState("doc-0", LedgerState.PARSING);
        Path second = ledger.createSnapshot();
        clock.advance(Duration.ofMinutes(1));
        ledger.updateState("doc-0", LedgerState.PARSED);
        Path third = ledger.createSnapshot();

        // Then
        List<Path> names = ledger.snapshots().stream().map(Path::getFileName).toList();
        assertEquals(List.of(second.getFileName(), third.getFileName()), names);

        restartLedger();
        assertLedgerState("doc-0", LedgerState.PARSED);
    }

    @Test
    void testSnapshotLoad_IsFasterThanFullReplay() {
        // Given: 400 documents driven through nine states each
        List<LedgerState> path = List.of(LedgerState.FETCHING, LedgerState.FETCHED, LedgerState.PARSING,
                LedgerState.PARSED, LedgerState.VALIDATING, LedgerState.VALIDATED, LedgerState.IR_BUILDING,
                LedgerState.IR_READY, LedgerState.COMPLETED);
        for (int i = 0; i < 400; i++) {
            for (LedgerState state : path) {
                ledger.updateState("doc-" + i, state);
            }
        }
        LedgerConfig config = ledger.config();
        ledger.close();

        // When: warm up, then time a full replay
        openLedger(config).close();
        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        ledger = new DurableLedgerStore(config, clock, new MicrometerIngestionMetrics(meters));
        ledger.createSnapshot();
        ledger.close();

        // When: warm up, then time a snapshot load
        openLedger(config).close();
        ledger = new DurableLedgerStore(config, clock, new MicrometerIngestionMetrics(meters));

        // Then
        double full = meters.get("ingest.ledger.initialization").tag("method", "full").timer()
                .totalTime(TimeUnit.NANOSECONDS);
        double snapshot = meters.get("ingest.ledger.initialization").tag("method", "snapshot").timer()
                .totalTime(TimeUnit.NANOSECONDS);
        assertEquals(400, ledger.entries(LedgerState.COMPLETED).size());
        assertTrue(snapshot < full, "snapshot load " + snapshot + "ns vs full replay " + full + "ns");
    }

    @Test
    void testCompactor_SnapshotsOnlyWhenDue() {
        // Given
        ledger.close();
        ledger = openLedger(defaultLedgerConfig().withAutoSnapshotInterval(Duration.ofHours(1)));
        seed(2);
        LedgerCompactor compactor = new LedgerCompactor(ledger, new LedgerCompactorConfig());

        // When: interval not yet elapsed
        compactor.scan();

        // Then
        assertTrue(ledger.snapshots().isEmpty());

        // When: interval elapsed
        clock.advance(Duration.ofHours(1));
        compactor.scan();

        // Then
        assertEquals(1, ledger.snapshots().size());
        assertFalse(ledger.isSnapshotDue());
    }
}
