package com.medkg.ingestion.adapter.filelog;

import com.medkg.ingestion.core.ledger.DocumentLedgerEntry;
import com.medkg.ingestion.core.ledger.LedgerCorruptionException;
import com.medkg.ingestion.core.ledger.LedgerIOException;
import com.medkg.ingestion.core.metrics.noop.NoOpIngestionMetrics;
import com.medkg.ingestion.core.statemachine.LedgerState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 스냅샷 생성, 압축, 복구 테스트.
 *
 * <ul>
 *   <li>스냅샷 + 꼬리 로그 로드 결과 == 전체 로그 재생 결과</li>
 *   <li>스냅샷 커밋 중간 단계에서 중단되어도 같은 결과</li>
 *   <li>보관 개수를 넘는 스냅샷은 삭제</li>
 * </ul>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
class SnapshotCompactionTest {

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));

    private DurableLedgerStore open(LedgerConfig config) {
        return new DurableLedgerStore(config, clock, new NoOpIngestionMetrics());
    }

    private static void advanceThroughPipeline(DurableLedgerStore ledger, String docId, int steps) {
        List<LedgerState> path = List.of(LedgerState.FETCHING, LedgerState.FETCHED, LedgerState.PARSING,
            LedgerState.PARSED, LedgerState.VALIDATING, LedgerState.VALIDATED, LedgerState.IR_BUILDING,
            LedgerState.IR_READY, LedgerState.COMPLETED);
        for (int i = 0; i < steps; i++) {
            ledger.updateState(docId, path.get(i));
        }
    }

    private static Map<String, LedgerState> states(DurableLedgerStore ledger) {
        return ledger.entries().stream().collect(Collectors.toMap(DocumentLedgerEntry::docId, DocumentLedgerEntry::state));
    }

    @Test
    void createSnapshot_로그를_비우고_인덱스를_커밋한다() throws Exception {
        // given
        LedgerConfig config = new LedgerConfig(tempDir.resolve("ledger.jsonl"));
        try (DurableLedgerStore ledger = open(config)) {
            advanceThroughPipeline(ledger, "doc-1", 9);

            // when
            Path snapshot = ledger.createSnapshot();

            // then
            assertThat(snapshot).exists();
            assertThat(snapshot.getParent()).isEqualTo(config.snapshotDirectory());
            assertThat(Files.size(config.logPath())).isZero();
            SnapshotIndex index = SnapshotIndex.read(config.indexPath()).orElseThrow();
            assertThat(index.snapshot()).isEqualTo(snapshot.getFileName().toString());
            assertThat(index.logOffset()).isZero();
            assertThat(ledger.history("doc-1")).isEmpty();
            assertThat(ledger.getState("doc-1")).contains(LedgerState.COMPLETED);
        }
    }

    @Test
    void 스냅샷과_꼬리_로그_로드는_전체_재생과_같다() throws Exception {
        // given: 같은 전이를 두 Ledger에 적용, 한쪽만 중간에 스냅샷
        LedgerConfig full = new LedgerConfig(tempDir.resolve("full/ledger.jsonl"));
        LedgerConfig compacted = new LedgerConfig(tempDir.resolve("compacted/ledger.jsonl"));
        try (DurableLedgerStore a = open(full); DurableLedgerStore b = open(compacted)) {
            for (int i = 0; i < 50; i++) {
                advanceThroughPipeline(a, "doc-" + i, 1 + i % 9);
                advanceThroughPipeline(b, "doc-" + i, 1 + i % 9);
            }
            b.createSnapshot();
            for (int i = 0; i < 10; i++) {
                a.updateState("doc-" + i, LedgerState.FAILED);
                b.updateState("doc-" + i, LedgerState.FAILED);
                clock.advance(Duration.ofMillis(7));
            }
        }

        // when
        try (DurableLedgerStore reloadedFull = open(full); DurableLedgerStore reloadedCompacted = open(compacted)) {
            // then
            assertThat(reloadedCompacted.entries()).containsExactlyInAnyOrderElementsOf(reloadedFull.entries());
            assertThat(states(reloadedCompacted)).hasSize(50);
        }

        Map<String, DocumentLedgerEntry> viaCompaction = DurableLedgerStore.loadWithCompaction(
            SnapshotCodec.list(compacted.snapshotDirectory()).get(0), compacted.logPath());
        assertThat(viaCompaction.values()).containsExactlyInAnyOrderElementsOf(
            DurableLedgerStore.loadWithCompaction(null, full.logPath()).values());
    }

    @Test
    void 인덱스가_truncate_이전_오프셋을_가리키면_앞부분을_건너뛴다() throws Exception {
        // given: 스냅샷 기록 + index{offset=L} 후 truncate 전에 중단된 상황 재현
        LedgerConfig config = new LedgerConfig(tempDir.resolve("ledger.jsonl"));
        Path snapshotFile;
        long offset;
        try (DurableLedgerStore ledger = open(config)) {
            advanceThroughPipeline(ledger, "doc-1", 3);
            offset = Files.size(config.logPath());
            snapshotFile = SnapshotCodec.write(config.snapshotDirectory(), clock.instant(), offset, ledger.entries(), true);
            new SnapshotIndex(snapshotFile.getFileName().toString(), offset, clock.instant()).write(config.indexPath(), true);
            ledger.updateState("doc-1", LedgerState.PARSED);
        }

        // when
        try (DurableLedgerStore reloaded = open(config)) {
            // then
            assertThat(reloaded.getState("doc-1")).contains(LedgerState.PARSED);
            assertThat(reloaded.history("doc-1")).hasSize(1);
        }
    }

    @Test
    void 로그가_인덱스_오프셋보다_짧으면_오프셋을_0으로_재커밋한다() throws Exception {
        // given: truncate 후 index 재커밋 전에 중단된 상황 재현
        LedgerConfig config = new LedgerConfig(tempDir.resolve("ledger.jsonl"));
        try (DurableLedgerStore ledger = open(config)) {
            advanceThroughPipeline(ledger, "doc-1", 4);
            Path snapshot = ledger.createSnapshot();
            new SnapshotIndex(snapshot.getFileName().toString(), 10_000, clock.instant()).write(config.indexPath(), true);
        }

        // when
        try (DurableLedgerStore reloaded = open(config)) {
            // then
            assertThat(reloaded.getState("doc-1")).contains(LedgerState.PARSED);
            assertThat(SnapshotIndex.read(config.indexPath()).orElseThrow().logOffset()).isZero();
        }
    }

    @Test
    void truncate_후_인덱스_재커밋이_한_번_실패하면_재시도해서_계속_쓸_수_있다() throws Exception {
        // given: 두 번째 인덱스 쓰기(재커밋)만 실패
        LedgerConfig config = new LedgerConfig(tempDir.resolve("ledger.jsonl"));
        try (IndexFailingStore ledger = new IndexFailingStore(config, Set.of(2))) {
            advanceThroughPipeline(ledger, "doc-1", 3);

            // when
            ledger.createSnapshot();
            ledger.updateState("doc-1", LedgerState.PARSED);

            // then
            assertThat(ledger.indexWrites).isEqualTo(3);
            assertThat(SnapshotIndex.read(config.indexPath()).orElseThrow().logOffset()).isZero();
        }
        try (DurableLedgerStore reloaded = open(config)) {
            assertThat(reloaded.getState("doc-1")).contains(LedgerState.PARSED);
            assertThat(reloaded.history("doc-1")).hasSize(1);
        }
    }

    @Test
    void truncate_후_인덱스_재커밋이_계속_실패하면_다시_열기_전까지_쓰기를_거부한다() throws Exception {
        // given: 재커밋과 그 재시도가 모두 실패
        LedgerConfig config = new LedgerConfig(tempDir.resolve("ledger.jsonl"));
        IndexFailingStore ledger = new IndexFailingStore(config, Set.of(2, 3));
        advanceThroughPipeline(ledger, "doc-1", 3);
        advanceThroughPipeline(ledger, "doc-2", 2);

        // when
        assertThatThrownBy(ledger::createSnapshot)
            .isInstanceOf(LedgerIOException.class)
            .hasMessageContaining("index");

        // then: 인덱스가 truncate 이전 오프셋을 가리키므로 append 금지
        assertThat(SnapshotIndex.read(config.indexPath()).orElseThrow().logOffset()).isPositive();
        assertThatThrownBy(() -> ledger.updateState("doc-1", LedgerState.PARSED))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("must be reopened");
        assertThatThrownBy(ledger::createSnapshot)
            .isInstanceOf(IllegalStateException.class);
        assertThat(ledger.getState("doc-1")).contains(LedgerState.PARSING);
        ledger.close();

        // when: 다시 열면 "로그가 오프셋보다 짧음" 경로로 복구
        try (DurableLedgerStore reopened = open(config)) {
            // then
            assertThat(states(reopened)).containsExactlyInAnyOrderEntriesOf(Map.of(
                "doc-1", LedgerState.PARSING,
                "doc-2", LedgerState.FETCHED));
            assertThat(SnapshotIndex.read(config.indexPath()).orElseThrow().logOffset()).isZero();
            reopened.updateState("doc-1", LedgerState.PARSED);
        }
        try (DurableLedgerStore again = open(config)) {
            assertThat(again.getState("doc-1")).contains(LedgerState.PARSED);
        }
    }

    /**
     * 지정한 번호(1부터)의 인덱스 쓰기를 실패시키는 Ledger.
     */
    private final class IndexFailingStore extends DurableLedgerStore {

        private final Set<Integer> failingWrites;
        private int indexWrites;

        IndexFailingStore(LedgerConfig config, Set<Integer> failingWrites) {
            super(config, clock, new NoOpIngestionMetrics());
            this.failingWrites = failingWrites;
        }

        @Override
        void commitIndex(SnapshotIndex index) {
            indexWrites++;
            if (failingWrites.contains(indexWrites)) {
                throw new LedgerIOException("Cannot write snapshot index (write #" + indexWrites + ")",
                    new IOException("disk full"));
            }
            super.commitIndex(index);
        }
    }

    @Test
    void 인덱스가_가리키지_않는_스냅샷은_무시된다() throws Exception {
        // given: 스냅샷 파일만 쓰고 인덱스 커밋 전에 중단
        LedgerConfig config = new LedgerConfig(tempDir.resolve("ledger.jsonl"));
        try (DurableLedgerStore ledger = open(config)) {
            advanceThroughPipeline(ledger, "doc-1", 2);
            SnapshotCodec.write(config.snapshotDirectory(), clock.instant(), 0, List.of(), true);
        }

        // when
        try (DurableLedgerStore reloaded = open(config)) {
            // then
            assertThat(reloaded.getState("doc-1")).contains(LedgerState.FETCHED);
        }
    }

    @Test
    void 인덱스가_없는_스냅샷을_가리키면_손상() throws Exception {
        // given
        LedgerConfig config = new LedgerConfig(tempDir.resolve("ledger.jsonl"));
        new SnapshotIndex("snapshot-0000000001-20240101T000000000Z.json", 0, clock.instant())
            .write(config.indexPath(), true);

        // when & then
        assertThatThrownBy(() -> open(config))
            .isInstanceOf(LedgerCorruptionException.class)
            .hasMessageContaining("does not exist");
    }

    @Test
    void 보관_개수를_넘는_오래된_스냅샷은_삭제된다() {
        // given
        LedgerConfig config = new LedgerConfig(tempDir.resolve("ledger.jsonl")).withSnapshotRetention(2);
        try (DurableLedgerStore ledger = open(config)) {
            Path last = null;
            for (int i = 0; i < 4; i++) {
                ledger.updateState("doc-" + i, LedgerState.FETCHING);
                last = ledger.createSnapshot();
            }

            // then
            List<Path> snapshots = ledger.snapshots();
            assertThat(snapshots).hasSize(2);
            assertThat(snapshots.get(1)).isEqualTo(last);
            assertThat(SnapshotCodec.sequenceOf(snapshots.get(0))).isEqualTo(3);
        }
    }

    @Test
    void isSnapshotDue_주기가_지나고_새_레코드가_있을_때만_true() {
        // given
        LedgerConfig config = new LedgerConfig(tempDir.resolve("ledger.jsonl"))
            .withAutoSnapshotInterval(Duration.ofHours(1));
        try (DurableLedgerStore ledger = open(config)) {
            clock.advance(Duration.ofHours(2));
            assertThat(ledger.isSnapshotDue()).isFalse();

            ledger.updateState("doc-1", LedgerState.FETCHING);
            assertThat(ledger.isSnapshotDue()).isTrue();

            ledger.createSnapshot();
            ledger.updateState("doc-1", LedgerState.FETCHED);
            assertThat(ledger.isSnapshotDue()).isFalse();

            clock.advance(Duration.ofMinutes(61));
            assertThat(ledger.isSnapshotDue()).isTrue();
        }
    }

    @Test
    void 스냅샷_파일_형식() throws Exception {
        // given
        LedgerConfig config = new LedgerConfig(tempDir.resolve("ledger.jsonl"));
        try (DurableLedgerStore ledger = open(config)) {
            ledger.updateState("doc-1", LedgerState.FETCHING);

            // when
            Path snapshot = ledger.createSnapshot();

            // then
            Map<String, Object> json = LedgerJson.readObject(Files.readAllBytes(snapshot), "test");
            assertThat(json).containsEntry("version", "1.0").containsEntry("document_count", 1)
                .containsKeys("created_at", "cut", "states");
            assertThat(snapshot.getFileName().toString()).matches("snapshot-0000000001-\\d{8}T\\d{9}Z\\.json");
        }
    }
}
