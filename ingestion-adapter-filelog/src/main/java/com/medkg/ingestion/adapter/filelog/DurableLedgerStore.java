package com.medkg.ingestion.adapter.filelog;

import com.medkg.ingestion.core.ledger.DocumentLedgerEntry;
import com.medkg.ingestion.core.ledger.InvalidStateTransitionException;
import com.medkg.ingestion.core.ledger.LedgerAuditRecord;
import com.medkg.ingestion.core.ledger.LedgerIOException;
import com.medkg.ingestion.core.ledger.TransitionContext;
import com.medkg.ingestion.core.metrics.IngestionMetrics;
import com.medkg.ingestion.core.metrics.noop.NoOpIngestionMetrics;
import com.medkg.ingestion.core.spi.CompactableLedger;
import com.medkg.ingestion.core.statemachine.LedgerState;
import com.medkg.ingestion.core.statemachine.StateAliases;
import com.medkg.ingestion.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.FileOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * JSON-lines 로그 기반 {@link CompactableLedger} 구현.
 *
 * <p>모든 전이는 감사 레코드 한 줄로 로그에 append되고 fsync된 뒤에야
 * 메모리 상태에 반영됩니다. 프로세스가 어느 시점에 죽더라도 재시작 시
 * 마지막으로 확인 응답한 전이까지 복원됩니다.</p>
 *
 * <p><strong>시작 흐름:</strong></p>
 * <pre>
 * 1. snapshot-index 읽기 → 있으면 가리키는 스냅샷을 기준선으로 로드
 * 2. 로그에서 log_offset 이후 레코드를 재생 (전이 검증 포함)
 * 3. 로드 방식(full/snapshot)과 소요 시간을 지표로 보고
 * </pre>
 *
 * <p><strong>쓰기 흐름 (updateState):</strong></p>
 * <pre>
 * write lock
 *   → 현재 상태 (없으면 PENDING)
 *   → StateTransition.validate
 *   → 로그 append + force
 *   → 메모리 엔트리 교체, 이력 추가, 지표 갱신
 * unlock
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>단일 {@link ReentrantReadWriteLock}: 쓰기와 스냅샷은 write lock, 조회는 read lock</li>
 *   <li>조회 결과는 불변 사본이므로 반쯤 적용된 전이를 관찰할 수 없음</li>
 *   <li>단일 프로세스 전용 (다중 프로세스 공유 불가)</li>
 * </ul>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public class DurableLedgerStore implements CompactableLedger, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DurableLedgerStore.class);

    private final LedgerConfig config;
    private final Clock clock;
    private final IngestionMetrics metrics;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, DocumentLedgerEntry> entries;
    private final Map<String, List<LedgerAuditRecord>> history;
    private final Map<LedgerState, Integer> stateCounts = new EnumMap<>(LedgerState.class);

    private FileOutputStream out;
    private Instant lastSnapshotAt;
    private long recordsSinceSnapshot;
    private boolean closed;
    private String reopenReason;

    /**
     * 생성자 (시스템 UTC 시계, NoOp 지표).
     *
     * @param config 설정
     */
    public DurableLedgerStore(LedgerConfig config) {
        this(config, Clock.systemUTC(), new NoOpIngestionMetrics());
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @param clock 전이 시각과 정체 판정에 사용할 시계
     * @param metrics 지표 구현체
     * @throws IllegalArgumentException 의존성이 null인 경우
     * @throws com.medkg.ingestion.core.ledger.LedgerCorruptionException 로그나 스냅샷이 손상된 경우
     * @throws LedgerIOException 파일을 열 수 없는 경우
     */
    public DurableLedgerStore(LedgerConfig config, Clock clock, IngestionMetrics metrics) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
        this.config = config;
        this.clock = clock;
        this.metrics = metrics;

        long started = System.nanoTime();
        Optional<SnapshotIndex> index = SnapshotIndex.read(config.indexPath());
        Map<String, DocumentLedgerEntry> baseline = Map.of();
        long offset = 0;
        String method = "full";

        if (index.isPresent()) {
            SnapshotCodec.Snapshot snapshot = SnapshotCodec.read(config.snapshotDirectory().resolve(index.get().snapshot()));
            baseline = snapshot.entries();
            lastSnapshotAt = snapshot.createdAt();
            method = "snapshot";
            offset = index.get().logOffset();
            long logSize = sizeOf(config.logPath());
            if (logSize < offset) {
                log.warn("Ledger log {} is shorter ({} bytes) than indexed offset {}; snapshot truncation completed, re-committing index",
                    config.logPath(), logSize, offset);
                offset = 0;
                index.get().withLogOffset(0, clock.instant()).write(config.indexPath(), config.fsync());
            }
        }

        LedgerReplayer.Result result = LedgerReplayer.replay(baseline, config.logPath(), offset);
        this.entries = result.entries();
        this.history = result.history();
        this.recordsSinceSnapshot = result.recordCount();
        if (lastSnapshotAt == null) {
            lastSnapshotAt = clock.instant();
        }
        for (DocumentLedgerEntry entry : entries.values()) {
            stateCounts.merge(entry.state(), 1, Integer::sum);
        }
        this.out = openAppendStream();

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        metrics.recordLedgerLoad(method, elapsed);
        metrics.updateStateDistribution(distribution());
        log.info("Ledger loaded from {} ({}): {} documents, {} records replayed in {} ms",
            config.logPath(), method, entries.size(), result.recordCount(), elapsed.toMillis());
    }

    /**
     * 스냅샷과 델타 로그로부터 상태 Map을 복원 (부수 효과 없음).
     *
     * @see LedgerReplayer#loadWithCompaction(Path, Path)
     */
    public static Map<String, DocumentLedgerEntry> loadWithCompaction(Path snapshotPath, Path deltaPath) {
        return LedgerReplayer.loadWithCompaction(snapshotPath, deltaPath);
    }

    @Override
    public LedgerAuditRecord updateState(String docId, LedgerState newState, TransitionContext context) {
        if (docId == null || docId.isBlank()) {
            throw new IllegalArgumentException("docId cannot be null or blank");
        }
        if (newState == null) {
            throw new IllegalArgumentException("newState must be a LedgerState enum value");
        }
        TransitionContext ctx = context == null ? TransitionContext.empty() : context;

        lock.writeLock().lock();
        try {
            ensureOpen();
            DocumentLedgerEntry current = entries.get(docId);
            LedgerState oldState = current == null ? LedgerState.PENDING : current.state();
            try {
                StateTransition.validate(oldState, newState);
            } catch (InvalidStateTransitionException e) {
                metrics.recordLedgerError("invalid_transition");
                log.error("Rejected ledger transition for {}: {} → {}", docId, oldState, newState);
                throw e;
            }

            Instant now = clock.instant();
            Duration timeInState = current == null ? null : nonNegative(Duration.between(current.updatedAt(), now));
            Double durationSeconds = ctx.durationSeconds() != null
                ? ctx.durationSeconds()
                : timeInState == null ? null : timeInState.toNanos() / 1_000_000_000.0;

            LedgerAuditRecord record = new LedgerAuditRecord(
                docId,
                oldState,
                newState,
                LedgerAuditRecord.toEpochSeconds(now),
                ctx.adapter(),
                ctx.metadata(),
                ctx.parameters(),
                ctx.retryCount(),
                durationSeconds,
                ctx.errorType(),
                ctx.errorMessage()
            );

            append(record);

            entries.put(docId, DocumentLedgerEntry.apply(current, record));
            history.computeIfAbsent(docId, id -> new ArrayList<>()).add(record);
            recordsSinceSnapshot++;
            if (current != null) {
                stateCounts.merge(oldState, -1, Integer::sum);
            }
            stateCounts.merge(newState, 1, Integer::sum);

            metrics.recordTransition(oldState, newState);
            if (timeInState != null) {
                metrics.recordStateDuration(oldState, timeInState);
            }
            metrics.updateStateDistribution(distribution());
            log.debug("Ledger transition {}: {} → {}", docId, oldState, newState);
            return record;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p>호출할 때마다 deprecation 경고를 로깅합니다.</p>
     */
    @Override
    @Deprecated
    public LedgerAuditRecord record(String docId, String state, Map<String, Object> metadata) {
        log.warn("Ledger.record(docId, String, metadata) is deprecated; use updateState with a LedgerState (docId: {}, state: {})",
            docId, state);
        LedgerState resolved = StateAliases.resolve(state).orElseThrow(
            () -> new IllegalArgumentException("Unknown ledger state label: '" + state + "'")
        );
        return updateState(docId, resolved, TransitionContext.empty().withMetadata(metadata));
    }

    @Override
    public Optional<DocumentLedgerEntry> get(String docId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(docId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Collection<DocumentLedgerEntry> entries() {
        lock.readLock().lock();
        try {
            return List.copyOf(entries.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<DocumentLedgerEntry> entries(LedgerState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        lock.readLock().lock();
        try {
            return entries.values().stream()
                .filter(entry -> entry.state() == state)
                .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<DocumentLedgerEntry> getStuckDocuments(Duration threshold) {
        if (threshold == null || threshold.isNegative()) {
            throw new IllegalArgumentException("threshold must be non-negative (current: " + threshold + ")");
        }
        Instant cutoff = clock.instant().minus(threshold);
        List<DocumentLedgerEntry> stuck;
        lock.readLock().lock();
        try {
            stuck = entries.values().stream()
                .filter(entry -> !entry.state().isTerminal())
                .filter(entry -> !entry.updatedAt().isAfter(cutoff))
                .sorted(Comparator.comparing(DocumentLedgerEntry::updatedAt))
                .toList();
        } finally {
            lock.readLock().unlock();
        }

        Map<LedgerState, Integer> byState = new EnumMap<>(LedgerState.class);
        for (DocumentLedgerEntry entry : stuck) {
            byState.merge(entry.state(), 1, Integer::sum);
        }
        metrics.updateStuckDocuments(byState);
        if (!stuck.isEmpty()) {
            log.warn("Found {} documents stuck for at least {} (by state: {})", stuck.size(), threshold, byState);
        }
        return stuck;
    }

    @Override
    public List<LedgerAuditRecord> history(String docId) {
        lock.readLock().lock();
        try {
            List<LedgerAuditRecord> records = history.get(docId);
            return records == null ? List.of() : List.copyOf(records);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>처리 흐름:</strong></p>
     * <pre>
     * 1. 현재 엔트리를 새 스냅샷 파일로 기록
     * 2. index = {새 스냅샷, 현재 로그 크기}
     * 3. 로그 truncate
     * 4. index = {새 스냅샷, 0}  (실패 시 한 번 재시도)
     * 5. 보관 개수를 넘는 오래된 스냅샷 삭제
     * </pre>
     *
     * <p>4단계가 재시도 후에도 실패하면 인덱스가 truncate 이전 오프셋을 가리킨 채로 남습니다.
     * 이 상태에서 append하면 재시작 시 새 레코드가 건너뛰어지므로, 이후 모든 쓰기와 스냅샷은
     * {@link IllegalStateException}으로 거부됩니다. 다시 열면 "로그가 오프셋보다 짧음" 복구 경로로
     * 정상 로드됩니다.</p>
     */
    @Override
    public Path createSnapshot() {
        lock.writeLock().lock();
        try {
            ensureOpen();
            Instant now = clock.instant();
            long logSize = Files.size(config.logPath());

            Path snapshot = SnapshotCodec.write(config.snapshotDirectory(), now, logSize, entries.values(), config.fsync());
            SnapshotIndex index = new SnapshotIndex(snapshot.getFileName().toString(), logSize, now);
            commitIndex(index);

            truncateLog();
            recommitAfterTruncate(index.withLogOffset(0, now));

            history.clear();
            recordsSinceSnapshot = 0;
            lastSnapshotAt = now;
            applyRetention(snapshot);

            log.info("Ledger snapshot created: {} ({} documents, {} log bytes compacted)", snapshot, entries.size(), logSize);
            return snapshot;
        } catch (IOException e) {
            metrics.recordLedgerError("io");
            log.error("Failed to create ledger snapshot for {}", config.logPath(), e);
            throw new LedgerIOException("Cannot create snapshot for " + config.logPath(), e);
        } catch (LedgerIOException e) {
            metrics.recordLedgerError("io");
            log.error("Failed to create ledger snapshot for {}", config.logPath(), e);
            throw e;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean isSnapshotDue() {
        lock.readLock().lock();
        try {
            if (recordsSinceSnapshot == 0) {
                return false;
            }
            return !clock.instant().isBefore(lastSnapshotAt.plus(config.autoSnapshotInterval()));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 스냅샷 디렉터리의 스냅샷 파일 목록 (오래된 순).
     */
    public List<Path> snapshots() {
        return SnapshotCodec.list(config.snapshotDirectory());
    }

    public LedgerConfig config() {
        return config;
    }

    /**
     * 로그 파일을 닫습니다. 이후 쓰기는 {@link IllegalStateException}.
     */
    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            out.close();
            log.info("Ledger closed: {}", config.logPath());
        } catch (IOException e) {
            throw new LedgerIOException("Cannot close ledger log " + config.logPath(), e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void append(LedgerAuditRecord record) {
        byte[] line = (LedgerJson.writeLine(record.toMap()) + "\n").getBytes(StandardCharsets.UTF_8);
        try {
            out.write(line);
            if (config.fsync()) {
                out.getFD().sync();
            }
        } catch (IOException e) {
            metrics.recordLedgerError("io");
            log.error("Failed to append ledger record for {}", record.docId(), e);
            throw new LedgerIOException("Cannot append to ledger log " + config.logPath(), e);
        }
    }

    void commitIndex(SnapshotIndex index) {
        index.write(config.indexPath(), config.fsync());
    }

    private void recommitAfterTruncate(SnapshotIndex index) {
        try {
            commitIndex(index);
        } catch (LedgerIOException first) {
            log.warn("Failed to re-commit snapshot index {} after log truncation, retrying once", config.indexPath(), first);
            try {
                commitIndex(index);
            } catch (LedgerIOException second) {
                second.addSuppressed(first);
                reopenReason = "snapshot index re-commit failed after log truncation";
                log.error("Ledger {} rejects further writes until reopened: {}", config.logPath(), reopenReason, second);
                throw second;
            }
        }
    }

    private void truncateLog() throws IOException {
        out.close();
        try (FileOutputStream truncating = new FileOutputStream(config.logPath().toFile(), false)) {
            if (config.fsync()) {
                truncating.getFD().sync();
            }
        } finally {
            out = openAppendStream();
        }
    }

    private void applyRetention(Path current) {
        List<Path> snapshots = SnapshotCodec.list(config.snapshotDirectory());
        int excess = snapshots.size() - config.snapshotRetention();
        for (int i = 0; i < excess; i++) {
            Path candidate = snapshots.get(i);
            if (candidate.getFileName().equals(current.getFileName())) {
                continue;
            }
            try {
                Files.deleteIfExists(candidate);
                log.debug("Deleted expired ledger snapshot {}", candidate);
            } catch (IOException e) {
                log.warn("Failed to delete expired ledger snapshot {}", candidate, e);
            }
        }
    }

    // FileOutputStream rather than FileChannel: an interrupt on a writer thread must not close the log
    private FileOutputStream openAppendStream() {
        try {
            Path parent = config.logPath().toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            return new FileOutputStream(config.logPath().toFile(), true);
        } catch (IOException e) {
            throw new LedgerIOException("Cannot open ledger log " + config.logPath(), e);
        }
    }

    private Map<LedgerState, Integer> distribution() {
        Map<LedgerState, Integer> counts = new EnumMap<>(LedgerState.class);
        for (LedgerState state : LedgerState.values()) {
            counts.put(state, stateCounts.getOrDefault(state, 0));
        }
        return counts;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Ledger is closed: " + config.logPath());
        }
        if (reopenReason != null) {
            throw new IllegalStateException("Ledger must be reopened (" + reopenReason + "): " + config.logPath());
        }
    }

    private static Duration nonNegative(Duration duration) {
        return duration.isNegative() ? Duration.ZERO : duration;
    }

    private static long sizeOf(Path path) {
        try {
            return Files.exists(path) ? Files.size(path) : 0;
        } catch (IOException e) {
            throw new LedgerIOException("Cannot stat ledger log " + path, e);
        }
    }
}
