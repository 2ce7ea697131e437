package com.medkg.ingestion.adapter.filelog;

import java.nio.file.Path;
import java.time.Duration;

/**
 * DurableLedgerStore 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>logPath: JSON-lines 로그 파일 경로</li>
 *   <li>autoSnapshotInterval: 스냅샷 권장 주기 (기본 24시간)</li>
 *   <li>snapshotRetention: 보관할 스냅샷 수 (기본 7)</li>
 *   <li>fsync: append마다 디스크 동기화 여부 (기본 true)</li>
 * </ul>
 *
 * <p><strong>파일 배치:</strong></p>
 * <pre>
 * ledger.jsonl                       ← 로그 (스냅샷 이후 전이만)
 * ledger.jsonl.snapshots/            ← 스냅샷 디렉터리
 * ledger.jsonl.snapshot-index.json   ← 현재 스냅샷과 로그 오프셋
 * </pre>
 *
 * @author Ingestion Team
 * @since 1.0.0
 * @param logPath 로그 파일 경로 (null 불가)
 * @param autoSnapshotInterval 스냅샷 권장 주기 (양수)
 * @param snapshotRetention 보관할 스냅샷 수 (1 이상)
 * @param fsync append마다 fsync 수행 여부
 */
public record LedgerConfig(
    Path logPath,
    Duration autoSnapshotInterval,
    int snapshotRetention,
    boolean fsync
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: autoSnapshotInterval=24시간, snapshotRetention=7, fsync=true</p>
     *
     * @param logPath 로그 파일 경로
     */
    public LedgerConfig(Path logPath) {
        this(logPath, Duration.ofHours(24), 7, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LedgerConfig {
        if (logPath == null) {
            throw new IllegalArgumentException("logPath cannot be null");
        }
        if (autoSnapshotInterval == null || autoSnapshotInterval.isNegative() || autoSnapshotInterval.isZero()) {
            throw new IllegalArgumentException(
                "autoSnapshotInterval must be positive (current: " + autoSnapshotInterval + ")"
            );
        }
        if (snapshotRetention <= 0) {
            throw new IllegalArgumentException(
                "snapshotRetention must be positive (current: " + snapshotRetention + ")"
            );
        }
    }

    /**
     * 스냅샷 디렉터리 ({@code <log>.snapshots}).
     */
    public Path snapshotDirectory() {
        return logPath.resolveSibling(logPath.getFileName() + ".snapshots");
    }

    /**
     * 스냅샷 인덱스 파일 ({@code <log>.snapshot-index.json}).
     */
    public Path indexPath() {
        return logPath.resolveSibling(logPath.getFileName() + ".snapshot-index.json");
    }

    /**
     * autoSnapshotInterval만 변경한 새 인스턴스 생성.
     */
    public LedgerConfig withAutoSnapshotInterval(Duration autoSnapshotInterval) {
        return new LedgerConfig(logPath, autoSnapshotInterval, snapshotRetention, fsync);
    }

    /**
     * snapshotRetention만 변경한 새 인스턴스 생성.
     */
    public LedgerConfig withSnapshotRetention(int snapshotRetention) {
        return new LedgerConfig(logPath, autoSnapshotInterval, snapshotRetention, fsync);
    }

    /**
     * fsync만 변경한 새 인스턴스 생성.
     */
    public LedgerConfig withFsync(boolean fsync) {
        return new LedgerConfig(logPath, autoSnapshotInterval, snapshotRetention, fsync);
    }
}
