package com.medkg.ingestion.adapter.runner;

import com.medkg.ingestion.application.runtime.HousekeepingTask;
import com.medkg.ingestion.core.spi.CompactableLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Ledger 압축 작업.
 *
 * <p>{@link CompactableLedger#isSnapshotDue()}가 true이면 스냅샷을 만들어 로그를 비웁니다.
 * 스냅샷 생성이 실패해도 로그는 그대로 남아 있으므로 다음 확인에서 다시 시도합니다.
 * 단, 로그 truncate 후 인덱스 재커밋까지 실패한 Ledger는 다시 열기 전까지
 * {@link IllegalStateException}으로 모든 쓰기를 거부하며, 이후 확인도 같은 예외로 실패합니다.</p>
 *
 * <pre>
 * scan()
 *   ↓
 * force || ledger.isSnapshotDue() ?
 *   ├─ yes → ledger.createSnapshot()
 *   └─ no  → skip
 * </pre>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public final class LedgerCompactor implements HousekeepingTask {

    private static final Logger log = LoggerFactory.getLogger(LedgerCompactor.class);

    private final CompactableLedger ledger;
    private final LedgerCompactorConfig config;

    public LedgerCompactor(CompactableLedger ledger, LedgerCompactorConfig config) {
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.ledger = ledger;
        this.config = config;
    }

    @Override
    public void scan() {
        try {
            if (!config.force() && !ledger.isSnapshotDue()) {
                log.debug("Ledger snapshot not due");
                return;
            }
            Path snapshot = ledger.createSnapshot();
            log.info("Ledger compacted into {}", snapshot);
        } catch (IllegalStateException e) {
            log.error("Ledger compaction skipped, ledger is not writable: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Ledger compaction failed, will retry on next scan", e);
        }
    }

    @Override
    public long intervalMs() {
        return config.checkIntervalMs();
    }
}
