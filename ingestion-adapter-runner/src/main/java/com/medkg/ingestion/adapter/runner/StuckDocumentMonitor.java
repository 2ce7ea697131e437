package com.medkg.ingestion.adapter.runner;

import com.medkg.ingestion.application.runtime.HousekeepingTask;
import com.medkg.ingestion.core.ledger.DocumentLedgerEntry;
import com.medkg.ingestion.core.ledger.TransitionContext;
import com.medkg.ingestion.core.spi.Ledger;
import com.medkg.ingestion.core.statemachine.LedgerState;
import com.medkg.ingestion.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * 정체 문서 감시 작업.
 *
 * <p>비종단 상태에서 {@code thresholdMs} 이상 머문 문서를 찾아 정책에 따라 처리합니다.
 * 정체 문서 지표(gauge) 갱신과 경고 로그는 {@link Ledger#getStuckDocuments(Duration)}가 담당합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * scan()
 *   ↓
 * ledger.getStuckDocuments(threshold) → 오래된 순 목록
 *   ↓
 * REPORT → 로그만
 * FAIL   → 앞에서부터 batchSize개:
 *            FAILED 아님 + → FAILED 허용 → updateState(FAILED, error_type=stuck)
 *            그 외 → 건너뜀
 * </pre>
 *
 * <p>개별 문서 처리 실패는 로그만 남기고 다음 문서로 넘어갑니다.</p>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public final class StuckDocumentMonitor implements HousekeepingTask {

    private static final Logger log = LoggerFactory.getLogger(StuckDocumentMonitor.class);
    static final String ERROR_TYPE = "stuck";
    static final String ADAPTER = "stuck-document-monitor";

    private final Ledger ledger;
    private final StuckDocumentMonitorConfig config;

    /**
     * @param ledger 감시할 Ledger
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StuckDocumentMonitor(Ledger ledger, StuckDocumentMonitorConfig config) {
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
        Duration threshold = Duration.ofMillis(config.thresholdMs());
        List<DocumentLedgerEntry> stuck;
        try {
            stuck = ledger.getStuckDocuments(threshold);
        } catch (RuntimeException e) {
            log.error("Stuck document scan failed", e);
            return;
        }

        if (stuck.isEmpty() || config.policy() == StuckDocumentPolicy.REPORT) {
            log.info("Stuck document scan completed: {} stuck (threshold {})", stuck.size(), threshold);
            return;
        }

        int failed = 0;
        int limit = Math.min(stuck.size(), config.batchSize());
        for (DocumentLedgerEntry entry : stuck.subList(0, limit)) {
            if (tryFail(entry, threshold)) {
                failed++;
            }
        }
        log.info("Stuck document scan completed: {} marked FAILED out of {} stuck", failed, stuck.size());
    }

    @Override
    public long intervalMs() {
        return config.scanIntervalMs();
    }

    private boolean tryFail(DocumentLedgerEntry entry, Duration threshold) {
        LedgerState state = entry.state();
        if (state == LedgerState.FAILED || !StateTransition.isAllowed(state, LedgerState.FAILED)) {
            log.debug("Stuck document {} left in {}", entry.docId(), state);
            return false;
        }
        try {
            ledger.updateState(entry.docId(), LedgerState.FAILED, TransitionContext.ofAdapter(ADAPTER)
                .withError(ERROR_TYPE, "No progress in " + state + " since " + entry.updatedAt() + " (threshold " + threshold + ")"));
            log.info("Stuck document {} marked FAILED (was {})", entry.docId(), state);
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to mark stuck document {} as FAILED", entry.docId(), e);
            return false;
        }
    }
}
