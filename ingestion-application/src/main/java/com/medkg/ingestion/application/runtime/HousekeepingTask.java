package com.medkg.ingestion.application.runtime;

/**
 * 주기적으로 실행되는 Ledger 유지보수 작업.
 *
 * <p>스케줄링은 호출자의 몫입니다 (예: {@code ScheduledExecutorService}).
 * 구현체는 개별 항목의 실패를 로깅하고 다음 항목을 계속 처리해야 하며,
 * {@link #scan()}에서 예외를 던지지 않아야 합니다.</p>
 *
 * <p><strong>구현체 (adapter-runner 모듈):</strong></p>
 * <ul>
 *   <li>{@code StuckDocumentMonitor}: 정체 문서 감지 및 선택적 FAILED 처리</li>
 *   <li>{@code LedgerCompactor}: 주기가 지나면 스냅샷 생성</li>
 * </ul>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public interface HousekeepingTask {

    /**
     * 한 번의 유지보수 패스를 실행합니다.
     */
    void scan();

    /**
     * 권장 실행 주기 (밀리초).
     */
    long intervalMs();
}
