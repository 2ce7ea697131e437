package com.medkg.ingestion.core.metrics;

import com.medkg.ingestion.core.statemachine.LedgerState;

import java.time.Duration;
import java.util.Map;

/**
 * Ledger 및 파이프라인 관측 지표 SPI.
 *
 * <p>구현체는 생성 시점에 한 번 선택되어 주입됩니다. 백엔드가 없으면
 * {@link com.medkg.ingestion.core.metrics.noop.NoOpIngestionMetrics}를 사용합니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>Thread-safe: Ledger 쓰기 스레드와 생산자 스레드에서 동시에 호출됨</li>
 *   <li>예외를 던지지 않음: 지표 실패가 수집 경로를 막아서는 안 됨</li>
 * </ul>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public interface IngestionMetrics {

    /**
     * 상태 전이 1건 기록.
     */
    void recordTransition(LedgerState from, LedgerState to);

    /**
     * Ledger 오류 1건 기록.
     *
     * @param type 오류 분류 (예: "invalid_transition", "io")
     */
    void recordLedgerError(String type);

    /**
     * Ledger 초기 로드 기록.
     *
     * @param method "full" 또는 "snapshot"
     * @param duration 로드 소요 시간
     */
    void recordLedgerLoad(String method, Duration duration);

    /**
     * 상태별 문서 수 갱신 (없는 상태는 0).
     */
    void updateStateDistribution(Map<LedgerState, Integer> counts);

    /**
     * 상태별 정체 문서 수 갱신.
     */
    void updateStuckDocuments(Map<LedgerState, Integer> counts);

    /**
     * 문서가 이전 상태에 머문 시간 기록.
     */
    void recordStateDuration(LedgerState state, Duration duration);

    /**
     * 파이프라인 이벤트 1건 기록.
     *
     * @param eventType 이벤트 타입 이름
     */
    void recordEvent(String eventType);

    /**
     * 이벤트 큐 깊이 샘플 기록.
     */
    void recordQueueDepth(int depth);

    /**
     * 파이프라인 실행 전체 소요 시간 기록.
     */
    void recordPipelineDuration(String source, Duration duration);

    /**
     * 체크포인트 간 간격 기록.
     */
    void recordCheckpointLatency(Duration latency);

    /**
     * 파이프라인 소비 방식 기록.
     *
     * @param mode "stream_events", "run", "iter_results"
     */
    void recordConsumptionMode(String mode);

    /**
     * 전송 계층 재시도 1건 기록.
     */
    void recordTransportRetry(String adapter);
}
