package com.medkg.ingestion.core.statemachine;

/**
 * 문서 수집 파이프라인의 처리 단계.
 *
 * <p>Ledger는 문서마다 정확히 하나의 {@code LedgerState}를 유지하며,
 * 모든 변경은 {@link StateTransition}이 허용하는 간선을 따라야 합니다.</p>
 *
 * <p><strong>상태 흐름:</strong></p>
 * <pre>
 * PENDING → FETCHING → FETCHED → PARSING → PARSED → VALIDATING → VALIDATED
 *    → IR_BUILDING → IR_READY → (EMBEDDING → (INDEXED →)) COMPLETED
 *
 * 모든 비종료 단계 ─► FAILED ─► RETRYING ─► FETCHING
 * FETCHING ─► RETRYING
 * </pre>
 *
 * <p><strong>종료/재시도 규칙:</strong></p>
 * <ul>
 *   <li>COMPLETED만 종료 상태 (나가는 간선 없음)</li>
 *   <li>FAILED는 종료 상태가 아니며 RETRYING으로 재진입 가능</li>
 * </ul>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public enum LedgerState {

    /**
     * 아직 처리되지 않음 (처음 보는 문서의 암묵적 상태).
     */
    PENDING,

    /**
     * 원천 소스에서 가져오는 중.
     */
    FETCHING,

    /**
     * 가져오기 완료.
     */
    FETCHED,

    /**
     * 파싱 중.
     */
    PARSING,

    /**
     * 파싱 완료.
     */
    PARSED,

    /**
     * 검증 중.
     */
    VALIDATING,

    /**
     * 검증 완료.
     */
    VALIDATED,

    /**
     * 중간 표현(IR) 생성 중.
     */
    IR_BUILDING,

    /**
     * 중간 표현(IR) 준비 완료.
     */
    IR_READY,

    /**
     * 임베딩 생성 중.
     */
    EMBEDDING,

    /**
     * 색인 완료.
     */
    INDEXED,

    /**
     * 재시도 대기.
     */
    RETRYING,

    /**
     * 완료 (종료 상태).
     */
    COMPLETED,

    /**
     * 실패 (재시도 가능).
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED인 경우에만 true
     */
    public boolean isTerminal() {
        return this == COMPLETED;
    }

    /**
     * 재시도 가능한 상태인지 확인.
     *
     * @return FAILED인 경우에만 true
     */
    public boolean isRetryable() {
        return this == FAILED;
    }
}
