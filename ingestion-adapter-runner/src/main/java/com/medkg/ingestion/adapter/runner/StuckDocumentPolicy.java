package com.medkg.ingestion.adapter.runner;

/**
 * 정체 문서 처리 정책.
 *
 * <p>비종단 상태에서 임계 시간 이상 머문 문서를 {@link StuckDocumentMonitor}가
 * 어떻게 다룰지 결정합니다.</p>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public enum StuckDocumentPolicy {

    /**
     * 보고만 합니다.
     *
     * <p>정체 문서 지표(gauge)를 갱신하고 경고 로그를 남깁니다. Ledger는 바꾸지 않습니다.</p>
     */
    REPORT,

    /**
     * 실패로 전이합니다.
     *
     * <p>{@code → FAILED}가 허용되는 상태의 문서를 {@code FAILED}로 기록해 다음 실행에서
     * {@code RETRYING}으로 재처리할 수 있게 합니다. 이미 {@code FAILED}인 문서와
     * {@code → FAILED} 간선이 없는 상태({@code PENDING})는 건너뜁니다.</p>
     */
    FAIL
}
