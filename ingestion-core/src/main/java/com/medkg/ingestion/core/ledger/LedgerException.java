package com.medkg.ingestion.core.ledger;

/**
 * Ledger 관련 예외의 최상위 타입.
 *
 * <p>상태 머신 위반과 마찬가지로 {@link IllegalStateException}을 상속하므로,
 * 호출 측은 기존 상태 검증 예외와 동일하게 처리할 수 있습니다.</p>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public class LedgerException extends IllegalStateException {

    /**
     * 생성자.
     *
     * @param message 예외 메시지
     */
    public LedgerException(String message) {
        super(message);
    }

    /**
     * 생성자.
     *
     * @param message 예외 메시지
     * @param cause 원인 예외
     */
    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
