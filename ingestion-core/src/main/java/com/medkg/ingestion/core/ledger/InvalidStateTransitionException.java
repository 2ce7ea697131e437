package com.medkg.ingestion.core.ledger;

import com.medkg.ingestion.core.statemachine.LedgerState;

/**
 * 상태 그래프에 없는 전이를 시도했을 때 발생.
 *
 * <p>계약 위반이므로 재시도 대상이 아닙니다.</p>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public class InvalidStateTransitionException extends LedgerException {

    private final LedgerState from;
    private final LedgerState to;

    /**
     * 생성자.
     *
     * @param from 현재 상태
     * @param to 요청된 상태
     */
    public InvalidStateTransitionException(LedgerState from, LedgerState to) {
        super(String.format("Invalid state transition: %s → %s", from, to));
        this.from = from;
        this.to = to;
    }

    public LedgerState from() {
        return from;
    }

    public LedgerState to() {
        return to;
    }
}
