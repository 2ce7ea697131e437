package com.medkg.ingestion.core.ledger;

/**
 * 로그 또는 스냅샷이 읽을 수 없거나 상태 그래프와 모순될 때 발생.
 *
 * <p>로드 시점에 치명적이며, 손상된 Ledger로는 서비스를 시작하지 않습니다.</p>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public class LedgerCorruptionException extends LedgerException {

    public LedgerCorruptionException(String message) {
        super(message);
    }

    public LedgerCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
