package com.medkg.ingestion.core.ledger;

/**
 * 로그 append, fsync, 스냅샷 기록 중 발생한 I/O 실패를 감싸는 예외.
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public class LedgerIOException extends LedgerException {

    public LedgerIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
