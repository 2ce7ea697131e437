package com.medkg.ingestion.core.spi;

/**
 * Failure raised by an adapter while producing results.
 *
 * <p>Carries the failing document ID (when known), the number of retries already
 * made and whether the failure is worth retrying in a later run.</p>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public class AdapterException extends RuntimeException {

    private final String docId;
    private final int retryCount;
    private final boolean retryable;

    public AdapterException(String message, String docId, int retryCount, boolean retryable) {
        this(message, docId, retryCount, retryable, null);
    }

    public AdapterException(String message, String docId, int retryCount, boolean retryable, Throwable cause) {
        super(message, cause);
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be non-negative (current: " + retryCount + ")");
        }
        this.docId = docId;
        this.retryCount = retryCount;
        this.retryable = retryable;
    }

    /**
     * Returns the failing document ID, or null if unknown.
     */
    public String docId() {
        return docId;
    }

    public int retryCount() {
        return retryCount;
    }

    public boolean retryable() {
        return retryable;
    }
}
