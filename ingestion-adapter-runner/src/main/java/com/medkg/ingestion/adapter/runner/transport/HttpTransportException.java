package com.medkg.ingestion.adapter.runner.transport;

/**
 * HTTP 요청이 재시도 후에도 실패했거나 재시도 대상이 아닌 응답을 받은 경우.
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public class HttpTransportException extends RuntimeException {

    private final Integer statusCode;

    public HttpTransportException(String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * 마지막 응답의 HTTP 상태 코드. 응답을 받지 못했으면 null.
     */
    public Integer statusCode() {
        return statusCode;
    }
}
