package com.medkg.ingestion.application.orchestrator;

/**
 * 생산자 스레드에서 발생한 예기치 않은 오류를 소비자에게 전달하는 예외.
 *
 * <p>어댑터 결과 스트림의 실패는 이벤트({@code DocumentFailed})로 전달되며
 * 이 예외로 감싸지지 않습니다.</p>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public class IngestionStreamException extends RuntimeException {

    public IngestionStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
