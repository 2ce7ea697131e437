package com.medkg.ingestion.core.event;

import java.time.Instant;
import java.util.Map;

/**
 * 문서 처리 실패.
 *
 * <p>어댑터가 실패 문서를 특정하지 못한 경우 {@code docId}는 null입니다.</p>
 *
 * @author Ingestion Team
 * @since 1.0.0
 * @param pipelineId 파이프라인 ID
 * @param timestamp 발생 시각
 * @param docId 실패한 문서 ID (nullable)
 * @param error 오류 메시지
 * @param retryCount 지금까지의 재시도 횟수
 * @param retryable 재시도 가능 여부
 * @param errorType 오류 타입 (예외 클래스 단순 이름)
 */
public record DocumentFailed(
    String pipelineId,
    Instant timestamp,
    String docId,
    String error,
    int retryCount,
    boolean retryable,
    String errorType
) implements PipelineEvent {

    public DocumentFailed {
        if (error == null) {
            error = "";
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be non-negative (current: " + retryCount + ")");
        }
    }

    @Override
    public DocumentFailed withPipelineContext(String pipelineId, Instant now) {
        if (this.pipelineId != null && this.timestamp != null) {
            return this;
        }
        return new DocumentFailed(
            PipelineEvents.fillId(this.pipelineId, pipelineId),
            PipelineEvents.fillTime(this.timestamp, now),
            docId, error, retryCount, retryable, errorType
        );
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = PipelineEvents.baseMap(this);
        map.put("doc_id", docId);
        map.put("error", error);
        map.put("retry_count", retryCount);
        map.put("is_retryable", retryable);
        map.put("error_type", errorType);
        return map;
    }
}
