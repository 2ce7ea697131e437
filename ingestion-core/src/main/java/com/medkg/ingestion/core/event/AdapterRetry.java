package com.medkg.ingestion.core.event;

import java.time.Instant;
import java.util.Map;

/**
 * 전송 계층에서 요청을 재시도함.
 *
 * @author Ingestion Team
 * @since 1.0.0
 * @param pipelineId 파이프라인 ID
 * @param timestamp 발생 시각
 * @param adapter 어댑터 이름
 * @param attempt 재시도 차수 (1부터)
 * @param error 직전 시도의 오류
 * @param statusCode HTTP 상태 코드 (응답이 없었으면 null)
 */
public record AdapterRetry(
    String pipelineId,
    Instant timestamp,
    String adapter,
    int attempt,
    String error,
    Integer statusCode
) implements PipelineEvent {

    public AdapterRetry {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
    }

    @Override
    public AdapterRetry withPipelineContext(String pipelineId, Instant now) {
        if (this.pipelineId != null && this.timestamp != null) {
            return this;
        }
        return new AdapterRetry(
            PipelineEvents.fillId(this.pipelineId, pipelineId),
            PipelineEvents.fillTime(this.timestamp, now),
            adapter, attempt, error, statusCode
        );
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = PipelineEvents.baseMap(this);
        map.put("adapter", adapter);
        map.put("attempt", attempt);
        map.put("error", error);
        map.put("status_code", statusCode);
        return map;
    }
}
