package com.medkg.ingestion.core.event;

import java.time.Instant;
import java.util.Map;

/**
 * 어댑터 생명주기 변화.
 *
 * @author Ingestion Team
 * @since 1.0.0
 * @param pipelineId 파이프라인 ID
 * @param timestamp 발생 시각
 * @param adapter 어댑터 이름
 * @param oldState 이전 단계 (최초 전이면 null)
 * @param newState 새 단계
 * @param reason 전이 사유 (nullable)
 */
public record AdapterStateChange(
    String pipelineId,
    Instant timestamp,
    String adapter,
    AdapterLifecycle oldState,
    AdapterLifecycle newState,
    String reason
) implements PipelineEvent {

    public AdapterStateChange {
        if (adapter == null || adapter.isBlank()) {
            throw new IllegalArgumentException("adapter cannot be null or blank");
        }
        if (newState == null) {
            throw new IllegalArgumentException("newState cannot be null");
        }
    }

    @Override
    public AdapterStateChange withPipelineContext(String pipelineId, Instant now) {
        if (this.pipelineId != null && this.timestamp != null) {
            return this;
        }
        return new AdapterStateChange(
            PipelineEvents.fillId(this.pipelineId, pipelineId),
            PipelineEvents.fillTime(this.timestamp, now),
            adapter, oldState, newState, reason
        );
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = PipelineEvents.baseMap(this);
        map.put("adapter", adapter);
        map.put("old_state", oldState == null ? null : oldState.label());
        map.put("new_state", newState.label());
        map.put("reason", reason);
        return map;
    }
}
