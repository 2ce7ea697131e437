package com.medkg.ingestion.core.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 문서 처리 시작.
 *
 * @author Ingestion Team
 * @since 1.0.0
 * @param pipelineId 파이프라인 ID
 * @param timestamp 발생 시각
 * @param docId 문서 ID
 * @param adapter 어댑터(소스) 이름
 * @param parameters 현재 어댑터 호출 파라미터
 */
public record DocumentStarted(
    String pipelineId,
    Instant timestamp,
    String docId,
    String adapter,
    Map<String, Object> parameters
) implements PipelineEvent {

    public DocumentStarted {
        if (docId == null || docId.isBlank()) {
            throw new IllegalArgumentException("docId cannot be null or blank");
        }
        parameters = parameters == null || parameters.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    @Override
    public DocumentStarted withPipelineContext(String pipelineId, Instant now) {
        if (this.pipelineId != null && this.timestamp != null) {
            return this;
        }
        return new DocumentStarted(
            PipelineEvents.fillId(this.pipelineId, pipelineId),
            PipelineEvents.fillTime(this.timestamp, now),
            docId, adapter, parameters
        );
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = PipelineEvents.baseMap(this);
        map.put("doc_id", docId);
        map.put("adapter", adapter);
        map.put("parameters", parameters);
        return map;
    }
}
