package com.medkg.ingestion.core.event;

import com.medkg.ingestion.core.model.Document;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 문서 처리 완료.
 *
 * @author Ingestion Team
 * @since 1.0.0
 * @param pipelineId 파이프라인 ID
 * @param timestamp 발생 시각
 * @param document 완료된 문서
 * @param durationSeconds 시작 이벤트부터 완료까지의 경과 시간 (0 이상)
 * @param adapterMetadata 어댑터가 결과에 붙인 메타데이터
 */
public record DocumentCompleted(
    String pipelineId,
    Instant timestamp,
    Document document,
    double durationSeconds,
    Map<String, Object> adapterMetadata
) implements PipelineEvent {

    public DocumentCompleted {
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        if (durationSeconds < 0) {
            throw new IllegalArgumentException("durationSeconds must be non-negative (current: " + durationSeconds + ")");
        }
        adapterMetadata = adapterMetadata == null || adapterMetadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(adapterMetadata));
    }

    public String docId() {
        return document.docId();
    }

    @Override
    public DocumentCompleted withPipelineContext(String pipelineId, Instant now) {
        if (this.pipelineId != null && this.timestamp != null) {
            return this;
        }
        return new DocumentCompleted(
            PipelineEvents.fillId(this.pipelineId, pipelineId),
            PipelineEvents.fillTime(this.timestamp, now),
            document, durationSeconds, adapterMetadata
        );
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = PipelineEvents.baseMap(this);
        map.put("doc_id", document.docId());
        map.put("source", document.source());
        map.put("duration_seconds", durationSeconds);
        map.put("adapter_metadata", adapterMetadata);
        return map;
    }
}
