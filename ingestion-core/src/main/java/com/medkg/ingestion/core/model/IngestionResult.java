package com.medkg.ingestion.core.model;

import com.medkg.ingestion.core.statemachine.LedgerState;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 어댑터 결과 스트림의 한 항목.
 *
 * @author Ingestion Team
 * @since 1.0.0
 * @param document 생성된 문서
 * @param state 어댑터가 문서를 남긴 Ledger 상태
 * @param timestamp 결과 생성 시각
 * @param metadata 어댑터 메타데이터 (이벤트의 adapterMetadata로 전달)
 */
public record IngestionResult(
    Document document,
    LedgerState state,
    Instant timestamp,
    Map<String, Object> metadata
) {

    public IngestionResult {
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        if (state == null) {
            state = LedgerState.COMPLETED;
        }
        if (timestamp == null) {
            timestamp = Instant.now();
        }
        metadata = metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * 완료된 문서 결과 생성.
     */
    public static IngestionResult completed(Document document) {
        return new IngestionResult(document, LedgerState.COMPLETED, null, Map.of());
    }

    public String docId() {
        return document.docId();
    }
}
