package com.medkg.ingestion.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 어댑터가 원천 소스에서 만들어 낸 문서.
 *
 * @author Ingestion Team
 * @since 1.0.0
 * @param docId 문서 ID (공백 불가)
 * @param source 소스 이름 (예: "pubmed")
 * @param content 본문 텍스트
 * @param metadata 메타데이터
 * @param raw 원본 페이로드 (nullable)
 */
public record Document(
    String docId,
    String source,
    String content,
    Map<String, Object> metadata,
    Object raw
) {

    public Document {
        if (docId == null || docId.isBlank()) {
            throw new IllegalArgumentException("docId cannot be null or blank");
        }
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source cannot be null or blank");
        }
        if (content == null) {
            content = "";
        }
        metadata = metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * 본문만 있는 문서 생성.
     */
    public static Document of(String docId, String source, String content) {
        return new Document(docId, source, content, Map.of(), null);
    }
}
