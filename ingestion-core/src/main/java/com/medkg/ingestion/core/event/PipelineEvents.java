package com.medkg.ingestion.core.event;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 이벤트 공통 헬퍼.
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public final class PipelineEvents {

    // Utility class - prevent instantiation
    private PipelineEvents() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 새 파이프라인 실행 ID 생성.
     *
     * @param source 소스 이름
     * @return {@code <source>:<32자리 hex>}
     */
    public static String newPipelineId(String source) {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source cannot be null or blank");
        }
        return source + ":" + UUID.randomUUID().toString().replace("-", "");
    }

    static Map<String, Object> baseMap(PipelineEvent event) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", event.type());
        map.put("pipeline_id", event.pipelineId());
        map.put("timestamp", event.timestamp() == null ? null : event.timestamp().toString());
        return map;
    }

    static String fillId(String current, String pipelineId) {
        return current != null ? current : pipelineId;
    }

    static Instant fillTime(Instant current, Instant now) {
        return current != null ? current : now;
    }
}
