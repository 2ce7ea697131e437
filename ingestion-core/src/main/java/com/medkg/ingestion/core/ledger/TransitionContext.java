package com.medkg.ingestion.core.ledger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 상태 전이에 함께 기록되는 부가 정보.
 *
 * @author Ingestion Team
 * @since 1.0.0
 * @param adapter 어댑터 이름 (nullable)
 * @param metadata 메타데이터
 * @param parameters 어댑터 호출 파라미터
 * @param retryCount 재시도 횟수 (nullable)
 * @param durationSeconds 소요 시간 (nullable, 없으면 Ledger가 계산)
 * @param errorType 오류 타입 (nullable)
 * @param errorMessage 오류 메시지 (nullable)
 */
public record TransitionContext(
    String adapter,
    Map<String, Object> metadata,
    Map<String, Object> parameters,
    Integer retryCount,
    Double durationSeconds,
    String errorType,
    String errorMessage
) {

    private static final TransitionContext EMPTY =
        new TransitionContext(null, Map.of(), Map.of(), null, null, null, null);

    public TransitionContext {
        metadata = copy(metadata);
        parameters = copy(parameters);
        if (retryCount != null && retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be non-negative (current: " + retryCount + ")");
        }
    }

    /**
     * 부가 정보가 없는 컨텍스트.
     */
    public static TransitionContext empty() {
        return EMPTY;
    }

    /**
     * 어댑터 이름만 지정한 컨텍스트.
     */
    public static TransitionContext ofAdapter(String adapter) {
        return EMPTY.withAdapter(adapter);
    }

    public TransitionContext withAdapter(String adapter) {
        return new TransitionContext(adapter, metadata, parameters, retryCount, durationSeconds, errorType, errorMessage);
    }

    public TransitionContext withMetadata(Map<String, Object> metadata) {
        return new TransitionContext(adapter, metadata, parameters, retryCount, durationSeconds, errorType, errorMessage);
    }

    public TransitionContext withParameters(Map<String, Object> parameters) {
        return new TransitionContext(adapter, metadata, parameters, retryCount, durationSeconds, errorType, errorMessage);
    }

    public TransitionContext withRetryCount(Integer retryCount) {
        return new TransitionContext(adapter, metadata, parameters, retryCount, durationSeconds, errorType, errorMessage);
    }

    public TransitionContext withDurationSeconds(Double durationSeconds) {
        return new TransitionContext(adapter, metadata, parameters, retryCount, durationSeconds, errorType, errorMessage);
    }

    /**
     * 오류 정보를 지정한 새 인스턴스 생성.
     */
    public TransitionContext withError(String errorType, String errorMessage) {
        return new TransitionContext(adapter, metadata, parameters, retryCount, durationSeconds, errorType, errorMessage);
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
