package com.medkg.ingestion.application.orchestrator;

import com.medkg.ingestion.core.event.PipelineEvent;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * 스트리밍 수집 요청 (불변 record).
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * StreamRequest request = StreamRequest.of("pubmed")
 *     .withParams(List.of(Map.of("term", "cancer")))
 *     .withConfig(new StreamConfig().withBufferSize(10))
 *     .withCompletedIds(previousCheckpointIds);
 * </pre>
 *
 * @author Ingestion Team
 * @since 1.0.0
 * @param source 소스 이름 (공백 불가)
 * @param params 어댑터 호출 파라미터 목록 (비어 있으면 파라미터 없이 1회 호출)
 * @param resume Ledger 기준 완료 문서를 건너뛸지 여부 (어댑터에 전달)
 * @param config 큐와 진행률 설정
 * @param eventFilter 큐에 넣을 이벤트 선택
 * @param eventTransformer 큐에 넣기 전 변환
 * @param completedIds 이전 체크포인트에서 완료된 문서 ID (건너뜀)
 * @param totalEstimated 전체 문서 수 추정 (nullable)
 */
public record StreamRequest(
    String source,
    List<Map<String, Object>> params,
    boolean resume,
    StreamConfig config,
    Predicate<PipelineEvent> eventFilter,
    EventTransformer eventTransformer,
    Set<String> completedIds,
    Integer totalEstimated
) {

    public StreamRequest {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source cannot be null or blank");
        }
        params = params == null ? List.of() : List.copyOf(params);
        config = config == null ? new StreamConfig() : config;
        eventFilter = eventFilter == null ? EventFilters.all() : eventFilter;
        eventTransformer = eventTransformer == null ? EventTransformer.identity() : eventTransformer;
        completedIds = completedIds == null ? Set.of() : Set.copyOf(completedIds);
        if (totalEstimated != null && totalEstimated < 0) {
            throw new IllegalArgumentException("totalEstimated must be non-negative (current: " + totalEstimated + ")");
        }
    }

    /**
     * 기본 설정의 요청 생성.
     *
     * @param source 소스 이름
     */
    public static StreamRequest of(String source) {
        return new StreamRequest(source, null, false, null, null, null, null, null);
    }

    /**
     * 실제로 수행할 호출 목록 (파라미터가 없으면 빈 Map 1개).
     */
    public List<Map<String, Object>> invocations() {
        return params.isEmpty() ? List.of(Map.of()) : params;
    }

    public StreamRequest withParams(List<Map<String, Object>> params) {
        return new StreamRequest(source, params, resume, config, eventFilter, eventTransformer, completedIds, totalEstimated);
    }

    public StreamRequest withResume(boolean resume) {
        return new StreamRequest(source, params, resume, config, eventFilter, eventTransformer, completedIds, totalEstimated);
    }

    public StreamRequest withConfig(StreamConfig config) {
        return new StreamRequest(source, params, resume, config, eventFilter, eventTransformer, completedIds, totalEstimated);
    }

    public StreamRequest withEventFilter(Predicate<PipelineEvent> eventFilter) {
        return new StreamRequest(source, params, resume, config, eventFilter, eventTransformer, completedIds, totalEstimated);
    }

    public StreamRequest withEventTransformer(EventTransformer eventTransformer) {
        return new StreamRequest(source, params, resume, config, eventFilter, eventTransformer, completedIds, totalEstimated);
    }

    public StreamRequest withCompletedIds(Set<String> completedIds) {
        return new StreamRequest(source, params, resume, config, eventFilter, eventTransformer, completedIds, totalEstimated);
    }

    public StreamRequest withTotalEstimated(Integer totalEstimated) {
        return new StreamRequest(source, params, resume, config, eventFilter, eventTransformer, completedIds, totalEstimated);
    }
}
