package com.medkg.ingestion.core.event;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 진행률 보고 또는 체크포인트.
 *
 * <p>{@code checkpoint}가 true이면 {@code checkpointDocIds}는 직전 체크포인트 이후
 * 완료된 문서 ID이며, 재개 시 {@code completedIds}로 전달할 수 있습니다.</p>
 *
 * @author Ingestion Team
 * @since 1.0.0
 * @param pipelineId 파이프라인 ID
 * @param timestamp 발생 시각
 * @param completedCount 누적 완료 수
 * @param failedCount 누적 실패 수
 * @param inFlightCount 처리 중인 문서 수
 * @param queueDepth 보고 시점의 큐 깊이
 * @param bufferSize 큐 용량
 * @param remaining 남은 문서 수 추정 (총량을 모르면 null)
 * @param etaSeconds 남은 시간 추정 (nullable)
 * @param backpressureWaitSeconds 생산자가 큐 공간을 기다린 누적 시간
 * @param backpressureWaitCount 생산자가 큐 공간을 기다린 횟수
 * @param checkpointDocIds 체크포인트에 포함된 문서 ID
 * @param checkpoint 체크포인트 여부
 */
public record BatchProgress(
    String pipelineId,
    Instant timestamp,
    int completedCount,
    int failedCount,
    int inFlightCount,
    int queueDepth,
    int bufferSize,
    Integer remaining,
    Double etaSeconds,
    double backpressureWaitSeconds,
    int backpressureWaitCount,
    List<String> checkpointDocIds,
    boolean checkpoint
) implements PipelineEvent {

    public BatchProgress {
        if (completedCount < 0 || failedCount < 0 || inFlightCount < 0) {
            throw new IllegalArgumentException(
                "counts must be non-negative (completed: " + completedCount
                    + ", failed: " + failedCount + ", inFlight: " + inFlightCount + ")"
            );
        }
        if (backpressureWaitSeconds < 0) {
            throw new IllegalArgumentException(
                "backpressureWaitSeconds must be non-negative (current: " + backpressureWaitSeconds + ")"
            );
        }
        checkpointDocIds = checkpointDocIds == null ? List.of() : List.copyOf(checkpointDocIds);
    }

    @Override
    public BatchProgress withPipelineContext(String pipelineId, Instant now) {
        if (this.pipelineId != null && this.timestamp != null) {
            return this;
        }
        return new BatchProgress(
            PipelineEvents.fillId(this.pipelineId, pipelineId),
            PipelineEvents.fillTime(this.timestamp, now),
            completedCount, failedCount, inFlightCount, queueDepth, bufferSize,
            remaining, etaSeconds, backpressureWaitSeconds, backpressureWaitCount,
            checkpointDocIds, checkpoint
        );
    }

    @Override
    public Map<String, Object> toMap() {
        Map<String, Object> map = PipelineEvents.baseMap(this);
        map.put("completed_count", completedCount);
        map.put("failed_count", failedCount);
        map.put("in_flight_count", inFlightCount);
        map.put("queue_depth", queueDepth);
        map.put("buffer_size", bufferSize);
        map.put("remaining", remaining);
        map.put("eta_seconds", etaSeconds);
        map.put("backpressure_wait_seconds", backpressureWaitSeconds);
        map.put("backpressure_wait_count", backpressureWaitCount);
        map.put("checkpoint_doc_ids", checkpointDocIds);
        map.put("is_checkpoint", checkpoint);
        return map;
    }
}
