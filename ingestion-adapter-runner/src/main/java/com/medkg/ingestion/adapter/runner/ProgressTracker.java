package com.medkg.ingestion.adapter.runner;

import com.medkg.ingestion.application.orchestrator.StreamConfig;
import com.medkg.ingestion.core.event.BatchProgress;

import java.util.ArrayList;
import java.util.List;

/**
 * 한 파이프라인 실행의 진행률 집계기.
 *
 * <p>생산자 스레드 하나만 사용하므로 동기화하지 않습니다.</p>
 *
 * <p><strong>집계 항목:</strong></p>
 * <ul>
 *   <li>완료/실패/진행 중 문서 수</li>
 *   <li>직전 체크포인트 이후 완료된 문서 ID</li>
 *   <li>backpressure 대기 시간과 횟수</li>
 *   <li>totalEstimated 기반 remaining, ETA</li>
 * </ul>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
final class ProgressTracker {

    private final StreamConfig config;
    private final Integer totalEstimated;
    private final long startedNanos;

    private int completedCount;
    private int failedCount;
    private int inFlightCount;
    private long backpressureWaitNanos;
    private int backpressureWaitCount;
    private List<String> pendingCheckpointIds = new ArrayList<>();

    ProgressTracker(StreamConfig config, Integer totalEstimated, long startedNanos) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.totalEstimated = totalEstimated;
        this.startedNanos = startedNanos;
    }

    void documentStarted() {
        inFlightCount++;
    }

    /**
     * 문서 완료 기록.
     *
     * @return 이번 완료로 진행률 이벤트를 내야 하는지
     */
    boolean documentCompleted(String docId) {
        inFlightCount = Math.max(0, inFlightCount - 1);
        completedCount++;
        pendingCheckpointIds.add(docId);
        return completedCount % config.progressInterval() == 0 || checkpointDue();
    }

    void documentFailed() {
        inFlightCount = Math.max(0, inFlightCount - 1);
        failedCount++;
    }

    boolean checkpointDue() {
        return completedCount > 0 && completedCount % config.checkpointInterval() == 0;
    }

    void backpressureWaited(long nanos) {
        backpressureWaitNanos += nanos;
        backpressureWaitCount++;
    }

    int completedCount() {
        return completedCount;
    }

    int failedCount() {
        return failedCount;
    }

    /**
     * 진행률 이벤트 생성. 체크포인트면 직전 체크포인트 이후의 문서 ID를 담고 목록을 비웁니다.
     *
     * @param queueDepth 현재 큐 깊이
     * @param checkpoint 체크포인트 여부
     * @param nowNanos 현재 {@code System.nanoTime()}
     */
    BatchProgress snapshot(int queueDepth, boolean checkpoint, long nowNanos) {
        List<String> checkpointIds = List.of();
        if (checkpoint) {
            checkpointIds = pendingCheckpointIds;
            pendingCheckpointIds = new ArrayList<>();
        }

        Integer remaining = null;
        Double etaSeconds = null;
        if (totalEstimated != null) {
            remaining = Math.max(0, totalEstimated - completedCount - failedCount);
            double elapsedSeconds = (nowNanos - startedNanos) / 1_000_000_000.0;
            int processed = completedCount + failedCount;
            if (processed > 0) {
                etaSeconds = remaining * (elapsedSeconds / processed);
            }
        }

        return new BatchProgress(
            null,
            null,
            completedCount,
            failedCount,
            inFlightCount,
            queueDepth,
            config.bufferSize(),
            remaining,
            etaSeconds,
            backpressureWaitNanos / 1_000_000_000.0,
            backpressureWaitCount,
            checkpointIds,
            checkpoint
        );
    }
}
