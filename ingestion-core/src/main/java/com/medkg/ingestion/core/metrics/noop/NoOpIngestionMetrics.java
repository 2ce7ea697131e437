package com.medkg.ingestion.core.metrics.noop;

import com.medkg.ingestion.core.metrics.IngestionMetrics;
import com.medkg.ingestion.core.statemachine.LedgerState;

import java.time.Duration;
import java.util.Map;

/**
 * IngestionMetrics NoOp 구현.
 *
 * <p>아무것도 기록하지 않습니다. 지표 백엔드 없이 실행하거나 테스트에서 사용합니다.</p>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public final class NoOpIngestionMetrics implements IngestionMetrics {

    @Override
    public void recordTransition(LedgerState from, LedgerState to) {
        // NoOp
    }

    @Override
    public void recordLedgerError(String type) {
        // NoOp
    }

    @Override
    public void recordLedgerLoad(String method, Duration duration) {
        // NoOp
    }

    @Override
    public void updateStateDistribution(Map<LedgerState, Integer> counts) {
        // NoOp
    }

    @Override
    public void updateStuckDocuments(Map<LedgerState, Integer> counts) {
        // NoOp
    }

    @Override
    public void recordStateDuration(LedgerState state, Duration duration) {
        // NoOp
    }

    @Override
    public void recordEvent(String eventType) {
        // NoOp
    }

    @Override
    public void recordQueueDepth(int depth) {
        // NoOp
    }

    @Override
    public void recordPipelineDuration(String source, Duration duration) {
        // NoOp
    }

    @Override
    public void recordCheckpointLatency(Duration latency) {
        // NoOp
    }

    @Override
    public void recordConsumptionMode(String mode) {
        // NoOp
    }

    @Override
    public void recordTransportRetry(String adapter) {
        // NoOp
    }
}
