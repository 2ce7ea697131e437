package com.medkg.ingestion.adapter.micrometer;

import com.medkg.ingestion.core.metrics.IngestionMetrics;
import com.medkg.ingestion.core.statemachine.LedgerState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer 기반 {@link IngestionMetrics} 구현.
 *
 * <p><strong>Ledger 지표:</strong></p>
 * <ul>
 *   <li>{@code ingest.ledger.transitions} (counter, from/to)</li>
 *   <li>{@code ingest.ledger.errors} (counter, type)</li>
 *   <li>{@code ingest.ledger.initialization} (timer, method=full|snapshot)</li>
 *   <li>{@code ingest.ledger.documents} (gauge, state)</li>
 *   <li>{@code ingest.ledger.stuck} (gauge, state)</li>
 *   <li>{@code ingest.ledger.state.duration} (timer, state)</li>
 * </ul>
 *
 * <p><strong>파이프라인 지표:</strong></p>
 * <ul>
 *   <li>{@code ingest.pipeline.events} (counter, type)</li>
 *   <li>{@code ingest.pipeline.duration} (timer, source)</li>
 *   <li>{@code ingest.pipeline.queue.depth} (gauge)</li>
 *   <li>{@code ingest.pipeline.checkpoint.latency} (timer)</li>
 *   <li>{@code ingest.pipeline.consumption} (counter, mode)</li>
 *   <li>{@code ingest.http.retries} (counter, adapter)</li>
 * </ul>
 *
 * <p>상태별 gauge는 생성 시 모든 {@link LedgerState}에 대해 0으로 등록됩니다.</p>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public final class MicrometerIngestionMetrics implements IngestionMetrics {

    private final MeterRegistry registry;

    private final Map<LedgerState, AtomicInteger> documentsByState;
    private final Map<LedgerState, AtomicInteger> stuckByState;
    private final AtomicInteger queueDepth;
    private final Timer checkpointLatency;

    public MicrometerIngestionMetrics(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
        this.documentsByState = registerStateGauges("ingest.ledger.documents", "Documents currently in each ledger state");
        this.stuckByState = registerStateGauges("ingest.ledger.stuck", "Documents exceeding the stuck threshold per state");

        this.queueDepth = new AtomicInteger();
        Gauge.builder("ingest.pipeline.queue.depth", queueDepth, AtomicInteger::get)
            .description("Events waiting in the pipeline queue")
            .register(registry);

        this.checkpointLatency = Timer.builder("ingest.pipeline.checkpoint.latency")
            .description("Time between consecutive pipeline checkpoints")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry);
    }

    private Map<LedgerState, AtomicInteger> registerStateGauges(String name, String description) {
        Map<LedgerState, AtomicInteger> gauges = new EnumMap<>(LedgerState.class);
        for (LedgerState state : LedgerState.values()) {
            AtomicInteger value = new AtomicInteger();
            Gauge.builder(name, value, AtomicInteger::get)
                .description(description)
                .tag("state", state.name())
                .register(registry);
            gauges.put(state, value);
        }
        return Collections.unmodifiableMap(gauges);
    }

    // ==================== Ledger ====================

    @Override
    public void recordTransition(LedgerState from, LedgerState to) {
        Counter.builder("ingest.ledger.transitions")
            .description("Ledger state transitions")
            .tag("from", stateTag(from))
            .tag("to", stateTag(to))
            .register(registry)
            .increment();
    }

    @Override
    public void recordLedgerError(String type) {
        registry.counter("ingest.ledger.errors", "type", sanitizeTag(type)).increment();
    }

    @Override
    public void recordLedgerLoad(String method, Duration duration) {
        Timer.builder("ingest.ledger.initialization")
            .description("Time taken to load the ledger")
            .tag("method", sanitizeTag(method))
            .register(registry)
            .record(duration);
    }

    @Override
    public void updateStateDistribution(Map<LedgerState, Integer> counts) {
        setAll(documentsByState, counts);
    }

    @Override
    public void updateStuckDocuments(Map<LedgerState, Integer> counts) {
        setAll(stuckByState, counts);
    }

    @Override
    public void recordStateDuration(LedgerState state, Duration duration) {
        Timer.builder("ingest.ledger.state.duration")
            .description("Time a document spent in a state before leaving it")
            .tag("state", stateTag(state))
            .register(registry)
            .record(duration);
    }

    // ==================== Pipeline ====================

    @Override
    public void recordEvent(String eventType) {
        registry.counter("ingest.pipeline.events", "type", sanitizeTag(eventType)).increment();
    }

    @Override
    public void recordQueueDepth(int depth) {
        queueDepth.set(depth);
    }

    @Override
    public void recordPipelineDuration(String source, Duration duration) {
        Timer.builder("ingest.pipeline.duration")
            .description("Wall time of a pipeline run")
            .tag("source", sanitizeTag(source))
            .register(registry)
            .record(duration);
    }

    @Override
    public void recordCheckpointLatency(Duration latency) {
        checkpointLatency.record(latency);
    }

    @Override
    public void recordConsumptionMode(String mode) {
        registry.counter("ingest.pipeline.consumption", "mode", sanitizeTag(mode)).increment();
    }

    @Override
    public void recordTransportRetry(String adapter) {
        registry.counter("ingest.http.retries", "adapter", sanitizeTag(adapter)).increment();
    }

    // ==================== Helper Methods ====================

    private static void setAll(Map<LedgerState, AtomicInteger> gauges, Map<LedgerState, Integer> counts) {
        for (Map.Entry<LedgerState, AtomicInteger> gauge : gauges.entrySet()) {
            Integer count = counts == null ? null : counts.get(gauge.getKey());
            gauge.getValue().set(count == null ? 0 : count);
        }
    }

    private static String stateTag(LedgerState state) {
        return state == null ? "unknown" : state.name();
    }

    /**
     * 태그 카디널리티 제한: 영숫자와 {@code _ - . :}만 남기고 50자로 자릅니다.
     */
    static String sanitizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_.:-]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
