package com.medkg.ingestion.testkit.contract;

import com.medkg.ingestion.core.event.PipelineEvent;
import com.medkg.ingestion.core.ledger.TransitionContext;
import com.medkg.ingestion.core.model.Document;
import com.medkg.ingestion.core.model.IngestionResult;
import com.medkg.ingestion.core.spi.Adapter;
import com.medkg.ingestion.core.spi.AdapterContext;
import com.medkg.ingestion.core.spi.AdapterException;
import com.medkg.ingestion.core.spi.HttpTransport;
import com.medkg.ingestion.core.spi.Ledger;
import com.medkg.ingestion.core.statemachine.LedgerState;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * 스크립트대로 문서를 내는 {@link Adapter}.
 *
 * <p><strong>스크립트:</strong></p>
 * <ul>
 *   <li>{@link #invocation(String...)}: 호출 순서대로 낼 문서 ID 목록 (스크립트보다 호출이 많으면 빈 결과)</li>
 *   <li>{@link #failAt(int, String, RuntimeException)}: 해당 호출에서 주어진 문서 차례에 예외</li>
 *   <li>{@link #endless()}: 모든 호출이 끝없이 문서를 냄</li>
 *   <li>{@link #withDelayPerDocument(Duration)}: 문서마다 인터럽트 가능한 대기</li>
 *   <li>{@link #withLedgerTracking()}: 문서를 내기 전에 Ledger에 처리 단계를 기록</li>
 *   <li>{@link #retryBefore(String, int)}: 문서를 내기 전에 transport 재시도를 흉내 냄</li>
 * </ul>
 *
 * <p><strong>Ledger 추적 흐름 (문서 하나):</strong></p>
 * <pre>
 * (FAILED → RETRYING →) FETCHING → FETCHED → PARSING → PARSED → VALIDATING
 *   → VALIDATED → IR_BUILDING → IR_READY → COMPLETED → yield
 * 실패 지점 문서: FETCHING까지만 기록한 뒤 예외
 * 이미 COMPLETED인 문서: Ledger는 건드리지 않고 그대로 yield
 * </pre>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public class FakeAdapter implements Adapter {

    private static final List<LedgerState> PROCESSING_STEPS = List.of(
        LedgerState.FETCHED,
        LedgerState.PARSING,
        LedgerState.PARSED,
        LedgerState.VALIDATING,
        LedgerState.VALIDATED,
        LedgerState.IR_BUILDING,
        LedgerState.IR_READY,
        LedgerState.COMPLETED
    );

    private final String name;
    private final List<List<String>> scripts = new ArrayList<>();
    private final List<Failure> failures = new ArrayList<>();
    private final Map<String, Integer> retriesBefore = new HashMap<>();
    private final List<Map<String, Object>> invocations = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    private boolean endless;
    private boolean trackLedger;
    private Duration delayPerDocument = Duration.ZERO;
    private volatile Ledger ledger;
    private volatile HttpTransport transport;
    private volatile Consumer<PipelineEvent> emitter;

    public FakeAdapter(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
    }

    // ==================== Script ====================

    public FakeAdapter invocation(String... docIds) {
        scripts.add(List.of(docIds));
        return this;
    }

    /**
     * 호출 {@code invocationIndex}(0부터)에서 {@code docId} 차례가 오면 error를 던집니다.
     */
    public FakeAdapter failAt(int invocationIndex, String docId, RuntimeException error) {
        if (invocationIndex < 0) {
            throw new IllegalArgumentException("invocationIndex must be non-negative (current: " + invocationIndex + ")");
        }
        failures.add(new Failure(invocationIndex, docId, error));
        return this;
    }

    /**
     * {@link AdapterException}으로 실패시키는 편의 메서드.
     */
    public FakeAdapter failAt(int invocationIndex, String docId, String message) {
        return failAt(invocationIndex, docId, new AdapterException(message, docId, 0, false));
    }

    public FakeAdapter endless() {
        this.endless = true;
        return this;
    }

    public FakeAdapter withDelayPerDocument(Duration delay) {
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must be non-negative (current: " + delay + ")");
        }
        this.delayPerDocument = delay;
        return this;
    }

    /**
     * {@code docId}를 내기 전에 {@link RecordingHttpTransport}의 재시도 리스너를 {@code attempts}번 호출합니다.
     */
    public FakeAdapter retryBefore(String docId, int attempts) {
        if (attempts <= 0) {
            throw new IllegalArgumentException("attempts must be positive (current: " + attempts + ")");
        }
        retriesBefore.put(docId, attempts);
        return this;
    }

    public FakeAdapter withLedgerTracking() {
        this.trackLedger = true;
        return this;
    }

    // ==================== Adapter ====================

    void attach(AdapterContext context, HttpTransport transport) {
        this.ledger = context == null ? null : context.ledger();
        this.transport = transport;
        closed.set(false);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Iterable<IngestionResult> iterResults(Map<String, Object> params, boolean resume) {
        int index = invocations.size();
        invocations.add(params);
        if (endless) {
            return () -> new EndlessIterator(index);
        }
        List<String> docIds = index < scripts.size() ? scripts.get(index) : List.of();
        return () -> new ScriptIterator(index, docIds);
    }

    @Override
    public void bindEventEmitter(Consumer<PipelineEvent> emitter) {
        this.emitter = emitter;
    }

    /**
     * 바인딩된 이미터로 이벤트를 보냄. 이미터가 없으면 false.
     */
    public boolean emit(PipelineEvent event) {
        Consumer<PipelineEvent> current = emitter;
        if (current == null) {
            return false;
        }
        current.accept(event);
        return true;
    }

    @Override
    public void close() {
        closed.set(true);
    }

    public int invocationCount() {
        return invocations.size();
    }

    public List<Map<String, Object>> invocations() {
        return List.copyOf(invocations);
    }

    public boolean isClosed() {
        return closed.get();
    }

    public boolean hasEmitter() {
        return emitter != null;
    }

    // ==================== Helper Methods ====================

    private IngestionResult produce(int invocationIndex, String docId) {
        pause();
        simulateRetries(docId);
        Optional<RuntimeException> failure = failureFor(invocationIndex, docId);
        if (trackLedger) {
            track(docId, failure.isPresent());
        }
        if (failure.isPresent()) {
            throw failure.get();
        }
        Document document = new Document(docId, name, "content of " + docId, Map.of("invocation", invocationIndex), null);
        return new IngestionResult(document, LedgerState.COMPLETED, null, Map.of("adapter", name));
    }

    private Optional<RuntimeException> failureFor(int invocationIndex, String docId) {
        for (Failure failure : failures) {
            if (failure.invocationIndex() == invocationIndex && failure.docId().equals(docId)) {
                return Optional.of(failure.error());
            }
        }
        return Optional.empty();
    }

    private void simulateRetries(String docId) {
        Integer attempts = retriesBefore.get(docId);
        if (attempts == null) {
            return;
        }
        if (!(transport instanceof RecordingHttpTransport recording)) {
            throw new IllegalStateException("Retry simulation requires a RecordingHttpTransport");
        }
        for (int attempt = 1; attempt <= attempts; attempt++) {
            recording.simulateRetry(attempt, "HTTP 503 for " + docId, 503);
        }
    }

    private void track(String docId, boolean failing) {
        Ledger current = ledger;
        if (current == null) {
            throw new IllegalStateException("Ledger tracking requires an AdapterContext");
        }
        Optional<LedgerState> state = current.getState(docId);
        if (state.isPresent() && state.get() == LedgerState.COMPLETED) {
            return;
        }
        TransitionContext context = TransitionContext.ofAdapter(name);
        if (state.isPresent() && state.get() == LedgerState.FAILED) {
            current.updateState(docId, LedgerState.RETRYING, context);
        }
        current.updateState(docId, LedgerState.FETCHING, context);
        if (failing) {
            return;
        }
        for (LedgerState step : PROCESSING_STEPS) {
            current.updateState(docId, step, context);
        }
    }

    private void pause() {
        if (delayPerDocument.isZero()) {
            return;
        }
        try {
            Thread.sleep(delayPerDocument.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Adapter " + name + " interrupted");
        }
    }

    private record Failure(int invocationIndex, String docId, RuntimeException error) {

        private Failure {
            if (docId == null || error == null) {
                throw new IllegalArgumentException("docId and error cannot be null");
            }
        }
    }

    private final class ScriptIterator implements Iterator<IngestionResult> {

        private final int invocationIndex;
        private final Iterator<String> docIds;

        private ScriptIterator(int invocationIndex, List<String> docIds) {
            this.invocationIndex = invocationIndex;
            this.docIds = docIds.iterator();
        }

        @Override
        public boolean hasNext() {
            return docIds.hasNext();
        }

        @Override
        public IngestionResult next() {
            if (!docIds.hasNext()) {
                throw new NoSuchElementException();
            }
            return produce(invocationIndex, docIds.next());
        }
    }

    private final class EndlessIterator implements Iterator<IngestionResult> {

        private final int invocationIndex;
        private long sequence;

        private EndlessIterator(int invocationIndex) {
            this.invocationIndex = invocationIndex;
        }

        @Override
        public boolean hasNext() {
            return true;
        }

        @Override
        public IngestionResult next() {
            return produce(invocationIndex, name + "-" + invocationIndex + "-" + sequence++);
        }
    }
}
