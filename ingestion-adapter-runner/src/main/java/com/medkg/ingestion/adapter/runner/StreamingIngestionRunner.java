package com.medkg.ingestion.adapter.runner;

import com.medkg.ingestion.application.orchestrator.EventStream;
import com.medkg.ingestion.application.orchestrator.IngestionStreamException;
import com.medkg.ingestion.application.orchestrator.PipelineRunResult;
import com.medkg.ingestion.application.orchestrator.ResultStream;
import com.medkg.ingestion.application.orchestrator.StreamRequest;
import com.medkg.ingestion.application.orchestrator.StreamingOrchestrator;
import com.medkg.ingestion.core.event.AdapterLifecycle;
import com.medkg.ingestion.core.event.AdapterRetry;
import com.medkg.ingestion.core.event.AdapterStateChange;
import com.medkg.ingestion.core.event.BatchProgress;
import com.medkg.ingestion.core.event.DocumentCompleted;
import com.medkg.ingestion.core.event.DocumentFailed;
import com.medkg.ingestion.core.event.DocumentStarted;
import com.medkg.ingestion.core.event.PipelineEvent;
import com.medkg.ingestion.core.event.PipelineEvents;
import com.medkg.ingestion.core.ledger.LedgerException;
import com.medkg.ingestion.core.ledger.TransitionContext;
import com.medkg.ingestion.core.metrics.IngestionMetrics;
import com.medkg.ingestion.core.metrics.noop.NoOpIngestionMetrics;
import com.medkg.ingestion.core.model.Document;
import com.medkg.ingestion.core.model.IngestionResult;
import com.medkg.ingestion.core.spi.Adapter;
import com.medkg.ingestion.core.spi.AdapterContext;
import com.medkg.ingestion.core.spi.AdapterException;
import com.medkg.ingestion.core.spi.AdapterRegistry;
import com.medkg.ingestion.core.spi.HttpTransport;
import com.medkg.ingestion.core.spi.Ledger;
import com.medkg.ingestion.core.statemachine.LedgerState;
import com.medkg.ingestion.core.statemachine.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

/**
 * 유계 큐 기반 스트리밍 수집 오케스트레이터.
 *
 * <p>호출마다 전용 생산자 스레드를 띄워 어댑터 결과를 이벤트로 바꿔
 * {@code ArrayBlockingQueue(bufferSize)}에 넣고, 호출자 스레드가 소비합니다.</p>
 *
 * <p><strong>생산자 흐름:</strong></p>
 * <pre>
 * try (transport = transportFactory.get();
 *      adapter = registry.getAdapter(source, ctx, transport)) {
 *   AdapterStateChange(→ INITIALISING), (→ READY)
 *   for params in request.invocations():
 *     AdapterStateChange(→ INVOCATION_STARTED)
 *     for result in adapter.iterResults(params, resume):
 *       completedIds에 있으면 skip
 *       DocumentStarted → DocumentCompleted
 *       progressInterval마다 BatchProgress, checkpointInterval마다 체크포인트
 *     어댑터 예외 → (가능하면 Ledger → FAILED) DocumentFailed, AdapterStateChange(→ FAILED), 중단
 *     AdapterStateChange(→ INVOCATION_COMPLETED)
 *   AdapterStateChange(→ COMPLETED)
 * } finally {
 *   마지막 체크포인트 (항상), 종료 표시
 * }
 * </pre>
 *
 * <p><strong>Backpressure:</strong> 먼저 {@code offer}를 시도하고, 큐가 가득 차면
 * 블로킹 {@code put}의 대기 시간을 측정해 {@code backpressureWaitSeconds}와
 * {@code backpressureWaitCount}에 누적합니다.</p>
 *
 * <p><strong>취소:</strong> 스트림을 닫으면 생산자 스레드를 인터럽트하고 종료를 기다립니다.
 * 자원은 생산자의 try-with-resources에서 해제되며, 마지막 체크포인트는
 * {@link EventStream#finalCheckpoint()}로 조회할 수 있습니다.</p>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public final class StreamingIngestionRunner implements StreamingOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(StreamingIngestionRunner.class);

    private final AdapterRegistry registry;
    private final Ledger ledger;
    private final Supplier<? extends HttpTransport> transportFactory;
    private final IngestionMetrics metrics;
    private final Clock clock;

    /**
     * 생성자 (지표 없음, 시스템 시계).
     *
     * @param registry 어댑터 레지스트리
     * @param ledger 문서 Ledger
     * @param transportFactory 실행마다 새 HttpTransport를 만드는 팩토리
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StreamingIngestionRunner(AdapterRegistry registry, Ledger ledger, Supplier<? extends HttpTransport> transportFactory) {
        this(registry, ledger, transportFactory, new NoOpIngestionMetrics(), Clock.systemUTC());
    }

    /**
     * 생성자 (지표와 시계 주입).
     *
     * @param registry 어댑터 레지스트리
     * @param ledger 문서 Ledger
     * @param transportFactory 실행마다 새 HttpTransport를 만드는 팩토리
     * @param metrics 지표
     * @param clock 이벤트 타임스탬프용 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StreamingIngestionRunner(
        AdapterRegistry registry,
        Ledger ledger,
        Supplier<? extends HttpTransport> transportFactory,
        IngestionMetrics metrics,
        Clock clock
    ) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        if (transportFactory == null) {
            throw new IllegalArgumentException("transportFactory cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.registry = registry;
        this.ledger = ledger;
        this.transportFactory = transportFactory;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public EventStream streamEvents(StreamRequest request) {
        BoundedEventStream stream = start(request);
        metrics.recordConsumptionMode("stream_events");
        return stream;
    }

    @Override
    public PipelineRunResult run(StreamRequest request) {
        BoundedEventStream stream = start(request);
        metrics.recordConsumptionMode("run");
        Instant startedAt = clock.instant();

        List<Document> documents = new ArrayList<>();
        List<DocumentFailed> failures = new ArrayList<>();
        List<PipelineEvent> events = new ArrayList<>();
        try (stream) {
            while (stream.hasNext()) {
                PipelineEvent event = stream.next();
                events.add(event);
                if (event instanceof DocumentCompleted completed) {
                    documents.add(completed.document());
                } else if (event instanceof DocumentFailed failed) {
                    failures.add(failed);
                }
            }
        }
        PipelineRunResult result = new PipelineRunResult(
            stream.pipelineId(), request.source(), documents, failures, events,
            stream.finalCheckpoint(), startedAt, clock.instant()
        );
        log.info("Pipeline {} finished: {} documents, {} failures",
            result.pipelineId(), result.successCount(), result.failureCount());
        return result;
    }

    /**
     * {@inheritDoc}
     *
     * <p>{@link DocumentFailed}를 만나면 {@link IngestionStreamException}을 던집니다.</p>
     */
    @Override
    public ResultStream<Document> iterResults(StreamRequest request) {
        BoundedEventStream stream = start(request);
        metrics.recordConsumptionMode("iter_results");
        return new DocumentResultStream(stream);
    }

    private BoundedEventStream start(StreamRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (!registry.supports(request.source())) {
            throw new IllegalArgumentException(
                "Unknown adapter source: '" + request.source() + "' (available: " + registry.availableSources() + ")"
            );
        }

        String pipelineId = PipelineEvents.newPipelineId(request.source());
        BoundedEventStream stream = new BoundedEventStream(pipelineId, request.config().bufferSize());
        Thread producer = new Thread(new PipelineProducer(pipelineId, request, stream), "ingest-producer-" + pipelineId);
        producer.setDaemon(true);
        stream.attach(producer);
        producer.start();
        log.info("Pipeline {} started (source={}, invocations={}, resume={})",
            pipelineId, request.source(), request.invocations().size(), request.resume());
        return stream;
    }

    /**
     * 한 실행의 생산자. 생산자 스레드에서만 실행됩니다.
     */
    private final class PipelineProducer implements Runnable {

        private final String pipelineId;
        private final StreamRequest request;
        private final BoundedEventStream stream;
        private final ProgressTracker tracker;
        private final long startedNanos;
        private long lastCheckpointNanos;
        private String adapterName;
        private AdapterLifecycle adapterState;

        PipelineProducer(String pipelineId, StreamRequest request, BoundedEventStream stream) {
            this.pipelineId = pipelineId;
            this.request = request;
            this.stream = stream;
            this.startedNanos = System.nanoTime();
            this.lastCheckpointNanos = startedNanos;
            this.tracker = new ProgressTracker(request.config(), request.totalEstimated(), startedNanos);
        }

        @Override
        public void run() {
            Throwable unexpected = null;
            try {
                produce();
            } catch (CancellationException e) {
                log.info("Pipeline {} cancelled after {} documents", pipelineId, tracker.completedCount());
            } catch (RuntimeException | Error e) {
                // the consumer sees this as IngestionStreamException, never as a normal end
                log.error("Pipeline {} aborted by an unexpected error", pipelineId, e);
                unexpected = e;
            } finally {
                finish(unexpected);
            }
        }

        private void produce() {
            try (HttpTransport transport = transportFactory.get();
                 Adapter adapter = registry.getAdapter(request.source(), new AdapterContext(ledger), transport)) {
                adapterName = adapter.name();
                transport.bindRetryListener(this::onTransportRetry);
                adapter.bindEventEmitter(this::emitFromAdapter);
                try {
                    changeAdapterState(AdapterLifecycle.INITIALISING, null);
                    changeAdapterState(AdapterLifecycle.READY, null);
                    for (Map<String, Object> params : request.invocations()) {
                        changeAdapterState(AdapterLifecycle.INVOCATION_STARTED, null);
                        if (!consume(adapter, params)) {
                            return;
                        }
                        changeAdapterState(AdapterLifecycle.INVOCATION_COMPLETED, null);
                    }
                    changeAdapterState(AdapterLifecycle.COMPLETED, null);
                } finally {
                    adapter.bindEventEmitter(null);
                    transport.bindRetryListener(null);
                }
            }
        }

        /**
         * 한 호출의 결과 스트림 소비.
         *
         * @return 정상 종료면 true, 어댑터 오류로 중단했으면 false
         */
        private boolean consume(Adapter adapter, Map<String, Object> params) {
            Iterator<IngestionResult> results;
            try {
                results = adapter.iterResults(params, request.resume()).iterator();
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                checkCancelled();
                failFast(e);
                return false;
            }

            while (true) {
                long fetchStarted = System.nanoTime();
                IngestionResult result;
                try {
                    if (!results.hasNext()) {
                        return true;
                    }
                    result = results.next();
                } catch (CancellationException e) {
                    throw e;
                } catch (RuntimeException e) {
                    checkCancelled();
                    failFast(e);
                    return false;
                }

                String docId = result.docId();
                if (request.completedIds().contains(docId)) {
                    log.debug("Pipeline {} skipped already completed document {}", pipelineId, docId);
                    continue;
                }

                tracker.documentStarted();
                emit(new DocumentStarted(null, null, docId, adapterName, params));
                double durationSeconds = (System.nanoTime() - fetchStarted) / 1_000_000_000.0;
                emit(new DocumentCompleted(null, null, result.document(), durationSeconds, result.metadata()));

                if (tracker.documentCompleted(docId)) {
                    emitProgress(tracker.checkpointDue());
                }
            }
        }

        private void failFast(RuntimeException error) {
            String docId = null;
            int retryCount = 0;
            boolean retryable = false;
            if (error instanceof AdapterException adapterError) {
                docId = adapterError.docId();
                retryCount = adapterError.retryCount();
                retryable = adapterError.retryable();
            }
            String errorType = error.getClass().getSimpleName();
            String message = error.getMessage() == null ? errorType : error.getMessage();

            log.error("Pipeline {} adapter {} failed on document {}", pipelineId, adapterName, docId, error);
            tracker.documentFailed();
            recordLedgerFailure(docId, errorType, message, retryCount);
            emit(new DocumentFailed(null, null, docId, message, retryCount, retryable, errorType));
            changeAdapterState(AdapterLifecycle.FAILED, message);
        }

        private void recordLedgerFailure(String docId, String errorType, String message, int retryCount) {
            if (docId == null) {
                return;
            }
            Optional<LedgerState> current = ledger.getState(docId);
            if (current.isEmpty() || !StateTransition.isAllowed(current.get(), LedgerState.FAILED)) {
                log.debug("Ledger not updated for {}: FAILED is not reachable from {}", docId, current.orElse(null));
                return;
            }
            try {
                ledger.updateState(docId, LedgerState.FAILED, TransitionContext.ofAdapter(adapterName)
                    .withRetryCount(retryCount)
                    .withError(errorType, message));
            } catch (LedgerException e) {
                // the adapter error is what the run reports
                log.warn("Could not record FAILED for {} in ledger", docId, e);
            }
        }

        private void changeAdapterState(AdapterLifecycle newState, String reason) {
            emit(new AdapterStateChange(null, null, adapterName, adapterState, newState, reason));
            adapterState = newState;
        }

        private void emitProgress(boolean checkpoint) {
            long now = System.nanoTime();
            emit(tracker.snapshot(stream.depth(), checkpoint, now));
            if (checkpoint) {
                metrics.recordCheckpointLatency(Duration.ofNanos(now - lastCheckpointNanos));
                lastCheckpointNanos = now;
            }
        }

        private void emitFromAdapter(PipelineEvent event) {
            if (event != null) {
                emit(event);
            }
        }

        private void onTransportRetry(int attempt, String error, Integer statusCode) {
            metrics.recordTransportRetry(adapterName);
            emit(new AdapterRetry(null, null, adapterName, attempt, error, statusCode));
        }

        /**
         * 필터와 변환을 적용한 뒤 큐에 넣습니다. 큐가 가득 차면 대기 시간을 기록합니다.
         *
         * @throws CancellationException 스트림이 닫혔거나 생산자가 인터럽트된 경우
         */
        private void emit(PipelineEvent raw) {
            checkCancelled();
            PipelineEvent event = raw.withPipelineContext(pipelineId, clock.instant());
            if (!request.eventFilter().test(event)) {
                return;
            }
            Optional<PipelineEvent> transformed = request.eventTransformer().transform(event);
            if (transformed.isEmpty()) {
                return;
            }
            PipelineEvent queued = transformed.get();
            if (!stream.tryPublish(queued)) {
                long waitStarted = System.nanoTime();
                try {
                    stream.publish(queued);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Pipeline " + pipelineId + " interrupted while queueing");
                }
                tracker.backpressureWaited(System.nanoTime() - waitStarted);
            }
            metrics.recordEvent(queued.type());
            metrics.recordQueueDepth(stream.depth());
        }

        private void checkCancelled() {
            if (stream.isClosed() || Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Pipeline " + pipelineId + " cancelled");
            }
        }

        private void finish(Throwable unexpected) {
            try {
                long now = System.nanoTime();
                BatchProgress checkpoint = tracker.snapshot(stream.depth(), true, now)
                    .withPipelineContext(pipelineId, clock.instant());
                stream.recordFinalCheckpoint(checkpoint);
                metrics.recordCheckpointLatency(Duration.ofNanos(now - lastCheckpointNanos));
                publishFinalCheckpoint(checkpoint);
                metrics.recordPipelineDuration(request.source(), Duration.ofNanos(System.nanoTime() - startedNanos));
                log.info("Pipeline {} producer finished: completed={}, failed={}",
                    pipelineId, tracker.completedCount(), tracker.failedCount());
            } finally {
                stream.finish(unexpected);
            }
        }

        private void publishFinalCheckpoint(BatchProgress checkpoint) {
            if (!request.eventFilter().test(checkpoint)) {
                return;
            }
            Optional<PipelineEvent> transformed = request.eventTransformer().transform(checkpoint);
            if (transformed.isEmpty()) {
                return;
            }
            PipelineEvent queued = transformed.get();
            if (stream.isClosed() || Thread.currentThread().isInterrupted()) {
                // consumer is gone; keep it only if there is room
                stream.tryPublish(queued);
                return;
            }
            try {
                stream.publish(queued);
                metrics.recordEvent(queued.type());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stream.tryPublish(queued);
            }
        }
    }

    /**
     * 완료된 문서만 노출하는 스트림.
     */
    private static final class DocumentResultStream implements ResultStream<Document> {

        private final EventStream events;
        private Document next;

        DocumentResultStream(EventStream events) {
            this.events = events;
        }

        @Override
        public boolean hasNext() {
            while (next == null && events.hasNext()) {
                PipelineEvent event = events.next();
                if (event instanceof DocumentCompleted completed) {
                    next = completed.document();
                } else if (event instanceof DocumentFailed failed) {
                    throw new IngestionStreamException(
                        "Document " + failed.docId() + " failed in pipeline " + events.pipelineId()
                            + ": " + failed.error(), null
                    );
                }
            }
            return next != null;
        }

        @Override
        public Document next() {
            if (!hasNext()) {
                throw new NoSuchElementException("No more documents");
            }
            Document document = next;
            next = null;
            return document;
        }

        @Override
        public void close() {
            events.close();
        }
    }
}
