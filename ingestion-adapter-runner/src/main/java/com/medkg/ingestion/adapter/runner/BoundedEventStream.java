package com.medkg.ingestion.adapter.runner;

import com.medkg.ingestion.application.orchestrator.EventStream;
import com.medkg.ingestion.application.orchestrator.IngestionStreamException;
import com.medkg.ingestion.core.event.BatchProgress;
import com.medkg.ingestion.core.event.PipelineEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 생산자 스레드와 소비자를 잇는 유계 큐 기반 {@link EventStream}.
 *
 * <p><strong>큐 항목:</strong></p>
 * <ul>
 *   <li>이벤트</li>
 *   <li>생산자의 예기치 않은 오류 (소비자에게 {@link IngestionStreamException}으로 전달)</li>
 *   <li>종료 표시</li>
 * </ul>
 *
 * <p>생산자 측 메서드는 생산자 스레드 하나만, 소비자 측 메서드({@code hasNext}, {@code next})는
 * 소비자 스레드 하나만 호출합니다. {@link #close()}는 어느 스레드에서나 호출할 수 있습니다.</p>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
final class BoundedEventStream implements EventStream {

    private static final Logger log = LoggerFactory.getLogger(BoundedEventStream.class);
    private static final long POLL_INTERVAL_MS = 50;

    private record Signal(PipelineEvent event, Throwable error) {
    }

    private static final Signal END = new Signal(null, null);

    private final String pipelineId;
    private final BlockingQueue<Signal> queue;
    private final CountDownLatch finished = new CountDownLatch(1);
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile Thread producer;
    private volatile BatchProgress finalCheckpoint;

    private PipelineEvent next;
    private boolean exhausted;

    BoundedEventStream(String pipelineId, int bufferSize) {
        this.pipelineId = pipelineId;
        this.queue = new ArrayBlockingQueue<>(bufferSize);
    }

    void attach(Thread producer) {
        this.producer = producer;
    }

    // ==================== producer side ====================

    boolean tryPublish(PipelineEvent event) {
        return queue.offer(new Signal(event, null));
    }

    void publish(PipelineEvent event) throws InterruptedException {
        queue.put(new Signal(event, null));
    }

    int depth() {
        return queue.size();
    }

    boolean isClosed() {
        return closed.get();
    }

    void recordFinalCheckpoint(BatchProgress checkpoint) {
        this.finalCheckpoint = checkpoint;
    }

    /**
     * 종료 표시(또는 오류)를 큐에 넣고 생산자 종료를 알립니다.
     *
     * @param error 생산자를 중단시킨 오류 ({@link Error} 포함), 정상 종료면 null
     */
    void finish(Throwable error) {
        try {
            deliver(error == null ? END : new Signal(null, error));
        } finally {
            finished.countDown();
        }
    }

    private void deliver(Signal signal) {
        if (closed.get()) {
            queue.offer(signal);
            return;
        }
        try {
            queue.put(signal);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (!queue.offer(signal)) {
                log.warn("Pipeline {} interrupted before its end marker could be queued", pipelineId);
            }
        }
    }

    // ==================== consumer side ====================

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (exhausted || closed.get()) {
            return false;
        }
        try {
            while (true) {
                Signal signal = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (signal == null) {
                    if (finished.getCount() == 0 && queue.isEmpty()) {
                        exhausted = true;
                        return false;
                    }
                    continue;
                }
                if (signal == END) {
                    exhausted = true;
                    return false;
                }
                if (signal.error() != null) {
                    exhausted = true;
                    throw new IngestionStreamException("Pipeline " + pipelineId + " failed", signal.error());
                }
                next = signal.event();
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IngestionStreamException("Interrupted while waiting for events of pipeline " + pipelineId, e);
        }
    }

    @Override
    public PipelineEvent next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Pipeline " + pipelineId + " has no more events");
        }
        PipelineEvent event = next;
        next = null;
        return event;
    }

    @Override
    public String pipelineId() {
        return pipelineId;
    }

    @Override
    public Optional<BatchProgress> finalCheckpoint() {
        return Optional.ofNullable(finalCheckpoint);
    }

    /**
     * 생산자를 인터럽트하고 종료(자원 해제 포함)까지 기다립니다.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        Thread thread = producer;
        if (thread == null || thread == Thread.currentThread()) {
            return;
        }
        if (finished.getCount() > 0) {
            thread.interrupt();
        }
        try {
            finished.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for pipeline {} to stop", pipelineId);
        }
    }

    boolean awaitFinished(long timeout, TimeUnit unit) throws InterruptedException {
        return finished.await(timeout, unit);
    }
}
