package com.medkg.ingestion.core.spi;

import com.medkg.ingestion.core.event.PipelineEvent;
import com.medkg.ingestion.core.model.IngestionResult;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Source-specific document producer.
 *
 * <p>Adapters are created per pipeline run by an {@link AdapterRegistry} and closed by
 * the orchestrator on every exit path.</p>
 *
 * <p><strong>Failure Contract:</strong> an exception thrown while iterating the result
 * stream ends the run. Throw {@link AdapterException} to attach the failing document ID,
 * retry count and retryability.</p>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public interface Adapter extends AutoCloseable {

    /**
     * Returns the adapter (source) name.
     */
    String name();

    /**
     * Lazily produces results for one invocation.
     *
     * @param params invocation parameters (empty for a parameterless invocation)
     * @param resume whether documents already completed in the ledger should be skipped
     * @return a lazily evaluated result sequence
     */
    Iterable<IngestionResult> iterResults(Map<String, Object> params, boolean resume);

    /**
     * Binds (or unbinds with {@code null}) a sink for adapter-internal events.
     *
     * <p>The orchestrator fills in missing pipeline IDs and timestamps.</p>
     *
     * @param emitter the event sink, or null to unbind
     */
    default void bindEventEmitter(Consumer<PipelineEvent> emitter) {
    }

    /**
     * Releases adapter resources.
     */
    @Override
    default void close() {
    }
}
