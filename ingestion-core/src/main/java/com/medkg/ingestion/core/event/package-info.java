/**
 * Pipeline event model.
 *
 * <p>Immutable records streamed from the orchestrator to consumers. The set of event
 * types is closed by the sealed {@link com.medkg.ingestion.core.event.PipelineEvent} interface.</p>
 *
 * @since 1.0.0
 * @author Ingestion Team
 */
package com.medkg.ingestion.core.event;
