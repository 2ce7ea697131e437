package com.medkg.ingestion.application.orchestrator;

import com.medkg.ingestion.core.event.PipelineEvent;

import java.util.Optional;

/**
 * 큐에 넣기 전에 이벤트를 변환하거나 버리는 함수.
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventTransformer {

    /**
     * @param event 원본 이벤트
     * @return 변환된 이벤트, 버리려면 empty
     */
    Optional<PipelineEvent> transform(PipelineEvent event);

    /**
     * 이벤트를 그대로 통과시키는 변환기.
     */
    static EventTransformer identity() {
        return Optional::of;
    }
}
