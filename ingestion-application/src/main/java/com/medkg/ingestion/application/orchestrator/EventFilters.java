package com.medkg.ingestion.application.orchestrator;

import com.medkg.ingestion.core.event.AdapterLifecycle;
import com.medkg.ingestion.core.event.AdapterStateChange;
import com.medkg.ingestion.core.event.BatchProgress;
import com.medkg.ingestion.core.event.DocumentFailed;
import com.medkg.ingestion.core.event.PipelineEvent;

import java.util.List;
import java.util.function.Predicate;

/**
 * 자주 쓰는 이벤트 필터.
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public final class EventFilters {

    // Utility class - prevent instantiation
    private EventFilters() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 모든 이벤트 통과.
     */
    public static Predicate<PipelineEvent> all() {
        return event -> true;
    }

    /**
     * 실패 관련 이벤트만 통과 (DocumentFailed, FAILED로의 AdapterStateChange).
     */
    public static Predicate<PipelineEvent> errorsOnly() {
        return event -> event instanceof DocumentFailed
            || (event instanceof AdapterStateChange change && change.newState() == AdapterLifecycle.FAILED);
    }

    /**
     * 진행률과 체크포인트만 통과.
     */
    public static Predicate<PipelineEvent> progressOnly() {
        return event -> event instanceof BatchProgress;
    }

    /**
     * 지정한 타입의 이벤트만 통과.
     */
    @SafeVarargs
    public static Predicate<PipelineEvent> ofTypes(Class<? extends PipelineEvent>... types) {
        List<Class<? extends PipelineEvent>> accepted = List.of(types);
        return event -> accepted.stream().anyMatch(type -> type.isInstance(event));
    }
}
