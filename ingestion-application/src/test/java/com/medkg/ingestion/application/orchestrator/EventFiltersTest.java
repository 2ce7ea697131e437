package com.medkg.ingestion.application.orchestrator;

import com.medkg.ingestion.core.event.AdapterLifecycle;
import com.medkg.ingestion.core.event.AdapterStateChange;
import com.medkg.ingestion.core.event.BatchProgress;
import com.medkg.ingestion.core.event.DocumentFailed;
import com.medkg.ingestion.core.event.DocumentStarted;
import com.medkg.ingestion.core.event.PipelineEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * EventFilters 테스트.
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
class EventFiltersTest {

    private static final Instant NOW = Instant.EPOCH;

    private final PipelineEvent started = new DocumentStarted("p", NOW, "doc-1", "pubmed", Map.of());
    private final PipelineEvent failed = new DocumentFailed("p", NOW, "doc-1", "boom", 0, false, "RuntimeException");
    private final PipelineEvent adapterFailed =
        new AdapterStateChange("p", NOW, "pubmed", AdapterLifecycle.INVOCATION_STARTED, AdapterLifecycle.FAILED, "boom");
    private final PipelineEvent adapterReady =
        new AdapterStateChange("p", NOW, "pubmed", AdapterLifecycle.INITIALISING, AdapterLifecycle.READY, null);
    private final PipelineEvent progress =
        new BatchProgress("p", NOW, 1, 0, 0, 0, 1, null, null, 0.0, 0, List.of(), false);

    private List<PipelineEvent> apply(Predicate<PipelineEvent> filter) {
        return List.of(started, failed, adapterFailed, adapterReady, progress).stream().filter(filter).toList();
    }

    @Test
    void errorsOnly_실패_이벤트만_통과() {
        assertThat(apply(EventFilters.errorsOnly())).containsExactly(failed, adapterFailed);
    }

    @Test
    void progressOnly_진행률만_통과() {
        assertThat(apply(EventFilters.progressOnly())).containsExactly(progress);
    }

    @Test
    void ofTypes_지정한_타입만_통과() {
        assertThat(apply(EventFilters.ofTypes(DocumentStarted.class, BatchProgress.class)))
            .containsExactly(started, progress);
    }

    @Test
    void all_모두_통과() {
        assertThat(apply(EventFilters.all())).hasSize(5);
    }
}
