package com.medkg.ingestion.core.event;

import com.medkg.ingestion.core.model.Document;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * PipelineEvent 테스트.
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
class PipelineEventTest {

    private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void newPipelineId_소스와_hex_UUID로_구성된다() {
        String pipelineId = PipelineEvents.newPipelineId("pubmed");

        assertThat(pipelineId).startsWith("pubmed:");
        assertThat(pipelineId.substring("pubmed:".length())).matches("[0-9a-f]{32}");
        assertThat(PipelineEvents.newPipelineId("pubmed")).isNotEqualTo(pipelineId);
    }

    @Test
    void withPipelineContext_누락된_값만_채운다() {
        // given
        DocumentStarted fromAdapter = new DocumentStarted(null, null, "doc-1", "pubmed", Map.of());
        DocumentStarted complete = new DocumentStarted("p:1", NOW.minusSeconds(5), "doc-1", "pubmed", Map.of());

        // when
        DocumentStarted filled = fromAdapter.withPipelineContext("p:2", NOW);

        // then
        assertThat(filled.pipelineId()).isEqualTo("p:2");
        assertThat(filled.timestamp()).isEqualTo(NOW);
        assertThat(complete.withPipelineContext("p:2", NOW)).isSameAs(complete);
    }

    @Test
    void type은_클래스_단순_이름() {
        PipelineEvent event = new AdapterStateChange("p:1", NOW, "pubmed", null, AdapterLifecycle.INITIALISING, null);

        assertThat(event.type()).isEqualTo("AdapterStateChange");
        assertThat(event.toMap())
            .containsEntry("type", "AdapterStateChange")
            .containsEntry("new_state", "initialising")
            .containsEntry("old_state", null);
    }

    @Test
    void documentCompleted_toMap에는_문서_정보가_포함된다() {
        DocumentCompleted event = new DocumentCompleted(
            "p:1", NOW, Document.of("doc-1", "pubmed", "text"), 0.25, Map.of("page", 1)
        );

        assertThat(event.docId()).isEqualTo("doc-1");
        assertThat(event.toMap())
            .containsEntry("doc_id", "doc-1")
            .containsEntry("source", "pubmed")
            .containsEntry("duration_seconds", 0.25)
            .containsEntry("pipeline_id", "p:1")
            .containsEntry("timestamp", "2024-01-01T00:00:00Z");
    }

    @Test
    void documentCompleted_음수_소요시간은_거부된다() {
        assertThatThrownBy(() -> new DocumentCompleted(
            "p:1", NOW, Document.of("doc-1", "pubmed", "text"), -1.0, Map.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void batchProgress_체크포인트_ID는_불변_복사본() {
        // given
        List<String> ids = new java.util.ArrayList<>(List.of("a", "b"));
        BatchProgress progress = new BatchProgress(
            "p:1", NOW, 2, 0, 0, 0, 10, null, null, 0.0, 0, ids, true
        );

        // when
        ids.add("c");

        // then
        assertThat(progress.checkpointDocIds()).containsExactly("a", "b");
        assertThat(progress.toMap()).containsEntry("is_checkpoint", true);
    }

    @Test
    void documentFailed_docId는_null일_수_있다() {
        DocumentFailed failed = new DocumentFailed(null, null, null, "boom", 0, false, "RuntimeException")
            .withPipelineContext("p:1", NOW);

        assertThat(failed.docId()).isNull();
        assertThat(failed.pipelineId()).isEqualTo("p:1");
        assertThat(failed.toMap()).containsEntry("is_retryable", false);
    }

    @Test
    void adapterRetry_attempt는_1_이상() {
        assertThatThrownBy(() -> new AdapterRetry("p:1", NOW, "pubmed", 0, "boom", 503))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("attempt");
    }
}
