package com.medkg.ingestion.application.orchestrator;

import com.medkg.ingestion.core.event.BatchProgress;
import com.medkg.ingestion.core.event.DocumentStarted;
import com.medkg.ingestion.core.event.PipelineEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StreamRequest / StreamConfig 테스트.
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
class StreamRequestTest {

    @Test
    void of_기본값으로_채워진다() {
        StreamRequest request = StreamRequest.of("pubmed");

        assertThat(request.params()).isEmpty();
        assertThat(request.invocations()).containsExactly(Map.of());
        assertThat(request.resume()).isFalse();
        assertThat(request.config()).isEqualTo(new StreamConfig());
        assertThat(request.completedIds()).isEmpty();
        assertThat(request.totalEstimated()).isNull();

        PipelineEvent event = new DocumentStarted("p:1", Instant.EPOCH, "doc-1", "pubmed", Map.of());
        assertThat(request.eventFilter().test(event)).isTrue();
        assertThat(request.eventTransformer().transform(event)).contains(event);
    }

    @Test
    void with_메서드는_하나의_값만_바꾼다() {
        // given
        StreamRequest base = StreamRequest.of("pubmed");

        // when
        StreamRequest updated = base
            .withParams(List.of(Map.of("term", "a"), Map.of("term", "b")))
            .withResume(true)
            .withCompletedIds(Set.of("doc-1"))
            .withTotalEstimated(10)
            .withConfig(new StreamConfig().withBufferSize(1));

        // then
        assertThat(updated.invocations()).hasSize(2);
        assertThat(updated.resume()).isTrue();
        assertThat(updated.completedIds()).containsExactly("doc-1");
        assertThat(updated.totalEstimated()).isEqualTo(10);
        assertThat(updated.config().bufferSize()).isEqualTo(1);
        assertThat(base.resume()).isFalse();
    }

    @Test
    void 잘못된_값은_거부된다() {
        assertThatThrownBy(() -> StreamRequest.of(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StreamRequest.of("pubmed").withTotalEstimated(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("totalEstimated");
    }

    @Test
    void streamConfig_기본값과_검증() {
        StreamConfig config = new StreamConfig();

        assertThat(config.bufferSize()).isEqualTo(100);
        assertThat(config.progressInterval()).isEqualTo(100);
        assertThat(config.checkpointInterval()).isEqualTo(1000);
        assertThatThrownBy(() -> config.withBufferSize(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("bufferSize must be positive (current: 0)");
        assertThatThrownBy(() -> config.withProgressInterval(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.withCheckpointInterval(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pipelineRunResult_집계() {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        PipelineRunResult result = new PipelineRunResult(
            "p:1", "pubmed", List.of(), List.of(), List.of(),
            Optional.<BatchProgress>empty(), start, start.plusSeconds(2)
        );

        assertThat(result.successCount()).isZero();
        assertThat(result.failureCount()).isZero();
        assertThat(result.succeeded()).isTrue();
        assertThat(result.duration()).hasSeconds(2);
    }
}
