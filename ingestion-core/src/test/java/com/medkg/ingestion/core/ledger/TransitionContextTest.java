package com.medkg.ingestion.core.ledger;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TransitionContext 테스트.
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
class TransitionContextTest {

    @Test
    void empty_모든_값이_비어있다() {
        TransitionContext context = TransitionContext.empty();

        assertThat(context.adapter()).isNull();
        assertThat(context.metadata()).isEmpty();
        assertThat(context.parameters()).isEmpty();
        assertThat(context.retryCount()).isNull();
    }

    @Test
    void with_메서드는_새_인스턴스를_만든다() {
        // given
        TransitionContext base = TransitionContext.ofAdapter("pubmed");

        // when
        TransitionContext updated = base
            .withMetadata(Map.of("k", "v"))
            .withRetryCount(1)
            .withError("IOException", "boom");

        // then
        assertThat(base.metadata()).isEmpty();
        assertThat(updated.adapter()).isEqualTo("pubmed");
        assertThat(updated.metadata()).containsEntry("k", "v");
        assertThat(updated.retryCount()).isEqualTo(1);
        assertThat(updated.errorType()).isEqualTo("IOException");
        assertThat(updated.errorMessage()).isEqualTo("boom");
    }

    @Test
    void 음수_retryCount는_거부된다() {
        assertThatThrownBy(() -> TransitionContext.empty().withRetryCount(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("retryCount");
    }
}
