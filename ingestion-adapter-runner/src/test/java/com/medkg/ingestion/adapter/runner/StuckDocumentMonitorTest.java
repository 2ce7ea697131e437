package com.medkg.ingestion.adapter.runner;

import com.medkg.ingestion.core.ledger.DocumentLedgerEntry;
import com.medkg.ingestion.core.ledger.LedgerIOException;
import com.medkg.ingestion.core.ledger.TransitionContext;
import com.medkg.ingestion.core.spi.Ledger;
import com.medkg.ingestion.core.statemachine.LedgerState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * StuckDocumentMonitor 유닛 테스트.
 *
 * <ul>
 *   <li>REPORT 정책: Ledger 변경 없음</li>
 *   <li>FAIL 정책: → FAILED 허용 상태만 전이, batchSize 제한</li>
 *   <li>개별 실패 시에도 계속 진행</li>
 * </ul>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class StuckDocumentMonitorTest {

    private static final Instant LONG_AGO = Instant.parse("2024-01-01T00:00:00Z");

    @Mock
    private Ledger ledger;

    private StuckDocumentMonitorConfig config;

    @BeforeEach
    void setUp() {
        config = new StuckDocumentMonitorConfig();
    }

    private static DocumentLedgerEntry entry(String docId, LedgerState state) {
        return new DocumentLedgerEntry(docId, state, LONG_AGO, "pubmed", Map.of(), 0);
    }

    @Test
    void scan_REPORT_정책이면_Ledger를_바꾸지_않는다() {
        // given
        when(ledger.getStuckDocuments(Duration.ofMillis(86400000)))
            .thenReturn(List.of(entry("d1", LedgerState.FETCHING)));

        // when
        new StuckDocumentMonitor(ledger, config).scan();

        // then
        verify(ledger).getStuckDocuments(Duration.ofHours(24));
        verify(ledger, never()).updateState(anyString(), any(LedgerState.class), any(TransitionContext.class));
    }

    @Test
    void scan_FAIL_정책이면_FAILED로_갈수있는_문서만_전이한다() {
        // given
        StuckDocumentMonitor monitor = new StuckDocumentMonitor(ledger, config.withPolicy(StuckDocumentPolicy.FAIL));
        when(ledger.getStuckDocuments(any(Duration.class))).thenReturn(List.of(
            entry("fetching", LedgerState.FETCHING),
            entry("pending", LedgerState.PENDING),
            entry("failed", LedgerState.FAILED),
            entry("embedding", LedgerState.EMBEDDING)
        ));

        // when
        monitor.scan();

        // then
        ArgumentCaptor<TransitionContext> captor = ArgumentCaptor.forClass(TransitionContext.class);
        verify(ledger).updateState(eq("fetching"), eq(LedgerState.FAILED), captor.capture());
        verify(ledger).updateState(eq("embedding"), eq(LedgerState.FAILED), any(TransitionContext.class));
        verify(ledger, never()).updateState(eq("pending"), any(LedgerState.class), any(TransitionContext.class));
        verify(ledger, never()).updateState(eq("failed"), any(LedgerState.class), any(TransitionContext.class));

        TransitionContext context = captor.getValue();
        assertThat(context.errorType()).isEqualTo("stuck");
        assertThat(context.errorMessage()).contains("FETCHING");
        assertThat(context.adapter()).isEqualTo("stuck-document-monitor");
    }

    @Test
    void scan_FAIL_정책은_batchSize만큼만_처리한다() {
        // given
        StuckDocumentMonitor monitor = new StuckDocumentMonitor(ledger,
            config.withPolicy(StuckDocumentPolicy.FAIL).withBatchSize(1));
        when(ledger.getStuckDocuments(any(Duration.class))).thenReturn(List.of(
            entry("oldest", LedgerState.PARSING),
            entry("newer", LedgerState.PARSING)
        ));

        // when
        monitor.scan();

        // then
        verify(ledger).updateState(eq("oldest"), eq(LedgerState.FAILED), any(TransitionContext.class));
        verify(ledger, never()).updateState(eq("newer"), any(LedgerState.class), any(TransitionContext.class));
    }

    @Test
    void scan_개별_전이가_실패해도_다음_문서를_처리한다() {
        // given
        StuckDocumentMonitor monitor = new StuckDocumentMonitor(ledger, config.withPolicy(StuckDocumentPolicy.FAIL));
        when(ledger.getStuckDocuments(any(Duration.class))).thenReturn(List.of(
            entry("broken", LedgerState.FETCHED),
            entry("fine", LedgerState.FETCHED)
        ));
        when(ledger.updateState(eq("broken"), eq(LedgerState.FAILED), any(TransitionContext.class)))
            .thenThrow(new LedgerIOException("disk full", new IOException("disk full")));

        // when
        monitor.scan();

        // then
        verify(ledger).updateState(eq("fine"), eq(LedgerState.FAILED), any(TransitionContext.class));
    }

    @Test
    void scan_조회_실패는_예외를_던지지_않는다() {
        when(ledger.getStuckDocuments(any(Duration.class))).thenThrow(new IllegalStateException("Ledger is closed"));

        assertThatCode(() -> new StuckDocumentMonitor(ledger, config).scan()).doesNotThrowAnyException();
    }

    @Test
    void config_기본값과_검증() {
        assertThat(config.scanIntervalMs()).isEqualTo(900000);
        assertThat(config.policy()).isEqualTo(StuckDocumentPolicy.REPORT);
        assertThat(new StuckDocumentMonitor(ledger, config).intervalMs()).isEqualTo(900000);
        assertThatThrownBy(() -> config.withThresholdMs(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("thresholdMs must be positive (current: 0)");
        assertThatThrownBy(() -> config.withPolicy(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new StuckDocumentMonitor(null, config))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("ledger cannot be null");
    }
}
