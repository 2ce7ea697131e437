package com.medkg.ingestion.adapter.runner;

/**
 * StuckDocumentMonitor 설정.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 900000 (15분)</li>
 *   <li>thresholdMs: 86400000 (24시간)</li>
 *   <li>batchSize: 100</li>
 *   <li>policy: REPORT</li>
 * </ul>
 *
 * @param scanIntervalMs 스캔 주기 (밀리초)
 * @param thresholdMs 정체로 판단하는 최소 경과 시간 (밀리초)
 * @param batchSize 한 번의 스캔에서 FAIL 정책으로 처리할 최대 문서 수
 * @param policy 처리 정책
 * @author Ingestion Team
 * @since 1.0.0
 */
public record StuckDocumentMonitorConfig(
    long scanIntervalMs,
    long thresholdMs,
    int batchSize,
    StuckDocumentPolicy policy
) {

    public StuckDocumentMonitorConfig() {
        this(900000, 86400000, 100, StuckDocumentPolicy.REPORT);
    }

    public StuckDocumentMonitorConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException("scanIntervalMs must be positive (current: " + scanIntervalMs + ")");
        }
        if (thresholdMs <= 0) {
            throw new IllegalArgumentException("thresholdMs must be positive (current: " + thresholdMs + ")");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
    }

    public StuckDocumentMonitorConfig withScanIntervalMs(long scanIntervalMs) {
        return new StuckDocumentMonitorConfig(scanIntervalMs, thresholdMs, batchSize, policy);
    }

    public StuckDocumentMonitorConfig withThresholdMs(long thresholdMs) {
        return new StuckDocumentMonitorConfig(scanIntervalMs, thresholdMs, batchSize, policy);
    }

    public StuckDocumentMonitorConfig withBatchSize(int batchSize) {
        return new StuckDocumentMonitorConfig(scanIntervalMs, thresholdMs, batchSize, policy);
    }

    public StuckDocumentMonitorConfig withPolicy(StuckDocumentPolicy policy) {
        return new StuckDocumentMonitorConfig(scanIntervalMs, thresholdMs, batchSize, policy);
    }
}
