package com.medkg.ingestion.adapter.runner;

/**
 * LedgerCompactor 설정.
 *
 * @param checkIntervalMs 스냅샷 필요 여부 확인 주기 (밀리초, 기본 300000)
 * @param force true면 주기와 무관하게 매 확인마다 스냅샷 생성 (기본 false)
 * @author Ingestion Team
 * @since 1.0.0
 */
public record LedgerCompactorConfig(
    long checkIntervalMs,
    boolean force
) {

    public LedgerCompactorConfig() {
        this(300000, false);
    }

    public LedgerCompactorConfig {
        if (checkIntervalMs <= 0) {
            throw new IllegalArgumentException("checkIntervalMs must be positive (current: " + checkIntervalMs + ")");
        }
    }

    public LedgerCompactorConfig withCheckIntervalMs(long checkIntervalMs) {
        return new LedgerCompactorConfig(checkIntervalMs, force);
    }

    public LedgerCompactorConfig withForce(boolean force) {
        return new LedgerCompactorConfig(checkIntervalMs, force);
    }
}
