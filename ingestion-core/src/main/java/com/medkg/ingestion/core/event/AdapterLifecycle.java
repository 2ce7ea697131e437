package com.medkg.ingestion.core.event;

import java.util.Locale;

/**
 * 오케스트레이터가 관찰하는 어댑터 생명주기 단계.
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public enum AdapterLifecycle {
    INITIALISING,
    READY,
    INVOCATION_STARTED,
    INVOCATION_COMPLETED,
    COMPLETED,
    FAILED;

    /**
     * 이벤트 소비자에게 노출되는 소문자 라벨.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
