package com.medkg.ingestion.adapter.runner.transport;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * HTTP 재시도 지연 계산기 (Exponential Backoff with Jitter).
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * exponential = min(baseDelay * 2^(attempt-1), maxDelay)
 * delay       = min(exponential + random(0, exponential * jitterFactor), maxDelay)
 * </pre>
 *
 * <p>기본값은 baseDelay=1000ms, maxDelay=300000ms, jitterFactor=0.1 입니다.
 * 여러 어댑터가 같은 upstream에 동시에 재시도하지 않도록 jitter를 더합니다.</p>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public final class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    public BackoffCalculator() {
        this(1000, 300000, 0.1);
    }

    /**
     * @param baseDelayMs 첫 재시도 지연 (밀리초, 양수)
     * @param maxDelayMs 최대 지연 (밀리초, baseDelayMs 이상)
     * @param jitterFactor jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        this(baseDelayMs, maxDelayMs, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive (current: " + baseDelayMs + ")");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * 재시도 전 대기 시간 계산.
     *
     * @param attempt 재시도 번호 (1부터 시작)
     * @return 대기 시간
     * @throws IllegalArgumentException attempt가 양수가 아닌 경우
     */
    public Duration delayFor(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("attempt must be positive (current: " + attempt + ")");
        }
        // shift is capped so that 1L << shift cannot overflow
        int shift = Math.min(attempt - 1, 30);
        long exponential = Math.min(baseDelayMs * (1L << shift), maxDelayMs);
        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());
        return Duration.ofMillis(Math.min(exponential + jitter, maxDelayMs));
    }

    public long baseDelayMs() {
        return baseDelayMs;
    }

    public long maxDelayMs() {
        return maxDelayMs;
    }

    public double jitterFactor() {
        return jitterFactor;
    }
}
