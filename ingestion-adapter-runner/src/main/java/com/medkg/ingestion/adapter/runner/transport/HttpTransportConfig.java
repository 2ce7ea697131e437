package com.medkg.ingestion.adapter.runner.transport;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * JdkHttpTransport 설정.
 *
 * <p><strong>기본값:</strong></p>
 * <ul>
 *   <li>connectTimeout: 10초</li>
 *   <li>requestTimeout: 30초</li>
 *   <li>maxAttempts: 3 (첫 요청 포함)</li>
 *   <li>retryStatusCodes: 429, 500, 502, 503, 504</li>
 *   <li>backoff: 1000ms ~ 300000ms, jitter 0.1</li>
 * </ul>
 *
 * @param connectTimeout 연결 타임아웃
 * @param requestTimeout 요청 타임아웃
 * @param maxAttempts 최대 시도 횟수
 * @param defaultHeaders 모든 요청에 붙는 헤더 (User-Agent 등)
 * @param backoff 재시도 지연 계산기
 * @author Ingestion Team
 * @since 1.0.0
 */
public record HttpTransportConfig(
    Duration connectTimeout,
    Duration requestTimeout,
    int maxAttempts,
    Map<String, String> defaultHeaders,
    BackoffCalculator backoff
) {

    private static final Set<Integer> RETRYABLE_STATUS_CODES = Set.of(429, 500, 502, 503, 504);

    public HttpTransportConfig() {
        this(Duration.ofSeconds(10), Duration.ofSeconds(30), 3, Map.of("User-Agent", "medkg-ingestion/1.0"), new BackoffCalculator());
    }

    public HttpTransportConfig {
        if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive (current: " + connectTimeout + ")");
        }
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive (current: " + requestTimeout + ")");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive (current: " + maxAttempts + ")");
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff cannot be null");
        }
        defaultHeaders = defaultHeaders == null ? Map.of() : Map.copyOf(defaultHeaders);
    }

    /**
     * 재시도 대상 상태 코드 여부.
     */
    public boolean isRetryableStatus(int statusCode) {
        return RETRYABLE_STATUS_CODES.contains(statusCode);
    }

    public HttpTransportConfig withConnectTimeout(Duration connectTimeout) {
        return new HttpTransportConfig(connectTimeout, requestTimeout, maxAttempts, defaultHeaders, backoff);
    }

    public HttpTransportConfig withRequestTimeout(Duration requestTimeout) {
        return new HttpTransportConfig(connectTimeout, requestTimeout, maxAttempts, defaultHeaders, backoff);
    }

    public HttpTransportConfig withMaxAttempts(int maxAttempts) {
        return new HttpTransportConfig(connectTimeout, requestTimeout, maxAttempts, defaultHeaders, backoff);
    }

    public HttpTransportConfig withDefaultHeaders(Map<String, String> defaultHeaders) {
        return new HttpTransportConfig(connectTimeout, requestTimeout, maxAttempts, defaultHeaders, backoff);
    }

    public HttpTransportConfig withBackoff(BackoffCalculator backoff) {
        return new HttpTransportConfig(connectTimeout, requestTimeout, maxAttempts, defaultHeaders, backoff);
    }
}
