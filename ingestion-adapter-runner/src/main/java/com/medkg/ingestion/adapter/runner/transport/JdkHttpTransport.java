package com.medkg.ingestion.adapter.runner.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medkg.ingestion.core.spi.HttpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@code java.net.http.HttpClient} 기반 HttpTransport 구현체.
 *
 * <p>어댑터가 upstream API를 호출할 때 사용하는 GET 전용 전송 계층입니다.</p>
 *
 * <p><strong>재시도 흐름:</strong></p>
 * <pre>
 * attempt = 1
 *   ↓
 * send(GET) → 2xx → body 반환
 *   ├─ 429/5xx 또는 IOException, attempt &lt; maxAttempts
 *   │    → RetryListener.onRetry(attempt, error, status)
 *   │    → backoff.delayFor(attempt) 만큼 대기 → attempt++
 *   └─ 그 외 또는 시도 소진 → HttpTransportException
 * </pre>
 *
 * <p>RetryListener는 오케스트레이터가 바인딩하며, 재시도마다
 * {@code AdapterRetry} 이벤트로 전달됩니다.</p>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public final class JdkHttpTransport implements HttpTransport {

    private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };

    /**
     * 재시도 사이 대기.
     */
    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final HttpTransportConfig config;
    private final HttpClient client;
    private final Sleeper sleeper;
    private volatile RetryListener retryListener;
    private volatile boolean closed;

    public JdkHttpTransport() {
        this(new HttpTransportConfig());
    }

    public JdkHttpTransport(HttpTransportConfig config) {
        this(config, buildClient(config));
    }

    /**
     * @param config 전송 설정
     * @param client 요청을 보낼 HttpClient
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public JdkHttpTransport(HttpTransportConfig config, HttpClient client) {
        this(config, client, duration -> Thread.sleep(duration.toMillis()));
    }

    JdkHttpTransport(HttpTransportConfig config, HttpClient client, Sleeper sleeper) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.config = config;
        this.client = client;
        this.sleeper = sleeper;
    }

    private static HttpClient buildClient(HttpTransportConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return HttpClient.newBuilder()
            .connectTimeout(config.connectTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    @Override
    public String getText(String url, Map<String, String> query) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url cannot be null or blank");
        }
        if (closed) {
            throw new IllegalStateException("Transport is closed");
        }
        return execute(buildUri(url, query));
    }

    @Override
    public Map<String, Object> getJson(String url, Map<String, String> query) {
        String body = getText(url, query);
        try {
            return MAPPER.readValue(body, JSON_OBJECT);
        } catch (JsonProcessingException e) {
            throw new HttpTransportException("Malformed JSON from " + url + ": " + e.getOriginalMessage(), null, e);
        }
    }

    @Override
    public void bindRetryListener(RetryListener listener) {
        this.retryListener = listener;
    }

    @Override
    public void close() {
        // HttpClient has no close() before JDK 21; the pool is released with the client
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    private String execute(URI uri) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(config.requestTimeout())
            .GET();
        config.defaultHeaders().forEach(builder::header);
        HttpRequest request = builder.build();

        int maxAttempts = config.maxAttempts();
        for (int attempt = 1; ; attempt++) {
            String error;
            Integer retryStatus = null;
            try {
                HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
                int status = response.statusCode();
                if (status >= 200 && status < 300) {
                    return response.body();
                }
                if (!config.isRetryableStatus(status) || attempt >= maxAttempts) {
                    throw new HttpTransportException(
                        "GET " + uri + " returned HTTP " + status + " after " + attempt + " attempt(s)", status, null
                    );
                }
                error = "HTTP " + status;
                retryStatus = status;
            } catch (IOException e) {
                if (attempt >= maxAttempts) {
                    throw new HttpTransportException(
                        "GET " + uri + " failed after " + attempt + " attempt(s): " + e.getMessage(), null, e
                    );
                }
                error = e.getClass().getSimpleName() + ": " + e.getMessage();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new HttpTransportException("GET " + uri + " interrupted", null, e);
            }

            try {
                awaitRetry(uri, attempt, error, retryStatus);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new HttpTransportException("GET " + uri + " interrupted while backing off", null, e);
            }
        }
    }

    private void awaitRetry(URI uri, int attempt, String error, Integer statusCode) throws InterruptedException {
        Duration delay = config.backoff().delayFor(attempt);
        log.warn("GET {} failed ({}), retrying in {}ms (attempt {})", uri, error, delay.toMillis(), attempt);
        RetryListener listener = retryListener;
        if (listener != null) {
            listener.onRetry(attempt, error, statusCode);
        }
        sleeper.sleep(delay);
    }

    static URI buildUri(String url, Map<String, String> query) {
        if (query == null || query.isEmpty()) {
            return URI.create(url);
        }
        String encoded = query.entrySet().stream()
            .map(entry -> encode(entry.getKey()) + "=" + encode(entry.getValue() == null ? "" : entry.getValue()))
            .collect(Collectors.joining("&"));
        return URI.create(url + (url.contains("?") ? "&" : "?") + encoded);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
