package com.medkg.ingestion.testkit.contract;

import com.medkg.ingestion.core.spi.HttpTransport;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 네트워크를 쓰지 않는 {@link HttpTransport}.
 *
 * <p>요청 URL을 기록하고, {@link #simulateRetry}로 바인딩된 재시도 리스너를 직접 호출할 수 있습니다.</p>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public class RecordingHttpTransport implements HttpTransport {

    private final List<String> requestedUrls = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile RetryListener retryListener;

    @Override
    public String getText(String url, Map<String, String> query) {
        requestedUrls.add(url);
        return "";
    }

    @Override
    public Map<String, Object> getJson(String url, Map<String, String> query) {
        requestedUrls.add(url);
        return Map.of();
    }

    @Override
    public void bindRetryListener(RetryListener listener) {
        this.retryListener = listener;
    }

    /**
     * 바인딩된 리스너에 재시도를 알림. 리스너가 없으면 false.
     */
    public boolean simulateRetry(int attempt, String error, Integer statusCode) {
        RetryListener listener = retryListener;
        if (listener == null) {
            return false;
        }
        listener.onRetry(attempt, error, statusCode);
        return true;
    }

    @Override
    public void close() {
        closed.set(true);
    }

    public boolean isClosed() {
        return closed.get();
    }

    public List<String> requestedUrls() {
        return List.copyOf(requestedUrls);
    }
}
