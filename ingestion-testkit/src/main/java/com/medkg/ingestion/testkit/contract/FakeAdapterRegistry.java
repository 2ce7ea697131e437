package com.medkg.ingestion.testkit.contract;

import com.medkg.ingestion.core.spi.Adapter;
import com.medkg.ingestion.core.spi.AdapterContext;
import com.medkg.ingestion.core.spi.AdapterRegistry;
import com.medkg.ingestion.core.spi.HttpTransport;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 등록된 {@link FakeAdapter} 인스턴스를 그대로 돌려주는 레지스트리.
 *
 * <p>{@code getAdapter} 호출 시 받은 {@link AdapterContext}를 어댑터에 연결해
 * Ledger 추적이 켜진 어댑터가 같은 Ledger를 쓰도록 합니다.</p>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public class FakeAdapterRegistry implements AdapterRegistry {

    private final Map<String, FakeAdapter> adapters = new ConcurrentHashMap<>();
    private final AtomicInteger lookups = new AtomicInteger();

    public FakeAdapterRegistry register(String source, FakeAdapter adapter) {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source cannot be null or blank");
        }
        if (adapter == null) {
            throw new IllegalArgumentException("adapter cannot be null");
        }
        adapters.put(source, adapter);
        return this;
    }

    @Override
    public Adapter getAdapter(String source, AdapterContext context, HttpTransport transport) {
        FakeAdapter adapter = adapters.get(source);
        if (adapter == null) {
            throw new IllegalArgumentException(
                "Unknown adapter source: '" + source + "' (available: " + availableSources() + ")");
        }
        lookups.incrementAndGet();
        adapter.attach(context, transport);
        return adapter;
    }

    @Override
    public Set<String> availableSources() {
        return Collections.unmodifiableSet(new TreeSet<>(adapters.keySet()));
    }

    public int lookupCount() {
        return lookups.get();
    }

    public void clear() {
        adapters.clear();
    }
}
