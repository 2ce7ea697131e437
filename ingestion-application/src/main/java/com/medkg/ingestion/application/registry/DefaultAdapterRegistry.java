package com.medkg.ingestion.application.registry;

import com.medkg.ingestion.core.spi.Adapter;
import com.medkg.ingestion.core.spi.AdapterContext;
import com.medkg.ingestion.core.spi.AdapterFactory;
import com.medkg.ingestion.core.spi.AdapterRegistry;
import com.medkg.ingestion.core.spi.HttpTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 명시적으로 구성하는 {@link AdapterRegistry} 구현.
 *
 * <p>전역 상태 없이 소스 이름과 팩토리를 생성 시점에 등록합니다.
 * 생성 이후에는 변경할 수 없습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * AdapterRegistry registry = DefaultAdapterRegistry.builder()
 *     .register("pubmed", PubMedAdapter::new)
 *     .register("clinicaltrials", ClinicalTrialsAdapter::new)
 *     .build();
 * </pre>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public final class DefaultAdapterRegistry implements AdapterRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultAdapterRegistry.class);

    private final Map<String, AdapterFactory> factories;

    private DefaultAdapterRegistry(Map<String, AdapterFactory> factories) {
        this.factories = Collections.unmodifiableMap(new LinkedHashMap<>(factories));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public Adapter getAdapter(String source, AdapterContext context, HttpTransport transport) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        AdapterFactory factory = source == null ? null : factories.get(source);
        if (factory == null) {
            throw new IllegalArgumentException(
                "Unknown adapter source: '" + source + "' (available: " + availableSources() + ")"
            );
        }
        Adapter adapter = factory.create(context, transport);
        if (adapter == null) {
            throw new IllegalStateException("Adapter factory for '" + source + "' returned null");
        }
        log.debug("Created adapter {} for source {}", adapter.name(), source);
        return adapter;
    }

    @Override
    public Set<String> availableSources() {
        return Collections.unmodifiableSet(new TreeSet<>(factories.keySet()));
    }

    /**
     * DefaultAdapterRegistry 빌더.
     */
    public static final class Builder {

        private final Map<String, AdapterFactory> factories = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * 소스 등록.
         *
         * @param source 소스 이름
         * @param factory 어댑터 팩토리
         * @return this
         * @throws IllegalArgumentException 인자가 비어 있거나 이미 등록된 소스인 경우
         */
        public Builder register(String source, AdapterFactory factory) {
            if (source == null || source.isBlank()) {
                throw new IllegalArgumentException("source cannot be null or blank");
            }
            if (factory == null) {
                throw new IllegalArgumentException("factory cannot be null");
            }
            if (factories.putIfAbsent(source, factory) != null) {
                throw new IllegalArgumentException("Adapter source already registered: " + source);
            }
            return this;
        }

        public DefaultAdapterRegistry build() {
            return new DefaultAdapterRegistry(factories);
        }
    }
}
