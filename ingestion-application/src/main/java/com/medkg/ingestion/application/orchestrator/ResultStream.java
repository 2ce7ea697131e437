package com.medkg.ingestion.application.orchestrator;

import java.util.Iterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 닫을 수 있는 지연 스트림.
 *
 * <p>끝까지 소비하지 않고 닫으면 생산자가 취소되고 자원이 해제됩니다.
 * {@code hasNext()}는 다음 항목이 준비될 때까지 블로킹할 수 있습니다.</p>
 *
 * @param <T> 항목 타입
 * @author Ingestion Team
 * @since 1.0.0
 */
public interface ResultStream<T> extends Iterator<T>, AutoCloseable {

    /**
     * 생산자를 취소하고 자원을 해제합니다. 여러 번 호출해도 안전합니다.
     */
    @Override
    void close();

    /**
     * 남은 항목을 {@link Stream}으로 노출. 스트림을 닫으면 이 객체도 닫힙니다.
     */
    default Stream<T> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED), false)
            .onClose(this::close);
    }
}
