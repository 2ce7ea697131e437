package com.medkg.ingestion.core.event;

import java.time.Instant;
import java.util.Map;

/**
 * 스트리밍 수집 중 소비자에게 전달되는 이벤트.
 *
 * <p>모든 이벤트는 불변이며 {@code pipelineId}와 {@code timestamp}를 가집니다.</p>
 * <ul>
 *   <li>{@link DocumentStarted}: 문서 처리 시작</li>
 *   <li>{@link DocumentCompleted}: 문서 처리 완료</li>
 *   <li>{@link DocumentFailed}: 문서 처리 실패</li>
 *   <li>{@link AdapterStateChange}: 어댑터 생명주기 변화</li>
 *   <li>{@link AdapterRetry}: 전송 계층 재시도</li>
 *   <li>{@link BatchProgress}: 진행률 및 체크포인트</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 구현 타입이 닫혀 있습니다.</p>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public sealed interface PipelineEvent
    permits DocumentStarted, DocumentCompleted, DocumentFailed, AdapterStateChange, AdapterRetry, BatchProgress {

    /**
     * 이벤트를 만든 파이프라인 실행 ID ({@code <source>:<uuid>}).
     *
     * <p>어댑터가 직접 만든 이벤트는 오케스트레이터가 채우기 전까지 null일 수 있습니다.</p>
     */
    String pipelineId();

    /**
     * 이벤트 발생 시각.
     */
    Instant timestamp();

    /**
     * 이벤트 타입 이름 (예: "DocumentCompleted").
     */
    default String type() {
        return getClass().getSimpleName();
    }

    /**
     * 누락된 pipelineId와 timestamp를 채운 사본.
     *
     * <p>이미 값이 있는 필드는 유지합니다.</p>
     *
     * @param pipelineId 파이프라인 ID
     * @param now 현재 시각
     * @return 채워진 이벤트 (변경이 없으면 this)
     */
    PipelineEvent withPipelineContext(String pipelineId, Instant now);

    /**
     * JSON 직렬화에 적합한 Map 표현 ({@code type} 키 포함).
     */
    Map<String, Object> toMap();
}
