package com.medkg.ingestion.application.orchestrator;

import com.medkg.ingestion.core.event.BatchProgress;
import com.medkg.ingestion.core.event.PipelineEvent;

import java.util.Optional;

/**
 * 파이프라인 이벤트 스트림.
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public interface EventStream extends ResultStream<PipelineEvent> {

    /**
     * 이 실행의 파이프라인 ID ({@code <source>:<uuid>}).
     */
    String pipelineId();

    /**
     * 실행이 끝난 뒤 만들어진 마지막 체크포인트.
     *
     * <p>스트림을 일찍 닫았거나 큐가 가득 차 마지막 체크포인트를 전달하지 못한 경우에도
     * 여기서 조회할 수 있습니다. 생산자가 아직 끝나지 않았으면 empty입니다.</p>
     */
    Optional<BatchProgress> finalCheckpoint();
}
