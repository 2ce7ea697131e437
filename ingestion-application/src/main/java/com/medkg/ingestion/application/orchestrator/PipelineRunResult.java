package com.medkg.ingestion.application.orchestrator;

import com.medkg.ingestion.core.event.BatchProgress;
import com.medkg.ingestion.core.event.DocumentFailed;
import com.medkg.ingestion.core.event.PipelineEvent;
import com.medkg.ingestion.core.model.Document;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 스트림을 끝까지 소비한 실행 결과.
 *
 * @author Ingestion Team
 * @since 1.0.0
 * @param pipelineId 파이프라인 ID
 * @param source 소스 이름
 * @param documents 완료된 문서 (완료 순)
 * @param failures 실패 이벤트
 * @param events 필터와 변환을 거쳐 전달된 전체 이벤트
 * @param finalCheckpoint 마지막 체크포인트
 * @param startedAt 시작 시각
 * @param completedAt 종료 시각
 */
public record PipelineRunResult(
    String pipelineId,
    String source,
    List<Document> documents,
    List<DocumentFailed> failures,
    List<PipelineEvent> events,
    Optional<BatchProgress> finalCheckpoint,
    Instant startedAt,
    Instant completedAt
) {

    public PipelineRunResult {
        documents = List.copyOf(documents);
        failures = List.copyOf(failures);
        events = List.copyOf(events);
        finalCheckpoint = finalCheckpoint == null ? Optional.empty() : finalCheckpoint;
    }

    public int successCount() {
        return documents.size();
    }

    public int failureCount() {
        return failures.size();
    }

    /**
     * 실패 없이 끝났는지 여부.
     */
    public boolean succeeded() {
        return failures.isEmpty();
    }

    public Duration duration() {
        return Duration.between(startedAt, completedAt);
    }
}
