package com.medkg.ingestion.core.ledger;

import com.medkg.ingestion.core.statemachine.LedgerState;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 문서의 현재 상태 (감사 레코드를 접은 결과).
 *
 * <p>전이가 일어날 때마다 새 인스턴스로 교체되며, 삭제되지 않습니다.</p>
 *
 * @author Ingestion Team
 * @since 1.0.0
 * @param docId 문서 ID
 * @param state 현재 상태
 * @param updatedAt 마지막 전이 시각
 * @param adapter 어댑터를 기록한 가장 최근 전이의 어댑터 (nullable)
 * @param metadata 메타데이터를 기록한 가장 최근 전이의 메타데이터
 * @param retryCount 누적 재시도 횟수
 */
public record DocumentLedgerEntry(
    String docId,
    LedgerState state,
    Instant updatedAt,
    String adapter,
    Map<String, Object> metadata,
    int retryCount
) {

    public DocumentLedgerEntry {
        if (docId == null || docId.isBlank()) {
            throw new IllegalArgumentException("docId cannot be null or blank");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (updatedAt == null) {
            throw new IllegalArgumentException("updatedAt cannot be null");
        }
        metadata = metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * 감사 레코드를 적용한 다음 엔트리.
     *
     * <p>retry_count, adapter, metadata가 기록되지 않은 레코드(null 또는 빈 메타데이터)는
     * 이전 값을 유지합니다.</p>
     *
     * @param previous 이전 엔트리 (처음 보는 문서면 null)
     * @param record 적용할 레코드
     * @return 새 엔트리
     */
    public static DocumentLedgerEntry apply(DocumentLedgerEntry previous, LedgerAuditRecord record) {
        int retries = record.retryCount() != null
            ? record.retryCount()
            : previous == null ? 0 : previous.retryCount();
        String adapter = record.adapter() != null || previous == null
            ? record.adapter()
            : previous.adapter();
        Map<String, Object> metadata = !record.metadata().isEmpty() || previous == null
            ? record.metadata()
            : previous.metadata();
        return new DocumentLedgerEntry(
            record.docId(),
            record.newState(),
            record.occurredAt(),
            adapter,
            metadata,
            retries
        );
    }
}
