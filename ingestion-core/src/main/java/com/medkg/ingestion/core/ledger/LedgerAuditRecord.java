package com.medkg.ingestion.core.ledger;

import com.medkg.ingestion.core.statemachine.LedgerState;
import com.medkg.ingestion.core.statemachine.StateAliases;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 하나의 상태 전이를 기록한 불변 감사 레코드.
 *
 * <p>로그 파일에는 레코드당 JSON 한 줄이 기록되며, {@link #toMap()}과
 * {@link #fromMap(Map)}은 서로 정확히 역함수 관계입니다.</p>
 *
 * <p><strong>직렬화 필드:</strong></p>
 * <pre>
 * doc_id, old_state, new_state, timestamp (UTC epoch seconds),
 * adapter, metadata, parameters, retry_count, duration_seconds,
 * error_type, error_message
 * </pre>
 *
 * <p>디코딩 시 상태 라벨은 {@link StateAliases}를 통해 해석되므로
 * 과거 라벨로 기록된 로그도 읽을 수 있습니다.</p>
 *
 * @author Ingestion Team
 * @since 1.0.0
 * @param docId 문서 ID (공백 불가)
 * @param oldState 전이 전 상태
 * @param newState 전이 후 상태
 * @param timestamp 전이 시각 (UTC epoch seconds)
 * @param adapter 전이를 수행한 어댑터 이름 (nullable)
 * @param metadata 자유 형식 메타데이터
 * @param parameters 어댑터 호출 파라미터
 * @param retryCount 재시도 횟수 (nullable)
 * @param durationSeconds 이전 단계 소요 시간 (nullable)
 * @param errorType 실패 시 오류 타입 (nullable)
 * @param errorMessage 실패 시 오류 메시지 (nullable)
 */
public record LedgerAuditRecord(
    String docId,
    LedgerState oldState,
    LedgerState newState,
    double timestamp,
    String adapter,
    Map<String, Object> metadata,
    Map<String, Object> parameters,
    Integer retryCount,
    Double durationSeconds,
    String errorType,
    String errorMessage
) {

    /**
     * Compact constructor (유효성 검증 및 방어적 복사).
     *
     * @throws IllegalArgumentException 필수 값이 비어 있는 경우
     */
    public LedgerAuditRecord {
        if (docId == null || docId.isBlank()) {
            throw new IllegalArgumentException("docId cannot be null or blank");
        }
        if (oldState == null) {
            throw new IllegalArgumentException("oldState cannot be null");
        }
        if (newState == null) {
            throw new IllegalArgumentException("newState cannot be null");
        }
        metadata = immutableCopy(metadata);
        parameters = immutableCopy(parameters);
    }

    /**
     * 전이 시각을 {@link Instant}로 반환.
     */
    public Instant occurredAt() {
        return toInstant(timestamp);
    }

    /**
     * epoch seconds를 마이크로초 정밀도의 {@link Instant}로 변환.
     *
     * <p>double은 현재 시각 기준 약 0.25µs 정밀도이므로 마이크로초로 반올림해야
     * 로그와 스냅샷을 오가는 변환이 안정적입니다.</p>
     *
     * @param epochSeconds UTC epoch seconds
     * @return 변환된 시각
     */
    public static Instant toInstant(double epochSeconds) {
        long seconds = (long) Math.floor(epochSeconds);
        long micros = Math.round((epochSeconds - seconds) * 1_000_000L);
        return Instant.ofEpochSecond(seconds, micros * 1_000L);
    }

    /**
     * {@link Instant}를 epoch seconds로 변환.
     */
    public static double toEpochSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
    }

    /**
     * 로그 한 줄에 해당하는 Map으로 변환.
     *
     * @return 삽입 순서가 유지되는 Map (snake_case 키)
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("doc_id", docId);
        map.put("old_state", oldState.name());
        map.put("new_state", newState.name());
        map.put("timestamp", timestamp);
        map.put("adapter", adapter);
        map.put("metadata", new LinkedHashMap<>(metadata));
        map.put("parameters", new LinkedHashMap<>(parameters));
        map.put("retry_count", retryCount);
        map.put("duration_seconds", durationSeconds);
        map.put("error_type", errorType);
        map.put("error_message", errorMessage);
        return map;
    }

    /**
     * 로그 한 줄을 레코드로 복원.
     *
     * @param map JSON 객체를 읽은 Map
     * @return 복원된 레코드
     * @throws LedgerCorruptionException 필수 필드가 없거나 형식이 잘못된 경우
     */
    public static LedgerAuditRecord fromMap(Map<String, Object> map) {
        if (map == null) {
            throw new LedgerCorruptionException("Ledger record cannot be null");
        }
        Object docId = map.get("doc_id");
        if (!(docId instanceof String) || ((String) docId).isBlank()) {
            throw new LedgerCorruptionException("Ledger record has no doc_id: " + map);
        }
        LedgerState newState = StateAliases.decode(asString(map.get("new_state")), null);
        LedgerState oldState = StateAliases.decode(asString(map.get("old_state")), newState);

        Object timestamp = map.get("timestamp");
        if (!(timestamp instanceof Number)) {
            throw new LedgerCorruptionException("Ledger record for " + docId + " has no numeric timestamp");
        }

        return new LedgerAuditRecord(
            (String) docId,
            oldState,
            newState,
            ((Number) timestamp).doubleValue(),
            asString(map.get("adapter")),
            asMap(map.get("metadata"), "metadata", docId),
            asMap(map.get("parameters"), "parameters", docId),
            map.get("retry_count") instanceof Number n ? Integer.valueOf(n.intValue()) : null,
            map.get("duration_seconds") instanceof Number n ? Double.valueOf(n.doubleValue()) : null,
            asString(map.get("error_type")),
            asString(map.get("error_message"))
        );
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String field, Object docId) {
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new LedgerCorruptionException(
                "Ledger record for " + docId + " has non-object " + field + ": " + value
            );
        }
        return (Map<String, Object>) value;
    }

    private static Map<String, Object> immutableCopy(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
