package com.medkg.ingestion.core.statemachine;

import com.medkg.ingestion.core.ledger.LedgerCorruptionException;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 과거 버전의 상태 라벨을 현재 {@link LedgerState}로 해석하는 단일 조회 테이블.
 *
 * <p>로그 디코딩 시점에 한 번만 사용되며, 런타임 상태 로직은 별칭을 알지 못합니다.</p>
 *
 * <p><strong>해석 순서:</strong></p>
 * <ol>
 *   <li>레거시 별칭 (예: {@code auto_done} → COMPLETED)</li>
 *   <li>대소문자 무관한 enum 이름 (예: {@code "completed"})</li>
 * </ol>
 *
 * <p>old_state 자리의 {@code "legacy"} 토큰은 마이그레이션된 시드 레코드를 의미하며
 * 해당 레코드의 new_state로 대체됩니다.</p>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public final class StateAliases {

    /**
     * 마이그레이션 시드 레코드의 old_state 토큰.
     */
    public static final String LEGACY_TOKEN = "legacy";

    private static final Map<String, LedgerState> ALIASES = Map.of(
        "auto_done", LedgerState.COMPLETED,
        "auto_failed", LedgerState.FAILED,
        "auto_inflight", LedgerState.FETCHING,
        "mineru_failed", LedgerState.FAILED,
        "mineru_inflight", LedgerState.IR_BUILDING,
        "pdf_downloaded", LedgerState.FETCHED,
        "pdf_ir_ready", LedgerState.IR_READY,
        "ir_exists", LedgerState.IR_READY,
        "ir_written", LedgerState.IR_READY,
        "postpdf_started", LedgerState.EMBEDDING
    );

    // Utility class - prevent instantiation
    private StateAliases() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 라벨을 상태로 해석.
     *
     * @param label 상태 라벨 (별칭 또는 enum 이름)
     * @return 해석된 상태, 알 수 없거나 비어 있으면 empty
     */
    public static Optional<LedgerState> resolve(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        LedgerState alias = ALIASES.get(normalized);
        if (alias != null) {
            return Optional.of(alias);
        }
        try {
            return Optional.of(LedgerState.valueOf(normalized.toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * 로그에서 읽은 라벨을 디코딩.
     *
     * @param label 상태 라벨
     * @param legacyFallback label이 {@code "legacy"}일 때 사용할 상태 (없으면 null)
     * @return 해석된 상태
     * @throws LedgerCorruptionException 해석할 수 없는 라벨인 경우
     */
    public static LedgerState decode(String label, LedgerState legacyFallback) {
        if (legacyFallback != null && label != null && LEGACY_TOKEN.equalsIgnoreCase(label.trim())) {
            return legacyFallback;
        }
        return resolve(label).orElseThrow(
            () -> new LedgerCorruptionException("Unknown ledger state label: '" + label + "'")
        );
    }

    /**
     * 등록된 레거시 별칭 목록.
     */
    public static Map<String, LedgerState> aliases() {
        return ALIASES;
    }
}
