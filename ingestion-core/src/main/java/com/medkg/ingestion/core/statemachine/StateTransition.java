package com.medkg.ingestion.core.statemachine;

import com.medkg.ingestion.core.ledger.InvalidStateTransitionException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.medkg.ingestion.core.statemachine.LedgerState.*;

/**
 * 상태 전이 검증 및 실행.
 *
 * <p>이 클래스의 간선 테이블이 허용 전이의 유일한 정의입니다.
 * Ledger의 쓰기 경로와 로그 재생 경로 모두 이 테이블로 검증합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → FETCHING</li>
 *   <li>FETCHING → FETCHED, FAILED, RETRYING</li>
 *   <li>FETCHED → PARSING, FAILED</li>
 *   <li>PARSING → PARSED, FAILED</li>
 *   <li>PARSED → VALIDATING, FAILED</li>
 *   <li>VALIDATING → VALIDATED, FAILED</li>
 *   <li>VALIDATED → IR_BUILDING, FAILED</li>
 *   <li>IR_BUILDING → IR_READY, FAILED</li>
 *   <li>IR_READY → EMBEDDING, COMPLETED, FAILED</li>
 *   <li>EMBEDDING → INDEXED, COMPLETED, FAILED</li>
 *   <li>INDEXED → COMPLETED, FAILED</li>
 *   <li>RETRYING → FETCHING, FAILED</li>
 *   <li>FAILED → RETRYING, FAILED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>COMPLETED에서는 어떤 상태로도 전이 불가</li>
 *   <li>자기 자신으로의 전이는 테이블에 있을 때만 허용 (FAILED → FAILED)</li>
 * </ul>
 *
 * @author Ingestion Team
 * @since 1.0.0
 */
public final class StateTransition {

    private static final Map<LedgerState, Set<LedgerState>> EDGES = new EnumMap<>(LedgerState.class);

    static {
        EDGES.put(PENDING, EnumSet.of(FETCHING));
        EDGES.put(FETCHING, EnumSet.of(FETCHED, FAILED, RETRYING));
        EDGES.put(FETCHED, EnumSet.of(PARSING, FAILED));
        EDGES.put(PARSING, EnumSet.of(PARSED, FAILED));
        EDGES.put(PARSED, EnumSet.of(VALIDATING, FAILED));
        EDGES.put(VALIDATING, EnumSet.of(VALIDATED, FAILED));
        EDGES.put(VALIDATED, EnumSet.of(IR_BUILDING, FAILED));
        EDGES.put(IR_BUILDING, EnumSet.of(IR_READY, FAILED));
        EDGES.put(IR_READY, EnumSet.of(EMBEDDING, COMPLETED, FAILED));
        EDGES.put(EMBEDDING, EnumSet.of(INDEXED, COMPLETED, FAILED));
        EDGES.put(INDEXED, EnumSet.of(COMPLETED, FAILED));
        EDGES.put(RETRYING, EnumSet.of(FETCHING, FAILED));
        EDGES.put(FAILED, EnumSet.of(RETRYING, FAILED));
        EDGES.put(COMPLETED, EnumSet.noneOf(LedgerState.class));
    }

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 주어진 상태에서 이동할 수 있는 상태 집합.
     *
     * @param state 현재 상태
     * @return 변경 불가능한 다음 상태 집합 (COMPLETED는 빈 집합)
     * @throws IllegalArgumentException state가 null인 경우
     */
    public static Set<LedgerState> getValidNextStates(LedgerState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(EDGES.get(state)));
    }

    /**
     * 전이 가능 여부만 확인 (예외 없음).
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 간선 테이블에 있으면 true
     */
    public static boolean isAllowed(LedgerState from, LedgerState to) {
        if (from == null || to == null) {
            return false;
        }
        return EDGES.get(from).contains(to);
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws InvalidStateTransitionException 간선 테이블에 없는 전이인 경우
     */
    public static void validate(LedgerState from, LedgerState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (!EDGES.get(from).contains(to)) {
            throw new InvalidStateTransitionException(from, to);
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws InvalidStateTransitionException 유효하지 않은 전이인 경우
     */
    public static LedgerState transition(LedgerState current, LedgerState next) {
        validate(current, next);
        return next;
    }

    /**
     * 종료 상태 여부 (COMPLETED만 해당).
     */
    public static boolean isTerminalState(LedgerState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        return state.isTerminal();
    }

    /**
     * 재시도 가능 상태 여부 (FAILED만 해당).
     */
    public static boolean isRetryableState(LedgerState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        return state.isRetryable();
    }

    /**
     * 사람이 읽을 수 있는 상태 그래프 설명.
     *
     * <p>운영 도구에서 전이 거부 원인을 안내할 때 사용합니다.</p>
     *
     * @return 상태별 허용 전이 목록 (한 줄에 한 상태)
     */
    public static String describe() {
        StringBuilder sb = new StringBuilder("Ledger state machine:\n");
        for (LedgerState state : LedgerState.values()) {
            sb.append("  ").append(state).append(" → ");
            Set<LedgerState> next = EDGES.get(state);
            if (next.isEmpty()) {
                sb.append("(terminal)");
            } else {
                StringBuilder targets = new StringBuilder();
                for (LedgerState target : next) {
                    if (targets.length() > 0) {
                        targets.append(", ");
                    }
                    targets.append(target);
                }
                sb.append(targets);
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
