package com.ryuqq.conductor.core.turn;

/**
 * 턴 단계 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>INIT → BROADCAST, INIT → TERMINAL</li>
 *   <li>BROADCAST → SELECT</li>
 *   <li>SELECT → TRIGGER</li>
 *   <li>TRIGGER → AWAIT</li>
 *   <li>AWAIT → RESPONDED, AWAIT → TIMED_OUT</li>
 *   <li>RESPONDED, TIMED_OUT → SELECT, TERMINAL</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>TERMINAL에서는 어떤 단계로도 전이 불가</li>
 *   <li>첫 턴은 반드시 BROADCAST를 거침 (INIT → SELECT 불가)</li>
 * </ul>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class TurnTransition {

    private TurnTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 단계 전이가 유효한지 검증.
     *
     * @param from 현재 단계
     * @param to 전이할 단계
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(TurnPhase from, TurnPhase to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Phases cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal phase: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case INIT -> to == TurnPhase.BROADCAST || to == TurnPhase.TERMINAL;
            case BROADCAST -> to == TurnPhase.SELECT;
            case SELECT -> to == TurnPhase.TRIGGER;
            case TRIGGER -> to == TurnPhase.AWAIT;
            case AWAIT -> to == TurnPhase.RESPONDED || to == TurnPhase.TIMED_OUT;
            case RESPONDED, TIMED_OUT -> to == TurnPhase.SELECT || to == TurnPhase.TERMINAL;
            case TERMINAL -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid turn transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 단계 전이 실행 (검증 후).
     *
     * @param current 현재 단계
     * @param next 다음 단계
     * @return 전이된 단계 (next)
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static TurnPhase transition(TurnPhase current, TurnPhase next) {
        validate(current, next);
        return next;
    }
}
