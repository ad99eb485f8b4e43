package com.ryuqq.conductor.core.state;

/**
 * 워크플로 인스턴스 하나의 턴 루프 상태.
 *
 * <p>인스턴스 호출마다 생성되어 턴 단위로 다음 값으로 교체되고, 종료 시 버려집니다.
 * 인스턴스 간에 공유되지 않습니다.</p>
 *
 * <p><strong>불변식:</strong> {@code 1 ≤ turn ≤ maxIterations}</p>
 *
 * @param turn 현재 턴 (1부터 시작)
 * @param maxIterations 최대 턴 수
 * @param timeoutSeconds 턴당 응답 대기 시간 (초)
 * @param strategyState 선택 전략 상태
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public record OrchestratorState(
    int turn,
    int maxIterations,
    int timeoutSeconds,
    StrategyState strategyState
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 불변식 위반 또는 strategyState가 null인 경우
     */
    public OrchestratorState {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive (current: " + maxIterations + ")");
        }
        if (turn < 1 || turn > maxIterations) {
            throw new IllegalArgumentException(
                String.format("turn must be between 1 and %d (current: %d)", maxIterations, turn));
        }
        if (timeoutSeconds < 1) {
            throw new IllegalArgumentException("timeoutSeconds must be positive (current: " + timeoutSeconds + ")");
        }
        if (strategyState == null) {
            throw new IllegalArgumentException("strategyState cannot be null");
        }
    }

    /**
     * 첫 턴 상태 생성.
     *
     * @param maxIterations 최대 턴 수
     * @param timeoutSeconds 응답 대기 시간 (초)
     * @param strategyState 초기 전략 상태
     * @return turn=1인 OrchestratorState
     */
    public static OrchestratorState initial(int maxIterations, int timeoutSeconds, StrategyState strategyState) {
        return new OrchestratorState(1, maxIterations, timeoutSeconds, strategyState);
    }

    public boolean isFirstTurn() {
        return turn == 1;
    }

    public boolean isFinalTurn() {
        return turn == maxIterations;
    }

    /**
     * 다음 턴 상태.
     *
     * @return turn + 1 상태
     * @throws IllegalStateException 마지막 턴인 경우
     */
    public OrchestratorState nextTurn() {
        if (isFinalTurn()) {
            throw new IllegalStateException("Cannot advance past final turn " + maxIterations);
        }
        return new OrchestratorState(turn + 1, maxIterations, timeoutSeconds, strategyState);
    }

    public OrchestratorState withStrategyState(StrategyState nextStrategyState) {
        return new OrchestratorState(turn, maxIterations, timeoutSeconds, nextStrategyState);
    }

    /**
     * 타이머 단위(밀리초)로 변환한 타임아웃.
     *
     * @return timeoutSeconds * 1000
     */
    public long timeoutMillis() {
        return timeoutSeconds * 1_000L;
    }
}
