package com.ryuqq.conductor.core.selection;

import com.ryuqq.conductor.core.state.StrategyState;

/**
 * 다음 발화자 선택 전략.
 *
 * <p>구현체는 상태를 필드에 보관하지 않습니다. 모든 인스턴스별 상태는
 * 인자로 전달되고 {@link Selection#nextState()}로 반환됩니다.</p>
 *
 * <p><strong>호출 순서 (인스턴스 하나당):</strong></p>
 * <ol>
 *   <li>{@link #initialState()}</li>
 *   <li>{@link #prepare(StrategyState)} 1회</li>
 *   <li>{@link #isExhausted(StrategyState)}가 true면 실행 종료</li>
 *   <li>턴마다 {@link #select(StrategyState)}</li>
 * </ol>
 *
 * @param <S> 전략 상태 타입
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public interface SelectionStrategy<S extends StrategyState> {

    StrategyType type();

    /**
     * 상태 타입 (OrchestratorState에서 꺼낼 때 사용).
     *
     * @return 상태 클래스
     */
    Class<S> stateType();

    /**
     * 설정값으로 초기 상태 생성.
     *
     * @return 초기 전략 상태
     */
    S initialState();

    /**
     * 실행 시작 시 상태 준비. 기본 구현은 상태를 그대로 반환합니다.
     *
     * @param state 초기 상태
     * @return 준비된 상태
     */
    default S prepare(S state) {
        return state;
    }

    /**
     * 선택할 에이전트가 없어 실행을 시작할 수 없는지 확인.
     *
     * <p>기본 구현은 false이며, 빈 레지스트리는 {@link #select(StrategyState)}에서 예외로 보고됩니다.</p>
     *
     * @param state 준비된 상태
     * @return 실행 불가능하면 true
     */
    default boolean isExhausted(S state) {
        return false;
    }

    /**
     * 다음 발화자 선택.
     *
     * @param state 현재 전략 상태
     * @return 선택된 에이전트와 다음 상태
     * @throws com.ryuqq.conductor.core.exception.NoAgentsAvailableException 선택 가능한 에이전트가 없는 경우
     */
    Selection<S> select(S state);
}
