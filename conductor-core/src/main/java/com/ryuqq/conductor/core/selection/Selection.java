package com.ryuqq.conductor.core.selection;

import com.ryuqq.conductor.core.state.StrategyState;

/**
 * 선택 결과: 다음 발화자와 갱신된 전략 상태.
 *
 * @param agentName 선택된 에이전트
 * @param nextState 다음 턴에 사용할 전략 상태
 * @param <S> 전략 상태 타입
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public record Selection<S extends StrategyState>(String agentName, S nextState) {

    public Selection {
        if (agentName == null || agentName.isBlank()) {
            throw new IllegalArgumentException("agentName cannot be null or blank");
        }
        if (nextState == null) {
            throw new IllegalArgumentException("nextState cannot be null");
        }
    }
}
