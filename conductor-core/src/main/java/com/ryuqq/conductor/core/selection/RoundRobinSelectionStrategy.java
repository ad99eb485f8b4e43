package com.ryuqq.conductor.core.selection;

import com.ryuqq.conductor.core.spi.AgentRegistry;
import com.ryuqq.conductor.core.state.RoundRobinState;

import java.util.List;

/**
 * 순환 발화자 선택.
 *
 * <p>에이전트 목록은 {@link #prepare(RoundRobinState)}에서 한 번만 조회하며,
 * 실행 도중 레지스트리가 바뀌어도 반영하지 않습니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class RoundRobinSelectionStrategy implements SelectionStrategy<RoundRobinState> {

    private final AgentRegistry registry;
    private final String callerName;
    private final int startIndex;

    /**
     * Constructor.
     *
     * @param registry 에이전트 레지스트리
     * @param callerName 호출한 오케스트레이터 이름
     * @param startIndex 시작 인덱스 (범위를 벗어나면 prepare에서 0으로 초기화)
     * @throws IllegalArgumentException registry, callerName이 null이거나 startIndex가 음수인 경우
     */
    public RoundRobinSelectionStrategy(AgentRegistry registry, String callerName, int startIndex) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (callerName == null || callerName.isBlank()) {
            throw new IllegalArgumentException("callerName cannot be null or blank");
        }
        if (startIndex < 0) {
            throw new IllegalArgumentException("startIndex must be non-negative (current: " + startIndex + ")");
        }
        this.registry = registry;
        this.callerName = callerName;
        this.startIndex = startIndex;
    }

    @Override
    public StrategyType type() {
        return StrategyType.ROUND_ROBIN;
    }

    @Override
    public Class<RoundRobinState> stateType() {
        return RoundRobinState.class;
    }

    @Override
    public RoundRobinState initialState() {
        return RoundRobinState.startingAt(startIndex);
    }

    @Override
    public RoundRobinState prepare(RoundRobinState state) {
        List<String> names = List.copyOf(registry.getAgents(callerName, true, true).keySet());
        return state.refreshedWith(names);
    }

    @Override
    public boolean isExhausted(RoundRobinState state) {
        return state.isEmpty();
    }

    @Override
    public Selection<RoundRobinState> select(RoundRobinState state) {
        return new Selection<>(state.currentAgent(), state.advance());
    }
}
