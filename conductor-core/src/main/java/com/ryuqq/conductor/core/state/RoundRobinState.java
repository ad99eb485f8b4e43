package com.ryuqq.conductor.core.state;

import java.util.List;

/**
 * Round-Robin 전략 상태.
 *
 * <p>agentNames는 실행 시작 시점에 한 번 갱신되며, 실행 중에는 다시 갱신되지 않습니다.</p>
 *
 * @param currentAgentIndex 다음에 선택할 인덱스 (0 이상)
 * @param agentNames 실행 시작 시점의 에이전트 목록 (레지스트리 순서)
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public record RoundRobinState(
    int currentAgentIndex,
    List<String> agentNames
) implements StrategyState {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException currentAgentIndex가 음수인 경우
     */
    public RoundRobinState {
        if (currentAgentIndex < 0) {
            throw new IllegalArgumentException("currentAgentIndex must be non-negative (current: " + currentAgentIndex + ")");
        }
        agentNames = agentNames == null ? List.of() : List.copyOf(agentNames);
    }

    /**
     * 목록이 아직 없는 초기 상태.
     *
     * @param startIndex 시작 인덱스
     * @return RoundRobinState
     */
    public static RoundRobinState startingAt(int startIndex) {
        return new RoundRobinState(startIndex, List.of());
    }

    /**
     * 새 에이전트 목록으로 갱신. 인덱스가 범위를 벗어나면 0으로 초기화합니다.
     *
     * @param refreshedNames 갱신된 에이전트 목록
     * @return 갱신된 상태
     */
    public RoundRobinState refreshedWith(List<String> refreshedNames) {
        List<String> names = refreshedNames == null ? List.of() : refreshedNames;
        int index = currentAgentIndex >= names.size() ? 0 : currentAgentIndex;
        return new RoundRobinState(index, names);
    }

    /**
     * 현재 인덱스의 에이전트.
     *
     * @return 에이전트 이름
     * @throws IllegalStateException 목록이 비어 있는 경우
     */
    public String currentAgent() {
        if (agentNames.isEmpty()) {
            throw new IllegalStateException("No agents available for round-robin selection");
        }
        return agentNames.get(currentAgentIndex);
    }

    /**
     * 인덱스를 한 칸 전진 ({@code (index + 1) mod size}).
     *
     * @return 전진된 상태
     * @throws IllegalStateException 목록이 비어 있는 경우
     */
    public RoundRobinState advance() {
        if (agentNames.isEmpty()) {
            throw new IllegalStateException("No agents available for round-robin selection");
        }
        return new RoundRobinState((currentAgentIndex + 1) % agentNames.size(), agentNames);
    }

    public boolean isEmpty() {
        return agentNames.isEmpty();
    }
}
