package com.ryuqq.conductor.core.selection;

import com.ryuqq.conductor.core.exception.NoAgentsAvailableException;
import com.ryuqq.conductor.core.spi.AgentRegistry;
import com.ryuqq.conductor.core.state.RandomState;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 무작위 발화자 선택.
 *
 * <p>선택마다 레지스트리를 다시 조회하며(자기 자신과 오케스트레이터 제외),
 * 후보가 둘 이상이면 직전 발화자를 후보에서 제외합니다.
 * 후보가 하나뿐이면 직전 발화자라도 그대로 선택합니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class RandomSelectionStrategy implements SelectionStrategy<RandomState> {

    static final String NO_AGENTS_MESSAGE = "No agents available for selection";

    private final AgentRegistry registry;
    private final String callerName;
    private final Random random;
    private final String initialSpeaker;

    /**
     * Constructor.
     *
     * @param registry 에이전트 레지스트리
     * @param callerName 호출한 오케스트레이터 이름 (조회 시 제외)
     * @param random 난수 소스
     * @param initialSpeaker 초기 직전 발화자 (null 가능)
     * @throws IllegalArgumentException registry, callerName, random이 null인 경우
     */
    public RandomSelectionStrategy(AgentRegistry registry, String callerName, Random random, String initialSpeaker) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (callerName == null || callerName.isBlank()) {
            throw new IllegalArgumentException("callerName cannot be null or blank");
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.registry = registry;
        this.callerName = callerName;
        this.random = random;
        this.initialSpeaker = initialSpeaker;
    }

    @Override
    public StrategyType type() {
        return StrategyType.RANDOM;
    }

    @Override
    public Class<RandomState> stateType() {
        return RandomState.class;
    }

    @Override
    public RandomState initialState() {
        return new RandomState(initialSpeaker);
    }

    @Override
    public Selection<RandomState> select(RandomState state) {
        List<String> candidates = new ArrayList<>(registry.getAgents(callerName, true, true).keySet());
        if (candidates.isEmpty()) {
            throw new NoAgentsAvailableException(NO_AGENTS_MESSAGE);
        }

        if (state.hasCurrentSpeaker() && candidates.size() > 1) {
            candidates.remove(state.currentSpeaker());
        }

        String chosen = candidates.get(random.nextInt(candidates.size()));
        return new Selection<>(chosen, new RandomState(chosen));
    }
}
