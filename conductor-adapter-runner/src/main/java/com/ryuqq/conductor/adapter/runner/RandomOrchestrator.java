package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.application.orchestrator.OrchestratorConfig;
import com.ryuqq.conductor.core.selection.RandomSelectionStrategy;
import com.ryuqq.conductor.core.state.RandomState;

import java.util.Random;

/**
 * 무작위 발화자 오케스트레이터.
 *
 * <p>매 턴 레지스트리를 다시 조회하고, 직전 발화자를 제외한 후보 중 하나를 균등하게 고릅니다.
 * 선택 가능한 에이전트가 없으면 {@link com.ryuqq.conductor.core.exception.NoAgentsAvailableException}으로 실행이 실패합니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class RandomOrchestrator extends TurnBasedOrchestrator<RandomState> {

    static final String FALLBACK_OUTPUT = "Workflow completed without final output";

    public RandomOrchestrator(OrchestratorConfig config, OrchestratorComponents components) {
        this(config, components, new Random());
    }

    /**
     * 생성자 (난수 소스 지정).
     *
     * @param config 설정
     * @param components 외부 협력 객체
     * @param random 난수 소스
     */
    public RandomOrchestrator(OrchestratorConfig config, OrchestratorComponents components, Random random) {
        super(config, components, strategy(config, components, random), new TurnExecutor());
    }

    @Override
    protected String fallbackOutput() {
        return FALLBACK_OUTPUT;
    }

    private static RandomSelectionStrategy strategy(
        OrchestratorConfig config,
        OrchestratorComponents components,
        Random random
    ) {
        if (config == null || components == null) {
            throw new IllegalArgumentException("config and components cannot be null");
        }
        return new RandomSelectionStrategy(components.registry(), config.name(), random, config.currentSpeaker());
    }
}
