package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.application.orchestrator.OrchestratorConfig;
import com.ryuqq.conductor.core.selection.RoundRobinSelectionStrategy;
import com.ryuqq.conductor.core.state.RoundRobinState;

/**
 * 순환 발화자 오케스트레이터.
 *
 * <p>실행 시작 시 에이전트 목록을 한 번 조회해 고정하고, 그 순서대로 돌아가며 선택합니다.
 * 목록이 비어 있으면 브로드캐스트 없이 안내 문구를 반환합니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class RoundRobinOrchestrator extends TurnBasedOrchestrator<RoundRobinState> {

    static final String FALLBACK_OUTPUT = "Round Robin workflow completed without final output";
    static final String NO_AGENTS_OUTPUT = "No agents available for round-robin workflow";

    public RoundRobinOrchestrator(OrchestratorConfig config, OrchestratorComponents components) {
        super(config, components, strategy(config, components), new TurnExecutor());
    }

    @Override
    protected String fallbackOutput() {
        return FALLBACK_OUTPUT;
    }

    @Override
    protected String exhaustedOutput() {
        return NO_AGENTS_OUTPUT;
    }

    private static RoundRobinSelectionStrategy strategy(OrchestratorConfig config, OrchestratorComponents components) {
        if (config == null || components == null) {
            throw new IllegalArgumentException("config and components cannot be null");
        }
        return new RoundRobinSelectionStrategy(components.registry(), config.name(), config.currentAgentIndex());
    }
}
