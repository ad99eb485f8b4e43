package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.application.orchestrator.OrchestratorConfig;
import com.ryuqq.conductor.application.orchestrator.OrchestratorWorkflow;
import com.ryuqq.conductor.core.selection.StrategyType;

/**
 * 전략 태그로 오케스트레이터 생성.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class Orchestrators {

    private Orchestrators() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 오케스트레이터 생성.
     *
     * @param type 선택 전략
     * @param config 설정
     * @param components 외부 협력 객체
     * @return 생성된 오케스트레이터 (레지스트리 등록 완료)
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static OrchestratorWorkflow create(
        StrategyType type,
        OrchestratorConfig config,
        OrchestratorComponents components
    ) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return switch (type) {
            case RANDOM -> new RandomOrchestrator(config, components);
            case ROUND_ROBIN -> new RoundRobinOrchestrator(config, components);
        };
    }

    /**
     * 태그 문자열로 오케스트레이터 생성.
     *
     * @param tag 전략 태그 (예: "random", "round-robin")
     * @param config 설정
     * @param components 외부 협력 객체
     * @return 생성된 오케스트레이터
     * @throws IllegalArgumentException 알 수 없는 태그인 경우
     */
    public static OrchestratorWorkflow create(String tag, OrchestratorConfig config, OrchestratorComponents components) {
        return create(StrategyType.fromTag(tag), config, components);
    }
}
