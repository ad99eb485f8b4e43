package com.ryuqq.conductor.core.exception;

/**
 * 레지스트리에 없는 에이전트를 트리거하려 한 경우.
 *
 * <p>턴을 진행할 수 없으므로 워크플로 인스턴스 전체를 실패시킵니다.
 * 로컬 재시도는 하지 않으며, 재시도 정책은 durable runtime의 몫입니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public class AgentNotFoundException extends RuntimeException {

    private final String agentName;

    public AgentNotFoundException(String agentName) {
        super("Agent " + agentName + " not found in registry");
        this.agentName = agentName;
    }

    /**
     * 찾지 못한 에이전트 이름.
     *
     * @return 에이전트 이름
     */
    public String getAgentName() {
        return agentName;
    }
}
