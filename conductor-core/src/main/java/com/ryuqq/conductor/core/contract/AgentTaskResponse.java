package com.ryuqq.conductor.core.contract;

import com.ryuqq.conductor.core.model.MessageRole;

/**
 * Trigger에 대한 에이전트 응답.
 *
 * <p>에이전트로부터 외부 이벤트로 수신되거나, 타임아웃 시 로컬에서 sentinel로 합성됩니다.</p>
 *
 * @param role 발신 역할
 * @param content 응답 본문 (null 가능)
 * @param name 응답한 에이전트 이름 (null 가능)
 * @param workflowInstanceId 원본 워크플로 인스턴스 ID (null 가능)
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public record AgentTaskResponse(
    MessageRole role,
    String content,
    String name,
    String workflowInstanceId
) {

    /**
     * 타임아웃 sentinel의 name 값.
     */
    public static final String TIMEOUT_NAME = "timeout";

    /**
     * 타임아웃 sentinel의 content 값.
     */
    public static final String TIMEOUT_CONTENT = "Timeout occurred. Continuing...";

    /**
     * Compact Constructor.
     *
     * <p>content는 null을 허용합니다. 빈 응답은 최종 턴에서 fallback 출력으로 대체됩니다.</p>
     *
     * @throws IllegalArgumentException role이 null인 경우
     */
    public AgentTaskResponse {
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
    }

    /**
     * assistant 역할의 응답 생성.
     *
     * @param name 에이전트 이름
     * @param content 응답 본문 (null 가능)
     * @param workflowInstanceId 워크플로 인스턴스 ID
     * @return AgentTaskResponse
     */
    public static AgentTaskResponse fromAgent(String name, String content, String workflowInstanceId) {
        return new AgentTaskResponse(MessageRole.ASSISTANT, content, name, workflowInstanceId);
    }

    /**
     * 타임아웃 sentinel 생성.
     *
     * @return {@code {role: system, name: "timeout", content: TIMEOUT_CONTENT}}
     */
    public static AgentTaskResponse timeout() {
        return new AgentTaskResponse(MessageRole.SYSTEM, TIMEOUT_CONTENT, TIMEOUT_NAME, null);
    }

    /**
     * 타임아웃 sentinel인지 확인.
     *
     * @return name과 content가 sentinel 값과 일치하면 true
     */
    public boolean isTimeoutSentinel() {
        return TIMEOUT_NAME.equals(name) && TIMEOUT_CONTENT.equals(content);
    }

    /**
     * 본문이 비어 있는지 확인.
     *
     * @return content가 null이거나 공백인 경우 true
     */
    public boolean hasNoContent() {
        return content == null || content.isBlank();
    }
}
