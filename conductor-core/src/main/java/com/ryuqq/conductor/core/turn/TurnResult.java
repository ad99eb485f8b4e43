package com.ryuqq.conductor.core.turn;

import com.ryuqq.conductor.core.contract.AgentTaskResponse;

/**
 * 턴 한 번의 결과.
 *
 * <p>응답 대기와 타이머 중 먼저 완료된 쪽의 결과만 기록됩니다.
 * 타임아웃인 경우 response는 {@link AgentTaskResponse#timeout()} sentinel입니다.</p>
 *
 * @param turn 턴 번호 (1부터 시작)
 * @param agentName 선택된 에이전트
 * @param response 에이전트 응답 또는 타임아웃 sentinel
 * @param timedOut 타이머가 먼저 완료되었는지 여부
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public record TurnResult(
    int turn,
    String agentName,
    AgentTaskResponse response,
    boolean timedOut
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException turn이 1 미만이거나 agentName, response가 null인 경우
     */
    public TurnResult {
        if (turn < 1) {
            throw new IllegalArgumentException("turn must be positive (current: " + turn + ")");
        }
        if (agentName == null || agentName.isBlank()) {
            throw new IllegalArgumentException("agentName cannot be null or blank");
        }
        if (response == null) {
            throw new IllegalArgumentException("response cannot be null");
        }
    }

    /**
     * 에이전트가 응답한 턴.
     *
     * @param turn 턴 번호
     * @param agentName 에이전트 이름
     * @param response 수신된 응답
     * @return TurnResult
     */
    public static TurnResult responded(int turn, String agentName, AgentTaskResponse response) {
        return new TurnResult(turn, agentName, response, false);
    }

    /**
     * 타이머가 먼저 완료된 턴.
     *
     * @param turn 턴 번호
     * @param agentName 에이전트 이름
     * @return sentinel 응답을 가진 TurnResult
     */
    public static TurnResult timedOut(int turn, String agentName) {
        return new TurnResult(turn, agentName, AgentTaskResponse.timeout(), true);
    }

    public String content() {
        return response.content();
    }
}
