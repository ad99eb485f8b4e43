package com.ryuqq.conductor.core.state;

import com.ryuqq.conductor.core.contract.AgentTaskResponse;
import com.ryuqq.conductor.core.turn.TurnResult;

import java.util.ArrayList;
import java.util.List;

/**
 * 워크플로 인스턴스 한 건의 실행 기록.
 *
 * @param instanceId 인스턴스 ID
 * @param task 초기 작업 (null 가능)
 * @param turns 완료된 턴 결과 (순서대로)
 * @param messages processAgentResponse로 기록된 에이전트 응답
 * @param output 최종 출력 (종료 전 null)
 * @param status 실행 상태
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public record InstanceRecord(
    String instanceId,
    String task,
    List<TurnResult> turns,
    List<AgentTaskResponse> messages,
    String output,
    InstanceStatus status
) {

    public InstanceRecord {
        if (instanceId == null || instanceId.isBlank()) {
            throw new IllegalArgumentException("instanceId cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        turns = turns == null ? List.of() : List.copyOf(turns);
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    /**
     * 실행 시작 기록 생성.
     *
     * @param instanceId 인스턴스 ID
     * @param task 초기 작업
     * @return RUNNING 상태 기록
     */
    public static InstanceRecord started(String instanceId, String task) {
        return new InstanceRecord(instanceId, task, List.of(), List.of(), null, InstanceStatus.RUNNING);
    }

    public InstanceRecord withTurn(TurnResult result) {
        List<TurnResult> next = new ArrayList<>(turns);
        next.add(result);
        return new InstanceRecord(instanceId, task, next, messages, output, status);
    }

    public InstanceRecord withMessage(AgentTaskResponse message) {
        List<AgentTaskResponse> next = new ArrayList<>(messages);
        next.add(message);
        return new InstanceRecord(instanceId, task, turns, next, output, status);
    }

    public InstanceRecord completed(String finalOutput) {
        return new InstanceRecord(instanceId, task, turns, messages, finalOutput, InstanceStatus.COMPLETED);
    }

    public InstanceRecord failed(String reason) {
        return new InstanceRecord(instanceId, task, turns, messages, reason, InstanceStatus.FAILED);
    }
}
