package com.ryuqq.conductor.application.orchestrator;

import com.ryuqq.conductor.core.contract.AgentTaskResponse;
import com.ryuqq.conductor.core.contract.BroadcastMessage;
import com.ryuqq.conductor.core.contract.TriggerAction;
import com.ryuqq.conductor.core.spi.WorkflowContext;

/**
 * 턴 기반 멀티 에이전트 워크플로 조정자.
 *
 * <p>한 번의 실행은 다음 순서로 진행됩니다.</p>
 * <pre>
 * run(task)
 *   ↓
 * mainWorkflow(context, TriggerAction)
 *   turn 1: broadcast(task)
 *   loop:
 *     select → trigger → await(response | timeout)
 *     turn == maxIterations ? return output : turn + 1
 * </pre>
 *
 * <p>구현체는 하나의 객체가 여러 워크플로 인스턴스를 동시에 실행할 수 있어야 하며,
 * 인스턴스별 상태를 필드에 보관해서는 안 됩니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public interface OrchestratorWorkflow {

    /**
     * 오케스트레이터 이름 (레지스트리 키, 메시지 sender 헤더).
     *
     * @return 이름
     */
    String name();

    /**
     * 새 워크플로 인스턴스를 시작하고 최종 출력까지 실행.
     *
     * @param task 초기 작업 (null 또는 공백이면 기본 안내 문구로 대체)
     * @return 최종 출력
     * @throws com.ryuqq.conductor.core.exception.AgentNotFoundException 선택된 에이전트가 레지스트리에 없는 경우
     * @throws com.ryuqq.conductor.core.exception.NoAgentsAvailableException 선택 가능한 에이전트가 없는 경우 (Random)
     */
    String run(String task);

    /**
     * 턴 루프 본체.
     *
     * @param context 워크플로 런타임 컨텍스트
     * @param input 초기 입력 (task, workflowInstanceId)
     * @return 최종 출력
     */
    String mainWorkflow(WorkflowContext context, TriggerAction input);

    /**
     * 에이전트 응답 기록. 제어 흐름에는 영향을 주지 않습니다.
     *
     * @param response 에이전트 응답
     */
    void processAgentResponse(AgentTaskResponse response);

    /**
     * 오케스트레이터를 제외한 모든 에이전트에게 메시지 발행.
     *
     * <p>에이전트별 발행 실패는 기록만 하고 전체 호출은 실패하지 않습니다.</p>
     *
     * @param message 브로드캐스트 메시지 (null이면 무시)
     */
    void broadcastMessageToAgents(BroadcastMessage message);

    /**
     * 지정한 에이전트의 trigger 토픽으로 TriggerAction 발행.
     *
     * @param name 에이전트 이름
     * @param instanceId 워크플로 인스턴스 ID
     * @param task 작업 (null 가능)
     * @throws com.ryuqq.conductor.core.exception.AgentNotFoundException 레지스트리에 없는 경우
     */
    void triggerAgent(String name, String instanceId, String task);

    /**
     * 레지스트리에서 오케스트레이터 제거.
     */
    void unregister();
}
