package com.ryuqq.conductor.core.contract;

/**
 * 단일 에이전트에게 행동을 요청하는 메시지.
 *
 * <p>트리거마다 새로 생성되며 오케스트레이터가 보관하지 않습니다.
 * task가 없으면 에이전트는 자신의 메모리나 기본 동작에 따라 행동합니다.</p>
 *
 * @param task 수행할 작업 (null 가능)
 * @param workflowInstanceId 요청한 워크플로 인스턴스 ID (null 가능)
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public record TriggerAction(
    String task,
    String workflowInstanceId
) {

    /**
     * 작업만 담은 TriggerAction 생성 (워크플로 입력용).
     *
     * @param task 수행할 작업 (null 가능)
     * @return TriggerAction
     */
    public static TriggerAction of(String task) {
        return new TriggerAction(task, null);
    }

    /**
     * 인스턴스 ID를 포함한 TriggerAction 생성.
     *
     * @param task 수행할 작업 (null 가능)
     * @param workflowInstanceId 워크플로 인스턴스 ID
     * @return TriggerAction
     */
    public static TriggerAction of(String task, String workflowInstanceId) {
        return new TriggerAction(task, workflowInstanceId);
    }
}
