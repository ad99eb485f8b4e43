package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.application.observe.TurnListener;
import com.ryuqq.conductor.core.spi.AgentRegistry;
import com.ryuqq.conductor.core.spi.MessageBus;
import com.ryuqq.conductor.core.spi.WorkflowRuntime;
import com.ryuqq.conductor.core.spi.WorkflowStateStore;

/**
 * 오케스트레이터가 사용하는 외부 협력 객체 묶음.
 *
 * @param registry 에이전트 레지스트리
 * @param bus 메시지 버스
 * @param runtime 워크플로 런타임
 * @param stateStore 워크플로 상태 저장소
 * @param localStateStore 로컬 미러 저장소 (null 가능, saveStateLocally=true일 때만 사용)
 * @param listener 턴 진행 리스너
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public record OrchestratorComponents(
    AgentRegistry registry,
    MessageBus bus,
    WorkflowRuntime runtime,
    WorkflowStateStore stateStore,
    WorkflowStateStore localStateStore,
    TurnListener listener
) {

    /**
     * Compact Constructor.
     *
     * <p>listener가 null이면 {@link TurnListener#NO_OP}을 사용합니다.</p>
     *
     * @throws IllegalArgumentException 필수 협력 객체가 null인 경우
     */
    public OrchestratorComponents {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (bus == null) {
            throw new IllegalArgumentException("bus cannot be null");
        }
        if (runtime == null) {
            throw new IllegalArgumentException("runtime cannot be null");
        }
        if (stateStore == null) {
            throw new IllegalArgumentException("stateStore cannot be null");
        }
        listener = listener == null ? TurnListener.NO_OP : listener;
    }

    public static OrchestratorComponents of(
        AgentRegistry registry,
        MessageBus bus,
        WorkflowRuntime runtime,
        WorkflowStateStore stateStore
    ) {
        return new OrchestratorComponents(registry, bus, runtime, stateStore, null, TurnListener.NO_OP);
    }

    public OrchestratorComponents withLocalStateStore(WorkflowStateStore localStateStore) {
        return new OrchestratorComponents(registry, bus, runtime, stateStore, localStateStore, listener);
    }

    public OrchestratorComponents withListener(TurnListener listener) {
        return new OrchestratorComponents(registry, bus, runtime, stateStore, localStateStore, listener);
    }
}
