package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.application.observe.TurnListener;
import com.ryuqq.conductor.application.orchestrator.OrchestratorConfig;
import com.ryuqq.conductor.application.orchestrator.OrchestratorWorkflow;
import com.ryuqq.conductor.core.contract.AgentTaskResponse;
import com.ryuqq.conductor.core.contract.BroadcastMessage;
import com.ryuqq.conductor.core.contract.MessageHeaders;
import com.ryuqq.conductor.core.contract.TriggerAction;
import com.ryuqq.conductor.core.exception.AgentNotFoundException;
import com.ryuqq.conductor.core.model.AgentRecord;
import com.ryuqq.conductor.core.selection.Selection;
import com.ryuqq.conductor.core.selection.SelectionStrategy;
import com.ryuqq.conductor.core.spi.AgentRegistry;
import com.ryuqq.conductor.core.spi.MessageBus;
import com.ryuqq.conductor.core.spi.WorkflowContext;
import com.ryuqq.conductor.core.spi.WorkflowStateStore;
import com.ryuqq.conductor.core.state.InstanceRecord;
import com.ryuqq.conductor.core.state.OrchestratorState;
import com.ryuqq.conductor.core.state.StrategyState;
import com.ryuqq.conductor.core.state.WorkflowState;
import com.ryuqq.conductor.core.turn.TurnPhase;
import com.ryuqq.conductor.core.turn.TurnResult;
import com.ryuqq.conductor.core.turn.TurnTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Workflow Coordinator.
 *
 * <p>턴 루프와 브로드캐스트, trigger, 상태 저장을 담당하며,
 * 다음 발화자 선택만 {@link SelectionStrategy}에 위임합니다.</p>
 *
 * <p><strong>턴 루프:</strong></p>
 * <pre>
 * prepare strategy (에이전트 없음 → exhaustedOutput 반환)
 * turn 1: processInput → broadcast
 * loop:
 *   select → trigger → await(response | timeout)
 *   기록 및 저장
 *   turn == maxIterations ? 최종 출력 반환 : turn + 1
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>인스턴스별 상태는 {@link OrchestratorState} 값으로 루프 안에서만 전달</li>
 *   <li>공유되는 것은 인스턴스 기록 맵뿐이며 stateLock으로 보호</li>
 *   <li>기록은 maxRetainedInstances개까지 보관하며, 넘으면 가장 오래된 종료 기록부터 제거</li>
 *   <li>하나의 객체가 여러 인스턴스를 동시에 실행 가능</li>
 * </ul>
 *
 * <p><strong>실패:</strong> 루프에서 발생한 예외(예: {@link AgentNotFoundException})는
 * 인스턴스 기록을 FAILED로 저장하고 리스너에 알린 뒤 그대로 다시 던집니다.</p>
 *
 * @param <S> 선택 전략 상태 타입
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public abstract class TurnBasedOrchestrator<S extends StrategyState> implements OrchestratorWorkflow {

    static final String DEFAULT_TASK = "Please proceed with the task";

    private static final Logger log = LoggerFactory.getLogger(TurnBasedOrchestrator.class);

    private final OrchestratorConfig config;
    private final OrchestratorComponents components;
    private final SelectionStrategy<S> strategy;
    private final TurnExecutor turnExecutor;
    private final Object stateLock = new Object();
    private final Map<String, InstanceRecord> instances = new LinkedHashMap<>();

    /**
     * 생성자.
     *
     * <p>저장된 워크플로 상태를 불러오고, 레지스트리에 자신을 오케스트레이터로 등록합니다.
     * 이미 같은 이름이 등록되어 있으면 등록을 건너뜁니다.</p>
     *
     * @param config 설정
     * @param components 외부 협력 객체
     * @param strategy 선택 전략
     * @param turnExecutor 턴 대기 실행기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    protected TurnBasedOrchestrator(
        OrchestratorConfig config,
        OrchestratorComponents components,
        SelectionStrategy<S> strategy,
        TurnExecutor turnExecutor
    ) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (components == null) {
            throw new IllegalArgumentException("components cannot be null");
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        if (turnExecutor == null) {
            throw new IllegalArgumentException("turnExecutor cannot be null");
        }
        this.config = config;
        this.components = components;
        this.strategy = strategy;
        this.turnExecutor = turnExecutor;

        restoreState();
        registerSelf();
    }

    /**
     * 최종 턴 응답이 비어 있을 때 반환할 출력.
     *
     * @return fallback 출력
     */
    protected abstract String fallbackOutput();

    /**
     * 실행 시작 시 선택 가능한 에이전트가 없을 때 반환할 출력.
     *
     * @return 기본값은 {@link #fallbackOutput()}
     */
    protected String exhaustedOutput() {
        return fallbackOutput();
    }

    @Override
    public String name() {
        return config.name();
    }

    public OrchestratorConfig config() {
        return config;
    }

    @Override
    public String run(String task) {
        WorkflowContext context = components.runtime().newInstance(config.name());
        return mainWorkflow(context, TriggerAction.of(task, context.instanceId()));
    }

    @Override
    public String mainWorkflow(WorkflowContext context, TriggerAction input) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        String instanceId = context.instanceId();
        String task = input == null ? null : input.task();

        startInstance(instanceId, task);
        try {
            String output = runTurns(context, instanceId, task);
            completeInstance(instanceId, output);
            return output;
        } catch (RuntimeException e) {
            failInstance(instanceId, e);
            throw e;
        }
    }

    private String runTurns(WorkflowContext context, String instanceId, String task) {
        TurnPhase phase = TurnPhase.INIT;

        S prepared = context.callActivity("prepareStrategy", () -> strategy.prepare(strategy.initialState()));
        if (strategy.isExhausted(prepared)) {
            log.warn("{} has no agents to select for instance {}", config.name(), instanceId);
            TurnTransition.validate(phase, TurnPhase.TERMINAL);
            return exhaustedOutput();
        }

        OrchestratorState state = OrchestratorState.initial(
            config.maxIterations(), config.timeoutSeconds(), prepared);

        while (true) {
            if (state.isFirstTurn()) {
                phase = TurnTransition.transition(phase, TurnPhase.BROADCAST);
                BroadcastMessage message = context.callActivity("processInput", () -> processInput(task));
                BroadcastSummary summary = context.callActivity("broadcastMessageToAgents", () -> fanOut(message));
                listener().onBroadcast(instanceId, summary.delivered(), summary.failed());
            }

            phase = TurnTransition.transition(phase, TurnPhase.SELECT);
            S current = strategy.stateType().cast(state.strategyState());
            Selection<S> selection = context.callActivity("selectNextSpeaker", () -> strategy.select(current));
            state = state.withStrategyState(selection.nextState());
            String agentName = selection.agentName();
            listener().onAgentSelected(instanceId, state.turn(), agentName);

            phase = TurnTransition.transition(phase, TurnPhase.TRIGGER);
            context.callActivity("triggerAgent", () -> {
                triggerAgent(agentName, instanceId, null);
                return agentName;
            });

            phase = TurnTransition.transition(phase, TurnPhase.AWAIT);
            TurnResult result = turnExecutor.awaitTurn(context, state.turn(), agentName, state.timeoutMillis());
            phase = TurnTransition.transition(phase, result.timedOut() ? TurnPhase.TIMED_OUT : TurnPhase.RESPONDED);

            if (!result.timedOut()) {
                recordResponse(instanceId, result.response());
            }
            recordTurn(instanceId, result);
            listener().onTurnCompleted(instanceId, result);

            if (state.isFinalTurn()) {
                TurnTransition.validate(phase, TurnPhase.TERMINAL);
                return result.response().hasNoContent() ? fallbackOutput() : result.content();
            }
            state = state.nextTurn();
        }
    }

    /**
     * 초기 작업을 브로드캐스트 메시지로 변환.
     *
     * @param task 초기 작업 (null 가능)
     * @return user 역할 메시지
     */
    protected BroadcastMessage processInput(String task) {
        String content = task == null || task.isBlank() ? DEFAULT_TASK : task;
        return BroadcastMessage.fromUser(content);
    }

    @Override
    public void processAgentResponse(AgentTaskResponse response) {
        if (response == null) {
            log.warn("{} received null agent response", config.name());
            return;
        }
        String instanceId = response.workflowInstanceId();
        if (instanceId == null) {
            log.info("{} received response from {} without instance id", config.name(), response.name());
            return;
        }
        recordResponse(instanceId, response);
    }

    @Override
    public void broadcastMessageToAgents(BroadcastMessage message) {
        fanOut(message);
    }

    private BroadcastSummary fanOut(BroadcastMessage message) {
        if (message == null) {
            log.warn("{} skipped broadcast of null message", config.name());
            return new BroadcastSummary(0, 0);
        }

        Map<String, AgentRecord> agents = registry().getAgents(config.name(), true, true);
        Map<String, String> headers = Map.of(
            MessageHeaders.SENDER, config.name(),
            MessageHeaders.BROADCAST, "true"
        );

        int delivered = 0;
        int failed = 0;
        for (AgentRecord agent : agents.values()) {
            try {
                bus().publish(agent.eventTopic(), message, headers);
                delivered++;
            } catch (RuntimeException e) {
                failed++;
                log.error("Failed to broadcast to {} on {}", agent.name(), agent.eventTopic(), e);
            }
        }

        log.info("{} broadcast to {} agents ({} failed)", config.name(), delivered, failed);
        return new BroadcastSummary(delivered, failed);
    }

    @Override
    public void triggerAgent(String name, String instanceId, String task) {
        AgentRecord agent = registry().getAgents(config.name(), false, false).get(name);
        if (agent == null) {
            throw new AgentNotFoundException(name);
        }

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(MessageHeaders.SENDER, config.name());
        headers.put(MessageHeaders.TARGET_AGENT, name);
        if (instanceId != null) {
            headers.put(MessageHeaders.WORKFLOW_INSTANCE_ID, instanceId);
        }

        bus().publish(agent.triggerTopic(), TriggerAction.of(task, instanceId), headers);
        log.info("{} triggered {} on {}", config.name(), name, agent.triggerTopic());
    }

    @Override
    public void unregister() {
        registry().unregister(config.name());
        log.info("{} unregistered", config.name());
    }

    /**
     * 인스턴스 기록 조회.
     *
     * @param instanceId 인스턴스 ID
     * @return 기록 (없으면 null)
     */
    public InstanceRecord instanceRecord(String instanceId) {
        synchronized (stateLock) {
            return instances.get(instanceId);
        }
    }

    // ============================================================
    // 등록 및 상태 저장
    // ============================================================

    private void registerSelf() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("name", config.name());
        metadata.put("topicName", config.broadcastTopic());
        metadata.put("pubsubName", config.messageBusName());
        metadata.put(AgentRecord.ORCHESTRATOR_KEY, true);

        boolean registered = registry().register(new AgentRecord(config.name(), config.broadcastTopic(), metadata));
        if (registered) {
            log.info("{} registered as orchestrator on {}", config.name(), config.broadcastTopic());
        } else {
            log.debug("{} already registered, skipping", config.name());
        }
    }

    private void restoreState() {
        components.stateStore().load(config.stateKey()).ifPresent(saved -> {
            synchronized (stateLock) {
                instances.putAll(saved.instances());
            }
            log.info("{} restored {} workflow instances from {}",
                config.name(), saved.instances().size(), config.stateKey());
        });
    }

    private void startInstance(String instanceId, String task) {
        update(instanceId, ignored -> InstanceRecord.started(instanceId, task));
        log.info("{} started instance {}", config.name(), instanceId);
        listener().onRunStarted(instanceId, task);
    }

    private void recordResponse(String instanceId, AgentTaskResponse response) {
        log.info("{} received response from {} for instance {}", config.name(), response.name(), instanceId);
        synchronized (stateLock) {
            if (!instances.containsKey(instanceId)) {
                log.warn("{} has no record of instance {}, response not stored", config.name(), instanceId);
                return;
            }
            update(instanceId, record -> record.withMessage(response));
        }
    }

    private void recordTurn(String instanceId, TurnResult result) {
        update(instanceId, record -> record.withTurn(result));
    }

    private void completeInstance(String instanceId, String output) {
        update(instanceId, record -> record.completed(output));
        listener().onRunCompleted(instanceId, output);
    }

    private void failInstance(String instanceId, RuntimeException cause) {
        log.error("{} failed instance {}", config.name(), instanceId, cause);
        try {
            update(instanceId, record -> record.failed(cause.getMessage()));
        } catch (RuntimeException saveFailure) {
            cause.addSuppressed(saveFailure);
        }
        listener().onRunFailed(instanceId, cause);
    }

    private void update(String instanceId, UnaryOperator<InstanceRecord> change) {
        WorkflowState snapshot;
        synchronized (stateLock) {
            instances.put(instanceId, change.apply(instances.get(instanceId)));
            pruneFinished();
            snapshot = new WorkflowState(instances);
            components.stateStore().save(config.stateKey(), snapshot);
        }
        mirrorLocally(snapshot);
    }

    // 실행 중인 기록은 상한을 넘어도 제거하지 않음
    private void pruneFinished() {
        int excess = instances.size() - config.maxRetainedInstances();
        Iterator<InstanceRecord> oldestFirst = instances.values().iterator();
        while (excess > 0 && oldestFirst.hasNext()) {
            if (oldestFirst.next().status().isTerminal()) {
                oldestFirst.remove();
                excess--;
            }
        }
    }

    private void mirrorLocally(WorkflowState snapshot) {
        WorkflowStateStore local = components.localStateStore();
        if (!config.saveStateLocally() || local == null) {
            return;
        }
        try {
            local.save(config.stateKey(), snapshot);
        } catch (RuntimeException e) {
            log.warn("{} failed to mirror state locally", config.name(), e);
        }
    }

    private AgentRegistry registry() {
        return components.registry();
    }

    private MessageBus bus() {
        return components.bus();
    }

    private TurnListener listener() {
        return components.listener();
    }

    private record BroadcastSummary(int delivered, int failed) {
    }
}
