package com.ryuqq.conductor.adapter.runner;

import com.ryuqq.conductor.application.observe.TurnListener;
import com.ryuqq.conductor.application.orchestrator.OrchestratorConfig;
import com.ryuqq.conductor.core.contract.AgentTaskResponse;
import com.ryuqq.conductor.core.contract.BroadcastMessage;
import com.ryuqq.conductor.core.contract.MessageHeaders;
import com.ryuqq.conductor.core.contract.TriggerAction;
import com.ryuqq.conductor.core.model.AgentRecord;
import com.ryuqq.conductor.core.spi.AgentRegistry;
import com.ryuqq.conductor.core.spi.MessageBus;
import com.ryuqq.conductor.core.spi.WorkflowRuntime;
import com.ryuqq.conductor.core.spi.WorkflowStateStore;
import com.ryuqq.conductor.core.state.InstanceRecord;
import com.ryuqq.conductor.core.state.InstanceStatus;
import com.ryuqq.conductor.core.state.WorkflowState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * RoundRobinOrchestrator 유닛 테스트.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class RoundRobinOrchestratorTest {

    private static final String NAME = "rr-orchestrator";

    @Mock
    private AgentRegistry registry;

    @Mock
    private MessageBus bus;

    @Mock
    private WorkflowRuntime runtime;

    @Mock
    private WorkflowStateStore stateStore;

    @Mock
    private WorkflowStateStore localStateStore;

    @Mock
    private TurnListener listener;

    private OrchestratorConfig config;

    @BeforeEach
    void setUp() {
        config = OrchestratorConfig.of(NAME, "messagepubsub", "workflowstatestore", "agentstatestore")
            .withMaxIterations(3)
            .withTimeoutSeconds(2);
    }

    private RoundRobinOrchestrator orchestrator(OrchestratorConfig config) {
        OrchestratorComponents components = OrchestratorComponents.of(registry, bus, runtime, stateStore)
            .withLocalStateStore(localStateStore)
            .withListener(listener);
        return new RoundRobinOrchestrator(config, components);
    }

    // ============================================================
    // 1. 생성 시 등록
    // ============================================================

    @Test
    void 생성자_오케스트레이터로_레지스트리에_등록() {
        // when
        orchestrator(config.withBroadcastTopicName("beacon"));

        // then
        verify(stateStore).load("workflow_state");
        verify(registry).register(argThat(record ->
            record.name().equals(NAME)
                && record.isOrchestrator()
                && "beacon".equals(record.topic())
                && "messagepubsub".equals(record.metadata().get("pubsubName"))));
    }

    @Test
    void unregister_레지스트리에서_제거() {
        // given
        RoundRobinOrchestrator orchestrator = orchestrator(config);

        // when
        orchestrator.unregister();

        // then
        verify(registry).unregister(NAME);
    }

    // ============================================================
    // 2. 순환 선택
    // ============================================================

    @Test
    void run_에이전트_A_B_에_세_턴이면_A_B_A_순서로_trigger() {
        // given
        Map<String, AgentRecord> agents = agents("A", "B");
        when(registry.getAgents(NAME, true, true)).thenReturn(agents);
        when(registry.getAgents(NAME, false, false)).thenReturn(agents);
        ScriptedWorkflowContext context = new ScriptedWorkflowContext("wf-1",
            reply("A", "first"), reply("B", "second"), reply("A", "third"));
        when(runtime.newInstance(NAME)).thenReturn(context);
        RoundRobinOrchestrator orchestrator = orchestrator(config);

        // when
        String output = orchestrator.run("Write a story");

        // then
        assertThat(output).isEqualTo("third");
        InOrder inOrder = inOrder(bus);
        inOrder.verify(bus).publish(eq("A.events"), any(BroadcastMessage.class), anyMap());
        inOrder.verify(bus).publish(eq("B.events"), any(BroadcastMessage.class), anyMap());
        inOrder.verify(bus).publish(eq("A.trigger"), eq(TriggerAction.of(null, "wf-1")), anyMap());
        inOrder.verify(bus).publish(eq("B.trigger"), eq(TriggerAction.of(null, "wf-1")), anyMap());
        inOrder.verify(bus).publish(eq("A.trigger"), eq(TriggerAction.of(null, "wf-1")), anyMap());
        verify(registry, times(1)).getAgents(NAME, true, true);
        assertThat(context.timerDurations()).containsExactly(2_000L, 2_000L, 2_000L);
    }

    @Test
    void run_첫_턴에만_브로드캐스트하고_trigger_헤더를_채움() {
        // given
        Map<String, AgentRecord> agents = agents("A");
        when(registry.getAgents(NAME, true, true)).thenReturn(agents);
        when(registry.getAgents(NAME, false, false)).thenReturn(agents);
        when(runtime.newInstance(NAME)).thenReturn(new ScriptedWorkflowContext("wf-7",
            reply("A", "1"), reply("A", "2"), reply("A", "3")));

        // when
        orchestrator(config).run("task");

        // then
        verify(bus, times(1)).publish(eq("A.events"),
            argThat(message -> message instanceof BroadcastMessage broadcast && broadcast.content().equals("task")),
            eq(Map.of(MessageHeaders.SENDER, NAME, MessageHeaders.BROADCAST, "true")));
        verify(bus, times(3)).publish("A.trigger", TriggerAction.of(null, "wf-7"), Map.of(
            MessageHeaders.SENDER, NAME,
            MessageHeaders.TARGET_AGENT, "A",
            MessageHeaders.WORKFLOW_INSTANCE_ID, "wf-7"));
    }

    @Test
    void run_null_작업은_기본_안내_문구로_브로드캐스트() {
        // given
        Map<String, AgentRecord> agents = agents("A");
        when(registry.getAgents(NAME, true, true)).thenReturn(agents);
        when(registry.getAgents(NAME, false, false)).thenReturn(agents);
        when(runtime.newInstance(NAME)).thenReturn(new ScriptedWorkflowContext("wf-1", reply("A", "ok")));

        // when
        orchestrator(config.withMaxIterations(1)).run(null);

        // then
        verify(bus).publish(eq("A.events"),
            argThat(message -> message instanceof BroadcastMessage broadcast
                && broadcast.content().equals("Please proceed with the task")),
            anyMap());
    }

    // ============================================================
    // 3. 빈 레지스트리, fallback
    // ============================================================

    @Test
    void run_에이전트가_없으면_브로드캐스트_없이_안내_문구_반환() {
        // given
        when(registry.getAgents(NAME, true, true)).thenReturn(Map.of());
        when(runtime.newInstance(NAME)).thenReturn(new ScriptedWorkflowContext("wf-1"));

        // when
        String output = orchestrator(config).run("task");

        // then
        assertThat(output).isEqualTo("No agents available for round-robin workflow");
        verifyNoInteractions(bus);
    }

    @Test
    void run_최종_응답이_비어_있으면_fallback_반환() {
        // given
        Map<String, AgentRecord> agents = agents("A");
        when(registry.getAgents(NAME, true, true)).thenReturn(agents);
        when(registry.getAgents(NAME, false, false)).thenReturn(agents);
        when(runtime.newInstance(NAME)).thenReturn(new ScriptedWorkflowContext("wf-1", reply("A", "")));

        // when
        String output = orchestrator(config.withMaxIterations(1)).run("task");

        // then
        assertThat(output).isEqualTo("Round Robin workflow completed without final output");
    }

    @Test
    void run_최종_턴이_타임아웃이면_sentinel_본문_반환() {
        // given
        Map<String, AgentRecord> agents = agents("A", "B");
        when(registry.getAgents(NAME, true, true)).thenReturn(agents);
        when(registry.getAgents(NAME, false, false)).thenReturn(agents);
        when(runtime.newInstance(NAME)).thenReturn(new ScriptedWorkflowContext("wf-1", reply("A", "draft"), null));

        // when
        String output = orchestrator(config.withMaxIterations(2)).run("task");

        // then
        assertThat(output).isEqualTo(AgentTaskResponse.TIMEOUT_CONTENT);
        verify(listener).onTurnCompleted(eq("wf-1"), argThat(result -> result.turn() == 2 && result.timedOut()));
    }

    // ============================================================
    // 4. 상태 저장
    // ============================================================

    @Test
    void run_완료시_인스턴스_기록을_저장하고_로컬에도_미러링() {
        // given
        Map<String, AgentRecord> agents = agents("A");
        when(registry.getAgents(NAME, true, true)).thenReturn(agents);
        when(registry.getAgents(NAME, false, false)).thenReturn(agents);
        when(runtime.newInstance(NAME)).thenReturn(new ScriptedWorkflowContext("wf-1", reply("A", "done")));
        RoundRobinOrchestrator orchestrator = orchestrator(config.withMaxIterations(1));

        // when
        orchestrator.run("task");

        // then
        ArgumentCaptor<WorkflowState> saved = ArgumentCaptor.forClass(WorkflowState.class);
        verify(stateStore, atLeastOnce()).save(eq("workflow_state"), saved.capture());
        InstanceRecord record = saved.getValue().instance("wf-1").orElseThrow();
        assertThat(record.status()).isEqualTo(InstanceStatus.COMPLETED);
        assertThat(record.output()).isEqualTo("done");
        assertThat(record.turns()).hasSize(1);
        assertThat(record.messages()).extracting(AgentTaskResponse::content).containsExactly("done");
        verify(localStateStore, atLeastOnce()).save(eq("workflow_state"), any(WorkflowState.class));
        assertThat(orchestrator.instanceRecord("wf-1")).isEqualTo(record);
    }

    @Test
    void run_saveStateLocally가_false면_로컬_저장소_미사용() {
        // given
        Map<String, AgentRecord> agents = agents("A");
        when(registry.getAgents(NAME, true, true)).thenReturn(agents);
        when(registry.getAgents(NAME, false, false)).thenReturn(agents);
        when(runtime.newInstance(NAME)).thenReturn(new ScriptedWorkflowContext("wf-1", reply("A", "done")));

        // when
        orchestrator(config.withMaxIterations(1).withSaveStateLocally(false)).run("task");

        // then
        verify(stateStore, atLeastOnce()).save(anyString(), any(WorkflowState.class));
        verifyNoInteractions(localStateStore);
    }

    @Test
    void run_보관_상한을_넘으면_가장_오래된_종료_기록부터_제거() {
        // given
        Map<String, AgentRecord> agents = agents("A");
        when(registry.getAgents(NAME, true, true)).thenReturn(agents);
        when(registry.getAgents(NAME, false, false)).thenReturn(agents);
        when(runtime.newInstance(NAME)).thenReturn(
            new ScriptedWorkflowContext("wf-1", reply("A", "1")),
            new ScriptedWorkflowContext("wf-2", reply("A", "2")),
            new ScriptedWorkflowContext("wf-3", reply("A", "3")));
        RoundRobinOrchestrator orchestrator = orchestrator(config.withMaxIterations(1).withMaxRetainedInstances(2));

        // when
        orchestrator.run("first");
        orchestrator.run("second");
        orchestrator.run("third");

        // then
        ArgumentCaptor<WorkflowState> saved = ArgumentCaptor.forClass(WorkflowState.class);
        verify(stateStore, atLeastOnce()).save(eq("workflow_state"), saved.capture());
        assertThat(saved.getValue().instances()).containsOnlyKeys("wf-2", "wf-3");
        assertThat(orchestrator.instanceRecord("wf-1")).isNull();
        assertThat(orchestrator.instanceRecord("wf-3").status()).isEqualTo(InstanceStatus.COMPLETED);
    }

    @Test
    void run_턴마다_같은_활동_이름으로_기록() {
        // given
        Map<String, AgentRecord> agents = agents("A", "B");
        when(registry.getAgents(NAME, true, true)).thenReturn(agents);
        when(registry.getAgents(NAME, false, false)).thenReturn(agents);
        ScriptedWorkflowContext context = new ScriptedWorkflowContext("wf-1", reply("A", "1"), reply("B", "2"));
        when(runtime.newInstance(NAME)).thenReturn(context);

        // when
        orchestrator(config.withMaxIterations(2)).run("task");

        // then
        assertThat(context.activities()).containsExactly(
            "prepareStrategy", "processInput", "broadcastMessageToAgents",
            "selectNextSpeaker", "triggerAgent",
            "selectNextSpeaker", "triggerAgent");
    }

    private static AgentTaskResponse reply(String agent, String content) {
        return AgentTaskResponse.fromAgent(agent, content, "wf-1");
    }

    private static Map<String, AgentRecord> agents(String... names) {
        Map<String, AgentRecord> agents = new LinkedHashMap<>();
        for (String name : List.of(names)) {
            agents.put(name, AgentRecord.of(name, null));
        }
        return agents;
    }
}
