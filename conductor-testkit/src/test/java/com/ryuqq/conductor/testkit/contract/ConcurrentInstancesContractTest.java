package com.ryuqq.conductor.testkit.contract;

import com.ryuqq.conductor.application.orchestrator.OrchestratorConfig;
import com.ryuqq.conductor.application.orchestrator.OrchestratorWorkflow;
import com.ryuqq.conductor.core.selection.StrategyType;
import com.ryuqq.conductor.core.state.InstanceRecord;
import com.ryuqq.conductor.core.state.InstanceStatus;
import com.ryuqq.conductor.core.state.WorkflowState;
import com.ryuqq.conductor.core.turn.TurnResult;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for concurrent workflow instances on one orchestrator.
 *
 * <p>Each instance carries its own turn counter and round-robin position, and replies are routed
 * by workflow instance id.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
class ConcurrentInstancesContractTest extends AbstractContractTest {

    @Test
    void testConcurrentRuns_StateIsolatedPerInstance() throws Exception {
        // Given
        agent("a");
        agent("b");
        OrchestratorConfig config = config(3, 5);
        OrchestratorWorkflow orchestrator = orchestrator(StrategyType.ROUND_ROBIN, config);
        int runs = 4;
        ExecutorService executor = Executors.newFixedThreadPool(runs);

        // When
        List<Future<String>> outputs = new ArrayList<>();
        try {
            for (int i = 0; i < runs; i++) {
                String task = "task-" + i;
                outputs.add(executor.submit(() -> orchestrator.run(task)));
            }
            for (Future<String> output : outputs) {
                assertNotNull(output.get(30, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        WorkflowState state = stateStore.load(config.stateKey()).orElseThrow();
        assertEquals(runs, state.instances().size());
        for (InstanceRecord record : state.instances().values()) {
            assertInstanceStatus(record, InstanceStatus.COMPLETED);
            List<String> speakers = record.turns().stream()
                .map(TurnResult::agentName)
                .collect(Collectors.toList());
            assertEquals(List.of("a", "b", "a"), speakers, "Instance " + record.instanceId());
            assertEquals(3, record.messages().size());
            record.messages().forEach(message ->
                assertEquals(record.instanceId(), message.workflowInstanceId(), "Reply routed to another instance"));
        }
    }
}
