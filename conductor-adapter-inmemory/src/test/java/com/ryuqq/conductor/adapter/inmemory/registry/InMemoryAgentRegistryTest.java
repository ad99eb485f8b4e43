package com.ryuqq.conductor.adapter.inmemory.registry;

import com.ryuqq.conductor.core.model.AgentRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryAgentRegistry tests.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
class InMemoryAgentRegistryTest {

    private InMemoryAgentRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemoryAgentRegistry();
        registry.register(AgentRecord.of("writer", null));
        registry.register(new AgentRecord("boss", "boss", Map.of(AgentRecord.ORCHESTRATOR_KEY, true)));
        registry.register(AgentRecord.of("critic", null));
    }

    @Test
    void getAgents_excludesSelfAndOrchestrators() {
        assertThat(registry.getAgents("writer", true, true).keySet()).containsExactly("critic");
        assertThat(registry.getAgents("writer", false, true).keySet()).containsExactly("writer", "critic");
        assertThat(registry.getAgents("writer", false, false).keySet()).containsExactly("writer", "boss", "critic");
    }

    @Test
    void register_existingName_isSkipped() {
        // when
        boolean registered = registry.register(AgentRecord.of("writer", "other-topic"));

        // then
        assertThat(registered).isFalse();
        assertThat(registry.getAgents("x", false, false).get("writer").topic()).isNull();
    }

    @Test
    void unregister_removesAgent() {
        // when
        registry.unregister("critic");
        registry.unregister("unknown");

        // then
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void getAgents_returnsUnmodifiableSnapshot() {
        Map<String, AgentRecord> snapshot = registry.getAgents("x", false, false);
        registry.register(AgentRecord.of("late", null));

        assertThat(snapshot).hasSize(3);
        assertThatThrownBy(() -> snapshot.remove("writer")).isInstanceOf(UnsupportedOperationException.class);
    }
}
