package com.ryuqq.conductor.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AgentRecord 테스트.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
class AgentRecordTest {

    @Test
    void triggerTopic_TopicMissing_FallsBackToNameTrigger() {
        // Given
        AgentRecord record = AgentRecord.of("writer", null);

        // When & Then
        assertEquals("writer.trigger", record.triggerTopic());
        assertEquals("writer.events", record.eventTopic());
    }

    @Test
    void triggerTopic_TopicPresent_UsesTopicForBoth() {
        // Given
        AgentRecord record = AgentRecord.of("writer", "writer-topic");

        // When & Then
        assertEquals("writer-topic", record.triggerTopic());
        assertEquals("writer-topic", record.eventTopic());
    }

    @Test
    void triggerTopic_BlankTopic_FallsBackToName() {
        AgentRecord record = AgentRecord.of("writer", "  ");

        assertEquals("writer.trigger", record.triggerTopic());
    }

    @Test
    void isOrchestrator_BooleanOrStringFlag_ReturnsTrue() {
        // Given
        AgentRecord booleanFlag = new AgentRecord("o1", null, Map.of(AgentRecord.ORCHESTRATOR_KEY, true));
        AgentRecord stringFlag = new AgentRecord("o2", null, Map.of(AgentRecord.ORCHESTRATOR_KEY, "true"));
        AgentRecord noFlag = AgentRecord.of("agent", null);

        // When & Then
        assertTrue(booleanFlag.isOrchestrator());
        assertTrue(stringFlag.isOrchestrator());
        assertFalse(noFlag.isOrchestrator());
    }

    @Test
    void constructor_MetadataMutatedAfterwards_RecordUnaffected() {
        // Given
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("role", "critic");

        // When
        AgentRecord record = new AgentRecord("critic", null, metadata);
        metadata.put("role", "changed");

        // Then
        assertEquals("critic", record.metadata().get("role"));
        assertThrows(UnsupportedOperationException.class, () -> record.metadata().put("x", 1));
    }

    @Test
    void constructor_NullMetadata_BecomesEmpty() {
        AgentRecord record = new AgentRecord("agent", null, null);

        assertTrue(record.metadata().isEmpty());
    }

    @Test
    void constructor_BlankName_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> AgentRecord.of(" ", null)
        );
        assertTrue(exception.getMessage().contains("cannot be null or blank"));
    }
}
