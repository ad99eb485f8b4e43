package com.ryuqq.conductor.core.state;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RoundRobinState 테스트.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
class RoundRobinStateTest {

    @Test
    void advance_WrapsAroundModuloSize() {
        // Given
        RoundRobinState state = new RoundRobinState(0, List.of("a", "b"));

        // When
        RoundRobinState second = state.advance();
        RoundRobinState third = second.advance();

        // Then
        assertEquals("a", state.currentAgent());
        assertEquals("b", second.currentAgent());
        assertEquals("a", third.currentAgent());
        assertEquals(0, third.currentAgentIndex());
    }

    @Test
    void refreshedWith_IndexOutOfBounds_ResetsToZero() {
        // Given
        RoundRobinState state = RoundRobinState.startingAt(5);

        // When
        RoundRobinState refreshed = state.refreshedWith(List.of("a", "b", "c"));

        // Then
        assertEquals(0, refreshed.currentAgentIndex());
        assertEquals(List.of("a", "b", "c"), refreshed.agentNames());
    }

    @Test
    void refreshedWith_IndexInBounds_KeepsIndex() {
        RoundRobinState refreshed = RoundRobinState.startingAt(1).refreshedWith(List.of("a", "b"));

        assertEquals("b", refreshed.currentAgent());
    }

    @Test
    void currentAgent_EmptyList_ThrowsException() {
        // Given
        RoundRobinState state = RoundRobinState.startingAt(0);

        // When & Then
        assertTrue(state.isEmpty());
        assertThrows(IllegalStateException.class, state::currentAgent);
        assertThrows(IllegalStateException.class, state::advance);
    }

    @Test
    void constructor_NegativeIndex_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new RoundRobinState(-1, List.of("a")));
    }
}
