package com.ryuqq.conductor.core.state;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OrchestratorState 테스트.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
class OrchestratorStateTest {

    @Test
    void initial_StartsAtTurnOne() {
        // When
        OrchestratorState state = OrchestratorState.initial(3, 5, RandomState.initial());

        // Then
        assertEquals(1, state.turn());
        assertTrue(state.isFirstTurn());
        assertFalse(state.isFinalTurn());
        assertEquals(5_000L, state.timeoutMillis());
    }

    @Test
    void nextTurn_AdvancesUntilFinal() {
        // Given
        OrchestratorState state = OrchestratorState.initial(2, 1, RandomState.initial());

        // When
        OrchestratorState next = state.nextTurn();

        // Then
        assertEquals(2, next.turn());
        assertTrue(next.isFinalTurn());
        assertThrows(IllegalStateException.class, next::nextTurn);
    }

    @Test
    void nextTurn_KeepsStrategyState() {
        // Given
        RandomState strategy = new RandomState("writer");
        OrchestratorState state = OrchestratorState.initial(5, 1, strategy);

        // When & Then
        assertSame(strategy, state.nextTurn().strategyState());
    }

    @Test
    void withStrategyState_ReplacesOnlyStrategy() {
        // Given
        OrchestratorState state = OrchestratorState.initial(5, 1, RandomState.initial());

        // When
        OrchestratorState updated = state.withStrategyState(new RandomState("critic"));

        // Then
        assertEquals(state.turn(), updated.turn());
        assertEquals(new RandomState("critic"), updated.strategyState());
    }

    @Test
    void constructor_TurnOutOfRange_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new OrchestratorState(0, 3, 1, RandomState.initial()));
        assertThrows(IllegalArgumentException.class, () -> new OrchestratorState(4, 3, 1, RandomState.initial()));
    }

    @Test
    void constructor_NonPositiveLimits_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> OrchestratorState.initial(0, 1, RandomState.initial())
        );
        assertTrue(exception.getMessage().contains("maxIterations must be positive"));
        assertThrows(IllegalArgumentException.class, () -> OrchestratorState.initial(1, 0, RandomState.initial()));
    }

    @Test
    void constructor_NullStrategyState_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> OrchestratorState.initial(1, 1, null));
    }
}
