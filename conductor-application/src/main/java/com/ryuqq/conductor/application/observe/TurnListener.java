package com.ryuqq.conductor.application.observe;

import com.ryuqq.conductor.core.turn.TurnResult;

/**
 * Observer of turn loop progress.
 *
 * <p>All callbacks default to no-op. Callbacks run on the workflow thread and must not block;
 * an exception thrown from a callback propagates into the turn loop.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public interface TurnListener {

    /**
     * Listener that ignores every callback.
     */
    TurnListener NO_OP = new TurnListener() { };

    default void onRunStarted(String instanceId, String task) {
    }

    /**
     * Called after a broadcast fan-out.
     *
     * @param instanceId workflow instance id
     * @param delivered number of agents the message was published to
     * @param failed number of agents whose publish failed
     */
    default void onBroadcast(String instanceId, int delivered, int failed) {
    }

    default void onAgentSelected(String instanceId, int turn, String agentName) {
    }

    default void onTurnCompleted(String instanceId, TurnResult result) {
    }

    default void onRunCompleted(String instanceId, String output) {
    }

    default void onRunFailed(String instanceId, Throwable cause) {
    }
}
