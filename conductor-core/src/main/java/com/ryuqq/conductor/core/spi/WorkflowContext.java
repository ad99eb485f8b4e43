package com.ryuqq.conductor.core.spi;

import com.ryuqq.conductor.core.contract.AgentTaskResponse;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Execution context of one workflow instance, provided by the durable runtime.
 *
 * <p>The only suspension points of the turn loop go through this context:
 * the external event wait and the timer. Side-effecting steps go through
 * {@link #callActivity(String, Supplier)} so a replaying runtime can record them once.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public interface WorkflowContext {

    /**
     * Returns the workflow instance ID.
     *
     * @return instance ID (non-blank)
     */
    String instanceId();

    /**
     * Waits for the next external event with the given name.
     *
     * @param eventName event name (e.g. {@code AgentTaskResponse})
     * @return future completed with the event payload
     */
    CompletableFuture<AgentTaskResponse> waitForExternalEvent(String eventName);

    /**
     * Creates a durable timer.
     *
     * @param durationMs timer duration in milliseconds
     * @return future completed when the timer fires
     * @throws IllegalArgumentException if durationMs is negative
     */
    CompletableFuture<Void> createTimer(long durationMs);

    /**
     * Runs a side-effecting step as an activity.
     *
     * <p>A replaying runtime returns the recorded result instead of invoking the supplier again.</p>
     *
     * @param activityName activity name
     * @param activity the step to run
     * @param <T> result type
     * @return the activity result
     */
    <T> T callActivity(String activityName, Supplier<T> activity);
}
