package com.ryuqq.conductor.adapter.inmemory.runtime;

import com.ryuqq.conductor.core.contract.AgentTaskResponse;
import com.ryuqq.conductor.core.spi.WorkflowContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * {@link WorkflowContext} of one in-memory workflow instance.
 *
 * <p><strong>Event delivery:</strong></p>
 * <ul>
 *   <li>A raised event completes the most recent outstanding wait for that event name</li>
 *   <li>Completed or cancelled waits are not outstanding</li>
 *   <li>An event with no outstanding wait is buffered and handed to the next wait, in arrival order</li>
 * </ul>
 *
 * <p>Activities run inline and are journaled by name.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public class InMemoryWorkflowContext implements WorkflowContext {

    private static final Logger log = LoggerFactory.getLogger(InMemoryWorkflowContext.class);

    private final String instanceId;
    private final Map<String, Deque<CompletableFuture<AgentTaskResponse>>> waits = new HashMap<>();
    private final Map<String, Deque<AgentTaskResponse>> buffered = new HashMap<>();
    private final List<String> activityJournal = new ArrayList<>();

    InMemoryWorkflowContext(String instanceId) {
        this.instanceId = instanceId;
    }

    @Override
    public String instanceId() {
        return instanceId;
    }

    @Override
    public synchronized CompletableFuture<AgentTaskResponse> waitForExternalEvent(String eventName) {
        Deque<AgentTaskResponse> pending = buffered.get(eventName);
        if (pending != null && !pending.isEmpty()) {
            return CompletableFuture.completedFuture(pending.poll());
        }
        CompletableFuture<AgentTaskResponse> wait = new CompletableFuture<>();
        waits.computeIfAbsent(eventName, key -> new ArrayDeque<>()).push(wait);
        return wait;
    }

    @Override
    public CompletableFuture<Void> createTimer(long durationMs) {
        if (durationMs < 0) {
            throw new IllegalArgumentException("durationMs cannot be negative (current: " + durationMs + ")");
        }
        return CompletableFuture.runAsync(() -> { },
            CompletableFuture.delayedExecutor(durationMs, TimeUnit.MILLISECONDS));
    }

    @Override
    public <T> T callActivity(String activityName, Supplier<T> activity) {
        synchronized (this) {
            activityJournal.add(activityName);
        }
        log.debug("[{}] activity {}", instanceId, activityName);
        return activity.get();
    }

    /**
     * Delivers an event to this instance.
     *
     * @param eventName event name
     * @param payload event payload
     * @return true if an outstanding wait received it, false if it was buffered
     */
    boolean raise(String eventName, AgentTaskResponse payload) {
        CompletableFuture<AgentTaskResponse> target = null;
        synchronized (this) {
            Deque<CompletableFuture<AgentTaskResponse>> outstanding = waits.get(eventName);
            while (outstanding != null && !outstanding.isEmpty()) {
                CompletableFuture<AgentTaskResponse> candidate = outstanding.pop();
                if (!candidate.isDone()) {
                    target = candidate;
                    break;
                }
            }
            if (target == null) {
                buffered.computeIfAbsent(eventName, key -> new ArrayDeque<>()).add(payload);
                log.debug("[{}] buffered {} with no outstanding wait", instanceId, eventName);
                return false;
            }
        }
        if (!target.complete(payload)) {
            // cancelled between selection and completion
            return raise(eventName, payload);
        }
        return true;
    }

    public synchronized List<String> activityJournal() {
        return List.copyOf(activityJournal);
    }

    public synchronized int bufferedEvents(String eventName) {
        Deque<AgentTaskResponse> pending = buffered.get(eventName);
        return pending == null ? 0 : pending.size();
    }
}
