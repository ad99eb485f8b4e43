package com.ryuqq.conductor.adapter.inmemory.runtime;

import com.ryuqq.conductor.core.contract.AgentTaskResponse;
import com.ryuqq.conductor.core.spi.WorkflowRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link WorkflowRuntime}.
 *
 * <p>Each instance runs once on the calling thread; nothing is replayed or recovered after a crash.
 * External events are raised with {@link #raiseEvent(String, String, AgentTaskResponse)}.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public class InMemoryWorkflowRuntime implements WorkflowRuntime {

    private static final Logger log = LoggerFactory.getLogger(InMemoryWorkflowRuntime.class);

    private final ConcurrentHashMap<String, InMemoryWorkflowContext> instances = new ConcurrentHashMap<>();

    @Override
    public InMemoryWorkflowContext newInstance(String workflowName) {
        if (workflowName == null || workflowName.isBlank()) {
            throw new IllegalArgumentException("workflowName cannot be null or blank");
        }
        String instanceId = workflowName + "-" + UUID.randomUUID();
        InMemoryWorkflowContext context = new InMemoryWorkflowContext(instanceId);
        instances.put(instanceId, context);
        log.debug("Started workflow instance {}", instanceId);
        return context;
    }

    /**
     * Raises an external event on a running instance.
     *
     * @param instanceId target instance
     * @param eventName event name
     * @param payload event payload
     * @return true if a wait received it, false if it was buffered
     * @throws IllegalArgumentException if the instance is unknown or payload is null
     */
    public boolean raiseEvent(String instanceId, String eventName, AgentTaskResponse payload) {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        InMemoryWorkflowContext context = instances.get(instanceId);
        if (context == null) {
            throw new IllegalArgumentException("Unknown workflow instance: " + instanceId);
        }
        return context.raise(eventName, payload);
    }

    public Optional<InMemoryWorkflowContext> context(String instanceId) {
        return Optional.ofNullable(instances.get(instanceId));
    }

    public Set<String> instanceIds() {
        return Set.copyOf(instances.keySet());
    }
}
