package com.ryuqq.conductor.adapter.inmemory.store;

import com.ryuqq.conductor.core.spi.WorkflowStateStore;
import com.ryuqq.conductor.core.state.WorkflowState;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link WorkflowStateStore}.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public class InMemoryStateStore implements WorkflowStateStore {

    private final ConcurrentHashMap<String, WorkflowState> states = new ConcurrentHashMap<>();

    @Override
    public void save(String key, WorkflowState state) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        states.put(key, state);
    }

    @Override
    public Optional<WorkflowState> load(String key) {
        return Optional.ofNullable(states.get(key));
    }

    public void clear() {
        states.clear();
    }
}
