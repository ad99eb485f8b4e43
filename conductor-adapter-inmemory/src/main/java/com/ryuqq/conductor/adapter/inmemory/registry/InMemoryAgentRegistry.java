package com.ryuqq.conductor.adapter.inmemory.registry;

import com.ryuqq.conductor.core.model.AgentRecord;
import com.ryuqq.conductor.core.spi.AgentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * In-memory implementation of {@link AgentRegistry}.
 *
 * <p>Agents are returned in registration order.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public class InMemoryAgentRegistry implements AgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAgentRegistry.class);

    private final Map<String, AgentRecord> agents = new LinkedHashMap<>();

    @Override
    public synchronized Map<String, AgentRecord> getAgents(
        String callerName,
        boolean excludeSelf,
        boolean excludeOrchestrator
    ) {
        Map<String, AgentRecord> snapshot = new LinkedHashMap<>();
        for (AgentRecord agent : agents.values()) {
            if (excludeSelf && agent.name().equals(callerName)) {
                continue;
            }
            if (excludeOrchestrator && agent.isOrchestrator()) {
                continue;
            }
            snapshot.put(agent.name(), agent);
        }
        return Collections.unmodifiableMap(snapshot);
    }

    @Override
    public synchronized boolean register(AgentRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (agents.containsKey(record.name())) {
            return false;
        }
        agents.put(record.name(), record);
        log.debug("Registered agent {}", record.name());
        return true;
    }

    @Override
    public synchronized void unregister(String name) {
        if (agents.remove(name) != null) {
            log.debug("Unregistered agent {}", name);
        }
    }

    public synchronized int size() {
        return agents.size();
    }

    public synchronized void clear() {
        agents.clear();
    }
}
