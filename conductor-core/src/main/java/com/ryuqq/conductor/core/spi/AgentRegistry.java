package com.ryuqq.conductor.core.spi;

import com.ryuqq.conductor.core.model.AgentRecord;

import java.util.Map;

/**
 * Agent Registry SPI.
 *
 * <p>Maps agent names to their communication topic and metadata. The registry store itself
 * is an external collaborator; the orchestrator only reads snapshots and registers itself.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: snapshots may be requested concurrently by several workflow instances</li>
 *   <li>Ordered: snapshots iterate in registration order (round-robin order depends on it)</li>
 *   <li>Snapshot isolation: the returned map must not change after it is returned</li>
 * </ul>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public interface AgentRegistry {

    /**
     * Returns the current registry snapshot.
     *
     * @param callerName name of the caller, used by {@code excludeSelf}
     * @param excludeSelf drop the entry named {@code callerName}
     * @param excludeOrchestrator drop every entry flagged as orchestrator
     * @return ordered, unmodifiable map of agent name to record (may be empty)
     */
    Map<String, AgentRecord> getAgents(String callerName, boolean excludeSelf, boolean excludeOrchestrator);

    /**
     * Registers an agent if its name is not already present.
     *
     * @param record the agent record
     * @return true if registered, false if the name already existed
     * @throws IllegalArgumentException if record is null
     */
    boolean register(AgentRecord record);

    /**
     * Removes an agent from the registry. Unknown names are ignored.
     *
     * @param name the agent name
     */
    void unregister(String name);
}
