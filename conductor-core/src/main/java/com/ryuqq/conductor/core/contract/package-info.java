/**
 * Wire contracts exchanged with agents over the message bus.
 *
 * <h2>Records</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.contract.TriggerAction} - request for one agent to act</li>
 *   <li>{@link com.ryuqq.conductor.core.contract.BroadcastMessage} - initial task fan-out</li>
 *   <li>{@link com.ryuqq.conductor.core.contract.AgentTaskResponse} - agent reply or timeout sentinel</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Records are immutable by default</li>
 *   <li><strong>Validation:</strong> Compact constructors enforce required fields</li>
 *   <li><strong>Transport-agnostic:</strong> Serialization is the bus adapter's concern</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Conductor Team
 */
package com.ryuqq.conductor.core.contract;
