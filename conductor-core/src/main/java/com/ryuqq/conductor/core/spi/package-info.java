/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the external collaborators the orchestration core requires.
 * Infrastructure adapters provide the concrete implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.spi.AgentRegistry} - agent name → topic/metadata snapshots</li>
 *   <li>{@link com.ryuqq.conductor.core.spi.MessageBus} - topic-addressed publish with headers</li>
 *   <li>{@link com.ryuqq.conductor.core.spi.WorkflowRuntime} / {@link com.ryuqq.conductor.core.spi.WorkflowContext} -
 *       instance ID, external events, timers, activities</li>
 *   <li>{@link com.ryuqq.conductor.core.spi.WorkflowStateStore} - workflow state snapshots</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 *   <li><strong>Pluggability:</strong> In-memory adapters for tests, durable ones in production</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Conductor Team
 */
package com.ryuqq.conductor.core.spi;
