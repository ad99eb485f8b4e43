/**
 * Orchestrator state values.
 *
 * <p>{@link com.ryuqq.conductor.core.state.OrchestratorState} and
 * {@link com.ryuqq.conductor.core.state.StrategyState} are threaded through the turn loop as values,
 * one per workflow instance. {@link com.ryuqq.conductor.core.state.WorkflowState} is the persisted
 * record of every instance an orchestrator ran.</p>
 *
 * @since 1.0.0
 * @author Conductor Team
 */
package com.ryuqq.conductor.core.state;
