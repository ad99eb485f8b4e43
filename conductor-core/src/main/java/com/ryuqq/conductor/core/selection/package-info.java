/**
 * Speaker selection strategies.
 *
 * <p>Strategies are stateless objects; per-instance state lives in
 * {@link com.ryuqq.conductor.core.state.StrategyState} values passed in and returned.</p>
 *
 * <p><strong>Design Principles:</strong></p>
 * <ul>
 *   <li>Registry queries always exclude the calling orchestrator and any agent flagged as orchestrator</li>
 *   <li>Selection never publishes or waits; those are the coordinator's job</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Conductor Team
 */
package com.ryuqq.conductor.core.selection;
