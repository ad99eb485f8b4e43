/**
 * In-memory workflow runtime: external events, timers and an activity journal.
 *
 * <p><strong>Design Principles:</strong></p>
 * <ul>
 *   <li>Timers are {@link java.util.concurrent.CompletableFuture#delayedExecutor} tasks</li>
 *   <li>Events raised before a wait are buffered, never dropped</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Conductor Team
 */
package com.ryuqq.conductor.adapter.inmemory.runtime;
