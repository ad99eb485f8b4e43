/**
 * Exception taxonomy of the orchestration engine.
 *
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.exception.ConfigurationException} - fatal, raised at construction</li>
 *   <li>{@link com.ryuqq.conductor.core.exception.AgentNotFoundException} - fatal, fails the running instance</li>
 *   <li>{@link com.ryuqq.conductor.core.exception.NoAgentsAvailableException} - fatal for random selection</li>
 *   <li>{@link com.ryuqq.conductor.core.exception.MessageBusException} - publish failure; caught per agent during broadcast</li>
 * </ul>
 *
 * <p>A response timeout is not an exception: the turn loop synthesizes a sentinel response instead.</p>
 *
 * @since 1.0.0
 * @author Conductor Team
 */
package com.ryuqq.conductor.core.exception;
