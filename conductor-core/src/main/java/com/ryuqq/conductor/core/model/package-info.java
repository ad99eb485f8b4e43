/**
 * Registry and message value types shared by every module.
 *
 * <ul>
 *   <li>{@link com.ryuqq.conductor.core.model.AgentRecord} - registry entry (name, topic, metadata)</li>
 *   <li>{@link com.ryuqq.conductor.core.model.MessageRole} - sender role carried by every message</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Conductor Team
 */
package com.ryuqq.conductor.core.model;
