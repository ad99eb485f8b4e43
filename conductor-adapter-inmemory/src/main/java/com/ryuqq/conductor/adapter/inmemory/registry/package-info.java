/**
 * In-memory agent registry adapter.
 *
 * @since 1.0.0
 * @author Conductor Team
 */
package com.ryuqq.conductor.adapter.inmemory.registry;
