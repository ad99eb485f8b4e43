/**
 * In-memory message bus adapter.
 *
 * <p>Intended for tests and local runs; messages do not survive the process.</p>
 *
 * @since 1.0.0
 * @author Conductor Team
 */
package com.ryuqq.conductor.adapter.inmemory.bus;
