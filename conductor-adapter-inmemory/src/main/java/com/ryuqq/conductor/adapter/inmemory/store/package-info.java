/**
 * Workflow state store adapters: in-memory map and JSON files.
 *
 * @since 1.0.0
 * @author Conductor Team
 */
package com.ryuqq.conductor.adapter.inmemory.store;
