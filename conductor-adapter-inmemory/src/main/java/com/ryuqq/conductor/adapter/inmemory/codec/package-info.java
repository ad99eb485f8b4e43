/**
 * Jackson-based JSON codec shared by the in-memory bus and the file state store.
 *
 * @since 1.0.0
 * @author Conductor Team
 */
package com.ryuqq.conductor.adapter.inmemory.codec;
