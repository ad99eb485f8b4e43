/**
 * Observability port for the turn loop.
 *
 * @since 1.0.0
 * @author Conductor Team
 */
package com.ryuqq.conductor.application.observe;
