package com.ryuqq.conductor.core.spi;

/**
 * Durable Workflow Runtime SPI.
 *
 * <p>Creates workflow instances. Replay determinism, retries and checkpointing are the
 * runtime's responsibility and are not specified here.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public interface WorkflowRuntime {

    /**
     * Creates a new workflow instance context.
     *
     * @param workflowName name of the workflow being started
     * @return context of the new instance (unique instance ID)
     * @throws IllegalArgumentException if workflowName is blank
     */
    WorkflowContext newInstance(String workflowName);
}
