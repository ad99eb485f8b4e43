package com.ryuqq.conductor.core.contract;

/**
 * Publish 헤더 키 상수.
 *
 * <ul>
 *   <li>모든 publish: {@link #SENDER}</li>
 *   <li>trigger: {@link #TARGET_AGENT}, {@link #WORKFLOW_INSTANCE_ID}</li>
 *   <li>broadcast: {@link #BROADCAST} = "true"</li>
 * </ul>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class MessageHeaders {

    public static final String SENDER = "sender";
    public static final String TARGET_AGENT = "targetAgent";
    public static final String WORKFLOW_INSTANCE_ID = "workflowInstanceId";
    public static final String BROADCAST = "broadcast";

    private MessageHeaders() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
