package com.ryuqq.conductor.core.spi;

import com.ryuqq.conductor.core.exception.MessageBusException;

import java.util.Map;

/**
 * Publish/subscribe Message Bus SPI.
 *
 * <p>Publishes are fire-and-forget: the call returns once the bus accepted the message,
 * never after the recipient processed it.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * bus.publish("writer.trigger",
 *     TriggerAction.of(null, instanceId),
 *     Map.of(MessageHeaders.SENDER, "orchestrator"));
 * </pre>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public interface MessageBus {

    /**
     * Publishes a typed payload to a topic.
     *
     * @param topic the topic name
     * @param payload the message payload (a contract record)
     * @param headers publish headers (may be empty)
     * @throws IllegalArgumentException if topic is blank or payload is null
     * @throws MessageBusException if the bus rejects the message
     */
    void publish(String topic, Object payload, Map<String, String> headers);
}
