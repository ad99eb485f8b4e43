package com.ryuqq.conductor.adapter.inmemory.bus;

import java.time.Instant;
import java.util.Map;

/**
 * A message accepted by {@link InMemoryMessageBus}.
 *
 * @param topic destination topic
 * @param payload JSON-encoded payload
 * @param headers message headers
 * @param publishedAt time the bus accepted the message
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public record PublishedMessage(
    String topic,
    String payload,
    Map<String, String> headers,
    Instant publishedAt
) {

    public PublishedMessage {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public String header(String name) {
        return headers.get(name);
    }
}
