package com.ryuqq.conductor.adapter.inmemory.bus;

import com.ryuqq.conductor.adapter.inmemory.codec.JsonCodecException;
import com.ryuqq.conductor.adapter.inmemory.codec.JsonMessageCodec;
import com.ryuqq.conductor.core.exception.MessageBusException;
import com.ryuqq.conductor.core.spi.MessageBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link MessageBus}.
 *
 * <p>Payloads are encoded to JSON with {@link JsonMessageCodec} at publish time, exactly as they
 * would travel over a broker. Every accepted message is kept in publish order for inspection and
 * delivered synchronously to the topic's subscribers.</p>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Topic subscriptions ({@link #subscribe(String, Consumer)})</li>
 *   <li>Injected publish failures per topic ({@link #failPublishesTo(String)})</li>
 *   <li>Publish log for assertions ({@link #published()}, {@link #published(String)})</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> All operations are thread-safe. A subscriber that throws does not
 * fail the publish; the error is logged.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public class InMemoryMessageBus implements MessageBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageBus.class);

    private final JsonMessageCodec codec;
    private final List<PublishedMessage> published = new CopyOnWriteArrayList<>();
    private final ConcurrentHashMap<String, List<Consumer<PublishedMessage>>> subscribers = new ConcurrentHashMap<>();
    private final Set<String> failingTopics = ConcurrentHashMap.newKeySet();

    public InMemoryMessageBus() {
        this(new JsonMessageCodec());
    }

    public InMemoryMessageBus(JsonMessageCodec codec) {
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.codec = codec;
    }

    @Override
    public void publish(String topic, Object payload, Map<String, String> headers) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic cannot be null or blank");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (failingTopics.contains(topic)) {
            throw new MessageBusException(topic, "Publish to " + topic + " rejected");
        }

        String json;
        try {
            json = codec.encode(payload);
        } catch (JsonCodecException e) {
            throw new MessageBusException(topic, "Failed to encode payload for " + topic, e);
        }

        PublishedMessage message = new PublishedMessage(topic, json, headers, Instant.now());
        published.add(message);
        log.debug("Published to {}: {}", topic, json);

        for (Consumer<PublishedMessage> subscriber : subscribers.getOrDefault(topic, List.of())) {
            try {
                subscriber.accept(message);
            } catch (RuntimeException e) {
                log.error("Subscriber of {} failed", topic, e);
            }
        }
    }

    /**
     * Registers a subscriber for a topic.
     *
     * @param topic topic to listen on
     * @param subscriber called for every message published to the topic
     */
    public void subscribe(String topic, Consumer<PublishedMessage> subscriber) {
        if (topic == null || subscriber == null) {
            throw new IllegalArgumentException("topic and subscriber cannot be null");
        }
        subscribers.computeIfAbsent(topic, key -> new CopyOnWriteArrayList<>()).add(subscriber);
    }

    /**
     * Makes every later publish to the topic throw {@link MessageBusException}.
     *
     * @param topic topic to fail
     */
    public void failPublishesTo(String topic) {
        failingTopics.add(topic);
    }

    public void restorePublishesTo(String topic) {
        failingTopics.remove(topic);
    }

    public <T> T decode(PublishedMessage message, Class<T> type) {
        return codec.decode(message.payload(), type);
    }

    public List<PublishedMessage> published() {
        return List.copyOf(published);
    }

    public List<PublishedMessage> published(String topic) {
        return published.stream()
            .filter(message -> message.topic().equals(topic))
            .collect(Collectors.toList());
    }

    /**
     * Clears the publish log, subscriptions and injected failures.
     */
    public void clear() {
        published.clear();
        subscribers.clear();
        failingTopics.clear();
    }
}
