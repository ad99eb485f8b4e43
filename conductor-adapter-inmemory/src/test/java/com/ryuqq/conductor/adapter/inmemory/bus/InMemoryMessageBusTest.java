package com.ryuqq.conductor.adapter.inmemory.bus;

import com.ryuqq.conductor.core.contract.MessageHeaders;
import com.ryuqq.conductor.core.contract.TriggerAction;
import com.ryuqq.conductor.core.exception.MessageBusException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryMessageBus tests.
 *
 * @author Conductor Team
 * @since 1.0.0
 */
class InMemoryMessageBusTest {

    private InMemoryMessageBus bus;

    @BeforeEach
    void setUp() {
        bus = new InMemoryMessageBus();
    }

    @Test
    void publish_recordsJsonPayloadAndHeaders() {
        // when
        bus.publish("writer.trigger", TriggerAction.of("draft", "wf-1"),
            Map.of(MessageHeaders.SENDER, "orchestrator", MessageHeaders.TARGET_AGENT, "writer"));

        // then
        List<PublishedMessage> published = bus.published("writer.trigger");
        assertThat(published).hasSize(1);
        PublishedMessage message = published.get(0);
        assertThat(message.header(MessageHeaders.SENDER)).isEqualTo("orchestrator");
        assertThat(bus.decode(message, TriggerAction.class)).isEqualTo(TriggerAction.of("draft", "wf-1"));
        assertThat(message.publishedAt()).isNotNull();
    }

    @Test
    void publish_deliversToSubscribersOfTopicOnly() {
        // given
        List<String> received = new ArrayList<>();
        bus.subscribe("a.events", message -> received.add(message.topic()));

        // when
        bus.publish("a.events", TriggerAction.of("x"), Map.of());
        bus.publish("b.events", TriggerAction.of("y"), Map.of());

        // then
        assertThat(received).containsExactly("a.events");
        assertThat(bus.published()).hasSize(2);
    }

    @Test
    void publish_failingSubscriberDoesNotFailPublish() {
        // given
        bus.subscribe("a.events", message -> {
            throw new IllegalStateException("subscriber down");
        });

        // when
        bus.publish("a.events", TriggerAction.of("x"), Map.of());

        // then
        assertThat(bus.published("a.events")).hasSize(1);
    }

    @Test
    void failPublishesTo_rejectsPublishUntilRestored() {
        // given
        bus.failPublishesTo("b.events");

        // when & then
        assertThatThrownBy(() -> bus.publish("b.events", TriggerAction.of("x"), Map.of()))
            .isInstanceOf(MessageBusException.class)
            .satisfies(e -> assertThat(((MessageBusException) e).getTopic()).isEqualTo("b.events"));
        assertThat(bus.published()).isEmpty();

        bus.restorePublishesTo("b.events");
        bus.publish("b.events", TriggerAction.of("x"), Map.of());
        assertThat(bus.published()).hasSize(1);
    }

    @Test
    void publish_invalidArguments_throwException() {
        assertThatThrownBy(() -> bus.publish(" ", TriggerAction.of("x"), Map.of()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> bus.publish("a", null, Map.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void clear_removesLogAndSubscriptions() {
        // given
        List<String> received = new ArrayList<>();
        bus.subscribe("a", message -> received.add(message.payload()));
        bus.publish("a", TriggerAction.of("x"), null);

        // when
        bus.clear();
        bus.publish("a", TriggerAction.of("y"), null);

        // then
        assertThat(received).hasSize(1);
        assertThat(bus.published()).hasSize(1);
    }
}
