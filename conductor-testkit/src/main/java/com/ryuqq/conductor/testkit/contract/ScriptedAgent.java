package com.ryuqq.conductor.testkit.contract;

import com.ryuqq.conductor.adapter.inmemory.bus.InMemoryMessageBus;
import com.ryuqq.conductor.adapter.inmemory.bus.PublishedMessage;
import com.ryuqq.conductor.adapter.inmemory.registry.InMemoryAgentRegistry;
import com.ryuqq.conductor.adapter.inmemory.runtime.InMemoryWorkflowRuntime;
import com.ryuqq.conductor.adapter.runner.TurnExecutor;
import com.ryuqq.conductor.core.contract.AgentTaskResponse;
import com.ryuqq.conductor.core.contract.BroadcastMessage;
import com.ryuqq.conductor.core.contract.MessageHeaders;
import com.ryuqq.conductor.core.contract.TriggerAction;
import com.ryuqq.conductor.core.model.AgentRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Test agent that answers triggers from a script.
 *
 * <p>The agent registers itself, listens on its trigger and event topics, and answers each trigger by
 * raising an {@value TurnExecutor#AGENT_RESPONSE_EVENT} event on the triggering workflow instance.</p>
 *
 * <p><strong>Script:</strong></p>
 * <ul>
 *   <li>{@link #replies(String...)}: one entry per trigger; a null entry means no answer for that trigger</li>
 *   <li>Once the script is used up, the agent answers {@code "<name> #<n>"}</li>
 *   <li>{@link #silent()}: never answer</li>
 *   <li>{@link #respondAfter(long)}: answer asynchronously after a delay</li>
 * </ul>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class ScriptedAgent {

    private final String name;
    private final InMemoryMessageBus bus;
    private final InMemoryWorkflowRuntime runtime;
    private final ConcurrentLinkedQueue<Optional<String>> script = new ConcurrentLinkedQueue<>();
    private final List<TriggerAction> triggers = new CopyOnWriteArrayList<>();
    private final List<BroadcastMessage> broadcasts = new CopyOnWriteArrayList<>();
    private final List<Consumer<TriggerAction>> triggerHooks = new CopyOnWriteArrayList<>();
    private final AtomicInteger answered = new AtomicInteger();
    private volatile boolean silent;
    private volatile long replyDelayMs;

    private ScriptedAgent(String name, InMemoryMessageBus bus, InMemoryWorkflowRuntime runtime) {
        this.name = name;
        this.bus = bus;
        this.runtime = runtime;
    }

    /**
     * Registers a new agent and subscribes it to its topics.
     *
     * @param name agent name
     * @param registry registry to join
     * @param bus bus to listen on
     * @param runtime runtime to raise replies on
     * @return the agent
     */
    public static ScriptedAgent join(
        String name,
        InMemoryAgentRegistry registry,
        InMemoryMessageBus bus,
        InMemoryWorkflowRuntime runtime
    ) {
        ScriptedAgent agent = new ScriptedAgent(name, bus, runtime);
        AgentRecord record = AgentRecord.of(name, null);
        registry.register(record);
        bus.subscribe(record.triggerTopic(), agent::onTrigger);
        bus.subscribe(record.eventTopic(), agent::onBroadcast);
        return agent;
    }

    public ScriptedAgent replies(String... contents) {
        for (String content : contents) {
            script.add(Optional.ofNullable(content));
        }
        return this;
    }

    public ScriptedAgent silent() {
        this.silent = true;
        return this;
    }

    public ScriptedAgent respondAfter(long delayMs) {
        this.replyDelayMs = delayMs;
        return this;
    }

    /**
     * Runs an action on every trigger, before the reply.
     *
     * @param hook action receiving the trigger
     * @return this agent
     */
    public ScriptedAgent onEachTrigger(Consumer<TriggerAction> hook) {
        triggerHooks.add(hook);
        return this;
    }

    public String name() {
        return name;
    }

    public List<TriggerAction> triggers() {
        return new ArrayList<>(triggers);
    }

    public List<BroadcastMessage> broadcasts() {
        return new ArrayList<>(broadcasts);
    }

    private void onTrigger(PublishedMessage message) {
        TriggerAction trigger = bus.decode(message, TriggerAction.class);
        triggers.add(trigger);
        triggerHooks.forEach(hook -> hook.accept(trigger));

        Optional<String> next = script.poll();
        if (silent || (next != null && next.isEmpty())) {
            return;
        }
        String content = next != null ? next.get() : name + " #" + triggers.size();
        AgentTaskResponse reply = AgentTaskResponse.fromAgent(name, content, trigger.workflowInstanceId());

        if (replyDelayMs > 0) {
            CompletableFuture.runAsync(() -> answer(trigger, reply),
                CompletableFuture.delayedExecutor(replyDelayMs, TimeUnit.MILLISECONDS));
        } else {
            answer(trigger, reply);
        }
    }

    private void answer(TriggerAction trigger, AgentTaskResponse reply) {
        runtime.raiseEvent(trigger.workflowInstanceId(), TurnExecutor.AGENT_RESPONSE_EVENT, reply);
        answered.incrementAndGet();
    }

    private void onBroadcast(PublishedMessage message) {
        if ("true".equals(message.header(MessageHeaders.BROADCAST))) {
            broadcasts.add(bus.decode(message, BroadcastMessage.class));
        }
    }

    public int answered() {
        return answered.get();
    }
}
