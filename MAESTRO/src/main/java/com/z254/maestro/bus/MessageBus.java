package com.z254.maestro.bus;

import com.z254.maestro.config.MaestroProperties;
import com.z254.maestro.domain.message.BusMessage;
import com.z254.maestro.domain.message.MessagePayload;
import com.z254.maestro.error.BusDeliveryException;
import com.z254.maestro.error.MessageValidationException;
import com.z254.maestro.observability.OrchestrationMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.scheduler.Scheduler;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-process, topic-based publish/subscribe bus connecting the orchestrator, workers and
 * downstream consumers.
 * <p>
 * Delivery is at-most-once and best effort:
 * - payloads are validated against their message type before anything is delivered
 * - handlers run on the orchestration loop, in subscription order
 * - a message published during delivery is queued behind the current one
 * - a failing handler is logged and skipped; the remaining handlers still run
 */
@Service
@Slf4j
public class MessageBus {

    private final Scheduler loop;
    private final OrchestrationMetrics metrics;
    private final int historyLimit;

    // Handlers keyed by topic, or by "topic:targetId" for targeted subscriptions
    private final Map<String, List<Registration>> handlers = new ConcurrentHashMap<>();
    private final AtomicLong registrationSequence = new AtomicLong();

    // Bounded history, also used for duplicate detection
    private final Deque<BusMessage> history = new ArrayDeque<>();
    private final Set<String> recentIds = new HashSet<>();

    private final AtomicLong publishedCount = new AtomicLong();
    private final AtomicLong deliveredCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();

    public MessageBus(Scheduler orchestrationLoop, MaestroProperties properties, OrchestrationMetrics metrics) {
        this.loop = orchestrationLoop;
        this.metrics = metrics;
        this.historyLimit = properties.getBus().getHistoryLimit();
        log.info("Initialized MessageBus (history limit {})", historyLimit);
    }

    /**
     * Subscribe to every message published on a topic.
     */
    public Subscription subscribe(String topic, Consumer<BusMessage> handler) {
        return register(topic, handler);
    }

    /**
     * Subscribe to messages on a topic addressed to one target.
     */
    public Subscription subscribe(String topic, String targetId, Consumer<BusMessage> handler) {
        return register(targetKey(topic, targetId), handler);
    }

    /**
     * Publish on the topic of the message's type.
     */
    public void publish(BusMessage message) {
        if (message == null || message.getType() == null) {
            throw new MessageValidationException("message and message type are required");
        }
        publish(message.getType().getTopic(), message);
    }

    /**
     * Publish a message. Returns once the message is validated and queued for delivery.
     *
     * @throws MessageValidationException when the message or its payload is malformed
     */
    public void publish(String topic, BusMessage message) {
        validate(topic, message);

        if (message.getId() == null) {
            message.setId(UUID.randomUUID().toString());
        }
        if (message.getTimestamp() == null) {
            message.setTimestamp(Instant.ofEpochMilli(loop.now(TimeUnit.MILLISECONDS)));
        }

        if (!remember(message)) {
            log.debug("Duplicate message ignored: {}", message.getId());
            return;
        }

        publishedCount.incrementAndGet();
        metrics.messagePublished();
        log.debug("Message published: {} -> {} on {} (type: {})",
                message.getSenderId(),
                message.getTargetId() != null ? message.getTargetId() : "broadcast",
                topic, message.getType());

        try {
            loop.schedule(() -> deliver(topic, message));
        } catch (RejectedExecutionException e) {
            log.warn("Bus loop is shut down, dropping message {} on {}", message.getId(), topic);
        }
    }

    /**
     * Most recent messages, oldest first.
     */
    public List<BusMessage> getMessageHistory(int limit) {
        synchronized (history) {
            List<BusMessage> all = new ArrayList<>(history);
            return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
        }
    }

    /**
     * Most recent messages sent by or addressed to an agent, oldest first.
     */
    public List<BusMessage> getMessagesForAgent(String agentId, int limit) {
        synchronized (history) {
            List<BusMessage> matching = history.stream()
                    .filter(m -> agentId.equals(m.getSenderId()) || agentId.equals(m.getTargetId()))
                    .toList();
            return List.copyOf(matching.subList(Math.max(0, matching.size() - limit), matching.size()));
        }
    }

    public int getSubscriberCount(String topic) {
        return handlers.getOrDefault(topic, List.of()).size();
    }

    /**
     * Get statistics about the message bus.
     */
    public Map<String, Object> getStats() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("published", publishedCount.get());
        stats.put("delivered", deliveredCount.get());
        stats.put("failedDeliveries", failedCount.get());
        Map<String, Integer> subscribers = new HashMap<>();
        handlers.forEach((key, list) -> subscribers.put(key, list.size()));
        stats.put("subscribers", subscribers);
        synchronized (history) {
            stats.put("storedMessages", history.size());
        }
        return stats;
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private Subscription register(String key, Consumer<BusMessage> handler) {
        Objects.requireNonNull(handler, "handler");
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("topic is required");
        }
        Registration registration = new Registration(registrationSequence.incrementAndGet(), handler);
        handlers.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(registration);
        log.debug("Handler subscribed to {}", key);
        return () -> {
            List<Registration> list = handlers.get(key);
            if (list != null) {
                list.remove(registration);
            }
        };
    }

    private void validate(String topic, BusMessage message) {
        if (topic == null || topic.isBlank()) {
            throw new MessageValidationException("topic is required");
        }
        if (message == null || message.getType() == null) {
            throw new MessageValidationException("message and message type are required");
        }
        if (!topic.equals(message.getType().getTopic())) {
            throw new MessageValidationException("message " + message.getType() + " belongs on topic "
                    + message.getType().getTopic() + ", not " + topic);
        }
        MessagePayload payload = message.getPayload();
        if (payload == null) {
            throw new MessageValidationException("message " + message.getType() + " has no payload");
        }
        Class<? extends MessagePayload> expected = message.getType().getPayloadType();
        if (!expected.isInstance(payload)) {
            throw new MessageValidationException("message " + message.getType() + " expects "
                    + expected.getSimpleName() + " but carries " + payload.getClass().getSimpleName());
        }
        payload.validate();
    }

    private boolean remember(BusMessage message) {
        synchronized (history) {
            if (!recentIds.add(message.getId())) {
                return false;
            }
            history.addLast(message);
            while (history.size() > historyLimit) {
                recentIds.remove(history.removeFirst().getId());
            }
            return true;
        }
    }

    private void deliver(String topic, BusMessage message) {
        List<Registration> targets = new ArrayList<>(handlers.getOrDefault(topic, List.of()));
        if (!message.isBroadcast()) {
            targets.addAll(handlers.getOrDefault(targetKey(topic, message.getTargetId()), List.of()));
            targets.sort(Comparator.comparingLong(Registration::sequence));
        }
        if (targets.isEmpty()) {
            log.debug("No subscribers for {} on {}", message.getId(), topic);
        }
        for (Registration registration : targets) {
            deliverSafely(topic, message, registration);
        }
    }

    private void deliverSafely(String topic, BusMessage message, Registration registration) {
        try {
            registration.handler().accept(message);
            deliveredCount.incrementAndGet();
        } catch (RuntimeException e) {
            BusDeliveryException failure = new BusDeliveryException(topic, message.getId(), e);
            failedCount.incrementAndGet();
            metrics.deliveryFailed();
            log.warn("{}", failure.getMessage(), e);
        }
    }

    private static String targetKey(String topic, String targetId) {
        return topic + ":" + targetId;
    }

    private record Registration(long sequence, Consumer<BusMessage> handler) {
    }
}
