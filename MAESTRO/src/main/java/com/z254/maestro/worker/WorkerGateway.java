package com.z254.maestro.worker;

import com.z254.maestro.bus.MessageBus;
import com.z254.maestro.bus.Subscription;
import com.z254.maestro.capability.CapabilityCatalog;
import com.z254.maestro.domain.message.BusMessage;
import com.z254.maestro.domain.message.DispatchPayload;
import com.z254.maestro.domain.message.MessageType;
import com.z254.maestro.domain.message.StepResultPayload;
import com.z254.maestro.domain.model.Capability;
import com.z254.maestro.error.OrchestrationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connects workers to the bus: registers their capabilities, routes targeted inbound messages to
 * them and publishes their replies. A worker that errors on a dispatch is reported as a failed step.
 */
@Component
@Slf4j
public class WorkerGateway {

    private final MessageBus messageBus;
    private final CapabilityCatalog catalog;
    private final Map<String, List<Subscription>> attached = new ConcurrentHashMap<>();

    public WorkerGateway(MessageBus messageBus, CapabilityCatalog catalog, List<Worker> workers) {
        this.messageBus = messageBus;
        this.catalog = catalog;
        workers.forEach(this::attach);
    }

    /**
     * Register a worker's capabilities and subscribe it to its inbound topics.
     */
    public void attach(Worker worker) {
        String workerId = worker.getWorkerId();
        if (attached.containsKey(workerId)) {
            throw new IllegalStateException("Worker already attached: " + workerId);
        }
        for (Capability capability : worker.getCapabilities()) {
            Capability entry = capability.copy();
            entry.setAgentId(workerId);
            catalog.registerCapability(entry);
        }
        List<Subscription> subscriptions = new ArrayList<>();
        for (MessageType type : MessageType.values()) {
            if (type.getDirection() == MessageType.Direction.WORKER_INBOUND) {
                subscriptions.add(messageBus.subscribe(type.getTopic(), workerId, message -> handle(worker, message)));
            }
        }
        attached.put(workerId, subscriptions);
        log.info("Attached worker {} with {} capabilities", workerId, worker.getCapabilities().size());
    }

    /**
     * Unsubscribe a worker and remove its capabilities from the catalog.
     */
    public void detach(String workerId) {
        List<Subscription> subscriptions = attached.remove(workerId);
        if (subscriptions == null) {
            return;
        }
        subscriptions.forEach(Subscription::cancel);
        catalog.unregisterAgent(workerId);
        log.info("Detached worker {}", workerId);
    }

    public boolean isAttached(String workerId) {
        return attached.containsKey(workerId);
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private void handle(Worker worker, BusMessage message) {
        if (!worker.accepts(message)) {
            return;
        }
        Mono<BusMessage> reply;
        try {
            reply = worker.handleMessage(message);
        } catch (RuntimeException e) {
            reportFailure(worker, message, e);
            return;
        }
        if (reply == null) {
            return;
        }
        reply.subscribe(
                answer -> publishReply(worker, answer),
                error -> reportFailure(worker, message, error));
    }

    private void publishReply(Worker worker, BusMessage reply) {
        if (reply.getSenderId() == null) {
            reply.setSenderId(worker.getWorkerId());
        }
        try {
            messageBus.publish(reply);
        } catch (OrchestrationException e) {
            log.warn("Dropped invalid reply from worker {}: {}", worker.getWorkerId(), e.getMessage());
        }
    }

    private void reportFailure(Worker worker, BusMessage message, Throwable error) {
        log.warn("Worker {} failed handling {}: {}", worker.getWorkerId(), message.getType(), error.getMessage());
        if (!(message.getPayload() instanceof DispatchPayload dispatch)) {
            return;
        }
        StepResultPayload failure = StepResultPayload.failure(dispatch.getTaskId(), dispatch.getStepId(),
                error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName());
        messageBus.publish(BusMessage.create(MessageType.TASK_STEP_ERROR, worker.getWorkerId(),
                message.getSenderId(), dispatch.getTaskId(), failure));
    }
}
