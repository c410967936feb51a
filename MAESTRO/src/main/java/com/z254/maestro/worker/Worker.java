package com.z254.maestro.worker;

import com.z254.maestro.domain.message.BusMessage;
import com.z254.maestro.domain.model.Capability;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * A specialized executor reachable over the message bus.
 * Implementations advertise what they can do and answer dispatches; they share no base class.
 */
public interface Worker {

    /**
     * Identifier used as the target of dispatch messages.
     */
    String getWorkerId();

    /**
     * Capabilities to register in the catalog. The agentId of each entry is forced to {@link #getWorkerId()}.
     */
    List<Capability> getCapabilities();

    /**
     * Handle an inbound message.
     *
     * @return the reply to publish, or empty when there is none
     */
    Mono<BusMessage> handleMessage(BusMessage message);

    /**
     * Filter applied before {@link #handleMessage}. Accepts everything by default.
     */
    default boolean accepts(BusMessage message) {
        return true;
    }
}
