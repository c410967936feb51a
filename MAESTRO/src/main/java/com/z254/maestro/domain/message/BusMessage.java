package com.z254.maestro.domain.message;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Envelope for everything that travels over the message bus.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusMessage {

    /**
     * Unique identifier for this message.
     */
    private String id;

    private MessageType type;

    /**
     * Stamped by the bus on publish when absent.
     */
    private Instant timestamp;

    private String senderId;

    /**
     * Receiving worker. Null for broadcast messages.
     */
    private String targetId;

    /**
     * Task the message relates to.
     */
    private String correlationId;

    private MessagePayload payload;

    public static BusMessage create(MessageType type, String senderId, String targetId,
                                    String correlationId, MessagePayload payload) {
        return BusMessage.builder()
                .id(UUID.randomUUID().toString())
                .type(type)
                .senderId(senderId)
                .targetId(targetId)
                .correlationId(correlationId)
                .payload(payload)
                .build();
    }

    public static BusMessage broadcast(MessageType type, String senderId, String correlationId,
                                       MessagePayload payload) {
        return create(type, senderId, null, correlationId, payload);
    }

    /**
     * Typed access to the payload.
     */
    public <T extends MessagePayload> T payloadAs(Class<T> payloadClass) {
        return payloadClass.cast(payload);
    }

    public boolean isBroadcast() {
        return targetId == null;
    }
}
