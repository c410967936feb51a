package com.z254.maestro.error;

/**
 * A subscriber threw while handling a message. Logged by the bus, never rethrown.
 */
public class BusDeliveryException extends OrchestrationException {

    public static final String CODE = "BUS_DELIVERY_FAILED";

    public BusDeliveryException(String topic, String messageId, Throwable cause) {
        super(CODE, "Handler failed for message " + messageId + " on topic " + topic
                + ": " + cause.getMessage(), false, cause);
    }
}
