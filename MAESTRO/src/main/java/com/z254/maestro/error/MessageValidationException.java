package com.z254.maestro.error;

/**
 * Message rejected at the bus boundary.
 */
public class MessageValidationException extends OrchestrationException {

    public static final String CODE = "INVALID_MESSAGE";

    public MessageValidationException(String message) {
        super(CODE, message, false);
    }
}
