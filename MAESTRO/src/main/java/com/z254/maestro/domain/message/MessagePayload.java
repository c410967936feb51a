package com.z254.maestro.domain.message;

import com.z254.maestro.error.MessageValidationException;

/**
 * Typed body of a bus message. Each {@link MessageType} accepts exactly one payload class.
 */
public interface MessagePayload {

    /**
     * Checks required fields.
     *
     * @throws MessageValidationException when the payload is malformed
     */
    void validate();

    static void require(boolean condition, String problem) {
        if (!condition) {
            throw new MessageValidationException(problem);
        }
    }

    static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
