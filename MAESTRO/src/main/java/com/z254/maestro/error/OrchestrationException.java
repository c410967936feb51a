package com.z254.maestro.error;

/**
 * Root of the orchestration error taxonomy.
 * Every subclass carries a stable error code and whether another attempt could succeed.
 */
public abstract class OrchestrationException extends RuntimeException {

    private final String errorCode;
    private final boolean retryable;

    protected OrchestrationException(String errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    protected OrchestrationException(String errorCode, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Reason string stored on a failed task.
     */
    public String toReason() {
        return errorCode + ": " + getMessage();
    }
}
