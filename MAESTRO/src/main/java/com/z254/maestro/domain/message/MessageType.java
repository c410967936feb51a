package com.z254.maestro.domain.message;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of messages carried by the bus, each bound to a topic and a payload class.
 */
public enum MessageType {

    /**
     * Generic dispatch of a task or plan step to a worker.
     */
    EXECUTE_TASK("execute_task", DispatchPayload.class, Direction.WORKER_INBOUND),

    /**
     * Dispatch alias for read-style capabilities such as balance lookups.
     */
    CHECK_BALANCE("check_balance", DispatchPayload.class, Direction.WORKER_INBOUND),

    /**
     * Dispatch alias for write-style capabilities such as transfers.
     */
    EXECUTE_TRANSACTION("execute_transaction", DispatchPayload.class, Direction.WORKER_INBOUND),

    /**
     * Best-effort request to abandon an in-flight dispatch.
     */
    CANCEL_TASK("cancel_task", CancellationPayload.class, Direction.WORKER_INBOUND),

    /**
     * Worker reports the outcome of a dispatch.
     */
    TASK_STEP_COMPLETE("task_step_complete", StepResultPayload.class, Direction.WORKER_OUTBOUND),

    /**
     * Failure alias of {@link #TASK_STEP_COMPLETE}; always treated as a failure.
     */
    TASK_STEP_ERROR("task_step_error", StepResultPayload.class, Direction.WORKER_OUTBOUND),

    TASK_REGISTERED("task_registered", TaskLifecyclePayload.class, Direction.LIFECYCLE),

    TASK_STATE_CHANGED("task_state_changed", TaskLifecyclePayload.class, Direction.LIFECYCLE),

    TASK_COMPLETE("task_complete", TaskLifecyclePayload.class, Direction.LIFECYCLE),

    TASK_FAILED("task_failed", TaskLifecyclePayload.class, Direction.LIFECYCLE);

    private final String topic;
    private final Class<? extends MessagePayload> payloadType;
    private final Direction direction;

    MessageType(String topic, Class<? extends MessagePayload> payloadType, Direction direction) {
        this.topic = topic;
        this.payloadType = payloadType;
        this.direction = direction;
    }

    public String getTopic() {
        return topic;
    }

    public Class<? extends MessagePayload> getPayloadType() {
        return payloadType;
    }

    public Direction getDirection() {
        return direction;
    }

    public boolean isDispatch() {
        return payloadType == DispatchPayload.class;
    }

    public static Optional<MessageType> fromTopic(String topic) {
        return Arrays.stream(values()).filter(t -> t.topic.equals(topic)).findFirst();
    }

    public enum Direction {
        WORKER_INBOUND,
        WORKER_OUTBOUND,
        LIFECYCLE
    }
}
