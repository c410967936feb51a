package com.z254.maestro.orchestration;

import com.z254.maestro.bus.MessageBus;
import com.z254.maestro.capability.CapabilityCatalog;
import com.z254.maestro.capability.CapabilityRouter;
import com.z254.maestro.config.MaestroProperties;
import com.z254.maestro.domain.message.BusMessage;
import com.z254.maestro.domain.message.CancellationPayload;
import com.z254.maestro.domain.message.DispatchPayload;
import com.z254.maestro.domain.message.MessageType;
import com.z254.maestro.domain.message.StepResultPayload;
import com.z254.maestro.domain.message.TaskLifecyclePayload;
import com.z254.maestro.domain.model.AgentCapabilityMatch;
import com.z254.maestro.domain.model.CollaborationPlan;
import com.z254.maestro.domain.model.ExecutionStep;
import com.z254.maestro.domain.model.SecurityLevel;
import com.z254.maestro.domain.model.Task;
import com.z254.maestro.domain.model.TaskMetrics;
import com.z254.maestro.domain.model.TaskPriority;
import com.z254.maestro.domain.model.TaskRequest;
import com.z254.maestro.domain.model.TaskRequirement;
import com.z254.maestro.domain.model.TaskState;
import com.z254.maestro.domain.model.TaskStatus;
import com.z254.maestro.domain.model.TaskView;
import com.z254.maestro.error.IllegalTransitionException;
import com.z254.maestro.error.OrchestrationException;
import com.z254.maestro.error.PlanningException;
import com.z254.maestro.error.SelectionException;
import com.z254.maestro.error.TaskExecutionException;
import com.z254.maestro.error.TaskNotFoundException;
import com.z254.maestro.ledger.TaskLedger;
import com.z254.maestro.observability.OrchestrationMetrics;
import com.z254.maestro.observability.StructuredLogger;
import com.z254.maestro.planning.CollaborationPlanner;
import com.z254.maestro.planning.PlanningContext;
import com.z254.maestro.planning.TaskComplexity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Implementation of the task orchestrator.
 * <p>
 * Every mutation runs on the orchestration loop, so the queues, the active set, ledger
 * transitions and catalog load updates never race. Worker results arrive as bus messages on the
 * same loop.
 */
@Service
@Slf4j
public class TaskOrchestratorImpl implements TaskOrchestrator {

    static final String ORCHESTRATOR_ID = "orchestrator";

    private final TaskLedger ledger;
    private final CapabilityCatalog catalog;
    private final CapabilityRouter router;
    private final CollaborationPlanner planner;
    private final MessageBus messageBus;
    private final Scheduler loop;
    private final MaestroProperties properties;
    private final OrchestrationMetrics metrics;
    private final StructuredLogger structuredLogger;

    private final PriorityTaskQueue queue = new PriorityTaskQueue();
    private final Map<String, ActiveExecution> active = new ConcurrentHashMap<>();

    public TaskOrchestratorImpl(TaskLedger ledger,
                                CapabilityCatalog catalog,
                                CapabilityRouter router,
                                CollaborationPlanner planner,
                                MessageBus messageBus,
                                Scheduler orchestrationLoop,
                                MaestroProperties properties,
                                OrchestrationMetrics metrics,
                                StructuredLogger structuredLogger) {
        this.ledger = ledger;
        this.catalog = catalog;
        this.router = router;
        this.planner = planner;
        this.messageBus = messageBus;
        this.loop = orchestrationLoop;
        this.properties = properties;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;

        messageBus.subscribe(MessageType.TASK_STEP_COMPLETE.getTopic(), this::onStepResult);
        messageBus.subscribe(MessageType.TASK_STEP_ERROR.getTopic(), this::onStepResult);
        registerGauges();

        log.info("Initialized TaskOrchestrator (max concurrent tasks {}, max retries {})",
                properties.getScheduling().getMaxConcurrentTasks(), properties.getTasks().getMaxRetries());
    }

    // --------------------------------------------------------------------------------------------
    // Submission
    // --------------------------------------------------------------------------------------------

    @Override
    public Mono<TaskView> submitTask(TaskRequest request) {
        return onLoop(() -> accept(request));
    }

    @Override
    public Mono<TaskView> cancelTask(String taskId, String reason) {
        return onLoop(() -> cancel(taskId, reason));
    }

    // --------------------------------------------------------------------------------------------
    // Scheduling
    // --------------------------------------------------------------------------------------------

    @Override
    public void tick() {
        try {
            loop.schedule(this::runTick);
        } catch (RejectedExecutionException e) {
            log.warn("Orchestration loop is shut down, tick skipped");
        }
    }

    @Override
    public Mono<QueueStatus> getQueueStatus() {
        return onLoop(this::queueStatus);
    }

    @Override
    public Mono<QueuePosition> getQueuePosition(String taskId) {
        return onLoop(() -> queuePosition(taskId).orElse(null));
    }

    // --------------------------------------------------------------------------------------------
    // Queries
    // --------------------------------------------------------------------------------------------

    @Override
    public Mono<TaskStatus> getTaskStatus(String taskId) {
        return onLoop(() -> ledger.getStatus(taskId).orElse(null));
    }

    @Override
    public Mono<TaskMetrics> getMetrics(String ownerId) {
        return onLoop(() -> ledger.getMetrics(ownerId));
    }

    @Override
    public Mono<CollaborationPlan> getPlan(String taskId) {
        return onLoop(() -> planner.getActivePlan(taskId).orElse(null));
    }

    @Override
    public Flux<TaskView> getActiveTasks(String ownerId) {
        return onLoop(() -> ledger.getActiveTasks(ownerId)).flatMapMany(Flux::fromIterable);
    }

    QueueStatus queueStatus() {
        return new QueueStatus(
                queue.size(TaskPriority.HIGH),
                queue.size(TaskPriority.MEDIUM),
                queue.size(TaskPriority.LOW),
                active.size(),
                properties.getScheduling().getMaxConcurrentTasks());
    }

    // --------------------------------------------------------------------------------------------
    // Loop-side operations
    // --------------------------------------------------------------------------------------------

    private TaskView accept(TaskRequest request) {
        Task registered = ledger.registerTask(buildTask(request));
        metrics.taskSubmitted();
        structuredLogger.setTaskContext(registered.getId(), registered.getOwnerId(), null);
        try {
            structuredLogger.logTaskSubmitted(registered.getId(), registered.getOwnerId(),
                    registered.getPriority().name(), registered.isComplex());

            Optional<SelectionException> infeasible = checkFeasibility(registered);
            if (infeasible.isPresent()) {
                return TaskView.of(fail(registered.getId(), infeasible.get()));
            }
            Task queued = ledger.updateState(registered.getId(), TaskState.QUEUED);
            queue.enqueue(queued.getId(), queued.getPriority());
            log.info("Task {} queued at {} priority ({} task)", queued.getId(), queued.getPriority(),
                    queued.isComplex() ? "complex" : "simple");
            return TaskView.of(queued);
        } finally {
            structuredLogger.clearContext();
        }
    }

    void runTick() {
        if (properties.getScheduling().isWatchdogEnabled()) {
            expireOverdueDispatches();
        }
        int cap = properties.getScheduling().getMaxConcurrentTasks();
        while (active.size() < cap) {
            Optional<String> next = queue.poll();
            if (next.isEmpty()) {
                break;
            }
            startAttempt(next.get());
        }
    }

    private TaskView cancel(String taskId, String reason) {
        Task task = ledger.getTask(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        String why = reason != null ? reason : "cancelled by request";
        if (task.isTerminal()) {
            // Let the ledger reject and log the move
            ledger.updateState(taskId, TaskState.CANCELLED, null, why);
        }
        if (!queue.remove(taskId)) {
            ActiveExecution execution = active.remove(taskId);
            if (execution != null) {
                abandon(execution, why);
            }
        }
        Task cancelled = ledger.updateState(taskId, TaskState.CANCELLED, null, why);
        metrics.taskCancelled();
        log.info("Task {} cancelled: {}", taskId, why);
        return TaskView.of(cancelled);
    }

    // --------------------------------------------------------------------------------------------
    // Dispatch
    // --------------------------------------------------------------------------------------------

    private void startAttempt(String taskId) {
        Optional<Task> found = ledger.getTask(taskId);
        if (found.isEmpty() || found.get().getState() != TaskState.QUEUED) {
            log.debug("Skipping dequeued task {} in state {}", taskId, found.map(Task::getState).orElse(null));
            return;
        }
        Task task = found.get();
        ActiveExecution execution = new ActiveExecution(taskId, task.getRetryCount() + 1, now());
        active.put(taskId, execution);
        ledger.updateState(taskId, TaskState.RUNNING);

        structuredLogger.setTaskContext(taskId, task.getOwnerId(), null);
        try {
            if (task.isComplex()) {
                startPlan(task, execution);
            } else {
                dispatchSingle(task, execution);
            }
        } catch (SelectionException | PlanningException e) {
            active.remove(taskId);
            abandon(execution, e.getMessage());
            fail(taskId, e);
        } finally {
            structuredLogger.clearContext();
        }
    }

    private void dispatchSingle(Task task, ActiveExecution execution) {
        String capability = task.getRequiredCapabilities().get(0);
        TaskRequirement requirement = TaskRequirement.of(capability, task.getSecurityLevel(), latencyCeiling(task));
        List<AgentCapabilityMatch> matches = catalog.findBestAgentsForTask(requirement);
        if (matches.isEmpty()) {
            throw SelectionException.noCapableAgent(task.getId(), List.of(capability));
        }
        AgentCapabilityMatch best = matches.get(0);
        log.debug("Selected {} for task {}: {}", best.agentId(), task.getId(), best.reasoning());

        Map<String, Object> inputs = task.getParameters() != null ? new HashMap<>(task.getParameters()) : new HashMap<>();
        send(task, execution, null, best.agentId(), capability, inputs);
    }

    private void startPlan(Task task, ActiveExecution execution) {
        PlanningContext context = new PlanningContext(task.getSecurityLevel(), latencyCeiling(task), execution.getAttempt());
        CollaborationPlan plan = planner.createPlan(task, context);
        execution.setPlan(plan);
        structuredLogger.logPlanCreated(task.getId(), plan.getPlanId(), plan.getSteps().size(),
                plan.getConfidence(), plan.isParallelEligible());
        dispatchReadySteps(task, execution);
    }

    private void dispatchReadySteps(Task task, ActiveExecution execution) {
        List<ExecutionStep> ready = execution.getPlan().readySteps();
        if (ready.isEmpty() && execution.getPlan().dispatchedSteps().isEmpty()) {
            throw new PlanningException("Plan " + execution.getPlan().getPlanId() + " for task "
                    + task.getId() + " has no runnable step");
        }
        for (ExecutionStep step : ready) {
            String dispatchId = send(task, execution, step.getId(), step.getAgentId(), step.getCapability(),
                    new HashMap<>(step.getInputs()));
            step.markDispatched(dispatchId, now());
        }
    }

    private String send(Task task, ActiveExecution execution, String planStepId, String agentId,
                        String capability, Map<String, Object> inputs) {
        String dispatchId = UUID.randomUUID().toString();
        long ceiling = latencyCeiling(task);
        execution.track(new ActiveExecution.Dispatch(dispatchId, planStepId, agentId, capability, now(), ceiling));
        catalog.adjustLoad(agentId, capability, properties.getCatalog().getLoadIncrement());

        DispatchPayload payload = DispatchPayload.builder()
                .taskId(task.getId())
                .stepId(dispatchId)
                .capability(capability)
                .description(task.getDescription())
                .parameters(inputs)
                .attempt(execution.getAttempt())
                .maxLatencyMs(ceiling)
                .build();
        MessageType type = router.dispatchTypeFor(capability);
        messageBus.publish(BusMessage.create(type, ORCHESTRATOR_ID, agentId, task.getId(), payload));

        structuredLogger.logTaskDispatched(task.getId(), dispatchId, agentId, capability, execution.getAttempt());
        return dispatchId;
    }

    // --------------------------------------------------------------------------------------------
    // Completion handling
    // --------------------------------------------------------------------------------------------

    void onStepResult(BusMessage message) {
        StepResultPayload result = message.payloadAs(StepResultPayload.class);
        ActiveExecution execution = active.get(result.getTaskId());
        if (execution == null) {
            log.debug("Ignoring result for task {} with no active attempt", result.getTaskId());
            return;
        }
        ActiveExecution.Dispatch dispatch = execution.resolve(result.getStepId());
        if (dispatch == null) {
            log.debug("Ignoring stale result {} for task {}", result.getStepId(), result.getTaskId());
            return;
        }

        StepResultPayload.Outcome outcome = message.getType() == MessageType.TASK_STEP_ERROR
                ? StepResultPayload.Outcome.FAILED
                : result.getOutcome();
        switch (outcome) {
            case AWAITING_SIGNATURE -> advanceApproval(execution, TaskState.RUNNING, TaskState.AWAITING_SIGN);
            case CONFIRMING -> advanceApproval(execution, TaskState.AWAITING_SIGN, TaskState.CONFIRMING);
            case SUCCEEDED -> onDispatchSucceeded(execution, dispatch, result);
            case FAILED -> onDispatchFailed(execution, dispatch, result);
        }
    }

    private void advanceApproval(ActiveExecution execution, TaskState expected, TaskState next) {
        if (execution.isPlanned()) {
            log.debug("Ignoring approval update for planned task {}", execution.getTaskId());
            return;
        }
        Optional<TaskState> current = ledger.getTask(execution.getTaskId()).map(Task::getState);
        if (current.isPresent() && current.get() == expected) {
            ledger.updateState(execution.getTaskId(), next);
        } else {
            log.warn("Task {} reported {} while in {}", execution.getTaskId(), next, current.orElse(null));
        }
    }

    private void onDispatchSucceeded(ActiveExecution execution, ActiveExecution.Dispatch dispatch,
                                     StepResultPayload result) {
        execution.release(dispatch.dispatchId());
        settle(dispatch, true, result.getLatencyMs());

        if (!execution.isPlanned()) {
            complete(execution, result.getResult());
            return;
        }
        CollaborationPlan plan = execution.getPlan();
        plan.getStep(dispatch.planStepId()).ifPresent(step -> step.markCompleted(result.getResult(), now()));
        if (plan.isComplete()) {
            complete(execution, plan.results());
            return;
        }
        Task task = ledger.getTask(execution.getTaskId()).orElseThrow(() -> new TaskNotFoundException(execution.getTaskId()));
        try {
            dispatchReadySteps(task, execution);
        } catch (PlanningException e) {
            active.remove(task.getId());
            abandon(execution, e.getMessage());
            fail(task.getId(), e);
        }
    }

    private void onDispatchFailed(ActiveExecution execution, ActiveExecution.Dispatch dispatch,
                                  StepResultPayload result) {
        execution.release(dispatch.dispatchId());
        settle(dispatch, false, result.getLatencyMs());
        String workerError = result.getError() != null ? result.getError() : "worker reported failure";
        String reason = workerError;
        if (execution.isPlanned()) {
            execution.getPlan().getStep(dispatch.planStepId()).ifPresent(step -> step.markFailed(workerError, now()));
            reason = dispatch.planStepId() + " (" + dispatch.capability() + ") failed: " + workerError;
        }
        retryOrFail(execution, new TaskExecutionException(reason));
    }

    private void complete(ActiveExecution execution, Object result) {
        String taskId = execution.getTaskId();
        active.remove(taskId);
        abandon(execution, "task completed");

        if (ledger.getTask(taskId).map(Task::getState).orElse(null) == TaskState.AWAITING_SIGN) {
            ledger.updateState(taskId, TaskState.CONFIRMING);
        }
        Task completed = ledger.updateState(taskId, TaskState.COMPLETED, result, null);
        Duration duration = completed.getExecutionDuration();
        metrics.taskCompleted(duration);
        structuredLogger.logTaskCompleted(taskId, duration != null ? duration.toMillis() : 0,
                execution.isPlanned() ? execution.getPlan().getSteps().size() : 1);
        log.info("Task completed: {} - attempt: {} duration: {}ms", taskId, execution.getAttempt(),
                duration != null ? duration.toMillis() : 0);
        notify(MessageType.TASK_COMPLETE, completed, result, null);
    }

    /**
     * Return the task to its queue while retries remain, otherwise fail it.
     */
    private void retryOrFail(ActiveExecution execution, OrchestrationException error) {
        String taskId = execution.getTaskId();
        active.remove(taskId);
        abandon(execution, error.getMessage());

        Task task = ledger.getTask(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        if (!error.isRetryable()) {
            fail(taskId, error);
            return;
        }
        int retries = task.canRetry()
                ? ledger.recordFailedAttempt(taskId)
                : task.getRetryCount();
        if (retries < task.getMaxRetries()) {
            Task requeued = ledger.updateState(taskId, TaskState.QUEUED);
            queue.enqueue(taskId, requeued.getPriority());
            metrics.taskRetried();
            structuredLogger.logTaskRetried(taskId, retries, task.getMaxRetries(), error.getMessage());
            log.info("Task {} requeued after failure ({}/{}): {}", taskId, retries, task.getMaxRetries(),
                    error.getMessage());
        } else {
            fail(taskId, error);
        }
    }

    private Task fail(String taskId, OrchestrationException error) {
        Task failed = ledger.updateState(taskId, TaskState.FAILED, null, error.toReason());
        metrics.taskFailed();
        if (error instanceof SelectionException) {
            metrics.selectionFailed();
            structuredLogger.logSelectionFailed(taskId, String.join(",", failed.getRequiredCapabilities()));
        }
        structuredLogger.logTaskFailed(taskId, error.getErrorCode(), error.getMessage());
        log.info("Task failed: {} - {}", taskId, error.toReason());
        notify(MessageType.TASK_FAILED, failed, null, error.toReason());
        return failed;
    }

    /**
     * Release every outstanding dispatch of an attempt and tell the workers to stop.
     */
    private void abandon(ActiveExecution execution, String reason) {
        for (ActiveExecution.Dispatch dispatch : execution.outstanding()) {
            execution.release(dispatch.dispatchId());
            catalog.adjustLoad(dispatch.agentId(), dispatch.capability(), -properties.getCatalog().getLoadIncrement());
            CancellationPayload payload = CancellationPayload.builder()
                    .taskId(execution.getTaskId())
                    .stepId(dispatch.dispatchId())
                    .reason(reason)
                    .build();
            messageBus.publish(BusMessage.create(MessageType.CANCEL_TASK, ORCHESTRATOR_ID, dispatch.agentId(),
                    execution.getTaskId(), payload));
        }
        if (execution.isPlanned()) {
            planner.removePlan(execution.getTaskId());
        }
    }

    private void settle(ActiveExecution.Dispatch dispatch, boolean success, Long reportedLatencyMs) {
        long latency = reportedLatencyMs != null
                ? reportedLatencyMs
                : Duration.between(dispatch.dispatchedAt(), now()).toMillis();
        catalog.adjustLoad(dispatch.agentId(), dispatch.capability(), -properties.getCatalog().getLoadIncrement());
        catalog.recordOutcome(dispatch.agentId(), dispatch.capability(), success, latency);
    }

    // --------------------------------------------------------------------------------------------
    // Watchdog
    // --------------------------------------------------------------------------------------------

    private void expireOverdueDispatches() {
        Instant now = now();
        double factor = properties.getScheduling().getWatchdogGraceFactor();
        for (ActiveExecution execution : new ArrayList<>(active.values())) {
            TaskState state = ledger.getTask(execution.getTaskId()).map(Task::getState).orElse(null);
            if (state != TaskState.RUNNING) {
                // Tasks waiting on an external signature are not bounded by worker latency
                continue;
            }
            for (ActiveExecution.Dispatch dispatch : execution.outstanding()) {
                long elapsed = Duration.between(dispatch.dispatchedAt(), now).toMillis();
                if (elapsed > dispatch.maxLatencyMs() * factor) {
                    log.warn("Dispatch {} of task {} to {} exceeded {}ms (elapsed {}ms)", dispatch.dispatchId(),
                            execution.getTaskId(), dispatch.agentId(), dispatch.maxLatencyMs(), elapsed);
                    metrics.watchdogExpired();
                    catalog.recordOutcome(dispatch.agentId(), dispatch.capability(), false, elapsed);
                    retryOrFail(execution, TaskExecutionException.timeout(execution.getTaskId(), dispatch.agentId(), elapsed));
                    break;
                }
            }
        }
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private Task buildTask(TaskRequest request) {
        String description = request.getDescription() != null ? request.getDescription() : "";
        String category = request.getCategory() != null && !request.getCategory().isBlank()
                ? request.getCategory()
                : TaskInference.inferCategory(description);
        List<String> capabilities = request.getRequiredCapabilities() != null && !request.getRequiredCapabilities().isEmpty()
                ? new ArrayList<>(new LinkedHashSet<>(request.getRequiredCapabilities()))
                : router.capabilitiesFor(category);

        Task task = Task.builder()
                .id(request.getTaskId())
                .ownerId(request.getOwnerId())
                .description(description)
                .category(category)
                .priority(request.getPriority() != null ? request.getPriority() : TaskInference.inferPriority(description))
                .parameters(request.getParameters() != null ? new HashMap<>(request.getParameters()) : new HashMap<>())
                .requiredCapabilities(capabilities)
                .securityLevel(request.getSecurityLevel() != null ? request.getSecurityLevel() : SecurityLevel.LOW)
                .maxRetries(request.getMaxRetries() != null ? Math.max(0, request.getMaxRetries())
                        : properties.getTasks().getMaxRetries())
                .build();
        task.setComplex(TaskComplexity.isComplex(task));
        return task;
    }

    private Optional<SelectionException> checkFeasibility(Task task) {
        long ceiling = latencyCeiling(task);
        for (String capability : task.getRequiredCapabilities()) {
            TaskRequirement requirement = TaskRequirement.of(capability, task.getSecurityLevel(), ceiling);
            if (catalog.findBestAgentsForTask(requirement).isEmpty()) {
                return Optional.of(SelectionException.noCapableAgent(task.getId(), List.of(capability)));
            }
        }
        if (task.getRequiredCapabilities().isEmpty()) {
            return Optional.of(SelectionException.noCapableAgent(task.getId(), List.of()));
        }
        return Optional.empty();
    }

    private Optional<QueuePosition> queuePosition(String taskId) {
        int position = queue.positionOf(taskId);
        if (position == 0) {
            return Optional.empty();
        }
        TaskPriority priority = ledger.getTask(taskId).map(Task::getPriority).orElse(TaskPriority.MEDIUM);
        Duration perPosition = properties.getScheduling().getEstimatedStartPerPosition();
        return Optional.of(new QueuePosition(taskId, priority, position, now().plus(perPosition.multipliedBy(position))));
    }

    private long latencyCeiling(Task task) {
        return properties.getLatency().forPriority(task.getPriority()).toMillis();
    }

    private void notify(MessageType type, Task task, Object result, String reason) {
        TaskLifecyclePayload payload = TaskLifecyclePayload.builder()
                .taskId(task.getId())
                .ownerId(task.getOwnerId())
                .newState(task.getState())
                .task(TaskView.of(task))
                .result(result)
                .reason(reason)
                .build();
        messageBus.publish(BusMessage.broadcast(type, ORCHESTRATOR_ID, task.getId(), payload));
    }

    private void registerGauges() {
        for (TaskPriority priority : TaskPriority.values()) {
            metrics.gauge("maestro.queue.depth", "Tasks waiting for dispatch",
                    () -> queue.size(priority), "priority", priority.name().toLowerCase());
        }
        metrics.gauge("maestro.tasks.active", "Tasks currently dispatched", active::size);
    }

    private <T> Mono<T> onLoop(Callable<T> action) {
        return Mono.fromCallable(action).subscribeOn(loop);
    }

    private Instant now() {
        return Instant.ofEpochMilli(loop.now(TimeUnit.MILLISECONDS));
    }
}
