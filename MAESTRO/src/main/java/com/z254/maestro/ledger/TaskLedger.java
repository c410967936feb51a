package com.z254.maestro.ledger;

import com.z254.maestro.bus.MessageBus;
import com.z254.maestro.config.MaestroProperties;
import com.z254.maestro.domain.message.BusMessage;
import com.z254.maestro.domain.message.MessageType;
import com.z254.maestro.domain.message.TaskLifecyclePayload;
import com.z254.maestro.domain.model.OwnerTaskSummary;
import com.z254.maestro.domain.model.Task;
import com.z254.maestro.domain.model.TaskMetrics;
import com.z254.maestro.domain.model.TaskState;
import com.z254.maestro.domain.model.TaskStatus;
import com.z254.maestro.domain.model.TaskView;
import com.z254.maestro.domain.repository.TaskRepository;
import com.z254.maestro.error.DuplicateTaskException;
import com.z254.maestro.error.IllegalTransitionException;
import com.z254.maestro.error.TaskNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Canonical store of task records.
 * Owns the lifecycle state machine, completion metrics and archival of finished tasks.
 * Every accepted transition is announced on the bus as {@code task_state_changed}.
 */
@Service
@Slf4j
public class TaskLedger {

    static final String SENDER_ID = "task-ledger";
    private static final int RECENT_ACTIVITY = 5;

    private final TaskRepository repository;
    private final MessageBus messageBus;
    private final Scheduler loop;
    private final MaestroProperties.TaskProperties config;

    private long totalTasks;
    private long completedTasks;
    private long failedTasks;
    private long timedTasks;
    private double averageCompletionTimeMs;

    // Observed completion durations per category
    private final Map<String, DurationStats> categoryDurations = new ConcurrentHashMap<>();

    public TaskLedger(TaskRepository repository, MessageBus messageBus, Scheduler orchestrationLoop,
                      MaestroProperties properties) {
        this.repository = repository;
        this.messageBus = messageBus;
        this.loop = orchestrationLoop;
        this.config = properties.getTasks();
    }

    /**
     * Register a new task in state NEW.
     *
     * @return a copy of the stored record
     */
    public Task registerTask(Task task) {
        if (task.getId() == null || task.getId().isBlank()) {
            task.setId(UUID.randomUUID().toString());
        }
        if (repository.exists(task.getId())) {
            throw new DuplicateTaskException(task.getId());
        }
        Task record = task.copy();
        Instant now = now();
        record.setState(TaskState.NEW);
        record.setCreatedAt(now);
        record.setUpdatedAt(now);
        record.setRetryCount(0);
        record.setResult(null);
        record.setError(null);
        repository.save(record);
        totalTasks++;

        log.info("Registered task {} for owner {} ({}, {})",
                record.getId(), record.getOwnerId(), record.getCategory(), record.getPriority());
        announce(MessageType.TASK_REGISTERED, record, null, null);
        return record.copy();
    }

    public Task updateState(String taskId, TaskState newState) {
        return updateState(taskId, newState, null, null);
    }

    /**
     * Move a task to a new state.
     *
     * @param result stored when the new state is COMPLETED
     * @param error  stored when the new state is FAILED
     * @throws IllegalTransitionException when the lifecycle does not allow the move
     * @throws TaskNotFoundException      when the task is unknown
     */
    public Task updateState(String taskId, TaskState newState, Object result, String error) {
        Task task = repository.findById(taskId).orElse(null);
        if (task == null) {
            Task archived = repository.findArchived(taskId)
                    .orElseThrow(() -> new TaskNotFoundException(taskId));
            throw reject(archived, newState);
        }
        TaskState oldState = task.getState();
        if (!oldState.canTransitionTo(newState)) {
            throw reject(task, newState);
        }

        Instant now = now();
        task.setState(newState);
        task.setUpdatedAt(now);

        switch (newState) {
            case RUNNING -> task.setStartedAt(now);
            case COMPLETED -> {
                task.setResult(result);
                task.setError(null);
            }
            case FAILED -> {
                task.setResult(null);
                task.setError(error != null ? error : "Unknown error");
            }
            default -> {
            }
        }

        if (newState.isTerminal()) {
            task.setCompletedAt(now);
            recordOutcome(task);
            scheduleArchival(taskId);
        }

        log.debug("Task {} state {} -> {}", taskId, oldState, newState);
        announce(MessageType.TASK_STATE_CHANGED, task, oldState, error);
        return task.copy();
    }

    /**
     * Count one failed attempt.
     *
     * @return the updated retry count
     */
    public int recordFailedAttempt(String taskId) {
        Task task = repository.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        if (task.getRetryCount() >= task.getMaxRetries()) {
            throw new IllegalStateException("Task " + taskId + " already used all " + task.getMaxRetries() + " retries");
        }
        task.setRetryCount(task.getRetryCount() + 1);
        task.setUpdatedAt(now());
        return task.getRetryCount();
    }

    /**
     * Copy of a live or archived record.
     */
    public Optional<Task> getTask(String taskId) {
        return findAny(taskId).map(Task::copy);
    }

    /**
     * Sanitized record with progress and an estimated completion time.
     */
    public Optional<TaskStatus> getStatus(String taskId) {
        Optional<Task> live = repository.findById(taskId);
        if (live.isPresent()) {
            return live.map(task -> toStatus(task, false));
        }
        return repository.findArchived(taskId).map(task -> toStatus(task, true));
    }

    public TaskMetrics getMetrics() {
        return TaskMetrics.builder()
                .totalTasks(totalTasks)
                .completedTasks(completedTasks)
                .failedTasks(failedTasks)
                .averageCompletionTimeMs(averageCompletionTimeMs)
                .successRate(TaskMetrics.successRate(completedTasks, failedTasks))
                .build();
    }

    /**
     * Metrics scoped to one owner, or global metrics when owner is null.
     */
    public TaskMetrics getMetrics(String ownerId) {
        if (ownerId == null) {
            return getMetrics();
        }
        List<Task> tasks = repository.findByOwner(ownerId);
        long completed = tasks.stream().filter(t -> t.getState() == TaskState.COMPLETED).count();
        long failed = tasks.stream().filter(t -> t.getState() == TaskState.FAILED).count();
        double average = tasks.stream()
                .filter(t -> t.getState() == TaskState.COMPLETED || t.getState() == TaskState.FAILED)
                .map(Task::getExecutionDuration)
                .filter(d -> d != null)
                .mapToLong(Duration::toMillis)
                .average()
                .orElse(0.0);
        return TaskMetrics.builder()
                .totalTasks(tasks.size())
                .completedTasks(completed)
                .failedTasks(failed)
                .averageCompletionTimeMs(average)
                .successRate(TaskMetrics.successRate(completed, failed))
                .build();
    }

    public OwnerTaskSummary getTasksForOwner(String ownerId) {
        List<Task> tasks = repository.findByOwner(ownerId);
        Map<TaskState, Integer> byState = new EnumMap<>(TaskState.class);
        Map<String, Integer> byCategory = new TreeMap<>();
        int active = 0;
        int completed = 0;
        for (Task task : tasks) {
            byState.merge(task.getState(), 1, Integer::sum);
            byCategory.merge(task.getCategory() != null ? task.getCategory() : "unknown", 1, Integer::sum);
            if (!task.isTerminal()) active++;
            if (task.getState() == TaskState.COMPLETED) completed++;
        }
        List<TaskView> recent = tasks.stream()
                .sorted(Comparator.comparing(Task::getUpdatedAt).reversed())
                .limit(RECENT_ACTIVITY)
                .map(TaskView::of)
                .toList();
        return new OwnerTaskSummary(ownerId, tasks.size(), active, completed, byState, byCategory, recent);
    }

    /**
     * Non-terminal tasks of an owner, or of everyone when owner is null.
     */
    public List<TaskView> getActiveTasks(String ownerId) {
        List<Task> source = ownerId == null ? repository.findAllLive() : repository.findByOwner(ownerId);
        return source.stream()
                .filter(t -> !t.isTerminal())
                .sorted(Comparator.comparing(Task::getCreatedAt))
                .map(TaskView::of)
                .toList();
    }

    /**
     * Most recently archived tasks, oldest first.
     */
    public List<TaskView> getHistory(int limit) {
        List<Task> history = repository.findHistory();
        return history.subList(Math.max(0, history.size() - limit), history.size()).stream()
                .map(TaskView::of)
                .toList();
    }

    /**
     * Move a terminal task out of the live set.
     */
    public boolean archive(String taskId) {
        Optional<Task> task = repository.findById(taskId);
        if (task.isEmpty() || !task.get().isTerminal()) {
            return false;
        }
        boolean archived = repository.archive(taskId);
        if (archived) {
            log.debug("Archived task {}", taskId);
        }
        return archived;
    }

    public int liveTaskCount() {
        return repository.countLive();
    }

    // --------------------------------------------------------------------------------------------
    // Internal helpers
    // --------------------------------------------------------------------------------------------

    private Optional<Task> findAny(String taskId) {
        return repository.findById(taskId).or(() -> repository.findArchived(taskId));
    }

    private IllegalTransitionException reject(Task task, TaskState newState) {
        IllegalTransitionException error = new IllegalTransitionException(task.getId(), task.getState(), newState);
        log.warn("Rejected transition: {}", error.getMessage());
        return error;
    }

    private void recordOutcome(Task task) {
        if (task.getState() == TaskState.CANCELLED) {
            return;
        }
        if (task.getState() == TaskState.COMPLETED) {
            completedTasks++;
        } else {
            failedTasks++;
        }
        Duration duration = task.getExecutionDuration();
        if (duration == null) {
            return;
        }
        timedTasks++;
        averageCompletionTimeMs = ((averageCompletionTimeMs * (timedTasks - 1)) + duration.toMillis()) / timedTasks;
        if (task.getState() == TaskState.COMPLETED && task.getCategory() != null) {
            categoryDurations.computeIfAbsent(task.getCategory(), k -> new DurationStats())
                    .add(duration.toMillis());
        }
    }

    private void scheduleArchival(String taskId) {
        try {
            loop.schedule(() -> archive(taskId), config.getArchiveGracePeriod().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Archival of task {} not scheduled: {}", taskId, e.getMessage());
        }
    }

    private TaskStatus toStatus(Task task, boolean archived) {
        return new TaskStatus(TaskView.of(task), task.getState().getProgress(), estimateCompletion(task), archived);
    }

    private Instant estimateCompletion(Task task) {
        if (task.isTerminal()) {
            return null;
        }
        Instant base = task.getStartedAt() != null ? task.getStartedAt() : task.getCreatedAt();
        Instant estimate = base.plus(expectedDuration(task.getCategory()));
        Instant now = now();
        return estimate.isBefore(now) ? now : estimate;
    }

    Duration expectedDuration(String category) {
        if (category != null) {
            DurationStats observed = categoryDurations.get(category);
            if (observed != null && observed.count > 0) {
                return Duration.ofMillis(Math.round(observed.meanMs));
            }
            Duration configured = config.getCategoryDurations().get(category);
            if (configured != null) {
                return configured;
            }
        }
        return config.getDefaultDuration();
    }

    private void announce(MessageType type, Task task, TaskState oldState, String reason) {
        TaskLifecyclePayload payload = TaskLifecyclePayload.builder()
                .taskId(task.getId())
                .ownerId(task.getOwnerId())
                .oldState(oldState)
                .newState(task.getState())
                .task(TaskView.of(task))
                .reason(reason)
                .build();
        messageBus.publish(BusMessage.broadcast(type, SENDER_ID, task.getId(), payload));
    }

    private Instant now() {
        return Instant.ofEpochMilli(loop.now(TimeUnit.MILLISECONDS));
    }

    private static final class DurationStats {
        private long count;
        private double meanMs;

        void add(long millis) {
            count++;
            meanMs = ((meanMs * (count - 1)) + millis) / count;
        }
    }
}
