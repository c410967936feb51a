package com.z254.maestro.ledger;

import com.z254.maestro.bus.MessageBus;
import com.z254.maestro.config.MaestroProperties;
import com.z254.maestro.domain.message.BusMessage;
import com.z254.maestro.domain.message.MessageType;
import com.z254.maestro.domain.message.TaskLifecyclePayload;
import com.z254.maestro.domain.model.OwnerTaskSummary;
import com.z254.maestro.domain.model.Task;
import com.z254.maestro.domain.model.TaskMetrics;
import com.z254.maestro.domain.model.TaskPriority;
import com.z254.maestro.domain.model.TaskState;
import com.z254.maestro.domain.model.TaskStatus;
import com.z254.maestro.domain.repository.impl.InMemoryTaskRepository;
import com.z254.maestro.error.DuplicateTaskException;
import com.z254.maestro.error.IllegalTransitionException;
import com.z254.maestro.error.TaskNotFoundException;
import com.z254.maestro.observability.OrchestrationMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for TaskLedger.
 */
class TaskLedgerTest {

    private VirtualTimeScheduler loop;
    private MaestroProperties properties;
    private TaskLedger ledger;
    private List<TaskLifecyclePayload> stateChanges;

    @BeforeEach
    void setUp() {
        loop = VirtualTimeScheduler.create();
        properties = new MaestroProperties();
        MessageBus messageBus = new MessageBus(loop, properties, new OrchestrationMetrics(new SimpleMeterRegistry()));
        ledger = new TaskLedger(new InMemoryTaskRepository(properties), messageBus, loop, properties);

        stateChanges = new ArrayList<>();
        messageBus.subscribe(MessageType.TASK_STATE_CHANGED.getTopic(),
                m -> stateChanges.add(m.payloadAs(TaskLifecyclePayload.class)));
    }

    private Task register(String id, String owner, String category) {
        return ledger.registerTask(Task.builder()
                .id(id)
                .ownerId(owner)
                .description("check my balance")
                .category(category)
                .priority(TaskPriority.HIGH)
                .maxRetries(3)
                .build());
    }

    private void runToCompletion(String id, Duration runtime) {
        ledger.updateState(id, TaskState.QUEUED);
        ledger.updateState(id, TaskState.RUNNING);
        loop.advanceTimeBy(runtime);
        ledger.updateState(id, TaskState.COMPLETED, Map.of("balance", 100), null);
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        void shouldRegisterTaskAsNew() {
            // When
            Task task = register("t1", "user-1", "balance_check");

            // Then
            assertThat(task.getState()).isEqualTo(TaskState.NEW);
            assertThat(task.getCreatedAt()).isNotNull();
            assertThat(ledger.getTask("t1")).isPresent();
        }

        @Test
        void shouldAssignIdWhenMissing() {
            Task task = ledger.registerTask(Task.builder().ownerId("user-1").description("x").build());

            assertThat(task.getId()).isNotBlank();
        }

        @Test
        void shouldRejectDuplicateIds() {
            register("t1", "user-1", "balance_check");

            assertThatThrownBy(() -> register("t1", "user-1", "balance_check"))
                    .isInstanceOf(DuplicateTaskException.class)
                    .hasMessageContaining("t1");
            assertThat(ledger.liveTaskCount()).isEqualTo(1);
        }

        @Test
        void shouldAssignIdWhenBlank() {
            // When
            Task task = register("  ", "user-1", "balance_check");

            // Then
            assertThat(task.getId()).isNotBlank();
            assertThat(ledger.getTask(task.getId())).isPresent();
            assertThat(ledger.liveTaskCount()).isEqualTo(1);
        }

        @Test
        void shouldFollowLegalTransitionsAndAnnounceThem() {
            // Given
            register("t1", "user-1", "balance_check");

            // When
            runToCompletion("t1", Duration.ofSeconds(2));

            // Then
            Task task = ledger.getTask("t1").orElseThrow();
            assertThat(task.getState()).isEqualTo(TaskState.COMPLETED);
            assertThat(task.getResult()).isEqualTo(Map.of("balance", 100));
            assertThat(task.getStartedAt()).isNotNull();
            assertThat(task.getCompletedAt()).isNotNull();
            assertThat(stateChanges).extracting(TaskLifecyclePayload::getNewState)
                    .containsExactly(TaskState.QUEUED, TaskState.RUNNING, TaskState.COMPLETED);
            assertThat(stateChanges.get(0).getOldState()).isEqualTo(TaskState.NEW);
        }

        @Test
        void shouldRejectIllegalTransitionAndKeepState() {
            // Given
            register("t1", "user-1", "balance_check");

            // When / Then
            assertThatThrownBy(() -> ledger.updateState("t1", TaskState.COMPLETED))
                    .isInstanceOf(IllegalTransitionException.class)
                    .satisfies(e -> {
                        IllegalTransitionException ite = (IllegalTransitionException) e;
                        assertThat(ite.getFrom()).isEqualTo(TaskState.NEW);
                        assertThat(ite.getTo()).isEqualTo(TaskState.COMPLETED);
                    });
            assertThat(ledger.getTask("t1").orElseThrow().getState()).isEqualTo(TaskState.NEW);
        }

        @Test
        void shouldNeverLeaveTerminalState() {
            // Given
            register("t1", "user-1", "balance_check");
            ledger.updateState("t1", TaskState.CANCELLED);

            // When / Then
            assertThatThrownBy(() -> ledger.updateState("t1", TaskState.QUEUED))
                    .isInstanceOf(IllegalTransitionException.class);
        }

        @Test
        void shouldStoreErrorOnFailure() {
            // Given
            register("t1", "user-1", "balance_check");

            // When
            ledger.updateState("t1", TaskState.FAILED, null, "NO_CAPABLE_AGENT: nobody");

            // Then
            Task task = ledger.getTask("t1").orElseThrow();
            assertThat(task.getError()).isEqualTo("NO_CAPABLE_AGENT: nobody");
            assertThat(task.getResult()).isNull();
        }

        @Test
        void shouldThrowForUnknownTask() {
            assertThatThrownBy(() -> ledger.updateState("missing", TaskState.QUEUED))
                    .isInstanceOf(TaskNotFoundException.class);
        }

        @Test
        void shouldBoundFailedAttempts() {
            // Given
            ledger.registerTask(Task.builder().id("t1").ownerId("u").maxRetries(1).build());

            // When
            int retries = ledger.recordFailedAttempt("t1");

            // Then
            assertThat(retries).isEqualTo(1);
            assertThatThrownBy(() -> ledger.recordFailedAttempt("t1")).isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("metrics")
    class Metrics {

        @Test
        void shouldTrackGlobalCountersAndAverageDuration() {
            // Given
            register("t1", "user-1", "balance_check");
            register("t2", "user-1", "balance_check");
            register("t3", "user-2", "balance_check");

            // When
            runToCompletion("t1", Duration.ofSeconds(2));
            runToCompletion("t2", Duration.ofSeconds(4));
            ledger.updateState("t3", TaskState.FAILED, null, "boom");

            // Then
            TaskMetrics metrics = ledger.getMetrics();
            assertThat(metrics.getTotalTasks()).isEqualTo(3);
            assertThat(metrics.getCompletedTasks()).isEqualTo(2);
            assertThat(metrics.getFailedTasks()).isEqualTo(1);
            assertThat(metrics.getAverageCompletionTimeMs()).isCloseTo(3000.0, within(1e-6));
            assertThat(metrics.getSuccessRate()).isCloseTo(2.0 / 3.0, within(1e-9));
        }

        @Test
        void shouldScopeMetricsToOwner() {
            // Given
            register("t1", "user-1", "balance_check");
            register("t2", "user-2", "balance_check");
            runToCompletion("t1", Duration.ofSeconds(1));

            // When
            TaskMetrics metrics = ledger.getMetrics("user-2");

            // Then
            assertThat(metrics.getTotalTasks()).isEqualTo(1);
            assertThat(metrics.getCompletedTasks()).isZero();
            assertThat(metrics.getSuccessRate()).isZero();
        }

        @Test
        void shouldNotCountCancellationsAsOutcomes() {
            // Given
            register("t1", "user-1", "balance_check");

            // When
            ledger.updateState("t1", TaskState.CANCELLED);

            // Then
            assertThat(ledger.getMetrics().getFailedTasks()).isZero();
            assertThat(ledger.getMetrics().getCompletedTasks()).isZero();
        }

        @Test
        void shouldSummarizeOwnerTasks() {
            // Given
            register("t1", "user-1", "balance_check");
            register("t2", "user-1", "token_operations");
            runToCompletion("t1", Duration.ofSeconds(1));

            // When
            OwnerTaskSummary summary = ledger.getTasksForOwner("user-1");

            // Then
            assertThat(summary.total()).isEqualTo(2);
            assertThat(summary.active()).isEqualTo(1);
            assertThat(summary.completed()).isEqualTo(1);
            assertThat(summary.byState()).containsEntry(TaskState.COMPLETED, 1).containsEntry(TaskState.NEW, 1);
            assertThat(summary.byCategory()).containsEntry("token_operations", 1);
            assertThat(ledger.getActiveTasks("user-1")).extracting(v -> v.id()).containsExactly("t2");
        }
    }

    @Nested
    @DisplayName("status and archival")
    class StatusAndArchival {

        @Test
        void shouldReportProgressAndEstimate() {
            // Given
            register("t1", "user-1", "balance_check");
            ledger.updateState("t1", TaskState.QUEUED);
            ledger.updateState("t1", TaskState.RUNNING);

            // When
            TaskStatus status = ledger.getStatus("t1").orElseThrow();

            // Then
            assertThat(status.progress()).isEqualTo(TaskState.RUNNING.getProgress());
            assertThat(status.estimatedCompletion()).isAfter(status.task().startedAt());
            assertThat(status.archived()).isFalse();
        }

        @Test
        void shouldLearnExpectedDurationFromCompletions() {
            // Given
            register("t1", "user-1", "balance_check");

            // When
            runToCompletion("t1", Duration.ofSeconds(30));

            // Then
            assertThat(ledger.expectedDuration("balance_check")).isEqualTo(Duration.ofSeconds(30));
            assertThat(ledger.expectedDuration("information")).isEqualTo(Duration.ofMinutes(1));
            assertThat(ledger.expectedDuration("unknown")).isEqualTo(properties.getTasks().getDefaultDuration());
        }

        @Test
        void shouldArchiveTerminalTaskAfterGracePeriod() {
            // Given
            register("t1", "user-1", "balance_check");
            runToCompletion("t1", Duration.ofSeconds(1));
            assertThat(ledger.liveTaskCount()).isEqualTo(1);

            // When
            loop.advanceTimeBy(properties.getTasks().getArchiveGracePeriod());

            // Then
            assertThat(ledger.liveTaskCount()).isZero();
            assertThat(ledger.getStatus("t1")).hasValueSatisfying(s -> assertThat(s.archived()).isTrue());
            assertThat(ledger.getHistory(10)).extracting(v -> v.id()).containsExactly("t1");
            assertThat(ledger.getTasksForOwner("user-1").total()).isEqualTo(1);
        }

        @Test
        void shouldNotArchiveLiveTasks() {
            register("t1", "user-1", "balance_check");

            assertThat(ledger.archive("t1")).isFalse();
        }

        @Test
        void shouldRejectTransitionsOfArchivedTasks() {
            // Given
            register("t1", "user-1", "balance_check");
            ledger.updateState("t1", TaskState.CANCELLED);
            loop.advanceTimeBy(properties.getTasks().getArchiveGracePeriod());

            // When / Then
            assertThatThrownBy(() -> ledger.updateState("t1", TaskState.QUEUED))
                    .isInstanceOf(IllegalTransitionException.class);
        }
    }

    @Test
    void shouldAnnounceRegistration() {
        // Given
        List<BusMessage> registered = new ArrayList<>();
        MessageBus bus = new MessageBus(loop, properties, new OrchestrationMetrics(new SimpleMeterRegistry()));
        TaskLedger other = new TaskLedger(new InMemoryTaskRepository(properties), bus, loop, properties);
        bus.subscribe(MessageType.TASK_REGISTERED.getTopic(), registered::add);

        // When
        other.registerTask(Task.builder().id("t9").ownerId("user-1").build());

        // Then
        assertThat(registered).hasSize(1);
        assertThat(registered.get(0).getCorrelationId()).isEqualTo("t9");
        assertThat(registered.get(0).getSenderId()).isEqualTo(TaskLedger.SENDER_ID);
    }
}
