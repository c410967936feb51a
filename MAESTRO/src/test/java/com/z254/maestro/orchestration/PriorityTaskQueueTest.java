package com.z254.maestro.orchestration;

import com.z254.maestro.domain.model.TaskPriority;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PriorityTaskQueueTest {

    private PriorityTaskQueue queue;

    @BeforeEach
    void setUp() {
        queue = new PriorityTaskQueue();
    }

    @Test
    @DisplayName("Should drain high before medium before low, FIFO within a level")
    void shouldDrainInPriorityOrder() {
        queue.enqueue("low-1", TaskPriority.LOW);
        queue.enqueue("med-1", TaskPriority.MEDIUM);
        queue.enqueue("high-1", TaskPriority.HIGH);
        queue.enqueue("med-2", TaskPriority.MEDIUM);

        assertThat(queue.poll()).contains("high-1");
        assertThat(queue.poll()).contains("med-1");
        assertThat(queue.poll()).contains("med-2");
        assertThat(queue.poll()).contains("low-1");
        assertThat(queue.poll()).isEmpty();
    }

    @Test
    void shouldReportPositionAcrossLevels() {
        queue.enqueue("med-1", TaskPriority.MEDIUM);
        queue.enqueue("low-1", TaskPriority.LOW);
        queue.enqueue("high-1", TaskPriority.HIGH);

        assertThat(queue.positionOf("high-1")).isEqualTo(1);
        assertThat(queue.positionOf("med-1")).isEqualTo(2);
        assertThat(queue.positionOf("low-1")).isEqualTo(3);
        assertThat(queue.positionOf("missing")).isZero();
    }

    @Test
    void shouldRejectDuplicateEnqueue() {
        queue.enqueue("task-1", TaskPriority.HIGH);

        assertThatThrownBy(() -> queue.enqueue("task-1", TaskPriority.LOW))
                .isInstanceOf(IllegalStateException.class);
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    void shouldRemoveQueuedTask() {
        queue.enqueue("task-1", TaskPriority.MEDIUM);
        queue.enqueue("task-2", TaskPriority.MEDIUM);

        assertThat(queue.remove("task-1")).isTrue();
        assertThat(queue.remove("task-1")).isFalse();
        assertThat(queue.contains("task-1")).isFalse();
        assertThat(queue.size(TaskPriority.MEDIUM)).isEqualTo(1);
        assertThat(queue.positionOf("task-2")).isEqualTo(1);
    }
}
