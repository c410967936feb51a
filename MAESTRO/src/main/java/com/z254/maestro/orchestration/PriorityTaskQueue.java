package com.z254.maestro.orchestration;

import com.z254.maestro.domain.model.TaskPriority;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Three FIFO queues of task ids, drained strictly high before medium before low.
 */
public class PriorityTaskQueue {

    private final Map<TaskPriority, Deque<String>> queues = new EnumMap<>(TaskPriority.class);

    public PriorityTaskQueue() {
        for (TaskPriority priority : TaskPriority.values()) {
            queues.put(priority, new ArrayDeque<>());
        }
    }

    public synchronized void enqueue(String taskId, TaskPriority priority) {
        if (contains(taskId)) {
            throw new IllegalStateException("Task already queued: " + taskId);
        }
        queues.get(priority).addLast(taskId);
    }

    /**
     * Next task id in priority order.
     */
    public synchronized Optional<String> poll() {
        for (TaskPriority priority : TaskPriority.values()) {
            String next = queues.get(priority).pollFirst();
            if (next != null) {
                return Optional.of(next);
            }
        }
        return Optional.empty();
    }

    public synchronized boolean remove(String taskId) {
        for (Deque<String> queue : queues.values()) {
            if (queue.remove(taskId)) {
                return true;
            }
        }
        return false;
    }

    public synchronized boolean contains(String taskId) {
        return queues.values().stream().anyMatch(q -> q.contains(taskId));
    }

    /**
     * 1-based position across all levels, or 0 when the task is not queued.
     */
    public synchronized int positionOf(String taskId) {
        int ahead = 0;
        for (TaskPriority priority : TaskPriority.values()) {
            int index = 0;
            for (String queued : queues.get(priority)) {
                if (queued.equals(taskId)) {
                    return ahead + index + 1;
                }
                index++;
            }
            ahead += queues.get(priority).size();
        }
        return 0;
    }

    public synchronized int size(TaskPriority priority) {
        return queues.get(priority).size();
    }

    public synchronized int size() {
        return queues.values().stream().mapToInt(Deque::size).sum();
    }
}
