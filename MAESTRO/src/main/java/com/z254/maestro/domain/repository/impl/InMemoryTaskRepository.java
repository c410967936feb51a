package com.z254.maestro.domain.repository.impl;

import com.z254.maestro.config.MaestroProperties;
import com.z254.maestro.domain.model.Task;
import com.z254.maestro.domain.repository.TaskRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of TaskRepository.
 * The archive holds at most historyLimit records; past that it is cut back to the newest historyTrimTo.
 */
@Slf4j
@Repository
public class InMemoryTaskRepository implements TaskRepository {

    private final Map<String, Task> live = new ConcurrentHashMap<>();
    private final LinkedHashMap<String, Task> history = new LinkedHashMap<>();
    private final Map<String, Set<String>> ownerIndex = new ConcurrentHashMap<>();
    private final int historyLimit;
    private final int historyTrimTo;

    public InMemoryTaskRepository(MaestroProperties properties) {
        this.historyLimit = properties.getTasks().getHistoryLimit();
        this.historyTrimTo = Math.min(properties.getTasks().getHistoryTrimTo(), historyLimit);
    }

    @Override
    public Task save(Task task) {
        live.put(task.getId(), task);
        if (task.getOwnerId() != null) {
            ownerIndex.computeIfAbsent(task.getOwnerId(), k -> ConcurrentHashMap.newKeySet()).add(task.getId());
        }
        return task;
    }

    @Override
    public boolean exists(String taskId) {
        if (live.containsKey(taskId)) {
            return true;
        }
        synchronized (history) {
            return history.containsKey(taskId);
        }
    }

    @Override
    public Optional<Task> findById(String taskId) {
        return Optional.ofNullable(live.get(taskId));
    }

    @Override
    public Optional<Task> findArchived(String taskId) {
        synchronized (history) {
            return Optional.ofNullable(history.get(taskId));
        }
    }

    @Override
    public boolean archive(String taskId) {
        Task task = live.remove(taskId);
        if (task == null) {
            return false;
        }
        synchronized (history) {
            history.put(taskId, task);
            if (history.size() > historyLimit) {
                trimHistory();
            }
        }
        return true;
    }

    @Override
    public List<Task> findByOwner(String ownerId) {
        Set<String> ids = ownerIndex.get(ownerId);
        if (ids == null) {
            return List.of();
        }
        List<Task> tasks = new ArrayList<>();
        for (String id : new ArrayList<>(ids)) {
            findById(id).or(() -> findArchived(id)).ifPresent(tasks::add);
        }
        return tasks;
    }

    @Override
    public List<Task> findAllLive() {
        return new ArrayList<>(live.values());
    }

    @Override
    public List<Task> findHistory() {
        synchronized (history) {
            return new ArrayList<>(history.values());
        }
    }

    @Override
    public int countLive() {
        return live.size();
    }

    private void trimHistory() {
        int toRemove = history.size() - historyTrimTo;
        Iterator<Map.Entry<String, Task>> it = history.entrySet().iterator();
        while (toRemove-- > 0 && it.hasNext()) {
            Task evicted = it.next().getValue();
            it.remove();
            Set<String> ids = evicted.getOwnerId() != null ? ownerIndex.get(evicted.getOwnerId()) : null;
            if (ids != null) {
                ids.remove(evicted.getId());
            }
        }
        log.debug("Trimmed task history to {} entries", history.size());
    }
}
