package com.z254.maestro.domain.repository;

import com.z254.maestro.domain.model.Task;

import java.util.List;
import java.util.Optional;

/**
 * Storage for task records: a live set plus a bounded archive, both indexed by owner.
 * Only the task ledger writes through this interface.
 */
public interface TaskRepository {

    /**
     * Insert or replace a live record.
     */
    Task save(Task task);

    boolean exists(String taskId);

    /**
     * Live record, not archived.
     */
    Optional<Task> findById(String taskId);

    Optional<Task> findArchived(String taskId);

    /**
     * Move a live record to the archive.
     *
     * @return false when the task is not live
     */
    boolean archive(String taskId);

    /**
     * Live and archived records of an owner.
     */
    List<Task> findByOwner(String ownerId);

    List<Task> findAllLive();

    /**
     * Archived records, oldest first.
     */
    List<Task> findHistory();

    int countLive();
}
