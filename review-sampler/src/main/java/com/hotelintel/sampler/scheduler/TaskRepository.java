package com.hotelintel.sampler.scheduler;

import com.hotelintel.sampler.model.FetchTask;
import com.hotelintel.sampler.model.TaskKind;
import com.hotelintel.sampler.model.TaskStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable storage for fetch tasks and their transition log.
 */
public interface TaskRepository {

    void ensureSchema();

    void insert(FetchTask task);

    void update(FetchTask task);

    Optional<FetchTask> findById(String taskId);

    /**
     * PENDING tasks whose backoff has elapsed at {@code now}, highest priority first,
     * then oldest first. A null kind means any kind.
     */
    List<FetchTask> findReady(TaskKind kind, LocalDateTime now, int limit);

    List<FetchTask> findByStatus(TaskStatus status);

    boolean hasOpenReviewTask(String itemId);

    Map<TaskKind, Map<TaskStatus, Integer>> countByKindAndStatus();

    void recordEvent(TaskEvent event);

    List<TaskEvent> findEvents(String taskId);
}
