package com.hotelintel.sampler.scheduler;

import com.hotelintel.sampler.model.TaskStatus;

import java.time.LocalDateTime;

/** One status transition of a fetch task, as written to task_events. */
public record TaskEvent(String taskId, TaskStatus from, TaskStatus to, String reason, LocalDateTime at) {
}
