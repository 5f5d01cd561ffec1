package com.hotelintel.sampler.scheduler;

import com.hotelintel.sampler.model.TaskKind;
import com.hotelintel.sampler.model.TaskStatus;

import java.util.EnumMap;
import java.util.Map;

/**
 * Task counts by status and by kind. Every enum constant is present, zero when empty.
 */
public record TaskStats(Map<TaskStatus, Integer> byStatus, Map<TaskKind, Integer> byKind, int total) {

    public static TaskStats from(Map<TaskKind, Map<TaskStatus, Integer>> counts) {
        Map<TaskStatus, Integer> byStatus = new EnumMap<>(TaskStatus.class);
        Map<TaskKind, Integer> byKind = new EnumMap<>(TaskKind.class);
        for (TaskStatus status : TaskStatus.values()) byStatus.put(status, 0);
        for (TaskKind kind : TaskKind.values()) byKind.put(kind, 0);

        int total = 0;
        for (Map.Entry<TaskKind, Map<TaskStatus, Integer>> kindEntry : counts.entrySet()) {
            for (Map.Entry<TaskStatus, Integer> statusEntry : kindEntry.getValue().entrySet()) {
                int n = statusEntry.getValue();
                byStatus.merge(statusEntry.getKey(), n, Integer::sum);
                byKind.merge(kindEntry.getKey(), n, Integer::sum);
                total += n;
            }
        }
        return new TaskStats(byStatus, byKind, total);
    }

    public int count(TaskStatus status) {
        return byStatus.getOrDefault(status, 0);
    }

    public int count(TaskKind kind) {
        return byKind.getOrDefault(kind, 0);
    }
}
