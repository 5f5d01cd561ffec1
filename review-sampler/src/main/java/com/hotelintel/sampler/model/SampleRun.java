package com.hotelintel.sampler.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Tracks each plan run for observability.
 * Stored in the sample_runs table.
 */
@Data
@Builder
public class SampleRun {

    private String runId;           // UUID
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | SUCCESS | CANCELLED | FAILED
    private int itemsTargeted;
    private int itemsAccepted;
    private int zonesShort;
    private String errorMessage;    // null on success
}
