package com.hotelintel.sampler.scheduler;

import com.hotelintel.sampler.config.SamplerProperties;
import com.hotelintel.sampler.exception.SamplerBusyException;
import com.hotelintel.sampler.model.TaskKind;
import com.hotelintel.sampler.output.SampleStore;
import com.hotelintel.sampler.service.AcquisitionService;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup work.
 *
 * Default schedule: 03:00 every day, a drain of pending review tasks.
 * Review fetching is slow and rate limited, so each drain takes a bounded batch
 * (sampler.scheduling.review-batch-size) rather than the whole queue.
 *
 * Override with SAMPLER_SCHEDULING_CRON or sampler.scheduling.cron.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SamplingScheduler {

    private final AcquisitionService acquisitionService;
    private final TaskRepository taskRepository;
    private final TaskScheduler taskScheduler;
    private final SampleStore sampleStore;
    private final SamplerProperties properties;

    /**
     * On application startup:
     *  1. Always ensure the task and sample schemas exist, and requeue tasks a previous
     *     process left IN_PROGRESS
     *  2. Optionally run the full plan if sampler.scheduling.run-on-startup=true
     */
    @PostConstruct
    public void onStartup() {
        try {
            taskRepository.ensureSchema();
            sampleStore.ensureSchema();
            taskScheduler.recoverInterrupted();
        } catch (Exception e) {
            log.warn("Could not initialise database schema (running in CSV-only mode?): {}", e.getMessage());
        }

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("run-on-startup=true, starting a plan run in the background");
            new Thread(this::runPlan, "startup-plan-run").start();
        } else {
            log.info("Sampler ready. Next scheduled review drain: {}", properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${sampler.scheduling.cron:0 0 3 * * ?}")
    public void scheduledReviewDrain() {
        log.info("Scheduled review drain triggered");
        try {
            acquisitionService.createReviewTasksForEligibleItems();
            acquisitionService.runPendingTasks(TaskKind.REVIEW_FETCH, properties.getScheduling().getReviewBatchSize());
        } catch (SamplerBusyException e) {
            log.info("Skipping scheduled drain: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled review drain failed: {}", e.getMessage(), e);
        }
    }

    private void runPlan() {
        try {
            acquisitionService.planAndRun();
        } catch (Exception e) {
            log.error("Startup plan run failed: {}", e.getMessage(), e);
        }
    }
}
