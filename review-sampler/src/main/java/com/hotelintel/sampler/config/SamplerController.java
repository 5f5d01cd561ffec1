package com.hotelintel.sampler.config;

import com.hotelintel.sampler.driver.ManualInterventionGate;
import com.hotelintel.sampler.exception.SamplerBusyException;
import com.hotelintel.sampler.model.SamplingPlan;
import com.hotelintel.sampler.model.TaskKind;
import com.hotelintel.sampler.scheduler.TaskStats;
import com.hotelintel.sampler.service.AcquisitionService;
import com.hotelintel.sampler.service.DrainSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class SamplerController {

    private final AcquisitionService acquisitionService;
    private final SamplingPlanLoader planLoader;
    private final ManualInterventionGate gate;

    // ── Plan runs ─────────────────────────────────────────────────────────────

    @PostMapping("/sample/run")
    public ResponseEntity<Map<String, String>> run() {
        if (acquisitionService.isBusy()) {
            return busy();
        }
        new Thread(() -> {
            try {
                acquisitionService.planAndRun();
            } catch (SamplerBusyException e) {
                log.warn("Plan run not started: {}", e.getMessage());
            } catch (Exception e) {
                log.error("Plan run failed: {}", e.getMessage(), e);
            }
        }, "manual-plan-run").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "target", "plan"));
    }

    @PostMapping("/sample/cancel")
    public ResponseEntity<Map<String, Object>> cancel() {
        boolean cancelled = acquisitionService.cancel();
        return ResponseEntity.ok(Map.of("cancelled", cancelled));
    }

    @GetMapping("/sample/status")
    public ResponseEntity<Map<String, Object>> status() {
        SamplingPlan plan = planLoader.load();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "hotel-review-sampler");
        body.put("busy", acquisitionService.isBusy());
        body.put("awaitingChallenge", gate.isWaiting());
        body.put("expectedTotal", plan.expectedTotal());
        body.put("expectedByRegion", plan.expectedByRegion());
        return ResponseEntity.ok(body);
    }

    // ── Tasks ─────────────────────────────────────────────────────────────────

    @PostMapping("/tasks/review")
    public ResponseEntity<Map<String, Object>> createReviewTasks() {
        List<String> ids = acquisitionService.createReviewTasksForEligibleItems();
        return ResponseEntity.ok(Map.of("created", ids.size(), "taskIds", ids));
    }

    /**
     * Drain runnable tasks in the background.
     *
     * POST /tasks/run?kind=REVIEW_FETCH&limit=20
     */
    @PostMapping("/tasks/run")
    public ResponseEntity<Map<String, String>> runTasks(
            @RequestParam(required = false) TaskKind kind,
            @RequestParam(defaultValue = "20") int limit) {
        if (limit <= 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "limit must be positive"));
        }
        if (acquisitionService.isBusy()) {
            return busy();
        }
        new Thread(() -> {
            try {
                DrainSummary summary = acquisitionService.runPendingTasks(kind, limit);
                log.info("Manual drain done: {}", summary);
            } catch (SamplerBusyException e) {
                log.warn("Task drain not started: {}", e.getMessage());
            } catch (Exception e) {
                log.error("Task drain failed: {}", e.getMessage(), e);
            }
        }, "manual-task-drain").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted",
                "kind", kind != null ? kind.name() : "ANY", "limit", String.valueOf(limit)));
    }

    @GetMapping("/tasks/stats")
    public ResponseEntity<TaskStats> stats() {
        return ResponseEntity.ok(acquisitionService.stats());
    }

    @PostMapping("/tasks/reset-failed")
    public ResponseEntity<Map<String, Integer>> resetFailed() {
        return ResponseEntity.ok(Map.of("reset", acquisitionService.resetFailed()));
    }

    // ── Challenge ─────────────────────────────────────────────────────────────

    @PostMapping("/challenge/resume")
    public ResponseEntity<Map<String, Object>> resume() {
        boolean resumed = gate.resume();
        return ResponseEntity.ok(Map.of("resumed", resumed));
    }

    private ResponseEntity<Map<String, String>> busy() {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Map.of("error", "a run or task drain is already in progress"));
    }
}
