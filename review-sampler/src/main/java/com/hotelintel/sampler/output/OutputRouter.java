package com.hotelintel.sampler.output;

import com.hotelintel.sampler.config.SamplerProperties;
import com.hotelintel.sampler.model.CandidateItem;
import com.hotelintel.sampler.model.ReviewRecord;
import com.hotelintel.sampler.model.SampleRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Routes output to the appropriate sink(s) based on configuration.
 * Supports DATABASE, CSV, or BOTH modes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter {

    private final SampleStore sampleStore;
    private final CsvWriter csvWriter;
    private final SamplerProperties properties;

    /** Items accepted for one zone; all rows commit or none do. */
    public void writeItems(List<CandidateItem> items, String runId) {
        if (items.isEmpty()) return;
        switch (mode()) {
            case DATABASE -> upsertItems(items);
            case CSV -> csvWriter.writeItems(items, runId);
            case BOTH -> {
                upsertItems(items);
                csvWriter.writeItems(items, runId);
            }
        }
    }

    public void writeReviews(List<ReviewRecord> reviews, String itemId) {
        if (reviews.isEmpty()) return;
        switch (mode()) {
            case DATABASE -> upsertReviews(reviews);
            case CSV -> csvWriter.writeReviews(reviews, itemId);
            case BOTH -> {
                upsertReviews(reviews);
                csvWriter.writeReviews(reviews, itemId);
            }
        }
    }

    public void writeSampleRun(SampleRun run) {
        try {
            if (mode() != SamplerProperties.Output.OutputMode.CSV) {
                sampleStore.writeSampleRun(run);
            }
        } catch (Exception e) {
            log.warn("Failed to write sample run metadata: {}", e.getMessage());
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void upsertItems(List<CandidateItem> items) {
        sampleStore.upsertItems(items);
        log.info("Upserted {} items", items.size());
    }

    private void upsertReviews(List<ReviewRecord> reviews) {
        sampleStore.upsertReviews(reviews);
        log.info("Upserted {} reviews for item {}", reviews.size(), reviews.get(0).getItemId());
    }

    private SamplerProperties.Output.OutputMode mode() {
        return properties.getOutput().getMode();
    }
}
