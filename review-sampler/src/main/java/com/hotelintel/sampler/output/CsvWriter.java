package com.hotelintel.sampler.output;

import com.hotelintel.sampler.config.SamplerProperties;
import com.hotelintel.sampler.model.CandidateItem;
import com.hotelintel.sampler.model.ReviewRecord;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.OpenOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.function.Function;

/**
 * Writes sampled items and reviews to CSV files.
 *
 * Output path patterns:
 *   {outputDir}/items_{runId}.csv
 *   {outputDir}/reviews_{itemId}.csv
 *
 * Items of one run are appended zone by zone; a review file is rewritten per item.
 * Files are UTF-8; list columns are joined with '|'.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvWriter {

    private final SamplerProperties properties;

    static final String[] ITEM_HEADERS = {
            "item_id", "name", "address", "city_code",
            "latitude", "longitude", "star_level",
            "rating", "review_count", "base_price",
            "region", "zone_code", "zone_name",
            "fetched_tier", "classified_tier", "scraped_at"
    };

    static final String[] REVIEW_HEADERS = {
            "review_id", "item_id", "author", "content", "summary",
            "score_clean", "score_location", "score_service", "score_value", "overall_score",
            "tags", "image_urls", "has_images", "room_type", "review_date",
            "reply_content", "reply_date", "source_pool", "scraped_at"
    };

    public Path writeItems(List<CandidateItem> items, String runId) {
        return write(items, "items_" + runId + ".csv", ITEM_HEADERS, this::toRow, true);
    }

    public Path writeReviews(List<ReviewRecord> reviews, String itemId) {
        return write(reviews, "reviews_" + itemId + ".csv", REVIEW_HEADERS, this::toRow, false);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private <T> Path write(List<T> records, String filename, String[] headers, Function<T, String[]> toRow,
                           boolean append) {
        if (records.isEmpty()) return null;

        Path outputDir = Paths.get(properties.getOutput().getCsv().getOutputDir());
        ensureDirectory(outputDir);
        Path outputPath = outputDir.resolve(filename);
        boolean continuing = append && Files.exists(outputPath);
        OpenOption[] options = continuing
                ? new OpenOption[]{StandardOpenOption.APPEND}
                : new OpenOption[]{StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING};

        try (Writer out = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8, options);
             CSVWriter writer = new CSVWriter(out,
                     CSVWriter.DEFAULT_SEPARATOR,
                     CSVWriter.DEFAULT_QUOTE_CHARACTER,
                     CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                     CSVWriter.DEFAULT_LINE_END)) {

            if (!continuing && properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(headers);
            }
            for (T record : records) {
                writer.writeNext(toRow.apply(record));
            }
            log.info("Written {} records to CSV: {}", records.size(), outputPath);
            return outputPath;

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new RuntimeException("CSV write failed", e);
        }
    }

    private String[] toRow(CandidateItem i) {
        return new String[]{
                str(i.getItemId()), str(i.getName()), str(i.getAddress()), str(i.getCityCode()),
                str(i.getLatitude()), str(i.getLongitude()), str(i.getStarLevel()),
                str(i.getRating()), str(i.getReviewCount()), str(i.getBasePrice()),
                str(i.getRegion()), str(i.getZoneCode()), str(i.getZoneName()),
                str(i.getFetchedTier()), str(i.getClassifiedTier()), str(i.getScrapedAt())
        };
    }

    private String[] toRow(ReviewRecord r) {
        return new String[]{
                str(r.getReviewId()), str(r.getItemId()), str(r.getAuthor()), str(r.getContent()), str(r.getSummary()),
                str(r.getScoreClean()), str(r.getScoreLocation()), str(r.getScoreService()), str(r.getScoreValue()),
                str(r.getOverallScore()),
                join(r.getTags()), join(r.getImageUrls()), String.valueOf(r.isHasImages()),
                str(r.getRoomType()), str(r.getReviewDate()),
                str(r.getReplyContent()), str(r.getReplyDate()),
                r.getSourcePool() != null ? r.getSourcePool().code() : "", str(r.getScrapedAt())
        };
    }

    private String join(List<String> values) {
        return values == null ? "" : String.join("|", values);
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new RuntimeException("Cannot create output directory: " + dir, e);
        }
    }
}
