package com.hotelintel.sampler.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hotelintel.sampler.model.CandidateItem;
import com.hotelintel.sampler.model.ReviewPool;
import com.hotelintel.sampler.model.ReviewRecord;
import com.hotelintel.sampler.model.SampleRun;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * JdbcTemplate-backed store, portable between PostgreSQL and H2.
 *
 * Upsert is UPDATE ... SET col = COALESCE(?, col) followed by INSERT when no row
 * matched, so a null never erases a stored value.
 *
 * Retries wrap whole batches: a transient failure rolls the batch back and the retry
 * replays it in a fresh transaction. Single-row upserts join the caller's transaction.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JdbcSampleStore implements SampleStore {

    private static final int MAX_TEXT = 4000;
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public void ensureSchema() {
        log.info("Ensuring sample schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS items
            (
                item_id             VARCHAR(64)   PRIMARY KEY,
                name                VARCHAR(200)  NOT NULL,
                address             VARCHAR(500),
                city_code           VARCHAR(20),
                latitude            DOUBLE PRECISION,
                longitude           DOUBLE PRECISION,
                star_level          VARCHAR(50),
                rating              DOUBLE PRECISION,
                review_count        INT,
                base_price          INT,
                region              VARCHAR(100),
                zone_code           VARCHAR(50),
                zone_name           VARCHAR(100),
                fetched_tier        VARCHAR(20),
                classified_tier     VARCHAR(20),
                scraped_at          TIMESTAMP,
                updated_at          TIMESTAMP
            )
        """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_items_review_count ON items (review_count)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS reviews
            (
                review_id           VARCHAR(100)  PRIMARY KEY,
                item_id             VARCHAR(64)   NOT NULL,
                author              VARCHAR(100),
                content             VARCHAR(4000) NOT NULL,
                summary             VARCHAR(500),
                score_clean         DOUBLE PRECISION,
                score_location      DOUBLE PRECISION,
                score_service       DOUBLE PRECISION,
                score_value         DOUBLE PRECISION,
                overall_score       DOUBLE PRECISION,
                tags                VARCHAR(2000),
                image_urls          VARCHAR(4000),
                has_images          BOOLEAN       NOT NULL DEFAULT FALSE,
                room_type           VARCHAR(100),
                review_date         TIMESTAMP,
                reply_content       VARCHAR(4000),
                reply_date          TIMESTAMP,
                source_pool         VARCHAR(20),
                scraped_at          TIMESTAMP
            )
        """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_reviews_item ON reviews (item_id)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS sample_runs
            (
                run_id              VARCHAR(64)   PRIMARY KEY,
                started_at          TIMESTAMP     NOT NULL,
                completed_at        TIMESTAMP,
                status              VARCHAR(20)   NOT NULL,
                items_targeted      INT           NOT NULL DEFAULT 0,
                items_accepted      INT           NOT NULL DEFAULT 0,
                zones_short         INT           NOT NULL DEFAULT 0,
                error_message       VARCHAR(1000)
            )
        """);

        log.info("Sample schema ready.");
    }

    @Override
    @Retry(name = "sampleStore")
    public void upsertItems(List<CandidateItem> items) {
        transactionTemplate.executeWithoutResult(status -> items.forEach(this::upsertItem));
    }

    @Override
    @Retry(name = "sampleStore")
    public void upsertReviews(List<ReviewRecord> reviews) {
        transactionTemplate.executeWithoutResult(status -> reviews.forEach(this::upsertReview));
    }

    @Override
    public void upsertItem(CandidateItem i) {
        transactionTemplate.executeWithoutResult(status -> {
            LocalDateTime now = LocalDateTime.now();
            int rows = jdbcTemplate.update("""
                    UPDATE items
                       SET name = COALESCE(?, name), address = COALESCE(?, address),
                           city_code = COALESCE(?, city_code), latitude = COALESCE(?, latitude),
                           longitude = COALESCE(?, longitude), star_level = COALESCE(?, star_level),
                           rating = COALESCE(?, rating), review_count = COALESCE(?, review_count),
                           base_price = COALESCE(?, base_price), region = COALESCE(?, region),
                           zone_code = COALESCE(?, zone_code), zone_name = COALESCE(?, zone_name),
                           fetched_tier = COALESCE(?, fetched_tier), classified_tier = COALESCE(?, classified_tier),
                           scraped_at = COALESCE(?, scraped_at), updated_at = ?
                     WHERE item_id = ?
                    """,
                    i.getName(), i.getAddress(), i.getCityCode(), i.getLatitude(), i.getLongitude(),
                    i.getStarLevel(), i.getRating(), i.getReviewCount(), i.getBasePrice(), i.getRegion(),
                    i.getZoneCode(), i.getZoneName(), i.getFetchedTier(), i.getClassifiedTier(),
                    ts(i.getScrapedAt()), ts(now), i.getItemId());
            if (rows == 0) {
                jdbcTemplate.update("""
                        INSERT INTO items
                        (item_id, name, address, city_code, latitude, longitude, star_level, rating,
                         review_count, base_price, region, zone_code, zone_name, fetched_tier,
                         classified_tier, scraped_at, updated_at)
                        VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)
                        """,
                        i.getItemId(), i.getName(), i.getAddress(), i.getCityCode(), i.getLatitude(),
                        i.getLongitude(), i.getStarLevel(), i.getRating(), i.getReviewCount(), i.getBasePrice(),
                        i.getRegion(), i.getZoneCode(), i.getZoneName(), i.getFetchedTier(),
                        i.getClassifiedTier(), ts(i.getScrapedAt()), ts(now));
            }
        });
    }

    @Override
    public void upsertReview(ReviewRecord r) {
        String tags = r.getTags() == null || r.getTags().isEmpty() ? null : toJson(r.getTags());
        String images = r.getImageUrls() == null || r.getImageUrls().isEmpty() ? null : toJson(r.getImageUrls());
        String pool = r.getSourcePool() != null ? r.getSourcePool().name() : null;

        transactionTemplate.executeWithoutResult(status -> {
            int rows = jdbcTemplate.update("""
                    UPDATE reviews
                       SET item_id = COALESCE(?, item_id), author = COALESCE(?, author),
                           content = COALESCE(?, content), summary = COALESCE(?, summary),
                           score_clean = COALESCE(?, score_clean), score_location = COALESCE(?, score_location),
                           score_service = COALESCE(?, score_service), score_value = COALESCE(?, score_value),
                           overall_score = COALESCE(?, overall_score), tags = COALESCE(?, tags),
                           image_urls = COALESCE(?, image_urls), has_images = (has_images OR ?),
                           room_type = COALESCE(?, room_type), review_date = COALESCE(?, review_date),
                           reply_content = COALESCE(?, reply_content), reply_date = COALESCE(?, reply_date),
                           source_pool = COALESCE(?, source_pool), scraped_at = COALESCE(?, scraped_at)
                     WHERE review_id = ?
                    """,
                    r.getItemId(), r.getAuthor(), clip(r.getContent()), r.getSummary(), r.getScoreClean(),
                    r.getScoreLocation(), r.getScoreService(), r.getScoreValue(), r.getOverallScore(),
                    tags, images, r.isHasImages(), r.getRoomType(), ts(r.getReviewDate()),
                    clip(r.getReplyContent()), ts(r.getReplyDate()), pool, ts(r.getScrapedAt()), r.getReviewId());
            if (rows == 0) {
                jdbcTemplate.update("""
                        INSERT INTO reviews
                        (review_id, item_id, author, content, summary, score_clean, score_location,
                         score_service, score_value, overall_score, tags, image_urls, has_images,
                         room_type, review_date, reply_content, reply_date, source_pool, scraped_at)
                        VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)
                        """,
                        r.getReviewId(), r.getItemId(), r.getAuthor(), clip(r.getContent()), r.getSummary(),
                        r.getScoreClean(), r.getScoreLocation(), r.getScoreService(), r.getScoreValue(),
                        r.getOverallScore(), tags, images, r.isHasImages(), r.getRoomType(),
                        ts(r.getReviewDate()), clip(r.getReplyContent()), ts(r.getReplyDate()), pool,
                        ts(r.getScrapedAt()));
            }
        });
    }

    @Override
    public List<CandidateItem> findItemsWithMinReviews(int minReviewCount) {
        return jdbcTemplate.query(
                "SELECT * FROM items WHERE review_count >= ? ORDER BY review_count DESC, item_id",
                (rs, n) -> mapItem(rs), minReviewCount);
    }

    @Override
    public Optional<CandidateItem> findItem(String itemId) {
        return jdbcTemplate.query("SELECT * FROM items WHERE item_id = ?", (rs, n) -> mapItem(rs), itemId)
                .stream().findFirst();
    }

    @Override
    public List<ReviewRecord> findReviews(String itemId) {
        return jdbcTemplate.query("SELECT * FROM reviews WHERE item_id = ? ORDER BY review_id",
                (rs, n) -> mapReview(rs), itemId);
    }

    @Override
    @Retry(name = "sampleStore")
    public <T> T withTransaction(Supplier<T> work) {
        return transactionTemplate.execute(status -> work.get());
    }

    @Override
    public void writeSampleRun(SampleRun run) {
        int rows = jdbcTemplate.update("""
                UPDATE sample_runs
                   SET completed_at = ?, status = ?, items_targeted = ?, items_accepted = ?,
                       zones_short = ?, error_message = ?
                 WHERE run_id = ?
                """,
                ts(run.getCompletedAt()), run.getStatus(), run.getItemsTargeted(), run.getItemsAccepted(),
                run.getZonesShort(), run.getErrorMessage(), run.getRunId());
        if (rows == 0) {
            jdbcTemplate.update("""
                    INSERT INTO sample_runs
                    (run_id, started_at, completed_at, status, items_targeted, items_accepted,
                     zones_short, error_message)
                    VALUES (?,?,?,?,?,?,?,?)
                    """,
                    run.getRunId(), ts(run.getStartedAt()), ts(run.getCompletedAt()), run.getStatus(),
                    run.getItemsTargeted(), run.getItemsAccepted(), run.getZonesShort(), run.getErrorMessage());
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private CandidateItem mapItem(ResultSet rs) throws SQLException {
        return CandidateItem.builder()
                .itemId(rs.getString("item_id"))
                .name(rs.getString("name"))
                .address(rs.getString("address"))
                .cityCode(rs.getString("city_code"))
                .latitude(rs.getObject("latitude", Double.class))
                .longitude(rs.getObject("longitude", Double.class))
                .starLevel(rs.getString("star_level"))
                .rating(rs.getObject("rating", Double.class))
                .reviewCount(rs.getObject("review_count", Integer.class))
                .basePrice(rs.getObject("base_price", Integer.class))
                .region(rs.getString("region"))
                .zoneCode(rs.getString("zone_code"))
                .zoneName(rs.getString("zone_name"))
                .fetchedTier(rs.getString("fetched_tier"))
                .classifiedTier(rs.getString("classified_tier"))
                .scrapedAt(toLocal(rs.getTimestamp("scraped_at")))
                .build();
    }

    private ReviewRecord mapReview(ResultSet rs) throws SQLException {
        String pool = rs.getString("source_pool");
        return ReviewRecord.builder()
                .reviewId(rs.getString("review_id"))
                .itemId(rs.getString("item_id"))
                .author(rs.getString("author"))
                .content(rs.getString("content"))
                .summary(rs.getString("summary"))
                .scoreClean(rs.getObject("score_clean", Double.class))
                .scoreLocation(rs.getObject("score_location", Double.class))
                .scoreService(rs.getObject("score_service", Double.class))
                .scoreValue(rs.getObject("score_value", Double.class))
                .overallScore(rs.getObject("overall_score", Double.class))
                .tags(fromJson(rs.getString("tags")))
                .imageUrls(fromJson(rs.getString("image_urls")))
                .hasImages(rs.getBoolean("has_images"))
                .roomType(rs.getString("room_type"))
                .reviewDate(toLocal(rs.getTimestamp("review_date")))
                .replyContent(rs.getString("reply_content"))
                .replyDate(toLocal(rs.getTimestamp("reply_date")))
                .sourcePool(pool != null ? ReviewPool.valueOf(pool) : null)
                .scrapedAt(toLocal(rs.getTimestamp("scraped_at")))
                .build();
    }

    private String toJson(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise list: " + values, e);
        }
    }

    private List<String> fromJson(String json) {
        if (json == null || json.isBlank()) return new ArrayList<>();
        try {
            return new ArrayList<>(objectMapper.readValue(json, STRING_LIST));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable list column {}: {}", json, e.getMessage());
            return new ArrayList<>();
        }
    }

    private static String clip(String s) {
        return s == null || s.length() <= MAX_TEXT ? s : s.substring(0, MAX_TEXT);
    }

    private static Timestamp ts(LocalDateTime t) {
        return t == null ? null : Timestamp.valueOf(t);
    }

    private static LocalDateTime toLocal(Timestamp t) {
        return t == null ? null : t.toLocalDateTime();
    }
}
