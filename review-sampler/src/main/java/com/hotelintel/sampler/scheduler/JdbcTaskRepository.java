package com.hotelintel.sampler.scheduler;

import com.hotelintel.sampler.model.FetchTask;
import com.hotelintel.sampler.model.TaskKind;
import com.hotelintel.sampler.model.TaskStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
@Slf4j
@RequiredArgsConstructor
public class JdbcTaskRepository implements TaskRepository {

    private static final int MAX_REASON_LENGTH = 1000;

    private static final String COLUMNS = """
            task_id, kind, region, zone_code, tier_level, item_id, priority, status,
            retry_count, error_reason, created_at, started_at, completed_at,
            next_attempt_after, items_crawled, items_target
            """;

    private final JdbcTemplate jdbcTemplate;

    @Override
    public void ensureSchema() {
        log.info("Ensuring task schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS fetch_tasks
            (
                task_id             VARCHAR(64)   PRIMARY KEY,
                seq                 BIGINT        GENERATED BY DEFAULT AS IDENTITY,
                kind                VARCHAR(20)   NOT NULL,
                region              VARCHAR(100),
                zone_code           VARCHAR(50),
                tier_level          VARCHAR(20),
                item_id             VARCHAR(64),
                priority            INT           NOT NULL DEFAULT 0,
                status              VARCHAR(20)   NOT NULL,
                retry_count         INT           NOT NULL DEFAULT 0,
                error_reason        VARCHAR(1000),
                created_at          TIMESTAMP     NOT NULL,
                started_at          TIMESTAMP,
                completed_at        TIMESTAMP,
                next_attempt_after  TIMESTAMP,
                items_crawled       INT           NOT NULL DEFAULT 0,
                items_target        INT
            )
        """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_fetch_tasks_status ON fetch_tasks (status, priority)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_fetch_tasks_item ON fetch_tasks (item_id)");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS task_events
            (
                event_id            BIGINT        GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                task_id             VARCHAR(64)   NOT NULL,
                from_status         VARCHAR(20),
                to_status           VARCHAR(20)   NOT NULL,
                reason              VARCHAR(1000),
                event_at            TIMESTAMP     NOT NULL
            )
        """);
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_task_events_task ON task_events (task_id)");

        log.info("Task schema ready.");
    }

    @Override
    public void insert(FetchTask t) {
        jdbcTemplate.update("INSERT INTO fetch_tasks (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
                t.getTaskId(), t.getKind().name(), t.getRegion(), t.getZoneCode(), t.getTierLevel(),
                t.getItemId(), t.getPriority(), t.getStatus().name(), t.getRetryCount(),
                truncate(t.getErrorReason()), ts(t.getCreatedAt()), ts(t.getStartedAt()),
                ts(t.getCompletedAt()), ts(t.getNextAttemptAfter()), t.getItemsCrawled(), t.getItemsTarget());
    }

    @Override
    public void update(FetchTask t) {
        int rows = jdbcTemplate.update("""
                UPDATE fetch_tasks
                   SET status = ?, retry_count = ?, error_reason = ?, started_at = ?, completed_at = ?,
                       next_attempt_after = ?, items_crawled = ?, items_target = ?, priority = ?
                 WHERE task_id = ?
                """,
                t.getStatus().name(), t.getRetryCount(), truncate(t.getErrorReason()), ts(t.getStartedAt()),
                ts(t.getCompletedAt()), ts(t.getNextAttemptAfter()), t.getItemsCrawled(), t.getItemsTarget(),
                t.getPriority(), t.getTaskId());
        if (rows == 0) {
            throw new IllegalStateException("No task with id " + t.getTaskId());
        }
    }

    @Override
    public Optional<FetchTask> findById(String taskId) {
        List<FetchTask> found = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM fetch_tasks WHERE task_id = ?", TASK_ROW, taskId);
        return found.stream().findFirst();
    }

    @Override
    public List<FetchTask> findReady(TaskKind kind, LocalDateTime now, int limit) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + """
                 FROM fetch_tasks
                WHERE status = 'PENDING'
                  AND (next_attempt_after IS NULL OR next_attempt_after <= ?)
                """);
        List<Object> args = new ArrayList<>();
        args.add(ts(now));
        if (kind != null) {
            sql.append(" AND kind = ?");
            args.add(kind.name());
        }
        sql.append(" ORDER BY priority DESC, created_at ASC, seq ASC LIMIT ?");
        args.add(limit);
        return jdbcTemplate.query(sql.toString(), TASK_ROW, args.toArray());
    }

    @Override
    public List<FetchTask> findByStatus(TaskStatus status) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM fetch_tasks WHERE status = ? ORDER BY seq",
                TASK_ROW, status.name());
    }

    @Override
    public boolean hasOpenReviewTask(String itemId) {
        Integer open = jdbcTemplate.queryForObject("""
                SELECT COUNT(*) FROM fetch_tasks
                 WHERE kind = 'REVIEW_FETCH' AND item_id = ? AND status IN ('PENDING', 'IN_PROGRESS')
                """, Integer.class, itemId);
        return open != null && open > 0;
    }

    @Override
    public Map<TaskKind, Map<TaskStatus, Integer>> countByKindAndStatus() {
        Map<TaskKind, Map<TaskStatus, Integer>> counts = new EnumMap<>(TaskKind.class);
        jdbcTemplate.query("SELECT kind, status, COUNT(*) AS n FROM fetch_tasks GROUP BY kind, status", rs -> {
            counts.computeIfAbsent(TaskKind.valueOf(rs.getString("kind")), k -> new EnumMap<>(TaskStatus.class))
                    .put(TaskStatus.valueOf(rs.getString("status")), rs.getInt("n"));
        });
        return counts;
    }

    @Override
    public void recordEvent(TaskEvent e) {
        jdbcTemplate.update(
                "INSERT INTO task_events (task_id, from_status, to_status, reason, event_at) VALUES (?,?,?,?,?)",
                e.taskId(), e.from() != null ? e.from().name() : null, e.to().name(), truncate(e.reason()), ts(e.at()));
    }

    @Override
    public List<TaskEvent> findEvents(String taskId) {
        return jdbcTemplate.query(
                "SELECT task_id, from_status, to_status, reason, event_at FROM task_events WHERE task_id = ? ORDER BY event_id",
                (rs, i) -> new TaskEvent(
                        rs.getString("task_id"),
                        rs.getString("from_status") != null ? TaskStatus.valueOf(rs.getString("from_status")) : null,
                        TaskStatus.valueOf(rs.getString("to_status")),
                        rs.getString("reason"),
                        toLocal(rs.getTimestamp("event_at"))),
                taskId);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static final RowMapper<FetchTask> TASK_ROW = JdbcTaskRepository::mapTask;

    private static FetchTask mapTask(ResultSet rs, int rowNum) throws SQLException {
        int target = rs.getInt("items_target");
        Integer itemsTarget = rs.wasNull() ? null : target;
        return FetchTask.builder()
                .taskId(rs.getString("task_id"))
                .kind(TaskKind.valueOf(rs.getString("kind")))
                .region(rs.getString("region"))
                .zoneCode(rs.getString("zone_code"))
                .tierLevel(rs.getString("tier_level"))
                .itemId(rs.getString("item_id"))
                .priority(rs.getInt("priority"))
                .status(TaskStatus.valueOf(rs.getString("status")))
                .retryCount(rs.getInt("retry_count"))
                .errorReason(rs.getString("error_reason"))
                .createdAt(toLocal(rs.getTimestamp("created_at")))
                .startedAt(toLocal(rs.getTimestamp("started_at")))
                .completedAt(toLocal(rs.getTimestamp("completed_at")))
                .nextAttemptAfter(toLocal(rs.getTimestamp("next_attempt_after")))
                .itemsCrawled(rs.getInt("items_crawled"))
                .itemsTarget(itemsTarget)
                .build();
    }

    private static Timestamp ts(LocalDateTime t) {
        return t == null ? null : Timestamp.valueOf(t);
    }

    private static LocalDateTime toLocal(Timestamp t) {
        return t == null ? null : t.toLocalDateTime();
    }

    private static String truncate(String s) {
        return s == null || s.length() <= MAX_REASON_LENGTH ? s : s.substring(0, MAX_REASON_LENGTH);
    }
}
