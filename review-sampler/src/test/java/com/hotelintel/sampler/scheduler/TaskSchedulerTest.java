package com.hotelintel.sampler.scheduler;

import com.hotelintel.sampler.config.SamplerProperties;
import com.hotelintel.sampler.model.CandidateItem;
import com.hotelintel.sampler.model.FetchTask;
import com.hotelintel.sampler.model.SamplingPlan;
import com.hotelintel.sampler.model.TaskKind;
import com.hotelintel.sampler.model.TaskStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskSchedulerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T08:00:00Z"), ZoneOffset.UTC);

    private static final SamplingPlan.PriceTier ECONOMY = new SamplingPlan.PriceTier("economy", 0, 300, 4, 3);
    private static final SamplingPlan.PriceTier COMFORT = new SamplingPlan.PriceTier("comfort", 300, 600, 6, 4);
    private static final SamplingPlan.Zone ZONE = new SamplingPlan.Zone("39584", "Zhujiang New Town");
    private static final SamplingPlan.Region CBD =
            new SamplingPlan.Region("CBD", 10, List.of(ZONE), List.of(ECONOMY, COMFORT));
    private static final SamplingPlan.Region CAMPUS =
            new SamplingPlan.Region("University & Tech", 5, List.of(ZONE), List.of(ECONOMY, COMFORT));

    private EmbeddedDatabase db;
    private JdbcTaskRepository repository;
    private TransactionTemplate tx;
    private SamplerProperties properties;
    private TaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        db = new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true)
                .build();
        repository = new JdbcTaskRepository(new JdbcTemplate(db));
        repository.ensureSchema();
        tx = new TransactionTemplate(new DataSourceTransactionManager(db));
        properties = new SamplerProperties();
        properties.getTasks().setRetryBackoff(Duration.ZERO);
        scheduler = new TaskScheduler(repository, tx, properties, CLOCK);
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    @Nested
    @DisplayName("retry state machine")
    class Retries {

        @Test
        @DisplayName("three failed attempts end in FAILED with retryCount 3")
        void failsAfterThreeAttempts() {
            // given
            FetchTask task = scheduler.enqueueListTask(CBD, ZONE, ECONOMY, 4);

            // when / then
            for (int attempt = 1; attempt <= 2; attempt++) {
                scheduler.start(task);
                scheduler.fail(task, "navigation timeout");
                FetchTask stored = scheduler.get(task.getTaskId());
                assertThat(stored.getStatus()).isEqualTo(TaskStatus.PENDING);
                assertThat(stored.getRetryCount()).isEqualTo(attempt);
            }
            scheduler.start(task);
            scheduler.fail(task, "navigation timeout");

            FetchTask stored = scheduler.get(task.getTaskId());
            assertThat(stored.getStatus()).isEqualTo(TaskStatus.FAILED);
            assertThat(stored.getRetryCount()).isEqualTo(3);
            assertThat(stored.getErrorReason()).isEqualTo("navigation timeout");
            assertThat(stored.getCompletedAt()).isNotNull();
        }

        @Test
        void resetFailedReopensWithCleanBudget() {
            // given
            FetchTask task = scheduler.enqueueListTask(CBD, ZONE, ECONOMY, 4);
            for (int i = 0; i < 3; i++) {
                scheduler.start(task);
                scheduler.fail(task, "timeout");
            }

            // when
            int reset = scheduler.resetFailed();

            // then
            FetchTask stored = scheduler.get(task.getTaskId());
            assertThat(reset).isEqualTo(1);
            assertThat(stored.getStatus()).isEqualTo(TaskStatus.PENDING);
            assertThat(stored.getRetryCount()).isZero();
            assertThat(stored.getErrorReason()).isNull();
            assertThat(scheduler.nextBatch(null, 10)).extracting(FetchTask::getTaskId).containsExactly(task.getTaskId());
        }

        @Test
        void everyTransitionIsLoggedWithReason() {
            // given
            FetchTask task = scheduler.enqueueListTask(CBD, ZONE, ECONOMY, 4);

            // when
            scheduler.start(task);
            scheduler.fail(task, "timeout");
            scheduler.start(task);
            scheduler.complete(task, 4);

            // then
            List<TaskEvent> events = scheduler.history(task.getTaskId());
            assertThat(events).extracting(TaskEvent::to).containsExactly(
                    TaskStatus.PENDING, TaskStatus.IN_PROGRESS, TaskStatus.PENDING,
                    TaskStatus.IN_PROGRESS, TaskStatus.COMPLETED);
            assertThat(events.get(2).reason()).isEqualTo("timeout");
            assertThat(scheduler.get(task.getTaskId()).getItemsCrawled()).isEqualTo(4);
        }

        @Test
        void backoffKeepsRetriedTaskOutOfTheBatchUntilDue() {
            // given
            properties.getTasks().setRetryBackoff(Duration.ofSeconds(30));
            FetchTask task = scheduler.enqueueListTask(CBD, ZONE, ECONOMY, 4);
            scheduler.start(task);
            scheduler.fail(task, "timeout");

            // when
            List<FetchTask> now = scheduler.nextBatch(null, 10);
            TaskScheduler later = new TaskScheduler(repository, tx, properties, Clock.offset(CLOCK, Duration.ofSeconds(31)));

            // then
            assertThat(now).isEmpty();
            assertThat(later.nextBatch(null, 10)).hasSize(1);
            assertThat(scheduler.backoff(0)).isEqualTo(Duration.ofSeconds(30));
            assertThat(scheduler.backoff(2)).isEqualTo(Duration.ofSeconds(120));
        }

        @Test
        void completedTaskCannotBeStartedAgain() {
            // given
            FetchTask task = scheduler.enqueueListTask(CBD, ZONE, ECONOMY, 4);
            scheduler.start(task);
            scheduler.skip(task, "no listings after offset 0");

            // when / then
            assertThatThrownBy(() -> scheduler.start(task)).isInstanceOf(IllegalStateException.class);
            assertThat(scheduler.get(task.getTaskId()).getStatus()).isEqualTo(TaskStatus.SKIPPED);
        }

        @Test
        @DisplayName("a task left IN_PROGRESS by a dead process is requeued without spending a retry")
        void recoverInterruptedRequeuesStuckTasks() {
            // given
            FetchTask stuck = scheduler.enqueueListTask(CBD, ZONE, ECONOMY, 4);
            scheduler.start(stuck);
            FetchTask done = scheduler.enqueueListTask(CBD, ZONE, COMFORT, 6);
            scheduler.start(done);
            scheduler.complete(done, 6);

            // when
            int recovered = scheduler.recoverInterrupted();

            // then
            FetchTask stored = scheduler.get(stuck.getTaskId());
            assertThat(recovered).isEqualTo(1);
            assertThat(stored.getStatus()).isEqualTo(TaskStatus.PENDING);
            assertThat(stored.getRetryCount()).isZero();
            assertThat(stored.getStartedAt()).isNull();
            assertThat(scheduler.nextBatch(null, 10)).extracting(FetchTask::getTaskId)
                    .containsExactly(stuck.getTaskId());
            List<TaskEvent> events = scheduler.history(stuck.getTaskId());
            assertThat(events.get(events.size() - 1).reason()).isEqualTo("recovered after restart");
            assertThat(scheduler.stats().count(TaskStatus.IN_PROGRESS)).isZero();
        }

        @Test
        void recoverInterruptedWithNothingStuckIsANoOp() {
            // given
            scheduler.enqueueListTask(CBD, ZONE, ECONOMY, 4);

            // when / then
            assertThat(scheduler.recoverInterrupted()).isZero();
        }
    }

    @Nested
    @DisplayName("queue order")
    class Ordering {

        @Test
        void listPriorityIsRegionWeightPlusTierWeight() {
            // given
            FetchTask low = scheduler.enqueueListTask(CAMPUS, ZONE, ECONOMY, 4);
            FetchTask high = scheduler.enqueueListTask(CBD, ZONE, COMFORT, 6);
            FetchTask mid = scheduler.enqueueListTask(CBD, ZONE, ECONOMY, 4);

            // when
            List<FetchTask> batch = scheduler.nextBatch(TaskKind.LIST_FETCH, 10);

            // then
            assertThat(high.getPriority()).isEqualTo(14);
            assertThat(batch).extracting(FetchTask::getTaskId)
                    .containsExactly(high.getTaskId(), mid.getTaskId(), low.getTaskId());
        }

        @Test
        void equalPriorityKeepsCreationOrder() {
            // given
            FetchTask first = scheduler.enqueueListTask(CBD, ZONE, ECONOMY, 4);
            FetchTask second = scheduler.enqueueListTask(CBD, ZONE, ECONOMY, 4);

            // when / then
            assertThat(scheduler.nextBatch(null, 10)).extracting(FetchTask::getTaskId)
                    .containsExactly(first.getTaskId(), second.getTaskId());
        }

        @Test
        void reviewTasksRankedByVolumeAndRating() {
            // given
            FetchTask small = scheduler.enqueueReviewTask(item("1", 300, null));
            FetchTask huge = scheduler.enqueueReviewTask(item("2", 1500, 4.6));
            FetchTask medium = scheduler.enqueueReviewTask(item("3", 600, 4.0));

            // when
            List<FetchTask> batch = scheduler.nextBatch(TaskKind.REVIEW_FETCH, 2);

            // then
            assertThat(huge.getPriority()).isEqualTo(14);
            assertThat(medium.getPriority()).isEqualTo(12);
            assertThat(small.getPriority()).isEqualTo(5);
            assertThat(batch).extracting(FetchTask::getTaskId).containsExactly(huge.getTaskId(), medium.getTaskId());
            assertThat(huge.getItemsTarget()).isEqualTo(300);
            assertThat(small.getItemsTarget()).isEqualTo(300);
        }

        @Test
        void kindFilterAndOpenReviewLookup() {
            // given
            scheduler.enqueueListTask(CBD, ZONE, ECONOMY, 4);
            FetchTask review = scheduler.enqueueReviewTask(item("42", 800, 4.5));

            // then
            assertThat(scheduler.nextBatch(TaskKind.REVIEW_FETCH, 10)).extracting(FetchTask::getItemId).containsExactly("42");
            assertThat(scheduler.hasOpenReviewTask("42")).isTrue();

            scheduler.start(review);
            scheduler.complete(review, 120);
            assertThat(scheduler.hasOpenReviewTask("42")).isFalse();
        }
    }

    @Test
    void statsCountByStatusAndKind() {
        // given
        FetchTask done = scheduler.enqueueListTask(CBD, ZONE, ECONOMY, 4);
        scheduler.start(done);
        scheduler.complete(done, 4);
        scheduler.enqueueListTask(CBD, ZONE, COMFORT, 6);
        scheduler.enqueueReviewTask(item("7", 900, 4.2));

        // when
        TaskStats stats = scheduler.stats();

        // then
        assertThat(stats.total()).isEqualTo(3);
        assertThat(stats.count(TaskStatus.COMPLETED)).isEqualTo(1);
        assertThat(stats.count(TaskStatus.PENDING)).isEqualTo(2);
        assertThat(stats.count(TaskStatus.FAILED)).isZero();
        assertThat(stats.count(TaskKind.LIST_FETCH)).isEqualTo(2);
        assertThat(stats.count(TaskKind.REVIEW_FETCH)).isEqualTo(1);
    }

    @Test
    void reviewPriorityThresholds() {
        assertThat(TaskScheduler.reviewPriority(1001, null)).isEqualTo(10);
        assertThat(TaskScheduler.reviewPriority(1000, null)).isEqualTo(8);
        assertThat(TaskScheduler.reviewPriority(500, 3.9)).isEqualTo(8);
        assertThat(TaskScheduler.reviewPriority(200, 4.9)).isEqualTo(4);
        assertThat(TaskScheduler.reviewPriority(null, null)).isZero();
    }

    private static CandidateItem item(String id, int reviewCount, Double rating) {
        return CandidateItem.builder().itemId(id).name("Hotel " + id).reviewCount(reviewCount).rating(rating).build();
    }
}
