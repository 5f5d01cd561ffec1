package com.hotelintel.sampler.service;

import com.hotelintel.sampler.config.SamplerProperties;
import com.hotelintel.sampler.config.SamplingPlanLoader;
import com.hotelintel.sampler.exception.SamplerBusyException;
import com.hotelintel.sampler.exception.TransientFetchException;
import com.hotelintel.sampler.model.CandidateItem;
import com.hotelintel.sampler.model.FetchTask;
import com.hotelintel.sampler.model.Outcome;
import com.hotelintel.sampler.model.ReviewPool;
import com.hotelintel.sampler.model.ReviewRecord;
import com.hotelintel.sampler.model.SampleRun;
import com.hotelintel.sampler.model.SamplingPlan;
import com.hotelintel.sampler.model.TaskKind;
import com.hotelintel.sampler.model.TaskStatus;
import com.hotelintel.sampler.output.OutputRouter;
import com.hotelintel.sampler.output.SampleStore;
import com.hotelintel.sampler.pacing.PacingPolicy;
import com.hotelintel.sampler.planner.SegmentQuotaPlanner;
import com.hotelintel.sampler.planner.TierRequest;
import com.hotelintel.sampler.planner.ZoneOutcome;
import com.hotelintel.sampler.reviews.AllocationResult;
import com.hotelintel.sampler.scheduler.JdbcTaskRepository;
import com.hotelintel.sampler.scheduler.TaskScheduler;
import com.microsoft.playwright.PlaywrightException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
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
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AcquisitionServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T03:00:00Z"), ZoneOffset.UTC);

    private static final SamplingPlan.PriceTier ECONOMY = new SamplingPlan.PriceTier("economy", 0, 300, 2, 3);
    private static final SamplingPlan.PriceTier COMFORT = new SamplingPlan.PriceTier("comfort", 300, 600, 1, 4);
    private static final SamplingPlan.Zone ZHUJIANG = new SamplingPlan.Zone("39584", "Zhujiang New Town");
    private static final SamplingPlan.Zone TIYU = new SamplingPlan.Zone("6240", "Tianhe Sports Center");
    private static final SamplingPlan.Region CBD =
            new SamplingPlan.Region("CBD", 10, List.of(ZHUJIANG, TIYU), List.of(ECONOMY, COMFORT));
    private static final SamplingPlan PLAN = new SamplingPlan("440100", List.of(CBD));

    @Mock
    private ListingFetcher listingFetcher;
    @Mock
    private ReviewAcquisitionService reviewAcquisition;
    @Mock
    private OutputRouter outputRouter;
    @Mock
    private SampleStore sampleStore;
    @Mock
    private PacingPolicy pacing;
    @Mock
    private SamplingPlanLoader planLoader;

    private EmbeddedDatabase db;
    private TaskScheduler taskScheduler;
    private AcquisitionService service;
    private final AtomicInteger nextId = new AtomicInteger(1);

    @BeforeEach
    void setUp() {
        db = new EmbeddedDatabaseBuilder().setType(EmbeddedDatabaseType.H2).generateUniqueName(true).build();
        JdbcTaskRepository repository = new JdbcTaskRepository(new JdbcTemplate(db));
        repository.ensureSchema();

        SamplerProperties properties = new SamplerProperties();
        properties.getTasks().setRetryBackoff(Duration.ZERO);
        taskScheduler = new TaskScheduler(repository,
                new TransactionTemplate(new DataSourceTransactionManager(db)), properties, CLOCK);

        service = new AcquisitionService(new SegmentQuotaPlanner(), taskScheduler, listingFetcher, reviewAcquisition,
                outputRouter, sampleStore, pacing, planLoader, properties, CLOCK);
        lenient().when(planLoader.load()).thenReturn(PLAN);
    }

    @AfterEach
    void tearDown() {
        db.shutdown();
    }

    @Nested
    @DisplayName("plan runs")
    class PlanRuns {

        @Test
        void fillsEveryZoneAndRecordsTasks() {
            // given
            when(listingFetcher.fetch(eq("440100"), any())).thenAnswer(inv -> freshItems(inv.getArgument(1)));

            // when
            RunSummary summary = service.planAndRun();

            // then
            assertThat(summary.status()).isEqualTo("SUCCESS");
            assertThat(summary.targeted()).isEqualTo(6);
            assertThat(summary.accepted()).isEqualTo(6);
            assertThat(summary.shortfallByZone()).isEmpty();
            assertThat(summary.zones()).extracting(ZoneOutcome::zoneCode).containsExactly("39584", "6240");

            assertThat(service.stats().count(TaskStatus.COMPLETED)).isEqualTo(4);
            assertThat(service.stats().count(TaskKind.LIST_FETCH)).isEqualTo(4);
            verify(outputRouter, times(2)).writeItems(anyList(), eq(summary.runId()));
            assertThat(service.isBusy()).isFalse();
        }

        @Test
        void finalRunRecordCarriesTotals() {
            // given
            when(listingFetcher.fetch(anyString(), any())).thenAnswer(inv -> freshItems(inv.getArgument(1)));

            // when
            RunSummary summary = service.planAndRun();

            // then
            ArgumentCaptor<SampleRun> run = ArgumentCaptor.forClass(SampleRun.class);
            verify(outputRouter, times(2)).writeSampleRun(run.capture());
            SampleRun last = run.getValue();
            assertThat(last.getRunId()).isEqualTo(summary.runId());
            assertThat(last.getStatus()).isEqualTo("SUCCESS");
            assertThat(last.getItemsTargeted()).isEqualTo(6);
            assertThat(last.getItemsAccepted()).isEqualTo(6);
            assertThat(last.getZonesShort()).isZero();
            assertThat(last.getCompletedAt()).isNotNull();
        }

        @Test
        void transientFailureIsRetriedInPlace() {
            // given
            AtomicInteger calls = new AtomicInteger();
            when(listingFetcher.fetch(anyString(), any())).thenAnswer(inv -> {
                if (calls.getAndIncrement() == 0) {
                    throw new TransientFetchException("navigation timeout");
                }
                return freshItems(inv.getArgument(1));
            });

            // when
            RunSummary summary = service.planAndRun();

            // then
            assertThat(summary.accepted()).isEqualTo(6);
            assertThat(calls.get()).isEqualTo(5);
            assertThat(service.stats().count(TaskStatus.COMPLETED)).isEqualTo(4);
            assertThat(service.stats().count(TaskStatus.FAILED)).isZero();
        }

        @Test
        void tierFailingForGoodLeavesZoneShort() {
            // given
            when(listingFetcher.fetch(anyString(), any())).thenThrow(new TransientFetchException("blocked"));

            // when
            RunSummary summary = service.planAndRun();

            // then: economy, comfort, then economy again on the reverse pass; three attempts each
            assertThat(summary.status()).isEqualTo("SUCCESS");
            assertThat(summary.accepted()).isZero();
            assertThat(summary.shortfallByZone()).containsExactly(Map.entry("39584", 3), Map.entry("6240", 3));
            assertThat(service.stats().count(TaskStatus.FAILED)).isEqualTo(6);
            verify(listingFetcher, times(18)).fetch(anyString(), any());
        }

        @Test
        @DisplayName("a browser crash in one zone fails that zone's tasks and the run moves on")
        void unexpectedErrorInOneZoneDoesNotStopRun() {
            // given
            when(listingFetcher.fetch(anyString(), any())).thenAnswer(inv -> {
                TierRequest request = inv.getArgument(1);
                if (request.zone().code().equals("39584")) {
                    throw new PlaywrightException("Target page crashed");
                }
                return freshItems(request);
            });

            // when
            RunSummary summary = service.planAndRun();

            // then
            assertThat(summary.status()).isEqualTo("SUCCESS");
            assertThat(summary.zones()).extracting(ZoneOutcome::zoneCode).containsExactly("39584", "6240");
            assertThat(summary.zones().get(1).accepted()).hasSize(3);
            assertThat(summary.shortfallByZone()).containsExactly(Map.entry("39584", 3));
            assertThat(service.stats().count(TaskStatus.IN_PROGRESS)).isZero();
            assertThat(service.stats().count(TaskStatus.FAILED)).isEqualTo(3);
            assertThat(service.stats().count(TaskStatus.COMPLETED)).isEqualTo(2);
            assertThat(service.isBusy()).isFalse();
        }

        @Test
        void persistenceErrorDoesNotStopRun() {
            // given
            when(listingFetcher.fetch(anyString(), any())).thenAnswer(inv -> freshItems(inv.getArgument(1)));
            doThrow(new IllegalStateException("db down"))
                    .when(outputRouter).writeItems(anyList(), anyString());

            // when
            RunSummary summary = service.planAndRun();

            // then
            ArgumentCaptor<SampleRun> run = ArgumentCaptor.forClass(SampleRun.class);
            verify(outputRouter, times(2)).writeSampleRun(run.capture());
            assertThat(summary.status()).isEqualTo("SUCCESS");
            assertThat(summary.zones()).hasSize(2);
            assertThat(run.getValue().getErrorMessage()).contains("zone 39584: db down", "zone 6240: db down");
        }

        @Test
        void secondCallerIsRejectedWhileRunning() {
            // given
            AtomicReference<Throwable> rejected = new AtomicReference<>();
            when(listingFetcher.fetch(anyString(), any())).thenAnswer(inv -> {
                CompletableFuture.runAsync(() -> service.runPendingTasks(null, 5))
                        .exceptionally(e -> {
                            rejected.set(e.getCause());
                            return null;
                        })
                        .join();
                return freshItems(inv.getArgument(1));
            });

            // when
            service.planAndRun();

            // then
            assertThat(rejected.get()).isInstanceOf(SamplerBusyException.class);
            assertThat(service.isBusy()).isFalse();
        }

        @Test
        void cancelStopsAtNextZone() {
            // given
            assertThat(service.cancel()).isFalse();
            when(listingFetcher.fetch(anyString(), any())).thenAnswer(inv -> {
                service.cancel();
                return freshItems(inv.getArgument(1));
            });

            // when
            RunSummary summary = service.planAndRun();

            // then
            assertThat(summary.status()).isEqualTo("CANCELLED");
            assertThat(summary.zones()).hasSize(1);
            assertThat(summary.accepted()).isEqualTo(3);
        }

        @Test
        void sameItemInTwoZonesCountsOnce() {
            // given: both zones rank the same listings, exactly one tier target deep
            when(listingFetcher.fetch(anyString(), any())).thenAnswer(inv -> {
                TierRequest request = inv.getArgument(1);
                int supply = request.tier().targetCount();
                return IntStream.range(request.offset(), Math.min(request.offset() + request.requested(), supply))
                        .mapToObj(i -> CandidateItem.builder().itemId(request.tier().level() + "-" + i).build())
                        .collect(Collectors.toList());
            });

            // when
            RunSummary summary = service.planAndRun();

            // then
            assertThat(summary.zones().get(0).accepted()).hasSize(3);
            assertThat(summary.zones().get(1).accepted()).isEmpty();
            assertThat(summary.shortfallByZone()).containsEntry("6240", 3);
        }
    }

    @Nested
    @DisplayName("review tasks")
    class ReviewTasks {

        @Test
        void queuesOneTaskPerEligibleItem() {
            // given
            when(sampleStore.findItemsWithMinReviews(50)).thenReturn(List.of(
                    CandidateItem.builder().itemId("A").reviewCount(800).rating(4.5).build(),
                    CandidateItem.builder().itemId("B").reviewCount(120).build()));

            // when
            List<String> first = service.createReviewTasksForEligibleItems();
            List<String> second = service.createReviewTasksForEligibleItems();

            // then
            assertThat(first).hasSize(2);
            assertThat(second).isEmpty();
            assertThat(service.stats().count(TaskKind.REVIEW_FETCH)).isEqualTo(2);
        }

        @Test
        void drainReportsEachOutcome() {
            // given
            taskScheduler.enqueueReviewTask(CandidateItem.builder().itemId("A").reviewCount(800).build());
            taskScheduler.enqueueReviewTask(CandidateItem.builder().itemId("B").reviewCount(90).build());
            taskScheduler.enqueueReviewTask(CandidateItem.builder().itemId("C").reviewCount(400).build());
            when(sampleStore.findItem(anyString())).thenReturn(Optional.empty());
            when(reviewAcquisition.acquire(eq("A"), isNull())).thenReturn(new AllocationResult("A",
                    Outcome.Kind.ACCEPTED, null,
                    List.of(ReviewRecord.builder().reviewId("A_1").itemId("A").content("好").build()),
                    Map.of(ReviewPool.RECENCY, 1)));
            when(reviewAcquisition.acquire(eq("B"), isNull()))
                    .thenReturn(AllocationResult.skipped("B", "90 reviews below threshold 200"));
            when(reviewAcquisition.acquire(eq("C"), isNull())).thenThrow(new TransientFetchException("challenge"));

            // when
            DrainSummary summary = service.runPendingTasks(TaskKind.REVIEW_FETCH, 10);

            // then
            assertThat(summary).isEqualTo(new DrainSummary(3, 1, 1, 1, 0));
            assertThat(service.stats().count(TaskStatus.PENDING)).isEqualTo(1);
            assertThat(service.isBusy()).isFalse();
        }

        @Test
        void unexpectedErrorFailsTaskWithoutAbortingDrain() {
            // given
            FetchTask task = taskScheduler.enqueueReviewTask(
                    CandidateItem.builder().itemId("A").reviewCount(800).build());
            when(sampleStore.findItem("A"))
                    .thenReturn(Optional.of(CandidateItem.builder().itemId("A").reviewCount(800).build()));
            when(reviewAcquisition.acquire("A", 800)).thenThrow(new NullPointerException("missing node"));

            // when
            DrainSummary summary = service.runPendingTasks(null, 10);

            // then
            assertThat(summary.retrying()).isEqualTo(1);
            assertThat(taskScheduler.get(task.getTaskId()).getErrorReason())
                    .isEqualTo("NullPointerException: missing node");
        }

        @Test
        void emptyQueueDrainsNothing() {
            assertThat(service.runPendingTasks(TaskKind.REVIEW_FETCH, 5)).isEqualTo(DrainSummary.empty());
        }
    }

    @Nested
    @DisplayName("queued list tasks")
    class ListTasks {

        @Test
        void reRunsQueuedListTask() {
            // given
            FetchTask task = taskScheduler.enqueueListTask(CBD, TIYU, COMFORT, 2);
            when(listingFetcher.fetch(eq("440100"), any())).thenAnswer(inv -> freshItems(inv.getArgument(1)));

            // when
            DrainSummary summary = service.runPendingTasks(TaskKind.LIST_FETCH, 5);

            // then
            assertThat(summary.completed()).isEqualTo(1);
            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<CandidateItem>> items = ArgumentCaptor.forClass(List.class);
            verify(outputRouter).writeItems(items.capture(), eq("task-" + task.getTaskId()));
            assertThat(items.getValue()).hasSize(2).allSatisfy(item -> {
                assertThat(item.getRegion()).isEqualTo("CBD");
                assertThat(item.getZoneCode()).isEqualTo("6240");
                assertThat(item.getFetchedTier()).isEqualTo("comfort");
            });
        }

        @Test
        void taskOutsideCurrentPlanIsSkipped() {
            // given
            SamplingPlan.Region retired = new SamplingPlan.Region("Retired", 1, List.of(ZHUJIANG), List.of(ECONOMY));
            FetchTask task = taskScheduler.enqueueListTask(retired, ZHUJIANG, ECONOMY, 2);

            // when
            DrainSummary summary = service.runPendingTasks(TaskKind.LIST_FETCH, 5);

            // then
            assertThat(summary.skipped()).isEqualTo(1);
            assertThat(taskScheduler.get(task.getTaskId()).getStatus()).isEqualTo(TaskStatus.SKIPPED);
            verify(listingFetcher, never()).fetch(anyString(), any());
        }

        @Test
        void unexpectedErrorSendsTaskBackWithoutAbortingDrain() {
            // given
            FetchTask comfort = taskScheduler.enqueueListTask(CBD, TIYU, COMFORT, 1);
            FetchTask economy = taskScheduler.enqueueListTask(CBD, ZHUJIANG, ECONOMY, 2);
            when(listingFetcher.fetch(anyString(), any())).thenAnswer(inv -> {
                TierRequest request = inv.getArgument(1);
                if (request.zone().code().equals("6240")) {
                    throw new IllegalStateException("no page driver available");
                }
                return freshItems(request);
            });

            // when
            DrainSummary summary = service.runPendingTasks(TaskKind.LIST_FETCH, 5);

            // then
            assertThat(summary).isEqualTo(new DrainSummary(2, 1, 0, 1, 0));
            FetchTask failed = taskScheduler.get(comfort.getTaskId());
            assertThat(failed.getStatus()).isEqualTo(TaskStatus.PENDING);
            assertThat(failed.getRetryCount()).isEqualTo(1);
            assertThat(failed.getErrorReason()).isEqualTo("IllegalStateException: no page driver available");
            assertThat(taskScheduler.get(economy.getTaskId()).getStatus()).isEqualTo(TaskStatus.COMPLETED);
            assertThat(service.isBusy()).isFalse();
        }

        @Test
        void writesAtMostTheRequestedItemsAndIgnoresMissingIds() {
            // given
            FetchTask task = taskScheduler.enqueueListTask(CBD, TIYU, COMFORT, 2);
            when(listingFetcher.fetch(anyString(), any())).thenReturn(List.of(
                    CandidateItem.builder().name("No id").build(),
                    CandidateItem.builder().itemId("a").name("Hotel A").build(),
                    CandidateItem.builder().itemId("b").name("Hotel B").build(),
                    CandidateItem.builder().itemId("c").name("Hotel C").build()));

            // when
            service.runPendingTasks(TaskKind.LIST_FETCH, 5);

            // then
            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<CandidateItem>> items = ArgumentCaptor.forClass(List.class);
            verify(outputRouter).writeItems(items.capture(), eq("task-" + task.getTaskId()));
            assertThat(items.getValue()).extracting(CandidateItem::getItemId).containsExactly("a", "b");
        }
    }

    private List<CandidateItem> freshItems(TierRequest request) {
        return IntStream.range(0, request.requested())
                .mapToObj(i -> CandidateItem.builder()
                        .itemId(String.valueOf(nextId.getAndIncrement()))
                        .name("Hotel")
                        .build())
                .collect(Collectors.toList());
    }
}
