package com.hotelintel.sampler.service;

import com.hotelintel.sampler.config.SamplerProperties;
import com.hotelintel.sampler.driver.ChallengeHandler;
import com.hotelintel.sampler.driver.PageDriver;
import com.hotelintel.sampler.driver.SourceUrls;
import com.hotelintel.sampler.exception.TransientFetchException;
import com.hotelintel.sampler.model.RawReview;
import com.hotelintel.sampler.model.ReviewFilter;
import com.hotelintel.sampler.model.ReviewPool;
import com.hotelintel.sampler.model.ReviewQuery;
import com.hotelintel.sampler.model.ReviewRecord;
import com.hotelintel.sampler.output.OutputRouter;
import com.hotelintel.sampler.reviews.AllocationResult;
import com.hotelintel.sampler.reviews.ReviewPoolAllocator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Clock;
import java.util.List;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReviewAcquisitionServiceTest {

    @Mock
    private ObjectProvider<PageDriver> driverProvider;
    @Mock
    private PageDriver driver;
    @Mock
    private ChallengeHandler challengeHandler;
    @Mock
    private SourceUrls urls;
    @Mock
    private OutputRouter outputRouter;

    private ReviewAcquisitionService service;

    @BeforeEach
    void setUp() {
        SamplerProperties properties = new SamplerProperties();
        service = new ReviewAcquisitionService(driverProvider, challengeHandler, urls,
                new CandidateMapper(Clock.systemUTC()), new ReviewPoolAllocator(properties), outputRouter, properties);
        when(driverProvider.getIfAvailable()).thenReturn(driver);
        when(urls.detailUrl("10019773")).thenReturn("https://detail");
    }

    @Test
    void fillsPoolsInOrderAndStores() {
        // given
        when(driver.navigate("https://detail")).thenReturn(true);
        when(driver.totalReviewCount()).thenReturn(OptionalInt.of(850));
        when(driver.extractReviewPage(any(), anyInt())).thenAnswer(inv -> {
            ReviewQuery query = inv.getArgument(0);
            int page = inv.getArgument(1);
            if (page > 0) return PageDriver.ReviewPage.empty();
            if (query.filter() == ReviewFilter.BAD) {
                return new PageDriver.ReviewPage(List.of(review("a", "隔音差"), review("b", "早餐一般")), false);
            }
            if (query.filter() == ReviewFilter.ALL && query.imagesOnly()) {
                return new PageDriver.ReviewPage(List.of(RawReview.builder().author("c").content("有图有真相")
                        .imageUrls(List.of("https://img.example/c.jpg")).build()), false);
            }
            if (query.filter() == ReviewFilter.ALL) {
                return new PageDriver.ReviewPage(
                        List.of(review("a", "隔音差"), review("d", "位置好"), review("e", "干净卫生")), false);
            }
            return PageDriver.ReviewPage.empty();
        });

        // when
        AllocationResult result = service.acquire("10019773", null);

        // then
        assertThat(result.count(ReviewPool.NEGATIVE)).isEqualTo(2);
        assertThat(result.count(ReviewPool.EVIDENCE)).isEqualTo(1);
        assertThat(result.count(ReviewPool.RECENCY)).isEqualTo(2);
        assertThat(result.records()).extracting(ReviewRecord::getContent)
                .containsExactly("隔音差", "早餐一般", "有图有真相", "位置好", "干净卫生");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ReviewRecord>> stored = ArgumentCaptor.forClass(List.class);
        verify(outputRouter).writeReviews(stored.capture(), eq("10019773"));
        assertThat(stored.getValue()).hasSize(5).allSatisfy(r -> assertThat(r.getItemId()).isEqualTo("10019773"));
    }

    @Test
    void itemBelowThresholdIsSkipped() {
        // given
        when(driver.navigate(anyString())).thenReturn(true);
        when(driver.totalReviewCount()).thenReturn(OptionalInt.of(90));

        // when
        AllocationResult result = service.acquire("10019773", 300);

        // then
        assertThat(result.isSkipped()).isTrue();
        verify(driver, never()).extractReviewPage(any(), anyInt());
        verify(outputRouter, never()).writeReviews(anyList(), anyString());
    }

    @Test
    void listingCountUsedWhenDetailPageHasNone() {
        when(driver.navigate(anyString())).thenReturn(true);
        when(driver.totalReviewCount()).thenReturn(OptionalInt.empty());

        assertThat(service.acquire("10019773", 120).isSkipped()).isTrue();
    }

    @Test
    void nothingExtractedFromReviewedItemIsTransient() {
        when(driver.navigate(anyString())).thenReturn(true);
        when(driver.totalReviewCount()).thenReturn(OptionalInt.of(640));
        when(driver.extractReviewPage(any(), anyInt())).thenReturn(PageDriver.ReviewPage.empty());

        assertThatThrownBy(() -> service.acquire("10019773", null))
                .isInstanceOf(TransientFetchException.class)
                .hasMessageContaining("640");
        verify(outputRouter, never()).writeReviews(anyList(), anyString());
    }

    @Test
    void navigationFailureIsTransient() {
        when(driver.navigate(anyString())).thenReturn(false);

        assertThatThrownBy(() -> service.acquire("10019773", 500))
                .isInstanceOf(TransientFetchException.class);
    }

    private static RawReview review(String author, String content) {
        return RawReview.builder().author(author).content(content).build();
    }
}
