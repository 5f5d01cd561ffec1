package com.hotelintel.sampler.driver;

import com.hotelintel.sampler.config.SamplerProperties;
import com.hotelintel.sampler.exception.TransientFetchException;
import com.hotelintel.sampler.model.RawListing;
import com.hotelintel.sampler.model.RawReview;
import com.hotelintel.sampler.model.ReviewFilter;
import com.hotelintel.sampler.model.ReviewQuery;
import com.hotelintel.sampler.pacing.DelayKind;
import com.hotelintel.sampler.pacing.MotionStep;
import com.hotelintel.sampler.pacing.PacingPolicy;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.ElementHandle;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.BoundingBox;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Drives an already running Chrome over the DevTools protocol.
 *
 * The browser is started by hand with a persistent profile so the session looks like a
 * regular user's:
 *   chrome --remote-debugging-port=9222 --user-data-dir=/path/to/automation_profile
 *
 * Connection is lazy: nothing touches the browser until the first call. Browser errors
 * (page crash, detached frame, lost connection) surface as {@link TransientFetchException}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "sampler.browser", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PlaywrightPageDriver implements PageDriver {

    private static final String LIST_ROW = ".list-row.J_ListRow";
    private static final String LIST_NEXT = ".pi-pagination-next:not(.pi-pagination-disabled)";
    private static final String REVIEW_ITEM = "li.tb-r-comment";
    private static final String REVIEW_SECTION = "#hotel-review";
    private static final String IMAGE_CHECKBOX = "#review-addreply";
    private static final String SLIDER_HANDLE = "#nc_1_n1z";
    private static final String SLIDER_TRACK = ".nc_scale";

    private static final List<String> CHALLENGE_SELECTORS = List.of(
            "#nc_1_n1z", ".nc-container", ".nc_wrapper", "#baxia-dialog-content", ".J_MIDDLEWARE_FRAME_WIDGET");
    private static final List<String> CHALLENGE_PASSED = List.of(".nc_ok", ".nc-success");
    private static final List<String> REVIEW_COUNT_SELECTORS = List.of("#J_ReviewCount", ".comments a", "li.comments a");

    private static final Map<ReviewFilter, String> FILTER_SELECTORS = Map.of(
            ReviewFilter.ALL, "#review-t-1",
            ReviewFilter.GOOD, "#review-t-2",
            ReviewFilter.MEDIUM, "#review-t-4",
            ReviewFilter.BAD, "#review-t-5");

    private static final Pattern DIGITS = Pattern.compile("(\\d+)");

    private final SamplerProperties properties;
    private final PacingPolicy pacingPolicy;

    private Playwright playwright;
    private Browser browser;
    private Page page;

    @Override
    public boolean navigate(String url) {
        try {
            log.info("Navigating to: {}", url);
            page().navigate(url, new Page.NavigateOptions()
                    .setTimeout(properties.getBrowser().getNavigationTimeout().toMillis()));
            pacingPolicy.pause(DelayKind.INTER_REQUEST);
            return true;
        } catch (PlaywrightException e) {
            log.error("Navigation failed for {}: {}", url, e.getMessage());
            return false;
        }
    }

    @Override
    public ListPage extractListPage() {
        return guarded("extract list page", this::readListPage);
    }

    private ListPage readListPage() {
        Page p = page();
        try {
            p.waitForSelector(LIST_ROW, new Page.WaitForSelectorOptions().setTimeout(10_000));
        } catch (PlaywrightException e) {
            log.warn("No listing rows on {}", p.url());
            return ListPage.empty();
        }
        scrollToBottom(p);

        List<RawListing> listings = new ArrayList<>();
        for (ElementHandle row : p.querySelectorAll(LIST_ROW)) {
            listings.add(RawListing.builder()
                    .itemId(row.getAttribute("data-shid"))
                    .name(row.getAttribute("data-name"))
                    .latitude(row.getAttribute("data-lat"))
                    .longitude(row.getAttribute("data-lng"))
                    .ratingText(text(row, ".comment-score .score"))
                    .reviewCountText(text(row, ".comment-score .count"))
                    .priceText(text(row, ".pi-price"))
                    .address(text(row, ".row-address"))
                    .starLevel(starLevel(row))
                    .build());
        }
        log.info("Found {} listings on page", listings.size());
        return new ListPage(listings, p.querySelector(LIST_NEXT) != null);
    }

    @Override
    public boolean nextListPage() {
        return guarded("next list page", this::clickNext);
    }

    @Override
    public ReviewPage extractReviewPage(ReviewQuery query, int pageIndex) {
        return guarded("extract review page " + pageIndex, () -> readReviewPage(query, pageIndex));
    }

    private ReviewPage readReviewPage(ReviewQuery query, int pageIndex) {
        Page p = page();
        if (pageIndex == 0) {
            focusReviews(p);
            applyFilter(p, query);
        } else if (!clickNext()) {
            return ReviewPage.empty();
        }

        List<RawReview> reviews = new ArrayList<>();
        for (ElementHandle item : p.querySelectorAll(REVIEW_ITEM)) {
            reviews.add(parseReview(item));
        }
        log.debug("Review page {} ({}): {} reviews", pageIndex, query, reviews.size());
        return new ReviewPage(reviews, p.querySelector(LIST_NEXT) != null);
    }

    @Override
    public OptionalInt totalReviewCount() {
        return guarded("read review count", () -> {
            Page p = page();
            for (String selector : REVIEW_COUNT_SELECTORS) {
                ElementHandle el = p.querySelector(selector);
                if (el == null) continue;
                Matcher m = DIGITS.matcher(el.innerText());
                if (m.find()) {
                    try {
                        return OptionalInt.of(Integer.parseInt(m.group(1)));
                    } catch (NumberFormatException e) {
                        log.warn("Unreadable review count '{}'", m.group(1));
                    }
                }
            }
            return OptionalInt.empty();
        });
    }

    @Override
    public boolean challengePresent() {
        return guarded("check for challenge", () -> {
            Page p = page();
            for (String selector : CHALLENGE_SELECTORS) {
                if (p.querySelector(selector) != null) {
                    log.warn("Challenge element present: {}", selector);
                    return true;
                }
            }
            return false;
        });
    }

    @Override
    public OptionalInt sliderTrackLength() {
        return guarded("measure slider", () -> {
            ElementHandle track = page().querySelector(SLIDER_TRACK);
            if (track == null) return OptionalInt.empty();
            BoundingBox box = track.boundingBox();
            return box == null ? OptionalInt.empty() : OptionalInt.of((int) box.width);
        });
    }

    @Override
    public boolean dragSlider(List<MotionStep> motion) {
        Page p = page();
        try {
            ElementHandle handle = p.querySelector(SLIDER_HANDLE);
            BoundingBox box = handle == null ? null : handle.boundingBox();
            if (box == null) {
                log.debug("Slider handle not found");
                return false;
            }
            double x = box.x + box.width / 2;
            double y = box.y + box.height / 2;
            p.mouse().move(x, y);
            p.waitForTimeout(300);
            p.mouse().down();
            p.waitForTimeout(200);
            for (MotionStep step : motion) {
                x += step.dx();
                p.mouse().move(x, y + step.dy());
                p.waitForTimeout(step.dtMillis());
            }
            p.waitForTimeout(100);
            p.mouse().up();
            p.waitForTimeout(2_000);
            return CHALLENGE_PASSED.stream().anyMatch(s -> p.querySelector(s) != null);
        } catch (PlaywrightException e) {
            log.debug("Slider drag failed: {}", e.getMessage());
            return false;
        }
    }

    @PreDestroy
    public void close() {
        if (playwright != null) {
            // Disconnects from the user's Chrome without closing it
            playwright.close();
            playwright = null;
            browser = null;
            page = null;
            log.info("Disconnected from browser");
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private synchronized Page page() {
        if (page != null && !page.isClosed()) {
            return page;
        }
        String cdpUrl = properties.getBrowser().getCdpUrl();
        try {
            if (playwright == null) {
                playwright = Playwright.create();
            }
            browser = playwright.chromium().connectOverCDP(cdpUrl);
            BrowserContext context = browser.contexts().isEmpty() ? browser.newContext() : browser.contexts().get(0);
            page = context.pages().isEmpty() ? context.newPage() : context.pages().get(0);
            log.info("Connected to Chrome at {}", cdpUrl);
            return page;
        } catch (PlaywrightException e) {
            log.error("Cannot connect to Chrome at {}. Start it with --remote-debugging-port first.", cdpUrl);
            throw new TransientFetchException("Cannot connect to Chrome at " + cdpUrl, e);
        }
    }

    private <T> T guarded(String action, Supplier<T> body) {
        try {
            return body.get();
        } catch (PlaywrightException e) {
            log.warn("Browser error during {}: {}", action, e.getMessage());
            throw new TransientFetchException("Browser error during " + action + ": " + e.getMessage(), e);
        }
    }

    private void scrollToBottom(Page p) {
        for (int i = 0; i < properties.getBrowser().getMaxScrolls(); i++) {
            Object before = p.evaluate("document.body.scrollHeight");
            p.mouse().wheel(0, 500);
            pacingPolicy.pause(DelayKind.INTER_REQUEST);
            Object after = p.evaluate("document.body.scrollHeight");
            if (before != null && before.equals(after)) {
                log.debug("Reached bottom after {} scrolls", i + 1);
                return;
            }
        }
    }

    private boolean clickNext() {
        Page p = page();
        ElementHandle next = p.querySelector(LIST_NEXT);
        if (next == null) return false;
        next.click();
        pacingPolicy.pause(DelayKind.INTER_REQUEST);
        return true;
    }

    private void focusReviews(Page p) {
        ElementHandle section = p.querySelector(REVIEW_SECTION);
        if (section != null) {
            section.scrollIntoViewIfNeeded();
            pacingPolicy.pause(DelayKind.INTER_REQUEST);
        }
    }

    private void applyFilter(Page p, ReviewQuery query) {
        String selector = FILTER_SELECTORS.get(query.filter());
        ElementHandle radio = p.querySelector(selector);
        if (radio == null) {
            log.warn("Review filter control {} not found", selector);
        } else {
            ElementHandle label = p.querySelector("label[for=\"" + selector.substring(1) + "\"]");
            (label != null ? label : radio).click();
            pacingPolicy.pause(DelayKind.INTER_REQUEST);
        }

        ElementHandle images = p.querySelector(IMAGE_CHECKBOX);
        if (images != null && images.isChecked() != query.imagesOnly()) {
            images.click();
            pacingPolicy.pause(DelayKind.INTER_REQUEST);
        }
    }

    private RawReview parseReview(ElementHandle item) {
        ElementHandle nick = item.querySelector(".tb-r-nick a");
        String author = nick == null ? null : firstNonNull(nick.getAttribute("title"), nick.innerText());

        List<String> scoreStyles = new ArrayList<>();
        for (ElementHandle star : item.querySelectorAll(".starscore li em")) {
            scoreStyles.add(star.getAttribute("style"));
        }
        List<String> images = new ArrayList<>();
        for (ElementHandle img : item.querySelectorAll(".tb-r-photos img")) {
            String src = img.getAttribute("data-val");
            if (src != null) images.add(src);
        }
        List<ElementHandle> dates = item.querySelectorAll(".tb-r-info .tb-r-date");

        return RawReview.builder()
                .author(author)
                .content(text(item, ".tb-r-cnt"))
                .summary(text(item, ".comment-name"))
                .scoreStyles(scoreStyles)
                .dateText(text(item, ".tb-r-date"))
                .imageUrls(images)
                .replyContent(text(item, ".tb-r-seller"))
                .replyDateText(dates.size() > 1 ? dates.get(dates.size() - 1).innerText() : null)
                .build();
    }

    private String starLevel(ElementHandle row) {
        ElementHandle el = row.querySelector(".row-subtitle");
        return el == null ? null : firstNonNull(el.getAttribute("title"), el.innerText());
    }

    private String text(ElementHandle parent, String selector) {
        ElementHandle el = parent.querySelector(selector);
        return el == null ? null : el.innerText();
    }

    private String firstNonNull(String a, String b) {
        return a != null && !a.isBlank() ? a : b;
    }
}
