package com.hotelintel.sampler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "sampler")
@Data
public class SamplerProperties {

    private Output output = new Output();
    private Scheduling scheduling = new Scheduling();
    private Plan plan = new Plan();
    private Tasks tasks = new Tasks();
    private Reviews reviews = new Reviews();
    private Pacing pacing = new Pacing();
    private Browser browser = new Browser();
    private Source source = new Source();

    @Data
    public static class Output {
        private OutputMode mode = OutputMode.DATABASE;
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private String outputDir = "/data/output";
            private boolean includeHeader = true;
        }

        public enum OutputMode {
            DATABASE, CSV, BOTH
        }
    }

    @Data
    public static class Scheduling {
        private String cron = "0 0 3 * * ?";
        private boolean runOnStartup = false;
        private int reviewBatchSize = 20;
    }

    @Data
    public static class Plan {
        private String location = "classpath:sampling-plan.json";
    }

    @Data
    public static class Tasks {
        private int maxRetries = 3;
        /** Base of the exponential retry backoff: base * 2^retryCount */
        private Duration retryBackoff = Duration.ofSeconds(30);
        /** Items below this review count get no review task at all */
        private int reviewTaskMinReviewCount = 50;
    }

    @Data
    public static class Reviews {
        private int maxPerItem = 300;
        private int minReviewThreshold = 200;
        private int negativeCap = 100;
        private int evidenceCap = 150;
        /** Consecutive pages without a new identifier before a pool is abandoned */
        private int maxStalePages = 2;
        private int maxPagesPerFilter = 30;
    }

    @Data
    public static class Pacing {
        private Range interRequest = new Range(Duration.ofSeconds(1), Duration.ofSeconds(2));
        private Range interZone = new Range(Duration.ofSeconds(3), Duration.ofSeconds(6));
        private Range interRegion = new Range(Duration.ofSeconds(5), Duration.ofSeconds(10));
    }

    @Data
    public static class Range {
        private Duration min;
        private Duration max;

        public Range() {
        }

        public Range(Duration min, Duration max) {
            this.min = min;
            this.max = max;
        }
    }

    @Data
    public static class Browser {
        private boolean enabled = true;
        /** DevTools endpoint of a Chrome started with --remote-debugging-port */
        private String cdpUrl = "http://127.0.0.1:9222";
        private Duration navigationTimeout = Duration.ofSeconds(30);
        private int maxScrolls = 10;
        /** How long to wait for an operator to clear a challenge by hand */
        private Duration manualResumeTimeout = Duration.ofMinutes(10);
    }

    @Data
    public static class Source {
        private String listUrl = "https://hotel.fliggy.com/hotel_list3.htm";
        private String detailUrl = "https://hotel.fliggy.com/hotel_detail2.htm";
        private String cityCode = "440100";
    }
}
