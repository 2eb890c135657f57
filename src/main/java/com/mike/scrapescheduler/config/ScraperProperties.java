package com.mike.scrapescheduler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@Data
@ConfigurationProperties(prefix = "scrapescheduler.scraper")
public class ScraperProperties {

    private Identity identity = new Identity();
    private Rendered rendered = new Rendered();
    private Lightweight lightweight = new Lightweight();
    private TestRun testRun = new TestRun();

    @Data
    public static class Identity {
        private String userAgent =
                "Mozilla/5.0 (Windows NT 10.0; Win64; x64) " +
                        "AppleWebKit/537.36 (KHTML, like Gecko) " +
                        "Chrome/129.0.0.0 Safari/537.36";

        private String referrer = "https://www.google.com";
    }

    @Data
    public static class Rendered {
        private boolean headless = true;

        /**
         * Chromium flags; the defaults keep it working inside Docker.
         */
        private List<String> launchArgs = List.of("--no-sandbox", "--disable-dev-shm-usage");

        /**
         * Navigation timeout for a single page.
         */
        private int navigationTimeoutMs = 30_000;

        /**
         * Upper bound for the whole rendered fetch, pacing wait included.
         */
        private int callTimeoutMs = 120_000;
    }

    @Data
    public static class Lightweight {
        private int timeoutMs = 10_000;
        private int maxBodyBytes = 5 * 1024 * 1024;
    }

    @Data
    public static class TestRun {
        private int defaultDelaySeconds = 2;
    }
}
