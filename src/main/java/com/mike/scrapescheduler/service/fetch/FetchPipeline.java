package com.mike.scrapescheduler.service.fetch;

import com.mike.scrapescheduler.entity.FetchMethod;
import com.mike.scrapescheduler.entity.Scraper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves a URL to markup. Rendered scrapers try the browser first and fall back to a plain
 * HTTP GET on any failure; lightweight scrapers only use the plain GET.
 */
@Service
@Slf4j
public class FetchPipeline {

    private static final List<FetchMethod> RENDERED_ORDER = List.of(FetchMethod.RENDERED, FetchMethod.LIGHTWEIGHT);
    private static final List<FetchMethod> LIGHTWEIGHT_ORDER = List.of(FetchMethod.LIGHTWEIGHT);

    private final Map<FetchMethod, PageFetcher> fetchers = new EnumMap<>(FetchMethod.class);

    public FetchPipeline(List<PageFetcher> fetchers) {
        for (PageFetcher fetcher : fetchers) {
            PageFetcher previous = this.fetchers.put(fetcher.method(), fetcher);
            if (previous != null) {
                throw new IllegalStateException("Two fetchers registered for " + fetcher.method());
            }
        }
    }

    public String fetch(Scraper scraper, String url) {
        return attempt(scraper, url).markupOrThrow();
    }

    public FetchResult attempt(Scraper scraper, String url) {
        List<FetchMethod> order = scraper.getMethod() == FetchMethod.LIGHTWEIGHT ? LIGHTWEIGHT_ORDER : RENDERED_ORDER;
        List<FetchResult.Failure> failures = new ArrayList<>();

        for (FetchMethod method : order) {
            PageFetcher fetcher = fetchers.get(method);
            if (fetcher == null) {
                failures.add(new FetchResult.Failure(method, new FetchException("No fetcher configured for " + method)));
                continue;
            }

            try {
                String markup = fetcher.fetch(scraper, url);
                if (!failures.isEmpty()) {
                    log.info("FetchPipeline: {} fetched via {} after {} failed attempt(s)", url, method, failures.size());
                }
                return FetchResult.success(url, method, markup, failures);
            } catch (RuntimeException e) {
                log.warn("FetchPipeline: {} fetch failed for {}: {}", method, url, e.getMessage());
                failures.add(new FetchResult.Failure(method, e));
            }
        }

        return FetchResult.failed(url, failures);
    }
}
