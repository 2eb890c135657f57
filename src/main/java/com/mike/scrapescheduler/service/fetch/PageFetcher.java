package com.mike.scrapescheduler.service.fetch;

import com.mike.scrapescheduler.entity.FetchMethod;
import com.mike.scrapescheduler.entity.Scraper;

public interface PageFetcher {

    FetchMethod method();

    /**
     * @return the page markup
     * @throws RuntimeException any failure; {@link FetchException} for failures detected by the fetcher itself
     */
    String fetch(Scraper scraper, String url);
}
