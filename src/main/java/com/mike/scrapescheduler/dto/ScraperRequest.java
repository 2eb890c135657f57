package com.mike.scrapescheduler.dto;

import com.mike.scrapescheduler.entity.FetchMethod;
import com.mike.scrapescheduler.entity.ScraperStatus;

import java.util.Map;

/**
 * Create or partial-update payload. Null fields are left untouched on update.
 */
public record ScraperRequest(
        String name,
        String url,
        FetchMethod method,
        Map<String, String> selectors,
        Integer delaySeconds,
        Integer maxPages,
        Integer concurrentRequests,
        ScraperStatus status
) {
}
