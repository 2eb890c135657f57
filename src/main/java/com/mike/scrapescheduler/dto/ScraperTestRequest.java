package com.mike.scrapescheduler.dto;

import com.mike.scrapescheduler.entity.FetchMethod;

import java.util.Map;

/**
 * Unsaved scraper configuration to try out against one URL.
 */
public record ScraperTestRequest(
        String url,
        Map<String, String> selectors,
        FetchMethod method,
        Integer delaySeconds
) {
}
