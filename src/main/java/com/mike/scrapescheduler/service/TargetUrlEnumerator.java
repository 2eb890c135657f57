package com.mike.scrapescheduler.service;

import com.mike.scrapescheduler.entity.Scraper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists the pages a run visits. A URL containing {@value #PAGE_TOKEN} is expanded to pages
 * 1..maxPages, any other URL is visited once.
 */
@Component
public class TargetUrlEnumerator {

    public static final String PAGE_TOKEN = "{page}";

    public List<String> enumerate(Scraper scraper) {
        String url = scraper.getUrl();
        if (url == null || url.isBlank()) {
            throw new ValidationException("Scraper " + scraper.getId() + " has no URL");
        }

        String base = url.trim();
        if (!base.contains(PAGE_TOKEN)) {
            return List.of(base);
        }

        int cap = Math.max(1, scraper.getMaxPages());
        List<String> urls = new ArrayList<>(cap);
        for (int page = 1; page <= cap; page++) {
            urls.add(base.replace(PAGE_TOKEN, String.valueOf(page)));
        }
        return urls;
    }
}
