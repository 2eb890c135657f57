package com.mike.scrapescheduler.service;

import com.mike.scrapescheduler.config.ScraperProperties;
import com.mike.scrapescheduler.dto.ExtractionResult;
import com.mike.scrapescheduler.dto.RunSummary;
import com.mike.scrapescheduler.dto.ScraperTestRequest;
import com.mike.scrapescheduler.entity.FetchMethod;
import com.mike.scrapescheduler.entity.ScrapedData;
import com.mike.scrapescheduler.entity.Scraper;
import com.mike.scrapescheduler.entity.ScraperStatus;
import com.mike.scrapescheduler.repository.ScrapedDataRepository;
import com.mike.scrapescheduler.repository.ScraperRepository;
import com.mike.scrapescheduler.service.extract.SelectorExtractor;
import com.mike.scrapescheduler.service.fetch.FetchPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Runs a scraper end to end. Pages are fetched one at a time with the scraper's delay between
 * them; a failing page is logged and skipped, it never fails the run. An interrupt stops the
 * run before the next page and marks it failed. Only the status and last-run columns are written.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScraperRunner {

    private final ScraperRepository scraperRepository;
    private final ScrapedDataRepository scrapedDataRepository;
    private final TargetUrlEnumerator urlEnumerator;
    private final FetchPipeline fetchPipeline;
    private final SelectorExtractor extractor;
    private final Pacer pacer;
    private final ScraperProperties props;

    public RunSummary runScraper(Long scraperId) {
        Scraper scraper = scraperRepository.findById(scraperId)
                .orElseThrow(() -> NotFoundException.scraper(scraperId));

        LocalDateTime startedAt = LocalDateTime.now();
        scraper.setStatus(ScraperStatus.RUNNING);
        scraper.setLastRun(startedAt);
        scraperRepository.markRunning(scraperId, ScraperStatus.RUNNING, startedAt);

        log.info("ScraperRunner: started scraper id={} name='{}' method={}", scraperId, scraper.getName(), scraper.getMethod());

        try {
            List<String> urls = urlEnumerator.enumerate(scraper);
            if (urls.size() > scraper.getMaxPages()) {
                urls = urls.subList(0, Math.max(1, scraper.getMaxPages()));
            }

            int saved = 0;
            int failed = 0;
            int fieldErrors = 0;
            boolean interrupted = false;

            for (int i = 0; i < urls.size(); i++) {
                String url = urls.get(i);
                if (i > 0) {
                    pacer.pause(scraper.getDelaySeconds());
                }
                if (Thread.currentThread().isInterrupted()) {
                    interrupted = true;
                    log.warn("ScraperRunner: interrupted, stopping scraper id={} after {} of {} page(s)", scraperId, i, urls.size());
                    break;
                }

                try {
                    String markup = fetchPipeline.fetch(scraper, url);
                    ExtractionResult result = extractor.extract(markup, scraper.getSelectors());
                    if (result.hasErrors()) {
                        fieldErrors += result.errors().size();
                        log.warn("ScraperRunner: {} field error(s) on {}: {}", result.errors().size(), url, result.errors());
                    }

                    scrapedDataRepository.save(ScrapedData.builder()
                            .scraperId(scraperId)
                            .url(url)
                            .data(new LinkedHashMap<>(result.fields()))
                            .scrapedAt(LocalDateTime.now())
                            .build());
                    saved++;
                } catch (RuntimeException e) {
                    failed++;
                    log.warn("ScraperRunner: page failed scraperId={} url={} reason={}", scraperId, url, e.getMessage());
                }
            }

            ScraperStatus finalStatus = interrupted ? ScraperStatus.FAILED : ScraperStatus.COMPLETED;
            markStatus(scraper, finalStatus);

            RunSummary summary = RunSummary.builder()
                    .scraperId(scraperId)
                    .status(finalStatus)
                    .pagesPlanned(urls.size())
                    .pagesSaved(saved)
                    .pagesFailed(failed)
                    .fieldErrors(fieldErrors)
                    .startedAt(startedAt)
                    .finishedAt(LocalDateTime.now())
                    .build();

            log.info("ScraperRunner SUMMARY: {}", summary.toLogLine());
            return summary;

        } catch (RuntimeException e) {
            log.error("ScraperRunner: run failed for scraper id={}: {}", scraperId, e.getMessage(), e);
            try {
                markStatus(scraper, ScraperStatus.FAILED);
            } catch (RuntimeException statusError) {
                e.addSuppressed(statusError);
            }
            throw e;
        }
    }

    /**
     * Fetches and extracts one page for a configuration that is not saved yet.
     * Nothing is persisted.
     */
    public ExtractionResult testScraper(ScraperTestRequest request) {
        if (request == null || request.url() == null || request.url().isBlank()) {
            throw new ValidationException("URL and selectors are required for testing");
        }
        if (request.selectors() == null || request.selectors().isEmpty()) {
            throw new ValidationException("URL and selectors are required for testing");
        }

        Scraper transientScraper = Scraper.builder()
                .name("Test")
                .url(request.url().trim())
                .method(request.method() == null ? FetchMethod.RENDERED : request.method())
                .selectors(new LinkedHashMap<>(request.selectors()))
                .delaySeconds(request.delaySeconds() == null
                        ? props.getTestRun().getDefaultDelaySeconds()
                        : Math.max(0, request.delaySeconds()))
                .maxPages(1)
                .concurrentRequests(1)
                .status(ScraperStatus.TESTING)
                .createdAt(LocalDateTime.now())
                .build();

        log.info("ScraperRunner: test run url={} method={} fields={}",
                transientScraper.getUrl(), transientScraper.getMethod(), transientScraper.getSelectors().keySet());

        String markup = fetchPipeline.fetch(transientScraper, transientScraper.getUrl());
        return extractor.extract(markup, transientScraper.getSelectors());
    }

    // status only; the rest of the row may have been edited while the run was in progress
    private void markStatus(Scraper scraper, ScraperStatus status) {
        scraper.setStatus(status);
        scraperRepository.updateStatus(scraper.getId(), status);
    }
}
