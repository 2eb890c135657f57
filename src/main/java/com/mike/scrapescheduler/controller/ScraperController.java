package com.mike.scrapescheduler.controller;

import com.mike.scrapescheduler.dto.ExtractionResult;
import com.mike.scrapescheduler.dto.RunSummary;
import com.mike.scrapescheduler.dto.ScrapedDataPage;
import com.mike.scrapescheduler.dto.ScraperRequest;
import com.mike.scrapescheduler.dto.ScraperTestRequest;
import com.mike.scrapescheduler.entity.Scraper;
import com.mike.scrapescheduler.service.ScrapedDataService;
import com.mike.scrapescheduler.service.ScraperRunner;
import com.mike.scrapescheduler.service.ScraperService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ScraperController {

    private final ScraperService scraperService;
    private final ScraperRunner scraperRunner;
    private final ScrapedDataService scrapedDataService;

    @GetMapping("/scrapers")
    public List<Scraper> list() {
        return scraperService.list();
    }

    @GetMapping("/scrapers/{id}")
    public Scraper get(@PathVariable Long id) {
        return scraperService.get(id);
    }

    @PostMapping("/scrapers")
    public ResponseEntity<Scraper> create(@RequestBody ScraperRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(scraperService.create(request));
    }

    @PutMapping("/scrapers/{id}")
    public Scraper update(@PathVariable Long id, @RequestBody ScraperRequest request) {
        return scraperService.update(id, request);
    }

    @DeleteMapping("/scrapers/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        scraperService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/scrapers/test")
    public ExtractionResult test(@RequestBody ScraperTestRequest request) {
        return scraperRunner.testScraper(request);
    }

    @PostMapping("/scrapers/{id}/run")
    public RunSummary run(@PathVariable Long id) {
        return scraperRunner.runScraper(id);
    }

    @GetMapping("/scraped-data")
    public ScrapedDataPage scrapedData(
            @RequestParam(required = false) Long scraperId,
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(defaultValue = "0") int offset) {
        return scrapedDataService.list(scraperId, limit, offset);
    }
}
