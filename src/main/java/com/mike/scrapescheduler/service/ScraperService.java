package com.mike.scrapescheduler.service;

import com.mike.scrapescheduler.dto.ScraperRequest;
import com.mike.scrapescheduler.entity.Scraper;
import com.mike.scrapescheduler.repository.ScraperRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class ScraperService {

    private final ScraperRepository repository;

    public List<Scraper> list() {
        return repository.findAllByOrderByCreatedAtDesc();
    }

    public Scraper get(Long id) {
        return repository.findById(id).orElseThrow(() -> NotFoundException.scraper(id));
    }

    @Transactional
    public Scraper create(ScraperRequest request) {
        if (request == null || isBlank(request.name()) || isBlank(request.url())) {
            throw new ValidationException("name and url are required");
        }
        if (request.selectors() == null) {
            throw new ValidationException("selectors are required");
        }

        Scraper scraper = new Scraper();
        scraper.setName(request.name().trim());
        scraper.setUrl(request.url().trim());
        scraper.setSelectors(new LinkedHashMap<>());
        apply(scraper, request);

        Scraper saved = repository.save(scraper);
        log.info("ScraperService: created scraper id={} name='{}'", saved.getId(), saved.getName());
        return saved;
    }

    @Transactional
    public Scraper update(Long id, ScraperRequest request) {
        Scraper scraper = get(id);
        if (request == null) return scraper;

        if (request.name() != null) {
            if (request.name().isBlank()) throw new ValidationException("name must not be blank");
            scraper.setName(request.name().trim());
        }
        if (request.url() != null) {
            if (request.url().isBlank()) throw new ValidationException("url must not be blank");
            scraper.setUrl(request.url().trim());
        }
        apply(scraper, request);

        return repository.save(scraper);
    }

    @Transactional
    public void delete(Long id) {
        if (!repository.existsById(id)) {
            throw NotFoundException.scraper(id);
        }
        repository.deleteById(id);
        log.info("ScraperService: deleted scraper id={}", id);
    }

    private void apply(Scraper scraper, ScraperRequest request) {
        if (request.method() != null) scraper.setMethod(request.method());
        if (request.selectors() != null) scraper.setSelectors(new LinkedHashMap<>(request.selectors()));
        if (request.delaySeconds() != null) {
            if (request.delaySeconds() < 0) throw new ValidationException("delaySeconds must be >= 0");
            scraper.setDelaySeconds(request.delaySeconds());
        }
        if (request.maxPages() != null) {
            if (request.maxPages() < 1) throw new ValidationException("maxPages must be >= 1");
            scraper.setMaxPages(request.maxPages());
        }
        if (request.concurrentRequests() != null) {
            if (request.concurrentRequests() < 1) throw new ValidationException("concurrentRequests must be >= 1");
            scraper.setConcurrentRequests(request.concurrentRequests());
        }
        if (request.status() != null) scraper.setStatus(request.status());
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
