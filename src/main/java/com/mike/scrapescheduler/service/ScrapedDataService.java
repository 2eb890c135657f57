package com.mike.scrapescheduler.service;

import com.mike.scrapescheduler.dto.ScrapedDataPage;
import com.mike.scrapescheduler.entity.ScrapedData;
import com.mike.scrapescheduler.repository.ScrapedDataRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class ScrapedDataService {

    private static final int MAX_LIMIT = 1000;

    private final ScrapedDataRepository repository;

    /**
     * Newest first, {@code limit} rows starting at row {@code offset}.
     */
    public ScrapedDataPage list(Long scraperId, int limit, int offset) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new ValidationException("limit must be between 1 and " + MAX_LIMIT);
        }
        if (offset < 0) {
            throw new ValidationException("offset must be >= 0");
        }

        List<ScrapedData> data = scraperId == null
                ? repository.findLatest(limit, offset)
                : repository.findLatestByScraperId(scraperId, limit, offset);
        long total = scraperId == null ? repository.count() : repository.countByScraperId(scraperId);

        return new ScrapedDataPage(data, total);
    }
}
