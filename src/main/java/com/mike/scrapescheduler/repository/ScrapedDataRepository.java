package com.mike.scrapescheduler.repository;

import com.mike.scrapescheduler.entity.ScrapedData;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ScrapedDataRepository extends JpaRepository<ScrapedData, Long> {

    /**
     * Newest first, skipping exactly {@code offset} rows.
     */
    @Query(value = """
            SELECT * FROM scraped_data
            WHERE scraper_id = :scraperId
            ORDER BY scraped_at DESC, id DESC
            LIMIT :limit OFFSET :offset
            """, nativeQuery = true)
    List<ScrapedData> findLatestByScraperId(@Param("scraperId") Long scraperId,
                                            @Param("limit") int limit,
                                            @Param("offset") int offset);

    @Query(value = """
            SELECT * FROM scraped_data
            ORDER BY scraped_at DESC, id DESC
            LIMIT :limit OFFSET :offset
            """, nativeQuery = true)
    List<ScrapedData> findLatest(@Param("limit") int limit, @Param("offset") int offset);

    long countByScraperId(Long scraperId);
}
