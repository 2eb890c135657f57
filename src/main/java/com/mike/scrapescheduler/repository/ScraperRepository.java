package com.mike.scrapescheduler.repository;

import com.mike.scrapescheduler.entity.Scraper;
import com.mike.scrapescheduler.entity.ScraperStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

public interface ScraperRepository extends JpaRepository<Scraper, Long> {

    List<Scraper> findAllByOrderByCreatedAtDesc();

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update Scraper s set s.status = :status where s.id = :id")
    int updateStatus(@Param("id") Long id, @Param("status") ScraperStatus status);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update Scraper s set s.status = :status, s.lastRun = :lastRun where s.id = :id")
    int markRunning(@Param("id") Long id, @Param("status") ScraperStatus status, @Param("lastRun") LocalDateTime lastRun);
}
