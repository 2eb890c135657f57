package com.mike.scrapescheduler.entity;

import com.mike.scrapescheduler.entity.converter.FieldMapConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * One page worth of extracted fields. Written once, never updated.
 */
@Entity
@Table(name = "scraped_data", indexes = @Index(name = "idx_scraped_data_scraper", columnList = "scraper_id"))
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScrapedData {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "scraper_id", nullable = false, updatable = false)
    private Long scraperId;

    @Column(nullable = false, updatable = false, length = 2048)
    private String url;

    @Convert(converter = FieldMapConverter.class)
    @Column(name = "field_data", nullable = false, updatable = false, columnDefinition = "text")
    private Map<String, FieldValue> data;

    @Column(name = "scraped_at", nullable = false, updatable = false)
    private LocalDateTime scrapedAt;

    @PrePersist
    void prePersist() {
        if (scrapedAt == null) scrapedAt = LocalDateTime.now();
    }
}
