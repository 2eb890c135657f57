package com.mike.scrapescheduler.entity;

import com.mike.scrapescheduler.entity.converter.SelectorMapConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Entity
@Table(name = "scrapers")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Scraper {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    /**
     * May contain a {page} token, expanded up to maxPages.
     */
    @Column(nullable = false, length = 2048)
    private String url;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private FetchMethod method = FetchMethod.RENDERED;

    /**
     * field name -> CSS selector, in declaration order.
     */
    @Convert(converter = SelectorMapConverter.class)
    @Column(nullable = false, columnDefinition = "text")
    @Builder.Default
    private Map<String, String> selectors = new LinkedHashMap<>();

    @Column(name = "delay_seconds", nullable = false)
    @Builder.Default
    private int delaySeconds = 2;

    @Column(name = "max_pages", nullable = false)
    @Builder.Default
    private int maxPages = 100;

    // not enforced, pages are fetched one after another
    @Column(name = "concurrent_requests", nullable = false)
    @Builder.Default
    private int concurrentRequests = 1;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private ScraperStatus status = ScraperStatus.INACTIVE;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "last_run")
    private LocalDateTime lastRun;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = LocalDateTime.now();
        if (method == null) method = FetchMethod.RENDERED;
        if (status == null) status = ScraperStatus.INACTIVE;
        if (selectors == null) selectors = new LinkedHashMap<>();
    }
}
