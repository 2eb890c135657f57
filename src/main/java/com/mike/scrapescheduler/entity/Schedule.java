package com.mike.scrapescheduler.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "schedules")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
public class Schedule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * Scraper to run on each fire. A schedule without one only keeps its nextRun up to date.
     */
    @Column(name = "scraper_id")
    private Long scraperId;

    @Column(nullable = false)
    private String name;

    /**
     * hourly | daily | weekly | monthly | cron
     */
    @Column(nullable = false, length = 20)
    private String frequency;

    /**
     * Wins over frequency when present.
     */
    @Column(name = "cron_expression", length = 120)
    private String cronExpression;

    @Column(name = "next_run")
    private LocalDateTime nextRun;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = LocalDateTime.now();
    }
}
