package com.mike.scrapescheduler.dto;

/**
 * Create or partial-update payload. Null fields are left untouched on update.
 */
public record ScheduleRequest(
        Long scraperId,
        String name,
        String frequency,
        String cronExpression,
        Boolean active
) {
}
