package com.mike.scrapescheduler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

/**
 * @param poolSize          timer threads, i.e. how many scheduled runs may execute at once
 * @param zone              zone used for cron evaluation and persisted fire times
 * @param initializeOnStartup register all active schedules when the application starts
 */
@ConfigurationProperties(prefix = "scrapescheduler.scheduler")
public record SchedulerProperties(
        int poolSize,
        ZoneId zone,
        boolean initializeOnStartup
) {
    public SchedulerProperties {
        if (poolSize <= 0) poolSize = 4;
        if (zone == null) zone = ZoneId.systemDefault();
    }
}
