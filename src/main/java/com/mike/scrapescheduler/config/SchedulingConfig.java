package com.mike.scrapescheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
@Slf4j
public class SchedulingConfig {

    @Bean
    public ThreadPoolTaskScheduler scrapeTaskScheduler(SchedulerProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.poolSize());
        scheduler.setThreadNamePrefix("scrape-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        // in-flight runs finish on shutdown, pending fires are dropped
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        log.info("SchedulingConfig: task scheduler poolSize={}, zone={}", properties.poolSize(), properties.zone());
        return scheduler;
    }

    @Bean
    public Clock schedulerClock(SchedulerProperties properties) {
        return Clock.system(properties.zone());
    }
}
