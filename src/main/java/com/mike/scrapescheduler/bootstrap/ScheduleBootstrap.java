package com.mike.scrapescheduler.bootstrap;

import com.mike.scrapescheduler.config.SchedulerProperties;
import com.mike.scrapescheduler.service.schedule.ScheduleManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class ScheduleBootstrap implements ApplicationRunner {

    private final ScheduleManager scheduleManager;
    private final SchedulerProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.initializeOnStartup()) {
            log.info("ScheduleBootstrap: disabled via scrapescheduler.scheduler.initialize-on-startup=false");
            return;
        }

        try {
            int registered = scheduleManager.initialize();
            log.info("ScheduleBootstrap: {} schedule(s) live", registered);
        } catch (Exception e) {
            // storage unreachable at startup; the app stays up and schedules can be resumed later
            log.error("ScheduleBootstrap: loading schedules failed: {}", e.getMessage(), e);
        }
    }
}
