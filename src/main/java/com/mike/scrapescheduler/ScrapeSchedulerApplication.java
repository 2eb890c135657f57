package com.mike.scrapescheduler;

import com.mike.scrapescheduler.config.SchedulerProperties;
import com.mike.scrapescheduler.config.ScraperProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({ScraperProperties.class, SchedulerProperties.class})
public class ScrapeSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScrapeSchedulerApplication.class, args);
    }

}
