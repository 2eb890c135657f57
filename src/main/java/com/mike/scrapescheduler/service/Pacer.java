package com.mike.scrapescheduler.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Blocking wait between two page fetches of the same run.
 */
@Component
@Slf4j
public class Pacer {

    public void pause(int seconds) {
        if (seconds <= 0) return;
        try {
            Thread.sleep(seconds * 1000L);
        } catch (InterruptedException e) {
            log.debug("Pacer: interrupted during {}s pause", seconds);
            Thread.currentThread().interrupt();
        }
    }
}
