package com.mike.scrapescheduler.service.schedule;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Supplier;

/**
 * Live timers by schedule id, at most one per id.
 * <p>
 * Cancelling never interrupts a run that is already executing.
 */
@Component
@Slf4j
public class ScheduledTaskRegistry {

    private final ConcurrentMap<Long, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

    /**
     * Cancels the current timer for {@code id} (if any) and installs the one created by
     * {@code installer}, atomically for that id. If the installer fails, no timer is left for the id.
     */
    public void replace(Long id, Supplier<ScheduledFuture<?>> installer) {
        RuntimeException[] failure = new RuntimeException[1];

        tasks.compute(id, (key, previous) -> {
            if (previous != null) {
                previous.cancel(false);
                log.debug("ScheduledTaskRegistry: cancelled previous timer for id={}", key);
            }
            try {
                return installer.get();
            } catch (RuntimeException e) {
                failure[0] = e;
                return null;
            }
        });

        if (failure[0] != null) {
            throw failure[0];
        }
    }

    /**
     * @return true if a timer was cancelled
     */
    public boolean cancel(Long id) {
        boolean[] cancelled = new boolean[1];
        tasks.computeIfPresent(id, (key, future) -> {
            future.cancel(false);
            cancelled[0] = true;
            return null;
        });
        return cancelled[0];
    }

    public void cancelAll() {
        tasks.keySet().forEach(this::cancel);
    }

    public boolean contains(Long id) {
        return tasks.containsKey(id);
    }

    public Set<Long> ids() {
        return Set.copyOf(tasks.keySet());
    }

    public int size() {
        return tasks.size();
    }
}
