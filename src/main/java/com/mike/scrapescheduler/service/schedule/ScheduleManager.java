package com.mike.scrapescheduler.service.schedule;

import com.mike.scrapescheduler.config.SchedulerProperties;
import com.mike.scrapescheduler.entity.Schedule;
import com.mike.scrapescheduler.repository.ScheduleRepository;
import com.mike.scrapescheduler.service.NotFoundException;
import com.mike.scrapescheduler.service.ScraperRunner;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Owns the cron timers of all active schedules.
 * <p>
 * Each schedule id has at most one live timer, and only active schedules have one. A fire runs
 * the schedule's scraper and then stores the next fire time; failures are logged and the timer
 * keeps going. Stopping a timer does not interrupt a run already in progress.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduleManager {

    private final ScheduleRepository scheduleRepository;
    private final ScraperRunner scraperRunner;
    private final RecurrenceResolver recurrenceResolver;
    private final TaskScheduler taskScheduler;
    private final ScheduledTaskRegistry registry;
    private final SchedulerProperties properties;
    private final Clock clock;

    // per-id monitors serializing register/stop/pause/resume of the same schedule
    private final ConcurrentMap<Long, Object> locks = new ConcurrentHashMap<>();

    /**
     * Registers every active schedule found in storage. One bad schedule does not stop the others.
     *
     * @return number of schedules registered
     */
    public int initialize() {
        List<Schedule> schedules = scheduleRepository.findByActiveTrue();
        log.info("ScheduleManager: initializing {} active schedule(s)", schedules.size());

        int registered = 0;
        int failed = 0;
        for (Schedule schedule : schedules) {
            try {
                register(schedule);
                registered++;
            } catch (Exception e) {
                failed++;
                log.error("ScheduleManager: could not register schedule id={} name='{}': {}",
                        schedule.getId(), schedule.getName(), e.getMessage());
            }
        }

        log.info("ScheduleManager: initialized registered={}, failed={}", registered, failed);
        return registered;
    }

    /**
     * Installs the timer for {@code schedule}, replacing any existing one for the same id.
     * An inactive schedule only has its timer removed.
     *
     * @throws InvalidRecurrenceException if the recurrence cannot be resolved; an existing timer is kept
     */
    public void register(Schedule schedule) {
        Long id = schedule.getId();
        if (id == null) {
            throw new IllegalArgumentException("Schedule must be saved before it can be registered");
        }

        synchronized (lockFor(id)) {
            install(schedule);
        }
    }

    private void install(Schedule schedule) {
        Long id = schedule.getId();
        if (!schedule.isActive()) {
            log.info("ScheduleManager: schedule id={} is inactive, not registering", id);
            stop(id);
            return;
        }

        String expression = recurrenceResolver.resolveExpression(schedule);
        LocalDateTime nextRun = recurrenceResolver.nextFireTime(schedule, now());

        CronTrigger trigger = new CronTrigger(expression, properties.zone());
        Long scraperId = schedule.getScraperId();
        String name = schedule.getName();

        registry.replace(id, () -> taskScheduler.schedule(() -> fire(id, name, scraperId), trigger));

        schedule.setNextRun(nextRun);
        scheduleRepository.updateNextRun(id, nextRun);

        log.info("ScheduleManager: registered schedule id={} name='{}' cron='{}' scraperId={} nextRun={}",
                id, name, expression, scraperId, nextRun);
    }

    public void stop(Long id) {
        synchronized (lockFor(id)) {
            if (registry.cancel(id)) {
                log.info("ScheduleManager: stopped timer for schedule id={}", id);
            }
        }
    }

    public void pause(Long id) {
        synchronized (lockFor(id)) {
            int updated = scheduleRepository.updateActive(id, false);
            stop(id);
            if (updated == 0) {
                throw NotFoundException.schedule(id);
            }
        }
        log.info("ScheduleManager: paused schedule id={}", id);
    }

    /**
     * Persists active=true, reloads and registers. Holds the schedule's lock throughout so a
     * concurrent {@link #pause} either runs first or cancels the timer installed here.
     */
    public void resume(Long id) {
        synchronized (lockFor(id)) {
            int updated = scheduleRepository.updateActive(id, true);
            if (updated == 0) {
                throw NotFoundException.schedule(id);
            }
            Schedule schedule = scheduleRepository.findById(id)
                    .orElseThrow(() -> NotFoundException.schedule(id));
            install(schedule);
        }
        log.info("ScheduleManager: resumed schedule id={}", id);
    }

    public boolean isScheduled(Long id) {
        return registry.contains(id);
    }

    public Set<Long> scheduledIds() {
        return registry.ids();
    }

    @PreDestroy
    public void shutdown() {
        log.info("ScheduleManager: cancelling {} timer(s)", registry.size());
        registry.cancelAll();
    }

    void fire(Long id, String name, Long scraperId) {
        log.info("ScheduleManager: running scheduled task id={} name='{}'", id, name);

        if (scraperId != null) {
            try {
                scraperRunner.runScraper(scraperId);
            } catch (Exception e) {
                log.error("ScheduleManager: scheduled run failed id={} scraperId={}: {}", id, scraperId, e.getMessage(), e);
            }
        } else {
            log.info("ScheduleManager: schedule id={} has no scraper, nothing to run", id);
        }

        try {
            Schedule current = scheduleRepository.findById(id).orElse(null);
            if (current == null) {
                log.warn("ScheduleManager: schedule id={} no longer exists, leaving nextRun untouched", id);
                return;
            }
            LocalDateTime nextRun = recurrenceResolver.nextFireTime(current, now());
            scheduleRepository.updateNextRun(id, nextRun);
            log.debug("ScheduleManager: schedule id={} nextRun={}", id, nextRun);
        } catch (Exception e) {
            log.error("ScheduleManager: could not update nextRun for schedule id={}: {}", id, e.getMessage(), e);
        }
    }

    private Object lockFor(Long id) {
        return locks.computeIfAbsent(id, k -> new Object());
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
