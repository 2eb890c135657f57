package com.mike.scrapescheduler.service.schedule;

import com.mike.scrapescheduler.config.SchedulerProperties;
import com.mike.scrapescheduler.entity.Schedule;
import com.mike.scrapescheduler.repository.ScheduleRepository;
import com.mike.scrapescheduler.service.NotFoundException;
import com.mike.scrapescheduler.service.ScraperRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.support.CronTrigger;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

class ScheduleManagerTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 1, 10, 0);

    private ScheduleRepository scheduleRepository;
    private ScraperRunner scraperRunner;
    private TaskScheduler taskScheduler;
    private ScheduledTaskRegistry registry;
    private ScheduleManager manager;

    private final List<ScheduledFuture<?>> issuedTimers = new ArrayList<>();

    @BeforeEach
    void setUp() {
        scheduleRepository = mock(ScheduleRepository.class);
        scraperRunner = mock(ScraperRunner.class);
        taskScheduler = mock(TaskScheduler.class);
        registry = new ScheduledTaskRegistry();

        when(taskScheduler.schedule(any(Runnable.class), any(Trigger.class))).thenAnswer(inv -> {
            ScheduledFuture<?> future = mock(ScheduledFuture.class);
            issuedTimers.add(future);
            return future;
        });
        when(scheduleRepository.updateNextRun(anyLong(), any())).thenReturn(1);

        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        manager = new ScheduleManager(
                scheduleRepository,
                scraperRunner,
                new RecurrenceResolver(),
                taskScheduler,
                registry,
                new SchedulerProperties(2, ZoneOffset.UTC, true),
                clock
        );
    }

    private static Schedule schedule(long id, Long scraperId, String frequency, String cron) {
        return Schedule.builder()
                .id(id)
                .scraperId(scraperId)
                .name("schedule-" + id)
                .frequency(frequency)
                .cronExpression(cron)
                .active(true)
                .createdAt(NOW.minusDays(1))
                .build();
    }

    private long liveTimers() {
        return issuedTimers.stream().filter(f -> !wasCancelled(f)).count();
    }

    private static boolean wasCancelled(ScheduledFuture<?> future) {
        return mockingDetails(future).getInvocations().stream()
                .anyMatch(i -> i.getMethod().getName().equals("cancel"));
    }

    @Test
    @DisplayName("register twice for the same id -> one live timer")
    void register_is_idempotent() {
        Schedule s = schedule(1L, 10L, "daily", null);

        manager.register(s);
        manager.register(s);
        manager.register(s);

        assertEquals(Set.of(1L), manager.scheduledIds());
        assertEquals(3, issuedTimers.size());
        assertEquals(1, liveTimers());
        verify(issuedTimers.get(0)).cancel(false);
        verify(issuedTimers.get(1)).cancel(false);
    }

    @Test
    @DisplayName("register persists the next fire time and uses the resolved cron")
    void register_persists_next_run() {
        Schedule s = schedule(1L, 10L, "daily", null);

        manager.register(s);

        ArgumentCaptor<Trigger> trigger = ArgumentCaptor.forClass(Trigger.class);
        verify(taskScheduler).schedule(any(Runnable.class), trigger.capture());
        assertEquals("0 0 9 * * *", ((CronTrigger) trigger.getValue()).getExpression());

        verify(scheduleRepository).updateNextRun(1L, LocalDateTime.of(2024, 1, 2, 9, 0));
        assertEquals(LocalDateTime.of(2024, 1, 2, 9, 0), s.getNextRun());
    }

    @Test
    @DisplayName("invalid recurrence -> exception, existing timer untouched")
    void register_invalid_recurrence() {
        manager.register(schedule(1L, 10L, "daily", null));

        Schedule broken = schedule(1L, 10L, "fortnightly", null);
        assertThrows(InvalidRecurrenceException.class, () -> manager.register(broken));

        assertEquals(1, issuedTimers.size());
        assertEquals(1, liveTimers());
        assertTrue(manager.isScheduled(1L));
    }

    @Test
    @DisplayName("inactive schedule is not registered and loses its timer")
    void register_inactive() {
        manager.register(schedule(1L, 10L, "daily", null));

        Schedule inactive = schedule(1L, 10L, "daily", null);
        inactive.setActive(false);
        manager.register(inactive);

        assertFalse(manager.isScheduled(1L));
        assertEquals(0, liveTimers());
    }

    @Test
    @DisplayName("initialize registers every active schedule and isolates failures")
    void initialize_isolates_failures() {
        when(scheduleRepository.findByActiveTrue()).thenReturn(List.of(
                schedule(1L, 10L, "hourly", null),
                schedule(2L, 11L, "bogus", null),
                schedule(3L, null, "cron", "*/5 * * * *")
        ));

        int registered = manager.initialize();

        assertEquals(2, registered);
        assertEquals(Set.of(1L, 3L), manager.scheduledIds());
        assertEquals(2, liveTimers());
    }

    @Test
    @DisplayName("stop of an unknown id is a no-op")
    void stop_unknown() {
        assertDoesNotThrow(() -> manager.stop(99L));
        assertTrue(manager.scheduledIds().isEmpty());
    }

    @Test
    @DisplayName("pause then resume -> exactly one live timer and active=true persisted")
    void pause_then_resume() {
        Schedule s = schedule(1L, 10L, "daily", null);
        manager.register(s);

        when(scheduleRepository.updateActive(1L, false)).thenReturn(1);
        when(scheduleRepository.updateActive(1L, true)).thenReturn(1);
        when(scheduleRepository.findById(1L)).thenReturn(Optional.of(s));

        manager.pause(1L);
        assertFalse(manager.isScheduled(1L));
        assertEquals(0, liveTimers());

        manager.resume(1L);

        assertTrue(manager.isScheduled(1L));
        assertEquals(1, liveTimers());
        verify(scheduleRepository).updateActive(1L, false);
        verify(scheduleRepository).updateActive(1L, true);
    }

    @Test
    @DisplayName("pause racing a resume never leaves a timer on a paused schedule")
    void pause_during_resume_leaves_no_timer() throws Exception {
        Schedule stale = schedule(1L, 10L, "daily", null);
        CountDownLatch reloading = new CountDownLatch(1);
        CountDownLatch pauseDone = new CountDownLatch(1);

        when(scheduleRepository.updateActive(1L, true)).thenReturn(1);
        when(scheduleRepository.updateActive(1L, false)).thenReturn(1);
        when(scheduleRepository.findById(1L)).thenAnswer(inv -> {
            reloading.countDown();
            // gives a concurrent pause the chance to slip in before the timer is installed
            pauseDone.await(300, TimeUnit.MILLISECONDS);
            return Optional.of(stale);
        });

        Thread resumer = new Thread(() -> manager.resume(1L));
        Thread pauser = new Thread(() -> {
            try {
                reloading.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            manager.pause(1L);
            pauseDone.countDown();
        });

        resumer.start();
        pauser.start();
        resumer.join(5000);
        pauser.join(5000);

        verify(scheduleRepository).updateActive(1L, false);
        assertFalse(manager.isScheduled(1L));
        assertEquals(0, liveTimers());
    }

    @Test
    @DisplayName("resume of a missing schedule -> NotFoundException, no timer")
    void resume_missing() {
        when(scheduleRepository.updateActive(5L, true)).thenReturn(0);

        assertThrows(NotFoundException.class, () -> manager.resume(5L));
        assertFalse(manager.isScheduled(5L));
    }

    @Test
    @DisplayName("pause of a missing schedule -> NotFoundException")
    void pause_missing() {
        when(scheduleRepository.updateActive(5L, false)).thenReturn(0);
        assertThrows(NotFoundException.class, () -> manager.pause(5L));
    }

    @Test
    @DisplayName("fire runs the scraper then stores the next fire time")
    void fire_runs_scraper() {
        Schedule s = schedule(1L, 10L, "daily", null);
        when(scheduleRepository.findById(1L)).thenReturn(Optional.of(s));
        manager.register(s);

        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).schedule(task.capture(), any(Trigger.class));
        clearInvocations(scheduleRepository);

        task.getValue().run();

        verify(scraperRunner).runScraper(10L);
        verify(scheduleRepository).updateNextRun(1L, LocalDateTime.of(2024, 1, 2, 9, 0));
    }

    @Test
    @DisplayName("failing run is swallowed by the timer, nextRun still updated")
    void fire_survives_failing_run() {
        Schedule s = schedule(1L, 10L, "daily", null);
        when(scheduleRepository.findById(1L)).thenReturn(Optional.of(s));
        when(scraperRunner.runScraper(10L)).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(() -> manager.fire(1L, "schedule-1", 10L));

        verify(scheduleRepository).updateNextRun(1L, LocalDateTime.of(2024, 1, 2, 9, 0));
        verifyNoInteractions(taskScheduler);
    }

    @Test
    @DisplayName("schedule without scraper only refreshes nextRun")
    void fire_without_scraper() {
        Schedule s = schedule(1L, null, "hourly", null);
        when(scheduleRepository.findById(1L)).thenReturn(Optional.of(s));

        manager.fire(1L, "schedule-1", null);

        verifyNoInteractions(scraperRunner);
        verify(scheduleRepository).updateNextRun(1L, LocalDateTime.of(2024, 1, 1, 11, 0));
    }

    @Test
    @DisplayName("shutdown cancels every timer")
    void shutdown() {
        manager.register(schedule(1L, 10L, "daily", null));
        manager.register(schedule(2L, 11L, "weekly", null));

        manager.shutdown();

        assertTrue(manager.scheduledIds().isEmpty());
        assertEquals(0, liveTimers());
    }
}
