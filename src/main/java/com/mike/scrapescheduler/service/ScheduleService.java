package com.mike.scrapescheduler.service;

import com.mike.scrapescheduler.dto.ScheduleRequest;
import com.mike.scrapescheduler.entity.Schedule;
import com.mike.scrapescheduler.repository.ScheduleRepository;
import com.mike.scrapescheduler.service.schedule.RecurrenceResolver;
import com.mike.scrapescheduler.service.schedule.ScheduleManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Schedule CRUD that keeps the live timers in step with what is stored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScheduleService {

    private final ScheduleRepository repository;
    private final RecurrenceResolver recurrenceResolver;
    private final ScheduleManager scheduleManager;

    public List<Schedule> list() {
        return repository.findAllByOrderByCreatedAtDesc();
    }

    public Schedule get(Long id) {
        return repository.findById(id).orElseThrow(() -> NotFoundException.schedule(id));
    }

    public Schedule create(ScheduleRequest request) {
        if (request == null || request.name() == null || request.name().isBlank()) {
            throw new ValidationException("name is required");
        }
        if (request.frequency() == null || request.frequency().isBlank()) {
            throw new ValidationException("frequency is required");
        }

        Schedule schedule = Schedule.builder()
                .scraperId(request.scraperId())
                .name(request.name().trim())
                .frequency(request.frequency().trim())
                .cronExpression(blankToNull(request.cronExpression()))
                .active(request.active() == null || request.active())
                .build();

        // reject bad recurrences before anything is stored
        recurrenceResolver.resolveExpression(schedule);

        Schedule saved = repository.save(schedule);
        scheduleManager.register(saved);
        return saved;
    }

    public Schedule update(Long id, ScheduleRequest request) {
        Schedule schedule = get(id);
        if (request == null) return schedule;

        if (request.scraperId() != null) schedule.setScraperId(request.scraperId());
        if (request.name() != null && !request.name().isBlank()) schedule.setName(request.name().trim());
        if (request.frequency() != null && !request.frequency().isBlank()) schedule.setFrequency(request.frequency().trim());
        if (request.cronExpression() != null) schedule.setCronExpression(blankToNull(request.cronExpression()));
        if (request.active() != null) schedule.setActive(request.active());

        recurrenceResolver.resolveExpression(schedule);

        Schedule saved = repository.save(schedule);
        scheduleManager.register(saved);
        return saved;
    }

    public void delete(Long id) {
        scheduleManager.stop(id);
        if (!repository.existsById(id)) {
            throw NotFoundException.schedule(id);
        }
        repository.deleteById(id);
        log.info("ScheduleService: deleted schedule id={}", id);
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s.trim();
    }
}
