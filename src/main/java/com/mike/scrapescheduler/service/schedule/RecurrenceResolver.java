package com.mike.scrapescheduler.service.schedule;

import com.mike.scrapescheduler.entity.Schedule;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Maps a schedule's recurrence policy to a Spring cron expression and to concrete fire times.
 * <p>
 * An explicit cron expression always wins over the named frequency. Five-field expressions
 * (minute hour day-of-month month day-of-week) are accepted and get a leading seconds field.
 * Stateless; every method is a pure function of its arguments.
 */
@Component
public class RecurrenceResolver {

    public String resolveExpression(Schedule schedule) {
        String explicit = schedule.getCronExpression();
        if (explicit != null && !explicit.isBlank()) {
            return normalize(explicit);
        }

        String frequency = schedule.getFrequency();
        return Frequency.fromName(frequency)
                .flatMap(Frequency::expression)
                .orElseThrow(() -> new InvalidRecurrenceException(
                        "Unknown frequency '" + frequency + "' and no cron expression given"));
    }

    /**
     * First fire time strictly after {@code from}.
     */
    public LocalDateTime nextFireTime(Schedule schedule, LocalDateTime from) {
        String expression = resolveExpression(schedule);
        LocalDateTime next = CronExpression.parse(expression).next(from);
        if (next == null) {
            throw new InvalidRecurrenceException("Cron expression never fires after " + from + ": " + expression);
        }
        return next;
    }

    String normalize(String raw) {
        String trimmed = raw.trim().replaceAll("\\s+", " ");
        int fields = trimmed.split(" ").length;

        String expression = trimmed.startsWith("@") ? trimmed : switch (fields) {
            case 5 -> "0 " + trimmed;
            case 6 -> trimmed;
            default -> throw new InvalidRecurrenceException(
                    "Cron expression must have 5 or 6 fields, got " + fields + ": " + raw);
        };

        if (!CronExpression.isValidExpression(expression)) {
            throw new InvalidRecurrenceException("Invalid cron expression: " + raw);
        }
        return expression;
    }
}
