package com.mike.scrapescheduler.service.schedule;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Named frequencies and the fixed Spring cron expression each one maps to.
 */
public enum Frequency {
    HOURLY("0 0 * * * *"),
    DAILY("0 0 9 * * *"),
    WEEKLY("0 0 9 * * MON"),
    MONTHLY("0 0 9 1 * *"),
    // explicit expression only
    CRON(null);

    private final String expression;

    Frequency(String expression) {
        this.expression = expression;
    }

    public Optional<String> expression() {
        return Optional.ofNullable(expression);
    }

    public static Optional<Frequency> fromName(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(f -> f.name().equals(normalized))
                .findFirst();
    }
}
