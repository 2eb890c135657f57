package com.mike.scrapescheduler.service.schedule;

public class InvalidRecurrenceException extends RuntimeException {

    public InvalidRecurrenceException(String message) {
        super(message);
    }

    public InvalidRecurrenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
