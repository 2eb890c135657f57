package com.mike.scrapescheduler.service;

public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
