package com.mike.scrapescheduler.service;

public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException scraper(Long id) {
        return new NotFoundException("Scraper not found: " + id);
    }

    public static NotFoundException schedule(Long id) {
        return new NotFoundException("Schedule not found: " + id);
    }
}
