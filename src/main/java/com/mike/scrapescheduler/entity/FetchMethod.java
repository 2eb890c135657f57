package com.mike.scrapescheduler.entity;

public enum FetchMethod {
    /**
     * Headless browser, scripts executed. Falls back to {@link #LIGHTWEIGHT} on failure.
     */
    RENDERED,
    /**
     * Plain HTTP GET, no scripts.
     */
    LIGHTWEIGHT
}
