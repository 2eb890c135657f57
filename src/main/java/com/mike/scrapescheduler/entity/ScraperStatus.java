package com.mike.scrapescheduler.entity;

public enum ScraperStatus {
    INACTIVE, ACTIVE, RUNNING, COMPLETED, FAILED, TESTING
}
