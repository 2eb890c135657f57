package com.mike.scrapescheduler.dto;

/**
 * A selector that could not be evaluated. Only its own field is affected.
 */
public record ExtractionError(String field, String selector, String message) {
}
