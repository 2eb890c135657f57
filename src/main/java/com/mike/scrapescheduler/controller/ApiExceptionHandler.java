package com.mike.scrapescheduler.controller;

import com.mike.scrapescheduler.service.NotFoundException;
import com.mike.scrapescheduler.service.ValidationException;
import com.mike.scrapescheduler.service.fetch.FetchException;
import com.mike.scrapescheduler.service.schedule.InvalidRecurrenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler({ValidationException.class, InvalidRecurrenceException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(RuntimeException ex) {
        return ResponseEntity.badRequest()
                .body(Map.of("error", "invalid_request", "message", ex.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.badRequest()
                .body(Map.of("error", "invalid_request", "message", "Malformed request body"));
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(NotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", "not_found", "message", ex.getMessage()));
    }

    @ExceptionHandler(FetchException.class)
    public ResponseEntity<Map<String, String>> handleFetch(FetchException ex) {
        log.warn("ApiExceptionHandler: fetch failed: {}", ex.getMessage());
        return ResponseEntity.internalServerError()
                .body(Map.of("error", "fetch_failed", "message", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleOther(Exception ex) {
        log.error("ApiExceptionHandler: unhandled error: {}", ex.getMessage(), ex);
        return ResponseEntity.internalServerError()
                .body(Map.of("error", "internal_error", "message", String.valueOf(ex.getMessage())));
    }
}
