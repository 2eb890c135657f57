package com.mike.scrapescheduler.dto;

import com.mike.scrapescheduler.entity.FieldValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ExtractionResult(Map<String, FieldValue> fields, List<ExtractionError> errors) {

    public ExtractionResult {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        errors = List.copyOf(errors);
    }

    public static ExtractionResult empty() {
        return new ExtractionResult(Map.of(), List.of());
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
