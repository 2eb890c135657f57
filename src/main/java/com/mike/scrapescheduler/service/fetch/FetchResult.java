package com.mike.scrapescheduler.service.fetch;

import com.mike.scrapescheduler.entity.FetchMethod;

import java.util.List;

/**
 * Outcome of trying the fetch strategies in order: the markup and the strategy that produced it,
 * plus every failure seen before that (all of them when nothing succeeded).
 */
public record FetchResult(String url, String markup, FetchMethod fetchedWith, List<Failure> failures) {

    public FetchResult {
        failures = List.copyOf(failures);
    }

    public static FetchResult success(String url, FetchMethod method, String markup, List<Failure> failures) {
        return new FetchResult(url, markup, method, failures);
    }

    public static FetchResult failed(String url, List<Failure> failures) {
        return new FetchResult(url, null, null, failures);
    }

    public boolean succeeded() {
        return fetchedWith != null;
    }

    public String markupOrThrow() {
        if (succeeded()) return markup;
        throw FetchException.exhausted(url, failures);
    }

    public record Failure(FetchMethod method, RuntimeException error) {
    }
}
