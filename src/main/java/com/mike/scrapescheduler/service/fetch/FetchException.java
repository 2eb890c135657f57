package com.mike.scrapescheduler.service.fetch;

import java.util.List;
import java.util.stream.Collectors;

public class FetchException extends RuntimeException {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Every strategy failed. The first failure is the cause, the others are suppressed.
     */
    public static FetchException exhausted(String url, List<FetchResult.Failure> failures) {
        String reasons = failures.stream()
                .map(f -> f.method() + ": " + f.error().getMessage())
                .collect(Collectors.joining("; "));

        FetchException ex = new FetchException(
                "All fetch strategies failed for " + url + " [" + reasons + "]",
                failures.isEmpty() ? null : failures.get(0).error());
        for (int i = 1; i < failures.size(); i++) {
            ex.addSuppressed(failures.get(i).error());
        }
        return ex;
    }
}
