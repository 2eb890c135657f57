package com.mike.scrapescheduler.dto;

import com.mike.scrapescheduler.entity.ScraperStatus;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
public class RunSummary {
    Long scraperId;
    ScraperStatus status;

    int pagesPlanned;
    int pagesSaved;
    int pagesFailed;
    int fieldErrors;

    LocalDateTime startedAt;
    LocalDateTime finishedAt;

    public String toLogLine() {
        return "scraperId=" + scraperId +
                " status=" + status +
                " pagesPlanned=" + pagesPlanned +
                " pagesSaved=" + pagesSaved +
                " pagesFailed=" + pagesFailed +
                " fieldErrors=" + fieldErrors +
                " startedAt=" + startedAt +
                " finishedAt=" + finishedAt;
    }
}
