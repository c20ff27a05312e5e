package com.pwn.writeups.crawl.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public record CrawlRunSummary(
    Instant startedAt,
    Instant finishedAt,
    String status,
    String indexUrl,
    @JsonIgnore List<RowOutcome> outcomes
) {
    public static final String COMPLETED = "COMPLETED";
    public static final String COMPLETED_WITH_ERRORS = "COMPLETED_WITH_ERRORS";

    @JsonProperty("records")
    public List<ResolvedRecord> records() {
        return outcomes.stream()
            .filter(RowOutcome.Resolved.class::isInstance)
            .map(outcome -> ((RowOutcome.Resolved) outcome).record())
            .toList();
    }

    @JsonProperty("failures")
    public List<RowFailure> failures() {
        return outcomes.stream()
            .filter(RowOutcome.Failed.class::isInstance)
            .map(outcome -> RowFailure.from((RowOutcome.Failed) outcome))
            .toList();
    }

    @JsonProperty("rowCount")
    public int rowCount() {
        return outcomes.size();
    }

    @JsonProperty("durationMs")
    public long durationMs() {
        return Duration.between(startedAt, finishedAt).toMillis();
    }
}
