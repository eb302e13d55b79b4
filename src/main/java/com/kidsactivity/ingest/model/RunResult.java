package com.kidsactivity.ingest.model;

import com.kidsactivity.ingest.entity.Activity;
import com.kidsactivity.ingest.enums.ScrapeRunStatus;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one run, owned by whoever called {@code run}.
 */
@Value
@Builder
public class RunResult {
    Long scrapeRunId;
    ScrapeRunStatus status;
    String errorMessage;
    RunStats stats;
    List<Activity> activities;

    public boolean isSuccess() {
        return status == ScrapeRunStatus.COMPLETED;
    }
}
