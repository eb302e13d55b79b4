package com.kidsactivity.ingest.enums;

public enum ScrapeRunStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
