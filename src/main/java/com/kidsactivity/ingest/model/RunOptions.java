package com.kidsactivity.ingest.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-invocation knobs for a pipeline run.
 */
@Value
@Builder
public class RunOptions {
    @Builder.Default
    int concurrency = 3;
    @Builder.Default
    boolean headless = true;
}
