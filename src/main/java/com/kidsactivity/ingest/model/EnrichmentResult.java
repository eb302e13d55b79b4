package com.kidsactivity.ingest.model;

import java.util.List;

public record EnrichmentResult(List<ActivityCandidate> candidates, int errors) {
}
