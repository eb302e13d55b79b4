package com.kidsactivity.ingest.model;

import java.util.List;

/**
 * Results of a pooled batch, in input order, plus how many items fell back after a failure.
 */
public record WorkResult<R>(List<R> results, int failures) {
}
