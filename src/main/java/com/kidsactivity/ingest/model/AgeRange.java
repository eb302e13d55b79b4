package com.kidsactivity.ingest.model;

/**
 * Age bounds in whole years. A null bound is unbounded.
 */
public record AgeRange(Integer min, Integer max) {

    public static AgeRange atLeast(int min) {
        return new AgeRange(min, null);
    }
}
