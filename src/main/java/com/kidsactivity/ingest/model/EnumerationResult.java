package com.kidsactivity.ingest.model;

import java.util.List;

/**
 * Entries harvested from the listing tree. {@code failedGroups} counts categories and subcategories
 * that failed or were cut at the page cap; {@code unreadableEntries} counts rows that threw.
 */
public record EnumerationResult(List<RawListing> listings, int failedGroups, int unreadableEntries) {

    public boolean isComplete() {
        return failedGroups == 0 && unreadableEntries == 0;
    }

    public int failures() {
        return failedGroups + unreadableEntries;
    }
}
