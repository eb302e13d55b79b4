package com.kidsactivity.ingest.navigator;

import com.kidsactivity.ingest.entity.Provider;
import com.kidsactivity.ingest.model.EnumerationResult;
import com.microsoft.playwright.Page;

/**
 * Walks a provider's listing site and returns every leaf entry it can reach.
 */
public interface ListingNavigator {

    /**
     * Groups or entries that fail after the listing loaded are counted in the result, not thrown.
     *
     * @throws com.kidsactivity.ingest.exception.NavigationException if the listing cannot be loaded
     */
    EnumerationResult enumerate(Page page, Provider provider);
}
