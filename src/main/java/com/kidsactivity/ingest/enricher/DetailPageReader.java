package com.kidsactivity.ingest.enricher;

import com.kidsactivity.ingest.model.DetailPage;
import com.microsoft.playwright.Page;

public interface DetailPageReader {

    /**
     * Loads {@code url} in {@code page} and captures its content. Throws on navigation failure.
     */
    DetailPage read(Page page, String url);
}
