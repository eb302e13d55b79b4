package com.kidsactivity.ingest.manager;

public interface BrowserSessionFactory {

    /**
     * Launches a new session. Throws if the browser cannot be started.
     */
    BrowserSession create(int id, boolean headless);
}
