package com.kidsactivity.ingest.manager;

import com.microsoft.playwright.Page;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * One isolated browser with exactly one page. Work submitted here runs on the session's
 * own thread, one task at a time, because Playwright objects are not thread-safe.
 */
public interface BrowserSession extends AutoCloseable {

    int getId();

    /**
     * Whether the session is open and its page has not crashed or lost its browser.
     * Reads flags only, so it answers immediately even while a task is running.
     */
    boolean isAlive();

    /**
     * Full responsiveness check run on the session thread. Only meaningful on an idle session;
     * a session that cannot answer is treated as dead.
     */
    boolean isResponsive();

    <R> CompletableFuture<R> submit(Function<Page, R> work);

    @Override
    void close();
}
