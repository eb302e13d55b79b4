package com.kidsactivity.ingest.manager;

import com.kidsactivity.ingest.exception.PageHealthException;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.Page;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decides whether a pooled session's page can still take work.
 *
 * <p>{@link #checkHealth} drives the page and must run on the thread that owns it.
 * {@link #isTerminated} only reads the crash and disconnect flags and is safe from any thread.
 */
@Slf4j
public class PageHealthMonitor {

    private static final String EMOJI_HEALTH = "💚";
    private static final String EMOJI_WARNING = "⚠️";
    private static final String EMOJI_ERROR = "❌";

    private static final int MAX_CONSECUTIVE_FAILURES = 3;

    private final Page page;
    private final Browser browser;
    private final int checkTimeoutMs;
    private final int defaultTimeoutMs;

    private final AtomicBoolean crashed = new AtomicBoolean(false);
    private final AtomicBoolean disconnected = new AtomicBoolean(false);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);

    public PageHealthMonitor(Page page, Browser browser, int checkTimeoutMs, int defaultTimeoutMs) {
        this.page = page;
        this.browser = browser;
        this.checkTimeoutMs = checkTimeoutMs;
        this.defaultTimeoutMs = defaultTimeoutMs;

        page.onCrash(p -> {
            log.error("{} {} Page crashed", EMOJI_ERROR, EMOJI_HEALTH);
            crashed.set(true);
        });
        browser.onDisconnected(b -> {
            log.error("{} {} Browser disconnected", EMOJI_ERROR, EMOJI_HEALTH);
            disconnected.set(true);
        });
    }

    /**
     * @throws PageHealthException if the page is closed, crashed, detached from its browser,
     * or has failed too many responsiveness checks in a row
     */
    public void checkHealth() {
        if (crashed.get()) {
            throw new PageHealthException("Page crashed");
        }
        if (disconnected.get() || !browser.isConnected()) {
            throw new PageHealthException("Browser disconnected");
        }
        if (page.isClosed()) {
            throw new PageHealthException("Page is closed");
        }

        if (checkResponsiveness()) {
            consecutiveFailures.set(0);
            return;
        }

        int failures = consecutiveFailures.incrementAndGet();
        log.warn("{} {} Consecutive failed checks: {}/{}", EMOJI_WARNING, EMOJI_HEALTH, failures, MAX_CONSECUTIVE_FAILURES);
        if (failures >= MAX_CONSECUTIVE_FAILURES) {
            throw new PageHealthException("Page unresponsive after " + failures + " checks");
        }
    }

    public boolean isHealthy() {
        try {
            checkHealth();
            return true;
        } catch (PageHealthException e) {
            log.warn("{} {} Unhealthy page: {}", EMOJI_WARNING, EMOJI_HEALTH, e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.warn("{} {} Health check threw: {}", EMOJI_WARNING, EMOJI_HEALTH, e.getMessage());
            return false;
        }
    }

    /**
     * An interactive or complete document counts as responsive; a page still loading
     * after a failed navigation is not dead, it just isn't ready.
     */
    private boolean checkResponsiveness() {
        try {
            page.setDefaultTimeout(checkTimeoutMs);
            Object result = page.evaluate("() => document.readyState");
            if (!(result instanceof String readyState)) {
                log.warn("{} {} Unexpected readyState result: {}", EMOJI_WARNING, EMOJI_HEALTH, result);
                return false;
            }
            log.debug("{} readyState={}", EMOJI_HEALTH, readyState);
            return true;
        } catch (Exception e) {
            log.warn("{} {} Responsiveness check failed: {}", EMOJI_WARNING, EMOJI_HEALTH, e.getMessage());
            return false;
        } finally {
            if (!page.isClosed()) {
                page.setDefaultTimeout(defaultTimeoutMs);
            }
        }
    }

    public boolean isTerminated() {
        return crashed.get() || disconnected.get();
    }
}
