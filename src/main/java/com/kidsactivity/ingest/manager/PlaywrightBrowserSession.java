package com.kidsactivity.ingest.manager;

import com.kidsactivity.ingest.exception.SessionDeadException;
import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * A Playwright + Browser + BrowserContext + Page stack confined to a single thread.
 * Everything, including creation and teardown, runs on {@link #thread}.
 */
@Slf4j
public class PlaywrightBrowserSession implements BrowserSession {

    private static final String EMOJI_LAUNCH = "🚀";
    private static final String EMOJI_CLOSE = "🧹";
    private static final String EMOJI_ERROR = "❌";

    private final int id;
    private final ExecutorService thread;
    private final long healthCheckTimeoutMs;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    // Only touched from the session thread after construction
    private Playwright playwright;
    private Browser browser;
    private BrowserContext context;
    private Page page;
    private volatile PageHealthMonitor healthMonitor;

    PlaywrightBrowserSession(int id, long healthCheckTimeoutMs) {
        this.id = id;
        this.healthCheckTimeoutMs = healthCheckTimeoutMs;
        this.thread = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "browser-session-" + id);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Runs {@code launcher} on the session thread and blocks until the page exists.
     */
    void launch(Launcher launcher, long timeoutMs) throws Exception {
        CompletableFuture<Void> started = CompletableFuture.runAsync(() -> {
            playwright = Playwright.create();
            browser = launcher.browser(playwright);
            context = launcher.context(browser);
            page = context.newPage();
            healthMonitor = launcher.healthMonitor(page, browser);
        }, thread);

        try {
            started.get(timeoutMs, TimeUnit.MILLISECONDS);
            log.info("{} Session {} launched", EMOJI_LAUNCH, id);
        } catch (Exception e) {
            log.error("{} Session {} failed to launch: {}", EMOJI_ERROR, id, e.getMessage());
            close();
            throw e;
        }
    }

    @Override
    public int getId() {
        return id;
    }

    @Override
    public boolean isAlive() {
        PageHealthMonitor monitor = healthMonitor;
        return !closed.get() && monitor != null && !monitor.isTerminated();
    }

    @Override
    public boolean isResponsive() {
        if (!isAlive()) {
            return false;
        }
        try {
            return CompletableFuture.supplyAsync(() -> healthMonitor.isHealthy(), thread)
                    .get(healthCheckTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            log.warn("Session {} did not answer health check: {}", id, e.getMessage());
            return false;
        }
    }

    @Override
    public <R> CompletableFuture<R> submit(Function<Page, R> work) {
        if (closed.get()) {
            return CompletableFuture.failedFuture(new SessionDeadException("Session " + id + " is closed"));
        }
        try {
            return CompletableFuture.supplyAsync(() -> work.apply(page), thread);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new SessionDeadException("Session " + id + " is shut down", e));
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            CompletableFuture.runAsync(() -> {
                safeClose(page);
                safeClose(context);
                safeClose(browser);
                safeClose(playwright);
            }, thread).get(healthCheckTimeoutMs * 2, TimeUnit.MILLISECONDS);
            log.info("{} Session {} closed", EMOJI_CLOSE, id);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.warn("{} Session {} did not close cleanly: {}", EMOJI_ERROR, id, e.getMessage());
        } finally {
            thread.shutdownNow();
        }
    }

    private void safeClose(AutoCloseable c) {
        if (c == null) return;
        try {
            c.close();
        } catch (Exception e) {
            log.debug("Session {} close error on {}: {}", id, c.getClass().getSimpleName(), e.getMessage());
        }
    }

    /**
     * Builds the Playwright stack for one session. Called on the session thread.
     */
    interface Launcher {
        Browser browser(Playwright playwright);

        BrowserContext context(Browser browser);

        PageHealthMonitor healthMonitor(Page page, Browser browser);
    }
}
