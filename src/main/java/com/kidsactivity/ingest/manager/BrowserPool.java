package com.kidsactivity.ingest.manager;

import com.kidsactivity.ingest.exception.BrowserPoolException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-size set of isolated browser sessions for a single run.
 */
@Slf4j
public class BrowserPool implements AutoCloseable {

    private static final String EMOJI_POOL = "🧩";
    private static final String EMOJI_WARNING = "⚠️";

    private final BrowserSessionFactory sessionFactory;
    private final List<BrowserSession> sessions = Collections.synchronizedList(new ArrayList<>());
    private final LinkedBlockingQueue<BrowserSession> idle = new LinkedBlockingQueue<>();

    public BrowserPool(BrowserSessionFactory sessionFactory) {
        this.sessionFactory = sessionFactory;
    }

    /**
     * Launches up to {@code size} sessions. Sessions that fail to start are skipped.
     *
     * @throws BrowserPoolException if none could be launched
     */
    public void start(int size, boolean headless) {
        if (size < 1) {
            throw new IllegalArgumentException("Pool size must be at least 1, got " + size);
        }
        log.info("{} Starting browser pool (size={}, headless={})", EMOJI_POOL, size, headless);

        for (int i = 0; i < size; i++) {
            try {
                BrowserSession session = sessionFactory.create(i, headless);
                sessions.add(session);
                idle.add(session);
            } catch (RuntimeException e) {
                log.warn("{} Session {} failed to launch, skipping: {}", EMOJI_WARNING, i, e.getMessage());
            }
        }

        if (sessions.isEmpty()) {
            throw new BrowserPoolException("No browser session could be launched");
        }
        log.info("{} Browser pool ready with {}/{} sessions", EMOJI_POOL, sessions.size(), size);
    }

    /**
     * Exclusive lease on an idle session. Blocks until one is available.
     */
    public BrowserSession acquire() {
        try {
            while (true) {
                BrowserSession session = idle.poll(1, TimeUnit.SECONDS);
                if (session != null) {
                    if (session.isResponsive()) {
                        return session;
                    }
                    log.warn("{} Dropping dead session {} on acquire", EMOJI_WARNING, session.getId());
                    closeQuietly(session);
                    continue;
                }
                if (liveSessions().isEmpty()) {
                    throw new BrowserPoolException("All browser sessions are dead");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrowserPoolException("Interrupted while acquiring a session", e);
        }
    }

    public void release(BrowserSession session) {
        if (session != null && !idle.contains(session)) {
            idle.add(session);
        }
    }

    public List<BrowserSession> liveSessions() {
        List<BrowserSession> snapshot;
        synchronized (sessions) {
            snapshot = new ArrayList<>(sessions);
        }
        return snapshot.stream().filter(BrowserSession::isAlive).toList();
    }

    public int size() {
        return sessions.size();
    }

    @Override
    public void close() {
        List<BrowserSession> snapshot;
        synchronized (sessions) {
            snapshot = new ArrayList<>(sessions);
            sessions.clear();
        }
        idle.clear();
        for (BrowserSession session : snapshot) {
            closeQuietly(session);
        }
        log.info("{} Browser pool closed", EMOJI_POOL);
    }

    private void closeQuietly(BrowserSession session) {
        try {
            session.close();
        } catch (RuntimeException e) {
            log.warn("{} Session {} close failed: {}", EMOJI_WARNING, session.getId(), e.getMessage());
        }
    }
}
