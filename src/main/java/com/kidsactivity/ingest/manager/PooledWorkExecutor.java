package com.kidsactivity.ingest.manager;

import com.kidsactivity.ingest.config.ScraperConfig;
import com.kidsactivity.ingest.exception.BrowserPoolException;
import com.kidsactivity.ingest.exception.SessionDeadException;
import com.kidsactivity.ingest.model.WorkResult;
import com.microsoft.playwright.Page;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Fans a batch out across browser sessions.
 *
 * <p>Items are partitioned round-robin; each session works through its partition in order.
 * A failed or timed-out item on a live session gets its fallback value. When a session dies, the
 * item it was holding and everything left in its partition go to a shared orphan queue that the
 * surviving sessions drain, so an item may be attempted more than once but is completed exactly once.
 * A session whose timed-out task never finishes is closed and handled the same way.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PooledWorkExecutor {

    private static final String EMOJI_BATCH = "📦";
    private static final String EMOJI_WARNING = "⚠️";
    private static final String EMOJI_ERROR = "❌";
    private static final String EMOJI_REQUEUE = "🔁";

    private static final long IDLE_POLL_MS = 50;
    private static final long DRAIN_FACTOR = 3;

    private final ScraperConfig scraperConfig;

    /**
     * @throws BrowserPoolException if every session died while items were still pending
     */
    public <T, R> WorkResult<R> execute(List<BrowserSession> sessions,
                                        List<T> items,
                                        BiFunction<Page, T, R> task,
                                        Function<T, R> fallback) {
        if (items.isEmpty()) {
            return new WorkResult<>(List.of(), 0);
        }
        if (sessions.isEmpty()) {
            throw new BrowserPoolException("No live sessions for a batch of " + items.size());
        }

        Batch<T, R> batch = new Batch<>(items, task, fallback);
        List<Deque<Integer>> partitions = partition(items.size(), sessions.size());
        log.info("{} Executing {} items across {} sessions", EMOJI_BATCH, items.size(), sessions.size());

        ExecutorService workers = Executors.newFixedThreadPool(sessions.size(), r -> {
            Thread t = new Thread(r, "pooled-worker");
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<?>> running = new ArrayList<>();
            for (int i = 0; i < sessions.size(); i++) {
                BrowserSession session = sessions.get(i);
                Deque<Integer> partition = partitions.get(i);
                running.add(workers.submit(() -> work(session, partition, batch)));
            }
            for (Future<?> f : running) {
                f.get();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrowserPoolException("Interrupted while waiting for pooled work", e);
        } catch (ExecutionException e) {
            throw new BrowserPoolException("Pooled worker failed", e.getCause());
        } finally {
            workers.shutdownNow();
        }

        if (batch.pending.get() > 0) {
            throw new BrowserPoolException("All browser sessions died with " + batch.pending.get() + " items pending");
        }

        List<R> results = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            results.add(batch.results.get(i));
        }
        return new WorkResult<>(results, batch.failures.get());
    }

    private <T, R> void work(BrowserSession session, Deque<Integer> partition, Batch<T, R> batch) {
        long itemTimeoutMs = Math.max(1L, scraperConfig.getDetailTimeoutMs() * 2L);

        while (true) {
            Integer index = partition.pollFirst();
            if (index == null) {
                index = batch.orphans.poll();
            }
            if (index == null) {
                if (batch.pending.get() == 0) {
                    return;
                }
                // Another session may still orphan its work
                if (!sleepQuietly()) return;
                continue;
            }

            T item = batch.items.get(index);
            CompletableFuture<R> future = session.submit(page -> batch.task.apply(page, item));
            try {
                batch.complete(index, future.get(itemTimeoutMs, TimeUnit.MILLISECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                batch.orphans.add(index);
                return;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof SessionDeadException || !session.isAlive()) {
                    batch.orphans.add(index);
                    abandon(session, partition, batch, 1, cause.getMessage());
                    return;
                }
                fallBack(session, index, item, batch, cause.getMessage());
            } catch (TimeoutException e) {
                if (!session.isAlive()) {
                    batch.orphans.add(index);
                    abandon(session, partition, batch, 1, "died while item " + index + " was running");
                    return;
                }
                fallBack(session, index, item, batch, "timed out after " + itemTimeoutMs + "ms");
                // The session thread is still busy with the slow item; later submits queue behind it
                if (!drained(future, itemTimeoutMs * DRAIN_FACTOR)) {
                    abandon(session, partition, batch, 0, "still busy " + (itemTimeoutMs * DRAIN_FACTOR) + "ms after a timeout");
                    return;
                }
            }
        }
    }

    private <T, R> void fallBack(BrowserSession session, int index, T item, Batch<T, R> batch, String reason) {
        log.warn("{} Item {} failed on session {}, using fallback: {}", EMOJI_WARNING, index, session.getId(), reason);
        batch.failures.incrementAndGet();
        batch.complete(index, batch.fallback.apply(item));
    }

    /**
     * Closes a session that can no longer take work and hands its remaining partition to the others.
     */
    private <T, R> void abandon(BrowserSession session, Deque<Integer> partition, Batch<T, R> batch,
                                int alreadyRequeued, String reason) {
        int requeued = alreadyRequeued + partition.size();
        Integer rest;
        while ((rest = partition.pollFirst()) != null) {
            batch.orphans.add(rest);
        }
        log.error("{} {} Session {} abandoned, requeued {} items: {}",
                EMOJI_ERROR, EMOJI_REQUEUE, session.getId(), requeued, reason);
        try {
            session.close();
        } catch (RuntimeException e) {
            log.warn("{} Session {} close failed: {}", EMOJI_WARNING, session.getId(), e.getMessage());
        }
    }

    private static boolean drained(Future<?> future, long waitMs) {
        try {
            future.get(waitMs, TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            // Finished, even if badly; the thread is free again
            return true;
        } catch (TimeoutException e) {
            return false;
        }
    }

    static List<Deque<Integer>> partition(int itemCount, int sessionCount) {
        List<Deque<Integer>> partitions = new ArrayList<>(sessionCount);
        for (int i = 0; i < sessionCount; i++) {
            partitions.add(new ArrayDeque<>());
        }
        for (int i = 0; i < itemCount; i++) {
            partitions.get(i % sessionCount).addLast(i);
        }
        return partitions;
    }

    private boolean sleepQuietly() {
        try {
            Thread.sleep(IDLE_POLL_MS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static final class Batch<T, R> {
        final List<T> items;
        final BiFunction<Page, T, R> task;
        final Function<T, R> fallback;
        final AtomicReferenceArray<R> results;
        final AtomicReferenceArray<Boolean> done;
        final ConcurrentLinkedQueue<Integer> orphans = new ConcurrentLinkedQueue<>();
        final AtomicInteger pending;
        final AtomicInteger failures = new AtomicInteger();

        Batch(List<T> items, BiFunction<Page, T, R> task, Function<T, R> fallback) {
            this.items = items;
            this.task = task;
            this.fallback = fallback;
            this.results = new AtomicReferenceArray<>(items.size());
            this.done = new AtomicReferenceArray<>(items.size());
            this.pending = new AtomicInteger(items.size());
        }

        void complete(int index, R result) {
            if (done.compareAndSet(index, null, Boolean.TRUE)) {
                results.set(index, result);
                pending.decrementAndGet();
            }
        }
    }
}
