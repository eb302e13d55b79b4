package com.kidsactivity.ingest.model;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counters accumulated over a single run.
 */
public class RunStats {

    private final AtomicInteger found = new AtomicInteger();
    private final AtomicInteger created = new AtomicInteger();
    private final AtomicInteger updated = new AtomicInteger();
    private final AtomicInteger unchanged = new AtomicInteger();
    private final AtomicInteger deactivated = new AtomicInteger();
    private final AtomicInteger discarded = new AtomicInteger();
    private final AtomicInteger errors = new AtomicInteger();

    public void addFound(int n) { found.addAndGet(n); }
    public void incrementCreated() { created.incrementAndGet(); }
    public void incrementUpdated() { updated.incrementAndGet(); }
    public void incrementUnchanged() { unchanged.incrementAndGet(); }
    public void addDeactivated(int n) { deactivated.addAndGet(n); }
    public void incrementDiscarded() { discarded.incrementAndGet(); }
    public void addErrors(int n) { errors.addAndGet(n); }
    public void incrementErrors() { errors.incrementAndGet(); }

    public int getFound() { return found.get(); }
    public int getCreated() { return created.get(); }
    public int getUpdated() { return updated.get(); }
    public int getUnchanged() { return unchanged.get(); }
    public int getDeactivated() { return deactivated.get(); }
    public int getDiscarded() { return discarded.get(); }
    public int getErrors() { return errors.get(); }

    @Override
    public String toString() {
        return String.format("found=%d created=%d updated=%d unchanged=%d deactivated=%d discarded=%d errors=%d",
                getFound(), getCreated(), getUpdated(), getUnchanged(), getDeactivated(), getDiscarded(), getErrors());
    }
}
