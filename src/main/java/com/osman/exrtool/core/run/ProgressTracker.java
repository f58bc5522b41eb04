package com.osman.exrtool.core.run;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Display counters for a run: one unit per file decode attempt and one per finished frame group.
 * The maximum is fixed when the run is created.
 */
public final class ProgressTracker {

    private final AtomicLong done = new AtomicLong();
    private final long max;

    public ProgressTracker(int fileCount, int frameGroupCount) {
        this.max = (long) fileCount + frameGroupCount;
    }

    public void advance() {
        done.incrementAndGet();
    }

    public long done() {
        return done.get();
    }

    public long max() {
        return max;
    }
}
