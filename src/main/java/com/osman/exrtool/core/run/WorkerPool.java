package com.osman.exrtool.core.run;

import com.osman.exrtool.logging.AppLogger;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed set of worker threads draining a read-only task list through one shared cursor.
 * <p>
 * Each worker claims the next index with a single atomic increment, runs it, notifies, and repeats
 * until the cursor runs past the end. On the way out it bumps the finished counter and notifies once
 * more. The pool counts as complete only when every worker has gone through that exit step.
 *
 * @param <T> task type
 */
public final class WorkerPool<T> {

    private static final Logger LOGGER = AppLogger.get();
    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final List<T> tasks;
    private final int threadCount;
    private final Consumer<T> worker;
    private final Runnable notifier;
    private final AtomicInteger cursor = new AtomicInteger();
    private final AtomicInteger threadsFinished = new AtomicInteger();

    private ExecutorService executor;

    public WorkerPool(List<T> tasks, int threadCount, Consumer<T> worker, Runnable notifier) {
        if (threadCount < 1) {
            throw new IllegalArgumentException("threadCount must be at least 1: " + threadCount);
        }
        this.tasks = List.copyOf(tasks);
        this.threadCount = threadCount;
        this.worker = Objects.requireNonNull(worker, "worker");
        this.notifier = notifier == null ? () -> { } : notifier;
    }

    /**
     * Worker count for a request: the explicit value when positive, otherwise
     * {@code max(availableProcessors - 2, 1)}.
     */
    public static int resolveThreadCount(int requested, int availableProcessors) {
        if (requested > 0) {
            return requested;
        }
        return Math.max(availableProcessors - 2, 1);
    }

    public static int resolveThreadCount(int requested) {
        return resolveThreadCount(requested, Runtime.getRuntime().availableProcessors());
    }

    public synchronized void start() {
        if (executor != null) {
            throw new IllegalStateException("Worker pool already started");
        }
        int poolId = POOL_SEQUENCE.incrementAndGet();
        AtomicInteger threadSequence = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r, "MergePool-" + poolId + "-Worker-" + threadSequence.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        executor = Executors.newFixedThreadPool(threadCount, tf);
        for (int i = 0; i < threadCount; i++) {
            executor.execute(this::workLoop);
        }
        executor.shutdown();
    }

    public boolean isComplete() {
        return threadsFinished.get() == threadCount;
    }

    public int threadCount() {
        return threadCount;
    }

    public int threadsFinished() {
        return threadsFinished.get();
    }

    /**
     * Blocks until every worker has exited. Returns at once for a pool that was never started.
     * An interrupt does not cut the wait short; the interrupt flag is restored afterwards.
     */
    public void join() {
        ExecutorService started;
        synchronized (this) {
            started = executor;
        }
        if (started == null) {
            return;
        }
        boolean interrupted = false;
        while (true) {
            try {
                if (started.awaitTermination(1, TimeUnit.SECONDS)) {
                    break;
                }
            } catch (InterruptedException ex) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private void workLoop() {
        try {
            int index;
            while ((index = cursor.getAndIncrement()) < tasks.size()) {
                T task = tasks.get(index);
                try {
                    worker.accept(task);
                } catch (RuntimeException ex) {
                    LOGGER.log(Level.SEVERE, "Task " + index + " failed unexpectedly", ex);
                }
                notifySafely();
            }
        } finally {
            threadsFinished.incrementAndGet();
            notifySafely();
        }
    }

    private void notifySafely() {
        try {
            notifier.run();
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "Progress listener failed", ex);
        }
    }
}
