package com.osman.exrtool.core.run;

/**
 * Notified after every finished frame group and once more when each worker exits.
 * <p>
 * Calls come from worker threads, possibly several at once and in no particular order, so
 * implementations must be thread-safe. Any context the listener needs is captured by the implementation.
 */
@FunctionalInterface
public interface ProgressListener {

    void onProgress(RunHandle run);
}
