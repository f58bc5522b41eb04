package com.osman.exrtool.core.run;

import java.util.List;
import java.util.Optional;

/**
 * Caller's view of one in-flight merge run.
 * <p>
 * A run cannot be cancelled. Poll until {@link RunProgress#complete()}, inspect the errors, then
 * {@link #close()} it. A run with errors succeeded only partially: failed frames are named in the
 * error messages.
 */
public interface RunHandle extends AutoCloseable {

    /**
     * Non-blocking progress snapshot. Once it reports completion, every worker's progress and error
     * updates are visible to the caller.
     */
    RunProgress poll();

    int errorCount();

    /**
     * Error message by arrival index, empty when the index is out of range.
     */
    Optional<String> error(int index);

    List<MergeError> errors();

    int frameGroupCount();

    int threadCount();

    /**
     * Waits for every worker to exit, then drops the run's state. Safe to call right after
     * submission and more than once.
     */
    @Override
    void close();
}
