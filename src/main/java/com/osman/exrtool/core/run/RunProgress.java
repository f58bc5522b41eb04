package com.osman.exrtool.core.run;

/**
 * Snapshot returned by {@link RunHandle#poll()}.
 *
 * @param complete whether every worker has finished.
 * @param done     progress units completed so far.
 * @param max      total progress units, fixed for the run.
 */
public record RunProgress(boolean complete, long done, long max) {

    public double fraction() {
        return max == 0 ? 1.0 : (double) done / max;
    }
}
