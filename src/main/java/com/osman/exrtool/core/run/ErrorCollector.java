package com.osman.exrtool.core.run;

import com.osman.exrtool.logging.AppLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Append-only error list shared by all workers of a run. Entries keep arrival order.
 */
public final class ErrorCollector {

    private static final Logger LOGGER = AppLogger.get();

    private final Object lock = new Object();
    private final List<MergeError> errors = new ArrayList<>();

    public void record(MergeError error) {
        synchronized (lock) {
            errors.add(error);
        }
        LOGGER.warning(error.message().replace('\n', ' '));
    }

    public int count() {
        synchronized (lock) {
            return errors.size();
        }
    }

    public Optional<String> message(int index) {
        synchronized (lock) {
            if (index < 0 || index >= errors.size()) {
                return Optional.empty();
            }
            return Optional.of(errors.get(index).message());
        }
    }

    public List<MergeError> snapshot() {
        synchronized (lock) {
            return List.copyOf(errors);
        }
    }
}
