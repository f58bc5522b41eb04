package com.osman.exrtool.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Central entry point for resolving configuration values with overrides and persisted preferences.
 * System properties win over preferences, preferences win over built-in defaults.
 */
public final class ConfigService {
    static final String THREADS_PROPERTY = "exrtool.threads";
    static final String ERROR_LOG_PROPERTY = "exrtool.errorLog";

    private static final String PREF_KEY_THREADS = "worker.threads";
    private static final String PREF_KEY_INPUT_DIR = "input.dir";
    private static final String PREF_KEY_OUTPUT_DIR = "output.dir";
    private static final Path DEFAULT_ERROR_LOG = Paths.get("target", "exr-merge-errors.csv");

    private static final ConfigService INSTANCE = new ConfigService(PreferencesStore.global());

    private final PreferencesStore preferences;

    ConfigService(PreferencesStore preferences) {
        this.preferences = preferences;
    }

    public static ConfigService getInstance() {
        return INSTANCE;
    }

    /**
     * Worker count requested by configuration; {@code 0} means "pick automatically".
     */
    public int getThreadCount() {
        String override = System.getProperty(THREADS_PROPERTY);
        if (override != null && !override.isBlank()) {
            return parseThreadCount(override);
        }
        return preferences.getString(PREF_KEY_THREADS)
            .map(ConfigService::parseThreadCount)
            .orElse(0);
    }

    public void setThreadCount(int threads) {
        if (threads < 0) return;
        preferences.putString(PREF_KEY_THREADS, Integer.toString(threads));
    }

    public Path getErrorLogFile() {
        String override = System.getProperty(ERROR_LOG_PROPERTY);
        if (override != null && !override.isBlank()) {
            return Paths.get(override.trim());
        }
        return DEFAULT_ERROR_LOG;
    }

    public Optional<Path> getLastInputDirectory() {
        return preferences.getPath(PREF_KEY_INPUT_DIR);
    }

    public void setLastInputDirectory(Path directory) {
        preferences.putPath(PREF_KEY_INPUT_DIR, directory);
    }

    public Optional<Path> getLastOutputDirectory() {
        return preferences.getPath(PREF_KEY_OUTPUT_DIR);
    }

    public void setLastOutputDirectory(Path directory) {
        preferences.putPath(PREF_KEY_OUTPUT_DIR, directory);
    }

    private static int parseThreadCount(String raw) {
        try {
            return Math.max(Integer.parseInt(raw.trim()), 0);
        } catch (NumberFormatException ex) {
            return 0;
        }
    }
}
