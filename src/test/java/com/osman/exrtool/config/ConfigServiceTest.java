package com.osman.exrtool.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.UUID;
import java.util.prefs.Preferences;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigServiceTest {

    private Preferences node;
    private ConfigService config;

    @BeforeEach
    void setUp() {
        node = Preferences.userRoot().node("com/osman/exrtool-test/" + UUID.randomUUID());
        config = new ConfigService(new PreferencesStore(node));
        System.clearProperty(ConfigService.THREADS_PROPERTY);
    }

    @AfterEach
    void tearDown() throws Exception {
        System.clearProperty(ConfigService.THREADS_PROPERTY);
        node.removeNode();
    }

    @Test
    void threadCountDefaultsToAutomatic() {
        assertEquals(0, config.getThreadCount());
    }

    @Test
    void storedThreadCountIsUsed() {
        config.setThreadCount(6);
        assertEquals(6, config.getThreadCount());

        config.setThreadCount(-3);
        assertEquals(6, config.getThreadCount());
    }

    @Test
    void systemPropertyOverridesStoredThreadCount() {
        config.setThreadCount(6);
        System.setProperty(ConfigService.THREADS_PROPERTY, "3");
        assertEquals(3, config.getThreadCount());

        System.setProperty(ConfigService.THREADS_PROPERTY, "lots");
        assertEquals(0, config.getThreadCount());
    }

    @Test
    void remembersDirectories() {
        assertTrue(config.getLastInputDirectory().isEmpty());

        config.setLastInputDirectory(Path.of("/renders/in"));
        config.setLastOutputDirectory(Path.of("/renders/out"));

        assertEquals(Path.of("/renders/in"), config.getLastInputDirectory().orElseThrow());
        assertEquals(Path.of("/renders/out"), config.getLastOutputDirectory().orElseThrow());
    }

    @Test
    void errorLogFileFollowsSystemProperty() {
        String previous = System.getProperty(ConfigService.ERROR_LOG_PROPERTY);
        try {
            System.setProperty(ConfigService.ERROR_LOG_PROPERTY, "/tmp/custom-errors.csv");
            assertEquals(Path.of("/tmp/custom-errors.csv"), config.getErrorLogFile());
            System.clearProperty(ConfigService.ERROR_LOG_PROPERTY);
            assertEquals(Path.of("target", "exr-merge-errors.csv"), config.getErrorLogFile());
        } finally {
            if (previous != null) {
                System.setProperty(ConfigService.ERROR_LOG_PROPERTY, previous);
            }
        }
    }
}
