package com.testplatform.config;

import com.testplatform.core.RunnerOptions;
import com.testplatform.exception.SettingsException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class OptionsLoaderTest {

    @TempDir
    Path tempDir;

    private Path write(String yaml) throws IOException {
        Path file = tempDir.resolve("options.yaml");
        Files.writeString(file, yaml);
        return file;
    }

    @Test
    @DisplayName("Load options from the classpath")
    void testLoadFromClasspath() {
        RunnerOptions options = OptionsLoader.load("classpath:runner-options.yaml");

        assertTrue(options.isDesignMode());
        assertEquals("Category!=Slow", options.getTestCaseFilterValue());
        assertTrue(options.isTelemetryOptedIn());
        assertEquals(Duration.ofMillis(250), options.getRunRequestWaitTimeout());
    }

    @Test
    @DisplayName("Options may sit at the document root")
    void testRootLevelOptions() throws IOException {
        Path file = write("design-mode: true\nrun-request-wait-timeout: 2s\n");

        RunnerOptions options = OptionsLoader.load(file.toString());

        assertTrue(options.isDesignMode());
        assertFalse(options.isTelemetryOptedIn());
        assertEquals(Duration.ofSeconds(2), options.getRunRequestWaitTimeout());
    }

    @Test
    @DisplayName("Durations accept several notations")
    void testDurations() throws IOException {
        assertEquals(Duration.ofMillis(1500),
                OptionsLoader.load(write("run-request-wait-timeout: 1500\n").toString()).getRunRequestWaitTimeout());
        assertEquals(Duration.ofMinutes(1),
                OptionsLoader.load(write("run-request-wait-timeout: 1m\n").toString()).getRunRequestWaitTimeout());
        assertEquals(Duration.ofSeconds(3),
                OptionsLoader.load(write("run-request-wait-timeout: PT3S\n").toString()).getRunRequestWaitTimeout());
    }

    @Test
    @DisplayName("Empty file gives default options")
    void testEmptyFile() throws IOException {
        RunnerOptions options = OptionsLoader.load(write("").toString());

        assertEquals(RunnerOptions.DEFAULT_RUN_REQUEST_WAIT_TIMEOUT, options.getRunRequestWaitTimeout());
    }

    @Test
    @DisplayName("Invalid values are rejected")
    void testInvalidValues() throws IOException {
        assertThrows(SettingsException.class,
                () -> OptionsLoader.load(write("design-mode: maybe\n").toString()));
        assertThrows(SettingsException.class,
                () -> OptionsLoader.load(write("run-request-wait-timeout: soon\n").toString()));
        assertThrows(SettingsException.class,
                () -> OptionsLoader.load(write("run-request-wait-timeout: -5s\n").toString()));
        assertThrows(SettingsException.class,
                () -> OptionsLoader.load(write("- a\n- b\n").toString()));
        assertThrows(SettingsException.class,
                () -> OptionsLoader.load(write("testplatform: [1, 2]\n").toString()));
        assertThrows(SettingsException.class,
                () -> OptionsLoader.load(write("testplatform: {design-mode: true\n").toString()));
    }

    @Test
    @DisplayName("Missing files fail on load and fall back to defaults otherwise")
    void testMissingFile() {
        String missing = tempDir.resolve("missing.yaml").toString();

        assertThrows(SettingsException.class, () -> OptionsLoader.load(missing));
        assertFalse(OptionsLoader.loadOrDefault(missing).isDesignMode());
        assertFalse(OptionsLoader.loadOrDefault("classpath:missing.yaml").isDesignMode());
        assertNotNull(OptionsLoader.loadOrDefault(null));
    }
}
