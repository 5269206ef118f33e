package com.testplatform.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RunnerOptionsTest {

    @Test
    void testDefaults() {
        RunnerOptions options = new RunnerOptions();

        assertFalse(options.isDesignMode());
        assertFalse(options.isTelemetryOptedIn());
        assertNull(options.getTestCaseFilterValue());
        assertEquals(Duration.ofSeconds(5), options.getRunRequestWaitTimeout());
    }

    @Test
    void testInvalidWaitTimeout() {
        RunnerOptions options = new RunnerOptions();

        assertThrows(IllegalArgumentException.class, () -> options.setRunRequestWaitTimeout(null));
        assertThrows(IllegalArgumentException.class, () -> options.setRunRequestWaitTimeout(Duration.ofMillis(-1)));
    }
}
