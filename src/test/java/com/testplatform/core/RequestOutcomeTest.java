package com.testplatform.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RequestOutcomeTest {

    @Test
    void testSucceeded() {
        RequestOutcome outcome = RequestOutcome.succeeded();

        assertTrue(outcome.success());
        assertNull(outcome.errorKind());
        assertNull(outcome.message());
    }

    @Test
    void testFailed() {
        RequestOutcome outcome = RequestOutcome.failed(ErrorKind.SETTINGS_ERROR, "Invalid value '0' for BatchSize");

        assertFalse(outcome.success());
        assertEquals(ErrorKind.SETTINGS_ERROR, outcome.errorKind());
        assertEquals("Invalid value '0' for BatchSize", outcome.message());
    }
}
