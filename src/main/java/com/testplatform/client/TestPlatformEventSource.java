package com.testplatform.client;

/**
 * Telemetry sink for request lifecycle events.
 * Each start is paired with exactly one stop per request.
 */
public interface TestPlatformEventSource {

    void discoveryRequestStart();

    void discoveryRequestStop();

    void executionRequestStart();

    void executionRequestStop();
}
