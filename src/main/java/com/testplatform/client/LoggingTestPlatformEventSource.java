package com.testplatform.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default telemetry sink writing request lifecycle events to the log.
 */
public class LoggingTestPlatformEventSource implements TestPlatformEventSource {

    private static final Logger log = LoggerFactory.getLogger(LoggingTestPlatformEventSource.class);

    @Override
    public void discoveryRequestStart() {
        log.info("Discovery request started");
    }

    @Override
    public void discoveryRequestStop() {
        log.info("Discovery request stopped");
    }

    @Override
    public void executionRequestStart() {
        log.info("Execution request started");
    }

    @Override
    public void executionRequestStop() {
        log.info("Execution request stopped");
    }
}
