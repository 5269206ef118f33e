package com.testplatform.core;

import java.time.Duration;

/**
 * Runner-wide options shared by every request handled by a {@link TestRequestManager}.
 * Requests read the current values; {@link TestRequestManager#resetOptions()} swaps in
 * a fresh default instance.
 */
public class RunnerOptions {

    public static final Duration DEFAULT_RUN_REQUEST_WAIT_TIMEOUT = Duration.ofSeconds(5);

    /**
     * Whether the runner is driven by an IDE.
     */
    private volatile boolean designMode;

    /**
     * Filter applied when a request does not carry its own.
     */
    private volatile String testCaseFilterValue;

    /**
     * Whether per-request metrics are collected.
     */
    private volatile boolean telemetryOptedIn;

    /**
     * How long cancel and abort wait for a run request to be created.
     */
    private volatile Duration runRequestWaitTimeout = DEFAULT_RUN_REQUEST_WAIT_TIMEOUT;

    public boolean isDesignMode() {
        return designMode;
    }

    public void setDesignMode(boolean designMode) {
        this.designMode = designMode;
    }

    public String getTestCaseFilterValue() {
        return testCaseFilterValue;
    }

    public void setTestCaseFilterValue(String testCaseFilterValue) {
        this.testCaseFilterValue = testCaseFilterValue;
    }

    public boolean isTelemetryOptedIn() {
        return telemetryOptedIn;
    }

    public void setTelemetryOptedIn(boolean telemetryOptedIn) {
        this.telemetryOptedIn = telemetryOptedIn;
    }

    public Duration getRunRequestWaitTimeout() {
        return runRequestWaitTimeout;
    }

    public void setRunRequestWaitTimeout(Duration runRequestWaitTimeout) {
        if (runRequestWaitTimeout == null || runRequestWaitTimeout.isNegative()) {
            throw new IllegalArgumentException("Run request wait timeout must not be negative");
        }
        this.runRequestWaitTimeout = runRequestWaitTimeout;
    }

    @Override
    public String toString() {
        return "RunnerOptions{" +
                "designMode=" + designMode +
                ", testCaseFilterValue='" + testCaseFilterValue + '\'' +
                ", telemetryOptedIn=" + telemetryOptedIn +
                ", runRequestWaitTimeout=" + runRequestWaitTimeout +
                '}';
    }
}
