package com.testplatform.client;

/**
 * Caller hook attached to a run request while it executes.
 */
public interface TestRunEventsRegistrar {

    void registerTestRunEvents(TestRunRequest testRunRequest);

    void unregisterTestRunEvents(TestRunRequest testRunRequest);
}
