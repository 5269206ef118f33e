package com.testplatform.client;

/**
 * Handle of one test run created by the {@link TestEngine}.
 */
public interface TestRunRequest extends AutoCloseable {

    /**
     * Start the run; returns without waiting for it to finish.
     *
     * @return Process id of the test host, or -1 if not known
     */
    int executeAsync();

    /**
     * Block until the run has finished.
     */
    void waitForCompletion();

    /**
     * Ask the engine to stop the run after the tests in progress.
     */
    void cancelAsync();

    /**
     * Stop the run immediately.
     */
    void abort();

    @Override
    void close();
}
