package com.testplatform.client;

/**
 * Handle of one discovery request created by the {@link TestEngine}.
 */
public interface DiscoveryRequest extends AutoCloseable {

    /**
     * Start discovery; returns without waiting for it to finish.
     */
    void discoverAsync();

    /**
     * Block until discovery has finished.
     */
    void waitForCompletion();

    @Override
    void close();
}
