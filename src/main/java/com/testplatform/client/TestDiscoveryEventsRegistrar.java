package com.testplatform.client;

/**
 * Caller hook attached to a discovery request while it executes.
 */
public interface TestDiscoveryEventsRegistrar {

    void registerDiscoveryEvents(DiscoveryRequest discoveryRequest);

    void unregisterDiscoveryEvents(DiscoveryRequest discoveryRequest);
}
