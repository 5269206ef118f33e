package com.testplatform.request;

/**
 * Metric names recorded by the request manager.
 */
public final class TelemetryDataConstants {

    private TelemetryDataConstants() {
    }

    public static final String NUMBER_OF_SOURCES_SENT_FOR_DISCOVERY = "VS.TestDiscovery.NumberOfSources";

    public static final String NUMBER_OF_SOURCES_SENT_FOR_RUN = "VS.TestRun.NumberOfSources";

    public static final String PROTOCOL_VERSION = "VS.TestPlatform.ProtocolVersion";
}
