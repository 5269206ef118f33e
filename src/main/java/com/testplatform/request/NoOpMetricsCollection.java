package com.testplatform.request;

import java.util.Map;

/**
 * Metrics collection used when telemetry is not opted in.
 */
public class NoOpMetricsCollection implements MetricsCollection {

    @Override
    public void add(String metric, Object value) {
    }

    @Override
    public Map<String, Object> getMetrics() {
        return Map.of();
    }
}
