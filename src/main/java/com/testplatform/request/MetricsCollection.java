package com.testplatform.request;

import java.util.Map;

/**
 * Telemetry metrics gathered while a single request is processed.
 */
public interface MetricsCollection {

    /**
     * Add or replace a metric.
     */
    void add(String metric, Object value);

    /**
     * Snapshot of the metrics collected so far.
     */
    Map<String, Object> getMetrics();
}
