package com.testplatform.request;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Metrics collection backed by a concurrent map.
 * The engine may add metrics from its own threads.
 */
public class DefaultMetricsCollection implements MetricsCollection {

    private final Map<String, Object> metrics = new ConcurrentHashMap<>();

    @Override
    public void add(String metric, Object value) {
        if (metric != null && value != null) {
            metrics.put(metric, value);
        }
    }

    @Override
    public Map<String, Object> getMetrics() {
        return Map.copyOf(metrics);
    }

    @Override
    public String toString() {
        return "MetricsCollection" + metrics;
    }
}
