package com.testplatform.request;

import java.util.Objects;

/**
 * Per-call correlation data handed to the engine with each request.
 * A new context is created for every discovery or run call.
 *
 * @param protocolConfig    Protocol version supplied by the caller
 * @param metricsCollection Metrics for this request only
 */
public record RequestContext(ProtocolConfig protocolConfig, MetricsCollection metricsCollection) {

    public RequestContext {
        Objects.requireNonNull(protocolConfig, "protocolConfig");
        Objects.requireNonNull(metricsCollection, "metricsCollection");
    }
}
