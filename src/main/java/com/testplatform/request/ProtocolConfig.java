package com.testplatform.request;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire protocol version negotiated between client and engine.
 * Passed through to the engine unchanged.
 *
 * @param version Protocol version
 */
public record ProtocolConfig(@JsonProperty("Version") int version) {
}
