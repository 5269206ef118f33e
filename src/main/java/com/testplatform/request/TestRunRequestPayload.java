package com.testplatform.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Run request as sent by a client.
 *
 * @param sources             Test containers to run
 * @param runSettings         Run settings XML, may be null
 * @param testPlatformOptions Per-call options, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TestRunRequestPayload(
        @JsonProperty("Sources") List<String> sources,
        @JsonProperty("RunSettings") String runSettings,
        @JsonProperty("TestPlatformOptions") TestPlatformOptions testPlatformOptions
) {
    public TestRunRequestPayload {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public static TestRunRequestPayload of(List<String> sources, String runSettings) {
        return new TestRunRequestPayload(sources, runSettings, null);
    }
}
