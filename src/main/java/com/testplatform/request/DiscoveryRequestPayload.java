package com.testplatform.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Discovery request as sent by a client.
 *
 * @param sources        Test containers to discover
 * @param runSettings    Run settings XML, may be null
 * @param testCaseFilter Filter overriding the runner's filter, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DiscoveryRequestPayload(
        @JsonProperty("Sources") List<String> sources,
        @JsonProperty("RunSettings") String runSettings,
        @JsonProperty("TestCaseFilter") String testCaseFilter
) {
    public DiscoveryRequestPayload {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public static DiscoveryRequestPayload of(List<String> sources, String runSettings) {
        return new DiscoveryRequestPayload(sources, runSettings, null);
    }
}
