package com.testplatform.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.testplatform.filter.FilterOptions;

/**
 * Per-call options sent with a run request.
 *
 * @param testCaseFilter Filter string overriding the runner's filter, may be null
 * @param filterOptions  Value matching options for the filter, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TestPlatformOptions(
        @JsonProperty("TestCaseFilter") String testCaseFilter,
        @JsonProperty("FilterOptions") FilterOptions filterOptions
) {
    public static TestPlatformOptions withFilter(String testCaseFilter) {
        return new TestPlatformOptions(testCaseFilter, null);
    }
}
