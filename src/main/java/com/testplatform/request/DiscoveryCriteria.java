package com.testplatform.request;

import java.util.List;

/**
 * Fully merged description of a discovery request.
 *
 * @param sources                         Test containers, in caller order
 * @param runSettings                     Run settings XML after merging runner defaults
 * @param testCaseFilter                  Filter string, or null for all tests
 * @param frequencyOfDiscoveredTestsEvent Number of tests reported per discovery event
 */
public record DiscoveryCriteria(
        List<String> sources,
        String runSettings,
        String testCaseFilter,
        int frequencyOfDiscoveredTestsEvent
) {
    public DiscoveryCriteria {
        sources = List.copyOf(sources);
    }
}
