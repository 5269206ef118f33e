package com.testplatform.request;

import com.testplatform.client.TestHostLauncher;
import com.testplatform.filter.FilterOptions;

import java.util.List;

/**
 * Fully merged description of a test run.
 *
 * @param sources                        Test containers, in caller order
 * @param runSettings                    Run settings XML after merging runner defaults
 * @param testCaseFilter                 Filter string, or null for all tests
 * @param filterOptions                  Value matching options for the filter, may be null
 * @param frequencyOfRunStatsChangeEvent Number of results reported per run statistics event
 * @param testHostLauncher               Custom launcher supplied by the client, may be null
 */
public record TestRunCriteria(
        List<String> sources,
        String runSettings,
        String testCaseFilter,
        FilterOptions filterOptions,
        int frequencyOfRunStatsChangeEvent,
        TestHostLauncher testHostLauncher
) {
    public TestRunCriteria {
        sources = List.copyOf(sources);
    }

    public boolean hasCustomTestHostLauncher() {
        return testHostLauncher != null;
    }
}
