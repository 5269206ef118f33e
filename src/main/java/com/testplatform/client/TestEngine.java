package com.testplatform.client;

import com.testplatform.request.DiscoveryCriteria;
import com.testplatform.request.RequestContext;
import com.testplatform.request.TestRunCriteria;

import java.util.List;

/**
 * Execution engine that turns criteria into discovery and run requests.
 * Implementations own test host processes and the wire protocol.
 * <p>
 * Operational failures are reported as {@link com.testplatform.exception.TestPlatformException},
 * invalid settings as {@link com.testplatform.exception.SettingsException} and calls in an
 * unsupported state as {@link IllegalStateException}.
 */
public interface TestEngine {

    /**
     * Create a discovery request; discovery starts with {@link DiscoveryRequest#discoverAsync()}.
     */
    DiscoveryRequest createDiscoveryRequest(RequestContext context, DiscoveryCriteria criteria);

    /**
     * Create a run request; execution starts with {@link TestRunRequest#executeAsync()}.
     */
    TestRunRequest createTestRunRequest(RequestContext context, TestRunCriteria criteria);

    /**
     * Forget every extension loaded so far.
     */
    void clearExtensions();

    /**
     * Load extensions from the given paths.
     *
     * @param extensionPaths           Extension assembly or jar paths
     * @param skipExtensionFilters     Load every path, not only names matching the extension patterns
     */
    void updateExtensions(List<String> extensionPaths, boolean skipExtensionFilters);
}
