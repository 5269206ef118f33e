package com.testplatform.core;

import com.testplatform.client.DiscoveryRequest;
import com.testplatform.client.TestDiscoveryEventsRegistrar;
import com.testplatform.client.TestEngine;
import com.testplatform.client.TestHostLauncher;
import com.testplatform.client.TestPlatformEventSource;
import com.testplatform.client.TestRunEventsRegistrar;
import com.testplatform.client.TestRunRequest;
import com.testplatform.filter.FilterOptions;
import com.testplatform.request.DefaultMetricsCollection;
import com.testplatform.request.DiscoveryCriteria;
import com.testplatform.request.DiscoveryRequestPayload;
import com.testplatform.request.MetricsCollection;
import com.testplatform.request.NoOpMetricsCollection;
import com.testplatform.request.ProtocolConfig;
import com.testplatform.request.RequestContext;
import com.testplatform.request.RunSettingsUtilities;
import com.testplatform.request.RunSettingsUtilities.MergedRunSettings;
import com.testplatform.request.TelemetryDataConstants;
import com.testplatform.request.TestPlatformOptions;
import com.testplatform.request.TestRunCriteria;
import com.testplatform.request.TestRunRequestPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Turns client discovery and run requests into engine requests.
 * <p>
 * Each call merges the runner options into the request's run settings, builds the
 * criteria, creates the engine request and keeps the caller's registrar attached while
 * it executes. Telemetry start and stop events bracket every call.
 * <p>
 * Runs are single-flight: one run at a time, from creation of the run request until
 * the registrar has been detached. Discovery requests are not serialized.
 * <p>
 * Failures classified as {@link ErrorKind#PLATFORM_ERROR}, {@link ErrorKind#SETTINGS_ERROR}
 * or {@link ErrorKind#INVALID_OPERATION_ERROR} are logged and reported as {@code false};
 * anything else propagates to the caller.
 */
public class TestRequestManager {

    private static final Logger log = LoggerFactory.getLogger(TestRequestManager.class);

    private final TestEngine testEngine;
    private final TestPlatformEventSource eventSource;
    private volatile RunnerOptions options;

    private final Object runLock = new Object();
    private final RunRequestSlot activeRun = new RunRequestSlot();

    public TestRequestManager(RunnerOptions options, TestEngine testEngine, TestPlatformEventSource eventSource) {
        this.options = Objects.requireNonNull(options, "options");
        this.testEngine = Objects.requireNonNull(testEngine, "testEngine");
        this.eventSource = Objects.requireNonNull(eventSource, "eventSource");
    }

    /**
     * Replace the engine's extensions with the ones found at the given paths.
     */
    public void initializeExtensions(List<String> extensionPaths) {
        Objects.requireNonNull(extensionPaths, "extensionPaths");
        log.info("Initializing extensions from {} path(s)", extensionPaths.size());
        testEngine.clearExtensions();
        testEngine.updateExtensions(extensionPaths, false);
    }

    /**
     * Discard the current runner options in favour of a default instance.
     * Used between independent client sessions.
     */
    public void resetOptions() {
        options = new RunnerOptions();
        log.debug("Runner options reset");
    }

    public RunnerOptions getOptions() {
        return options;
    }

    /**
     * Discover tests in the payload's sources.
     *
     * @param payload        Discovery request from the client
     * @param registrar      Hook attached to the discovery request while it executes
     * @param protocolConfig Protocol version for this request
     * @return true if discovery completed, false on a known operational failure
     */
    public boolean discoverTests(DiscoveryRequestPayload payload,
                                 TestDiscoveryEventsRegistrar registrar,
                                 ProtocolConfig protocolConfig) {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(registrar, "registrar");
        Objects.requireNonNull(protocolConfig, "protocolConfig");

        log.info("Discovery request received for {} source(s)", payload.sources().size());
        eventSource.discoveryRequestStart();
        try {
            RequestOutcome outcome = execute("Discovery", () -> discover(payload, registrar, protocolConfig));
            if (!outcome.success()) {
                log.error("Discovery request failed ({}): {}", outcome.errorKind(), outcome.message());
            }
            return outcome.success();
        } finally {
            eventSource.discoveryRequestStop();
        }
    }

    /**
     * Run tests in the payload's sources.
     * Blocks while another run is in progress.
     *
     * @param payload            Run request from the client
     * @param customHostLauncher Launcher for test hosts, may be null
     * @param registrar          Hook attached to the run request while it executes
     * @param protocolConfig     Protocol version for this request
     * @return true if the run completed, false on a known operational failure
     */
    public boolean runTests(TestRunRequestPayload payload,
                            TestHostLauncher customHostLauncher,
                            TestRunEventsRegistrar registrar,
                            ProtocolConfig protocolConfig) {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(registrar, "registrar");
        Objects.requireNonNull(protocolConfig, "protocolConfig");

        log.info("Run request received for {} source(s)", payload.sources().size());
        eventSource.executionRequestStart();
        try {
            RequestOutcome outcome = execute("Run",
                    () -> run(payload, customHostLauncher, registrar, protocolConfig));
            if (!outcome.success()) {
                log.error("Run request failed ({}): {}", outcome.errorKind(), outcome.message());
            }
            return outcome.success();
        } finally {
            eventSource.executionRequestStop();
        }
    }

    /**
     * Cancel the run in progress, waiting for its run request to be created first.
     */
    public void cancelTestRun() {
        log.info("Cancelling the current run");
        withActiveRun("cancel", TestRunRequest::cancelAsync);
    }

    /**
     * Abort the run in progress, waiting for its run request to be created first.
     */
    public void abortTestRun() {
        log.info("Aborting the current run");
        withActiveRun("abort", TestRunRequest::abort);
    }

    private void discover(DiscoveryRequestPayload payload,
                          TestDiscoveryEventsRegistrar registrar,
                          ProtocolConfig protocolConfig) {
        RunnerOptions current = options;
        RequestContext context = createRequestContext(protocolConfig, current);
        MergedRunSettings settings = RunSettingsUtilities.merge(payload.runSettings(), current.isDesignMode());

        String filter = payload.testCaseFilter() != null
                ? payload.testCaseFilter()
                : current.getTestCaseFilterValue();

        DiscoveryCriteria criteria = new DiscoveryCriteria(
                payload.sources(), settings.runSettings(), filter, settings.batchSize());
        context.metricsCollection().add(
                TelemetryDataConstants.NUMBER_OF_SOURCES_SENT_FOR_DISCOVERY, payload.sources().size());

        try (DiscoveryRequest request = Objects.requireNonNull(
                testEngine.createDiscoveryRequest(context, criteria), "discovery request")) {
            log.debug("Discovery request created (filter={}, batchSize={})", filter, settings.batchSize());
            try {
                registrar.registerDiscoveryEvents(request);
                request.discoverAsync();
                request.waitForCompletion();
            } finally {
                registrar.unregisterDiscoveryEvents(request);
            }
        }
        log.info("Discovery request completed");
    }

    private void run(TestRunRequestPayload payload,
                     TestHostLauncher customHostLauncher,
                     TestRunEventsRegistrar registrar,
                     ProtocolConfig protocolConfig) {
        RunnerOptions current = options;
        RequestContext context = createRequestContext(protocolConfig, current);
        MergedRunSettings settings = RunSettingsUtilities.merge(payload.runSettings(), current.isDesignMode());

        TestPlatformOptions platformOptions = payload.testPlatformOptions();
        String filter = platformOptions != null && platformOptions.testCaseFilter() != null
                ? platformOptions.testCaseFilter()
                : current.getTestCaseFilterValue();
        FilterOptions filterOptions = platformOptions != null ? platformOptions.filterOptions() : null;

        TestRunCriteria criteria = new TestRunCriteria(
                payload.sources(), settings.runSettings(), filter, filterOptions,
                settings.batchSize(), customHostLauncher);
        context.metricsCollection().add(
                TelemetryDataConstants.NUMBER_OF_SOURCES_SENT_FOR_RUN, payload.sources().size());

        synchronized (runLock) {
            try (TestRunRequest request = Objects.requireNonNull(
                    testEngine.createTestRunRequest(context, criteria), "run request")) {
                activeRun.publish(request);
                log.debug("Run request created (filter={}, batchSize={}, customLauncher={})",
                        filter, settings.batchSize(), criteria.hasCustomTestHostLauncher());
                try {
                    registrar.registerTestRunEvents(request);
                    request.executeAsync();
                    request.waitForCompletion();
                } finally {
                    registrar.unregisterTestRunEvents(request);
                    activeRun.clear();
                }
            }
        }
        log.info("Run request completed");
    }

    private RequestOutcome execute(String requestType, Runnable action) {
        try {
            action.run();
            return RequestOutcome.succeeded();
        } catch (RuntimeException e) {
            ErrorKind kind = ErrorKind.classify(e);
            if (!kind.isKnown()) {
                throw e;
            }
            log.debug("{} request failure details", requestType, e);
            return RequestOutcome.failed(kind, e.getMessage());
        }
    }

    private void withActiveRun(String action, Consumer<TestRunRequest> operation) {
        Optional<TestRunRequest> request;
        try {
            request = activeRun.await(options.getRunRequestWaitTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for a run request to {}", action);
            return;
        }

        if (request.isEmpty()) {
            log.warn("No run request was created within {}, nothing to {}",
                    options.getRunRequestWaitTimeout(), action);
            return;
        }
        operation.accept(request.get());
    }

    private static RequestContext createRequestContext(ProtocolConfig protocolConfig, RunnerOptions options) {
        MetricsCollection metrics = options.isTelemetryOptedIn()
                ? new DefaultMetricsCollection()
                : new NoOpMetricsCollection();
        metrics.add(TelemetryDataConstants.PROTOCOL_VERSION, protocolConfig.version());
        return new RequestContext(protocolConfig, metrics);
    }
}
