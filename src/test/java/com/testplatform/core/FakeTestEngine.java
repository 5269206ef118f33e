package com.testplatform.core;

import com.testplatform.client.DiscoveryRequest;
import com.testplatform.client.TestDiscoveryEventsRegistrar;
import com.testplatform.client.TestEngine;
import com.testplatform.client.TestPlatformEventSource;
import com.testplatform.client.TestRunEventsRegistrar;
import com.testplatform.client.TestRunRequest;
import com.testplatform.request.DiscoveryCriteria;
import com.testplatform.request.RequestContext;
import com.testplatform.request.TestRunCriteria;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Engine double that records what the request manager asks of it.
 * Every interaction is appended to {@link #events}.
 */
class FakeTestEngine implements TestEngine {

    final List<String> events = Collections.synchronizedList(new ArrayList<>());
    final AtomicInteger runRequestsCreated = new AtomicInteger();

    volatile RequestContext lastContext;
    volatile DiscoveryCriteria lastDiscoveryCriteria;
    volatile TestRunCriteria lastRunCriteria;

    /** Thrown from create*Request when set. */
    volatile RuntimeException createFailure;
    /** Thrown from waitForCompletion when set. */
    volatile RuntimeException executionFailure;
    /** When set, run requests block in waitForCompletion until cancelled, aborted or released. */
    volatile boolean blockRuns;

    final List<FakeRunRequest> runRequests = Collections.synchronizedList(new ArrayList<>());
    List<String> extensionPaths;

    @Override
    public DiscoveryRequest createDiscoveryRequest(RequestContext context, DiscoveryCriteria criteria) {
        lastContext = context;
        lastDiscoveryCriteria = criteria;
        if (createFailure != null) {
            throw createFailure;
        }
        events.add("createDiscovery");
        return new FakeDiscoveryRequest();
    }

    @Override
    public TestRunRequest createTestRunRequest(RequestContext context, TestRunCriteria criteria) {
        lastContext = context;
        lastRunCriteria = criteria;
        if (createFailure != null) {
            throw createFailure;
        }
        int id = runRequestsCreated.incrementAndGet();
        events.add("create-" + id);
        FakeRunRequest request = new FakeRunRequest(id, blockRuns);
        runRequests.add(request);
        return request;
    }

    @Override
    public void clearExtensions() {
        events.add("clearExtensions");
    }

    @Override
    public void updateExtensions(List<String> extensionPaths, boolean skipExtensionFilters) {
        events.add("updateExtensions:" + skipExtensionFilters);
        this.extensionPaths = extensionPaths;
    }

    class FakeDiscoveryRequest implements DiscoveryRequest {

        @Override
        public void discoverAsync() {
            events.add("discoverAsync");
        }

        @Override
        public void waitForCompletion() {
            if (executionFailure != null) {
                throw executionFailure;
            }
            events.add("discoveryCompleted");
        }

        @Override
        public void close() {
            events.add("closeDiscovery");
        }
    }

    class FakeRunRequest implements TestRunRequest {

        final int id;
        final CountDownLatch started = new CountDownLatch(1);
        final CountDownLatch completion;
        final AtomicInteger cancelCount = new AtomicInteger();
        final AtomicInteger abortCount = new AtomicInteger();

        FakeRunRequest(int id, boolean block) {
            this.id = id;
            this.completion = new CountDownLatch(block ? 1 : 0);
        }

        @Override
        public int executeAsync() {
            events.add("execute-" + id);
            started.countDown();
            return 1000 + id;
        }

        @Override
        public void waitForCompletion() {
            if (executionFailure != null) {
                throw executionFailure;
            }
            try {
                if (!completion.await(10, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("run " + id + " never completed");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted", e);
            }
        }

        @Override
        public void cancelAsync() {
            events.add("cancel-" + id);
            cancelCount.incrementAndGet();
            completion.countDown();
        }

        @Override
        public void abort() {
            events.add("abort-" + id);
            abortCount.incrementAndGet();
            completion.countDown();
        }

        void release() {
            completion.countDown();
        }

        @Override
        public void close() {
            events.add("close-" + id);
        }
    }

    /**
     * Registrar recording attach and detach into the engine's event list.
     */
    class RecordingRegistrar implements TestRunEventsRegistrar, TestDiscoveryEventsRegistrar {

        @Override
        public void registerTestRunEvents(TestRunRequest request) {
            events.add("register-" + ((FakeRunRequest) request).id);
        }

        @Override
        public void unregisterTestRunEvents(TestRunRequest request) {
            events.add("unregister-" + ((FakeRunRequest) request).id);
        }

        @Override
        public void registerDiscoveryEvents(DiscoveryRequest request) {
            events.add("registerDiscovery");
        }

        @Override
        public void unregisterDiscoveryEvents(DiscoveryRequest request) {
            events.add("unregisterDiscovery");
        }
    }

    /**
     * Event source counting start and stop notifications.
     */
    static class CountingEventSource implements TestPlatformEventSource {

        final AtomicInteger discoveryStarts = new AtomicInteger();
        final AtomicInteger discoveryStops = new AtomicInteger();
        final AtomicInteger executionStarts = new AtomicInteger();
        final AtomicInteger executionStops = new AtomicInteger();

        @Override
        public void discoveryRequestStart() {
            discoveryStarts.incrementAndGet();
        }

        @Override
        public void discoveryRequestStop() {
            discoveryStops.incrementAndGet();
        }

        @Override
        public void executionRequestStart() {
            executionStarts.incrementAndGet();
        }

        @Override
        public void executionRequestStop() {
            executionStops.incrementAndGet();
        }
    }
}
