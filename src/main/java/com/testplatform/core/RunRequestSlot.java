package com.testplatform.core;

import com.testplatform.client.TestRunRequest;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Holds the run request of the run in progress.
 * Cancel and abort wait here until the run request has been created.
 * <p>
 * A waiter that finds no active run is answered by the next publication, even
 * when that run has already finished and cleared the slot before the waiter woke up.
 */
final class RunRequestSlot {

    private final Object monitor = new Object();
    private TestRunRequest current;
    private TestRunRequest lastPublished;
    private long publications;

    void publish(TestRunRequest request) {
        synchronized (monitor) {
            current = request;
            lastPublished = request;
            publications++;
            monitor.notifyAll();
        }
    }

    void clear() {
        synchronized (monitor) {
            current = null;
        }
    }

    /**
     * Wait for a run request.
     *
     * @param timeout Maximum time to wait
     * @return The active run request, else the first one published while waiting;
     *         empty if none was published in time
     * @throws InterruptedException if interrupted while waiting
     */
    Optional<TestRunRequest> await(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (monitor) {
            if (current != null) {
                return Optional.of(current);
            }
            long seen = publications;
            while (publications == seen) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return Optional.empty();
                }
                TimeUnit.NANOSECONDS.timedWait(monitor, remaining);
            }
            return Optional.of(lastPublished);
        }
    }
}
