package io.voicecast.application.service;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide cancellation flag shared by the worker and every wait it performs.
 *
 * Set once, never cleared. {@link #await(Duration)} replaces {@code Thread.sleep} at every
 * suspension point so a pending wait returns as soon as shutdown is requested.
 */
public final class ShutdownSignal {

    private final AtomicBoolean triggered = new AtomicBoolean(false);
    private final CountDownLatch latch = new CountDownLatch(1);

    /**
     * Request shutdown.
     *
     * @return true for the call that actually set the signal, false if it was already set
     */
    public boolean trigger() {
        if (triggered.compareAndSet(false, true)) {
            latch.countDown();
            return true;
        }
        return false;
    }

    public boolean isTriggered() {
        return triggered.get();
    }

    /**
     * Wait up to {@code timeout}, returning early if shutdown is requested.
     * An interrupt counts as a shutdown request; the interrupt flag is preserved.
     *
     * @return true if shutdown was requested before or during the wait
     */
    public boolean await(Duration timeout) {
        if (timeout.isNegative() || timeout.isZero()) {
            return isTriggered();
        }
        try {
            return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
