package io.limitgraph.session;

import java.util.concurrent.Semaphore;

/**
 * Counting gate bounding how many trace-producing tasks run inside one session.
 */
public final class AdmissionGate {
    private final int capacity;
    private final Semaphore permits;

    public AdmissionGate(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("gate capacity must be > 0");
        }
        this.capacity = capacity;
        this.permits = new Semaphore(capacity, true);
    }

    public void acquire() throws InterruptedException {
        permits.acquire();
    }

    public boolean tryAcquire() {
        return permits.tryAcquire();
    }

    public void release() {
        permits.release();
    }

    public int capacity() {
        return capacity;
    }

    public int inFlight() {
        return capacity - permits.availablePermits();
    }
}
