package com.jreinhal.edbot.util;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Closed/open/half-open breaker guarding one retrieval tier's store.
 * While open the tier is skipped; after the open period a single probe call is let through.
 */
public class TierCircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(TierCircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String name;
    private final int failureThreshold;
    private final Duration openDuration;
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicInteger probesInFlight = new AtomicInteger(0);
    private volatile long reopenAtEpochMs = 0L;
    private volatile State state = State.CLOSED;

    public TierCircuitBreaker(String name, int failureThreshold, Duration openDuration) {
        this.name = name;
        this.failureThreshold = Math.max(1, failureThreshold);
        this.openDuration = openDuration == null || openDuration.isNegative() ? Duration.ofSeconds(30) : openDuration;
    }

    public boolean tryAcquire() {
        if (this.state == State.CLOSED) {
            return true;
        }
        long now = System.currentTimeMillis();
        if (this.state == State.OPEN) {
            if (now < this.reopenAtEpochMs) {
                return false;
            }
            synchronized (this) {
                if (this.state == State.OPEN && now >= this.reopenAtEpochMs) {
                    this.state = State.HALF_OPEN;
                    this.probesInFlight.set(0);
                    log.info("Circuit '{}' half-open; allowing a probe call", this.name);
                }
            }
        }
        if (this.probesInFlight.incrementAndGet() <= 1) {
            return true;
        }
        this.probesInFlight.decrementAndGet();
        return false;
    }

    public void onSuccess() {
        if (this.state == State.CLOSED) {
            this.consecutiveFailures.set(0);
            return;
        }
        synchronized (this) {
            if (this.state != State.CLOSED) {
                log.info("Circuit '{}' closed after successful probe", this.name);
            }
            this.state = State.CLOSED;
            this.consecutiveFailures.set(0);
            this.probesInFlight.set(0);
            this.reopenAtEpochMs = 0L;
        }
    }

    public void onFailure() {
        if (this.state == State.HALF_OPEN) {
            trip();
            return;
        }
        if (this.consecutiveFailures.incrementAndGet() >= this.failureThreshold) {
            trip();
        }
    }

    /**
     * Gives back a half-open probe slot when the call ended without saying anything about the store's health.
     */
    public void releaseProbe() {
        if (this.state == State.HALF_OPEN) {
            this.probesInFlight.updateAndGet(n -> Math.max(0, n - 1));
        }
    }

    public State getState() {
        return this.state;
    }

    public String getName() {
        return this.name;
    }

    private void trip() {
        synchronized (this) {
            this.state = State.OPEN;
            this.reopenAtEpochMs = System.currentTimeMillis() + this.openDuration.toMillis();
            this.consecutiveFailures.set(0);
            this.probesInFlight.set(0);
        }
        log.warn("Circuit '{}' opened for {}s after repeated store failures", this.name, this.openDuration.toSeconds());
    }
}
