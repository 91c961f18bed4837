package com.jreinhal.edbot.rag.tier;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deadline and cooperative cancellation signal for one question, or for one tier call within it.
 * A tier context expires no later than its parent and is cancelled whenever its parent is.
 */
public final class RetrievalContext {
    private final Clock clock;
    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final RetrievalContext parent;

    private RetrievalContext(Clock clock, Instant deadline, RetrievalContext parent) {
        this.clock = clock;
        this.deadline = deadline;
        this.parent = parent;
    }

    public static RetrievalContext withTimeout(long timeoutMs) {
        return withTimeout(Clock.systemUTC(), timeoutMs);
    }

    public static RetrievalContext withTimeout(Clock clock, long timeoutMs) {
        return new RetrievalContext(clock, clock.instant().plusMillis(Math.max(0L, timeoutMs)), null);
    }

    /**
     * Child context for a single tier call, bounded by both the tier timeout and this deadline.
     */
    public RetrievalContext forTier(long tierTimeoutMs) {
        Instant tierDeadline = this.clock.instant().plusMillis(Math.max(0L, tierTimeoutMs));
        return new RetrievalContext(this.clock, tierDeadline.isBefore(this.deadline) ? tierDeadline : this.deadline, this);
    }

    public Instant deadline() {
        return this.deadline;
    }

    public long remainingMs() {
        return Math.max(0L, this.deadline.toEpochMilli() - this.clock.millis());
    }

    public boolean isExpired() {
        return this.remainingMs() <= 0L;
    }

    public boolean isCancelled() {
        return this.cancelled.get() || (this.parent != null && this.parent.isCancelled());
    }

    /**
     * True once the work under this context should stop, either by cancellation or deadline.
     */
    public boolean shouldStop() {
        return this.isCancelled() || this.isExpired();
    }

    public void cancel() {
        this.cancelled.set(true);
    }
}
