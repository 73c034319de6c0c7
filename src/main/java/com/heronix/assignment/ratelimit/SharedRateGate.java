package com.heronix.assignment.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import lombok.extern.slf4j.Slf4j;

/**
 * Process-wide gate for one rate class. Spacing is measured from the last
 * admitted call of any sequence, so concurrent runs share the provider quota.
 *
 * Callers queue on the gate's monitor while one of them sleeps. Counters are
 * read without the monitor. {@link #newSequence()} hands a run its own view so
 * it can report the calls and wait time that belong to it.
 */
@Slf4j
public class SharedRateGate implements RateGate {

    private final String name;
    private final Duration interval;
    private final Sleeper sleeper;
    private final Clock clock;

    // Guarded by this
    private Instant lastCallAt;

    private final AtomicInteger callCount = new AtomicInteger();
    private final AtomicLong totalWaitNanos = new AtomicLong();

    public SharedRateGate(String name, Duration interval, Sleeper sleeper, Clock clock) {
        if (interval == null || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be zero or positive");
        }
        this.name = name;
        this.interval = interval;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    @Override
    public void waitBeforeCall(int callIndex) {
        admit(callIndex);
    }

    /**
     * Block until the next call may proceed.
     *
     * @return time this caller slept
     */
    synchronized Duration admit(int callIndex) {
        Instant now = clock.instant();
        Duration waited = Duration.ZERO;
        if (lastCallAt != null) {
            Duration remaining = interval.minus(Duration.between(lastCallAt, now));
            if (!remaining.isNegative() && !remaining.isZero()) {
                log.info("Shared rate gate: waiting {}ms before call {} ({} rate limit protection)",
                        remaining.toMillis(), callIndex + 1, name);
                sleeper.pause(remaining);
                waited = remaining;
                totalWaitNanos.addAndGet(remaining.toNanos());
                Instant earliest = now.plus(remaining);
                now = clock.instant();
                if (now.isBefore(earliest)) {
                    now = earliest;
                }
            }
        }
        lastCallAt = now;
        callCount.incrementAndGet();
        return waited;
    }

    /**
     * A per-run view that paces through this gate but counts only its own calls.
     */
    public RateGate newSequence() {
        return new Sequence();
    }

    @Override
    public Duration getInterval() {
        return interval;
    }

    /**
     * Calls admitted across all sequences.
     */
    @Override
    public int getCallCount() {
        return callCount.get();
    }

    /**
     * Wait time across all sequences.
     */
    @Override
    public Duration getTotalWait() {
        return Duration.ofNanos(totalWaitNanos.get());
    }

    private final class Sequence implements RateGate {

        private int callCount;
        private Duration totalWait = Duration.ZERO;

        @Override
        public void waitBeforeCall(int callIndex) {
            totalWait = totalWait.plus(admit(callIndex));
            callCount++;
        }

        @Override
        public Duration getInterval() {
            return interval;
        }

        @Override
        public int getCallCount() {
            return callCount;
        }

        @Override
        public Duration getTotalWait() {
            return totalWait;
        }
    }
}
