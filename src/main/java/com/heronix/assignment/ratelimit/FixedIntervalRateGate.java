package com.heronix.assignment.ratelimit;

import java.time.Duration;

import lombok.extern.slf4j.Slf4j;

/**
 * Gate for a single call sequence. Every call except the first waits the full
 * interval before it proceeds, so n calls take at least {@code (n - 1) * interval}.
 *
 * Not shared between sequences and not thread-safe.
 */
@Slf4j
public class FixedIntervalRateGate implements RateGate {

    private final String name;
    private final Duration interval;
    private final Sleeper sleeper;

    private int callCount;
    private Duration totalWait = Duration.ZERO;

    public FixedIntervalRateGate(String name, Duration interval, Sleeper sleeper) {
        if (interval == null || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be zero or positive");
        }
        this.name = name;
        this.interval = interval;
        this.sleeper = sleeper;
    }

    @Override
    public void waitBeforeCall(int callIndex) {
        if (callIndex > 0 && !interval.isZero()) {
            log.info("Rate gate: waiting {}ms before call {} ({} rate limit protection)",
                    interval.toMillis(), callIndex + 1, name);
            sleeper.pause(interval);
            totalWait = totalWait.plus(interval);
        }
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
