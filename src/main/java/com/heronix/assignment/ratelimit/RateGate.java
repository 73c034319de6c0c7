package com.heronix.assignment.ratelimit;

import java.time.Duration;

/**
 * Enforces a fixed minimum delay between successive calls of one rate class.
 *
 * No burst allowance, no adaptive backoff, no jitter.
 */
public interface RateGate {

    /**
     * Block until the call at {@code callIndex} (0-based) may proceed.
     */
    void waitBeforeCall(int callIndex);

    Duration getInterval();

    /**
     * Number of calls admitted so far.
     */
    int getCallCount();

    /**
     * Time spent waiting so far.
     */
    Duration getTotalWait();

    /**
     * Advisory wait time for {@code calls} calls: {@code (calls - 1) * interval}.
     */
    default Duration estimate(int calls) {
        if (calls <= 1) {
            return Duration.ZERO;
        }
        return getInterval().multipliedBy(calls - 1L);
    }

    /**
     * Gate that never waits.
     */
    static RateGate none() {
        return new FixedIntervalRateGate("unlimited", Duration.ZERO, Sleeper.SYSTEM);
    }
}
