package com.heronix.assignment.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

import com.heronix.assignment.model.enums.RateClass;

/**
 * Supplies the gate a call sequence must pass through.
 */
@FunctionalInterface
public interface RateGateFactory {

    RateGate forSequence(RateClass rateClass);

    /**
     * A new {@link FixedIntervalRateGate} for every sequence. Separate runs do
     * not coordinate with each other.
     */
    static RateGateFactory perSequence(Map<RateClass, Duration> intervals, Sleeper sleeper) {
        Map<RateClass, Duration> copy = new EnumMap<>(RateClass.class);
        copy.putAll(intervals);
        return rateClass -> new FixedIntervalRateGate(rateClass.name(), intervalFor(copy, rateClass), sleeper);
    }

    /**
     * One {@link SharedRateGate} per rate class. Every sequence paces through
     * it and gets its own view for counting.
     */
    static RateGateFactory shared(Map<RateClass, Duration> intervals, Sleeper sleeper, Clock clock) {
        Map<RateClass, SharedRateGate> gates = new EnumMap<>(RateClass.class);
        for (RateClass rateClass : RateClass.values()) {
            gates.put(rateClass, new SharedRateGate(rateClass.name(), intervalFor(intervals, rateClass), sleeper, clock));
        }
        return rateClass -> gates.get(rateClass).newSequence();
    }

    /**
     * Gates that never wait.
     */
    static RateGateFactory unlimited() {
        return rateClass -> RateGate.none();
    }

    private static Duration intervalFor(Map<RateClass, Duration> intervals, RateClass rateClass) {
        Duration interval = intervals.get(rateClass);
        if (interval == null) {
            throw new IllegalArgumentException("No interval configured for " + rateClass);
        }
        return interval;
    }
}
