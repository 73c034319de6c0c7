package com.heronix.assignment.ratelimit;

import java.time.Duration;

import com.heronix.assignment.exception.AssignmentInterruptedException;

/**
 * Suspends the calling thread. Injected so tests can run on simulated time.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;

    /**
     * Sleep, turning an interrupt into {@link AssignmentInterruptedException}.
     * The thread's interrupt flag is restored.
     */
    default void pause(Duration duration) {
        try {
            sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssignmentInterruptedException("Interrupted while waiting " + duration, e);
        }
    }
}
