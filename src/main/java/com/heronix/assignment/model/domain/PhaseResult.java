package com.heronix.assignment.model.domain;

import java.time.Duration;
import java.util.List;

/**
 * Result of one workflow phase.
 */
public record PhaseResult(
        String phaseName,
        boolean success,
        List<OperationResult> operations,
        int devicesProcessed,
        int errors,
        Duration duration
) {

    public PhaseResult {
        operations = operations == null ? List.of() : List.copyOf(operations);
    }

    /**
     * Phase outcome derived from its operations.
     */
    public static PhaseResult of(String phaseName, List<OperationResult> operations,
                                 int devicesProcessed, Duration duration) {
        int errors = (int) operations.stream().filter(op -> !op.success()).count();
        return new PhaseResult(phaseName, errors == 0, operations, devicesProcessed, errors, duration);
    }

    /**
     * Phase that failed outside of any device-manager call (sync or lookup).
     */
    public static PhaseResult failed(String phaseName, Duration duration) {
        return new PhaseResult(phaseName, false, List.of(), 0, 1, duration);
    }
}
