package com.heronix.assignment.model.domain;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Result of one phased assignment run.
 *
 * {@code success} is true iff no operation failed in any phase.
 */
@Value
@Builder
public class ApplyResult {

    boolean success;

    @Singular
    List<OperationResult> operations;

    @Singular
    List<PhaseResult> phaseResults;

    int devicesCreated;
    int applicationsAssigned;
    int subscriptionsAssigned;
    int tagsUpdated;
    int errors;

    @Singular("newDeviceAdded")
    List<String> newDevicesAdded;

    @Singular("newDeviceFailed")
    List<String> newDevicesFailed;

    LocalDateTime startedAt;
    LocalDateTime completedAt;
    Duration totalDuration;
}
