package com.heronix.assignment.model.domain;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import com.heronix.assignment.model.enums.WorkflowAction;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Result of an archive, unarchive or remove run.
 */
@Value
@Builder
public class ActionResult {

    boolean success;
    WorkflowAction action;

    @Singular
    List<OperationResult> operations;

    int devicesProcessed;
    int devicesSucceeded;
    int devicesFailed;

    /**
     * Devices left out because they have no inventory identifier.
     */
    int devicesSkipped;

    @Singular
    List<UUID> failedDeviceIds;

    @Singular
    List<String> failedDeviceSerials;

    LocalDateTime startedAt;
    LocalDateTime completedAt;
    Duration totalDuration;
}
