package com.heronix.assignment.service.executor;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import com.heronix.assignment.adapter.DeviceManagerPort;
import com.heronix.assignment.exception.AssignmentInterruptedException;
import com.heronix.assignment.model.domain.OperationResult;
import com.heronix.assignment.model.enums.OperationType;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Polls an async operation handle and reports the terminal state against the
 * batch it belongs to. A poll failure or timeout fails that batch only.
 */
@Slf4j
@RequiredArgsConstructor
public class CompletionWaiter {

    private final DeviceManagerPort deviceManager;
    private final Duration timeout;

    public OperationResult await(OperationType type, List<UUID> deviceIds,
                                 List<String> deviceSerials, String operationUrl) {
        try {
            OperationResult status = deviceManager.waitForCompletion(operationUrl, timeout);
            if (status != null && status.success()) {
                return OperationResult.success(type, deviceIds, deviceSerials, operationUrl);
            }
            String error = status != null && status.error() != null ? status.error() : "Operation failed";
            log.error("{} operation {} did not complete: {}", type.getValue(), operationUrl, error);
            return OperationResult.failure(type, deviceIds, deviceSerials, error, operationUrl);
        } catch (AssignmentInterruptedException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Failed waiting for {} operation {}: {}", type.getValue(), operationUrl, e.getMessage());
            return OperationResult.failure(type, deviceIds, deviceSerials, e.getMessage(), operationUrl);
        }
    }
}
