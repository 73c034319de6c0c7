package com.heronix.assignment.model.domain;

import java.util.List;
import java.util.UUID;

import com.heronix.assignment.model.enums.OperationType;

/**
 * Outcome of one external call (one batch, or one device creation).
 *
 * @param operationUrl async operation handle returned by the provider, if any
 */
public record OperationResult(
        boolean success,
        OperationType operationType,
        List<UUID> deviceIds,
        List<String> deviceSerials,
        String error,
        String operationUrl
) {

    public OperationResult {
        deviceIds = deviceIds == null ? List.of() : List.copyOf(deviceIds);
        deviceSerials = deviceSerials == null ? List.of() : List.copyOf(deviceSerials);
    }

    public static OperationResult success(OperationType type, List<UUID> deviceIds,
                                          List<String> deviceSerials, String operationUrl) {
        return new OperationResult(true, type, deviceIds, deviceSerials, null, operationUrl);
    }

    public static OperationResult failure(OperationType type, List<UUID> deviceIds,
                                          List<String> deviceSerials, String error) {
        return new OperationResult(false, type, deviceIds, deviceSerials, error, null);
    }

    public static OperationResult failure(OperationType type, List<UUID> deviceIds,
                                          List<String> deviceSerials, String error, String operationUrl) {
        return new OperationResult(false, type, deviceIds, deviceSerials, error, operationUrl);
    }

    public boolean hasOperationUrl() {
        return operationUrl != null && !operationUrl.isBlank();
    }
}
