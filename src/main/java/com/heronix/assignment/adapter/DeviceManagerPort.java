package com.heronix.assignment.adapter;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.heronix.assignment.model.domain.OperationResult;
import com.heronix.assignment.model.enums.DeviceType;

/**
 * Device-management operations of the external platform.
 *
 * Batched operations accept at most {@link #MAX_DEVICES_PER_CALL} device
 * identifiers. Each returns an {@link OperationResult} that may carry an async
 * operation handle; {@link #waitForCompletion(String, Duration)} polls such a
 * handle to its terminal state. Implementations may also throw; callers treat
 * a thrown exception like a failed result.
 */
public interface DeviceManagerPort {

    /**
     * Hard ceiling of the provider API.
     */
    int MAX_DEVICES_PER_CALL = 25;

    // ========================================================================
    // POST
    // ========================================================================

    /**
     * Register a device that is not yet in inventory.
     *
     * @param serial     device serial number
     * @param deviceType type of device
     * @param macAddress MAC address (required for NETWORK devices)
     * @param partNumber part number (required for COMPUTE/STORAGE devices)
     * @param tags       optional initial tags, may be null
     * @return result of the call
     */
    OperationResult addDevice(String serial, DeviceType deviceType, String macAddress,
                              String partNumber, Map<String, String> tags);

    // ========================================================================
    // PATCH
    // ========================================================================

    OperationResult assignSubscription(List<UUID> deviceIds, UUID subscriptionId);

    /**
     * The provider needs the region together with the application.
     */
    OperationResult assignApplication(List<UUID> deviceIds, UUID applicationId, String region);

    /**
     * @param tags tag key-value pairs; a null value removes the tag
     */
    OperationResult updateTags(List<UUID> deviceIds, Map<String, String> tags);

    OperationResult archiveDevices(List<UUID> deviceIds);

    OperationResult unarchiveDevices(List<UUID> deviceIds);

    /**
     * Devices should be archived before removal.
     */
    OperationResult removeDevices(List<UUID> deviceIds);

    // ========================================================================
    // ASYNC OPERATIONS
    // ========================================================================

    /**
     * Poll an async operation until it reaches a terminal state or times out.
     *
     * @param operationUrl handle returned by an earlier call
     * @param timeout      maximum time to wait
     * @return terminal result; a timeout is reported as a failure
     */
    OperationResult waitForCompletion(String operationUrl, Duration timeout);
}
