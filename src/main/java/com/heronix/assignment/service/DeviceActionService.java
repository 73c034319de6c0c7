package com.heronix.assignment.service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.heronix.assignment.adapter.DeviceManagerPort;
import com.heronix.assignment.adapter.InventorySyncPort;
import com.heronix.assignment.config.AssignmentProperties;
import com.heronix.assignment.exception.AssignmentInterruptedException;
import com.heronix.assignment.exception.InvalidWorkflowActionException;
import com.heronix.assignment.model.domain.ActionResult;
import com.heronix.assignment.model.domain.DeviceAssignment;
import com.heronix.assignment.model.domain.OperationResult;
import com.heronix.assignment.model.enums.OperationType;
import com.heronix.assignment.model.enums.RateClass;
import com.heronix.assignment.model.enums.WorkflowAction;
import com.heronix.assignment.ratelimit.RateGate;
import com.heronix.assignment.ratelimit.RateGateFactory;
import com.heronix.assignment.service.batch.BatchPlanner;
import com.heronix.assignment.service.executor.CompletionWaiter;

import lombok.extern.slf4j.Slf4j;

/**
 * Archive, unarchive and remove devices in batches.
 *
 * Devices without an inventory identifier are counted as skipped. Batches run
 * one after another through the injected gate source; a failed batch does not
 * stop the next one. An optional resync afterwards never changes the result.
 *
 * Batches are paced by the PATCH gate only when {@code actions.rate-limited}
 * is set.
 *
 * @author Heronix Development Team
 */
@Service
@Slf4j
public class DeviceActionService {

    private final DeviceManagerPort deviceManager;
    private final RateGateFactory rateGates;
    private final CompletionWaiter completionWaiter;
    private final InventorySyncPort inventorySync;
    private final int maxBatchSize;
    private final boolean syncSubscriptions;

    @Autowired
    public DeviceActionService(DeviceManagerPort deviceManager,
                               RateGateFactory rateGateFactory,
                               CompletionWaiter completionWaiter,
                               ObjectProvider<InventorySyncPort> inventorySync,
                               AssignmentProperties properties) {
        this(deviceManager,
                properties.getActions().isRateLimited() ? rateGateFactory : RateGateFactory.unlimited(),
                completionWaiter,
                inventorySync.getIfAvailable(),
                properties.getBatch().getMaxSize(),
                properties.getActions().isSyncSubscriptions());
    }

    /**
     * @param rateGates     gate source for action batches; {@link RateGateFactory#unlimited()} disables pacing
     * @param inventorySync optional, no resync happens when null
     */
    public DeviceActionService(DeviceManagerPort deviceManager,
                               RateGateFactory rateGates,
                               CompletionWaiter completionWaiter,
                               InventorySyncPort inventorySync,
                               int maxBatchSize,
                               boolean syncSubscriptions) {
        this.deviceManager = deviceManager;
        this.rateGates = rateGates;
        this.completionWaiter = completionWaiter;
        this.inventorySync = inventorySync;
        this.maxBatchSize = maxBatchSize;
        this.syncSubscriptions = syncSubscriptions;
    }

    public ActionResult archive(List<DeviceAssignment> devices, boolean waitForCompletion, boolean syncAfter) {
        return execute(WorkflowAction.ARCHIVE, devices, waitForCompletion, syncAfter);
    }

    public ActionResult unarchive(List<DeviceAssignment> devices, boolean waitForCompletion, boolean syncAfter) {
        return execute(WorkflowAction.UNARCHIVE, devices, waitForCompletion, syncAfter);
    }

    /**
     * Devices should be archived before removal.
     */
    public ActionResult remove(List<DeviceAssignment> devices, boolean waitForCompletion, boolean syncAfter) {
        return execute(WorkflowAction.REMOVE, devices, waitForCompletion, syncAfter);
    }

    /**
     * Run one action over the given devices.
     *
     * @throws InvalidWorkflowActionException for {@code ASSIGN}, before any work starts
     */
    public ActionResult execute(WorkflowAction action, List<DeviceAssignment> devices,
                                boolean waitForCompletion, boolean syncAfter) {
        if (action == null || action == WorkflowAction.ASSIGN) {
            throw new InvalidWorkflowActionException(action,
                    "Action " + (action == null ? "null" : action.getValue())
                            + " is not a device action; use the assignment workflow instead");
        }

        LocalDateTime startedAt = LocalDateTime.now();
        log.info("Starting {} action for {} devices", action.getValue(), devices.size());

        List<DeviceAssignment> validDevices = devices.stream()
                .filter(d -> d.getDeviceId() != null)
                .toList();
        int skipped = devices.size() - validDevices.size();
        if (skipped > 0) {
            log.warn("Skipping {} devices without IDs", skipped);
        }

        ActionResult.ActionResultBuilder result = ActionResult.builder()
                .action(action)
                .devicesProcessed(devices.size())
                .devicesSkipped(skipped)
                .startedAt(startedAt);

        if (validDevices.isEmpty()) {
            log.warn("No valid devices to process");
            LocalDateTime completedAt = LocalDateTime.now();
            return result.success(true)
                    .completedAt(completedAt)
                    .totalDuration(Duration.between(startedAt, completedAt))
                    .build();
        }

        List<OperationResult> operations = executeBatched(action, validDevices, waitForCompletion);

        int succeeded = 0;
        int failed = 0;
        for (OperationResult op : operations) {
            if (op.success()) {
                succeeded += op.deviceIds().size();
            } else {
                failed += op.deviceIds().size();
                result.failedDeviceIds(op.deviceIds());
                result.failedDeviceSerials(op.deviceSerials());
            }
        }

        if (syncAfter && inventorySync != null) {
            resync();
        }

        LocalDateTime completedAt = LocalDateTime.now();
        ActionResult actionResult = result
                .success(failed == 0)
                .operations(operations)
                .devicesSucceeded(succeeded)
                .devicesFailed(failed)
                .completedAt(completedAt)
                .totalDuration(Duration.between(startedAt, completedAt))
                .build();

        log.info("{} complete in {}ms: {} succeeded, {} failed, {} skipped",
                action.getValue(), actionResult.getTotalDuration().toMillis(), succeeded, failed, skipped);

        return actionResult;
    }

    private List<OperationResult> executeBatched(WorkflowAction action, List<DeviceAssignment> devices,
                                                 boolean waitForCompletion) {
        OperationType type = action.getOperationType();
        List<List<DeviceAssignment>> batches = BatchPlanner.chunk(devices, maxBatchSize);
        RateGate gate = rateGates.forSequence(RateClass.PATCH);
        List<OperationResult> results = new ArrayList<>();

        for (int index = 0; index < batches.size(); index++) {
            gate.waitBeforeCall(index);

            List<DeviceAssignment> batch = batches.get(index);
            List<UUID> deviceIds = batch.stream().map(DeviceAssignment::getDeviceId).toList();
            List<String> serials = batch.stream().map(DeviceAssignment::getSerialNumber).toList();

            log.debug("Processing {} batch {}/{}", action.getValue(), index + 1, batches.size());

            try {
                OperationResult response = call(action, deviceIds);

                if (response == null || !response.success()) {
                    String error = response != null && response.error() != null
                            ? response.error()
                            : "Failed to " + action.getValue() + " devices";
                    log.error("{} batch {}/{} failed: {}", action.getValue(), index + 1, batches.size(), error);
                    results.add(OperationResult.failure(type, deviceIds, serials, error,
                            response != null ? response.operationUrl() : null));
                    continue;
                }

                if (waitForCompletion && response.hasOperationUrl()) {
                    results.add(completionWaiter.await(type, deviceIds, serials, response.operationUrl()));
                    continue;
                }

                results.add(OperationResult.success(type, deviceIds, serials, response.operationUrl()));

            } catch (AssignmentInterruptedException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("{} batch {}/{} failed: {}", action.getValue(), index + 1, batches.size(), e.getMessage());
                results.add(OperationResult.failure(type, deviceIds, serials, e.getMessage()));
            }
        }

        return results;
    }

    private OperationResult call(WorkflowAction action, List<UUID> deviceIds) {
        return switch (action) {
            case ARCHIVE -> deviceManager.archiveDevices(deviceIds);
            case UNARCHIVE -> deviceManager.unarchiveDevices(deviceIds);
            case REMOVE -> deviceManager.removeDevices(deviceIds);
            case ASSIGN -> throw new InvalidWorkflowActionException(action, "ASSIGN is not a device action");
        };
    }

    private void resync() {
        try {
            inventorySync.syncDevices();
            if (syncSubscriptions) {
                inventorySync.syncSubscriptions();
            }
            log.info("Inventory synced after action");
        } catch (RuntimeException e) {
            log.error("Failed to sync inventory after action: {}", e.getMessage());
        }
    }
}
