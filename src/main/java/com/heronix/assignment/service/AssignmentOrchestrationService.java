package com.heronix.assignment.service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.heronix.assignment.adapter.DeviceLookupPort;
import com.heronix.assignment.adapter.InventorySyncPort;
import com.heronix.assignment.model.domain.ApplyResult;
import com.heronix.assignment.model.domain.DeviceAssignment;
import com.heronix.assignment.model.domain.OperationResult;
import com.heronix.assignment.model.domain.PhaseResult;
import com.heronix.assignment.model.enums.OperationType;
import com.heronix.assignment.service.executor.DeviceCreationExecutor;
import com.heronix.assignment.service.executor.FireThenPollExecutor;

import lombok.extern.slf4j.Slf4j;

/**
 * Applies user-selected assignments to devices in four strictly sequential phases.
 *
 * <ol>
 *   <li>Existing devices: applications, then subscriptions, then tags.</li>
 *   <li>New devices: created one at a time through the POST gate.</li>
 *   <li>Refresh: inventory sync so new devices get their identifiers.</li>
 *   <li>New devices: same patch sequence as phase 1, for the created subset.</li>
 * </ol>
 *
 * The provider rejects a subscription on a device without an application, so
 * applications always go first. A run never aborts on a failed batch; success
 * is computed afterwards as "no failed operation".
 *
 * @author Heronix Development Team
 */
@Service
@Slf4j
public class AssignmentOrchestrationService {

    static final String PHASE_EXISTING = "Process Existing Devices";
    static final String PHASE_CREATE = "Add New Devices";
    static final String PHASE_REFRESH = "Refresh Inventory";
    static final String PHASE_NEW = "Process New Devices";

    private static final int LOG_SAMPLE_SIZE = 5;

    private final FireThenPollExecutor patchExecutor;
    private final DeviceCreationExecutor creationExecutor;
    private final DeviceLookupPort deviceLookup;
    private final InventorySyncPort inventorySync;

    @Autowired
    public AssignmentOrchestrationService(FireThenPollExecutor patchExecutor,
                                          DeviceCreationExecutor creationExecutor,
                                          ObjectProvider<DeviceLookupPort> deviceLookup,
                                          ObjectProvider<InventorySyncPort> inventorySync) {
        this(patchExecutor, creationExecutor, deviceLookup.getIfAvailable(), inventorySync.getIfAvailable());
    }

    /**
     * @param deviceLookup  optional, phase 4 is skipped when null
     * @param inventorySync optional, phase 3 is skipped when null
     */
    public AssignmentOrchestrationService(FireThenPollExecutor patchExecutor,
                                          DeviceCreationExecutor creationExecutor,
                                          DeviceLookupPort deviceLookup,
                                          InventorySyncPort inventorySync) {
        this.patchExecutor = patchExecutor;
        this.creationExecutor = creationExecutor;
        this.deviceLookup = deviceLookup;
        this.inventorySync = inventorySync;
    }

    public ApplyResult execute(List<DeviceAssignment> assignments, boolean waitForCompletion) {
        LocalDateTime startedAt = LocalDateTime.now();
        log.info("Starting phased assignment workflow for {} devices", assignments.size());

        warnSubscriptionsWithoutApplication(assignments);

        List<DeviceAssignment> existingDevices = assignments.stream()
                .filter(a -> !a.needsCreation())
                .toList();
        List<DeviceAssignment> newDevices = assignments.stream()
                .filter(DeviceAssignment::needsCreation)
                .toList();

        log.info("Found {} existing devices, {} new devices", existingDevices.size(), newDevices.size());

        ApplyResult.ApplyResultBuilder result = ApplyResult.builder().startedAt(startedAt);
        List<PhaseResult> phases = new ArrayList<>();

        if (!existingDevices.isEmpty()) {
            log.info("PHASE 1: Processing {} existing devices", existingDevices.size());
            phases.add(patchPhase(PHASE_EXISTING, existingDevices, waitForCompletion));
        }

        List<String> added = new ArrayList<>();
        if (!newDevices.isEmpty()) {
            PhaseResult creation = creationPhase(newDevices, waitForCompletion);
            phases.add(creation);
            for (OperationResult op : creation.operations()) {
                for (String serial : op.deviceSerials()) {
                    if (op.success()) {
                        added.add(serial);
                        result.newDeviceAdded(serial);
                    } else {
                        result.newDeviceFailed(serial);
                    }
                }
            }
        }

        if (!added.isEmpty()) {
            if (inventorySync != null) {
                phases.add(refreshPhase());
            } else {
                log.info("No inventory sync configured, skipping phase 3");
            }

            if (deviceLookup != null) {
                phases.add(newDevicePhase(newDevices, added, waitForCompletion));
            } else {
                log.warn("No device lookup configured, skipping phase 4 for {} new devices", added.size());
            }
        }

        List<OperationResult> operations = phases.stream()
                .flatMap(phase -> phase.operations().stream())
                .toList();
        int errors = (int) operations.stream().filter(op -> !op.success()).count();
        LocalDateTime completedAt = LocalDateTime.now();

        ApplyResult applyResult = result
                .success(errors == 0)
                .operations(operations)
                .phaseResults(phases)
                .devicesCreated(added.size())
                .applicationsAssigned(countAssigned(operations, OperationType.APPLICATION))
                .subscriptionsAssigned(countAssigned(operations, OperationType.SUBSCRIPTION))
                .tagsUpdated(countAssigned(operations, OperationType.TAGS))
                .errors(errors)
                .completedAt(completedAt)
                .totalDuration(Duration.between(startedAt, completedAt))
                .build();

        log.info("Workflow complete in {}ms: {} created, {} applications, {} subscriptions, {} tags, {} errors",
                applyResult.getTotalDuration().toMillis(), applyResult.getDevicesCreated(),
                applyResult.getApplicationsAssigned(), applyResult.getSubscriptionsAssigned(),
                applyResult.getTagsUpdated(), errors);

        return applyResult;
    }

    // ========================================================================
    // PHASES
    // ========================================================================

    /**
     * Applications, then subscriptions, then tags. Each pass takes only the
     * devices whose predicate holds at that moment.
     */
    private PhaseResult patchPhase(String phaseName, List<DeviceAssignment> devices, boolean waitForCompletion) {
        LocalDateTime phaseStart = LocalDateTime.now();

        devices.stream().limit(LOG_SAMPLE_SIZE).forEach(d -> log.debug(
                "  Device {}: needs_app={}, needs_sub={}, needs_tags={}, current_app={}, selected_app={}, "
                        + "current_sub={}, selected_sub={}",
                d.getSerialNumber(), d.needsApplicationPatch(), d.needsSubscriptionPatch(), d.needsTagPatch(),
                d.getCurrentApplicationId(), d.getSelectedApplicationId(),
                d.getCurrentSubscriptionId(), d.getSelectedSubscriptionId()));

        List<OperationResult> operations = new ArrayList<>();

        List<DeviceAssignment> needApplication = devices.stream()
                .filter(DeviceAssignment::needsApplicationPatch)
                .toList();
        if (!needApplication.isEmpty()) {
            log.info("  Assigning applications to {} devices", needApplication.size());
            operations.addAll(patchExecutor.assignApplications(needApplication, waitForCompletion));
        } else {
            log.info("  No devices need application assignment");
        }

        List<DeviceAssignment> needSubscription = devices.stream()
                .filter(DeviceAssignment::needsSubscriptionPatch)
                .toList();
        if (!needSubscription.isEmpty()) {
            log.info("  Assigning subscriptions to {} devices", needSubscription.size());
            operations.addAll(patchExecutor.assignSubscriptions(needSubscription, waitForCompletion));
        } else {
            log.info("  No devices need subscription assignment");
        }

        List<DeviceAssignment> needTags = devices.stream()
                .filter(DeviceAssignment::needsTagPatch)
                .toList();
        if (!needTags.isEmpty()) {
            log.info("  Updating tags on {} devices", needTags.size());
            operations.addAll(patchExecutor.updateTags(needTags, waitForCompletion));
        }

        return PhaseResult.of(phaseName, operations, devices.size(), Duration.between(phaseStart, LocalDateTime.now()));
    }

    private PhaseResult creationPhase(List<DeviceAssignment> devices, boolean waitForCompletion) {
        LocalDateTime phaseStart = LocalDateTime.now();
        log.info("PHASE 2: Adding {} new devices", devices.size());

        List<OperationResult> operations = creationExecutor.createAll(devices, waitForCompletion);

        return PhaseResult.of(PHASE_CREATE, operations, devices.size(), Duration.between(phaseStart, LocalDateTime.now()));
    }

    /**
     * A failed sync is reported on the phase but is not an operation failure.
     */
    private PhaseResult refreshPhase() {
        LocalDateTime phaseStart = LocalDateTime.now();
        log.info("PHASE 3: Refreshing inventory from the platform");

        try {
            inventorySync.syncDevices();
            inventorySync.syncSubscriptions();
            return PhaseResult.of(PHASE_REFRESH, List.of(), 0, Duration.between(phaseStart, LocalDateTime.now()));
        } catch (RuntimeException e) {
            log.error("Phase 3 sync failed: {}", e.getMessage());
            return PhaseResult.failed(PHASE_REFRESH, Duration.between(phaseStart, LocalDateTime.now()));
        }
    }

    private PhaseResult newDevicePhase(List<DeviceAssignment> originals, List<String> addedSerials,
                                       boolean waitForCompletion) {
        LocalDateTime phaseStart = LocalDateTime.now();
        log.info("PHASE 4: Processing {} newly added devices", addedSerials.size());

        List<DeviceAssignment> refreshed;
        try {
            refreshed = deviceLookup.findBySerials(addedSerials);
        } catch (RuntimeException e) {
            log.error("Phase 4 lookup failed: {}", e.getMessage());
            return PhaseResult.failed(PHASE_NEW, Duration.between(phaseStart, LocalDateTime.now()));
        }

        List<DeviceAssignment> resolved = reattachSelections(originals, addedSerials, refreshed);
        if (resolved.isEmpty()) {
            log.warn("No newly added devices found after refresh");
            return PhaseResult.of(PHASE_NEW, List.of(), 0, Duration.between(phaseStart, LocalDateTime.now()));
        }

        return patchPhase(PHASE_NEW, resolved, waitForCompletion);
    }

    /**
     * Combine freshly looked-up inventory state with the user's original
     * selections. Serials match case-insensitively.
     */
    static List<DeviceAssignment> reattachSelections(List<DeviceAssignment> originals,
                                                     List<String> addedSerials,
                                                     List<DeviceAssignment> refreshed) {
        Map<String, DeviceAssignment> refreshedBySerial = new HashMap<>();
        for (DeviceAssignment device : refreshed) {
            if (device.getDeviceId() != null) {
                refreshedBySerial.put(normalize(device.getSerialNumber()), device);
            }
        }
        Set<String> added = addedSerials.stream()
                .map(AssignmentOrchestrationService::normalize)
                .collect(Collectors.toSet());

        List<DeviceAssignment> resolved = new ArrayList<>();
        for (DeviceAssignment original : originals) {
            String serial = normalize(original.getSerialNumber());
            DeviceAssignment fresh = refreshedBySerial.get(serial);
            if (fresh == null || !added.contains(serial)) {
                continue;
            }
            resolved.add(fresh.toBuilder()
                    .serialNumber(original.getSerialNumber())
                    .macAddress(original.getMacAddress())
                    .rowNumber(original.getRowNumber())
                    .selectedSubscriptionId(original.getSelectedSubscriptionId())
                    .selectedApplicationId(original.getSelectedApplicationId())
                    .selectedRegion(original.getSelectedRegion())
                    .selectedTags(original.getSelectedTags())
                    .keepCurrentSubscription(original.isKeepCurrentSubscription())
                    .keepCurrentApplication(original.isKeepCurrentApplication())
                    .keepCurrentTags(original.isKeepCurrentTags())
                    .build());
        }
        return resolved;
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    /**
     * Logged only. The subscription call is still made and its result surfaced.
     */
    private void warnSubscriptionsWithoutApplication(List<DeviceAssignment> assignments) {
        List<String> serials = assignments.stream()
                .filter(DeviceAssignment::isSubscriptionWithoutApplication)
                .map(DeviceAssignment::getSerialNumber)
                .toList();

        if (!serials.isEmpty()) {
            log.warn("{} devices have a subscription selected but no application/region; "
                            + "their subscription assignment is expected to fail. Sample: {}",
                    serials.size(), serials.subList(0, Math.min(LOG_SAMPLE_SIZE, serials.size())));
        }
    }

    private static int countAssigned(List<OperationResult> operations, OperationType type) {
        return operations.stream()
                .filter(op -> op.success() && op.operationType() == type)
                .mapToInt(op -> op.deviceIds().size())
                .sum();
    }

    private static String normalize(String serial) {
        return serial.trim().toUpperCase(Locale.ROOT);
    }
}
