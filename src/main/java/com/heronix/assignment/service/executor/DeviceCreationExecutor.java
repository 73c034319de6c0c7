package com.heronix.assignment.service.executor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.heronix.assignment.adapter.DeviceManagerPort;
import com.heronix.assignment.exception.AssignmentInterruptedException;
import com.heronix.assignment.model.domain.DeviceAssignment;
import com.heronix.assignment.model.domain.OperationResult;
import com.heronix.assignment.model.enums.DeviceType;
import com.heronix.assignment.model.enums.OperationType;
import com.heronix.assignment.model.enums.RateClass;
import com.heronix.assignment.ratelimit.RateGate;
import com.heronix.assignment.ratelimit.RateGateFactory;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Registers devices one at a time through a POST gate.
 *
 * When asked to wait, each creation is polled to its terminal state before the
 * next one starts. A failed creation is recorded and the next one proceeds.
 */
@Slf4j
@RequiredArgsConstructor
public class DeviceCreationExecutor {

    private final DeviceManagerPort deviceManager;
    private final RateGateFactory rateGates;
    private final CompletionWaiter completionWaiter;

    public List<OperationResult> createAll(List<DeviceAssignment> devices, boolean waitForCompletion) {
        List<OperationResult> results = new ArrayList<>();
        if (devices.isEmpty()) {
            return results;
        }

        RateGate gate = rateGates.forSequence(RateClass.POST);
        log.info("Processing {} device creations sequentially (~{}s for rate limiting)",
                devices.size(), gate.estimate(devices.size()).toSeconds());

        for (int index = 0; index < devices.size(); index++) {
            gate.waitBeforeCall(index);
            results.add(createOne(devices.get(index), waitForCompletion));
        }

        log.info("Device creation complete: {} API calls, {}ms rate limit wait",
                gate.getCallCount(), gate.getTotalWait().toMillis());
        return results;
    }

    private OperationResult createOne(DeviceAssignment device, boolean waitForCompletion) {
        List<String> serials = List.of(device.getSerialNumber());
        Map<String, String> tags = device.getSelectedTags().isEmpty() ? null : device.getSelectedTags();

        try {
            OperationResult created = deviceManager.addDevice(
                    device.getSerialNumber(),
                    DeviceType.fromValueOrDefault(device.getDeviceType()),
                    device.getMacAddress(),
                    null,
                    tags);

            if (created == null || !created.success()) {
                String error = created != null && created.error() != null ? created.error() : "Failed to add device";
                log.error("Device {} creation failed: {}", device.getSerialNumber(), error);
                return OperationResult.failure(OperationType.CREATE, List.of(), serials, error,
                        created != null ? created.operationUrl() : null);
            }

            if (waitForCompletion && created.hasOperationUrl()) {
                return completionWaiter.await(OperationType.CREATE, List.of(), serials, created.operationUrl());
            }

            return OperationResult.success(OperationType.CREATE, List.of(), serials, created.operationUrl());

        } catch (AssignmentInterruptedException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Device {} creation failed: {}", device.getSerialNumber(), e.getMessage());
            return OperationResult.failure(OperationType.CREATE, List.of(), serials, e.getMessage());
        }
    }
}
