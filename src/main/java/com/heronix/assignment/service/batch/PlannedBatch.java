package com.heronix.assignment.service.batch;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

import com.heronix.assignment.model.domain.DeviceAssignment;

/**
 * One planned external call: a target value and at most one chunk of devices.
 *
 * @param <K> grouping key type
 */
public record PlannedBatch<K>(K target, List<DeviceAssignment> devices) {

    public PlannedBatch {
        devices = List.copyOf(devices);
    }

    public List<UUID> deviceIds() {
        return devices.stream()
                .map(DeviceAssignment::getDeviceId)
                .filter(Objects::nonNull)
                .toList();
    }

    public List<String> deviceSerials() {
        return devices.stream()
                .map(DeviceAssignment::getSerialNumber)
                .toList();
    }

    public int size() {
        return devices.size();
    }
}
