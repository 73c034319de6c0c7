package com.heronix.assignment.service.batch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Function;

import com.heronix.assignment.adapter.DeviceManagerPort;
import com.heronix.assignment.model.domain.DeviceAssignment;

import lombok.extern.slf4j.Slf4j;

/**
 * Groups devices by target value and slices every group into chunks no larger
 * than the batch size.
 *
 * Output order is first-encountered group, then chunk order inside the group.
 * Groups are never merged or rebalanced.
 */
@Slf4j
public class BatchPlanner {

    private final int maxBatchSize;

    public BatchPlanner() {
        this(DeviceManagerPort.MAX_DEVICES_PER_CALL);
    }

    public BatchPlanner(int maxBatchSize) {
        if (maxBatchSize < 1 || maxBatchSize > DeviceManagerPort.MAX_DEVICES_PER_CALL) {
            throw new IllegalArgumentException("maxBatchSize must be between 1 and "
                    + DeviceManagerPort.MAX_DEVICES_PER_CALL + ", got " + maxBatchSize);
        }
        this.maxBatchSize = maxBatchSize;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    /**
     * Group by (application, region). Devices with an application but no
     * region cannot be assigned and are skipped.
     */
    public List<PlannedBatch<ApplicationTarget>> planApplications(List<DeviceAssignment> devices) {
        return plan(devices, device -> {
            if (device.getSelectedApplicationId() == null) {
                return null;
            }
            String region = device.getSelectedRegion();
            if (region == null || region.isBlank()) {
                log.warn("Device {} has application {} but no region - skipping",
                        device.getSerialNumber(), device.getSelectedApplicationId());
                return null;
            }
            return new ApplicationTarget(device.getSelectedApplicationId(), region);
        });
    }

    public List<PlannedBatch<UUID>> planSubscriptions(List<DeviceAssignment> devices) {
        return plan(devices, DeviceAssignment::getSelectedSubscriptionId);
    }

    /**
     * Group by the full sorted tag set; distinct tag sets never share a call.
     */
    public List<PlannedBatch<Map<String, String>>> planTags(List<DeviceAssignment> devices) {
        return plan(devices, device -> device.getSelectedTags().isEmpty()
                ? null
                : Collections.unmodifiableSortedMap(new TreeMap<>(device.getSelectedTags())));
    }

    /**
     * Plan batches for an arbitrary key. Devices whose key is null are left out.
     */
    public <K> List<PlannedBatch<K>> plan(List<DeviceAssignment> devices,
                                          Function<DeviceAssignment, K> keyFunction) {
        Map<K, List<DeviceAssignment>> groups = new LinkedHashMap<>();
        for (DeviceAssignment device : devices) {
            K key = keyFunction.apply(device);
            if (key != null) {
                groups.computeIfAbsent(key, k -> new ArrayList<>()).add(device);
            }
        }

        List<PlannedBatch<K>> batches = new ArrayList<>();
        groups.forEach((key, members) -> {
            for (List<DeviceAssignment> chunk : chunk(members, maxBatchSize)) {
                batches.add(new PlannedBatch<>(key, chunk));
            }
        });
        return batches;
    }

    /**
     * Split a list into consecutive chunks of at most {@code size} items.
     */
    public static <T> List<List<T>> chunk(List<T> items, int size) {
        if (size < 1) {
            throw new IllegalArgumentException("size must be positive");
        }
        List<List<T>> chunks = new ArrayList<>();
        for (int start = 0; start < items.size(); start += size) {
            chunks.add(List.copyOf(items.subList(start, Math.min(start + size, items.size()))));
        }
        return chunks;
    }
}
