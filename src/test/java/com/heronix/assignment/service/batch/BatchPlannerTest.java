package com.heronix.assignment.service.batch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.UnaryOperator;

import org.junit.jupiter.api.Test;

import com.heronix.assignment.model.domain.DeviceAssignment;

import static org.junit.jupiter.api.Assertions.*;

class BatchPlannerTest {

    private final BatchPlanner planner = new BatchPlanner();

    @Test
    void planSubscriptions_sixtyDevicesOneTarget_threeBatches() {
        UUID subscription = UUID.randomUUID();
        List<DeviceAssignment> devices = devices("SN", 60, b -> b.selectedSubscriptionId(subscription));

        List<PlannedBatch<UUID>> batches = planner.planSubscriptions(devices);

        assertEquals(3, batches.size());
        assertEquals(List.of(25, 25, 10), batches.stream().map(PlannedBatch::size).toList());
        assertTrue(batches.stream().allMatch(b -> subscription.equals(b.target())));
        // Consecutive slices in input order
        assertEquals("SN-0", batches.get(0).devices().get(0).getSerialNumber());
        assertEquals("SN-25", batches.get(1).devices().get(0).getSerialNumber());
        assertEquals("SN-50", batches.get(2).devices().get(0).getSerialNumber());
    }

    @Test
    void planTags_twoTagSets_groupsNeverMixed() {
        Map<String, String> prod = Map.of("env", "prod");
        Map<String, String> dev = Map.of("env", "dev");
        List<DeviceAssignment> devices = new ArrayList<>();
        devices.addAll(devices("PROD", 20, b -> b.selectedTags(prod)));
        devices.addAll(devices("DEV", 40, b -> b.selectedTags(dev)));

        List<PlannedBatch<Map<String, String>>> batches = planner.planTags(devices);

        assertEquals(3, batches.size());
        assertEquals(prod, batches.get(0).target());
        assertEquals(20, batches.get(0).size());
        assertEquals(dev, batches.get(1).target());
        assertEquals(dev, batches.get(2).target());
        assertEquals(40, batches.get(1).size() + batches.get(2).size());
        assertTrue(batches.stream().allMatch(b -> b.size() <= 25));
        for (PlannedBatch<Map<String, String>> batch : batches) {
            assertTrue(batch.devices().stream().allMatch(d -> d.getSelectedTags().equals(batch.target())));
        }
    }

    @Test
    void planTags_sameTagsDifferentInsertionOrder_oneGroup() {
        Map<String, String> first = new LinkedHashMap<>();
        first.put("env", "prod");
        first.put("site", "nyc");
        Map<String, String> second = new LinkedHashMap<>();
        second.put("site", "nyc");
        second.put("env", "prod");

        List<DeviceAssignment> devices = List.of(
                device("A", 1).toBuilder().selectedTags(first).build(),
                device("B", 2).toBuilder().selectedTags(second).build());

        assertEquals(1, planner.planTags(devices).size());
    }

    @Test
    void planApplications_groupsByApplicationAndRegion() {
        UUID app = UUID.randomUUID();
        List<DeviceAssignment> devices = List.of(
                device("A", 1).toBuilder().selectedApplicationId(app).selectedRegion("us-west").build(),
                device("B", 2).toBuilder().selectedApplicationId(app).selectedRegion("eu-central").build(),
                device("C", 3).toBuilder().selectedApplicationId(app).selectedRegion("us-west").build());

        List<PlannedBatch<ApplicationTarget>> batches = planner.planApplications(devices);

        assertEquals(2, batches.size());
        assertEquals(new ApplicationTarget(app, "us-west"), batches.get(0).target());
        assertEquals(List.of("A", "C"), batches.get(0).deviceSerials());
        assertEquals(new ApplicationTarget(app, "eu-central"), batches.get(1).target());
    }

    @Test
    void planApplications_missingRegion_skipped() {
        UUID app = UUID.randomUUID();
        List<DeviceAssignment> devices = List.of(
                device("A", 1).toBuilder().selectedApplicationId(app).build(),
                device("B", 2).toBuilder().selectedApplicationId(app).selectedRegion("us-west").build());

        List<PlannedBatch<ApplicationTarget>> batches = planner.planApplications(devices);

        assertEquals(1, batches.size());
        assertEquals(List.of("B"), batches.get(0).deviceSerials());
    }

    @Test
    void plan_groupsInFirstSeenOrder() {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        List<DeviceAssignment> devices = List.of(
                device("A", 1).toBuilder().selectedSubscriptionId(second).build(),
                device("B", 2).toBuilder().selectedSubscriptionId(first).build(),
                device("C", 3).toBuilder().selectedSubscriptionId(second).build());

        List<PlannedBatch<UUID>> batches = planner.planSubscriptions(devices);

        assertEquals(List.of(second, first), batches.stream().map(PlannedBatch::target).toList());
        assertEquals(List.of("A", "C"), batches.get(0).deviceSerials());
    }

    @Test
    void plan_emptyInput_noBatches() {
        assertTrue(planner.planSubscriptions(List.of()).isEmpty());
        assertTrue(planner.planTags(List.of()).isEmpty());
    }

    @Test
    void constructor_sizeAboveProviderLimit_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new BatchPlanner(26));
        assertThrows(IllegalArgumentException.class, () -> new BatchPlanner(0));
        assertEquals(10, new BatchPlanner(10).getMaxBatchSize());
    }

    @Test
    void chunk_partitionsInOrder() {
        List<List<Integer>> chunks = BatchPlanner.chunk(List.of(1, 2, 3, 4, 5), 2);

        assertEquals(List.of(List.of(1, 2), List.of(3, 4), List.of(5)), chunks);
        assertTrue(BatchPlanner.chunk(List.of(), 25).isEmpty());
    }

    private static DeviceAssignment device(String serial, int row) {
        return DeviceAssignment.builder()
                .serialNumber(serial)
                .rowNumber(row)
                .deviceId(UUID.randomUUID())
                .build();
    }

    private static List<DeviceAssignment> devices(String prefix, int count,
                                                  UnaryOperator<DeviceAssignment.DeviceAssignmentBuilder> customizer) {
        List<DeviceAssignment> devices = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            devices.add(customizer.apply(device(prefix + "-" + i, i + 1).toBuilder()).build());
        }
        return devices;
    }
}
