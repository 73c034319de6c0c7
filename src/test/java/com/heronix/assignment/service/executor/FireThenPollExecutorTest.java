package com.heronix.assignment.service.executor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.heronix.assignment.adapter.DeviceManagerPort;
import com.heronix.assignment.model.domain.DeviceAssignment;
import com.heronix.assignment.model.domain.OperationResult;
import com.heronix.assignment.model.enums.CompletionPolicy;
import com.heronix.assignment.model.enums.OperationType;
import com.heronix.assignment.model.enums.RateClass;
import com.heronix.assignment.ratelimit.RateGateFactory;
import com.heronix.assignment.ratelimit.RecordingSleeper;
import com.heronix.assignment.service.batch.BatchPlanner;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FireThenPollExecutorTest {

    private static final Duration PATCH = Duration.ofMillis(3500);
    private static final Duration TIMEOUT = Duration.ofSeconds(300);

    @Mock
    private DeviceManagerPort deviceManager;

    private RecordingSleeper sleeper;
    private RateGateFactory rateGates;
    private CompletionWaiter completionWaiter;

    @BeforeEach
    void setUp() {
        sleeper = new RecordingSleeper();
        rateGates = RateGateFactory.perSequence(
                Map.of(RateClass.PATCH, PATCH, RateClass.POST, Duration.ofMillis(2600)), sleeper);
        completionWaiter = new CompletionWaiter(deviceManager, TIMEOUT);
    }

    private FireThenPollExecutor executor(CompletionPolicy policy) {
        return new FireThenPollExecutor(deviceManager, new BatchPlanner(), rateGates, completionWaiter, policy);
    }

    @Test
    void assignSubscriptions_failedBatch_remainingBatchesStillRun() {
        // Arrange
        UUID subscription = UUID.randomUUID();
        List<DeviceAssignment> devices = devices(125, subscription);
        when(deviceManager.assignSubscription(anyList(), eq(subscription))).thenReturn(
                accepted(OperationType.SUBSCRIPTION, "op-1"),
                OperationResult.failure(OperationType.SUBSCRIPTION, List.of(), List.of(), "HTTP 400"),
                accepted(OperationType.SUBSCRIPTION, "op-3"),
                accepted(OperationType.SUBSCRIPTION, "op-4"),
                accepted(OperationType.SUBSCRIPTION, "op-5"));

        // Act
        List<OperationResult> results = executor(CompletionPolicy.TRUST_PROVIDER)
                .assignSubscriptions(devices, true);

        // Assert
        verify(deviceManager, times(5)).assignSubscription(anyList(), eq(subscription));
        verify(deviceManager, never()).waitForCompletion(anyString(), any());
        assertEquals(5, results.size());
        assertEquals(1, results.stream().filter(r -> !r.success()).count());

        OperationResult failed = results.get(0);
        assertFalse(failed.success());
        assertEquals("HTTP 400", failed.error());
        assertEquals(25, failed.deviceIds().size());
        assertEquals("SN-25", failed.deviceSerials().get(0));

        assertEquals(4, sleeper.getSleeps().size());
        assertEquals(PATCH.multipliedBy(4), sleeper.getTotalSlept());
    }

    @Test
    void assignSubscriptions_batchNeverExceedsProviderLimit() {
        UUID subscription = UUID.randomUUID();
        List<List<UUID>> calls = new ArrayList<>();
        when(deviceManager.assignSubscription(anyList(), eq(subscription))).thenAnswer(invocation -> {
            calls.add(invocation.getArgument(0));
            return accepted(OperationType.SUBSCRIPTION, null);
        });

        executor(CompletionPolicy.TRUST_PROVIDER).assignSubscriptions(devices(60, subscription), false);

        assertEquals(List.of(25, 25, 10), calls.stream().map(List::size).toList());
    }

    @Test
    void assignApplications_thrownException_recordedAsFailedBatch() {
        // Arrange
        UUID app = UUID.randomUUID();
        List<DeviceAssignment> devices = List.of(
                device("A").toBuilder().selectedApplicationId(app).selectedRegion("us-west").build(),
                device("B").toBuilder().selectedApplicationId(app).selectedRegion("eu-central").build());
        when(deviceManager.assignApplication(anyList(), eq(app), eq("us-west")))
                .thenThrow(new IllegalStateException("connection reset"));
        when(deviceManager.assignApplication(anyList(), eq(app), eq("eu-central")))
                .thenReturn(accepted(OperationType.APPLICATION, "op-eu"));

        // Act
        List<OperationResult> results = executor(CompletionPolicy.TRUST_PROVIDER)
                .assignApplications(devices, true);

        // Assert
        assertEquals(2, results.size());
        assertFalse(results.get(0).success());
        assertEquals("connection reset", results.get(0).error());
        assertEquals(List.of("A"), results.get(0).deviceSerials());
        assertTrue(results.get(1).success());
        assertEquals("op-eu", results.get(1).operationUrl());
        assertEquals(OperationType.APPLICATION, results.get(1).operationType());
    }

    @Test
    void updateTags_awaitCompletion_pollsEveryHandleAfterAllFires() {
        // Arrange
        List<DeviceAssignment> devices = List.of(
                device("A").toBuilder().selectedTags(Map.of("env", "prod")).build(),
                device("B").toBuilder().selectedTags(Map.of("env", "dev")).build());
        when(deviceManager.updateTags(anyList(), eq(Map.of("env", "prod"))))
                .thenReturn(accepted(OperationType.TAGS, "op-prod"));
        when(deviceManager.updateTags(anyList(), eq(Map.of("env", "dev"))))
                .thenReturn(accepted(OperationType.TAGS, "op-dev"));
        when(deviceManager.waitForCompletion("op-prod", TIMEOUT))
                .thenReturn(OperationResult.success(OperationType.ASYNC, null, null, "op-prod"));
        when(deviceManager.waitForCompletion("op-dev", TIMEOUT))
                .thenReturn(OperationResult.failure(OperationType.ASYNC, null, null, "Operation timed out"));

        // Act
        List<OperationResult> results = executor(CompletionPolicy.AWAIT_COMPLETION).updateTags(devices, true);

        // Assert
        var order = inOrder(deviceManager);
        order.verify(deviceManager, times(2)).updateTags(anyList(), anyMap());
        order.verify(deviceManager).waitForCompletion("op-prod", TIMEOUT);
        order.verify(deviceManager).waitForCompletion("op-dev", TIMEOUT);

        assertTrue(results.get(0).success());
        assertFalse(results.get(1).success());
        assertEquals("Operation timed out", results.get(1).error());
        assertEquals(List.of("B"), results.get(1).deviceSerials());
    }

    @Test
    void updateTags_awaitCompletionButNoWaitRequested_trustsHandle() {
        List<DeviceAssignment> devices = List.of(device("A").toBuilder().selectedTags(Map.of("env", "prod")).build());
        when(deviceManager.updateTags(anyList(), anyMap())).thenReturn(accepted(OperationType.TAGS, "op-1"));

        List<OperationResult> results = executor(CompletionPolicy.AWAIT_COMPLETION).updateTags(devices, false);

        verify(deviceManager, never()).waitForCompletion(anyString(), any());
        assertTrue(results.get(0).success());
    }

    @Test
    void assignSubscriptions_acceptedWithoutHandle_recordedAsSuccess() {
        UUID subscription = UUID.randomUUID();
        when(deviceManager.assignSubscription(anyList(), eq(subscription)))
                .thenReturn(accepted(OperationType.SUBSCRIPTION, null));

        List<OperationResult> results = executor(CompletionPolicy.AWAIT_COMPLETION)
                .assignSubscriptions(devices(3, subscription), true);

        assertEquals(1, results.size());
        assertTrue(results.get(0).success());
        assertEquals(3, results.get(0).deviceIds().size());
        verify(deviceManager, never()).waitForCompletion(anyString(), any());
    }

    @Test
    void assignSubscriptions_nothingPlanned_noCallsNoWaits() {
        List<OperationResult> results = executor(CompletionPolicy.TRUST_PROVIDER)
                .assignSubscriptions(List.of(device("A")), true);

        assertTrue(results.isEmpty());
        assertTrue(sleeper.getSleeps().isEmpty());
        verifyNoInteractions(deviceManager);
    }

    private static OperationResult accepted(OperationType type, String operationUrl) {
        return OperationResult.success(type, null, null, operationUrl);
    }

    private static DeviceAssignment device(String serial) {
        return DeviceAssignment.builder().serialNumber(serial).deviceId(UUID.randomUUID()).build();
    }

    private static List<DeviceAssignment> devices(int count, UUID subscription) {
        List<DeviceAssignment> devices = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            devices.add(device("SN-" + i).toBuilder().selectedSubscriptionId(subscription).build());
        }
        return devices;
    }
}
