package com.heronix.assignment.service.executor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;

import com.heronix.assignment.adapter.DeviceManagerPort;
import com.heronix.assignment.exception.AssignmentInterruptedException;
import com.heronix.assignment.model.domain.DeviceAssignment;
import com.heronix.assignment.model.domain.OperationResult;
import com.heronix.assignment.model.enums.CompletionPolicy;
import com.heronix.assignment.model.enums.OperationType;
import com.heronix.assignment.model.enums.RateClass;
import com.heronix.assignment.ratelimit.RateGate;
import com.heronix.assignment.ratelimit.RateGateFactory;
import com.heronix.assignment.service.batch.ApplicationTarget;
import com.heronix.assignment.service.batch.BatchPlanner;
import com.heronix.assignment.service.batch.PlannedBatch;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Pushes one attribute type (application, subscription or tags) to the
 * platform in two passes.
 *
 * FIRE: every planned batch is sent in order through a PATCH gate. A failed or
 * throwing call is recorded as a failed batch immediately and never retried.
 * Accepted calls that return an async handle are held back.
 *
 * POLL: every held-back handle is resolved according to the
 * {@link CompletionPolicy}. With {@code TRUST_PROVIDER} the batch is recorded
 * as successful without polling.
 *
 * All planned batches are always attempted.
 */
@Slf4j
@RequiredArgsConstructor
public class FireThenPollExecutor {

    private final DeviceManagerPort deviceManager;
    private final BatchPlanner planner;
    private final RateGateFactory rateGates;
    private final CompletionWaiter completionWaiter;
    private final CompletionPolicy completionPolicy;

    public CompletionPolicy getCompletionPolicy() {
        return completionPolicy;
    }

    public List<OperationResult> assignApplications(List<DeviceAssignment> devices, boolean waitForCompletion) {
        return run(OperationType.APPLICATION,
                planner.planApplications(devices),
                (target, ids) -> deviceManager.assignApplication(ids, target.applicationId(), target.region()),
                target -> "app " + target.applicationId() + " + region '" + target.region() + "'",
                waitForCompletion);
    }

    public List<OperationResult> assignSubscriptions(List<DeviceAssignment> devices, boolean waitForCompletion) {
        return run(OperationType.SUBSCRIPTION,
                planner.planSubscriptions(devices),
                (subscriptionId, ids) -> deviceManager.assignSubscription(ids, subscriptionId),
                subscriptionId -> "subscription " + subscriptionId,
                waitForCompletion);
    }

    public List<OperationResult> updateTags(List<DeviceAssignment> devices, boolean waitForCompletion) {
        return run(OperationType.TAGS,
                planner.planTags(devices),
                (tags, ids) -> deviceManager.updateTags(ids, tags),
                tags -> "tags " + tags,
                waitForCompletion);
    }

    <K> List<OperationResult> run(OperationType type,
                                  List<PlannedBatch<K>> batches,
                                  BatchCall<K> call,
                                  Function<K, String> describe,
                                  boolean waitForCompletion) {
        List<OperationResult> results = new ArrayList<>();
        if (batches.isEmpty()) {
            return results;
        }

        RateGate gate = rateGates.forSequence(RateClass.PATCH);
        List<PendingBatch> pending = new ArrayList<>();

        log.info("FIRE: sending {} {} batches (~{}s for rate limiting)",
                batches.size(), type.getValue(), gate.estimate(batches.size()).toSeconds());

        for (int index = 0; index < batches.size(); index++) {
            gate.waitBeforeCall(index);

            PlannedBatch<K> batch = batches.get(index);
            List<UUID> deviceIds = batch.deviceIds();
            List<String> serials = batch.deviceSerials();

            OperationResult fired;
            try {
                log.info("Batch {}/{}: {} -> {} devices",
                        index + 1, batches.size(), describe.apply(batch.target()), deviceIds.size());
                fired = call.fire(batch.target(), deviceIds);
            } catch (AssignmentInterruptedException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Batch {}/{} ({}) failed: {}", index + 1, batches.size(), type.getValue(), e.getMessage());
                results.add(OperationResult.failure(type, deviceIds, serials, e.getMessage()));
                continue;
            }

            if (fired == null || !fired.success()) {
                String error = fired != null && fired.error() != null
                        ? fired.error()
                        : "Failed to apply " + type.getValue();
                log.error("Batch {}/{} ({}) rejected: {}", index + 1, batches.size(), type.getValue(), error);
                results.add(OperationResult.failure(type, deviceIds, serials, error));
            } else if (fired.hasOperationUrl()) {
                pending.add(new PendingBatch(deviceIds, serials, fired.operationUrl()));
            } else {
                results.add(OperationResult.success(type, deviceIds, serials, null));
            }
        }

        for (PendingBatch batch : pending) {
            results.add(resolve(type, batch, waitForCompletion));
        }

        log.info("{} complete: {} API calls, {}ms rate limit wait",
                type.getValue(), gate.getCallCount(), gate.getTotalWait().toMillis());
        return results;
    }

    private OperationResult resolve(OperationType type, PendingBatch batch, boolean waitForCompletion) {
        if (completionPolicy == CompletionPolicy.AWAIT_COMPLETION && waitForCompletion) {
            return completionWaiter.await(type, batch.deviceIds(), batch.serials(), batch.operationUrl());
        }
        return OperationResult.success(type, batch.deviceIds(), batch.serials(), batch.operationUrl());
    }

    /**
     * One external call for a batch target.
     */
    @FunctionalInterface
    interface BatchCall<K> {
        OperationResult fire(K target, List<UUID> deviceIds);
    }

    private record PendingBatch(List<UUID> deviceIds, List<String> serials, String operationUrl) {
    }
}
