package com.heronix.assignment.model.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.heronix.assignment.model.enums.AssignmentStatus;

import lombok.Builder;
import lombok.Value;

/**
 * One row of desired work for one device: what inventory currently holds and
 * what the user selected.
 *
 * Instances are immutable. The {@code needs*} predicates are computed from the
 * snapshot on every call. A device that already holds a value for an attribute
 * is never patched for that attribute again (gap-fill only).
 */
@Value
public class DeviceAssignment {

    String serialNumber;
    String macAddress;
    int rowNumber;

    // Looked up from inventory; null until the device exists there
    UUID deviceId;
    String deviceType;
    String model;
    String region;

    UUID currentSubscriptionId;
    String currentSubscriptionKey;
    UUID currentApplicationId;
    Map<String, String> currentTags;

    UUID selectedSubscriptionId;
    UUID selectedApplicationId;
    String selectedRegion;
    Map<String, String> selectedTags;

    boolean keepCurrentSubscription;
    boolean keepCurrentApplication;
    boolean keepCurrentTags;

    @Builder(toBuilder = true)
    private DeviceAssignment(
            String serialNumber,
            String macAddress,
            int rowNumber,
            UUID deviceId,
            String deviceType,
            String model,
            String region,
            UUID currentSubscriptionId,
            String currentSubscriptionKey,
            UUID currentApplicationId,
            Map<String, String> currentTags,
            UUID selectedSubscriptionId,
            UUID selectedApplicationId,
            String selectedRegion,
            Map<String, String> selectedTags,
            boolean keepCurrentSubscription,
            boolean keepCurrentApplication,
            boolean keepCurrentTags) {
        if (serialNumber == null || serialNumber.isBlank()) {
            throw new IllegalArgumentException("serialNumber is required");
        }
        this.serialNumber = serialNumber;
        this.macAddress = macAddress;
        this.rowNumber = rowNumber;
        this.deviceId = deviceId;
        this.deviceType = deviceType;
        this.model = model;
        this.region = region;
        this.currentSubscriptionId = currentSubscriptionId;
        this.currentSubscriptionKey = currentSubscriptionKey;
        this.currentApplicationId = currentApplicationId;
        this.currentTags = freeze(currentTags);
        this.selectedSubscriptionId = selectedSubscriptionId;
        this.selectedApplicationId = selectedApplicationId;
        this.selectedRegion = selectedRegion;
        this.selectedTags = freeze(selectedTags);
        this.keepCurrentSubscription = keepCurrentSubscription;
        this.keepCurrentApplication = keepCurrentApplication;
        this.keepCurrentTags = keepCurrentTags;
    }

    private static Map<String, String> freeze(Map<String, String> tags) {
        if (tags == null || tags.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    public boolean needsCreation() {
        return deviceId == null;
    }

    public boolean needsApplicationPatch() {
        return deviceId != null
                && !keepCurrentApplication
                && currentApplicationId == null
                && selectedApplicationId != null;
    }

    public boolean needsSubscriptionPatch() {
        return deviceId != null
                && !keepCurrentSubscription
                && currentSubscriptionId == null
                && selectedSubscriptionId != null;
    }

    public boolean needsTagPatch() {
        return deviceId != null
                && !keepCurrentTags
                && !selectedTags.isEmpty()
                && !selectedTags.equals(currentTags);
    }

    /**
     * A subscription was selected but the device neither holds nor will get an
     * application. The provider rejects subscription-before-application, so the
     * subscription call is expected to fail.
     */
    public boolean isSubscriptionWithoutApplication() {
        return selectedSubscriptionId != null
                && selectedApplicationId == null
                && currentApplicationId == null;
    }

    public AssignmentStatus getStatus() {
        if (deviceId == null) {
            return AssignmentStatus.NOT_IN_INVENTORY;
        }

        boolean hasSubscription = currentSubscriptionId != null;
        boolean hasApplication = currentApplicationId != null;
        boolean hasTags = !currentTags.isEmpty();

        if (hasSubscription && hasApplication && hasTags) {
            return AssignmentStatus.FULLY_ASSIGNED;
        }
        if (hasSubscription || hasApplication || hasTags) {
            return AssignmentStatus.PARTIAL;
        }
        return AssignmentStatus.UNASSIGNED;
    }
}
