package com.heronix.assignment.model.dto;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A device with its current inventory state and the user's selections.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeviceSelectionDTO {

    @NotBlank
    private String serialNumber;

    private String macAddress;

    private int rowNumber;

    /**
     * Inventory identifier; absent for devices that still have to be created.
     */
    private UUID deviceId;

    private String deviceType;

    private String model;

    private String region;

    /**
     * Current assignments, used to decide what needs patching.
     */
    private UUID currentSubscriptionId;

    private String currentSubscriptionKey;

    private UUID currentApplicationId;

    @Builder.Default
    private Map<String, String> currentTags = new HashMap<>();

    /**
     * User selections.
     */
    private UUID selectedSubscriptionId;

    private UUID selectedApplicationId;

    /**
     * Region code (e.g. "us-west"), required together with the application.
     */
    private String selectedRegion;

    @Builder.Default
    private Map<String, String> selectedTags = new HashMap<>();

    /**
     * Keep the current value instead of assigning the selection.
     */
    private boolean keepCurrentSubscription;

    private boolean keepCurrentApplication;

    private boolean keepCurrentTags;
}
