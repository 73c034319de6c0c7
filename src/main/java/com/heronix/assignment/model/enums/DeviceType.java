package com.heronix.assignment.model.enums;

/**
 * Device types supported by the device-management API.
 */
public enum DeviceType {
    COMPUTE,
    NETWORK,
    STORAGE;

    /**
     * Resolve a stored device type, falling back to NETWORK when absent or unknown.
     */
    public static DeviceType fromValueOrDefault(String value) {
        if (value == null || value.isBlank()) {
            return NETWORK;
        }
        for (DeviceType type : values()) {
            if (type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return NETWORK;
    }
}
