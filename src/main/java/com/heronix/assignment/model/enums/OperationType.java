package com.heronix.assignment.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of call made against the device-management API.
 */
public enum OperationType {

    CREATE("create"),
    APPLICATION("application"),
    SUBSCRIPTION("subscription"),
    TAGS("tags"),
    ARCHIVE("archive"),
    UNARCHIVE("unarchive"),
    REMOVE("remove"),

    /**
     * Terminal status of a polled async operation.
     */
    ASYNC("async");

    private final String value;

    OperationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static OperationType fromValue(String value) {
        for (OperationType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown operation type: " + value);
    }
}
