package com.heronix.assignment.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Workflow actions a caller can request for a set of devices.
 */
public enum WorkflowAction {

    /**
     * Assign subscription, application and tags (phased workflow).
     */
    ASSIGN("assign", null),

    ARCHIVE("archive", OperationType.ARCHIVE),

    UNARCHIVE("unarchive", OperationType.UNARCHIVE),

    /**
     * Remove devices from the platform. Devices should be archived first.
     */
    REMOVE("remove", OperationType.REMOVE);

    private final String value;
    private final OperationType operationType;

    WorkflowAction(String value, OperationType operationType) {
        this.value = value;
        this.operationType = operationType;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Operation type recorded for batches of this action, null for ASSIGN.
     */
    public OperationType getOperationType() {
        return operationType;
    }

    @JsonCreator
    public static WorkflowAction fromValue(String value) {
        for (WorkflowAction action : values()) {
            if (action.value.equalsIgnoreCase(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown workflow action: " + value);
    }
}
