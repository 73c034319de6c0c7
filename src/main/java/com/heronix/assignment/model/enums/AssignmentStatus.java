package com.heronix.assignment.model.enums;

/**
 * Assignment status of a device as last observed in inventory.
 */
public enum AssignmentStatus {

    /**
     * Device has no inventory identifier yet
     */
    NOT_IN_INVENTORY,

    /**
     * Has subscription, application and at least one tag
     */
    FULLY_ASSIGNED,

    /**
     * Has some but not all assignments
     */
    PARTIAL,

    /**
     * In inventory without any assignment
     */
    UNASSIGNED
}
