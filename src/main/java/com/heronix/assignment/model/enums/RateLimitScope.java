package com.heronix.assignment.model.enums;

/**
 * How rate gates are shared between call sequences.
 */
public enum RateLimitScope {

    /**
     * A fresh gate per call sequence (per attribute type, per phase).
     */
    SEQUENCE,

    /**
     * One gate per rate class for the whole process, shared by every run.
     */
    PROCESS
}
