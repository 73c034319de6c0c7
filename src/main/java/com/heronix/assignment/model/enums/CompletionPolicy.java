package com.heronix.assignment.model.enums;

/**
 * What the attribute patch executor does with async operation handles
 * collected during the fire pass.
 */
public enum CompletionPolicy {

    /**
     * Record every accepted batch as successful without polling. Completion is
     * verified later by an inventory resync.
     */
    TRUST_PROVIDER,

    /**
     * Poll each handle to a terminal state when the caller asked to wait.
     */
    AWAIT_COMPLETION
}
