package com.heronix.assignment.exception;

import com.heronix.assignment.model.enums.WorkflowAction;

/**
 * Exception thrown when a device action is requested with an action the
 * device-action path does not handle.
 */
public class InvalidWorkflowActionException extends RuntimeException {

    private final WorkflowAction action;

    public InvalidWorkflowActionException(WorkflowAction action, String message) {
        super(message);
        this.action = action;
    }

    public WorkflowAction getAction() {
        return action;
    }
}
