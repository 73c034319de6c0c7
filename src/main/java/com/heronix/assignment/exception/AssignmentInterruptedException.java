package com.heronix.assignment.exception;

/**
 * Exception thrown when the worker thread is interrupted while waiting on a
 * rate gate or an async operation. The run is abandoned.
 */
public class AssignmentInterruptedException extends RuntimeException {

    public AssignmentInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
