package com.sqlgrader.exception;

/**
 * Schema reset or database connectivity failure. Aborts the current student, or the whole run
 * while the ground truth is being built.
 */
public class InfrastructureException extends RuntimeException {
    public InfrastructureException(String message) {
        super(message);
    }

    public InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
