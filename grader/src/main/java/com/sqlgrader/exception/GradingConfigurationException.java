package com.sqlgrader.exception;

/**
 * The run cannot start: invalid configuration, unreadable input files or a broken model solution.
 */
public class GradingConfigurationException extends RuntimeException {
    public GradingConfigurationException(String message) {
        super(message);
    }

    public GradingConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
