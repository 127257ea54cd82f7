package com.sqlgrader.dto;

/**
 * Result of running one question for one party: either a result table or the engine's error text.
 */
public class QueryOutcome {
    public enum Status {
        SUCCESS,
        ERROR
    }

    public static final String TIMEOUT_MESSAGE = "timeout";

    private final Status status;
    private final ResultTable result;
    private final String message;
    private final long executionTime;

    private QueryOutcome(Status status, ResultTable result, String message, long executionTime) {
        this.status = status;
        this.result = result;
        this.message = message;
        this.executionTime = executionTime;
    }

    public static QueryOutcome success(ResultTable result, long executionTime) {
        if (result == null) {
            throw new IllegalArgumentException("Result cannot be null for a successful outcome");
        }
        return new QueryOutcome(Status.SUCCESS, result, null, executionTime);
    }

    public static QueryOutcome error(String message, long executionTime) {
        return new QueryOutcome(Status.ERROR, null, message != null ? message : "Unknown error", executionTime);
    }

    public static QueryOutcome timeout(long executionTime) {
        return error(TIMEOUT_MESSAGE, executionTime);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public ResultTable getResult() {
        return result;
    }

    public String getMessage() {
        return message;
    }

    public long getExecutionTime() {
        return executionTime;
    }
}
