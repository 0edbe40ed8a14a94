package com.catdb.execution;

/**
 * Raised when an execution id is unknown or has already been purged.
 */
public class ExecutionNotFoundException extends RuntimeException {

    private final String executionId;

    /**
     * Create an exception.
     *
     * @param executionId execution id
     */
    public ExecutionNotFoundException(String executionId) {
        super("No execution with id '" + executionId + "'");
        this.executionId = executionId;
    }

    public String getExecutionId() {
        return executionId;
    }
}
