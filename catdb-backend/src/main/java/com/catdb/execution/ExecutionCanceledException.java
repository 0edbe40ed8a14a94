package com.catdb.execution;

/**
 * Thrown when the cancel token is signaled before or during a statement.
 */
public class ExecutionCanceledException extends SqlExecutionException {

    /**
     * Create a new exception.
     *
     * @param statement statement that was skipped or interrupted
     */
    public ExecutionCanceledException(String statement) {
        super("Execution canceled", statement, null);
    }
}
