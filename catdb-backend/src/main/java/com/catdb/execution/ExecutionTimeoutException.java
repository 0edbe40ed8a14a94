package com.catdb.execution;

import java.time.Duration;

/**
 * Thrown when one statement runs longer than the statement timeout.
 */
public class ExecutionTimeoutException extends SqlExecutionException {

    private final Duration timeout;

    /**
     * Create a new exception.
     *
     * @param statement statement that timed out
     * @param timeout timeout that expired
     */
    public ExecutionTimeoutException(String statement, Duration timeout) {
        super("Execution timed out after " + describe(timeout) + " for statement: " + statement, statement, null);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }

    private static String describe(Duration d) {
        return d.toMillis() % 1000 == 0 ? d.toSeconds() + " seconds" : d.toMillis() + " ms";
    }
}
