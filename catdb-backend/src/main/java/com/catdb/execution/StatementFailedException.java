package com.catdb.execution;

/**
 * Thrown when the driver reports an error for a statement.
 */
public class StatementFailedException extends SqlExecutionException {

    /**
     * Create a new exception.
     *
     * @param statement failing statement
     * @param cause driver error
     */
    public StatementFailedException(String statement, Throwable cause) {
        super("Error executing statement: " + statement + "\n" + (cause != null ? cause.getMessage() : ""), statement, cause);
    }
}
