package com.catdb.execution;

/**
 * Base of the failures that abort an execution run. Carries the statement that was running.
 */
public abstract class SqlExecutionException extends RuntimeException {

    private final String statement;

    protected SqlExecutionException(String message, String statement, Throwable cause) {
        super(message, cause);
        this.statement = statement;
    }

    /**
     * Statement that was running, or about to run, when the execution stopped.
     *
     * @return statement text
     */
    public String getStatement() {
        return statement;
    }
}
