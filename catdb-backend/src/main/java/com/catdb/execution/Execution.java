package com.catdb.execution;

import com.catdb.model.ExecutionResult;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One asynchronous run of SQL text, as tracked by {@link ExecutionService}.
 */
public class Execution {

    /**
     * Lifecycle state.
     */
    public enum State {
        RUNNING,
        SUCCEEDED,
        FAILED,
        CANCELED,
        TIMED_OUT
    }

    private final String id;
    private final String connectionName;
    private final String sql;
    private final int rowLimit;
    private final Instant startedAt = Instant.now();
    private final CancelToken cancelToken = new CancelToken();
    private final List<ExecutionResult> results = new CopyOnWriteArrayList<>();
    private final CompletableFuture<Execution> completion = new CompletableFuture<>();

    private volatile State state = State.RUNNING;
    private volatile String error;
    private volatile String failedStatement;
    private volatile Instant finishedAt;

    Execution(String id, String connectionName, String sql, int rowLimit) {
        this.id = id;
        this.connectionName = connectionName;
        this.sql = sql;
        this.rowLimit = rowLimit;
    }

    public String getId() {
        return id;
    }

    public String getConnectionName() {
        return connectionName;
    }

    public String getSql() {
        return sql;
    }

    public int getRowLimit() {
        return rowLimit;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public State getState() {
        return state;
    }

    /**
     * Results completed so far; on failure these are the statements that ran before it.
     *
     * @return results
     */
    public List<ExecutionResult> getResults() {
        return List.copyOf(results);
    }

    public String getError() {
        return error;
    }

    public String getFailedStatement() {
        return failedStatement;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public boolean isFinished() {
        return state != State.RUNNING;
    }

    /**
     * Completes when the execution reaches a final state.
     *
     * @return future
     */
    public CompletableFuture<Execution> completion() {
        return completion.copy();
    }

    CancelToken cancelToken() {
        return cancelToken;
    }

    void addResult(ExecutionResult result) {
        results.add(result);
    }

    void finish(State finalState, String errorMessage, String statement) {
        this.error = errorMessage;
        this.failedStatement = statement;
        this.finishedAt = Instant.now();
        this.state = finalState;
        completion.complete(this);
    }
}
