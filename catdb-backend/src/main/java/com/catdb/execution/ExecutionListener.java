package com.catdb.execution;

import com.catdb.model.ExecutionResult;

/**
 * Receives each statement's result as soon as it is available, before the run finishes.
 * Results delivered here survive a later failure of the same run.
 */
@FunctionalInterface
public interface ExecutionListener {

    /**
     * Called on the thread running the execution.
     *
     * @param index 0-based statement index
     * @param statement statement text
     * @param result result
     */
    void onResult(int index, String statement, ExecutionResult result);

    /**
     * Called once, after the execution reached its final state.
     *
     * @param execution finished execution
     */
    default void onFinished(Execution execution) {
    }
}
