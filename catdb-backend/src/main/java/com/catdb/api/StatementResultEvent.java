package com.catdb.api;

import com.catdb.model.ExecutionResult;
import lombok.Builder;
import lombok.Data;

/**
 * One statement's result, pushed on an execution stream as soon as the statement completes.
 */
@Data
@Builder
public class StatementResultEvent {
    private int index;
    private String statement;
    private ExecutionResult result;
}
