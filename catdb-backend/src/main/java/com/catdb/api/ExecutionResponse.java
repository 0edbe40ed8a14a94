package com.catdb.api;

import com.catdb.execution.Execution;
import com.catdb.model.ExecutionResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of an execution. While it runs, results holds the statements finished so far.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionResponse {
    private String id;
    private String connection;
    private String state;
    private List<ExecutionResult> results;
    private String error;
    private String failedStatement;
    private Instant startedAt;
    private Instant finishedAt;
    private String traceId;

    public static ExecutionResponse from(Execution execution, String traceId) {
        return ExecutionResponse.builder()
                .id(execution.getId())
                .connection(execution.getConnectionName())
                .state(execution.getState().name())
                .results(execution.getResults())
                .error(execution.getError())
                .failedStatement(execution.getFailedStatement())
                .startedAt(execution.getStartedAt())
                .finishedAt(execution.getFinishedAt())
                .traceId(traceId)
                .build();
    }
}
