package com.catdb.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Uniform outcome of one statement.
 *
 * <p>Statements without a row set report {@code ["Message"]} with a single
 * {@code "Affected rows: N"} row. {@code truncated} is set only when rows beyond the limit were
 * discarded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExecutionResult {

    public static final String MESSAGE_COLUMN = "Message";

    private List<String> columns;
    private List<List<Object>> rows;
    private double elapsedSeconds;
    private boolean truncated;

    /**
     * Result of a statement that produced no row set.
     *
     * @param affectedRows driver-reported count
     * @param elapsedSeconds elapsed time
     * @return result
     */
    public static ExecutionResult affectedRows(long affectedRows, double elapsedSeconds) {
        return ExecutionResult.builder()
                .columns(List.of(MESSAGE_COLUMN))
                .rows(List.of(List.of("Affected rows: " + affectedRows)))
                .elapsedSeconds(elapsedSeconds)
                .truncated(false)
                .build();
    }
}
