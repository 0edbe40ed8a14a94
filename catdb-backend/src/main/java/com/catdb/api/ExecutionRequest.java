package com.catdb.api;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Request DTO for running SQL text.
 *
 * JSON fields (snake_case):
 * - connection: connection name; a leading "-- connection: NAME" line in sql overrides it
 * - sql: one or more statements separated by ';'
 * - row_limit: maximum rows kept per row set (default from settings)
 */
@Data
public class ExecutionRequest {
    private String connection;

    @NotBlank(message = "SQL is required")
    private String sql;

    @Min(value = 0, message = "Row limit must not be negative")
    private Integer rowLimit;
}
