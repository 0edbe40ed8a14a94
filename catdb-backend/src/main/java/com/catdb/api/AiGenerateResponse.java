package com.catdb.api;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Response DTO for AI-powered SQL generation.
 *
 * JSON fields (snake_case):
 * - sql: generated SQL (empty when generation is disabled)
 * - enabled: whether an API key is configured
 * - schema_connection: connection whose schema was included in the prompt, if any
 * - warnings: configuration warnings for the client
 * - trace_id: request correlation id
 */
@Data
@Builder
public class AiGenerateResponse {
    private String sql;
    private boolean enabled;
    private String schemaConnection;
    private List<String> warnings;
    private String traceId;
}
