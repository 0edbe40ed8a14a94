package com.catdb.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Request DTO for AI-powered SQL generation.
 *
 * JSON fields (snake_case):
 * - prompt: natural language description
 * - connection: optional connection whose schema is sent along with the prompt
 */
@Data
public class AiGenerateRequest {

    /**
     * Natural language description of desired data/operation.
     * Example: "Show me all users created in last week, ordered by name"
     */
    @NotBlank(message = "Natural language prompt is required")
    private String prompt;

    /**
     * Connection to describe. When absent the most recently opened connection is used.
     */
    private String connection;
}
