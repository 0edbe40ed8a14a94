package com.catdb.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class SchemaChangeRequest {
    @NotBlank(message = "Schema is required")
    private String schema;
}
