package com.catdb.api;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
public class RowDeleteRequest {
    @NotEmpty(message = "Primary key values are required")
    private Map<String, Object> primaryKeyValues = new LinkedHashMap<>();
}
