package com.catdb.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class FileConnectionRequest {
    private String name;

    @NotBlank(message = "Database file path is required")
    private String path;
}
