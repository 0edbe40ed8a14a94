package com.catdb.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class CsvExportRequest {
    private List<String> columns = new ArrayList<>();
    private List<List<Object>> rows = new ArrayList<>();

    @NotBlank(message = "Export path is required")
    private String path;

    private boolean includeHeader = true;

    @NotNull(message = "Delimiter is required")
    @Size(min = 1, max = 1, message = "Delimiter must be a single character")
    private String delimiter = ",";

    private boolean utf8Bom = true;
}
