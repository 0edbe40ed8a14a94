package com.catdb.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrimaryKeyResponse {
    private String connection;
    private String table;
    private List<String> columns;
    private String traceId;
}
