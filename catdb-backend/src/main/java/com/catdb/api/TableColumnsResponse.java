package com.catdb.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableColumnsResponse {
    private String connection;
    private Map<String, List<String>> tables;
    private String traceId;
}
