package com.catdb.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A block of text about a connection or table: a schema description or a DDL statement.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TextResponse {
    private String connection;
    private String table;
    private String text;
    private String traceId;
}
