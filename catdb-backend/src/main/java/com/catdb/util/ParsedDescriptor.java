package com.catdb.util;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalized fields of a connection descriptor.
 */
@Data
@Builder
public class ParsedDescriptor {
    private String scheme;
    private String kind;
    private String host;
    private Integer port;
    private String database;
    private String username;
    private String password;
    private String schema;
    @Builder.Default
    private Map<String, String> params = new LinkedHashMap<>();
}
