package com.catdb.driver;

import com.catdb.model.ConnectionKind;
import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything needed to open a JDBC connection for one configuration and one credential candidate.
 */
@Data
@Builder
public class JdbcTarget {
    private ConnectionKind kind;
    private String url;
    private String driverClass;
    private String username;
    @ToString.Exclude
    private String password;
    /**
     * Session initialization run on every new physical connection, or null.
     */
    private String initSql;
    @Builder.Default
    private Map<String, String> properties = new LinkedHashMap<>();
}
