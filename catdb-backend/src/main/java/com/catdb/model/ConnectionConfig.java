package com.catdb.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted connection record, one per display name in {@code config.json}.
 *
 * <p>For {@code sqlite} only {@code path} is set. The password is held in plain text in memory;
 * the store obfuscates it on write.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConnectionConfig {

    @JsonIgnore
    private String displayName;

    @JsonProperty("type")
    private String kind;

    private String path;
    private String driver;
    private String host;
    private Integer port;
    private String user;
    private String password;
    private String database;
    private String schema;

    @JsonProperty("params")
    @Builder.Default
    private Map<String, String> extraParams = new LinkedHashMap<>();

    /**
     * Deep copy, safe to hand out of the registry.
     *
     * @return copy
     */
    public ConnectionConfig copy() {
        return toBuilder()
                .extraParams(extraParams != null ? new LinkedHashMap<>(extraParams) : new LinkedHashMap<>())
                .build();
    }

    /**
     * Copy without the password, for display.
     *
     * @return redacted copy
     */
    public ConnectionConfig redacted() {
        ConnectionConfig c = copy();
        c.setPassword(null);
        return c;
    }

    @JsonIgnore
    public boolean isFileBased() {
        return ConnectionKind.SQLITE.id().equals(kind);
    }
}
