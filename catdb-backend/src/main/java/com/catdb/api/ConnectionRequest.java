package com.catdb.api;

import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request DTO for registering or editing a connection.
 *
 * JSON fields (snake_case):
 * - name: display name (optional when adding; derived from kind/host/database)
 * - new_name: new display name (edit only)
 * - kind: sqlite | postgresql | mysql, or an alias; optional when fields carry a jdbc descriptor
 * - fields: host, port, user, password, database, path, driver, schema, jdbc; anything else becomes a driver parameter
 */
@Data
public class ConnectionRequest {
    private String name;
    private String newName;
    private String kind;
    private Map<String, String> fields = new LinkedHashMap<>();
}
