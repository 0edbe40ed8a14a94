package com.catdb.api;

import com.catdb.model.ConnectionConfig;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A named connection. The configuration never carries the password.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionResponse {
    private String name;
    private String kind;
    private boolean live;
    private ConnectionConfig config;
    private String traceId;
}
