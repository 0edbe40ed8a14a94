package com.catdb.driver;

import com.catdb.model.ConnectionConfig;
import com.catdb.model.ConnectionKind;
import com.catdb.util.SqlIdentifiers;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds a {@link JdbcTarget} from a stored {@link ConnectionConfig}.
 */
@Service
public class JdbcTargetResolver {

    static final String APPLICATION_NAME = "catdb";

    private final DriverCatalog driverCatalog;

    /**
     * Create a resolver.
     *
     * @param driverCatalog driver catalog
     */
    public JdbcTargetResolver(DriverCatalog driverCatalog) {
        this.driverCatalog = driverCatalog;
    }

    /**
     * Resolve a configuration with one credential candidate.
     *
     * @param config configuration
     * @param password password candidate (plain)
     * @return target
     */
    public JdbcTarget resolve(ConnectionConfig config, String password) {
        ConnectionKind kind = ConnectionKind.fromId(config.getKind())
                .orElseThrow(() -> new IllegalArgumentException("Unsupported connection type: " + config.getKind()));
        DriverCatalog.Variant variant = driverCatalog.resolve(kind, config.getDriver());

        if (kind == ConnectionKind.SQLITE) {
            return JdbcTarget.builder()
                    .kind(kind)
                    .url(variant.getUrlPrefix() + config.getPath())
                    .driverClass(variant.getDriverClass())
                    .build();
        }

        String host = config.getHost() != null && !config.getHost().isBlank() ? config.getHost() : "localhost";
        int port = config.getPort() != null ? config.getPort() : variant.getDefaultPort();
        String database = config.getDatabase() != null ? config.getDatabase() : "";
        String url = variant.getUrlPrefix() + host + ":" + port + "/" + database;

        Map<String, String> extra = config.getExtraParams() != null ? config.getExtraParams() : Map.of();
        Map<String, String> properties = new LinkedHashMap<>();
        String initSql = null;
        if (kind == ConnectionKind.POSTGRESQL) {
            properties.put("ApplicationName", APPLICATION_NAME);
            properties.putAll(extra);
            initSql = searchPathSql(config.getSchema());
        } else {
            extra.forEach((k, v) -> {
                if ("options".equals(k)) {
                    return;
                }
                if ("sslmode".equals(k)) {
                    properties.put("sslMode", mysqlSslMode(v));
                    return;
                }
                properties.put(k, v);
            });
        }

        return JdbcTarget.builder()
                .kind(kind)
                .url(url)
                .driverClass(variant.getDriverClass())
                .username(config.getUser())
                .password(password)
                .initSql(initSql)
                .properties(properties)
                .build();
    }

    /**
     * Session statement applying a search path such as {@code app,public}.
     *
     * @param schema comma-separated schema list (may be null)
     * @return statement, or null when no schema is set
     */
    public static String searchPathSql(String schema) {
        if (schema == null || schema.isBlank()) {
            return null;
        }
        List<String> quoted = new ArrayList<>();
        for (String part : schema.split(",")) {
            String name = part.trim().replace("\"", "").replace("'", "");
            if (!name.isEmpty()) {
                quoted.add(SqlIdentifiers.quote(ConnectionKind.POSTGRESQL.id(), name));
            }
        }
        if (quoted.isEmpty()) {
            return null;
        }
        return "SET search_path TO " + String.join(", ", quoted);
    }

    private static String mysqlSslMode(String libpqMode) {
        String v = libpqMode == null ? "" : libpqMode.trim().toLowerCase(Locale.ROOT);
        switch (v) {
            case "disable":
                return "DISABLED";
            case "require":
                return "REQUIRED";
            case "verify-ca":
                return "VERIFY_CA";
            case "verify-full":
                return "VERIFY_IDENTITY";
            default:
                return "PREFERRED";
        }
    }
}
