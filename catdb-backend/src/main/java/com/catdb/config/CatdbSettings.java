package com.catdb.config;

import lombok.Builder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.regex.Matcher;

/**
 * Immutable runtime settings resolved from {@code catdb.*} properties, falling back to
 * {@code CATDB_*} environment variables and then to built-in defaults.
 *
 * @param configDir directory holding {@code config.json} and {@code app_state.json}
 * @param statementTimeout ceiling for one statement
 * @param defaultRowLimit row limit used when a caller gives none
 * @param executionRetention how long finished executions stay pollable
 * @param probeTimeout ceiling for the connectivity probe during reconstruction
 * @param maxPoolSize maximum pool size per live connection
 * @param schemaCallTimeout ceiling for each introspection sub-call
 * @param schemaCacheTtl time-to-live of cached schema descriptions
 * @param maxTables table cap for schema descriptions
 * @param pgDumpTimeout ceiling for the external dump tool
 */
@Builder(toBuilder = true)
public record CatdbSettings(
        Path configDir,
        Duration statementTimeout,
        int defaultRowLimit,
        Duration executionRetention,
        Duration probeTimeout,
        int maxPoolSize,
        Duration schemaCallTimeout,
        Duration schemaCacheTtl,
        int maxTables,
        Duration pgDumpTimeout
) {

    private static final Logger log = LoggerFactory.getLogger(CatdbSettings.class);

    public static final String CONFIG_FILE = "config.json";
    public static final String APP_STATE_FILE = "app_state.json";

    /**
     * Built-in defaults.
     *
     * @return settings
     */
    public static CatdbSettings defaults() {
        return new CatdbSettings(
                Paths.get(System.getProperty("user.home"), ".catdbviewer"),
                Duration.ofSeconds(30),
                1000,
                Duration.ofMinutes(10),
                Duration.ofSeconds(5),
                5,
                Duration.ofSeconds(5),
                Duration.ofSeconds(60),
                50,
                Duration.ofSeconds(20)
        );
    }

    /**
     * Resolve settings from the Spring environment.
     *
     * @param environment environment (may be null)
     * @return settings
     */
    public static CatdbSettings fromEnvironment(Environment environment) {
        CatdbSettings d = defaults();
        String dir = getTrimmed(environment, "catdb.config-dir", "CATDB_CONFIG_DIR");
        Path configDir = d.configDir();
        if (dir != null && !dir.isBlank()) {
            configDir = Paths.get(dir.replaceFirst("^~", Matcher.quoteReplacement(System.getProperty("user.home"))));
        }
        return new CatdbSettings(
                configDir,
                getMillis(environment, "catdb.execution.statement-timeout-ms", "CATDB_STATEMENT_TIMEOUT_MS", d.statementTimeout()),
                getInt(environment, "catdb.execution.default-row-limit", "CATDB_DEFAULT_ROW_LIMIT", d.defaultRowLimit()),
                getMillis(environment, "catdb.execution.retention-ms", "CATDB_EXECUTION_RETENTION_MS", d.executionRetention()),
                getMillis(environment, "catdb.registry.probe-timeout-ms", "CATDB_PROBE_TIMEOUT_MS", d.probeTimeout()),
                getInt(environment, "catdb.registry.max-pool-size", "CATDB_MAX_POOL_SIZE", d.maxPoolSize()),
                getMillis(environment, "catdb.schema.call-timeout-ms", "CATDB_SCHEMA_CALL_TIMEOUT_MS", d.schemaCallTimeout()),
                getMillis(environment, "catdb.schema.cache-ttl-ms", "CATDB_SCHEMA_CACHE_TTL_MS", d.schemaCacheTtl()),
                getInt(environment, "catdb.schema.max-tables", "CATDB_SCHEMA_MAX_TABLES", d.maxTables()),
                getMillis(environment, "catdb.schema.pg-dump-timeout-ms", "CATDB_PG_DUMP_TIMEOUT_MS", d.pgDumpTimeout())
        );
    }

    public Path configFile() {
        return configDir.resolve(CONFIG_FILE);
    }

    public Path appStateFile() {
        return configDir.resolve(APP_STATE_FILE);
    }

    private static Duration getMillis(Environment environment, String propKey, String envKey, Duration fallback) {
        return Duration.ofMillis(getInt(environment, propKey, envKey, (int) fallback.toMillis()));
    }

    private static int getInt(Environment environment, String propKey, String envKey, int fallback) {
        String raw = getTrimmed(environment, propKey, envKey);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int v = Integer.parseInt(raw);
            if (v < 0) {
                log.warn("Ignoring negative setting (key={}, value={}, default={})", propKey, raw, fallback);
                return fallback;
            }
            return v;
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric setting (key={}, value={}, default={})", propKey, raw, fallback);
            return fallback;
        }
    }

    static String getTrimmed(Environment environment, String propKey, String envKey) {
        if (environment == null) {
            return null;
        }
        String v = environment.getProperty(propKey);
        if ((v == null || v.isBlank()) && envKey != null) {
            v = environment.getProperty(envKey);
        }
        return v != null ? v.trim() : null;
    }
}
