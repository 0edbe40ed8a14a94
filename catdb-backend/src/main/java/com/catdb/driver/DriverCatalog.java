package com.catdb.driver;

import com.catdb.model.ConnectionKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Catalog of the JDBC driver variants bundled with the back end.
 *
 * <p>Configurations written by older clients name their driver by its client-library name
 * ({@code psycopg2}, {@code pymysql}, ...). Those names are registered as aliases of the
 * bundled variant of the same kind.
 */
@Slf4j
@Component
public class DriverCatalog {

    /**
     * One driver variant of a connection kind.
     */
    public static class Variant {
        private final ConnectionKind kind;
        private final String name;
        private final String driverClass;
        private final String urlPrefix;
        private final Integer defaultPort;

        /**
         * Create a variant.
         *
         * @param kind connection kind
         * @param name variant name
         * @param driverClass JDBC driver class
         * @param urlPrefix JDBC URL prefix
         * @param defaultPort default port (null for file-based kinds)
         */
        public Variant(ConnectionKind kind, String name, String driverClass, String urlPrefix, Integer defaultPort) {
            this.kind = kind;
            this.name = name;
            this.driverClass = driverClass;
            this.urlPrefix = urlPrefix;
            this.defaultPort = defaultPort;
        }

        public ConnectionKind getKind() {
            return kind;
        }

        public String getName() {
            return name;
        }

        public String getDriverClass() {
            return driverClass;
        }

        public String getUrlPrefix() {
            return urlPrefix;
        }

        public Integer getDefaultPort() {
            return defaultPort;
        }
    }

    private final Map<String, Variant> variantsByKey = new ConcurrentHashMap<>();
    private final Map<ConnectionKind, Variant> defaults = Collections.synchronizedMap(new EnumMap<>(ConnectionKind.class));

    /**
     * Create the catalog with the bundled drivers.
     */
    public DriverCatalog() {
        registerBuiltin(new Variant(ConnectionKind.SQLITE, "xerial", "org.sqlite.JDBC", "jdbc:sqlite:", null),
                "sqlite3", "pysqlite");
        registerBuiltin(new Variant(ConnectionKind.POSTGRESQL, "pgjdbc", "org.postgresql.Driver", "jdbc:postgresql://", 5432),
                "psycopg2", "psycopg", "asyncpg", "pg8000");
        registerBuiltin(new Variant(ConnectionKind.MYSQL, "connector-j", "com.mysql.cj.jdbc.Driver", "jdbc:mysql://", 3306),
                "pymysql", "mysqldb", "mysqlconnector", "mysql-connector");
    }

    /**
     * Register a variant as the default of its kind, under its own name and the given aliases.
     *
     * @param variant variant
     * @param aliases alias names
     */
    public void registerBuiltin(Variant variant, String... aliases) {
        variantsByKey.put(key(variant.getKind(), variant.getName()), variant);
        for (String alias : aliases) {
            variantsByKey.put(key(variant.getKind(), alias), variant);
        }
        defaults.put(variant.getKind(), variant);
    }

    /**
     * Find a variant by name or alias.
     *
     * @param kind kind
     * @param name variant name
     * @return variant if registered
     */
    public Optional<Variant> find(ConnectionKind kind, String name) {
        if (kind == null || name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(variantsByKey.get(key(kind, name)));
    }

    /**
     * Resolve a variant, falling back to the kind's default for blank or unknown names.
     *
     * @param kind kind
     * @param name variant name (may be null)
     * @return variant
     */
    public Variant resolve(ConnectionKind kind, String name) {
        Optional<Variant> found = find(kind, name);
        if (found.isPresent()) {
            return found.get();
        }
        Variant fallback = defaults.get(kind);
        if (fallback == null) {
            throw new IllegalArgumentException("No driver registered for kind: " + kind);
        }
        if (name != null && !name.isBlank()) {
            log.warn("Unknown driver variant, using default (kind={}, variant={}, default={})", kind.id(), name, fallback.getName());
        }
        return fallback;
    }

    /**
     * Default variant of each kind.
     *
     * @return variants
     */
    public List<Variant> list() {
        synchronized (defaults) {
            return new ArrayList<>(defaults.values());
        }
    }

    private static String key(ConnectionKind kind, String name) {
        return kind.id() + ":" + name.trim().toLowerCase(Locale.ROOT);
    }
}
