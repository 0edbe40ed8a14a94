package com.catdb.util;

import java.util.Locale;
import java.util.Map;

/**
 * Normalizes incoming connection kinds (and aliases) into canonical kind strings.
 */
public final class DbKindNormalizer {

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("postgres", "postgresql"),
            Map.entry("pg", "postgresql"),
            Map.entry("pgsql", "postgresql"),
            Map.entry("mariadb", "mysql"),
            Map.entry("sqlite3", "sqlite")
    );

    private DbKindNormalizer() {
    }

    /**
     * Normalize a kind.
     *
     * @param kind incoming kind
     * @return normalized kind (lowercased + alias mapping), empty when blank
     */
    public static String normalize(String kind) {
        if (kind == null) {
            return "";
        }
        String v = kind.trim().toLowerCase(Locale.ROOT);
        if (v.isBlank()) {
            return "";
        }
        return ALIASES.getOrDefault(v, v);
    }
}
