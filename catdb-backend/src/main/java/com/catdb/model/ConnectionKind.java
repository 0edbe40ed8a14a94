package com.catdb.model;

import com.catdb.util.DbKindNormalizer;

import java.util.Optional;

/**
 * Database kinds the registry can connect to.
 */
public enum ConnectionKind {
    SQLITE("sqlite"),
    POSTGRESQL("postgresql"),
    MYSQL("mysql");

    private final String id;

    ConnectionKind(String id) {
        this.id = id;
    }

    /**
     * Persisted identifier, e.g. {@code postgresql}.
     *
     * @return id
     */
    public String id() {
        return id;
    }

    /**
     * Resolve a kind from an id or alias.
     *
     * @param raw raw kind
     * @return kind, empty when unsupported
     */
    public static Optional<ConnectionKind> fromId(String raw) {
        String normalized = DbKindNormalizer.normalize(raw);
        for (ConnectionKind kind : values()) {
            if (kind.id.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
