package com.catdb.service;

import com.catdb.registry.ConnectionRegistry;
import com.catdb.registry.ConnectionUnavailableException;
import com.catdb.registry.LiveConnection;
import com.catdb.schema.SchemaIntrospector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Picks a connection and describes its schema for prompt enrichment.
 *
 * <p>An explicit name wins. Otherwise the most recently opened live connection is used, and
 * failing that the first configured connection that can be opened.
 */
@Slf4j
@Component
public class SchemaContextProvider {

    private final ConnectionRegistry registry;
    private final SchemaIntrospector introspector;

    public SchemaContextProvider(ConnectionRegistry registry, SchemaIntrospector introspector) {
        this.registry = registry;
        this.introspector = introspector;
    }

    /**
     * Describe the chosen connection.
     *
     * @param connectionName explicit connection, or null
     * @return connection name and description, empty when no connection could be opened
     */
    public Optional<SchemaContext> resolve(String connectionName) {
        if (connectionName != null && !connectionName.isBlank()) {
            return describe(connectionName);
        }
        List<String> liveNames = registry.liveNames();
        if (!liveNames.isEmpty()) {
            Optional<SchemaContext> latest = describe(liveNames.get(liveNames.size() - 1));
            if (latest.isPresent()) {
                return latest;
            }
        }
        for (String name : registry.list()) {
            Optional<SchemaContext> ctx = describe(name);
            if (ctx.isPresent()) {
                return ctx;
            }
        }
        return Optional.empty();
    }

    private Optional<SchemaContext> describe(String name) {
        try {
            LiveConnection live = registry.get(name);
            return Optional.of(new SchemaContext(name, introspector.describe(live)));
        } catch (ConnectionUnavailableException e) {
            log.debug("Skipping connection for schema context (name={}, error={})", name, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @param connectionName described connection
     * @param text description
     */
    public record SchemaContext(String connectionName, String text) {
    }
}
