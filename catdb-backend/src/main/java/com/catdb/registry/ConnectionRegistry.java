package com.catdb.registry;

import com.catdb.config.CatdbSettings;
import com.catdb.driver.DriverCatalog;
import com.catdb.driver.JdbcTargetResolver;
import com.catdb.model.ConnectionConfig;
import com.catdb.model.ConnectionKind;
import com.catdb.util.DeadlineOutcome;
import com.catdb.util.DeadlineRunner;
import com.catdb.util.DsnParser;
import com.catdb.util.ParsedDescriptor;
import com.catdb.util.PasswordObfuscator;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;

/**
 * Owns every named connection: its persisted {@link ConnectionConfig} and, lazily, its
 * {@link LiveConnection}.
 *
 * <p>Both maps are guarded by one lock. Reconstruction and probing run outside it, so a slow
 * server never blocks other names. Every mutating call rewrites {@code config.json}.
 */
@Slf4j
@Service
public class ConnectionRegistry {

    private static final List<String> SCHEMA_FIELDS = List.of("schema", "search_path", "currentSchema");
    private static final Set<String> KNOWN_FIELDS = Set.of(
            "host", "port", "user", "password", "database", "path", "driver", "schema", "search_path", "currentSchema"
    );
    private static final String OPTIONS = "options";

    private final ConnectionConfigStore store;
    private final JdbcTargetResolver targetResolver;
    private final DriverCatalog driverCatalog;
    private final LiveConnectionFactory connectionFactory;
    private final DeadlineRunner deadlineRunner;
    private final CatdbSettings settings;

    private final Object lock = new Object();
    private final Map<String, ConnectionConfig> configs = new LinkedHashMap<>();
    private final Map<String, LiveConnection> live = new LinkedHashMap<>();
    private final List<ConnectionLifecycleListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Create the registry and load persisted configurations.
     *
     * @param store config store
     * @param targetResolver JDBC target resolver
     * @param driverCatalog driver catalog
     * @param connectionFactory handle factory
     * @param deadlineRunner runner for connectivity probes
     * @param settings settings
     */
    public ConnectionRegistry(
            ConnectionConfigStore store,
            JdbcTargetResolver targetResolver,
            DriverCatalog driverCatalog,
            LiveConnectionFactory connectionFactory,
            DeadlineRunner deadlineRunner,
            CatdbSettings settings
    ) {
        this.store = store;
        this.targetResolver = targetResolver;
        this.driverCatalog = driverCatalog;
        this.connectionFactory = connectionFactory;
        this.deadlineRunner = deadlineRunner;
        this.settings = settings;
        this.configs.putAll(store.load());
    }

    /**
     * Register a listener for add/edit/remove/schema changes.
     *
     * @param listener listener
     */
    public void addListener(ConnectionLifecycleListener listener) {
        listeners.add(listener);
    }

    /**
     * Register an existing database file under a name derived from the file name.
     *
     * @param path file path
     * @return display name
     */
    public String addFile(String path) {
        return addFile(null, path);
    }

    /**
     * Register an existing database file. The file is not opened.
     *
     * @param requestedName name, or null for {@code SQLite: <file name>}
     * @param path file path
     * @return display name, disambiguated on collision
     * @throws DatabaseFileNotFoundException when the file does not exist
     */
    public String addFile(String requestedName, String path) {
        if (path == null || path.isBlank()) {
            throw new ConnectionValidationException("Database file path is required");
        }
        Path abs = Paths.get(path.trim()).toAbsolutePath().normalize();
        if (!Files.exists(abs)) {
            throw new DatabaseFileNotFoundException(abs.toString());
        }
        String base = requestedName != null && !requestedName.isBlank()
                ? requestedName.trim()
                : "SQLite: " + abs.getFileName();
        ConnectionConfig config = ConnectionConfig.builder()
                .kind(ConnectionKind.SQLITE.id())
                .path(abs.toString())
                .build();

        String name;
        synchronized (lock) {
            name = disambiguate(base, null);
            config.setDisplayName(name);
            configs.put(name, config);
            persistOrRollback(name);
        }
        log.info("Connection added (name={}, kind=sqlite, path={})", name, abs);
        notifyListeners(name, ConnectionLifecycleListener.Change.ADDED);
        return name;
    }

    /**
     * Register a network connection. The live handle is built but not tested.
     *
     * <p>Field aliases {@code username} and {@code pwd} are accepted. A descriptor under
     * {@code jdbc} (or {@code descriptor}) is merged in, with explicit fields taking precedence.
     * Unknown fields become driver parameters.
     *
     * @param name requested display name
     * @param kind connection kind (may be blank when a descriptor supplies it)
     * @param fields connection fields
     * @return display name, disambiguated on collision
     * @throws ConnectionValidationException for an unsupported kind or malformed values
     */
    public String add(String name, String kind, Map<String, String> fields) {
        ConnectionConfig config = buildConfig(name, kind, fields);
        if (config.isFileBased()) {
            return addFile(config.getDisplayName(), config.getPath());
        }

        String displayName;
        synchronized (lock) {
            displayName = disambiguate(config.getDisplayName(), null);
            config.setDisplayName(displayName);
            LiveConnection handle = connectionFactory.open(displayName, targetResolver.resolve(config, config.getPassword()));
            configs.put(displayName, config);
            live.put(displayName, handle);
            persistOrRollback(displayName);
        }
        log.info(
                "Connection added (name={}, kind={}, host={}, port={}, database={}, schema={})",
                displayName, config.getKind(), config.getHost(), config.getPort(), config.getDatabase(), config.getSchema()
        );
        notifyListeners(displayName, ConnectionLifecycleListener.Change.ADDED);
        return displayName;
    }

    /**
     * Replace a connection's configuration. Blank fields keep their previous values. When the name
     * changes the new one is disambiguated; the old entry is dropped only after the new one is
     * built.
     *
     * @param name current display name
     * @param newName new display name (null keeps the current one)
     * @param kind kind (null keeps the current one)
     * @param fields changed fields
     * @return final display name
     */
    public String edit(String name, String newName, String kind, Map<String, String> fields) {
        ConnectionConfig previous = config(name)
                .orElseThrow(() -> new ConnectionValidationException("No connection named '" + name + "'"));

        Map<String, String> merged = new LinkedHashMap<>();
        if (previous.getExtraParams() != null) {
            merged.putAll(previous.getExtraParams());
        }
        putIfPresent(merged, "host", previous.getHost());
        putIfPresent(merged, "port", previous.getPort() != null ? String.valueOf(previous.getPort()) : null);
        putIfPresent(merged, "user", previous.getUser());
        putIfPresent(merged, "password", previous.getPassword());
        putIfPresent(merged, "database", previous.getDatabase());
        putIfPresent(merged, "path", previous.getPath());
        putIfPresent(merged, "driver", previous.getDriver());
        putIfPresent(merged, "schema", previous.getSchema());
        if (fields != null) {
            fields.forEach((k, v) -> {
                if (v != null && !v.isBlank()) {
                    merged.put(normalizeFieldName(k), v);
                }
            });
        }
        String targetName = newName != null && !newName.isBlank() ? newName.trim() : name;
        String targetKind = kind != null && !kind.isBlank() ? kind : previous.getKind();
        ConnectionConfig config = buildConfig(targetName, targetKind, merged);
        if (config.isFileBased()) {
            Path abs = Paths.get(config.getPath()).toAbsolutePath().normalize();
            if (!Files.exists(abs)) {
                throw new DatabaseFileNotFoundException(abs.toString());
            }
            config.setPath(abs.toString());
        }

        String finalName;
        LiveConnection retired;
        synchronized (lock) {
            if (!configs.containsKey(name)) {
                throw new ConnectionValidationException("No connection named '" + name + "'");
            }
            finalName = targetName.equals(name) ? name : disambiguate(targetName, name);
            config.setDisplayName(finalName);
            LiveConnection handle = config.isFileBased()
                    ? null
                    : connectionFactory.open(finalName, targetResolver.resolve(config, config.getPassword()));
            ConnectionConfig replaced = configs.remove(name);
            retired = live.remove(name);
            configs.put(finalName, config);
            if (handle != null) {
                live.put(finalName, handle);
            }
            try {
                store.save(configs);
            } catch (RuntimeException e) {
                configs.remove(finalName);
                live.remove(finalName);
                configs.put(name, replaced);
                if (retired != null) {
                    live.put(name, retired);
                }
                if (handle != null) {
                    handle.close();
                }
                throw e;
            }
        }
        if (retired != null) {
            retired.close();
        }
        log.info("Connection edited (name={}, new_name={}, kind={})", name, finalName, config.getKind());
        if (!finalName.equals(name)) {
            notifyListeners(name, ConnectionLifecycleListener.Change.REMOVED);
            notifyListeners(finalName, ConnectionLifecycleListener.Change.ADDED);
        } else {
            notifyListeners(finalName, ConnectionLifecycleListener.Change.EDITED);
        }
        return finalName;
    }

    /**
     * Switch the session schema of a connection. For Postgres this is the search path applied on
     * every new physical connection; for MySQL it is the default database. The live handle is
     * disposed so the next {@link #get(String)} picks the change up.
     *
     * @param name display name
     * @param schema schema (or comma-separated search path)
     */
    public void changeSchema(String name, String schema) {
        if (schema == null || schema.isBlank()) {
            throw new ConnectionValidationException("Schema is required");
        }
        String value = schema.trim();
        LiveConnection retired;
        synchronized (lock) {
            ConnectionConfig current = configs.get(name);
            if (current == null) {
                throw new ConnectionValidationException("No connection named '" + name + "'");
            }
            ConnectionConfig previous = current.copy();
            ConnectionKind kind = ConnectionKind.fromId(current.getKind()).orElse(null);
            if (kind == ConnectionKind.POSTGRESQL) {
                current.setSchema(value);
                Map<String, String> params = current.getExtraParams();
                params.put(OPTIONS, withSearchPath(params.get(OPTIONS), value));
            } else if (kind == ConnectionKind.MYSQL) {
                current.setDatabase(value);
            } else {
                throw new ConnectionValidationException("Connection '" + name + "' has no selectable schema");
            }
            retired = live.remove(name);
            try {
                store.save(configs);
            } catch (RuntimeException e) {
                configs.put(name, previous);
                if (retired != null) {
                    live.put(name, retired);
                }
                throw e;
            }
        }
        if (retired != null) {
            retired.close();
        }
        log.info("Connection schema changed (name={}, schema={})", name, value);
        notifyListeners(name, ConnectionLifecycleListener.Change.SCHEMA_CHANGED);
    }

    /**
     * Get the live handle, reconstructing it from the persisted configuration when absent.
     *
     * <p>Reconstruction tries each credential candidate in order (the stored password, then its
     * letter-rotated variant for configs written in plain text) and keeps the first one whose
     * connectivity probe succeeds within the probe timeout.
     *
     * @param name display name
     * @return live handle
     * @throws ConnectionUnavailableException when there is no such connection or no candidate works
     */
    public LiveConnection get(String name) {
        ConnectionConfig config;
        synchronized (lock) {
            LiveConnection cached = live.get(name);
            if (cached != null && !cached.isClosed()) {
                return cached;
            }
            config = configs.get(name);
            if (config == null) {
                throw new ConnectionUnavailableException(name, "no configuration with this name", null);
            }
            config = config.copy();
        }

        LiveConnection handle = reconstruct(config);
        synchronized (lock) {
            if (!configs.containsKey(name)) {
                handle.close();
                throw new ConnectionUnavailableException(name, "connection was removed", null);
            }
            LiveConnection raced = live.get(name);
            if (raced != null && !raced.isClosed()) {
                handle.close();
                return raced;
            }
            live.put(name, handle);
        }
        return handle;
    }

    /**
     * All names, configured or live, sorted.
     *
     * @return names
     */
    public List<String> list() {
        synchronized (lock) {
            Set<String> names = new TreeSet<>(configs.keySet());
            names.addAll(live.keySet());
            return new ArrayList<>(names);
        }
    }

    /**
     * Names with a live handle, oldest first.
     *
     * @return names
     */
    public List<String> liveNames() {
        synchronized (lock) {
            return new ArrayList<>(live.keySet());
        }
    }

    /**
     * Copy of a stored configuration.
     *
     * @param name display name
     * @return configuration, if any
     */
    public Optional<ConnectionConfig> config(String name) {
        synchronized (lock) {
            ConnectionConfig config = configs.get(name);
            return Optional.ofNullable(config != null ? config.copy() : null);
        }
    }

    /**
     * Dispose the live handle and delete the configuration. Removing an unknown name does nothing.
     *
     * @param name display name
     */
    public void remove(String name) {
        LiveConnection handle;
        boolean existed;
        synchronized (lock) {
            handle = live.remove(name);
            existed = configs.remove(name) != null;
            if (existed) {
                store.save(configs);
            }
        }
        if (handle != null) {
            handle.close();
        }
        if (existed || handle != null) {
            log.info("Connection removed (name={})", name);
            notifyListeners(name, ConnectionLifecycleListener.Change.REMOVED);
        }
    }

    @PreDestroy
    public void shutdown() {
        List<LiveConnection> handles;
        synchronized (lock) {
            handles = new ArrayList<>(live.values());
            live.clear();
        }
        handles.forEach(LiveConnection::close);
    }

    private LiveConnection reconstruct(ConnectionConfig config) {
        String name = config.getDisplayName();
        if (config.isFileBased() && (config.getPath() == null || !Files.exists(Paths.get(config.getPath())))) {
            throw new ConnectionUnavailableException(name, "database file is missing",
                    new DatabaseFileNotFoundException(String.valueOf(config.getPath())));
        }

        List<String> candidates = credentialCandidates(config.getPassword());
        int probeSeconds = (int) Math.max(1, settings.probeTimeout().toSeconds());
        Throwable lastError = null;
        for (int i = 0; i < candidates.size(); i++) {
            LiveConnection handle;
            try {
                handle = connectionFactory.open(name, targetResolver.resolve(config, candidates.get(i)));
            } catch (RuntimeException e) {
                lastError = e;
                log.warn("Building connection failed (name={}, candidate={}, error={})", name, i, e.getMessage());
                continue;
            }
            DeadlineOutcome<Boolean> outcome = probe(handle, probeSeconds);
            if (outcome.isCompleted()) {
                log.info("Connection reconstructed (name={}, candidate={})", name, i);
                return handle;
            }
            lastError = outcome.isTimedOut()
                    ? new TimeoutException("Connectivity probe timed out after " + settings.probeTimeout().toMillis() + " ms")
                    : outcome.getError();
            log.warn("Connectivity probe failed (name={}, candidate={}, reason={})", name, i, outcome.describe());
            handle.close();
        }
        String reason = lastError != null && lastError.getMessage() != null ? lastError.getMessage() : "engine was not created";
        throw new ConnectionUnavailableException(name, reason, lastError);
    }

    private DeadlineOutcome<Boolean> probe(LiveConnection handle, int probeSeconds) {
        return deadlineRunner.run(() -> {
            handle.probe(probeSeconds);
            return Boolean.TRUE;
        }, settings.probeTimeout());
    }

    static List<String> credentialCandidates(String stored) {
        List<String> candidates = new ArrayList<>();
        candidates.add(stored);
        String rotated = PasswordObfuscator.reveal(stored);
        if (rotated != null && !rotated.equals(stored)) {
            candidates.add(rotated);
        }
        return candidates;
    }

    private ConnectionConfig buildConfig(String name, String kindRaw, Map<String, String> rawFields) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (rawFields != null) {
            for (Map.Entry<String, String> e : rawFields.entrySet()) {
                if (e.getKey() == null || e.getKey().isBlank()) {
                    throw new ConnectionValidationException("Parameter name must not be blank");
                }
                fields.put(normalizeFieldName(e.getKey().trim()), e.getValue());
            }
        }

        String descriptor = firstNonBlank(fields.remove("jdbc"), fields.remove("descriptor"));
        String descriptorSchema = null;
        String descriptorKind = null;
        Map<String, String> params = new LinkedHashMap<>();
        if (descriptor != null) {
            ParsedDescriptor parsed = DsnParser.parse(descriptor);
            descriptorKind = parsed.getKind();
            descriptorSchema = parsed.getSchema();
            if (ConnectionKind.SQLITE.id().equals(parsed.getKind())) {
                putIfAbsentNonBlank(fields, "path", parsed.getDatabase());
            } else {
                putIfAbsentNonBlank(fields, "host", parsed.getHost());
                putIfAbsentNonBlank(fields, "port", parsed.getPort() != null ? String.valueOf(parsed.getPort()) : null);
                putIfAbsentNonBlank(fields, "user", parsed.getUsername());
                putIfAbsentNonBlank(fields, "password", parsed.getPassword());
                putIfAbsentNonBlank(fields, "database", parsed.getDatabase());
            }
            params.putAll(parsed.getParams());
        }

        String effectiveKind = kindRaw != null && !kindRaw.isBlank() ? kindRaw : descriptorKind;
        ConnectionKind kind = ConnectionKind.fromId(effectiveKind)
                .orElseThrow(() -> new ConnectionValidationException("Unsupported connection type: " + effectiveKind));

        String explicitSchema = null;
        for (String key : SCHEMA_FIELDS) {
            String v = fields.get(key);
            if (explicitSchema == null && v != null && !v.isBlank()) {
                explicitSchema = v.trim();
            }
        }

        for (Map.Entry<String, String> e : fields.entrySet()) {
            if (KNOWN_FIELDS.contains(e.getKey())) {
                continue;
            }
            if (e.getValue() == null) {
                throw new ConnectionValidationException("Missing value for parameter '" + e.getKey() + "'");
            }
            params.put(e.getKey(), e.getValue());
        }

        if (kind == ConnectionKind.SQLITE) {
            String path = firstNonBlank(fields.get("path"), fields.get("database"));
            if (path == null) {
                throw new ConnectionValidationException("A database file path is required for sqlite connections");
            }
            return ConnectionConfig.builder()
                    .displayName(name != null && !name.isBlank() ? name.trim() : null)
                    .kind(kind.id())
                    .path(path)
                    .build();
        }

        DriverCatalog.Variant variant = driverCatalog.resolve(kind, fields.get("driver"));
        String host = firstNonBlank(fields.get("host"), "localhost");
        Integer port = parsePort(fields.get("port"));
        if (port == null) {
            port = variant.getDefaultPort();
        }
        String database = firstNonBlank(fields.get("database"));

        String schema = null;
        if (kind == ConnectionKind.POSTGRESQL) {
            schema = explicitSchema;
            if (schema == null) {
                schema = descriptorSchema;
            }
            if (schema == null) {
                schema = DsnParser.extractSearchPath(params.get(OPTIONS));
            }
            if (schema != null) {
                String options = params.get(OPTIONS);
                if (options == null || !options.contains("-c search_path=" + schema)) {
                    params.put(OPTIONS, withSearchPath(options, schema));
                }
            }
        }

        String displayName = name != null && !name.isBlank()
                ? name.trim()
                : kind.id() + "@" + host + (database != null ? "/" + database : "");

        return ConnectionConfig.builder()
                .displayName(displayName)
                .kind(kind.id())
                .driver(variant.getName())
                .host(host)
                .port(port)
                .user(firstNonBlank(fields.get("user")))
                .password(fields.get("password"))
                .database(database)
                .schema(schema)
                .extraParams(params)
                .build();
    }

    private static Integer parsePort(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            int port = Integer.parseInt(raw.trim());
            if (port < 1 || port > 65535) {
                throw new ConnectionValidationException("Port out of range: " + raw);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new ConnectionValidationException("Invalid port: " + raw);
        }
    }

    static String withSearchPath(String options, String schema) {
        String base = options == null ? "" : options.replaceAll("-c\\s*search_path\\s*=\\s*\\S+", "").trim().replaceAll("\\s{2,}", " ");
        String fragment = "-c search_path=" + schema;
        return base.isEmpty() ? fragment : base + " " + fragment;
    }

    private static String normalizeFieldName(String key) {
        switch (key) {
            case "username":
                return "user";
            case "pwd":
                return "password";
            default:
                return key;
        }
    }

    private String disambiguate(String base, String ignoredName) {
        if (isFree(base, ignoredName)) {
            return base;
        }
        int n = 1;
        while (!isFree(base + " (" + n + ")", ignoredName)) {
            n++;
        }
        return base + " (" + n + ")";
    }

    private boolean isFree(String candidate, String ignoredName) {
        if (candidate.equals(ignoredName)) {
            return true;
        }
        return !configs.containsKey(candidate) && !live.containsKey(candidate);
    }

    private void persistOrRollback(String addedName) {
        try {
            store.save(configs);
        } catch (RuntimeException e) {
            configs.remove(addedName);
            LiveConnection handle = live.remove(addedName);
            if (handle != null) {
                handle.close();
            }
            throw e;
        }
    }

    private void notifyListeners(String name, ConnectionLifecycleListener.Change change) {
        for (ConnectionLifecycleListener listener : listeners) {
            try {
                listener.onConnectionChanged(name, change);
            } catch (RuntimeException e) {
                log.warn("Connection listener failed (name={}, change={}, error={})", name, change, e.getMessage());
            }
        }
    }

    private static void putIfPresent(Map<String, String> target, String key, String value) {
        if (value != null && !value.isBlank()) {
            target.put(key, value);
        }
    }

    private static void putIfAbsentNonBlank(Map<String, String> target, String key, String value) {
        if (value != null && !value.isBlank() && (target.get(key) == null || target.get(key).isBlank())) {
            target.put(key, value);
        }
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v.trim();
            }
        }
        return null;
    }
}
