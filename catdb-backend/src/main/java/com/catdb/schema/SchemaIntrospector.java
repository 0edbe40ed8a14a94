package com.catdb.schema;

import com.catdb.config.CatdbSettings;
import com.catdb.model.ConnectionKind;
import com.catdb.registry.ConnectionRegistry;
import com.catdb.registry.LiveConnection;
import com.catdb.util.DeadlineOutcome;
import com.catdb.util.DeadlineRunner;
import com.catdb.util.SqlIdentifiers;
import com.catdb.util.SqlIdentifiers.QualifiedName;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads table, column, key, index and view metadata from live connections.
 *
 * <p>Every metadata round trip runs under its own deadline on its own pooled connection. A call
 * that times out or fails leaves a marker in the output instead of failing the whole operation.
 * Descriptions are cached per live handle and dropped whenever the registry reports a change to
 * the connection.
 */
@Slf4j
@Service
public class SchemaIntrospector {

    private static final String[] TABLE_TYPES = {"TABLE", "PARTITIONED TABLE"};
    private static final String[] VIEW_TYPES = {"VIEW"};
    private static final Set<Integer> SIZED_TYPES = Set.of(
            Types.CHAR, Types.VARCHAR, Types.NCHAR, Types.NVARCHAR, Types.DECIMAL, Types.NUMERIC
    );

    private final DeadlineRunner deadlineRunner;
    private final PgDumpRunner pgDumpRunner;
    private final Duration callTimeout;
    private final Duration cacheTtl;
    private final int maxTables;
    private final Clock clock;
    private final Map<String, CachedDescription> cache = new ConcurrentHashMap<>();

    @Autowired
    public SchemaIntrospector(
            ConnectionRegistry registry,
            DeadlineRunner deadlineRunner,
            PgDumpRunner pgDumpRunner,
            CatdbSettings settings
    ) {
        this(registry, deadlineRunner, pgDumpRunner, settings, Clock.systemUTC());
    }

    SchemaIntrospector(
            ConnectionRegistry registry,
            DeadlineRunner deadlineRunner,
            PgDumpRunner pgDumpRunner,
            CatdbSettings settings,
            Clock clock
    ) {
        this.deadlineRunner = deadlineRunner;
        this.pgDumpRunner = pgDumpRunner;
        this.callTimeout = settings.schemaCallTimeout();
        this.cacheTtl = settings.schemaCacheTtl();
        this.maxTables = settings.maxTables();
        this.clock = clock;
        if (registry != null) {
            registry.addListener((name, change) -> invalidate(name));
        }
    }

    /**
     * Text description of tables (up to the configured cap) and views, suitable for prompts.
     *
     * @param live live handle
     * @return description
     */
    public String describe(LiveConnection live) {
        CachedDescription cached = cache.get(live.getId());
        Instant now = clock.instant();
        if (cached != null && cached.createdAt().plus(cacheTtl).isAfter(now)) {
            return cached.text();
        }
        String text = buildDescription(live);
        cache.put(live.getId(), new CachedDescription(live.getName(), text, now));
        return text;
    }

    /**
     * Column names of every table, in declaration order.
     *
     * @param live live handle
     * @return table to columns, empty when the metadata could not be read in time
     */
    public Map<String, List<String>> tableColumns(LiveConnection live) {
        DeadlineOutcome<Map<String, List<String>>> outcome = bounded(live, conn -> {
            DatabaseMetaData md = conn.getMetaData();
            Scope scope = Scope.of(conn, live.getKind());
            Map<String, List<String>> out = new LinkedHashMap<>();
            for (String table : listNames(md, scope, TABLE_TYPES)) {
                List<String> names = new ArrayList<>();
                for (ColumnInfo column : fetchColumns(md, scope, table)) {
                    names.add(column.name());
                }
                out.put(table, names);
            }
            return out;
        });
        if (!outcome.isCompleted()) {
            log.warn("Listing table columns failed (connection={}, outcome={})", live.getName(), outcome.describe());
            return Map.of();
        }
        return outcome.getValue();
    }

    /**
     * Primary key columns of a table, in key order.
     *
     * @param live live handle
     * @param table possibly schema-qualified table
     * @return columns, empty when there is no key or it could not be read
     */
    public List<String> primaryKeyColumns(LiveConnection live, String table) {
        QualifiedName qn = QualifiedName.parse(table);
        DeadlineOutcome<List<String>> outcome = bounded(live, conn -> {
            Scope scope = Scope.of(conn, live.getKind()).narrowedTo(qn, live.getKind());
            return fetchPrimaryKey(conn.getMetaData(), scope, qn.name());
        });
        if (!outcome.isCompleted()) {
            log.warn("Reading primary key failed (connection={}, table={}, outcome={})", live.getName(), table, outcome.describe());
            return List.of();
        }
        return outcome.getValue();
    }

    /**
     * Reconstruct the {@code CREATE TABLE} statement of a table. Strategies run in order until
     * one yields text: driver metadata, then the dialect's own catalog, then for Postgres the
     * {@code pg_dump} tool when installed.
     *
     * @param live live handle
     * @param table possibly schema-qualified table
     * @return statement, or empty text when every strategy failed
     */
    public String createStatement(LiveConnection live, String table) {
        QualifiedName qn;
        try {
            qn = QualifiedName.parse(table);
        } catch (IllegalArgumentException e) {
            return "";
        }
        return createStatement(live, qn, true);
    }

    /**
     * Drop cached descriptions of a connection name.
     *
     * @param connectionName connection name
     */
    public void invalidate(String connectionName) {
        if (cache.values().removeIf(entry -> entry.connectionName().equals(connectionName))) {
            log.debug("Schema cache invalidated (connection={})", connectionName);
        }
    }

    public void invalidateAll() {
        cache.clear();
    }

    private String buildDescription(LiveConnection live) {
        ConnectionKind kind = live.getKind();
        StringBuilder out = new StringBuilder();

        DeadlineOutcome<String> product = bounded(live, conn -> {
            DatabaseMetaData md = conn.getMetaData();
            return md.getDatabaseProductName() + " " + md.getDatabaseProductVersion();
        });
        out.append("Connection dialect: ").append(kind.id());
        if (product.isCompleted()) {
            out.append(" (").append(product.getValue()).append(')');
        }
        out.append('\n');

        DeadlineOutcome<Scope> scopeOutcome = bounded(live, conn -> Scope.of(conn, kind));
        Scope scope = scopeOutcome.orElse(Scope.NONE);

        DeadlineOutcome<List<String>> tables = bounded(live, conn -> listNames(conn.getMetaData(), scope, TABLE_TYPES));
        out.append("Tables:\n");
        if (!tables.isCompleted()) {
            out.append("  (failed to list tables: ").append(tables.describe()).append(")\n");
        } else {
            List<String> names = tables.getValue();
            for (String table : names.subList(0, Math.min(maxTables, names.size()))) {
                describeTable(live, scope, table, out);
            }
            if (names.size() > maxTables) {
                out.append("... (table list truncated to first ").append(maxTables).append(" tables)\n");
            }
        }

        DeadlineOutcome<List<String>> views = bounded(live, conn -> listNames(conn.getMetaData(), scope, VIEW_TYPES));
        out.append("Views:\n");
        if (!views.isCompleted()) {
            out.append("  (failed to list views: ").append(views.describe()).append(")\n");
        } else {
            for (String view : views.getValue()) {
                out.append("- ").append(view).append('\n');
                DeadlineOutcome<String> definition = bounded(live, conn -> viewDefinition(conn, kind, scope, view));
                String text = definition.orElse("");
                if (text == null || text.isBlank()) {
                    out.append("  (view definition not available)\n");
                } else {
                    out.append("  Definition:\n").append(indent(text.trim(), "    ")).append('\n');
                }
            }
        }
        return out.toString();
    }

    private void describeTable(LiveConnection live, Scope scope, String table, StringBuilder out) {
        out.append("- ").append(table).append('\n');

        DeadlineOutcome<List<ColumnInfo>> columns = bounded(live, conn -> fetchColumns(conn.getMetaData(), scope, table));
        if (columns.isCompleted()) {
            for (ColumnInfo c : columns.getValue()) {
                out.append("  - ").append(c.name()).append(": ").append(c.type())
                        .append(", nullable=").append(c.nullable())
                        .append(", default=").append(c.defaultValue())
                        .append('\n');
            }
        } else {
            out.append("  (failed to introspect columns: ").append(columns.describe()).append(")\n");
        }

        DeadlineOutcome<List<String>> pk = bounded(live, conn -> fetchPrimaryKey(conn.getMetaData(), scope, table));
        if (pk.isCompleted()) {
            if (!pk.getValue().isEmpty()) {
                out.append("  Primary key: ").append(pk.getValue()).append('\n');
            }
        } else {
            out.append("  (failed to read primary key: ").append(pk.describe()).append(")\n");
        }

        DeadlineOutcome<List<ForeignKeyInfo>> fks = bounded(live, conn -> fetchForeignKeys(conn.getMetaData(), scope, table));
        if (fks.isCompleted()) {
            for (ForeignKeyInfo fk : fks.getValue()) {
                out.append("  FK: columns=").append(fk.columns())
                        .append(" -> ").append(fk.referencedTable()).append('.').append(fk.referencedColumns())
                        .append('\n');
            }
        } else {
            out.append("  (failed to read foreign keys: ").append(fks.describe()).append(")\n");
        }

        DeadlineOutcome<List<IndexInfo>> indexes = bounded(live, conn -> fetchIndexes(conn.getMetaData(), scope, table));
        if (indexes.isCompleted()) {
            for (IndexInfo idx : indexes.getValue()) {
                out.append("  Index: ").append(idx.name())
                        .append(" columns=").append(idx.columns())
                        .append(" unique=").append(idx.unique())
                        .append('\n');
            }
        } else {
            out.append("  (failed to read indexes: ").append(indexes.describe()).append(")\n");
        }

        String qualified = scope.schema() != null && live.getKind() == ConnectionKind.POSTGRESQL
                ? scope.schema() + "." + table
                : table;
        String ddl = createStatement(live, QualifiedName.parse(qualified), false);
        if (!ddl.isBlank()) {
            out.append("  CREATE:\n").append(indent(ddl.trim(), "    ")).append('\n');
        }
    }

    private String createStatement(LiveConnection live, QualifiedName table, boolean allowDump) {
        ConnectionKind kind = live.getKind();

        String ddl = attempt(live, table, "metadata", conn -> reflectDdl(conn, kind, table));
        if (!ddl.isEmpty()) {
            return ddl;
        }
        switch (kind) {
            case SQLITE:
                return attempt(live, table, "sqlite_master", conn -> sqliteMasterDdl(conn, table));
            case MYSQL:
                return attempt(live, table, "show_create", conn -> mysqlShowCreate(conn, table));
            case POSTGRESQL:
                ddl = attempt(live, table, "pg_catalog", conn -> PostgresDdlBuilder.build(conn, table));
                if (!ddl.isEmpty() || !allowDump) {
                    return ddl;
                }
                try {
                    return PgDumpRunner.extractCreateTable(pgDumpRunner.dump(live.getTarget(), qualifiedText(table)), table.name());
                } catch (RuntimeException e) {
                    log.debug("pg_dump strategy failed (connection={}, table={}, error={})", live.getName(), table.name(), e.getMessage());
                    return "";
                }
            default:
                return "";
        }
    }

    private String attempt(LiveConnection live, QualifiedName table, String strategy, SqlWork<String> work) {
        DeadlineOutcome<String> outcome = bounded(live, work);
        if (outcome.isCompleted() && outcome.getValue() != null) {
            return outcome.getValue();
        }
        if (!outcome.isCompleted()) {
            log.debug("DDL strategy failed (connection={}, table={}, strategy={}, outcome={})",
                    live.getName(), table.name(), strategy, outcome.describe());
        }
        return "";
    }

    private <T> DeadlineOutcome<T> bounded(LiveConnection live, SqlWork<T> work) {
        return deadlineRunner.run(() -> {
            try (Connection conn = live.getConnection()) {
                return work.apply(conn);
            }
        }, callTimeout);
    }

    private static String reflectDdl(Connection conn, ConnectionKind kind, QualifiedName table) throws SQLException {
        DatabaseMetaData md = conn.getMetaData();
        Scope scope = Scope.of(conn, kind).narrowedTo(table, kind);
        List<ColumnInfo> columns = fetchColumns(md, scope, table.name());
        if (columns.isEmpty()) {
            return "";
        }
        String k = kind.id();
        List<String> defs = new ArrayList<>();
        for (ColumnInfo c : columns) {
            StringBuilder def = new StringBuilder(SqlIdentifiers.quote(k, c.name())).append(' ').append(c.type());
            if (!c.nullable()) {
                def.append(" NOT NULL");
            }
            if (c.defaultValue() != null) {
                def.append(" DEFAULT ").append(c.defaultValue());
            }
            defs.add(def.toString());
        }
        List<String> pk = fetchPrimaryKey(md, scope, table.name());
        if (!pk.isEmpty()) {
            defs.add("PRIMARY KEY (" + quoteAll(k, pk) + ")");
        }
        for (ForeignKeyInfo fk : fetchForeignKeys(md, scope, table.name())) {
            defs.add("FOREIGN KEY (" + quoteAll(k, fk.columns()) + ") REFERENCES "
                    + SqlIdentifiers.quote(k, fk.referencedTable()) + " (" + quoteAll(k, fk.referencedColumns()) + ")");
        }
        String name = table.schema() != null
                ? SqlIdentifiers.quote(k, table.schema()) + "." + SqlIdentifiers.quote(k, table.name())
                : SqlIdentifiers.quote(k, table.name());
        return "CREATE TABLE " + name + " (\n  " + String.join(",\n  ", defs) + "\n);";
    }

    private static String sqliteMasterDdl(Connection conn, QualifiedName table) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT sql FROM sqlite_master WHERE type = 'table' AND name = ?")) {
            ps.setString(1, table.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getString(1) != null ? rs.getString(1) + ";" : "";
            }
        }
    }

    private static String mysqlShowCreate(Connection conn, QualifiedName table) throws SQLException {
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SHOW CREATE TABLE " + SqlIdentifiers.quoteQualified("mysql", qualifiedText(table)))) {
            return rs.next() && rs.getString(2) != null ? rs.getString(2) + ";" : "";
        }
    }

    private static String viewDefinition(Connection conn, ConnectionKind kind, Scope scope, String view) throws SQLException {
        String sql;
        String owner;
        switch (kind) {
            case SQLITE:
                sql = "SELECT sql FROM sqlite_master WHERE type = 'view' AND name = ?";
                owner = null;
                break;
            case POSTGRESQL:
                sql = "SELECT pg_get_viewdef(c.oid, true) FROM pg_class c "
                        + "JOIN pg_namespace n ON c.relnamespace = n.oid WHERE n.nspname = ? AND c.relname = ?";
                owner = scope.schema() != null ? scope.schema() : "public";
                break;
            case MYSQL:
                sql = "SELECT VIEW_DEFINITION FROM information_schema.VIEWS WHERE TABLE_SCHEMA = ? AND TABLE_NAME = ?";
                owner = scope.catalog() != null ? scope.catalog() : conn.getCatalog();
                break;
            default:
                return "";
        }
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            int i = 1;
            if (owner != null) {
                ps.setString(i++, owner);
            }
            ps.setString(i, view);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getString(1) != null ? rs.getString(1) : "";
            }
        }
    }

    private static List<String> listNames(DatabaseMetaData md, Scope scope, String[] types) throws SQLException {
        List<String> names = new ArrayList<>();
        try (ResultSet rs = md.getTables(scope.catalog(), scope.schema(), "%", types)) {
            while (rs.next()) {
                String name = rs.getString("TABLE_NAME");
                if (name != null && !name.startsWith("sqlite_")) {
                    names.add(name);
                }
            }
        }
        return names;
    }

    private static List<ColumnInfo> fetchColumns(DatabaseMetaData md, Scope scope, String table) throws SQLException {
        List<ColumnInfo> columns = new ArrayList<>();
        try (ResultSet rs = md.getColumns(scope.catalog(), scope.schema(), escapePattern(md, table), "%")) {
            while (rs.next()) {
                if (!table.equals(rs.getString("TABLE_NAME"))) {
                    continue;
                }
                columns.add(new ColumnInfo(
                        rs.getString("COLUMN_NAME"),
                        typeName(rs.getString("TYPE_NAME"), rs.getInt("DATA_TYPE"), rs.getInt("COLUMN_SIZE"), rs.getInt("DECIMAL_DIGITS")),
                        !"NO".equalsIgnoreCase(rs.getString("IS_NULLABLE")),
                        rs.getString("COLUMN_DEF")
                ));
            }
        }
        return columns;
    }

    private static List<String> fetchPrimaryKey(DatabaseMetaData md, Scope scope, String table) throws SQLException {
        Map<Integer, String> bySeq = new TreeMap<>();
        try (ResultSet rs = md.getPrimaryKeys(scope.catalog(), scope.schema(), table)) {
            while (rs.next()) {
                bySeq.put(rs.getInt("KEY_SEQ"), rs.getString("COLUMN_NAME"));
            }
        }
        return new ArrayList<>(bySeq.values());
    }

    private static List<ForeignKeyInfo> fetchForeignKeys(DatabaseMetaData md, Scope scope, String table) throws SQLException {
        List<ForeignKeyInfo> fks = new ArrayList<>();
        ForeignKeyInfo current = null;
        try (ResultSet rs = md.getImportedKeys(scope.catalog(), scope.schema(), table)) {
            while (rs.next()) {
                String refTable = rs.getString("PKTABLE_NAME");
                if (current == null || rs.getInt("KEY_SEQ") == 1 || !current.referencedTable().equals(refTable)) {
                    current = new ForeignKeyInfo(new ArrayList<>(), refTable, new ArrayList<>());
                    fks.add(current);
                }
                current.columns().add(rs.getString("FKCOLUMN_NAME"));
                current.referencedColumns().add(rs.getString("PKCOLUMN_NAME"));
            }
        }
        return fks;
    }

    private static List<IndexInfo> fetchIndexes(DatabaseMetaData md, Scope scope, String table) throws SQLException {
        Map<String, IndexInfo> byName = new LinkedHashMap<>();
        Map<String, Map<Integer, String>> positions = new LinkedHashMap<>();
        try (ResultSet rs = md.getIndexInfo(scope.catalog(), scope.schema(), table, false, true)) {
            while (rs.next()) {
                String name = rs.getString("INDEX_NAME");
                String column = rs.getString("COLUMN_NAME");
                if (name == null || column == null) {
                    continue;
                }
                boolean unique = !rs.getBoolean("NON_UNIQUE");
                byName.computeIfAbsent(name, n -> new IndexInfo(n, new ArrayList<>(), unique));
                positions.computeIfAbsent(name, n -> new TreeMap<>()).put(rs.getInt("ORDINAL_POSITION"), column);
            }
        }
        List<IndexInfo> out = new ArrayList<>();
        for (IndexInfo idx : byName.values()) {
            idx.columns().addAll(positions.get(idx.name()).values());
            out.add(idx);
        }
        out.sort(Comparator.comparing(IndexInfo::name));
        return out;
    }

    static String typeName(String typeName, int dataType, int size, int digits) {
        String base = typeName != null ? typeName : "UNKNOWN";
        if (!SIZED_TYPES.contains(dataType) || base.contains("(") || size <= 0 || size >= Integer.MAX_VALUE / 2) {
            return base;
        }
        if ((dataType == Types.DECIMAL || dataType == Types.NUMERIC) && digits > 0) {
            return base + "(" + size + "," + digits + ")";
        }
        return base + "(" + size + ")";
    }

    private static String escapePattern(DatabaseMetaData md, String name) throws SQLException {
        String escape = md.getSearchStringEscape();
        if (escape == null || escape.isEmpty()) {
            return name;
        }
        return name.replace(escape, escape + escape).replace("_", escape + "_").replace("%", escape + "%");
    }

    private static String quoteAll(String kind, List<String> names) {
        List<String> quoted = new ArrayList<>(names.size());
        for (String n : names) {
            quoted.add(SqlIdentifiers.quote(kind, n));
        }
        return String.join(", ", quoted);
    }

    private static String qualifiedText(QualifiedName table) {
        return table.schema() != null ? table.schema() + "." + table.name() : table.name();
    }

    private static String indent(String text, String prefix) {
        StringBuilder sb = new StringBuilder();
        String[] lines = text.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                sb.append('\n');
            }
            sb.append(prefix).append(lines[i]);
        }
        return sb.toString();
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T apply(Connection conn) throws Exception;
    }

    /**
     * Catalog/schema pair passed to {@link DatabaseMetaData} lookups.
     */
    private record Scope(String catalog, String schema) {

        static final Scope NONE = new Scope(null, null);

        static Scope of(Connection conn, ConnectionKind kind) throws SQLException {
            switch (kind) {
                case POSTGRESQL:
                    return new Scope(null, conn.getSchema());
                case MYSQL:
                    return new Scope(conn.getCatalog(), null);
                default:
                    return NONE;
            }
        }

        Scope narrowedTo(QualifiedName table, ConnectionKind kind) {
            if (table.schema() == null) {
                return this;
            }
            return kind == ConnectionKind.MYSQL ? new Scope(table.schema(), null) : new Scope(catalog, table.schema());
        }
    }

    private record ColumnInfo(String name, String type, boolean nullable, String defaultValue) {
    }

    private record ForeignKeyInfo(List<String> columns, String referencedTable, List<String> referencedColumns) {
    }

    private record IndexInfo(String name, List<String> columns, boolean unique) {
    }

    private record CachedDescription(String connectionName, String text, Instant createdAt) {
    }
}
