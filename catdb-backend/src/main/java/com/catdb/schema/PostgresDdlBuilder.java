package com.catdb.schema;

import com.catdb.util.SqlIdentifiers;
import com.catdb.util.SqlIdentifiers.QualifiedName;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds a {@code CREATE TABLE} statement from the Postgres system catalogs.
 */
final class PostgresDdlBuilder {

    private static final String FIND_IN_SCHEMA =
            "SELECT n.nspname, c.oid, c.relname FROM pg_class c "
                    + "JOIN pg_namespace n ON c.relnamespace = n.oid "
                    + "WHERE n.nspname = ? AND c.relname = ? AND c.relkind IN ('r', 'p') LIMIT 1";
    private static final String FIND_ANY_SCHEMA =
            "SELECT n.nspname, c.oid, c.relname FROM pg_class c "
                    + "JOIN pg_namespace n ON c.relnamespace = n.oid "
                    + "WHERE c.relname = ? AND c.relkind IN ('r', 'p') "
                    + "ORDER BY (n.nspname = current_schema()) DESC LIMIT 1";
    private static final String COLUMNS =
            "SELECT a.attname, format_type(a.atttypid, a.atttypmod), a.attnotnull, "
                    + "pg_get_expr(ad.adbin, ad.adrelid), a.attidentity "
                    + "FROM pg_attribute a "
                    + "LEFT JOIN pg_attrdef ad ON a.attrelid = ad.adrelid AND a.attnum = ad.adnum "
                    + "WHERE a.attrelid = ? AND a.attnum > 0 AND NOT a.attisdropped ORDER BY a.attnum";
    private static final String CONSTRAINTS =
            "SELECT conname, pg_get_constraintdef(c.oid) FROM pg_constraint c "
                    + "WHERE c.conrelid = ? AND contype IN ('p', 'f', 'u', 'c') ORDER BY contype, conname";
    private static final String INDEXES =
            "SELECT indexdef FROM pg_indexes WHERE schemaname = ? AND tablename = ?";

    private static final String KIND = "postgresql";

    private PostgresDdlBuilder() {
    }

    /**
     * @param conn open Postgres connection
     * @param table possibly schema-qualified table
     * @return statement, or empty text when the table is not found
     * @throws SQLException on catalog query failure
     */
    static String build(Connection conn, QualifiedName table) throws SQLException {
        String schema;
        long oid;
        String relname;
        try (PreparedStatement ps = conn.prepareStatement(table.schema() != null ? FIND_IN_SCHEMA : FIND_ANY_SCHEMA)) {
            if (table.schema() != null) {
                ps.setString(1, table.schema());
                ps.setString(2, table.name());
            } else {
                ps.setString(1, table.name());
            }
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return "";
                }
                schema = rs.getString(1);
                oid = rs.getLong(2);
                relname = rs.getString(3);
            }
        }

        List<String> defs = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(COLUMNS)) {
            ps.setLong(1, oid);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    defs.add(columnDefinition(rs.getString(1), rs.getString(2), rs.getBoolean(3), rs.getString(4), rs.getString(5)));
                }
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(CONSTRAINTS)) {
            ps.setLong(1, oid);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    defs.add("CONSTRAINT " + SqlIdentifiers.quote(KIND, rs.getString(1)) + " " + rs.getString(2));
                }
            }
        }

        StringBuilder ddl = new StringBuilder("CREATE TABLE ")
                .append(SqlIdentifiers.quote(KIND, schema)).append('.').append(SqlIdentifiers.quote(KIND, relname))
                .append(" (\n  ").append(String.join(",\n  ", defs)).append("\n);");

        try (PreparedStatement ps = conn.prepareStatement(INDEXES)) {
            ps.setString(1, schema);
            ps.setString(2, relname);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ddl.append("\n\n").append(rs.getString(1)).append(';');
                }
            }
        }
        return ddl.toString();
    }

    static String columnDefinition(String name, String type, boolean notNull, String defaultExpr, String identity) {
        StringBuilder sb = new StringBuilder(SqlIdentifiers.quote(KIND, name)).append(' ').append(type);
        if ("a".equals(identity)) {
            sb.append(" GENERATED ALWAYS AS IDENTITY");
        } else if ("d".equals(identity)) {
            sb.append(" GENERATED BY DEFAULT AS IDENTITY");
        } else if (defaultExpr != null) {
            sb.append(" DEFAULT ").append(defaultExpr);
        }
        if (notNull) {
            sb.append(" NOT NULL");
        }
        return sb.toString();
    }
}
