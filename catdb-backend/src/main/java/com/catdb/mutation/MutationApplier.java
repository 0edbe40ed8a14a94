package com.catdb.mutation;

import com.catdb.execution.StatementFailedException;
import com.catdb.model.PendingEdit;
import com.catdb.registry.ConnectionValidationException;
import com.catdb.registry.LiveConnection;
import com.catdb.util.SqlIdentifiers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes grid edits back to a table with parameterized UPDATE and DELETE statements keyed by the
 * row's primary-key values.
 */
@Slf4j
@Service
public class MutationApplier {

    /**
     * SQL text with its positional parameters.
     *
     * @param sql sql text
     * @param params parameters in placeholder order
     */
    public record BoundSql(String sql, List<Object> params) {
    }

    /**
     * Apply edits in one transaction. Edits with no changed columns or no primary-key values are
     * skipped. Any failure rolls back every edit of the call.
     *
     * @param connection borrowed handle
     * @param table table, optionally schema-qualified
     * @param edits edits
     * @return rows affected
     * @throws StatementFailedException when an UPDATE fails; nothing is committed
     */
    public int applyUpdates(LiveConnection connection, String table, List<PendingEdit> edits) {
        String kind = connection.getKind().id();
        List<BoundSql> statements = new ArrayList<>();
        if (edits != null) {
            for (PendingEdit edit : edits) {
                if (edit == null || isEmpty(edit.getChangedValues()) || isEmpty(edit.getPrimaryKeyValues())) {
                    continue;
                }
                statements.add(buildUpdate(kind, table, edit.getChangedValues(), edit.getPrimaryKeyValues()));
            }
        }
        if (statements.isEmpty()) {
            return 0;
        }
        int affected = executeInTransaction(connection, statements);
        log.info("Applied row edits (connection={}, table={}, edits={}, rows_affected={})",
                connection.getName(), table, statements.size(), affected);
        return affected;
    }

    /**
     * Delete one row in its own transaction.
     *
     * @param connection borrowed handle
     * @param table table, optionally schema-qualified
     * @param primaryKeyValues primary-key column to value
     * @return rows affected as reported by the driver (0 when the row is already gone)
     * @throws ConnectionValidationException when no primary-key values are given
     */
    public int deleteRow(LiveConnection connection, String table, Map<String, Object> primaryKeyValues) {
        if (isEmpty(primaryKeyValues)) {
            throw new ConnectionValidationException("Cannot delete a row without primary key values");
        }
        BoundSql delete = buildDelete(connection.getKind().id(), table, primaryKeyValues);
        int affected = executeInTransaction(connection, List.of(delete));
        log.info("Deleted row (connection={}, table={}, rows_affected={})", connection.getName(), table, affected);
        return affected;
    }

    /**
     * Build {@code UPDATE t SET c = ? [, ...] WHERE pk = ? [AND ...]}. Null key values become
     * {@code IS NULL} predicates.
     *
     * @param kind connection kind
     * @param table table
     * @param changes column to new value
     * @param primaryKeyValues primary-key column to value
     * @return bound statement
     */
    public static BoundSql buildUpdate(String kind, String table, Map<String, Object> changes, Map<String, Object> primaryKeyValues) {
        StringBuilder sql = new StringBuilder("UPDATE ").append(SqlIdentifiers.quoteQualified(kind, table)).append(" SET ");
        List<Object> params = new ArrayList<>();
        boolean first = true;
        for (Map.Entry<String, Object> e : changes.entrySet()) {
            if (!first) {
                sql.append(", ");
            }
            sql.append(SqlIdentifiers.quote(kind, e.getKey())).append(" = ?");
            params.add(e.getValue());
            first = false;
        }
        appendWhere(sql, params, kind, primaryKeyValues);
        return new BoundSql(sql.toString(), params);
    }

    /**
     * Build {@code DELETE FROM t WHERE pk = ? [AND ...]}.
     *
     * @param kind connection kind
     * @param table table
     * @param primaryKeyValues primary-key column to value
     * @return bound statement
     */
    public static BoundSql buildDelete(String kind, String table, Map<String, Object> primaryKeyValues) {
        StringBuilder sql = new StringBuilder("DELETE FROM ").append(SqlIdentifiers.quoteQualified(kind, table));
        List<Object> params = new ArrayList<>();
        appendWhere(sql, params, kind, primaryKeyValues);
        return new BoundSql(sql.toString(), params);
    }

    private static void appendWhere(StringBuilder sql, List<Object> params, String kind, Map<String, Object> primaryKeyValues) {
        sql.append(" WHERE ");
        boolean first = true;
        for (Map.Entry<String, Object> e : primaryKeyValues.entrySet()) {
            if (!first) {
                sql.append(" AND ");
            }
            sql.append(SqlIdentifiers.quote(kind, e.getKey()));
            if (e.getValue() == null) {
                sql.append(" IS NULL");
            } else {
                sql.append(" = ?");
                params.add(e.getValue());
            }
            first = false;
        }
    }

    private int executeInTransaction(LiveConnection connection, List<BoundSql> statements) {
        String current = statements.get(0).sql();
        try (Connection conn = connection.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                int total = 0;
                for (BoundSql statement : statements) {
                    current = statement.sql();
                    try (PreparedStatement ps = conn.prepareStatement(statement.sql())) {
                        List<Object> params = statement.params();
                        for (int i = 0; i < params.size(); i++) {
                            ps.setObject(i + 1, params.get(i));
                        }
                        total += ps.executeUpdate();
                    }
                }
                conn.commit();
                return total;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn, connection.getName());
                throw e;
            } finally {
                restoreAutoCommit(conn, autoCommit, connection.getName());
            }
        } catch (SQLException e) {
            throw new StatementFailedException(current, e);
        }
    }

    private static void rollbackQuietly(Connection conn, String name) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.warn("Rollback failed (connection={}, error={})", name, e.getMessage());
        }
    }

    private static void restoreAutoCommit(Connection conn, boolean autoCommit, String name) {
        try {
            conn.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            log.debug("Restoring auto-commit failed (connection={}, error={})", name, e.getMessage());
        }
    }

    private static boolean isEmpty(Map<String, Object> map) {
        return map == null || map.isEmpty();
    }
}
