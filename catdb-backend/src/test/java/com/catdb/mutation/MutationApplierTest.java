package com.catdb.mutation;

import com.catdb.execution.StatementFailedException;
import com.catdb.model.PendingEdit;
import com.catdb.registry.ConnectionValidationException;
import com.catdb.registry.LiveConnection;
import com.catdb.support.SqliteConnections;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MutationApplierTest {

    @TempDir
    Path dir;

    private LiveConnection live;
    private final MutationApplier applier = new MutationApplier();

    @BeforeEach
    void setUp() throws SQLException {
        live = SqliteConnections.open(dir.resolve("mutation.db"));
        exec("CREATE TABLE items(id INTEGER PRIMARY KEY, name TEXT NOT NULL, qty INTEGER)");
        exec("INSERT INTO items(id, name, qty) VALUES (1, 'apple', 3), (2, 'pear', 5)");
        exec("CREATE TABLE notes(k TEXT, v TEXT)");
        exec("INSERT INTO notes(k, v) VALUES (NULL, 'orphan'), ('b', 'kept')");
    }

    @AfterEach
    void tearDown() {
        live.close();
    }

    @Test
    void buildsQuotedParameterizedUpdate() {
        MutationApplier.BoundSql sql = MutationApplier.buildUpdate("postgresql", "sales.orders",
                map("status", "shipped", "note", null), map("id", 7));

        assertThat(sql.sql()).isEqualTo("UPDATE \"sales\".\"orders\" SET \"status\" = ?, \"note\" = ? WHERE \"id\" = ?");
        assertThat(sql.params()).containsExactly("shipped", null, 7);
    }

    @Test
    void nullKeyValueBecomesIsNull() {
        MutationApplier.BoundSql sql = MutationApplier.buildDelete("mysql", "t", map("a", 1, "b", null));

        assertThat(sql.sql()).isEqualTo("DELETE FROM `t` WHERE `a` = ? AND `b` IS NULL");
        assertThat(sql.params()).containsExactly(1);
    }

    @Test
    void appliesEditsInOneTransaction() throws SQLException {
        List<PendingEdit> edits = List.of(
                new PendingEdit(map("id", 1), map("name", "green apple", "qty", 4)),
                new PendingEdit(map("id", 2), map("qty", 0)),
                new PendingEdit(map("id", 2), new LinkedHashMap<>()));

        int affected = applier.applyUpdates(live, "items", edits);

        assertThat(affected).isEqualTo(2);
        assertThat(query("SELECT id, name, qty FROM items ORDER BY id"))
                .containsExactly("1|green apple|4", "2|pear|0");
    }

    @Test
    void updateMatchesRowWithNullKey() throws SQLException {
        int affected = applier.applyUpdates(live, "notes",
                List.of(new PendingEdit(map("k", null), map("v", "adopted"))));

        assertThat(affected).isEqualTo(1);
        assertThat(query("SELECT k, v FROM notes ORDER BY v"))
                .containsExactly("null|adopted", "b|kept");
    }

    @Test
    void failedEditRollsBackEarlierOnes() throws SQLException {
        List<PendingEdit> edits = List.of(
                new PendingEdit(map("id", 1), map("name", "renamed")),
                new PendingEdit(map("id", 2), map("name", null)));

        assertThatThrownBy(() -> applier.applyUpdates(live, "items", edits))
                .isInstanceOf(StatementFailedException.class)
                .satisfies(e -> assertThat(((StatementFailedException) e).getStatement())
                        .isEqualTo("UPDATE \"items\" SET \"name\" = ? WHERE \"id\" = ?"));

        assertThat(query("SELECT name FROM items ORDER BY id")).containsExactly("apple", "pear");
    }

    @Test
    void deletesRowByKey() throws SQLException {
        assertThat(applier.deleteRow(live, "items", map("id", 2))).isEqualTo(1);
        assertThat(applier.deleteRow(live, "items", map("id", 2))).isZero();
        assertThat(applier.deleteRow(live, "notes", map("k", null))).isEqualTo(1);

        assertThat(query("SELECT id FROM items")).containsExactly("1");
        assertThat(query("SELECT v FROM notes")).containsExactly("kept");
    }

    @Test
    void deleteWithoutKeyIsRejected() {
        assertThatThrownBy(() -> applier.deleteRow(live, "items", Map.of()))
                .isInstanceOf(ConnectionValidationException.class);
    }

    @Test
    void emptyEditListChangesNothing() {
        assertThat(applier.applyUpdates(live, "items", List.of())).isZero();
        assertThat(applier.applyUpdates(live, "items", null)).isZero();
    }

    private static Map<String, Object> map(Object... keyValues) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            m.put((String) keyValues[i], keyValues[i + 1]);
        }
        return m;
    }

    private void exec(String sql) throws SQLException {
        try (Connection conn = live.getConnection(); Statement st = conn.createStatement()) {
            st.execute(sql);
        }
    }

    private List<String> query(String sql) throws SQLException {
        List<String> rows = new ArrayList<>();
        try (Connection conn = live.getConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery(sql)) {
            int columns = rs.getMetaData().getColumnCount();
            while (rs.next()) {
                String[] values = new String[columns];
                for (int i = 0; i < columns; i++) {
                    values[i] = String.valueOf(rs.getObject(i + 1));
                }
                rows.add(String.join("|", Arrays.asList(values)));
            }
        }
        return rows;
    }
}
