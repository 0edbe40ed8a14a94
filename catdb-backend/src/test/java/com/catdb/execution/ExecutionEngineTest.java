package com.catdb.execution;

import com.catdb.model.ExecutionResult;
import com.catdb.registry.LiveConnection;
import com.catdb.support.SqliteConnections;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutionEngineTest {

    private static final String FIVE_ROWS =
            "WITH RECURSIVE c(x) AS (SELECT 1 UNION ALL SELECT x + 1 FROM c WHERE x < 5) SELECT x FROM c";

    @TempDir
    Path dir;

    private LiveConnection live;
    private ExecutionEngine engine;

    @BeforeEach
    void setUp() {
        live = SqliteConnections.open(dir.resolve("engine.db"));
        engine = new ExecutionEngine(Duration.ofSeconds(10));
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
        live.close();
    }

    @Test
    void runsStatementsInOrderOnOneConnection() {
        List<ExecutionResult> results = engine.run(live,
                "CREATE TABLE t(id INTEGER PRIMARY KEY, name TEXT); "
                        + "INSERT INTO t(name) VALUES ('alice'),('bob'); "
                        + "SELECT id, name FROM t ORDER BY id;",
                100, new CancelToken());

        assertThat(results).hasSize(3);
        assertThat(results.get(1).getColumns()).containsExactly(ExecutionResult.MESSAGE_COLUMN);
        assertThat(results.get(1).getRows()).containsExactly(List.of("Affected rows: 2"));

        ExecutionResult select = results.get(2);
        assertThat(select.getColumns()).containsExactly("id", "name");
        assertThat(select.isTruncated()).isFalse();
        assertThat(asText(select.getRows())).containsExactly("1|alice", "2|bob");
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 4, 5, 6, 50})
    void keepsAtMostRowLimitRows(int rowLimit) {
        ExecutionResult result = engine.run(live, FIVE_ROWS, rowLimit, null).get(0);

        assertThat(result.getRows()).hasSize(Math.min(rowLimit, 5));
        assertThat(result.isTruncated()).isEqualTo(5 > rowLimit);
    }

    @Test
    void blankTextYieldsNoResults() {
        assertThat(engine.run(live, " ; ;", 10, null)).isEmpty();
    }

    @Test
    void negativeRowLimitIsRejected() {
        assertThatThrownBy(() -> engine.run(live, "SELECT 1", -1, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void failingStatementNamesTheStatementAndStopsTheRun() {
        List<String> seen = new ArrayList<>();

        assertThatThrownBy(() -> engine.run(live,
                "CREATE TABLE f(x INTEGER); SELECT * FROM missing_table; CREATE TABLE g(x INTEGER)",
                10, null, (i, sql, result) -> seen.add(sql)))
                .isInstanceOf(StatementFailedException.class)
                .satisfies(e -> assertThat(((StatementFailedException) e).getStatement())
                        .isEqualTo("SELECT * FROM missing_table"));

        assertThat(seen).containsExactly("CREATE TABLE f(x INTEGER)");
        assertThat(tableNames()).contains("f").doesNotContain("g");
    }

    @Test
    void cancelBeforeStartRunsNothing() {
        CancelToken token = new CancelToken();
        token.cancel();

        assertThatThrownBy(() -> engine.run(live, "CREATE TABLE never(x INTEGER)", 10, token))
                .isInstanceOf(ExecutionCanceledException.class);

        assertThat(tableNames()).doesNotContain("never");
    }

    @Test
    void cancelBetweenStatementsSkipsTheRest() {
        CancelToken token = new CancelToken();

        assertThatThrownBy(() -> engine.run(live,
                "CREATE TABLE first_t(x INTEGER); CREATE TABLE second_t(x INTEGER); CREATE TABLE third_t(x INTEGER)",
                10, token, (i, sql, result) -> token.cancel()))
                .isInstanceOf(ExecutionCanceledException.class)
                .satisfies(e -> assertThat(((ExecutionCanceledException) e).getStatement())
                        .isEqualTo("CREATE TABLE second_t(x INTEGER)"));

        assertThat(tableNames()).contains("first_t").doesNotContain("second_t", "third_t");
    }

    @Test
    void runawayStatementTimesOut() {
        ExecutionEngine impatient = new ExecutionEngine(Duration.ofMillis(300));
        try {
            assertThatThrownBy(() -> impatient.run(live,
                    "WITH RECURSIVE c(x) AS (SELECT 1 UNION ALL SELECT x + 1 FROM c) SELECT count(*) FROM c",
                    10, null))
                    .isInstanceOf(ExecutionTimeoutException.class)
                    .hasMessageContaining("timed out");
        } finally {
            impatient.shutdown();
        }
    }

    private List<String> tableNames() {
        ExecutionResult result = engine.run(live, "SELECT name FROM sqlite_master WHERE type = 'table'", 100, null).get(0);
        return result.getRows().stream().map(r -> String.valueOf(r.get(0))).collect(Collectors.toList());
    }

    private static List<String> asText(List<List<Object>> rows) {
        return rows.stream()
                .map(r -> r.stream().map(String::valueOf).collect(Collectors.joining("|")))
                .collect(Collectors.toList());
    }
}
