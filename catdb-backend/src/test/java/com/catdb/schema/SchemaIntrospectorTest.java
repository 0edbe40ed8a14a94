package com.catdb.schema;

import com.catdb.config.CatdbSettings;
import com.catdb.registry.LiveConnection;
import com.catdb.support.SqliteConnections;
import com.catdb.util.DeadlineRunner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class SchemaIntrospectorTest {

    @TempDir
    Path dir;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private DeadlineRunner deadlineRunner;
    private LiveConnection live;
    private SchemaIntrospector introspector;

    @BeforeEach
    void setUp() throws SQLException {
        deadlineRunner = new DeadlineRunner("test-schema");
        live = SqliteConnections.open("shop", dir.resolve("schema.db"));
        exec("CREATE TABLE customers (id INTEGER PRIMARY KEY, name TEXT NOT NULL)");
        exec("CREATE TABLE orders (id INTEGER PRIMARY KEY, customer INTEGER NOT NULL REFERENCES customers(id), total NUMERIC DEFAULT 0)");
        exec("CREATE INDEX ordersbycustomer ON orders(customer)");
        exec("CREATE VIEW bigorders AS SELECT id, total FROM orders WHERE total > 100");
        introspector = newIntrospector(CatdbSettings.defaults());
    }

    @AfterEach
    void tearDown() {
        live.close();
        deadlineRunner.close();
    }

    private SchemaIntrospector newIntrospector(CatdbSettings settings) {
        return new SchemaIntrospector(null, deadlineRunner, new PgDumpRunner(settings), settings, clock);
    }

    @Test
    void describesTablesKeysIndexesAndViews() {
        String text = introspector.describe(live);

        assertThat(text).startsWith("Connection dialect: sqlite (SQLite");
        assertThat(text).contains(
                "Tables:\n",
                "- customers\n",
                "  - name: TEXT, nullable=false, default=null\n",
                "  Primary key: [id]\n",
                "- orders\n",
                "  FK: columns=[customer] -> customers.[id]\n",
                "  Index: ordersbycustomer columns=[customer] unique=false\n",
                "  CREATE:\n    CREATE TABLE \"orders\" (",
                "Views:\n- bigorders\n  Definition:\n    CREATE VIEW bigorders");
        assertThat(text).doesNotContain("sqlite_", "failed to");
    }

    @Test
    void truncatesLongTableLists() {
        String text = newIntrospector(CatdbSettings.defaults().toBuilder().maxTables(1).build()).describe(live);

        assertThat(text).contains("- customers\n", "... (table list truncated to first 1 tables)");
        assertThat(text).doesNotContain("- orders\n");
    }

    @Test
    void cachesDescriptionUntilInvalidatedOrExpired() throws SQLException {
        String first = introspector.describe(live);
        exec("CREATE TABLE refunds (id INTEGER PRIMARY KEY)");

        assertThat(introspector.describe(live)).isSameAs(first);

        introspector.invalidate("shop");
        String second = introspector.describe(live);
        assertThat(second).contains("- refunds\n");

        exec("CREATE TABLE coupons (code TEXT)");
        clock.advance(Duration.ofSeconds(59));
        assertThat(introspector.describe(live)).isSameAs(second);
        clock.advance(Duration.ofSeconds(2));
        assertThat(introspector.describe(live)).contains("- coupons\n");
    }

    @Test
    void invalidatingAnotherNameKeepsTheCache() throws SQLException {
        String first = introspector.describe(live);
        exec("CREATE TABLE refunds (id INTEGER PRIMARY KEY)");

        introspector.invalidate("elsewhere");

        assertThat(introspector.describe(live)).isSameAs(first);
        introspector.invalidateAll();
        assertThat(introspector.describe(live)).contains("- refunds\n");
    }

    @Test
    void listsColumnsPerTable() {
        assertThat(introspector.tableColumns(live))
                .containsEntry("customers", java.util.List.of("id", "name"))
                .containsEntry("orders", java.util.List.of("id", "customer", "total"))
                .doesNotContainKey("bigorders");
    }

    @Test
    void readsPrimaryKey() throws SQLException {
        exec("CREATE TABLE lines (orderref INTEGER, lineno INTEGER, sku TEXT, PRIMARY KEY (orderref, lineno))");

        assertThat(introspector.primaryKeyColumns(live, "customers")).containsExactly("id");
        assertThat(introspector.primaryKeyColumns(live, "lines")).containsExactly("orderref", "lineno");
        assertThat(introspector.primaryKeyColumns(live, "bigorders")).isEmpty();
    }

    @Test
    void reconstructsCreateStatementFromMetadata() {
        String ddl = introspector.createStatement(live, "orders");

        assertThat(ddl).startsWith("CREATE TABLE \"orders\" (\n");
        assertThat(ddl).contains(
                "\"customer\" INTEGER NOT NULL",
                "DEFAULT 0",
                "PRIMARY KEY (\"id\")",
                "FOREIGN KEY (\"customer\") REFERENCES \"customers\" (\"id\")");
        assertThat(ddl).endsWith("\n);");
    }

    @Test
    void unknownOrBlankTableHasNoCreateStatement() {
        assertThat(introspector.createStatement(live, "nothing_here")).isEmpty();
        assertThat(introspector.createStatement(live, "  ")).isEmpty();
    }

    @Test
    void addsSizeToCharacterAndDecimalTypes() {
        assertThat(SchemaIntrospector.typeName("VARCHAR", Types.VARCHAR, 40, 0)).isEqualTo("VARCHAR(40)");
        assertThat(SchemaIntrospector.typeName("NUMERIC", Types.NUMERIC, 10, 2)).isEqualTo("NUMERIC(10,2)");
        assertThat(SchemaIntrospector.typeName("INT", Types.INTEGER, 10, 0)).isEqualTo("INT");
        assertThat(SchemaIntrospector.typeName("TEXT", Types.VARCHAR, Integer.MAX_VALUE, 0)).isEqualTo("TEXT");
        assertThat(SchemaIntrospector.typeName(null, Types.OTHER, 0, 0)).isEqualTo("UNKNOWN");
    }

    private void exec(String sql) throws SQLException {
        try (Connection conn = live.getConnection(); Statement st = conn.createStatement()) {
            st.execute(sql);
        }
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
