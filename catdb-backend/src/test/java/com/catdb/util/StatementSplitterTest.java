package com.catdb.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StatementSplitterTest {

    @Test
    void splitsOnSemicolonsAndDropsEmptySegments() {
        assertThat(StatementSplitter.split(" SELECT 1 ;;\n SELECT 2;  "))
                .containsExactly("SELECT 1", "SELECT 2");
        assertThat(StatementSplitter.split("   ")).isEmpty();
        assertThat(StatementSplitter.split(null)).isEmpty();
    }

    @Test
    void semicolonInsideLiteralStillSplits() {
        assertThat(StatementSplitter.split("SELECT 'a;b'")).containsExactly("SELECT 'a", "b'");
    }

    @Test
    void extractsCommentDirective() {
        StatementSplitter.ConnectionDirective d =
                StatementSplitter.extractConnectionDirective("-- connection: reporting\nSELECT 1");

        assertThat(d.hasOverride()).isTrue();
        assertThat(d.connectionName()).isEqualTo("reporting");
        assertThat(d.sql()).isEqualTo("SELECT 1");
    }

    @Test
    void extractsUseConnectionDirective() {
        StatementSplitter.ConnectionDirective d =
                StatementSplitter.extractConnectionDirective("use connection main;\nSELECT 2");

        assertThat(d.connectionName()).isEqualTo("main");
        assertThat(d.sql()).isEqualTo("SELECT 2");
    }

    @Test
    void textWithoutDirectiveIsUnchanged() {
        StatementSplitter.ConnectionDirective d = StatementSplitter.extractConnectionDirective("SELECT 3");

        assertThat(d.hasOverride()).isFalse();
        assertThat(d.sql()).isEqualTo("SELECT 3");
    }

    @Test
    void findsPrimaryTableOfSelect() {
        assertThat(StatementSplitter.extractPrimaryTable("select * from users where id = 1")).contains("users");
        assertThat(StatementSplitter.extractPrimaryTable("SELECT a FROM \"sales\".\"orders\" o")).contains("sales.orders");
        assertThat(StatementSplitter.extractPrimaryTable(
                "SELECT (SELECT max(x) FROM inner_t) FROM outer_t")).contains("outer_t");
    }

    @Test
    void nonSelectHasNoPrimaryTable() {
        assertThat(StatementSplitter.extractPrimaryTable("DELETE FROM users")).isEmpty();
        assertThat(StatementSplitter.extractPrimaryTable("SELECT 1")).isEmpty();
        assertThat(StatementSplitter.extractPrimaryTable("")).isEmpty();
    }
}
