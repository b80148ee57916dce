package com.text2sql.service;

import com.text2sql.service.StatementClassifier.StatementKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StatementClassifierTest {

    private final StatementClassifier classifier = new StatementClassifier();

    @Test
    void selectIsReadRegardlessOfCaseAndWhitespace() {
        assertThat(classifier.classify("SELECT * FROM tracks")).isEqualTo(StatementKind.READ);
        assertThat(classifier.classify("  \n\tselect 1")).isEqualTo(StatementKind.READ);
        assertThat(classifier.classify("Select(1)")).isEqualTo(StatementKind.READ);
    }

    @Test
    void otherReadKeywords() {
        assertThat(classifier.classify("WITH t AS (SELECT 1) SELECT * FROM t")).isEqualTo(StatementKind.READ);
        assertThat(classifier.classify("VALUES (1), (2)")).isEqualTo(StatementKind.READ);
        assertThat(classifier.classify("explain select 1")).isEqualTo(StatementKind.READ);
    }

    @Test
    void everythingElseIsWrite() {
        assertThat(classifier.classify("INSERT INTO tracks VALUES (4, 'x', 1)")).isEqualTo(StatementKind.WRITE);
        assertThat(classifier.classify("update tracks set Name = 'y'")).isEqualTo(StatementKind.WRITE);
        assertThat(classifier.classify("CREATE TABLE t (id INTEGER)")).isEqualTo(StatementKind.WRITE);
        assertThat(classifier.classify("SELECTED")).isEqualTo(StatementKind.WRITE);
        assertThat(classifier.classify("")).isEqualTo(StatementKind.WRITE);
        assertThat(classifier.classify(null)).isEqualTo(StatementKind.WRITE);
    }

    @Test
    void commonTableExpressionIsClassifiedByTheStatementItPrecedes() {
        assertThat(classifier.classify("WITH n AS (SELECT 9 AS id) INSERT INTO tracks (TrackId) SELECT id FROM n"))
                .isEqualTo(StatementKind.WRITE);
        assertThat(classifier.classify("with recursive c(x) as (select 1 union all select x + 1 from c where x < 3) "
                + "delete from tracks where TrackId in (select x from c)"))
                .isEqualTo(StatementKind.WRITE);
        assertThat(classifier.classify("WITH a AS (SELECT 1), b AS MATERIALIZED (SELECT 2) SELECT * FROM a, b"))
                .isEqualTo(StatementKind.READ);
    }

    @Test
    void leadingCommentsAreSkipped() {
        assertThat(classifier.classify("-- all tracks\nSELECT * FROM tracks")).isEqualTo(StatementKind.READ);
        assertThat(classifier.classify("/* cleanup */ DELETE FROM tracks")).isEqualTo(StatementKind.WRITE);
        assertThat(classifier.classify("(SELECT 1)")).isEqualTo(StatementKind.WRITE);
    }
}
