package com.text2sql.service;

import com.text2sql.model.ValidationOutcome;
import com.text2sql.testsupport.SqliteFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.sql.Connection;

import static org.assertj.core.api.Assertions.assertThat;

class QueryValidatorTest {

    @TempDir
    Path tempDir;

    private Connection conn;
    private final QueryValidator validator = new QueryValidator();

    @BeforeEach
    void setUp() throws Exception {
        conn = SqliteFixtures.open(tempDir.resolve("validate.db"));
        SqliteFixtures.createTracks(conn);
    }

    @AfterEach
    void tearDown() throws Exception {
        conn.close();
    }

    @Test
    void acceptsValidSelect() {
        ValidationOutcome outcome = validator.validate("SELECT Name FROM tracks WHERE TrackId = 1", conn);

        assertThat(outcome.valid()).isTrue();
        assertThat(outcome.diagnostic()).isEmpty();
    }

    @Test
    void reportsMissingTable() {
        ValidationOutcome outcome = validator.validate("SELECT * FROM albums", conn);

        assertThat(outcome.valid()).isFalse();
        assertThat(outcome.diagnostic()).contains("no such table: albums");
    }

    @Test
    void reportsMissingColumn() {
        ValidationOutcome outcome = validator.validate("SELECT Composer FROM tracks", conn);

        assertThat(outcome.valid()).isFalse();
        assertThat(outcome.diagnostic()).contains("no such column: Composer");
    }

    @Test
    void reportsSyntaxError() {
        ValidationOutcome outcome = validator.validate("SELEC Name FROM tracks", conn);

        assertThat(outcome.valid()).isFalse();
        assertThat(outcome.diagnostic()).contains("syntax error");
    }

    @Test
    void blankSqlIsInvalid() {
        assertThat(validator.validate("  ", conn).valid()).isFalse();
        assertThat(validator.validate(null, conn).diagnostic()).isEqualTo("Empty SQL statement");
    }

    @Test
    void rejectsMoreThanOneStatement() throws Exception {
        ValidationOutcome outcome = validator.validate(
                "DELETE FROM tracks WHERE TrackId = 1; DELETE FROM tracks WHERE TrackId = 2;", conn);
        conn.commit();

        assertThat(outcome.valid()).isFalse();
        assertThat(outcome.diagnostic()).isEqualTo(QueryValidator.MULTIPLE_STATEMENTS_MESSAGE);
        assertThat(SqliteFixtures.count(conn, "tracks")).isEqualTo(3);
    }

    @Test
    void rejectsExplanationAfterStatement() {
        ValidationOutcome outcome = validator.validate("SELECT * FROM tracks; this is an explanation", conn);

        assertThat(outcome.valid()).isFalse();
        assertThat(outcome.diagnostic()).isEqualTo(QueryValidator.MULTIPLE_STATEMENTS_MESSAGE);
    }

    @Test
    void acceptsTerminatorAndTrailingComment() {
        assertThat(validator.validate("SELECT Name FROM tracks; -- every track", conn).valid()).isTrue();
        assertThat(validator.validate("SELECT 'a;b' FROM tracks;", conn).valid()).isTrue();
    }

    @Test
    void explainStatementIsCompiledAsIs() {
        assertThat(validator.validate("EXPLAIN QUERY PLAN SELECT * FROM tracks", conn).valid()).isTrue();
        assertThat(validator.validate("explain select Name from tracks", conn).valid()).isTrue();
        assertThat(validator.validate("EXPLAIN SELECT * FROM albums", conn).diagnostic())
                .contains("no such table: albums");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "EXPLAIN DELETE FROM tracks",
            "DELETE FROM tracks",
            "UPDATE tracks SET Name = 'changed'",
            "INSERT INTO tracks (TrackId, Name) VALUES (99, 'new')",
            "DROP TABLE tracks",
            "CREATE TABLE playlists (id INTEGER)",
            "DELETE FROM nowhere",
            "INSERT INTO tracks (Nope) VALUES (1)"
    })
    void neverChangesState(String sql) throws Exception {
        validator.validate(sql, conn);
        conn.commit();

        assertThat(SqliteFixtures.tableExists(conn, "tracks")).isTrue();
        assertThat(SqliteFixtures.tableExists(conn, "playlists")).isFalse();
        assertThat(SqliteFixtures.count(conn, "tracks")).isEqualTo(3);
        assertThat(SqliteFixtures.count(conn, "tracks WHERE Name = 'changed'")).isZero();
    }
}
