package com.text2sql.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.text2sql.config.DatabaseConfig;
import com.text2sql.model.ExecutionResult;
import com.text2sql.model.SchemaDescriptor;
import com.text2sql.model.Text2SqlAnswer;
import com.text2sql.testsupport.CompletionFixtures;
import com.text2sql.testsupport.SqliteFixtures;
import com.zaxxer.hikari.HikariDataSource;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.env.MockEnvironment;

import java.nio.file.Path;
import java.sql.Connection;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Text2SqlServiceTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MockWebServer server;
    private HikariDataSource dataSource;
    private Text2SqlService service;

    @BeforeEach
    void setUp() throws Exception {
        Path dbFile = tempDir.resolve("chinook.db");
        try (Connection conn = SqliteFixtures.open(dbFile)) {
            SqliteFixtures.createTracks(conn);
        }

        server = new MockWebServer();
        server.start();

        MockEnvironment environment = new MockEnvironment()
                .withProperty("text2sql.datasource.path", dbFile.toString())
                .withProperty("text2sql.ai.base-url", server.url("/").toString())
                .withProperty("text2sql.ai.api-key", "test-key");

        dataSource = new DatabaseConfig().dataSource(environment);
        QueryValidator validator = new QueryValidator();
        service = new Text2SqlService(
                dataSource,
                new SchemaIntrospector(),
                new PromptBuilder(100000),
                new QueryGenerator(objectMapper, environment),
                new QuerySanitizer(),
                validator,
                new QueryExecutor(validator, new StatementClassifier(), false));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        dataSource.close();
    }

    @Test
    void listAllTracksEndToEnd() throws Exception {
        server.enqueue(new MockResponse().setBody(CompletionFixtures.completionBody("```sql\nSELECT * FROM tracks;\n```")));

        Text2SqlAnswer answer = service.ask("list all tracks");

        assertThat(answer.getRequest()).isEqualTo("list all tracks");
        assertThat(answer.getQuery().getRawText()).isEqualTo("```sql\nSELECT * FROM tracks;\n```");
        assertThat(answer.getQuery().getSql()).isEqualTo("SELECT * FROM tracks;");

        ExecutionResult result = answer.getResult();
        assertThat(result.getKind()).isEqualTo(ExecutionResult.Kind.ROWS);
        assertThat(result.getRows()).hasSize(3);
        assertThat(result.getRows()).allSatisfy(row ->
                assertThat(row.columnNames()).containsExactly("TrackId", "Name", "Milliseconds"));

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        String prompt = objectMapper.readTree(request.getBody().readUtf8())
                .path("messages").path(0).path("content").asText();
        assertThat(prompt).contains("Table: tracks\n  - TrackId (INTEGER)\n  - Name (NVARCHAR(200))\n");
        assertThat(prompt).contains("User request: list all tracks");
    }

    @Test
    void generatedWriteIsCommitted() {
        server.enqueue(new MockResponse().setBody(CompletionFixtures.completionBody(
                "INSERT INTO tracks (TrackId, Name, Milliseconds) VALUES (4, 'Restless and Wild', 252051)")));

        Text2SqlAnswer answer = service.ask("add the track Restless and Wild");

        assertThat(answer.getResult().getKind()).isEqualTo(ExecutionResult.Kind.STATUS);
        ExecutionResult read = service.execute("SELECT COUNT(*) AS n FROM tracks");
        assertThat(((Number) read.getRows().get(0).get("n")).intValue()).isEqualTo(4);
    }

    @Test
    void invalidGeneratedSqlIsReportedNotThrown() {
        server.enqueue(new MockResponse().setBody(CompletionFixtures.completionBody("SELECT * FROM albums")));

        Text2SqlAnswer answer = service.ask("list all albums");

        assertThat(answer.getQuery().getSql()).isEqualTo("SELECT * FROM albums");
        assertThat(answer.getResult().isError()).isTrue();
        assertThat(answer.getResult().getMessage()).startsWith("Invalid SQL Query: ");
    }

    @Test
    void completionFailurePropagates() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("unavailable"));

        assertThatThrownBy(() -> service.ask("list all tracks"))
                .isInstanceOf(ExternalServiceException.class)
                .hasMessageContaining("HTTP 503");
    }

    @Test
    void closedDataSourceIsConnectionError() {
        dataSource.close();

        assertThatThrownBy(() -> service.ask("list all tracks"))
                .isInstanceOf(ConnectionException.class);
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void describeAndValidateUseTheLiveSchema() {
        SchemaDescriptor schema = service.describeSchema();
        assertThat(schema.getTables()).extracting(SchemaDescriptor.TableDescriptor::getName).containsExactly("tracks");

        assertThat(service.validate("SELECT Name FROM tracks").valid()).isTrue();
        assertThat(service.validate("SELECT Name FROM albums").valid()).isFalse();

        service.execute("CREATE TABLE albums (AlbumId INTEGER PRIMARY KEY, Title TEXT)");

        assertThat(service.describeSchema().getTables()).hasSize(2);
        assertThat(service.validate("SELECT Title FROM albums").valid()).isTrue();
    }
}
