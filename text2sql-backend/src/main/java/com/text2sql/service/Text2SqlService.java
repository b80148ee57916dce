package com.text2sql.service;

import com.text2sql.model.ExecutionResult;
import com.text2sql.model.GeneratedQuery;
import com.text2sql.model.SchemaDescriptor;
import com.text2sql.model.Text2SqlAnswer;
import com.text2sql.model.ValidationOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Runs the translate, validate and execute pipeline for one natural-language request.
 *
 * <p>Callers are serialized: at most one pipeline run holds the database connection at a time.
 */
@Slf4j
@Service
public class Text2SqlService {

    private final DataSource dataSource;
    private final SchemaIntrospector schemaIntrospector;
    private final PromptBuilder promptBuilder;
    private final QueryGenerator queryGenerator;
    private final QuerySanitizer querySanitizer;
    private final QueryValidator queryValidator;
    private final QueryExecutor queryExecutor;

    private final ReentrantLock lock = new ReentrantLock(true);

    public Text2SqlService(
            DataSource dataSource,
            SchemaIntrospector schemaIntrospector,
            PromptBuilder promptBuilder,
            QueryGenerator queryGenerator,
            QuerySanitizer querySanitizer,
            QueryValidator queryValidator,
            QueryExecutor queryExecutor
    ) {
        this.dataSource = dataSource;
        this.schemaIntrospector = schemaIntrospector;
        this.promptBuilder = promptBuilder;
        this.queryGenerator = queryGenerator;
        this.querySanitizer = querySanitizer;
        this.queryValidator = queryValidator;
        this.queryExecutor = queryExecutor;
    }

    /**
     * Translate a request into SQL and execute it.
     *
     * @param userRequest natural-language request
     * @return generated SQL and execution result
     * @throws ConnectionException if the database cannot be used
     * @throws ExternalServiceException if the completion API call fails
     */
    public Text2SqlAnswer ask(String userRequest) {
        return withConnection(conn -> {
            SchemaDescriptor schema = schemaIntrospector.describe(conn);
            String prompt = promptBuilder.build(schemaIntrospector.serialize(schema), userRequest);
            log.debug("Prompt built (tables={}, prompt_chars={})", schema.getTables().size(), prompt.length());

            String rawText = queryGenerator.generate(prompt);
            String sql = querySanitizer.clean(rawText);
            log.info("SQL generated (sql={})", sql);

            ExecutionResult result = queryExecutor.execute(sql, conn);
            if (result.isError()) {
                log.info("Generated SQL not executed successfully (error={})", result.getMessage());
            }
            return Text2SqlAnswer.builder()
                    .request(userRequest)
                    .query(GeneratedQuery.builder().rawText(rawText).sql(sql).build())
                    .result(result)
                    .build();
        });
    }

    /**
     * Read the live schema.
     *
     * @return schema descriptor
     */
    public SchemaDescriptor describeSchema() {
        return withConnection(schemaIntrospector::describe);
    }

    /**
     * Dry-run user-supplied SQL.
     *
     * @param sql statement
     * @return validation outcome
     */
    public ValidationOutcome validate(String sql) {
        return withConnection(conn -> queryValidator.validate(sql, conn));
    }

    /**
     * Validate and execute user-supplied SQL.
     *
     * @param sql statement
     * @return execution result
     */
    public ExecutionResult execute(String sql) {
        return withConnection(conn -> queryExecutor.execute(sql, conn));
    }

    private <T> T withConnection(Function<Connection, T> work) {
        lock.lock();
        try (Connection conn = dataSource.getConnection()) {
            return work.apply(conn);
        } catch (SQLException e) {
            throw new ConnectionException("Database connection unavailable: " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }
}
