package com.text2sql.service;

import com.text2sql.model.ValidationOutcome;
import com.text2sql.util.SqlText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Dry-runs candidate SQL through {@code EXPLAIN QUERY PLAN}.
 *
 * <p>The engine compiles the statement and resolves every table and column it references, but
 * only reports the plan; no row or schema object is touched whatever the outcome. Statements that
 * are already {@code EXPLAIN} are compiled as they are. Only one statement is accepted: the
 * driver runs the first statement of a batch and ignores the rest.
 */
@Slf4j
@Service
public class QueryValidator {

    static final String MULTIPLE_STATEMENTS_MESSAGE = "You can only execute one statement at a time.";

    private static final String EXPLAIN_PREFIX = "EXPLAIN QUERY PLAN ";

    /**
     * Validate a statement without executing it.
     *
     * @param sql candidate SQL
     * @param conn open connection; not closed by this method
     * @return outcome with the engine's error text when invalid
     */
    public ValidationOutcome validate(String sql, Connection conn) {
        if (sql == null || sql.isBlank()) {
            return ValidationOutcome.invalid("Empty SQL statement");
        }
        if (SqlText.hasTrailingStatement(sql)) {
            log.debug("Dry run rejected statement (error={})", MULTIPLE_STATEMENTS_MESSAGE);
            return ValidationOutcome.invalid(MULTIPLE_STATEMENTS_MESSAGE);
        }
        String dryRun = "EXPLAIN".equals(SqlText.leadingKeyword(sql)) ? sql : EXPLAIN_PREFIX + sql;
        try (Statement st = conn.createStatement()) {
            if (st.execute(dryRun)) {
                try (ResultSet rs = st.getResultSet()) {
                    while (rs.next()) {
                        // plan rows are not needed
                    }
                }
            }
            return ValidationOutcome.ok();
        } catch (SQLException e) {
            log.debug("Dry run rejected statement (error={})", e.getMessage());
            return ValidationOutcome.invalid(e.getMessage());
        }
    }
}
