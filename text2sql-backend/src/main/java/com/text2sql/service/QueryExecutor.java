package com.text2sql.service;

import com.text2sql.model.ExecutionResult;
import com.text2sql.model.ResultRow;
import com.text2sql.model.ValidationOutcome;
import com.text2sql.util.JdbcValues;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates and then executes a statement, shaping the outcome as rows, a status or an error.
 *
 * <p>Database errors never escape {@link #execute}; they are reported through
 * {@link ExecutionResult#error(String)}.
 */
@Slf4j
@Service
public class QueryExecutor {

    static final String SUCCESS_MESSAGE = "Query executed successfully.";
    static final String READ_ONLY_MESSAGE = "Write statements are disabled in read-only mode.";

    private final QueryValidator queryValidator;
    private final StatementClassifier statementClassifier;
    private final boolean readOnly;

    /**
     * Create an executor.
     *
     * @param queryValidator dry-run validator
     * @param statementClassifier read/write classifier
     * @param readOnly reject statements classified as writes
     */
    public QueryExecutor(
            QueryValidator queryValidator,
            StatementClassifier statementClassifier,
            @Value("${text2sql.execution.read-only:false}") boolean readOnly
    ) {
        this.queryValidator = queryValidator;
        this.statementClassifier = statementClassifier;
        this.readOnly = readOnly;
    }

    /**
     * Execute a statement after a successful dry run.
     *
     * @param sql statement text, executed verbatim
     * @param conn open connection; not closed by this method
     * @return rows, status or error; never {@code null}
     */
    public ExecutionResult execute(String sql, Connection conn) {
        ValidationOutcome outcome = queryValidator.validate(sql, conn);
        if (!outcome.valid()) {
            return ExecutionResult.error("Invalid SQL Query: " + outcome.diagnostic());
        }

        StatementClassifier.StatementKind kind = statementClassifier.classify(sql);
        if (kind == StatementClassifier.StatementKind.WRITE && readOnly) {
            log.info("Rejected write statement in read-only mode");
            return ExecutionResult.error(READ_ONLY_MESSAGE);
        }

        long startTime = System.currentTimeMillis();
        try {
            ExecutionResult result = kind == StatementClassifier.StatementKind.READ
                    ? executeRead(sql, conn)
                    : executeWrite(sql, conn);
            log.debug("Statement executed (kind={}, duration_ms={})", kind, System.currentTimeMillis() - startTime);
            return result;
        } catch (SQLException | RuntimeException e) {
            rollbackQuietly(conn);
            return ExecutionResult.error("SQL execution error: " + e.getMessage());
        }
    }

    private ExecutionResult executeRead(String sql, Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            if (!st.execute(sql)) {
                // no result set, e.g. a pragma assignment
                return commit(conn);
            }
            try (ResultSet rs = st.getResultSet()) {
                return materialize(rs);
            }
        }
    }

    private ExecutionResult executeWrite(String sql, Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute(sql);
        }
        return commit(conn);
    }

    private ExecutionResult commit(Connection conn) throws SQLException {
        if (!conn.getAutoCommit()) {
            conn.commit();
        }
        return ExecutionResult.status(SUCCESS_MESSAGE);
    }

    private ExecutionResult materialize(ResultSet rs) throws SQLException {
        ResultSetMetaData rsmd = rs.getMetaData();
        int columnCount = rsmd.getColumnCount();

        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(rsmd.getColumnLabel(i));
        }

        List<ResultRow> rows = new ArrayList<>();
        while (rs.next()) {
            List<Object> values = new ArrayList<>(columnCount);
            for (int i = 1; i <= columnCount; i++) {
                values.add(JdbcValues.read(rs, i));
            }
            rows.add(ResultRow.of(columns, values));
        }
        return ExecutionResult.rows(columns, rows);
    }

    private void rollbackQuietly(Connection conn) {
        try {
            if (!conn.isClosed() && !conn.getAutoCommit()) {
                conn.rollback();
            }
        } catch (SQLException e) {
            log.warn("Rollback after failed statement did not complete (error={})", e.getMessage());
        }
    }
}
