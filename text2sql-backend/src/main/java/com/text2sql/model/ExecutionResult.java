package com.text2sql.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Outcome of executing one statement: materialized rows, a status message, or an error message.
 *
 * <p>Always one of the three kinds; the executor never returns {@code null}.
 */
@Getter
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ExecutionResult {

    public enum Kind {
        ROWS,
        STATUS,
        ERROR
    }

    private final Kind kind;
    private final List<String> columns;
    private final List<ResultRow> rows;
    private final String message;

    private ExecutionResult(Kind kind, List<String> columns, List<ResultRow> rows, String message) {
        this.kind = kind;
        this.columns = columns;
        this.rows = rows;
        this.message = message;
    }

    /**
     * Create a tabular result.
     *
     * @param columns column labels in select-list order
     * @param rows rows, possibly empty
     * @return result
     */
    public static ExecutionResult rows(List<String> columns, List<ResultRow> rows) {
        return new ExecutionResult(Kind.ROWS, List.copyOf(columns), List.copyOf(rows), null);
    }

    public static ExecutionResult status(String message) {
        return new ExecutionResult(Kind.STATUS, null, null, message);
    }

    public static ExecutionResult error(String message) {
        return new ExecutionResult(Kind.ERROR, null, null, message);
    }

    @JsonIgnore
    public boolean isError() {
        return kind == Kind.ERROR;
    }
}
