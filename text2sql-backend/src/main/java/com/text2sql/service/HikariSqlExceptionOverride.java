package com.text2sql.service;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;

/**
 * Keeps the single pooled SQLite connection alive across statement-level errors.
 *
 * Generated SQL routinely fails with syntax, constraint or missing-object errors. Those are
 * reported to the caller and must not evict the only connection in the pool; only errors in the
 * connection exception class (SQLSTATE 08xxx) do.
 */
public class HikariSqlExceptionOverride implements SQLExceptionOverride {

    /**
     * Decide whether Hikari should evict a connection based on the exception.
     *
     * @param sqlException SQL exception
     * @return override decision
     */
    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState != null && sqlState.startsWith("08")) {
            return Override.CONTINUE_EVICT;
        }

        return Override.DO_NOT_EVICT;
    }
}
