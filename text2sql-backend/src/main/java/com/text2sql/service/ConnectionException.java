package com.text2sql.service;

/**
 * Thrown when the database handle cannot be used: it is closed, or opening it or reading its
 * catalog failed.
 */
public class ConnectionException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public ConnectionException(String message) {
        super(message);
    }

    /**
     * Create a new exception.
     *
     * @param message error message
     * @param cause underlying JDBC error
     */
    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
