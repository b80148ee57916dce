package com.text2sql.service;

/**
 * Thrown when the completion API call fails (configuration, authentication, network, quota or an
 * unusable response). Fatal for the request; not retried.
 */
public class ExternalServiceException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public ExternalServiceException(String message) {
        super(message);
    }

    /**
     * Create a new exception.
     *
     * @param message error message
     * @param cause underlying transport or parsing error
     */
    public ExternalServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
