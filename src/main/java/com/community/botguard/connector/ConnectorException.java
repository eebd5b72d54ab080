package com.community.botguard.connector;

/**
 * Failure reported by the platform connector. {@code statusCode} is the HTTP
 * status, or 0 when the connector could not be reached.
 */
public class ConnectorException extends RuntimeException {

    private final int statusCode;

    public ConnectorException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public ConnectorException(int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    public boolean isForbidden() {
        return statusCode == 403;
    }
}
