package tech.flowcatalyst.directory.exception;

import tech.flowcatalyst.directory.odata.ODataError;

import java.util.Optional;

/**
 * Base exception for directory client errors.
 *
 * <p>The status code is that of the last HTTP response, or 0 when the failure
 * happened before any response was received.
 */
public class DirectoryException extends RuntimeException {

    private final int statusCode;
    private final ODataError error;

    public DirectoryException(String message) {
        this(message, 0, null, null);
    }

    public DirectoryException(String message, int statusCode) {
        this(message, statusCode, null, null);
    }

    public DirectoryException(String message, Throwable cause) {
        this(message, 0, cause, null);
    }

    public DirectoryException(String message, int statusCode, Throwable cause, ODataError error) {
        super(message, cause);
        this.statusCode = statusCode;
        this.error = error;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public Optional<ODataError> getError() {
        return Optional.ofNullable(error);
    }
}
