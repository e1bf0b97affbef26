package tech.flowcatalyst.directory.exception;

/**
 * Exception thrown when the request could not be sent or the response could not be read.
 */
public class TransportException extends DirectoryException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
