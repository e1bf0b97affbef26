package tech.flowcatalyst.directory.exception;

/**
 * Exception thrown when a call is interrupted or runs out of time while retrying.
 */
public class RequestCancelledException extends DirectoryException {

    public RequestCancelledException(String message, int statusCode, Throwable cause) {
        super(message, statusCode, cause, null);
    }

    public static RequestCancelledException interrupted(String method, String path, int lastStatus, InterruptedException cause) {
        return new RequestCancelledException(method + " " + path + ": interrupted while retrying", lastStatus, cause);
    }

    public static RequestCancelledException deadlineExceeded(String method, String path, int lastStatus) {
        return new RequestCancelledException(method + " " + path + ": consistency deadline exceeded", lastStatus, null);
    }
}
