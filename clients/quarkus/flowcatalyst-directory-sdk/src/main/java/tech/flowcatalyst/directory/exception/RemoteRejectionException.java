package tech.flowcatalyst.directory.exception;

import tech.flowcatalyst.directory.odata.ODataError;

/**
 * Exception thrown when the directory answers with a status the operation does not accept.
 */
public class RemoteRejectionException extends DirectoryException {

    private final String method;
    private final String path;

    public RemoteRejectionException(String method, String path, int statusCode, ODataError error) {
        super(describe(method, path, statusCode, error), statusCode, null, error);
        this.method = method;
        this.path = path;
    }

    public String getMethod() {
        return method;
    }

    public String getPath() {
        return path;
    }

    private static String describe(String method, String path, int statusCode, ODataError error) {
        String base = method + " " + path + ": unexpected status " + statusCode;
        return error != null ? base + " with OData error: " + error : base;
    }
}
