package tech.flowcatalyst.directory.exception;

/**
 * Exception thrown when authentication fails.
 */
public class AuthenticationException extends DirectoryException {

    public AuthenticationException(String message) {
        super(message, 401);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, 401, cause, null);
    }

    public static AuthenticationException invalidCredentials(int statusCode) {
        return new AuthenticationException("Token endpoint rejected client credentials (status " + statusCode + ")");
    }

    public static AuthenticationException missingCredentials() {
        return new AuthenticationException("Client ID and secret are required");
    }

    public static AuthenticationException missingTenant() {
        return new AuthenticationException("Tenant ID or token URL is required");
    }
}
