package tech.flowcatalyst.directory.exception;

/**
 * Exception thrown when a call is rejected locally, before any request is sent.
 */
public class PreconditionException extends DirectoryException {

    public PreconditionException(String message) {
        super(message);
    }

    public static PreconditionException nullId(String operation, String entity) {
        return new PreconditionException(operation + "(): cannot update " + entity + " with nil ID");
    }

    public static PreconditionException missingArgument(String operation, String argument) {
        return new PreconditionException(operation + "(): " + argument + " is required");
    }
}
