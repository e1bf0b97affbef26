package tech.flowcatalyst.directory.exception;

/**
 * Exception thrown when a payload cannot be encoded or a response body cannot be decoded.
 */
public class CodecException extends DirectoryException {

    public enum Step {
        ENCODE,
        DECODE
    }

    private final Step step;

    public CodecException(Step step, String message, int statusCode, Throwable cause) {
        super(message, statusCode, cause, null);
        this.step = step;
    }

    public Step getStep() {
        return step;
    }

    public static CodecException encode(Class<?> type, Throwable cause) {
        return new CodecException(Step.ENCODE, "Failed to encode " + type.getSimpleName(), 0, cause);
    }

    public static CodecException decode(String target, int statusCode, Throwable cause) {
        return new CodecException(Step.DECODE, "Failed to decode " + target, statusCode, cause);
    }
}
