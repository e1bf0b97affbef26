package tech.flowcatalyst.directory.odata;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Structured error returned by the directory in the body of a non-success response.
 *
 * <p>The wire shape is {@code {"error": {"code": ..., "message": ..., "details": [...]}}};
 * this record is the inner {@code error} object.
 *
 * @param code machine-readable error code, e.g. {@code Request_BadRequest}
 * @param message human-readable description, which carries the distinguishing text
 * @param details nested errors reported alongside the top-level one
 * @param innerError request correlation data
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ODataError(
    String code,
    String message,
    List<ODataError> details,
    @JsonProperty("innerError") InnerError innerError
) {

    public ODataError {
        details = details != null ? List.copyOf(details) : List.of();
    }

    public static ODataError of(String code, String message) {
        return new ODataError(code, message, List.of(), null);
    }

    /**
     * Check whether this error, or any of its details, matches the given pattern.
     * The pattern is searched in the code and in the message.
     */
    public boolean matches(Pattern pattern) {
        if (pattern == null) {
            return false;
        }
        if (code != null && pattern.matcher(code).find()) {
            return true;
        }
        if (message != null && pattern.matcher(message).find()) {
            return true;
        }
        return details.stream().anyMatch(d -> d.matches(pattern));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (code != null) {
            sb.append(code);
        }
        if (message != null) {
            if (!sb.isEmpty()) {
                sb.append(": ");
            }
            sb.append(message);
        }
        if (innerError != null && innerError.requestId() != null) {
            sb.append(" (request-id ").append(innerError.requestId()).append(')');
        }
        return sb.toString();
    }

    /**
     * Correlation data the directory attaches to an error.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record InnerError(
        String date,
        @JsonProperty("request-id") String requestId,
        @JsonProperty("client-request-id") String clientRequestId
    ) {}
}
