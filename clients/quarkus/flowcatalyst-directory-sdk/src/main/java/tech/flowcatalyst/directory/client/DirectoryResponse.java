package tech.flowcatalyst.directory.client;

import tech.flowcatalyst.directory.odata.ODataError;

/**
 * An accepted directory response.
 *
 * @param status final HTTP status
 * @param body response body, possibly empty
 * @param error structured error, present only when the response was accepted by a classifier
 * @param classified true when the status was outside the valid set but the outcome classifier accepted it
 */
public record DirectoryResponse(int status, String body, ODataError error, boolean classified) {

    public static DirectoryResponse of(int status, String body) {
        return new DirectoryResponse(status, body, null, false);
    }

    public static DirectoryResponse classified(int status, String body, ODataError error) {
        return new DirectoryResponse(status, body, error, true);
    }

    public boolean hasBody() {
        return body != null && !body.isBlank();
    }
}
