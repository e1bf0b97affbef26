package tech.flowcatalyst.directory.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * A client secret of an application. {@code secretText} is only populated in the
 * response to {@code addPassword}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PasswordCredential(
    String keyId,
    String displayName,
    String hint,
    String secretText,
    String customKeyIdentifier,
    Instant startDateTime,
    Instant endDateTime
) {

    public static PasswordCredential named(String displayName, Instant endDateTime) {
        return new PasswordCredential(null, displayName, null, null, null, null, endDateTime);
    }
}
