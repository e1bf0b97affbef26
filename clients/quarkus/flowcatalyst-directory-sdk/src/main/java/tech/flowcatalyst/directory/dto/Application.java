package tech.flowcatalyst.directory.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * An application registration in the directory.
 *
 * <p>Only {@code id} is significant to the client; the remaining fields are carried as the
 * directory reports them. Null fields are omitted from request bodies, so an update payload
 * holds just the id and the properties to change.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Application(
    String id,
    String appId,
    String displayName,
    String description,
    String signInAudience,
    List<String> identifierUris,
    List<String> tags,
    String notes,
    String groupMembershipClaims,
    List<PasswordCredential> passwordCredentials,
    Instant createdDateTime,
    Instant deletedDateTime
) {

    public static Application named(String displayName) {
        return new Application(null, null, displayName, null, null, null, null, null, null, null, null, null);
    }

    public Application withId(String id) {
        return new Application(id, appId, displayName, description, signInAudience, identifierUris, tags,
            notes, groupMembershipClaims, passwordCredentials, createdDateTime, deletedDateTime);
    }
}
