package tech.flowcatalyst.directory.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Trust relationship letting tokens from an external issuer act as the application.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FederatedIdentityCredential(
    String id,
    String name,
    String issuer,
    String subject,
    String description,
    List<String> audiences
) {}
