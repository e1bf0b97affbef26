package tech.flowcatalyst.directory.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A token issuance policy as listed on an application's {@code tokenIssuancePolicies} relation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenIssuancePolicy(
    String id,
    String displayName,
    String description,
    List<String> definition,
    @JsonProperty("isOrganizationDefault") Boolean organizationDefault
) {}
