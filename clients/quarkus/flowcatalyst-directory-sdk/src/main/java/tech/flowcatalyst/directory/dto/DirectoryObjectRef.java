package tech.flowcatalyst.directory.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reference to any directory object. Two refs denote the same edge endpoint iff their ids are equal.
 *
 * @param id object id
 * @param odataId self URI; when absent, the client derives it from the id
 * @param odataType OData type name, e.g. {@code #microsoft.graph.user}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DirectoryObjectRef(
    String id,
    @JsonProperty("@odata.id") String odataId,
    @JsonProperty("@odata.type") String odataType
) {

    public static DirectoryObjectRef of(String id) {
        return new DirectoryObjectRef(id, null, null);
    }
}
