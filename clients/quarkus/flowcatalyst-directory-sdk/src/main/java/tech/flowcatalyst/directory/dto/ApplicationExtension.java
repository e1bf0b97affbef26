package tech.flowcatalyst.directory.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A directory schema extension property registered by an application.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApplicationExtension(
    String id,
    String name,
    String dataType,
    @JsonProperty("isMultiValued") Boolean multiValued,
    List<String> targetObjects
) {}
