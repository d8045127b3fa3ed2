package com.doctrace.core.rule;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Navigation category declared by a folder-level rule.
 *
 * @param id category node id
 * @param title display title
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HubDefinition(
    @JsonProperty("id") String id,
    @JsonProperty("title") String title
) {}
