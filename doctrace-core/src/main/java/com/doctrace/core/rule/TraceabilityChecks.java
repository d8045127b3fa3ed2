package com.doctrace.core.rule;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Graph conditions of a declarative rule.
 *
 * @param mustBeLinked every id declared by the asset must be referenced somewhere
 * @param mustTraceTo the asset's node needs an uplink starting with one of these prefixes
 * @param mustHaveDownlink the asset's node needs a downlink starting with one of these prefixes
 * @param allowedDownlinkPrefixes every downlink of the asset's node must start with one of these prefixes
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TraceabilityChecks(
    @JsonProperty("mustBeLinked") boolean mustBeLinked,
    @JsonProperty("mustTraceTo") @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<String> mustTraceTo,
    @JsonProperty("mustHaveDownlink") @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<String> mustHaveDownlink,
    @JsonProperty("allowedDownlinkPrefixes") @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<String> allowedDownlinkPrefixes
) {
    public TraceabilityChecks {
        mustTraceTo = mustTraceTo == null ? List.of() : List.copyOf(mustTraceTo);
        mustHaveDownlink = mustHaveDownlink == null ? List.of() : List.copyOf(mustHaveDownlink);
        allowedDownlinkPrefixes = allowedDownlinkPrefixes == null ? List.of() : List.copyOf(allowedDownlinkPrefixes);
    }
}
