package com.doctrace.core.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Last seen modification time and size of a file, with the hash of its content at that moment.
 *
 * @param modifiedMillis last modification time, epoch milliseconds
 * @param size file size in bytes
 * @param contentHash SHA-256 of the content
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FileFingerprint(
    @JsonProperty("modifiedMillis") long modifiedMillis,
    @JsonProperty("size") long size,
    @JsonProperty("contentHash") String contentHash
) {
}
