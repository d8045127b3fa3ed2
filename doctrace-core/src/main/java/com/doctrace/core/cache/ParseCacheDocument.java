package com.doctrace.core.cache;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * On-disk form of the parse cache: one versioned JSON document.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * {
 *   "version": "1.0",
 *   "lastUpdated": 1760000000000,
 *   "entries": { "<sha256>": { "contentHash": "<sha256>", "diagramType": "sequence", ... } },
 *   "files":   { "/abs/docs/journeys/JRN_Login.mermaid": { "modifiedMillis": 1, "size": 2, "contentHash": "<sha256>" } }
 * }
 * }</pre>
 *
 * @param version cache format version
 * @param lastUpdated last save time, epoch milliseconds
 * @param entries content hash to analysis
 * @param files absolute path to fingerprint
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParseCacheDocument(
    @JsonProperty("version") String version,
    @JsonProperty("lastUpdated") long lastUpdated,
    @JsonProperty("entries") Map<String, ParseCacheEntry> entries,
    @JsonProperty("files") Map<String, FileFingerprint> files
) {
    public ParseCacheDocument {
        entries = entries == null ? Map.of() : entries;
        files = files == null ? Map.of() : files;
    }
}
