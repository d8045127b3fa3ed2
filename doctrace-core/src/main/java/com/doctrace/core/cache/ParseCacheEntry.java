package com.doctrace.core.cache;

import com.doctrace.core.analyzer.DiagramAnalysis;
import com.doctrace.core.model.Relationship;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Analysis stored under the hash of the content it was computed from.
 *
 * <p>An entry is never changed after creation; changed content has a different hash and
 * therefore gets a new entry.
 *
 * @param contentHash SHA-256 of the analyzed content
 * @param timestamp creation time, epoch milliseconds
 * @param diagramType notation id
 * @param nodes declared identifiers in first-seen order
 * @param relationships edges in source order
 * @param filePath file the content was first seen in (informational)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParseCacheEntry(
    @JsonProperty("contentHash") String contentHash,
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("diagramType") String diagramType,
    @JsonProperty("nodes") List<String> nodes,
    @JsonProperty("relationships") List<Relationship> relationships,
    @JsonProperty("filePath") String filePath
) {
    public ParseCacheEntry {
        Objects.requireNonNull(contentHash, "contentHash must not be null");
        diagramType = diagramType == null ? "unknown" : diagramType;
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
    }

    static ParseCacheEntry of(String contentHash, long timestamp, String filePath, DiagramAnalysis analysis) {
        return new ParseCacheEntry(contentHash, timestamp, analysis.diagramType(), analysis.nodes(),
            analysis.relationships(), filePath);
    }

    public DiagramAnalysis toAnalysis() {
        return new DiagramAnalysis(diagramType, nodes, relationships);
    }
}
