package com.doctrace.core.rule;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Declarative checks of a rule, evaluated by the {@code declarative} implementation.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * checks:
 *   mermaidType: [graph, flowchart]
 *   requiredFrontmatter: [id, title]
 *   requiredNodes: [Start]
 *   traceability:
 *     mustTraceTo: [REQ_]
 * }</pre>
 *
 * @param mermaidType accepted opening keywords (single value or list)
 * @param requiredNodes node ids the diagram must contain (case-insensitive)
 * @param requiredFrontmatter front-matter keys that must be present and non-empty
 * @param requiredExtension required file extension, with or without leading dot
 * @param onePerFile the asset must declare exactly one entity
 * @param allowedNodePrefixes prefixed diagram node ids must use one of these prefixes
 * @param traceability graph conditions
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RuleChecks(
    @JsonProperty("mermaidType") @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY) List<String> mermaidType,
    @JsonProperty("requiredNodes") List<String> requiredNodes,
    @JsonProperty("requiredFrontmatter") List<String> requiredFrontmatter,
    @JsonProperty("requiredExtension") String requiredExtension,
    @JsonProperty("onePerFile") boolean onePerFile,
    @JsonProperty("allowedNodePrefixes") List<String> allowedNodePrefixes,
    @JsonProperty("traceability") TraceabilityChecks traceability
) {
    public RuleChecks {
        mermaidType = mermaidType == null ? List.of() : List.copyOf(mermaidType);
        requiredNodes = requiredNodes == null ? List.of() : List.copyOf(requiredNodes);
        requiredFrontmatter = requiredFrontmatter == null ? List.of() : List.copyOf(requiredFrontmatter);
        allowedNodePrefixes = allowedNodePrefixes == null ? List.of() : List.copyOf(allowedNodePrefixes);
    }

    public static RuleChecks none() {
        return new RuleChecks(null, null, null, null, false, null, null);
    }
}
