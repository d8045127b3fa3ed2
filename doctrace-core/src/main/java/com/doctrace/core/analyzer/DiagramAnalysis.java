package com.doctrace.core.analyzer;

import com.doctrace.core.model.Relationship;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Normalized result of analyzing one diagram.
 *
 * <p>{@code nodes} holds declared identifiers in first-seen order without duplicates;
 * {@code relationships} keeps every edge in source order, duplicates included.
 *
 * @param diagramType notation id (see {@link NotationType#id()})
 * @param nodes declared identifiers in first-seen order
 * @param relationships directed edges in source order
 */
public record DiagramAnalysis(
    String diagramType,
    List<String> nodes,
    List<Relationship> relationships
) {
    /**
     * Compact constructor with validation and defensive copies.
     */
    public DiagramAnalysis {
        Objects.requireNonNull(diagramType, "diagramType must not be null");
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
    }

    /**
     * Creates an empty analysis for the given notation.
     *
     * @param notation notation type
     * @return analysis with no nodes or relationships
     */
    public static DiagramAnalysis empty(NotationType notation) {
        return new DiagramAnalysis(notation.id(), List.of(), List.of());
    }

    public NotationType notation() {
        return NotationType.fromId(diagramType);
    }

    public boolean isEmpty() {
        return nodes.isEmpty() && relationships.isEmpty();
    }

    /**
     * Returns every identifier appearing as a node or relationship endpoint, in first-seen order.
     *
     * @return mentioned identifiers
     */
    public Set<String> mentionedIds() {
        Set<String> ids = new LinkedHashSet<>(nodes);
        for (Relationship relationship : relationships) {
            ids.add(relationship.from());
            ids.add(relationship.to());
        }
        return ids;
    }

    /**
     * Accumulates nodes and relationships while an analyzer walks a diagram.
     *
     * <p>Nodes are de-duplicated in first-seen order; relationships are kept as added.
     */
    public static final class Builder {

        private final NotationType notation;
        private final Set<String> nodes = new LinkedHashSet<>();
        private final List<Relationship> relationships = new ArrayList<>();

        public Builder(NotationType notation) {
            this.notation = Objects.requireNonNull(notation, "notation must not be null");
        }

        public Builder node(String id) {
            if (id != null && !id.isBlank()) {
                nodes.add(id.trim());
            }
            return this;
        }

        public Builder relationship(String from, String to, String label) {
            if (from == null || from.isBlank() || to == null || to.isBlank()) {
                return this;
            }
            relationships.add(new Relationship(from.trim(), to.trim(), label));
            return this;
        }

        /**
         * Adds a relationship and registers both endpoints as nodes.
         *
         * @param from source identifier
         * @param to target identifier
         * @param label optional label
         * @return this builder
         */
        public Builder link(String from, String to, String label) {
            node(from);
            node(to);
            return relationship(from, to, label);
        }

        public boolean hasNode(String id) {
            return nodes.contains(id);
        }

        public DiagramAnalysis build() {
            return new DiagramAnalysis(notation.id(), new ArrayList<>(nodes), relationships);
        }
    }
}
