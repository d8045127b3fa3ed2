package com.doctrace.core.model;

import java.util.Objects;

/**
 * A directed edge extracted from diagram source text.
 *
 * <p>Relationships keep the order and multiplicity in which they appear in the diagram;
 * two identical edges in one diagram are two relationships.
 *
 * @param from source identifier
 * @param to target identifier
 * @param label optional edge label ({@code null} when the edge carries none)
 */
public record Relationship(
    String from,
    String to,
    String label
) {
    /**
     * Compact constructor with validation.
     */
    public Relationship {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        if (label != null) {
            label = label.trim();
            if (label.isEmpty()) {
                label = null;
            }
        }
    }

    /**
     * Creates an unlabeled relationship.
     *
     * @param from source identifier
     * @param to target identifier
     * @return relationship without label
     */
    public static Relationship of(String from, String to) {
        return new Relationship(from, to, null);
    }
}
