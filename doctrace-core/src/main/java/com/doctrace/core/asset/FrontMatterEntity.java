package com.doctrace.core.asset;

import java.util.List;
import java.util.Objects;

/**
 * An entity declared inside a document's front matter ({@code entities[]}).
 *
 * @param id declared identifier
 * @param uplinks explicit uplink targets ({@code uplink}, single value or list)
 * @param downlinks explicit downlink targets
 * @param requirements requirement identifiers this entity traces to
 * @param classification optional classification, e.g. {@code Functional}
 */
public record FrontMatterEntity(
    String id,
    List<String> uplinks,
    List<String> downlinks,
    List<String> requirements,
    String classification
) {
    public FrontMatterEntity {
        Objects.requireNonNull(id, "id must not be null");
        uplinks = uplinks == null ? List.of() : List.copyOf(uplinks);
        downlinks = downlinks == null ? List.of() : List.copyOf(downlinks);
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
    }
}
