package com.doctrace.core.asset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed view of a document's front-matter block.
 *
 * <p>Known keys are exposed as fields; every other key is preserved in {@link #extras()}.
 * Fields are {@code null} or empty only when the document did not declare them; nothing is
 * defaulted.
 *
 * @param id declared identifier
 * @param title title
 * @param description description
 * @param kind kind derived from the identifier prefix
 * @param uplinks top-level explicit uplinks (legacy single-entity form)
 * @param downlinks top-level explicit downlinks
 * @param requirements requirement identifiers the document traces to
 * @param classification optional classification
 * @param entities nested entity declarations
 * @param extras unknown keys in declaration order
 */
public record FrontMatter(
    String id,
    String title,
    String description,
    DocumentKind kind,
    List<String> uplinks,
    List<String> downlinks,
    List<String> requirements,
    String classification,
    List<FrontMatterEntity> entities,
    Map<String, Object> extras
) {
    public FrontMatter {
        kind = kind == null ? DocumentKind.fromId(id) : kind;
        uplinks = uplinks == null ? List.of() : List.copyOf(uplinks);
        downlinks = downlinks == null ? List.of() : List.copyOf(downlinks);
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
        entities = entities == null ? List.of() : List.copyOf(entities);
        extras = extras == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    /**
     * Front matter of a document that declares none.
     *
     * @return empty front matter
     */
    public static FrontMatter empty() {
        return new FrontMatter(null, null, null, DocumentKind.GENERIC, null, null, null, null, null, null);
    }

    public boolean hasId() {
        return id != null && !id.isBlank();
    }

    /**
     * Returns the value of a front-matter key, known or extra, as text.
     *
     * @param key front-matter key
     * @return non-blank value, or empty when absent or blank
     */
    public Optional<String> value(String key) {
        Object value = switch (key) {
            case FrontMatterParser.ID -> id;
            case FrontMatterParser.TITLE -> title;
            case FrontMatterParser.DESCRIPTION -> description;
            case FrontMatterParser.CLASSIFICATION -> classification;
            case FrontMatterParser.ENTITIES -> entities.isEmpty() ? null : entities;
            case FrontMatterParser.UPLINK, FrontMatterParser.UPLINKS -> uplinks.isEmpty() ? null : uplinks;
            case FrontMatterParser.DOWNLINKS -> downlinks.isEmpty() ? null : downlinks;
            case FrontMatterParser.REQUIREMENTS -> requirements.isEmpty() ? null : requirements;
            default -> extras.get(key);
        };
        if (value == null) {
            return Optional.empty();
        }
        String text = value.toString();
        return text.isBlank() ? Optional.empty() : Optional.of(text);
    }

    /**
     * Returns every identifier this document declares: its own id followed by entity ids.
     *
     * @return declared identifiers in declaration order
     */
    public List<String> declaredIds() {
        List<String> ids = new ArrayList<>();
        if (hasId()) {
            ids.add(id);
        }
        for (FrontMatterEntity entity : entities) {
            if (!ids.contains(entity.id())) {
                ids.add(entity.id());
            }
        }
        return ids;
    }
}
