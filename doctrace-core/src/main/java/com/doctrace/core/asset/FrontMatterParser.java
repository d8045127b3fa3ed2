package com.doctrace.core.asset;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a document into its YAML front-matter block and body, and maps the block onto
 * {@link FrontMatter}.
 *
 * <p>The block must start on the first line with {@code ---} and end with a line holding
 * only {@code ---}. Single values and lists are both accepted for link fields. A block that is
 * not valid YAML does not fail: the document gets an empty front matter and the error text
 * is kept for reporting.
 */
public class FrontMatterParser {

    static final String ID = "id";
    static final String TITLE = "title";
    static final String DESCRIPTION = "description";
    static final String UPLINK = "uplink";
    static final String UPLINKS = "uplinks";
    static final String DOWNLINKS = "downlinks";
    static final String REQUIREMENTS = "requirements";
    static final String CLASSIFICATION = "classification";
    static final String ENTITIES = "entities";

    private static final Set<String> KNOWN_KEYS = Set.of(
        ID, TITLE, DESCRIPTION, UPLINK, UPLINKS, DOWNLINKS, REQUIREMENTS, CLASSIFICATION, ENTITIES);

    private static final Pattern BLOCK = Pattern.compile("\\A\\s*---[ \\t]*\\R(.*?)(?:\\R)?^---[ \\t]*$\\R?",
        Pattern.DOTALL | Pattern.MULTILINE);

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * Result of splitting a document.
     *
     * @param frontMatter parsed front matter, empty when absent or invalid
     * @param body content following the block
     * @param error parse error text, or null
     */
    public record ParsedDocument(FrontMatter frontMatter, String body, String error) {
    }

    /**
     * Parses a document.
     *
     * @param content full file content
     * @return parsed document; never null
     */
    public ParsedDocument parse(String content) {
        if (content == null) {
            return new ParsedDocument(FrontMatter.empty(), "", null);
        }
        Matcher matcher = BLOCK.matcher(content);
        if (!matcher.find()) {
            return new ParsedDocument(FrontMatter.empty(), content, null);
        }
        String body = content.substring(matcher.end());
        try {
            Map<String, Object> data = readBlock(matcher.group(1));
            return new ParsedDocument(toFrontMatter(data), body, null);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return new ParsedDocument(FrontMatter.empty(), body, firstLine(e.getMessage()));
        }
    }

    private Map<String, Object> readBlock(String yaml) throws JsonProcessingException {
        if (yaml == null || yaml.isBlank()) {
            return Map.of();
        }
        Object parsed = yamlMapper.readValue(yaml, Object.class);
        if (parsed == null) {
            return Map.of();
        }
        if (!(parsed instanceof Map<?, ?>)) {
            throw new IllegalArgumentException("Front matter must be a mapping of keys to values");
        }
        return yamlMapper.convertValue(parsed, new TypeReference<LinkedHashMap<String, Object>>() { });
    }

    private FrontMatter toFrontMatter(Map<String, Object> data) {
        String id = text(data.get(ID));
        List<String> uplinks = new ArrayList<>(strings(data.get(UPLINK)));
        for (String uplink : strings(data.get(UPLINKS))) {
            if (!uplinks.contains(uplink)) {
                uplinks.add(uplink);
            }
        }
        Map<String, Object> extras = new LinkedHashMap<>();
        data.forEach((key, value) -> {
            if (!KNOWN_KEYS.contains(key)) {
                extras.put(key, value);
            }
        });
        return new FrontMatter(
            id,
            text(data.get(TITLE)),
            text(data.get(DESCRIPTION)),
            DocumentKind.fromId(id),
            uplinks,
            strings(data.get(DOWNLINKS)),
            strings(data.get(REQUIREMENTS)),
            text(data.get(CLASSIFICATION)),
            entities(data.get(ENTITIES)),
            extras);
    }

    private List<FrontMatterEntity> entities(Object value) {
        if (!(value instanceof Collection<?> items)) {
            return List.of();
        }
        List<FrontMatterEntity> entities = new ArrayList<>();
        for (Object item : items) {
            if (item instanceof Map<?, ?> entity) {
                String id = text(entity.get(ID));
                if (id == null || id.isBlank()) {
                    continue;
                }
                List<String> uplinks = new ArrayList<>(strings(entity.get(UPLINK)));
                strings(entity.get(UPLINKS)).stream().filter(u -> !uplinks.contains(u)).forEach(uplinks::add);
                entities.add(new FrontMatterEntity(
                    id,
                    uplinks,
                    strings(entity.get(DOWNLINKS)),
                    strings(entity.get(REQUIREMENTS)),
                    text(entity.get(CLASSIFICATION))));
            }
        }
        return entities;
    }

    private static List<String> strings(Object value) {
        if (value == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        if (value instanceof Collection<?> items) {
            for (Object item : items) {
                String text = text(item);
                if (text != null && !text.isBlank()) {
                    result.add(text.trim());
                }
            }
        } else {
            String text = text(value);
            if (text != null && !text.isBlank()) {
                result.add(text.trim());
            }
        }
        return result;
    }

    private static String text(Object value) {
        if (value == null || value instanceof Map<?, ?> || value instanceof Collection<?>) {
            return null;
        }
        return value.toString();
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "invalid YAML";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }
}
