package com.doctrace.core.rule;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Loads the built-in rule document from the classpath, applies the user's rule document on top
 * of it and instantiates every enabled rule through a {@link RuleCatalog}.
 *
 * <p>Override semantics, applied in user file order:
 * <ul>
 *   <li>a rule whose id matches a loaded rule replaces it at the same position</li>
 *   <li>a rule with {@code enabled: false} removes the loaded rule with that id</li>
 *   <li>any other rule is appended</li>
 * </ul>
 *
 * <p>A missing user file means built-in rules only. An unreadable or invalid document, or a rule
 * naming an unknown implementation, raises {@link RuleConfigurationException}.
 */
public class RuleSetLoader {

    private static final Logger log = LoggerFactory.getLogger(RuleSetLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Classpath location of the built-in rule document. */
    public static final String BUILTIN_RESOURCE = "/default-rules.yaml";

    private final RuleCatalog catalog;
    private final String builtinResource;

    public RuleSetLoader(RuleCatalog catalog) {
        this(catalog, BUILTIN_RESOURCE);
    }

    RuleSetLoader(RuleCatalog catalog, String builtinResource) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.builtinResource = builtinResource;
    }

    /**
     * Loads built-in rules merged with the user's rule document.
     *
     * @param userRulesFile user rule document, may be null or missing
     * @return rule set in load order
     * @throws RuleConfigurationException if a document is unreadable or a rule is unusable
     */
    public RuleSet load(Path userRulesFile) {
        List<RuleDefinition> definitions = new ArrayList<>(loadBuiltinDefinitions());
        log.debug("Loaded {} built-in rule definitions", definitions.size());

        if (userRulesFile != null && Files.exists(userRulesFile)) {
            List<RuleDefinition> overrides = readDefinitions(userRulesFile);
            definitions = merge(definitions, overrides);
            log.info("Applied {} rule definitions from {}", overrides.size(), userRulesFile);
        } else if (userRulesFile != null) {
            log.debug("No user rules at {}; using built-in rules", userRulesFile);
        }

        List<Rule> rules = new ArrayList<>();
        for (RuleDefinition definition : definitions) {
            rules.add(catalog.create(definition));
        }
        log.info("Loaded {} rules", rules.size());
        return new RuleSet(rules);
    }

    List<RuleDefinition> loadBuiltinDefinitions() {
        try (InputStream input = RuleSetLoader.class.getResourceAsStream(builtinResource)) {
            if (input == null) {
                throw new RuleConfigurationException("Built-in rule document not found: " + builtinResource);
            }
            return validated(YAML_MAPPER.readValue(input, RuleDocument.class), builtinResource);
        } catch (IOException e) {
            throw new RuleConfigurationException("Failed to read built-in rules: " + e.getMessage(), e);
        }
    }

    /**
     * Reads a rule document.
     *
     * @param file rule document
     * @return definitions in file order
     * @throws RuleConfigurationException if the file cannot be read or parsed
     */
    public List<RuleDefinition> readDefinitions(Path file) {
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new RuleConfigurationException("Rule configuration is not readable: " + file);
        }
        try {
            RuleDocument document = YAML_MAPPER.readValue(file.toFile(), RuleDocument.class);
            return validated(document, file.toString());
        } catch (IOException e) {
            throw new RuleConfigurationException("Failed to parse rule configuration " + file + ": " + e.getMessage(), e);
        }
    }

    static List<RuleDefinition> merge(List<RuleDefinition> base, List<RuleDefinition> overrides) {
        List<RuleDefinition> merged = new ArrayList<>(base);
        for (RuleDefinition override : overrides) {
            int index = indexOf(merged, override.id());
            if (!override.isEnabled()) {
                if (index >= 0) {
                    merged.remove(index);
                }
            } else if (index >= 0) {
                merged.set(index, override);
            } else {
                merged.add(override);
            }
        }
        return merged;
    }

    private static int indexOf(List<RuleDefinition> definitions, String id) {
        for (int i = 0; i < definitions.size(); i++) {
            if (definitions.get(i).id().equals(id)) {
                return i;
            }
        }
        return -1;
    }

    private static List<RuleDefinition> validated(RuleDocument document, String source) {
        if (document == null) {
            return List.of();
        }
        List<RuleDefinition> definitions = new ArrayList<>();
        for (RuleDefinition definition : document.rules()) {
            if (definition == null || definition.id() == null || definition.id().isBlank()) {
                throw new RuleConfigurationException("Rule without id in " + source);
            }
            definitions.add(definition);
        }
        return definitions;
    }
}
