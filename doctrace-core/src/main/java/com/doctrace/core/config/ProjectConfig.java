package com.doctrace.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration of a DocTrace project.
 *
 * <p>Loaded from {@code doctrace.yaml} in the project root. Sections left out of the file take
 * their defaults, so a file may configure only what it needs.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "Checkout"
 *   version: "1.0.0"
 *
 * docs:
 *   directory: docs
 *   rulesFile: doctrace-rules.yaml
 *
 * cache:
 *   enabled: true
 *   file: .doctrace/cache/parse-cache.json
 *   maxAgeDays: 30
 *
 * validation:
 *   parallelism: 4
 *   exemptIds: [PER_Legacy]
 * }</pre>
 *
 * @param project project metadata
 * @param docs docs tree location
 * @param cache parse cache settings
 * @param validation validation pass settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("docs") DocsConfig docs,
    @JsonProperty("cache") CacheConfig cache,
    @JsonProperty("validation") ValidationConfig validation
) {
    public ProjectConfig {
        project = project == null ? new ProjectInfo(null, null) : project;
        docs = docs == null ? new DocsConfig(null, null) : docs;
        cache = cache == null ? new CacheConfig(null, null, null) : cache;
        validation = validation == null ? new ValidationConfig(null, null) : validation;
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(null, null, null, null);
    }

    /**
     * Project metadata.
     *
     * @param name project name
     * @param version project version
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("version") String version
    ) {
        public ProjectInfo {
            name = name == null ? "project" : name;
            version = version == null ? "1.0.0" : version;
        }
    }

    /**
     * Location of the docs tree and of the user's rule document, both relative to the project root.
     *
     * @param directory docs root
     * @param rulesFile user rule overrides; optional on disk
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DocsConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("rulesFile") String rulesFile
    ) {
        public DocsConfig {
            directory = directory == null || directory.isBlank() ? "docs" : directory;
            rulesFile = rulesFile == null || rulesFile.isBlank() ? "doctrace-rules.yaml" : rulesFile;
        }
    }

    /**
     * Parse cache settings.
     *
     * @param enabled false analyzes every file on every pass
     * @param file cache document, relative to the project root
     * @param maxAgeDays age after which {@code prune} drops entries
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CacheConfig(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("file") String file,
        @JsonProperty("maxAgeDays") Integer maxAgeDays
    ) {
        public CacheConfig {
            enabled = enabled == null ? Boolean.TRUE : enabled;
            file = file == null || file.isBlank() ? ".doctrace/cache/parse-cache.json" : file;
            maxAgeDays = maxAgeDays == null || maxAgeDays < 0 ? 30 : maxAgeDays;
        }

        public boolean isEnabled() {
            return enabled;
        }
    }

    /**
     * Validation pass settings.
     *
     * @param parallelism worker threads for analysis and asset rules
     * @param exemptIds ids never reported as orphans
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValidationConfig(
        @JsonProperty("parallelism") Integer parallelism,
        @JsonProperty("exemptIds") List<String> exemptIds
    ) {
        public ValidationConfig {
            parallelism = parallelism == null || parallelism < 1 ? Runtime.getRuntime().availableProcessors() : parallelism;
            exemptIds = exemptIds == null ? List.of() : List.copyOf(exemptIds);
        }
    }
}
