package com.doctrace.core.pipeline;

import com.doctrace.core.config.ProjectConfig;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;

/**
 * Inputs of one validation pass.
 *
 * @param docsRoot root of the docs tree
 * @param rulesFile user rule document, may be null or missing on disk
 * @param parallelism worker threads for analysis and asset-level rules
 * @param exemptIds extra ids never reported as orphans
 */
public record PipelineOptions(Path docsRoot, Path rulesFile, int parallelism, Set<String> exemptIds) {

    public PipelineOptions {
        Objects.requireNonNull(docsRoot, "docsRoot must not be null");
        parallelism = Math.max(1, parallelism);
        exemptIds = exemptIds == null ? Set.of() : Set.copyOf(exemptIds);
    }

    /**
     * Resolves the options of a project from its configuration.
     *
     * @param projectRoot project root directory
     * @param config loaded configuration
     * @return options with paths resolved against the project root
     */
    public static PipelineOptions fromConfig(Path projectRoot, ProjectConfig config) {
        return new PipelineOptions(
            projectRoot.resolve(config.docs().directory()),
            projectRoot.resolve(config.docs().rulesFile()),
            config.validation().parallelism(),
            Set.copyOf(config.validation().exemptIds())
        );
    }
}
