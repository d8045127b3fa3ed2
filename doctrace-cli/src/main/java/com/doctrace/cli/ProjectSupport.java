package com.doctrace.cli;

import com.doctrace.core.cache.ParseCache;
import com.doctrace.core.config.ConfigLoader;
import com.doctrace.core.config.ProjectConfig;

import java.nio.file.Path;

/**
 * Resolves a project's configuration and parse cache for commands.
 *
 * @param root absolute project root
 * @param config loaded configuration
 */
record ProjectSupport(Path root, ProjectConfig config) {

    static ProjectSupport load(Path projectPath) {
        Path root = projectPath.toAbsolutePath().normalize();
        return new ProjectSupport(root, ConfigLoader.loadFromProject(root));
    }

    Path cacheFile() {
        return root.resolve(config.cache().file());
    }

    ParseCache openCache() {
        return config.cache().isEnabled() ? ParseCache.open(cacheFile()) : ParseCache.inMemory();
    }
}
