package com.doctrace.core.asset;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Everything found under a docs root.
 *
 * @param root docs root directory
 * @param assets diagram and markdown files in path order
 * @param directories every directory below the root, relative and sorted
 * @param otherFiles files that are neither diagrams nor markdown, relative and sorted
 */
public record AssetCollection(Path root, List<Asset> assets, List<String> directories, List<String> otherFiles) {

    public AssetCollection {
        Objects.requireNonNull(root, "root must not be null");
        assets = assets == null ? List.of() : List.copyOf(assets);
        directories = directories == null ? List.of() : List.copyOf(directories);
        otherFiles = otherFiles == null ? List.of() : List.copyOf(otherFiles);
    }
}
