package com.doctrace.core.asset;

import com.doctrace.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Walks a docs root and reads every diagram ({@code .mermaid}) and markdown ({@code .md}) file.
 *
 * <p>Hidden files and directories (names starting with {@code .}) are skipped. The top-level
 * {@code others} folder is free-form storage: its directories are listed, its files are not
 * read as assets.
 *
 * <p>A file that is not valid UTF-8 is still collected, with undecodable bytes replaced, so one
 * badly encoded document never aborts the pass.
 */
public class AssetCollector {

    private static final Logger log = LoggerFactory.getLogger(AssetCollector.class);

    static final String OTHERS_FOLDER = "others";

    /**
     * Collects the assets under a docs root.
     *
     * @param docsRoot docs root directory
     * @return collected assets, directories and other files
     * @throws AssetCollectionException if the root is missing or a file cannot be read from disk
     */
    public AssetCollection collect(Path docsRoot) {
        Path root = docsRoot.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new AssetCollectionException("Docs directory not found: " + root, null);
        }

        List<Asset> assets = new ArrayList<>();
        List<String> directories = new ArrayList<>();
        List<String> otherFiles = new ArrayList<>();

        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = walk
                .filter(path -> !path.equals(root))
                .filter(path -> !isHidden(root, path))
                .sorted(Comparator.comparing(path -> FileUtils.toRelativePath(root, path)))
                .toList();
        } catch (IOException | UncheckedIOException e) {
            throw new AssetCollectionException("Failed to walk docs directory: " + root, e);
        }

        for (Path path : paths) {
            String relativePath = FileUtils.toRelativePath(root, path);
            if (Files.isDirectory(path)) {
                directories.add(relativePath);
                continue;
            }
            String extension = FileUtils.getExtension(relativePath);
            boolean documentation = Asset.DIAGRAM_EXTENSION.equals(extension) || Asset.MARKDOWN_EXTENSION.equals(extension);
            if (!documentation || isInOthers(relativePath)) {
                otherFiles.add(relativePath);
                continue;
            }
            assets.add(read(relativePath, path));
        }

        log.info("Collected {} assets from {}", assets.size(), root);
        log.debug("Found {} directories and {} other files", directories.size(), otherFiles.size());
        return new AssetCollection(root, assets, directories, otherFiles);
    }

    private Asset read(String relativePath, Path path) {
        try {
            byte[] bytes = Files.readAllBytes(path);
            if (!FileUtils.isUtf8(bytes)) {
                log.warn("{} is not valid UTF-8; undecodable bytes were replaced", relativePath);
            }
            Asset asset = Asset.of(relativePath, path, new String(bytes, StandardCharsets.UTF_8));
            if (asset.frontMatterError() != null) {
                log.warn("Invalid front matter in {}: {}", relativePath, asset.frontMatterError());
            }
            return asset;
        } catch (IOException e) {
            throw new AssetCollectionException("Failed to read asset: " + path, e);
        }
    }

    static boolean isInOthers(String relativePath) {
        return relativePath.equals(OTHERS_FOLDER) || relativePath.startsWith(OTHERS_FOLDER + "/");
    }

    private static boolean isHidden(Path root, Path path) {
        for (Path segment : root.relativize(path)) {
            if (segment.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }
}
