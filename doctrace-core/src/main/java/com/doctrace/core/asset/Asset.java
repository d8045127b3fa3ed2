package com.doctrace.core.asset;

import com.doctrace.core.util.FileUtils;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One documentation file with its parsed front matter. Immutable for the duration of a pass.
 *
 * @param relativePath path relative to the docs root, {@code /}-separated
 * @param absolutePath absolute file path
 * @param rawContent full file content
 * @param body content after the front-matter block
 * @param frontMatter parsed front matter
 * @param frontMatterError YAML error text when the block could not be parsed, otherwise null
 */
public record Asset(
    String relativePath,
    Path absolutePath,
    String rawContent,
    String body,
    FrontMatter frontMatter,
    String frontMatterError
) {
    public static final String DIAGRAM_EXTENSION = "mermaid";
    public static final String MARKDOWN_EXTENSION = "md";

    public Asset {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        rawContent = rawContent == null ? "" : rawContent;
        body = body == null ? rawContent : body;
        frontMatter = frontMatter == null ? FrontMatter.empty() : frontMatter;
    }

    /**
     * Creates an asset by parsing the front matter of the given content.
     *
     * @param relativePath path relative to the docs root
     * @param absolutePath absolute file path
     * @param rawContent full file content
     * @return asset
     */
    public static Asset of(String relativePath, Path absolutePath, String rawContent) {
        FrontMatterParser.ParsedDocument parsed = new FrontMatterParser().parse(rawContent);
        return new Asset(relativePath, absolutePath, rawContent, parsed.body(), parsed.frontMatter(), parsed.error());
    }

    public String id() {
        return frontMatter.id();
    }

    public boolean isDiagram() {
        return DIAGRAM_EXTENSION.equals(extension());
    }

    public boolean isMarkdown() {
        return MARKDOWN_EXTENSION.equals(extension());
    }

    public String extension() {
        return FileUtils.getExtension(relativePath);
    }

    public String baseName() {
        return FileUtils.getBaseName(relativePath);
    }

    public String directory() {
        return FileUtils.getParent(relativePath);
    }

    /**
     * First non-blank line of the body, trimmed. This is where a diagram's notation keyword lives.
     *
     * @return first body line or an empty string
     */
    public String firstLine() {
        for (String line : body.split("\\R")) {
            if (!line.isBlank()) {
                return line.trim();
            }
        }
        return "";
    }
}
