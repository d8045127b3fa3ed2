package com.doctrace.core.util;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Utility class for file and path operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Checks whether bytes are well-formed UTF-8.
     *
     * @param bytes raw bytes
     * @return true if they decode without malformed or unmappable sequences
     */
    public static boolean isUtf8(byte[] bytes) {
        try {
            StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes));
            return true;
        } catch (CharacterCodingException e) {
            return false;
        }
    }

    /**
     * Gets the file extension in lower case.
     *
     * @param fileName file name or relative path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(String fileName) {
        String name = getFileName(fileName);
        int lastDot = name.lastIndexOf('.');
        return lastDot > 0 ? name.substring(lastDot + 1).toLowerCase(Locale.ROOT) : "";
    }

    /**
     * Gets the file name without its extension ({@code requirements/REQ_Login.mermaid} gives {@code REQ_Login}).
     *
     * @param fileName file name or relative path
     * @return base name
     */
    public static String getBaseName(String fileName) {
        String name = getFileName(fileName);
        int lastDot = name.lastIndexOf('.');
        return lastDot > 0 ? name.substring(0, lastDot) : name;
    }

    /**
     * Gets the last segment of a forward-slash separated path.
     *
     * @param relativePath relative path
     * @return file name
     */
    public static String getFileName(String relativePath) {
        int slash = relativePath.lastIndexOf('/');
        return slash >= 0 ? relativePath.substring(slash + 1) : relativePath;
    }

    /**
     * Gets the parent directory of a forward-slash separated path, or an empty string at the root.
     *
     * @param relativePath relative path
     * @return parent directory
     */
    public static String getParent(String relativePath) {
        int slash = relativePath.lastIndexOf('/');
        return slash >= 0 ? relativePath.substring(0, slash) : "";
    }

    /**
     * Converts a path relative to {@code root} into a forward-slash separated string.
     *
     * @param root root directory
     * @param path path under root
     * @return relative path using {@code /} separators
     */
    public static String toRelativePath(Path root, Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }
}
