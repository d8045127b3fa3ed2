package com.doctrace.core.asset;

import com.doctrace.core.util.FileUtils;

import java.util.Set;

/**
 * Folder and file naming conventions of a docs tree.
 */
public final class DocsLayout {

    /** Supplementary markdown lives in a {@code footnotes} folder next to the diagrams it annotates. */
    public static final String FOOTNOTES_FOLDER = "footnotes";

    /** Free-form top-level folder exempt from layout policies. */
    public static final String OTHERS_FOLDER = AssetCollector.OTHERS_FOLDER;

    /** The only markdown file allowed at the docs root. */
    public static final String RULES_GUIDE = "RULES_GUIDE.md";

    public static final Set<String> IMAGE_EXTENSIONS = Set.of("png", "jpg", "jpeg", "svg", "gif");

    public static final Set<String> SYSTEM_FOLDERS = Set.of(FOOTNOTES_FOLDER, OTHERS_FOLDER);

    private DocsLayout() {
        // Utility class
    }

    /**
     * Returns the folder that governs a file: its parent directory with a trailing
     * {@code footnotes} segment removed ({@code personas/footnotes/x.md} gives {@code personas}).
     *
     * @param relativePath file path relative to the docs root
     * @return governing folder, empty at the root
     */
    public static String governingFolder(String relativePath) {
        return stripFootnotes(FileUtils.getParent(relativePath));
    }

    /**
     * Removes a trailing {@code footnotes} segment from a directory path.
     *
     * @param directory relative directory path
     * @return directory without footnotes segment
     */
    public static String stripFootnotes(String directory) {
        if (directory.equals(FOOTNOTES_FOLDER)) {
            return "";
        }
        String suffix = "/" + FOOTNOTES_FOLDER;
        return directory.endsWith(suffix) ? directory.substring(0, directory.length() - suffix.length()) : directory;
    }

    public static boolean isInFootnotes(String relativePath) {
        String parent = FileUtils.getParent(relativePath);
        return parent.equals(FOOTNOTES_FOLDER) || parent.endsWith("/" + FOOTNOTES_FOLDER);
    }

    public static boolean isInOthers(String relativePath) {
        return AssetCollector.isInOthers(relativePath);
    }

    /**
     * Returns true if {@code path} is {@code folder} or lies below it.
     *
     * @param folder relative folder, empty for the root
     * @param path relative path
     * @return true if contained
     */
    public static boolean isWithin(String folder, String path) {
        return folder.isEmpty() || path.equals(folder) || path.startsWith(folder + "/");
    }
}
