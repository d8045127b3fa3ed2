package com.doctrace.core.analyzer;

import java.util.List;

/**
 * Extracts identifiers and relationships from the source text of one diagram notation.
 *
 * <p>Analyzers are discovered via Java Service Provider Interface (SPI) and are stateless:
 * the same text always yields an element-for-element identical {@link DiagramAnalysis}.
 * Malformed input never throws; it produces an empty or partial analysis. Detecting
 * malformed syntax is the job of rules, not analyzers.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.doctrace.core.analyzer.DiagramAnalyzer}
 *
 * @see AnalyzerRegistry
 * @see DiagramAnalysis
 */
public interface DiagramAnalyzer {

    /**
     * Returns unique identifier for this analyzer (kebab-case, e.g. "sequence-analyzer").
     *
     * @return unique analyzer identifier
     */
    String getId();

    /**
     * Returns human-readable display name used in CLI output and logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the notation family this analyzer handles.
     *
     * @return notation type
     */
    NotationType getNotationType();

    /**
     * Returns the opening keywords this analyzer accepts.
     *
     * @return keywords of {@link #getNotationType()}
     */
    default List<String> getKeywords() {
        return getNotationType().keywords();
    }

    /**
     * Analyzes raw diagram text.
     *
     * @param content diagram source, optionally preceded by a front-matter block
     * @return analysis; never {@code null}
     */
    DiagramAnalysis analyze(String content);
}
