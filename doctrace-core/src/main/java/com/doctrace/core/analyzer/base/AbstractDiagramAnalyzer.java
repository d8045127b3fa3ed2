package com.doctrace.core.analyzer.base;

import com.doctrace.core.analyzer.DiagramAnalysis;
import com.doctrace.core.analyzer.DiagramAnalyzer;
import com.doctrace.core.analyzer.NotationType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Abstract base class for all diagram analyzers.
 *
 * <p>Implements {@link #analyze(String)} as a template: the preamble (front matter and
 * {@code %%} comments) and the opening keyword line are removed, the remaining statement
 * lines are handed to {@link #extract(List, DiagramAnalysis.Builder)}, and any
 * {@link RuntimeException} raised while extracting yields the partial result collected so far.
 *
 * @see DiagramAnalyzer
 */
public abstract class AbstractDiagramAnalyzer implements DiagramAnalyzer {

    /**
     * Logger instance for this analyzer. Initialized with the concrete class name.
     */
    protected final Logger log;

    protected AbstractDiagramAnalyzer() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public final DiagramAnalysis analyze(String content) {
        DiagramAnalysis.Builder builder = new DiagramAnalysis.Builder(getNotationType());
        if (content == null || content.isBlank()) {
            return builder.build();
        }
        try {
            extract(statementLines(content), builder);
        } catch (RuntimeException e) {
            log.debug("Analyzer {} stopped early: {}", getId(), e.getMessage());
        }
        return builder.build();
    }

    /**
     * Walks the statement lines of a diagram and records nodes and relationships.
     *
     * @param lines trimmed, non-empty statement lines following the opening keyword line
     * @param builder collector for the analysis
     */
    protected abstract void extract(List<String> lines, DiagramAnalysis.Builder builder);

    /**
     * Returns whether statement lines should keep their leading whitespace.
     * Indentation-sensitive notations override this.
     *
     * @return true to keep indentation
     */
    protected boolean preservesIndentation() {
        return false;
    }

    private List<String> statementLines(String content) {
        String body = NotationType.stripPreamble(content);
        String[] raw = body.split("\\R");
        List<String> lines = new ArrayList<>();
        // first line carries the opening keyword
        for (int i = 1; i < raw.length; i++) {
            String line = raw[i];
            if (line.isBlank() || line.trim().startsWith("%%")) {
                continue;
            }
            lines.add(preservesIndentation() ? stripTrailing(line) : line.trim());
        }
        return lines;
    }

    private static String stripTrailing(String line) {
        return line.replaceAll("\\s+$", "");
    }
}
