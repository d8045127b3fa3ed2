package com.doctrace.core.analyzer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Selects the analyzer for a diagram by its opening keyword and runs it.
 *
 * <p>Analyzers are discovered via {@link ServiceLoader}. Text whose notation is not recognized
 * yields an empty analysis typed {@code unknown}; an analyzer failure yields an empty analysis
 * of the detected type. {@link #analyze(String)} never throws.
 */
public class AnalyzerRegistry {

    private static final Logger log = LoggerFactory.getLogger(AnalyzerRegistry.class);

    private final Map<NotationType, DiagramAnalyzer> analyzers = new EnumMap<>(NotationType.class);

    /**
     * Creates a registry holding the given analyzers. When two analyzers declare the same
     * notation, the first one wins.
     *
     * @param analyzers analyzer instances
     */
    public AnalyzerRegistry(List<? extends DiagramAnalyzer> analyzers) {
        for (DiagramAnalyzer analyzer : analyzers) {
            DiagramAnalyzer previous = this.analyzers.putIfAbsent(analyzer.getNotationType(), analyzer);
            if (previous != null) {
                log.warn("Analyzer {} ignored: notation {} already handled by {}",
                    analyzer.getId(), analyzer.getNotationType().id(), previous.getId());
            }
        }
    }

    /**
     * Creates a registry from every analyzer registered through SPI.
     *
     * @return registry with discovered analyzers
     */
    public static AnalyzerRegistry discover() {
        List<DiagramAnalyzer> discovered = new ArrayList<>();
        ServiceLoader.load(DiagramAnalyzer.class).forEach(discovered::add);
        log.debug("Discovered {} diagram analyzers", discovered.size());
        return new AnalyzerRegistry(discovered);
    }

    public List<DiagramAnalyzer> getAnalyzers() {
        return Collections.unmodifiableList(new ArrayList<>(analyzers.values()));
    }

    public Optional<DiagramAnalyzer> analyzerFor(NotationType notation) {
        return Optional.ofNullable(analyzers.get(notation));
    }

    /**
     * Detects the notation of raw diagram text and analyzes it.
     *
     * @param content raw diagram text, optionally with front matter
     * @return analysis; empty and typed {@code unknown} when no analyzer matches
     */
    public DiagramAnalysis analyze(String content) {
        NotationType notation = NotationType.detect(content);
        DiagramAnalyzer analyzer = analyzers.get(notation);
        if (analyzer == null) {
            return DiagramAnalysis.empty(NotationType.UNKNOWN);
        }
        try {
            return analyzer.analyze(content);
        } catch (RuntimeException e) {
            log.warn("Analyzer {} failed: {}", analyzer.getId(), e.getMessage());
            return DiagramAnalysis.empty(notation);
        }
    }
}
