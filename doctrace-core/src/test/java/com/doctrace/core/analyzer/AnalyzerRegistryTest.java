package com.doctrace.core.analyzer;

import com.doctrace.core.analyzer.impl.FlowchartAnalyzer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AnalyzerRegistry}.
 */
class AnalyzerRegistryTest {

    @Test
    void analyze_unknownNotation_returnsEmptyUnknownAnalysis() {
        AnalyzerRegistry registry = AnalyzerRegistry.discover();

        DiagramAnalysis analysis = registry.analyze("gantt\n    title Plan\n");

        assertThat(analysis.diagramType()).isEqualTo("unknown");
        assertThat(analysis.isEmpty()).isTrue();
    }

    @Test
    void analyze_failingAnalyzer_returnsEmptyAnalysisOfDetectedNotation() {
        // Given
        DiagramAnalyzer failing = new DiagramAnalyzer() {
            @Override
            public String getId() {
                return "failing";
            }

            @Override
            public String getDisplayName() {
                return "Failing";
            }

            @Override
            public NotationType getNotationType() {
                return NotationType.MINDMAP;
            }

            @Override
            public DiagramAnalysis analyze(String content) {
                throw new IllegalStateException("boom");
            }
        };
        AnalyzerRegistry registry = new AnalyzerRegistry(List.of(failing));

        // When
        DiagramAnalysis analysis = registry.analyze("mindmap\n  Topic\n");

        // Then
        assertThat(analysis.diagramType()).isEqualTo("mindmap");
        assertThat(analysis.isEmpty()).isTrue();
    }

    @Test
    void constructor_duplicateNotation_keepsFirstAnalyzer() {
        FlowchartAnalyzer first = new FlowchartAnalyzer();
        FlowchartAnalyzer second = new FlowchartAnalyzer();

        AnalyzerRegistry registry = new AnalyzerRegistry(List.of(first, second));

        assertThat(registry.getAnalyzers()).hasSize(1);
        assertThat(registry.analyzerFor(NotationType.FLOWCHART)).containsSame(first);
    }
}
