package com.doctrace.core.analyzer.impl;

import com.doctrace.core.analyzer.DiagramAnalysis;
import com.doctrace.core.model.Relationship;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for {@link FlowchartAnalyzer}.
 */
class FlowchartAnalyzerTest {

    private FlowchartAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        analyzer = new FlowchartAnalyzer();
    }

    @Test
    void shouldHaveCorrectMetadata() {
        assertThat(analyzer.getId()).isEqualTo("flowchart-analyzer");
        assertThat(analyzer.getKeywords()).contains("flowchart", "graph");
    }

    @Test
    void analyze_shapesLabelsAndGroups_returnsAllEdges() {
        // Given
        String content = """
            flowchart TD
                A[Start] --> B{Is it?}
                B -->|Yes| C[OK]
                B -- No --> D[End]
                C & D --> E
            """;

        // When
        DiagramAnalysis analysis = analyzer.analyze(content);

        // Then
        assertThat(analysis.nodes()).containsExactly("A", "B", "C", "D", "E");
        assertThat(analysis.relationships()).containsExactly(
            Relationship.of("A", "B"),
            new Relationship("B", "C", "Yes"),
            new Relationship("B", "D", "No"),
            Relationship.of("C", "E"),
            Relationship.of("D", "E")
        );
    }

    @Test
    void analyze_chainOnOneLine_linksEachStep() {
        DiagramAnalysis analysis = analyzer.analyze("""
            graph LR
                REQ_Login --> FLOW_Auth --> COMP_Session
            """);

        assertThat(analysis.relationships()).containsExactly(
            Relationship.of("REQ_Login", "FLOW_Auth"),
            Relationship.of("FLOW_Auth", "COMP_Session")
        );
    }

    @Test
    void analyze_structuralStatements_areIgnored() {
        DiagramAnalysis analysis = analyzer.analyze("""
            flowchart LR
                subgraph Backend
                    API --> DB
                end
                classDef hot fill:#f00
                class API hot
                style DB stroke:#333
                click API "https://example.com"
            """);

        assertThat(analysis.nodes()).containsExactly("API", "DB");
        assertThat(analysis.relationships()).hasSize(1);
    }

    @Test
    void analyze_standaloneNodes_areReportedWithoutEdges() {
        DiagramAnalysis analysis = analyzer.analyze("""
            flowchart TD
                CTX_Shop[Shop]; CTX_Bank((Bank))
            """);

        assertThat(analysis.nodes()).containsExactly("CTX_Shop", "CTX_Bank");
        assertThat(analysis.relationships()).isEmpty();
    }
}
