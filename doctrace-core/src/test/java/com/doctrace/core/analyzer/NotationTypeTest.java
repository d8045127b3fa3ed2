package com.doctrace.core.analyzer;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link NotationType} detection.
 */
class NotationTypeTest {

    @ParameterizedTest
    @CsvSource({
        "graph, FLOWCHART",
        "flowchart-elk, FLOWCHART",
        "sequenceDiagram, SEQUENCE",
        "SEQUENCEDIAGRAM, SEQUENCE",
        "stateDiagram-v2, STATE",
        "erDiagram, ENTITY_RELATIONSHIP",
        "mindmap, MINDMAP",
        "requirementDiagram, REQUIREMENT",
        "C4Deployment, C4",
        "classDiagram-v2, CLASS",
        "gantt, UNKNOWN"
    })
    void fromKeyword_knownAndUnknownKeywords_resolvesNotation(String keyword, NotationType expected) {
        assertThat(NotationType.fromKeyword(keyword)).isEqualTo(expected);
    }

    @Test
    void detect_frontMatterAndComments_skipsPreamble() {
        String content = """
            ---
            id: SEQ_Order
            title: Order
            ---
            %% generated
            %% do not edit
            sequenceDiagram
                A->>B: go
            """;

        assertThat(NotationType.detect(content)).isEqualTo(NotationType.SEQUENCE);
        assertThat(NotationType.openingKeyword(content)).isEqualTo("sequenceDiagram");
    }

    @Test
    void detect_emptyContent_returnsUnknown() {
        assertThat(NotationType.detect("")).isEqualTo(NotationType.UNKNOWN);
        assertThat(NotationType.detect(null)).isEqualTo(NotationType.UNKNOWN);
    }

    @Test
    void fromId_storedId_roundTripsNotation() {
        assertThat(NotationType.fromId(NotationType.ENTITY_RELATIONSHIP.id())).isEqualTo(NotationType.ENTITY_RELATIONSHIP);
        assertThat(NotationType.fromId("nope")).isEqualTo(NotationType.UNKNOWN);
    }
}
