package com.doctrace.core.analyzer.impl;

import com.doctrace.core.analyzer.DiagramAnalysis;
import com.doctrace.core.model.Relationship;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Functional tests for the state, entity-relationship, class, requirement and C4 analyzers.
 */
class StructuralAnalyzersTest {

    @Test
    void stateAnalyzer_transitionsWithTerminals_excludesTerminalNodes() {
        DiagramAnalysis analysis = new StateDiagramAnalyzer().analyze("""
            stateDiagram-v2
                [*] --> Idle
                Idle --> Running : start
                state "Waiting for input" as Waiting
                Running --> [*]
            """);

        assertThat(analysis.diagramType()).isEqualTo("state");
        assertThat(analysis.nodes()).containsExactly("Idle", "Running", "Waiting");
        assertThat(analysis.relationships()).containsExactly(
            Relationship.of("[*]", "Idle"),
            new Relationship("Idle", "Running", "start"),
            Relationship.of("Running", "[*]")
        );
    }

    @Test
    void erAnalyzer_entitiesAndRelationships_skipsAttributes() {
        DiagramAnalysis analysis = new EntityRelationshipAnalyzer().analyze("""
            erDiagram
                DATA_Customer ||--o{ DATA_Order : "places"
                DATA_Order {
                    string id PK
                    date created
                }
                DATA_Invoice
            """);

        assertThat(analysis.nodes()).containsExactly("DATA_Customer", "DATA_Order", "DATA_Invoice");
        assertThat(analysis.relationships()).containsExactly(new Relationship("DATA_Customer", "DATA_Order", "places"));
    }

    @Test
    void classAnalyzer_declarationsAndRelationships_includesEndpoints() {
        DiagramAnalysis analysis = new ClassDiagramAnalyzer().analyze("""
            classDiagram
                class COMP_Cart {
                    +addItem()
                }
                COMP_Cart "1" --> "*" COMP_Item : contains
                COMP_Base <|-- COMP_Cart
            """);

        assertThat(analysis.nodes()).containsExactly("COMP_Cart", "COMP_Item", "COMP_Base");
        assertThat(analysis.relationships()).containsExactly(
            new Relationship("COMP_Cart", "COMP_Item", "contains"),
            Relationship.of("COMP_Base", "COMP_Cart")
        );
    }

    @Test
    void requirementAnalyzer_blocksAndBothArrowDirections_normalizesEdges() {
        DiagramAnalysis analysis = new RequirementDiagramAnalyzer().analyze("""
            requirementDiagram
                requirement login_req {
                    id: REQ_Login
                    text: Users can log in
                }
                element auth_service {
                    type: service
                }
                auth_service - satisfies -> login_req
                login_req <- traces - other_req
            """);

        assertThat(analysis.nodes()).contains("login_req", "REQ_Login", "auth_service", "other_req");
        assertThat(analysis.relationships()).containsExactly(
            new Relationship("auth_service", "login_req", "satisfies"),
            new Relationship("other_req", "login_req", "traces")
        );
    }

    @Test
    void c4Analyzer_elementsAndRelations_returnsAliases() {
        DiagramAnalysis analysis = new C4DiagramAnalyzer().analyze("""
            C4Context
                Person(PER_Customer, "Customer")
                System_Ext(CTX_Bank, "Bank")
                Rel(PER_Customer, CTX_Bank, "Pays with")
            """);

        assertThat(analysis.diagramType()).isEqualTo("c4");
        assertThat(analysis.nodes()).containsExactly("PER_Customer", "CTX_Bank");
        assertThat(analysis.relationships()).containsExactly(new Relationship("PER_Customer", "CTX_Bank", "Pays with"));
    }
}
