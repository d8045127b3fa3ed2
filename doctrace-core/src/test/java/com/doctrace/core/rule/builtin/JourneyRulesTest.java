package com.doctrace.core.rule.builtin;

import com.doctrace.core.model.ValidationReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static com.doctrace.core.rule.builtin.DocsFixture.messages;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for journey syntax, journey coverage and flow traceability.
 */
class JourneyRulesTest {

    private static final String SYNTAX = "journey-syntax";
    private static final String INTEGRITY = "journey-integrity";
    private static final String FLOW_TRACE = "flow-requirement-trace";

    @TempDir
    Path tempDir;

    private DocsFixture docs;

    @BeforeEach
    void setUp() throws IOException {
        docs = new DocsFixture(tempDir).validProject();
    }

    @Test
    void journeySyntax_validJourney_isSatisfied() {
        assertThat(docs.evaluate(SYNTAX).violations()).isEmpty();
    }

    @Test
    void journeySyntax_wrongNotationWithoutPersona_reportsBoth() throws IOException {
        docs.write("journeys/JRN_Bad.mermaid", """
            ---
            id: JRN_Bad
            title: Bad journey
            description: Drawn as a flowchart
            ---
            flowchart TD
              A --> B
            """);

        assertThat(messages(docs.evaluate(SYNTAX), SYNTAX)).containsExactly(
            "Journeys must use \"sequenceDiagram\" notation.",
            "Journey \"JRN_Bad\" must trace to a persona (uplink: PER_...).");
    }

    @Test
    void journeyRules_personaDrawnAsParticipant_tracesJourneyToPersona() throws IOException {
        // Given: front matter names only the requirement
        docs.write("journeys/JRN_Login.mermaid", DocsFixture.journey("JRN_Login", "uplinks: [REQ_Login]\n"));

        // When
        ValidationReport report = docs.evaluate("persona-gate", SYNTAX, INTEGRITY);

        // Then
        assertThat(report.forRule(SYNTAX)).isEmpty();
        assertThat(report.forRule(INTEGRITY)).isEmpty();
    }

    @Test
    void journeyIntegrity_validProject_isSatisfied() {
        assertThat(docs.evaluate("persona-gate", INTEGRITY).forRule(INTEGRITY)).isEmpty();
    }

    @Test
    void journeyIntegrity_uncoveredBehavioralPersona_isReportedButNotInfluencer() throws IOException {
        // Given
        docs.write("personas/PER_Bot.mermaid", DocsFixture.persona("PER_Bot", "Proxy", ""))
            .write("personas/PER_Boss.mermaid", DocsFixture.persona("PER_Boss", "Influencer", ""));

        // When
        ValidationReport report = docs.evaluate("persona-gate", INTEGRITY);

        // Then
        assertThat(messages(report, INTEGRITY)).containsExactly(
            "Behavioral stakeholder without journey: Proxy \"PER_Bot\" has no associated journey.");
        assertThat(report.passed()).isTrue();
    }

    @Test
    void journeyIntegrity_uncoveredFunctionalRequirement_isReported() throws IOException {
        docs.write("requirements/REQ_Export.mermaid", DocsFixture.requirement("REQ_Export", "uplink: PER_User\n"))
            .write("requirements/REQ_Speed.mermaid",
                DocsFixture.requirement("REQ_Speed", "uplink: PER_User\nclassification: Non-Functional\n"));

        assertThat(messages(docs.evaluate("persona-gate", INTEGRITY), INTEGRITY)).containsExactly(
            "Unvalidated requirement: functional requirement \"REQ_Export\" has no associated journey.");
    }

    @Test
    void flowRequirementTrace_flowWithoutRequirement_isReported() throws IOException {
        docs.write("flows/FLOW_Batch.mermaid", DocsFixture.flow("FLOW_Batch", ""));

        assertThat(messages(docs.evaluate(FLOW_TRACE), FLOW_TRACE))
            .containsExactly("Untraced flow: \"FLOW_Batch\" must trace to a requirement (REQ_...).");
    }

    @Test
    void flowRequirementTrace_requirementsField_countsAsTrace() throws IOException {
        docs.write("flows/FLOW_Batch.mermaid", DocsFixture.flow("FLOW_Batch", "requirements: [REQ_Login]\n"));

        assertThat(docs.evaluate(FLOW_TRACE).violations()).isEmpty();
    }
}
