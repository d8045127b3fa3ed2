package com.doctrace.core.rule.builtin;

import com.doctrace.core.asset.Asset;
import com.doctrace.core.graph.NodeMetadata;
import com.doctrace.core.graph.ProjectContext;
import com.doctrace.core.model.Enforcement;
import com.doctrace.core.model.ValidationReport;
import com.doctrace.core.rule.Rule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static com.doctrace.core.rule.builtin.DocsFixture.messages;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the persona gate, persona diversity and persona-requirement connectivity rules.
 */
class PersonaRulesTest {

    private static final String GATE = "persona-gate";
    private static final String DIVERSITY = "persona-diversity";
    private static final String TRACE = "persona-requirement-trace";

    @TempDir
    Path tempDir;

    private DocsFixture docs;

    @BeforeEach
    void setUp() throws IOException {
        docs = new DocsFixture(tempDir).validProject();
    }

    @Test
    void personaGate_validPersona_recordsPersonaType() {
        // Given
        ProjectContext context = docs.context();
        Rule gate = DocsFixture.DEFAULT_RULES.find(GATE).orElseThrow();
        Asset persona = context.assets().stream()
            .filter(asset -> "PER_User".equals(asset.id()))
            .findFirst()
            .orElseThrow();

        // When
        assertThat(gate.validate(persona, context)).isEmpty();

        // Then
        assertThat(context.node("PER_User").orElseThrow().metadata().getString(NodeMetadata.PERSONA_TYPE))
            .contains("actor");
    }

    @Test
    void personaGate_missingGoalsBranch_reportsExactlyOneError() throws IOException {
        // Given
        docs.write("personas/PER_Admin.mermaid", """
            ---
            id: PER_Admin
            title: Administrator
            description: Keeps the shop running
            ---
            mindmap
              root((PER_Admin))
                Role
                  Operator
                Description
                  Manages the catalogue
                Type: Guardian
            """);

        // When
        ValidationReport report = docs.evaluate(GATE);

        // Then
        assertThat(report.violations()).singleElement().satisfies(violation -> {
            assertThat(violation.filePath()).isEqualTo("personas/PER_Admin.mermaid");
            assertThat(violation.message()).isEqualTo("Persona mindmap: missing required branch \"Goals\"");
            assertThat(violation.severity()).isEqualTo(Enforcement.ERROR);
        });
        assertThat(report.passed()).isFalse();
    }

    @Test
    void personaGate_wrongNotationAndInvalidType_areReported() throws IOException {
        docs.write("personas/PER_Bot.mermaid", """
            ---
            id: PER_Bot
            title: Bot
            description: Automated client
            ---
            graph TD
              Role --> Description
              Description --> Goals
              Goals --> Type(Robot)
            """);

        assertThat(messages(docs.evaluate(GATE), GATE)).containsExactly(
            "Personas must use \"mindmap\" notation.",
            "Persona mindmap: invalid persona type \"robot\". Must be one of: [Actor, Influencer, Guardian, Proxy]");
    }

    @Test
    void personaGate_missingType_isReported() throws IOException {
        docs.write("personas/PER_Nobody.mermaid", """
            ---
            id: PER_Nobody
            ---
            mindmap
              root((PER_Nobody))
                Role
                Description
                Goals
            """);

        assertThat(messages(docs.evaluate(GATE), GATE))
            .containsExactly("Persona mindmap: missing \"Type: <value>\" node (e.g. Type: Actor).");
    }

    @Test
    void personaDiversity_onlyActors_warnsAboutMissingTypes() {
        ValidationReport report = docs.evaluate(GATE, DIVERSITY);

        assertThat(messages(report, DIVERSITY))
            .containsExactly("Missing mandatory persona types: [Influencer, Guardian, Proxy]");
        assertThat(report.forRule(DIVERSITY).get(0).severity()).isEqualTo(Enforcement.WARNING);
        assertThat(report.passed()).isTrue();
    }

    @Test
    void personaDiversity_allTypesPresent_isSatisfied() throws IOException {
        docs.write("personas/PER_Boss.mermaid", DocsFixture.persona("PER_Boss", "Influencer", ""))
            .write("personas/PER_Auditor.mermaid", DocsFixture.persona("PER_Auditor", "Guardian", ""))
            .write("personas/PER_Agent.mermaid", DocsFixture.persona("PER_Agent", "proxy", ""));

        assertThat(docs.evaluate(GATE, DIVERSITY).forRule(DIVERSITY)).isEmpty();
    }

    @Test
    void personaRequirementTrace_validProject_isSatisfied() {
        assertThat(docs.evaluate(TRACE).violations()).isEmpty();
    }

    @Test
    void personaRequirementTrace_personaWithoutRequirement_isGhost() throws IOException {
        docs.write("personas/PER_Boss.mermaid", DocsFixture.persona("PER_Boss", "Influencer", ""));

        assertThat(messages(docs.evaluate(TRACE), TRACE))
            .containsExactly("Ghost persona: \"PER_Boss\" drives no requirement.");
    }

    @Test
    void personaRequirementTrace_requirementUplinkToPersona_countsAsLink() throws IOException {
        docs.write("personas/PER_Boss.mermaid", DocsFixture.persona("PER_Boss", "Influencer", ""))
            .write("requirements/REQ_Reports.mermaid", DocsFixture.requirement("REQ_Reports", "uplink: PER_Boss\n"));

        assertThat(docs.evaluate(TRACE).violations()).isEmpty();
    }

    @Test
    void personaRequirementTrace_requirementWithoutPersona_isAbandoned() throws IOException {
        docs.write("requirements/REQ_Export.mermaid", DocsFixture.requirement("REQ_Export", ""));

        assertThat(messages(docs.evaluate(TRACE), TRACE))
            .containsExactly("Abandoned requirement: main requirement \"REQ_Export\" has no linked persona.");
    }

    @Test
    void personaRequirementTrace_personaLinkedToSubRequirement_isReported() throws IOException {
        docs.write("personas/PER_User.mermaid",
                DocsFixture.persona("PER_User", "Actor", "downlinks: [REQ_Login, REQ_Login_Sso]\n"))
            .write("requirements/REQ_Login_Sso.mermaid",
                DocsFixture.requirement("REQ_Login_Sso", "uplinks: [REQ_Login, PER_User]\n"));

        assertThat(messages(docs.evaluate(TRACE), TRACE)).containsExactly(
            "Persona \"PER_User\" is linked to sub-requirement \"REQ_Login_Sso\"; link its main requirement instead.");
    }
}
