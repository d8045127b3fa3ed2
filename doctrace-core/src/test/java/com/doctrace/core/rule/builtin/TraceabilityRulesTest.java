package com.doctrace.core.rule.builtin;

import com.doctrace.core.model.Enforcement;
import com.doctrace.core.model.ValidationReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static com.doctrace.core.rule.builtin.DocsFixture.messages;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for duplicate-id, reciprocity, orphan and dangling-reference detection.
 */
class TraceabilityRulesTest {

    private static final String ORPHAN = "global-traceability";

    @TempDir
    Path tempDir;

    private DocsFixture docs;

    @BeforeEach
    void setUp() throws IOException {
        docs = new DocsFixture(tempDir).validProject();
    }

    @Test
    void duplicateId_sameIdInTwoFiles_reportsOneViolationNamingBoth() throws IOException {
        // Given
        docs.write("flows/DUP_1.mermaid", DocsFixture.flow("DUP_1", ""))
            .write("sequences/DUP_1.mermaid", "---\nid: DUP_1\n---\nsequenceDiagram\n");

        // When
        ValidationReport report = docs.evaluate("duplicate-id");

        // Then
        assertThat(messages(report, "duplicate-id"))
            .containsExactly("Duplicate id \"DUP_1\" declared in: flows/DUP_1.mermaid, sequences/DUP_1.mermaid");
        assertThat(report.passed()).isFalse();
    }

    @Test
    void reciprocity_validProject_hasNoViolations() {
        assertThat(docs.evaluate("reciprocity").violations()).isEmpty();
    }

    @Test
    void reciprocity_downlinkWithoutMatchingUplink_isReportedOnDeclaringFile() throws IOException {
        docs.write("requirements/REQ_Login.mermaid", DocsFixture.requirement("REQ_Login", "downlinks: [FLOW_Login]\n"));

        ValidationReport report = docs.evaluate("reciprocity");

        assertThat(report.violations()).singleElement().satisfies(violation -> {
            assertThat(violation.filePath()).isEqualTo("personas/PER_User.mermaid");
            assertThat(violation.message()).isEqualTo(
                "Broken reciprocity: \"PER_User\" lists \"REQ_Login\" as a downlink but \"REQ_Login\" has no uplink to \"PER_User\"");
        });
    }

    @Test
    void reciprocity_downlinkToUndeclaredId_isLeftToDanglingCheck() throws IOException {
        docs.write("personas/PER_User.mermaid",
            DocsFixture.persona("PER_User", "Actor", "downlinks: [REQ_Login, REQ_Missing]\n"));

        assertThat(docs.evaluate("reciprocity").violations()).isEmpty();
        assertThat(messages(docs.evaluate("dangling-reference"), "dangling-reference")).containsExactly(
            "Dangling reference: downlink \"REQ_Missing\" of \"PER_User\" is not declared by any document.");
    }

    @Test
    void orphan_validProject_hasNoViolations() {
        assertThat(docs.evaluate(ORPHAN).violations()).isEmpty();
    }

    @Test
    void orphan_removingOnlyReference_producesOrphan() throws IOException {
        // Given: the requirement no longer lists the flow, and flows/ has no category
        docs.write("requirements/REQ_Login.mermaid", DocsFixture.requirement("REQ_Login", "uplink: PER_User\n"));

        // When
        ValidationReport report = docs.evaluate(ORPHAN);

        // Then
        assertThat(report.violations()).singleElement().satisfies(violation -> {
            assertThat(violation.filePath()).isEqualTo("flows/FLOW_Login.mermaid");
            assertThat(violation.message()).startsWith("Orphan detected: \"FLOW_Login\" is not referenced");
            assertThat(violation.severity()).isEqualTo(Enforcement.ERROR);
        });
    }

    @Test
    void orphan_diagramMention_countsAsReference() throws IOException {
        docs.write("requirements/REQ_Login.mermaid", DocsFixture.requirement("REQ_Login", "uplink: PER_User\n"))
            .write("sequences/SEQ_Login.mermaid", """
                ---
                id: SEQ_Login
                title: Login sequence
                description: Calls made during login
                ---
                sequenceDiagram
                    participant SEQ_Login
                    participant FLOW_Login
                    SEQ_Login->>FLOW_Login: runs
                """);

        ValidationReport report = docs.evaluate(ORPHAN);

        assertThat(report.violations()).extracting(violation -> violation.filePath())
            .containsExactly("sequences/SEQ_Login.mermaid");
    }

    @Test
    void orphan_entityOwnedByItsFile_isNotAnOrphan() throws IOException {
        docs.write("flows/FLOW_Login.mermaid",
            DocsFixture.flow("FLOW_Login", "uplink: REQ_Login\nentities:\n  - id: FLOW_Step\n"));

        assertThat(docs.evaluate(ORPHAN).violations()).isEmpty();
    }

    @Test
    void orphan_footnotesAreExempt() throws IOException {
        docs.write("flows/footnotes/FLOW_Login_Notes.md", "---\nid: FLOW_Login_Notes\ntitle: t\ndescription: d\n---\n");

        assertThat(docs.evaluate(ORPHAN).violations()).isEmpty();
    }

    @Test
    void danglingReference_journeyToUndeclaredPersona_isNotAnOrphan() throws IOException {
        // Given
        docs.write("journeys/JRN_Lost.mermaid", DocsFixture.journey("JRN_Lost", "uplink: PER_Ghost\n"));

        // When
        ValidationReport report = docs.evaluate(ORPHAN, "dangling-reference");

        // Then
        assertThat(report.forRule(ORPHAN)).isEmpty();
        assertThat(report.forRule("dangling-reference")).singleElement().satisfies(violation -> {
            assertThat(violation.filePath()).isEqualTo("journeys/JRN_Lost.mermaid");
            assertThat(violation.message()).isEqualTo(
                "Dangling reference: uplink \"PER_Ghost\" of \"JRN_Lost\" is not declared by any document.");
        });
    }

    @Test
    void danglingReference_entityRequirements_areChecked() throws IOException {
        docs.write("requirements/REQ_Search.mermaid", DocsFixture.requirement("REQ_Search", """
            uplink: PER_User
            entities:
              - id: REQ_Index
                requirements: [REQ_Nowhere, REQ_Nowhere]
            """));

        assertThat(messages(docs.evaluate("dangling-reference"), "dangling-reference")).containsExactly(
            "Dangling reference: requirement \"REQ_Nowhere\" of \"REQ_Index\" is not declared by any document.");
    }
}
