package com.doctrace.cli;

import com.doctrace.DocTraceCLI;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the validate, cache and list commands run through {@link DocTraceCLI}.
 */
class CommandsTest {

    @TempDir
    Path projectRoot;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        out = new StringWriter();
        err = new StringWriter();
        writeDoc("personas/PER_User.mermaid", """
            ---
            id: PER_User
            title: User
            description: Person shopping online
            downlinks: [REQ_Login]
            ---
            mindmap
              root((PER_User))
                Role
                  Shopper
                Description
                  Buys things online
                Goals
                  GOAL_Fast[Fast checkout]
                Type: Actor
            """);
        writeDoc("requirements/REQ_Login.mermaid", """
            ---
            id: REQ_Login
            title: Login
            description: Users sign in
            uplink: PER_User
            downlinks: [FLOW_Login]
            ---
            requirementDiagram
                requirement login {
                    id: REQ_Login
                    text: the user can sign in
                }
            """);
        writeDoc("journeys/JRN_Login.mermaid", """
            ---
            id: JRN_Login
            title: Login journey
            description: User signs in
            uplinks: [PER_User, REQ_Login]
            ---
            sequenceDiagram
                participant PER_User
                participant COMP_Auth
                PER_User->>COMP_Auth: Login
            """);
        writeDoc("flows/FLOW_Login.mermaid", """
            ---
            id: FLOW_Login
            title: Login flow
            description: Steps of signing in
            uplink: REQ_Login
            ---
            flowchart TD
                Start[Open page] --> Submit[Submit credentials]
            """);
    }

    private void writeDoc(String relativePath, String content) throws IOException {
        Path file = projectRoot.resolve("docs").resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private int run(String... args) {
        CommandLine commandLine = DocTraceCLI.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    // ==================== validate ====================

    @Test
    void validate_validProject_exitsZeroAndPrintsWarnings() {
        // When
        int exitCode = run("validate", projectRoot.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("Warnings (1):")
            .contains("[persona-diversity]")
            .doesNotContain("Errors (")
            .contains("4 assets, 25 rules: 0 errors, 1 warnings")
            .contains("✓ Validation passed");
        assertThat(projectRoot.resolve(".doctrace/cache/parse-cache.json")).exists();
    }

    @Test
    void validate_untracedFlow_exitsOneAndListsError() throws IOException {
        // Given
        writeDoc("flows/FLOW_Batch.mermaid", """
            ---
            id: FLOW_Batch
            title: Batch flow
            description: Nightly export
            ---
            flowchart TD
                A[Collect] --> B[Export]
            """);

        // When
        int exitCode = run("validate", projectRoot.toString());

        // Then
        assertThat(exitCode).isEqualTo(ValidateCommand.EXIT_FAILED);
        assertThat(out.toString())
            .contains("[flow-requirement-trace] project: Untraced flow: \"FLOW_Batch\"")
            .contains("✗ Validation failed");
    }

    @Test
    void validate_invalidRulesFile_exitsTwo() throws IOException {
        // Given
        Files.writeString(projectRoot.resolve("doctrace-rules.yaml"), "rules: [unclosed\n");

        // When
        int exitCode = run("validate", projectRoot.toString());

        // Then
        assertThat(exitCode).isEqualTo(ValidateCommand.EXIT_UNUSABLE);
        assertThat(err.toString()).contains("✗ Validation aborted");
    }

    @Test
    void validate_configuredDocsDirectoryMissing_exitsTwo() throws IOException {
        // Given
        Files.writeString(projectRoot.resolve("doctrace.yaml"), """
            docs:
              directory: documentation
            """);

        // When
        int exitCode = run("validate", projectRoot.toString());

        // Then
        assertThat(exitCode).isEqualTo(ValidateCommand.EXIT_UNUSABLE);
    }

    // ==================== cache ====================

    @Test
    void cache_statsAfterValidation_reportsAnalyzedDiagrams() {
        // Given
        run("validate", projectRoot.toString());
        out.getBuffer().setLength(0);

        // When
        int exitCode = run("cache", "stats", projectRoot.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("Entries: 4")
            .contains("Tracked files: 4");
    }

    @Test
    void cache_clear_emptiesCache() {
        // Given
        run("validate", projectRoot.toString());

        // When
        int exitCode = run("cache", "clear", projectRoot.toString());
        out.getBuffer().setLength(0);
        run("cache", "stats", projectRoot.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("Entries: 0");
    }

    @Test
    void cache_unknownAction_exitsOne() {
        assertThat(run("cache", "compact", projectRoot.toString())).isEqualTo(1);
    }

    // ==================== list ====================

    @Test
    void list_analyzers_printsDiscoveredAnalyzers() {
        // When
        int exitCode = run("list", "analyzers");

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("Available Analyzers:")
            .contains("(ID: flowchart-analyzer)");
    }

    @Test
    void list_rulesWithOverride_omitsRemovedRule() throws IOException {
        // Given
        Files.writeString(projectRoot.resolve("doctrace-rules.yaml"), """
            rules:
              - id: persona-diversity
                enabled: false
            """);

        // When
        int exitCode = run("list", "rules", projectRoot.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("(ID: duplicate-id)")
            .doesNotContain("persona-diversity");
    }

    @Test
    void list_unknownType_exitsOne() {
        assertThat(run("list", "plugins")).isEqualTo(1);
    }
}
