package com.doctrace.core.asset;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FrontMatterParser}.
 */
class FrontMatterParserTest {

    private final FrontMatterParser parser = new FrontMatterParser();

    @Test
    void parse_documentWithFrontMatter_splitsBlockAndBody() {
        String content = """
            ---
            id: REQ_Login
            title: Login
            description: Users can sign in
            uplink: PER_User
            downlinks:
              - JRN_Login
              - FLOW_Login
            classification: Functional
            owner: team-a
            ---
            requirementDiagram
              requirement REQ_Login {
              }
            """;

        FrontMatterParser.ParsedDocument parsed = parser.parse(content);

        FrontMatter frontMatter = parsed.frontMatter();
        assertThat(parsed.error()).isNull();
        assertThat(frontMatter.id()).isEqualTo("REQ_Login");
        assertThat(frontMatter.kind()).isEqualTo(DocumentKind.REQUIREMENT);
        assertThat(frontMatter.uplinks()).containsExactly("PER_User");
        assertThat(frontMatter.downlinks()).containsExactly("JRN_Login", "FLOW_Login");
        assertThat(frontMatter.classification()).isEqualTo("Functional");
        assertThat(frontMatter.extras()).containsEntry("owner", "team-a");
        assertThat(frontMatter.value("owner")).contains("team-a");
        assertThat(parsed.body()).startsWith("requirementDiagram");
    }

    @Test
    void parse_uplinkAndUplinks_areMergedWithoutDuplicates() {
        String content = """
            ---
            id: JRN_Checkout
            uplink: PER_Buyer
            uplinks: [PER_Buyer, REQ_Checkout]
            ---
            sequenceDiagram
            """;

        FrontMatter frontMatter = parser.parse(content).frontMatter();

        assertThat(frontMatter.uplinks()).containsExactly("PER_Buyer", "REQ_Checkout");
    }

    @Test
    void parse_entities_areReadWithTheirLinks() {
        String content = """
            ---
            id: REQ_Root
            entities:
              - id: REQ_Search
                uplink: REQ_Root
                requirements: [REQ_Index]
                classification: Non-Functional
              - title: entity without id is skipped
              - id: REQ_Filter
            ---
            requirementDiagram
            """;

        FrontMatter frontMatter = parser.parse(content).frontMatter();

        assertThat(frontMatter.entities()).extracting(FrontMatterEntity::id).containsExactly("REQ_Search", "REQ_Filter");
        FrontMatterEntity search = frontMatter.entities().get(0);
        assertThat(search.uplinks()).containsExactly("REQ_Root");
        assertThat(search.requirements()).containsExactly("REQ_Index");
        assertThat(search.classification()).isEqualTo("Non-Functional");
        assertThat(frontMatter.declaredIds()).containsExactly("REQ_Root", "REQ_Search", "REQ_Filter");
    }

    @Test
    void parse_noFrontMatter_returnsWholeContentAsBody() {
        String content = "graph TD\n  A --> B\n";

        FrontMatterParser.ParsedDocument parsed = parser.parse(content);

        assertThat(parsed.frontMatter().hasId()).isFalse();
        assertThat(parsed.body()).isEqualTo(content);
        assertThat(parsed.error()).isNull();
    }

    @Test
    void parse_invalidYaml_keepsBodyAndReportsError() {
        String content = """
            ---
            id: [unclosed
            ---
            mindmap
            """;

        FrontMatterParser.ParsedDocument parsed = parser.parse(content);

        assertThat(parsed.error()).isNotBlank();
        assertThat(parsed.frontMatter().hasId()).isFalse();
        assertThat(parsed.body()).startsWith("mindmap");
    }

    @Test
    void parse_scalarBlock_isReportedAsError() {
        FrontMatterParser.ParsedDocument parsed = parser.parse("---\njust text\n---\nbody\n");

        assertThat(parsed.error()).contains("mapping");
        assertThat(parsed.body()).isEqualTo("body\n");
    }

    @Test
    void parse_emptyBlock_givesEmptyFrontMatter() {
        FrontMatterParser.ParsedDocument parsed = parser.parse("---\n---\nstateDiagram-v2\n");

        assertThat(parsed.error()).isNull();
        assertThat(parsed.frontMatter().declaredIds()).isEmpty();
        assertThat(parsed.body()).isEqualTo("stateDiagram-v2\n");
    }

    @Test
    void parse_numericValues_areReadAsText() {
        FrontMatter frontMatter = parser.parse("---\nid: COMP_1\ntitle: 42\n---\n").frontMatter();

        assertThat(frontMatter.title()).isEqualTo("42");
        assertThat(frontMatter.kind()).isEqualTo(DocumentKind.COMPONENT);
    }
}
