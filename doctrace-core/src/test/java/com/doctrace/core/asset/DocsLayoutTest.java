package com.doctrace.core.asset;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DocsLayout}.
 */
class DocsLayoutTest {

    @ParameterizedTest
    @CsvSource({
        "personas/PER_User.mermaid, personas",
        "personas/footnotes/PER_User.md, personas",
        "arch/components/footnotes/COMP_A.md, arch/components",
        "footnotes/readme.md, ''",
        "RULES_GUIDE.md, ''"
    })
    void governingFolder_stripsFootnotesSegment(String path, String expected) {
        assertThat(DocsLayout.governingFolder(path)).isEqualTo(expected);
    }

    @Test
    void isWithin_matchesFolderAndDescendantsOnly() {
        assertThat(DocsLayout.isWithin("personas", "personas")).isTrue();
        assertThat(DocsLayout.isWithin("personas", "personas/footnotes")).isTrue();
        assertThat(DocsLayout.isWithin("personas", "personas-old")).isFalse();
        assertThat(DocsLayout.isWithin("", "anything/at/all")).isTrue();
    }

    @Test
    void isInFootnotes_checksParentFolder() {
        assertThat(DocsLayout.isInFootnotes("personas/footnotes/PER_User.md")).isTrue();
        assertThat(DocsLayout.isInFootnotes("footnotes/x.md")).isTrue();
        assertThat(DocsLayout.isInFootnotes("personas/PER_User.md")).isFalse();
    }
}
