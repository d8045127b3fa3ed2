package com.doctrace.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_withValidConfig_returnsConfig() throws IOException {
        // Given
        Path configFile = tempDir.resolve(ConfigLoader.CONFIG_FILE);
        Files.writeString(configFile, """
            project:
              name: shop-docs
              version: 2.1.0
            docs:
              directory: documentation
              rulesFile: governance/rules.yaml
            cache:
              enabled: false
              maxAgeDays: 7
            validation:
              parallelism: 3
              exemptIds: [EXT_Legacy, EXT_Partner]
            """);

        // When
        ProjectConfig config = ConfigLoader.load(configFile);

        // Then
        assertThat(config.project().name()).isEqualTo("shop-docs");
        assertThat(config.project().version()).isEqualTo("2.1.0");
        assertThat(config.docs().directory()).isEqualTo("documentation");
        assertThat(config.docs().rulesFile()).isEqualTo("governance/rules.yaml");
        assertThat(config.cache().isEnabled()).isFalse();
        assertThat(config.cache().maxAgeDays()).isEqualTo(7);
        assertThat(config.cache().file()).isEqualTo(".doctrace/cache/parse-cache.json");
        assertThat(config.validation().parallelism()).isEqualTo(3);
        assertThat(config.validation().exemptIds()).containsExactly("EXT_Legacy", "EXT_Partner");
    }

    @Test
    void load_withMissingFile_returnsDefaults() {
        ProjectConfig config = ConfigLoader.load(tempDir.resolve("missing.yaml"));

        assertThat(config).isEqualTo(ProjectConfig.defaults());
        assertThat(config.docs().directory()).isEqualTo("docs");
        assertThat(config.cache().isEnabled()).isTrue();
    }

    @Test
    void load_withEmptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.CONFIG_FILE);
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ProjectConfig.defaults());
    }

    @Test
    void load_withInvalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.CONFIG_FILE);
        Files.writeString(configFile, "docs: [unclosed\n");

        assertThat(ConfigLoader.load(configFile).docs().directory()).isEqualTo("docs");
    }

    @Test
    void load_withPartialConfig_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.CONFIG_FILE);
        Files.writeString(configFile, """
            docs:
              directory: site/docs
            unknownSection:
              ignored: true
            """);

        ProjectConfig config = ConfigLoader.loadFromProject(tempDir);

        assertThat(config.docs().directory()).isEqualTo("site/docs");
        assertThat(config.docs().rulesFile()).isEqualTo("doctrace-rules.yaml");
        assertThat(config.project().name()).isEqualTo("project");
        assertThat(config.validation().parallelism()).isPositive();
    }
}
