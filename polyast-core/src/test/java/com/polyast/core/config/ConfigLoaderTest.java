package com.polyast.core.config;

import com.polyast.core.lang.Language;
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
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("polyast.yaml");
        Files.writeString(configFile, """
            languages:
              enabled: [java, javascript]
              java:
                languageLevel: JAVA_11
              javascript:
                languageVersion: 180

            dump:
              includeTokens: false
              abstractPositions: true
              pretty: false

            driver:
              timeoutSeconds: 5
              threads: 2
            """);

        PolyastConfig config = ConfigLoader.load(configFile);

        assertThat(config.languages().enabledLanguages()).containsExactly(Language.JAVA, Language.JAVASCRIPT);
        assertThat(config.languages().isEnabled(Language.PYTHON)).isFalse();
        assertThat(config.languages().java().languageLevel()).isEqualTo("JAVA_11");
        assertThat(config.languages().javascript().languageVersion()).isEqualTo(180);
        assertThat(config.dump().includeTokens()).isFalse();
        assertThat(config.dump().abstractPositions()).isTrue();
        assertThat(config.dump().pretty()).isFalse();
        assertThat(config.driver().timeoutSeconds()).isEqualTo(5);
        assertThat(config.driver().threads()).isEqualTo(2);
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("polyast.yaml");
        Files.writeString(configFile, """
            driver:
              threads: 8
            """);

        PolyastConfig config = ConfigLoader.load(configFile);

        assertThat(config.driver().threads()).isEqualTo(8);
        assertThat(config.driver().timeoutSeconds()).isEqualTo(30);
        assertThat(config.languages().enabledLanguages()).containsExactly(Language.values());
        assertThat(config.languages().java().languageLevel()).isEqualTo("JAVA_17");
        assertThat(config.dump()).isEqualTo(PolyastConfig.DumpSettings.defaults());
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("polyast.yaml");
        Files.writeString(configFile, """
            colour: blue
            dump:
              pretty: false
              width: 120
            """);

        PolyastConfig config = ConfigLoader.load(configFile);

        assertThat(config.dump().pretty()).isFalse();
    }

    @Test
    void load_missingFile_returnsDefaults() {
        PolyastConfig config = ConfigLoader.load(tempDir.resolve("absent.yaml"));

        assertThat(config).isEqualTo(PolyastConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("polyast.yaml");
        Files.writeString(configFile, "driver: [unclosed");

        PolyastConfig config = ConfigLoader.load(configFile);

        assertThat(config).isEqualTo(PolyastConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        PolyastConfig config = ConfigLoader.load(tempDir);

        assertThat(config).isEqualTo(PolyastConfig.defaults());
    }

    @Test
    void loadOrDefaults_explicitPath_isLoaded() throws IOException {
        Path configFile = tempDir.resolve("custom.yaml");
        Files.writeString(configFile, """
            languages:
              enabled: [python]
            """);

        PolyastConfig config = ConfigLoader.loadOrDefaults(configFile);

        assertThat(config.languages().enabledLanguages()).containsExactly(Language.PYTHON);
    }

    @Test
    void driverSettings_nonPositiveValues_fallBackToDefaults() {
        PolyastConfig.DriverSettings settings = new PolyastConfig.DriverSettings(0, -3);

        assertThat(settings).isEqualTo(PolyastConfig.DriverSettings.defaults());
    }
}
