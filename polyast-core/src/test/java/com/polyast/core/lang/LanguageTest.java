package com.polyast.core.lang;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Language}.
 */
class LanguageTest {

    @Test
    void ofFilename_recognizesEveryExtension() {
        assertThat(Language.ofFilename("src/Main.java")).contains(Language.JAVA);
        assertThat(Language.ofFilename("app.js")).contains(Language.JAVASCRIPT);
        assertThat(Language.ofFilename("lib/index.mjs")).contains(Language.JAVASCRIPT);
        assertThat(Language.ofFilename("stubs/os.pyi")).contains(Language.PYTHON);
        assertThat(Language.ofFilename("setup.py")).contains(Language.PYTHON);
    }

    @Test
    void ofFilename_ignoresCase() {
        assertThat(Language.ofFilename("LEGACY.JAVA")).contains(Language.JAVA);
    }

    @Test
    void ofFilename_withUnknownExtension_returnsEmpty() {
        assertThat(Language.ofFilename("README.md")).isEmpty();
        assertThat(Language.ofFilename("Makefile")).isEmpty();
    }

    @Test
    void ofId_isCaseInsensitive() {
        assertThat(Language.ofId("JavaScript")).contains(Language.JAVASCRIPT);
        assertThat(Language.ofId("cobol")).isEmpty();
    }
}
