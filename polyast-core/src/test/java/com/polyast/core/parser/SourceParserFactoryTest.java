package com.polyast.core.parser;

import com.polyast.core.config.PolyastConfig;
import com.polyast.core.lang.Language;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SourceParserFactory}.
 */
class SourceParserFactoryTest {

    @AfterEach
    void tearDown() {
        SourceParserFactory.clearCache();
    }

    @Test
    void forLanguage_java_returnsJavaParser() {
        assertThat(SourceParserFactory.forLanguage(Language.JAVA, PolyastConfig.defaults()))
            .get()
            .isInstanceOf(JavaSourceParser.class)
            .extracting(SourceParser::language)
            .isEqualTo(Language.JAVA);
    }

    @Test
    void forLanguage_javascript_returnsRhinoParser() {
        assertThat(SourceParserFactory.forLanguage(Language.JAVASCRIPT, PolyastConfig.defaults()))
            .get()
            .isInstanceOf(JavaScriptSourceParser.class);
    }

    @Test
    void forLanguage_python_hasNoInRepoParser() {
        assertThat(SourceParserFactory.forLanguage(Language.PYTHON, PolyastConfig.defaults())).isEmpty();
        assertThat(SourceParserFactory.isAvailable(Language.PYTHON)).isFalse();
    }

    @Test
    void getJavaParser_sameSettings_returnsCachedInstance() {
        PolyastConfig.JavaSettings settings = PolyastConfig.JavaSettings.defaults();

        assertThat(SourceParserFactory.getJavaParser(settings)).isSameAs(SourceParserFactory.getJavaParser(settings));
    }

    @Test
    void getJavaParser_otherLanguageLevel_returnsOtherInstance() {
        JavaSourceParser java17 = SourceParserFactory.getJavaParser(new PolyastConfig.JavaSettings("JAVA_17"));
        JavaSourceParser java11 = SourceParserFactory.getJavaParser(new PolyastConfig.JavaSettings("JAVA_11"));

        assertThat(java17).isNotSameAs(java11);
    }

    @Test
    void isAvailable_javaAndJavaScript_areAvailable() {
        assertThat(SourceParserFactory.isAvailable(Language.JAVA)).isTrue();
        assertThat(SourceParserFactory.isAvailable(Language.JAVASCRIPT)).isTrue();
    }
}
