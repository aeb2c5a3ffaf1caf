package com.polyast.core.normalizer;

import com.polyast.core.ast.Stmt;
import com.polyast.core.lang.Language;
import com.polyast.core.lang.SourceFile;
import com.polyast.core.normalizer.java.JavaNormalizer;
import com.polyast.core.parser.JavaSourceParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Normalizers} provider discovery.
 */
class NormalizersTest {

    @Test
    void supportedLanguages_discoversAllProviders() {
        assertThat(Normalizers.supportedLanguages()).containsExactlyInAnyOrder(Language.values());
    }

    @Test
    void provider_hasDisplayName() {
        assertThat(Normalizers.provider(Language.JAVA))
            .get()
            .extracting(NormalizerProvider::getDisplayName)
            .isEqualTo("Java (JavaParser)");
    }

    @Test
    void forLanguage_createsNormalizerForFile() {
        Normalizer<?> normalizer = Normalizers.forLanguage(Language.JAVA, SourceFile.of("A.java", "class A {}"));

        assertThat(normalizer).isInstanceOf(JavaNormalizer.class);
        assertThat(normalizer.language()).isEqualTo(Language.JAVA);
    }

    @Test
    void normalize_javaCompilationUnit_returnsProgram() {
        SourceFile source = SourceFile.of("A.java", "class A {}");

        List<Stmt> program = Normalizers.normalize(Language.JAVA, new JavaSourceParser().parse(source), source);

        assertThat(program).hasSize(1);
    }

    @Test
    void normalize_wrongTreeType_throwsIllegalArgument() {
        SourceFile source = SourceFile.of("a.js", "x;");

        assertThatThrownBy(() -> Normalizers.normalize(Language.JAVASCRIPT, "not a tree", source))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("javascript");
    }
}
