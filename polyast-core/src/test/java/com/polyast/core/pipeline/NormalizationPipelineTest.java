package com.polyast.core.pipeline;

import com.polyast.core.ast.Stmt;
import com.polyast.core.config.PolyastConfig;
import com.polyast.core.lang.SourceFile;
import com.polyast.core.normalizer.UnsupportedLanguageException;
import com.polyast.core.parser.SourceParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link NormalizationPipeline}.
 */
class NormalizationPipelineTest {

    @TempDir
    Path tempDir;

    private final NormalizationPipeline pipeline = new NormalizationPipeline();

    @Test
    void normalize_javaSource_returnsTopLevelStatements() {
        String code = """
            package com.example;

            import java.util.List;

            public class Greeter {
                String greet(String name) {
                    return "Hello " + name;
                }
            }
            """;

        List<Stmt> program = pipeline.normalize(SourceFile.of("Greeter.java", code));

        assertThat(program).hasSize(3);
        assertThat(program.get(0)).isInstanceOf(Stmt.DirectiveStmt.class);
        assertThat(program.get(2)).isInstanceOf(Stmt.DefStmt.class);
    }

    @Test
    void normalize_javaScriptSource_returnsTopLevelStatements() {
        List<Stmt> program = pipeline.normalize(SourceFile.of("app.js", "var x = 1;\nfunction f() { return x; }\n"));

        assertThat(program).hasSize(2);
        assertThat(program).allSatisfy(stmt -> assertThat(stmt).isInstanceOf(Stmt.DefStmt.class));
    }

    @Test
    void normalize_pythonSource_throwsUnsupportedLanguage() {
        assertThatThrownBy(() -> pipeline.normalize(SourceFile.of("app.py", "x = 1\n")))
            .isInstanceOf(UnsupportedLanguageException.class)
            .hasMessageContaining("python");
    }

    @Test
    void normalize_unknownExtension_throwsUnsupportedLanguage() {
        assertThatThrownBy(() -> pipeline.normalize(SourceFile.of("notes.txt", "hello")))
            .isInstanceOf(UnsupportedLanguageException.class)
            .hasMessageContaining("notes.txt");
    }

    @Test
    void normalize_disabledLanguage_throwsUnsupportedLanguage() {
        PolyastConfig javaOnly = new PolyastConfig(
            new PolyastConfig.LanguageSettings(List.of("java"), null, null), null, null);
        NormalizationPipeline restricted = new NormalizationPipeline(javaOnly);

        assertThatThrownBy(() -> restricted.normalize(SourceFile.of("app.js", "var x = 1;")))
            .isInstanceOf(UnsupportedLanguageException.class)
            .hasMessageContaining("disabled");
    }

    @Test
    void normalize_syntaxError_throwsParseException() {
        assertThatThrownBy(() -> pipeline.normalize(SourceFile.of("Broken.java", "class Broken {")))
            .isInstanceOf(SourceParser.ParseException.class);
    }

    @Test
    void normalizeFile_readsFromDisk() throws IOException {
        Path file = tempDir.resolve("util.js");
        Files.writeString(file, "module.exports = function (a) { return a * 2; };\n");

        List<Stmt> program = pipeline.normalizeFile(file);

        assertThat(program).hasSize(1);
    }

    @Test
    void normalizeFile_missingFile_throwsUncheckedIOException() {
        Path missing = tempDir.resolve("Missing.java");

        assertThatThrownBy(() -> pipeline.normalizeFile(missing))
            .isInstanceOf(UncheckedIOException.class)
            .hasMessageContaining("Missing.java");
    }

    @Test
    void supports_reflectsLanguageAndParserAvailability() {
        assertThat(pipeline.supports(Path.of("src/Main.java"))).isTrue();
        assertThat(pipeline.supports(Path.of("web/app.js"))).isTrue();
        assertThat(pipeline.supports(Path.of("tool.py"))).isFalse();
        assertThat(pipeline.supports(Path.of("README.md"))).isFalse();
    }

    @Test
    void supports_disabledLanguage_isFalse() {
        PolyastConfig jsOnly = new PolyastConfig(
            new PolyastConfig.LanguageSettings(List.of("javascript"), null, null), null, null);

        assertThat(new NormalizationPipeline(jsOnly).supports(Path.of("Main.java"))).isFalse();
    }
}
