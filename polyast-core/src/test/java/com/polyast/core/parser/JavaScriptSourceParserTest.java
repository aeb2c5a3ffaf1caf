package com.polyast.core.parser;

import com.polyast.core.lang.SourceFile;
import org.junit.jupiter.api.Test;
import org.mozilla.javascript.Node;
import org.mozilla.javascript.ast.AstRoot;
import org.mozilla.javascript.ast.FunctionNode;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link JavaScriptSourceParser}.
 */
class JavaScriptSourceParserTest {

    private final JavaScriptSourceParser parser = new JavaScriptSourceParser();

    @Test
    void parse_validSource_returnsRoot() {
        AstRoot root = parser.parse(SourceFile.of("app.js", "function f(a) { return a + 1; }\nf(2);"));

        assertThat(statements(root)).hasSize(2);
        assertThat(statements(root).get(0)).isInstanceOf(FunctionNode.class);
    }

    @Test
    void parse_es6Syntax_isAccepted() {
        AstRoot root = parser.parse(SourceFile.of("app.js", "let x = 1;\nconst f = (a) => a * x;"));

        assertThat(statements(root)).hasSize(2);
    }

    @Test
    void parse_syntaxError_throwsParseException() {
        assertThatThrownBy(() -> parser.parse(SourceFile.of("broken.js", "function (")))
            .isInstanceOf(SourceParser.ParseException.class)
            .hasMessageContaining("broken.js");
    }

    private static List<Node> statements(AstRoot root) {
        List<Node> statements = new ArrayList<>();
        for (Node child : root) {
            statements.add(child);
        }
        return statements;
    }
}
