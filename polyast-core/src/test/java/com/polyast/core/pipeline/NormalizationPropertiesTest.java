package com.polyast.core.pipeline;

import com.polyast.core.ast.Any;
import com.polyast.core.ast.Expr;
import com.polyast.core.ast.Token;
import com.polyast.core.ast.visitor.AstTraversals;
import com.polyast.core.ast.visitor.Visitor;
import com.polyast.core.ast.visitor.VisitorHooks;
import com.polyast.core.ast.visitor.Visitors;
import com.polyast.core.lang.SourceFile;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Properties every normalized program holds, checked on real parser output.
 */
class NormalizationPropertiesTest {

    private final NormalizationPipeline pipeline = new NormalizationPipeline();

    static Stream<Arguments> layoutPairs() {
        return Stream.of(
            Arguments.of("a.js",
                "function f(a){return a+1;}",
                """
                function f( a )
                {
                    return a + 1;
                }
                """),
            Arguments.of("a.js",
                "for(var i=0;i<n;i++){sum+=xs[i];}",
                """
                for (var i = 0; i < n; i++) {
                  sum += xs[i];
                }
                """),
            Arguments.of("A.java",
                "class A{int f(int a){return a+1;}}",
                """
                class A {

                    int f(int a) {
                        return a + 1;
                    }
                }
                """));
    }

    static Stream<Arguments> sources() {
        return Stream.of(
            Arguments.of("a.js", """
                var total = 0;
                function add(x, y) {
                  if (x > y) { return x - y; }
                  return x + y;
                }
                total = add(total, 2);
                """),
            Arguments.of("Counter.java", """
                package demo;

                public class Counter {
                    private int count;

                    public void increment(int by) {
                        for (int i = 0; i < by; i++) {
                            count = count + 1;
                        }
                    }
                }
                """));
    }

    @ParameterizedTest
    @MethodSource("layoutPairs")
    void abstractPositionInfo_ignoresLayout(String path, String compact, String spread) {
        Any first = Any.program(pipeline.normalize(SourceFile.of(path, compact)));
        Any second = Any.program(pipeline.normalize(SourceFile.of(path, spread)));

        assertThat(first).isNotEqualTo(second);
        assertThat(AstTraversals.abstractPositionInfo(first)).isEqualTo(AstTraversals.abstractPositionInfo(second));
    }

    @ParameterizedTest
    @MethodSource("sources")
    void extractTokens_originTokensAreInSourceOrder(String path, String code) {
        List<Token> origins = AstTraversals.extractTokens(Any.program(pipeline.normalize(SourceFile.of(path, code))))
            .stream()
            .filter(Token::isOrigin)
            .toList();

        assertThat(origins).isNotEmpty();
        for (int i = 1; i < origins.size(); i++) {
            assertThat(origins.get(i).location().offset())
                .isGreaterThanOrEqualTo(origins.get(i - 1).location().offset());
        }
    }

    @ParameterizedTest
    @MethodSource("sources")
    void identifierTokens_pointAtTheirText(String path, String code) {
        List<Token> tokens = new ArrayList<>();
        Visitors.make(new VisitorHooks() {
            @Override
            public void expr(Expr expr, Consumer<Expr> k, Visitor visitor) {
                if (expr instanceof Expr.Id id && id.ident().token().isOrigin()) {
                    tokens.add(id.ident().token());
                }
                k.accept(expr);
            }
        }).visit(Any.program(pipeline.normalize(SourceFile.of(path, code))));

        assertThat(tokens).isNotEmpty().allSatisfy(token ->
            assertThat(code.substring(token.location().offset())).startsWith(token.text()));
    }

    @ParameterizedTest
    @MethodSource("sources")
    void range_spansFirstAndLastOriginToken(String path, String code) {
        Any program = Any.program(pipeline.normalize(SourceFile.of(path, code)));
        List<Token> origins = AstTraversals.extractTokens(program).stream().filter(Token::isOrigin).toList();

        assertThat(AstTraversals.range(program)).hasValueSatisfying(range -> {
            assertThat(range.get(0).location()).isEqualTo(origins.get(0).location());
            assertThat(range.get(1).location()).isEqualTo(origins.get(origins.size() - 1).location());
        });
    }

    @ParameterizedTest
    @MethodSource("sources")
    void abstractPositionInfo_leavesNoPositions(String path, String code) {
        Any program = Any.program(pipeline.normalize(SourceFile.of(path, code)));

        assertThat(AstTraversals.extractTokens(AstTraversals.abstractPositionInfo(program)))
            .noneMatch(Token::isOrigin);
    }
}
