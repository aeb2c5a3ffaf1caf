package com.polyast.core.ast.visitor;

import com.polyast.core.ast.Any;
import com.polyast.core.ast.Argument;
import com.polyast.core.ast.AstHelpers;
import com.polyast.core.ast.Expr;
import com.polyast.core.ast.IdInfo;
import com.polyast.core.ast.Ident;
import com.polyast.core.ast.Operator;
import com.polyast.core.ast.Token;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.UnaryOperator;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Mappers}.
 */
class MappersTest {

    @Test
    void defaultHooks_rebuildEqualTree() {
        Expr expr = AstHelpers.opCall(Operator.PLUS, Token.fake("+"),
            List.of(AstHelpers.id(Ident.fake("a")), AstHelpers.id(Ident.fake("b"))));

        Any mapped = Mappers.make(new MapperHooks() {
        }).map(Any.of(expr));

        assertThat(mapped).isEqualTo(Any.of(expr));
    }

    @Test
    void identHook_renamesIdentifiers() {
        Expr expr = AstHelpers.opCall(Operator.PLUS, Token.fake("+"),
            List.of(AstHelpers.id(Ident.fake("a")), AstHelpers.id(Ident.fake("b"))));

        Mapper mapper = Mappers.make(new MapperHooks() {
            @Override
            public Ident ident(Ident ident, UnaryOperator<Ident> k, Mapper m) {
                Ident mapped = k.apply(ident);
                return new Ident(mapped.name().toUpperCase(), mapped.token());
            }
        });
        Expr.Call call = (Expr.Call) mapper.mapExpr(expr);

        assertThat(call.arguments().value())
            .extracting(argument -> ((Expr.Id) ((Argument.Arg) argument).expr()).ident().name())
            .containsExactly("A", "B");
    }

    @Test
    void sharedIdInfo_staysSharedAfterMapping() {
        IdInfo shared = IdInfo.empty();
        Expr first = new Expr.Id(Ident.fake("x"), shared);
        Expr second = new Expr.Id(Ident.fake("x"), shared);
        Expr seq = new Expr.Seq(List.of(first, second));

        Expr.Seq mapped = (Expr.Seq) Mappers.make(new MapperHooks() {
        }).mapExpr(seq);

        IdInfo a = ((Expr.Id) mapped.exprs().get(0)).info();
        IdInfo b = ((Expr.Id) mapped.exprs().get(1)).info();
        assertThat(a).isSameAs(b);
        assertThat(a).isNotSameAs(shared);
    }

    @Test
    void reusedMapper_rebuildsCellsForEachProgram() {
        IdInfo shared = IdInfo.empty();
        Any expr = Any.of(new Expr.Id(Ident.fake("x"), shared));
        Mapper mapper = Mappers.make(new MapperHooks() {
        });

        IdInfo firstRun = ((Expr.Id) ((Any.AExpr) mapper.map(expr)).expr()).info();
        IdInfo secondRun = ((Expr.Id) ((Any.AExpr) mapper.map(expr)).expr()).info();

        assertThat(firstRun).isNotSameAs(shared);
        assertThat(secondRun).isNotSameAs(shared).isNotSameAs(firstRun);
    }
}
