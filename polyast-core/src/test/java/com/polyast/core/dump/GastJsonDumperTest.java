package com.polyast.core.dump;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polyast.core.ast.Any;
import com.polyast.core.ast.Expr;
import com.polyast.core.ast.IdInfo;
import com.polyast.core.ast.Ident;
import com.polyast.core.ast.Location;
import com.polyast.core.ast.Operator;
import com.polyast.core.ast.ResolvedName;
import com.polyast.core.ast.Special;
import com.polyast.core.ast.Stmt;
import com.polyast.core.ast.Token;
import com.polyast.core.config.PolyastConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link GastJsonDumper}.
 */
class GastJsonDumperTest {

    private static Token tok(String text, int line, int column) {
        return Token.of(text, new Location("a.js", line, column, 0));
    }

    private static Expr.Id id(String name, int column) {
        return Expr.Id.of(new Ident(name, tok(name, 1, column)));
    }

    @Test
    void toTree_namesNodesByFamilyAndVariant() {
        Stmt stmt = new Stmt.Return(tok("return", 1, 1), Optional.of(id("x", 8)));

        JsonNode tree = new GastJsonDumper(true, false).toTree(Any.of(stmt));

        assertThat(tree.get("node").asText()).isEqualTo("Any.AStmt");
        JsonNode returned = tree.get("stmt");
        assertThat(returned.get("node").asText()).isEqualTo("Stmt.Return");
        assertThat(returned.get("value").get("node").asText()).isEqualTo("Expr.Id");
    }

    @Test
    void toTree_originToken_rendersPosition() {
        JsonNode token = new GastJsonDumper(true, false).toTree(tok("return", 3, 5));

        assertThat(token.get("text").asText()).isEqualTo("return");
        assertThat(token.get("line").asInt()).isEqualTo(3);
        assertThat(token.get("column").asInt()).isEqualTo(5);
        assertThat(token.has("fake")).isFalse();
    }

    @Test
    void toTree_fakeAndAbstractTokens_areMarked() {
        GastJsonDumper dumper = new GastJsonDumper(true, false);

        JsonNode fake = dumper.toTree(Token.fake(";"));
        JsonNode abstracted = dumper.toTree(tok("x", 1, 1).abstracted());

        assertThat(fake.get("fake").asBoolean()).isTrue();
        assertThat(fake.has("line")).isFalse();
        assertThat(abstracted.get("abstract").asBoolean()).isTrue();
        assertThat(abstracted.has("line")).isFalse();
    }

    @Test
    void toTree_withoutTokens_omitsTokenMembers() {
        Stmt stmt = new Stmt.Return(tok("return", 1, 1), Optional.empty());

        JsonNode tree = new GastJsonDumper(false, false).toTree(stmt);

        assertThat(tree.get("node").asText()).isEqualTo("Stmt.Return");
        assertThat(tree.has("token")).isFalse();
        assertThat(tree.get("value").isNull()).isTrue();
    }

    @Test
    void toTree_enumsAndIdInfo_renderCompactly() {
        IdInfo info = IdInfo.resolvedAs(ResolvedName.unresolved(new ResolvedName.ResolvedKind.Local()));
        Expr.Id local = new Expr.Id(new Ident("x", tok("x", 1, 1)), info);
        Expr.IdSpecial plus = Expr.IdSpecial.of(new Special.Op(Operator.PLUS), tok("+", 1, 3));

        GastJsonDumper dumper = new GastJsonDumper(true, false);
        JsonNode id = dumper.toTree(local);
        JsonNode special = dumper.toTree(plus);

        assertThat(id.get("info").get("resolved").get("kind").get("node").asText())
            .isEqualTo("ResolvedKind.Local");
        assertThat(id.get("info").has("type")).isFalse();
        assertThat(special.get("special").get("value").get("operator").asText()).isEqualTo("PLUS");
    }

    @Test
    void toJson_producesParseableDocument() throws Exception {
        List<Stmt> program = List.of(new Stmt.ExprStmt(id("a", 1), tok(";", 1, 2)));

        String json = new GastJsonDumper(true, true).toJson(Any.program(program));

        JsonNode parsed = new ObjectMapper().readTree(json);
        assertThat(parsed.get("stmts")).hasSize(1);
        assertThat(json).contains(System.lineSeparator());
    }

    @Test
    void fromConfig_honoursDumpSettings() {
        GastJsonDumper dumper = GastJsonDumper.fromConfig(new PolyastConfig.DumpSettings(false, false, false));

        String json = dumper.toJson(Any.of(id("a", 1)));

        assertThat(json).doesNotContain("\n").doesNotContain("\"line\"");
    }

    @Test
    void nodeName_topLevelClass_isSimpleName() {
        assertThat(GastJsonDumper.nodeName(Token.class)).isEqualTo("Token");
        assertThat(GastJsonDumper.nodeName(Expr.Call.class)).isEqualTo("Expr.Call");
    }
}
