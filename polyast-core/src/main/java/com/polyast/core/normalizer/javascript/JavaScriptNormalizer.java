package com.polyast.core.normalizer.javascript;

import com.polyast.core.ast.Any;
import com.polyast.core.ast.Argument;
import com.polyast.core.ast.AstHelpers;
import com.polyast.core.ast.Attribute;
import com.polyast.core.ast.Attribute.KeywordAttribute;
import com.polyast.core.ast.Bracket;
import com.polyast.core.ast.Definition;
import com.polyast.core.ast.DefinitionKind;
import com.polyast.core.ast.Entity;
import com.polyast.core.ast.Expr;
import com.polyast.core.ast.Field;
import com.polyast.core.ast.FieldIdent;
import com.polyast.core.ast.FunctionDefinition;
import com.polyast.core.ast.IdInfo;
import com.polyast.core.ast.Ident;
import com.polyast.core.ast.Literal;
import com.polyast.core.ast.Operator;
import com.polyast.core.ast.Parameter;
import com.polyast.core.ast.ParameterClassic;
import com.polyast.core.ast.Pattern;
import com.polyast.core.ast.Special;
import com.polyast.core.ast.Stmt;
import com.polyast.core.ast.Token;
import com.polyast.core.ast.VariableDefinition;
import com.polyast.core.ast.Wrap;
import com.polyast.core.lang.Language;
import com.polyast.core.lang.SourceFile;
import com.polyast.core.normalizer.AbstractNormalizer;
import com.polyast.core.normalizer.Normalizer;
import com.polyast.core.normalizer.NormalizerProvider;
import org.mozilla.javascript.Node;
import org.mozilla.javascript.ast.ArrayLiteral;
import org.mozilla.javascript.ast.Assignment;
import org.mozilla.javascript.ast.AstNode;
import org.mozilla.javascript.ast.AstRoot;
import org.mozilla.javascript.ast.Block;
import org.mozilla.javascript.ast.BreakStatement;
import org.mozilla.javascript.ast.CatchClause;
import org.mozilla.javascript.ast.ConditionalExpression;
import org.mozilla.javascript.ast.ContinueStatement;
import org.mozilla.javascript.ast.DoLoop;
import org.mozilla.javascript.ast.ElementGet;
import org.mozilla.javascript.ast.EmptyExpression;
import org.mozilla.javascript.ast.EmptyStatement;
import org.mozilla.javascript.ast.ExpressionStatement;
import org.mozilla.javascript.ast.ForInLoop;
import org.mozilla.javascript.ast.ForLoop;
import org.mozilla.javascript.ast.FunctionCall;
import org.mozilla.javascript.ast.FunctionNode;
import org.mozilla.javascript.ast.IfStatement;
import org.mozilla.javascript.ast.InfixExpression;
import org.mozilla.javascript.ast.KeywordLiteral;
import org.mozilla.javascript.ast.Label;
import org.mozilla.javascript.ast.LabeledStatement;
import org.mozilla.javascript.ast.Name;
import org.mozilla.javascript.ast.NewExpression;
import org.mozilla.javascript.ast.NumberLiteral;
import org.mozilla.javascript.ast.ObjectLiteral;
import org.mozilla.javascript.ast.ObjectProperty;
import org.mozilla.javascript.ast.ParenthesizedExpression;
import org.mozilla.javascript.ast.PropertyGet;
import org.mozilla.javascript.ast.RegExpLiteral;
import org.mozilla.javascript.ast.ReturnStatement;
import org.mozilla.javascript.ast.Scope;
import org.mozilla.javascript.ast.StringLiteral;
import org.mozilla.javascript.ast.SwitchCase;
import org.mozilla.javascript.ast.SwitchStatement;
import org.mozilla.javascript.ast.TaggedTemplateLiteral;
import org.mozilla.javascript.ast.TemplateCharacters;
import org.mozilla.javascript.ast.TemplateLiteral;
import org.mozilla.javascript.ast.ThrowStatement;
import org.mozilla.javascript.ast.TryStatement;
import org.mozilla.javascript.ast.UnaryExpression;
import org.mozilla.javascript.ast.UpdateExpression;
import org.mozilla.javascript.ast.VariableDeclaration;
import org.mozilla.javascript.ast.VariableInitializer;
import org.mozilla.javascript.ast.WhileLoop;
import org.mozilla.javascript.ast.WithStatement;
import org.mozilla.javascript.ast.Yield;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Translates Rhino {@link AstRoot} trees into the generic AST.
 *
 * <p>Rhino reports absolute character offsets; tokens are located through the file's
 * line index. Keyword and punctuation tokens are recovered from the source text and
 * become fake tokens when the text at the expected offset does not match.
 *
 * <p>Every property access stays a {@link Expr.DotAccess}: unlike Java, the parser
 * already tells property accesses from names.
 *
 * <p>Destructuring declarations such as {@code var [a, b] = xs} are a single variable
 * named {@link AstHelpers#SPECIAL_MULTIVARDEF_PATTERN} whose initializer assigns the
 * pattern.
 *
 * @since 1.0.0
 */
public class JavaScriptNormalizer extends AbstractNormalizer<AstRoot> {

    private static final java.util.regex.Pattern INTEGER =
        java.util.regex.Pattern.compile("\\d+|0[xX][0-9a-fA-F]+|0[oO][0-7]+|0[bB][01]+");

    private final String content;

    public JavaScriptNormalizer(SourceFile sourceFile) {
        super(Language.JAVASCRIPT, AstRoot.class, sourceFile);
        this.content = sourceFile.content();
    }

    /**
     * SPI entry for {@link JavaScriptNormalizer}.
     */
    public static class Provider implements NormalizerProvider {

        @Override
        public Language language() {
            return Language.JAVASCRIPT;
        }

        @Override
        public String getDisplayName() {
            return "JavaScript (Rhino)";
        }

        @Override
        public Normalizer<?> create(SourceFile sourceFile) {
            return new JavaScriptNormalizer(sourceFile);
        }
    }

    // ==================== Entry points ====================

    @Override
    public List<Stmt> program(AstRoot root) {
        return children(root);
    }

    @Override
    public Any any(Object fragment) {
        if (fragment instanceof AstRoot root) {
            return Any.program(program(root));
        }
        if (fragment instanceof AstNode node) {
            return isStatement(node) ? Any.of(stmt(node)) : Any.of(expr(node));
        }
        if (fragment instanceof List<?> list && list.stream().allMatch(AstNode.class::isInstance)) {
            List<Stmt> stmts = new ArrayList<>();
            list.forEach(node -> stmts.addAll(stmtAux((AstNode) node)));
            return new Any.AStmts(stmts);
        }
        throw new IllegalArgumentException("Not a Rhino node: "
            + (fragment == null ? "null" : fragment.getClass().getName()));
    }

    private static boolean isStatement(AstNode node) {
        if (node instanceof FunctionNode function) {
            return isDeclaration(function);
        }
        if (node instanceof VariableDeclaration declaration) {
            return declaration.isStatement();
        }
        return node instanceof Block || node instanceof Scope || node instanceof IfStatement
            || node instanceof SwitchStatement || node instanceof BreakStatement || node instanceof ContinueStatement
            || node instanceof ReturnStatement || node instanceof ThrowStatement || node instanceof TryStatement
            || node instanceof LabeledStatement || node instanceof WithStatement || node instanceof EmptyStatement
            || node instanceof ExpressionStatement;
    }

    /**
     * Function declarations nested in blocks parse as expression statements; only arrow
     * functions in statement position stay expressions.
     */
    private static boolean isDeclaration(FunctionNode function) {
        return function.getFunctionType() == FunctionNode.FUNCTION_STATEMENT
            || function.getFunctionType() == FunctionNode.FUNCTION_EXPRESSION_STATEMENT;
    }

    // ==================== Tokens ====================

    private static int start(AstNode node) {
        return node.getAbsolutePosition();
    }

    private static int end(AstNode node) {
        return node.getAbsolutePosition() + node.getLength();
    }

    /**
     * Returns a token for {@code text} at {@code offset}, or a fake one when the source
     * does not contain that text there.
     */
    private Token textToken(String text, int offset) {
        if (offset >= 0 && content.startsWith(text, offset)) {
            return tokenAt(text, offset);
        }
        return Token.fake(text);
    }

    private Token keyword(String text, AstNode node) {
        return textToken(text, start(node));
    }

    /**
     * Finds the last occurrence of {@code text} between two offsets, e.g. the
     * {@code finally} keyword before its block.
     */
    private Token lastTokenBetween(String text, int from, int to) {
        int offset = content.lastIndexOf(text, to - text.length());
        return offset >= from ? tokenAt(text, offset) : Token.fake(text);
    }

    private Ident ident(Name name) {
        return new Ident(name.getIdentifier(), tokenAt(name.getIdentifier(), start(name)));
    }

    private Ident label(Label label) {
        return new Ident(label.getName(), tokenAt(label.getName(), start(label)));
    }

    private <T> Bracket<T> bracket(AstNode node, String open, T value, String close) {
        return new Bracket<>(textToken(open, start(node)), value, textToken(close, end(node) - close.length()));
    }

    // ==================== Statements ====================

    private List<Stmt> children(Node parent) {
        List<Stmt> stmts = new ArrayList<>();
        for (Node child : parent) {
            if (child instanceof AstNode node) {
                stmts.addAll(stmtAux(node));
            }
        }
        return stmts;
    }

    Stmt stmt(AstNode node) {
        return AstHelpers.stmt1(stmtAux(node));
    }

    private Stmt.Block block(AstNode node) {
        return new Stmt.Block(bracket(node, "{", children(node), "}"));
    }

    private List<Stmt> stmtAux(AstNode node) {
        if (node instanceof FunctionNode function && isDeclaration(function)) {
            return List.of(new Stmt.DefStmt(functionDefinition(function)));
        }
        if (node instanceof VariableDeclaration declaration) {
            return variables(declaration);
        }
        if (node instanceof ExpressionStatement statement
            && statement.getExpression() instanceof FunctionNode function && isDeclaration(function)) {
            return List.of(new Stmt.DefStmt(functionDefinition(function)));
        }
        if (node instanceof ExpressionStatement statement) {
            Token semicolon = end(statement) > 0 && content.charAt(end(statement) - 1) == ';'
                ? tokenAt(";", end(statement) - 1)
                : Token.fake(";");
            return List.of(new Stmt.ExprStmt(expr(statement.getExpression()), semicolon));
        }
        if (node instanceof IfStatement ifStatement) {
            return List.of(new Stmt.If(keyword("if", ifStatement), expr(ifStatement.getCondition()),
                stmt(ifStatement.getThenPart()), Optional.ofNullable(ifStatement.getElsePart()).map(this::stmt)));
        }
        if (node instanceof WhileLoop loop) {
            return List.of(new Stmt.While(keyword("while", loop), expr(loop.getCondition()), stmt(loop.getBody())));
        }
        if (node instanceof DoLoop loop) {
            return List.of(new Stmt.DoWhile(keyword("do", loop), stmt(loop.getBody()), expr(loop.getCondition())));
        }
        if (node instanceof ForInLoop loop) {
            return List.of(forIn(loop));
        }
        if (node instanceof ForLoop loop) {
            return List.of(forLoop(loop));
        }
        if (node instanceof SwitchStatement switchStatement) {
            return List.of(switchStatement(switchStatement));
        }
        if (node instanceof BreakStatement breakStatement) {
            return List.of(new Stmt.Break(keyword("break", breakStatement),
                AstHelpers.optToLabelIdent(Optional.ofNullable(breakStatement.getBreakLabel()).map(this::ident))));
        }
        if (node instanceof ContinueStatement continueStatement) {
            return List.of(new Stmt.Continue(keyword("continue", continueStatement),
                AstHelpers.optToLabelIdent(Optional.ofNullable(continueStatement.getLabel()).map(this::ident))));
        }
        if (node instanceof ReturnStatement returnStatement) {
            return List.of(new Stmt.Return(keyword("return", returnStatement),
                Optional.ofNullable(returnStatement.getReturnValue()).map(this::expr)));
        }
        if (node instanceof ThrowStatement throwStatement) {
            return List.of(new Stmt.Throw(keyword("throw", throwStatement), expr(throwStatement.getExpression())));
        }
        if (node instanceof TryStatement tryStatement) {
            return List.of(tryStatement(tryStatement));
        }
        if (node instanceof LabeledStatement labeled) {
            Stmt body = stmt(labeled.getStatement());
            List<Label> labels = labeled.getLabels();
            for (int i = labels.size() - 1; i >= 0; i--) {
                body = new Stmt.Label(label(labels.get(i)), body);
            }
            return List.of(body);
        }
        if (node instanceof WithStatement with) {
            return List.of(new Stmt.OtherStmtWithStmt(Stmt.OtherStmtWithStmtOp.WITH, expr(with.getExpression()),
                stmt(with.getStatement())));
        }
        if (node instanceof EmptyStatement || node instanceof EmptyExpression) {
            Token semicolon = textToken(";", start(node));
            return List.of(new Stmt.Block(new Bracket<>(semicolon, List.of(), semicolon)));
        }
        if (node instanceof Block || (node instanceof Scope && !(node instanceof FunctionNode))) {
            return List.of(block(node));
        }
        if (node instanceof KeywordLiteral keyword && keyword.getType() == org.mozilla.javascript.Token.DEBUGGER) {
            logFallback("stmt", node);
            return List.of(new Stmt.OtherStmt(Stmt.OtherStmtOp.TODO, List.of(Any.of(keyword("debugger", keyword)))));
        }
        return List.of(new Stmt.ExprStmt(expr(node), Token.fake(";")));
    }

    /**
     * One definition per declared variable, all sharing the declaration keyword.
     */
    private List<Stmt> variables(VariableDeclaration declaration) {
        Attribute kind = declarationKind(declaration);
        List<Stmt> stmts = new ArrayList<>();
        for (VariableInitializer variable : declaration.getVariables()) {
            stmts.add(new Stmt.DefStmt(variable(variable, kind)));
        }
        return stmts;
    }

    private Attribute declarationKind(VariableDeclaration declaration) {
        int type = declaration.getType();
        if (type == org.mozilla.javascript.Token.LET) {
            return Attribute.KeywordAttr.of(KeywordAttribute.LET, keyword("let", declaration));
        }
        if (type == org.mozilla.javascript.Token.CONST) {
            return Attribute.KeywordAttr.of(KeywordAttribute.CONST, keyword("const", declaration));
        }
        return Attribute.KeywordAttr.of(KeywordAttribute.VAR, keyword("var", declaration));
    }

    private Definition variable(VariableInitializer variable, Attribute kind) {
        Optional<Expr> initializer = Optional.ofNullable(variable.getInitializer()).map(this::expr);
        if (variable.getTarget() instanceof Name name) {
            return new Definition(AstHelpers.basicEntity(ident(name), List.of(kind)),
                new DefinitionKind.VarDef(new VariableDefinition(initializer, Optional.empty())));
        }
        // destructuring
        Expr pattern = expr(variable.getTarget());
        Expr value = initializer.orElseGet(() -> new Expr.Lit(new Literal.UndefinedLit(Token.fake("undefined"))));
        Ident synthetic = new Ident(AstHelpers.SPECIAL_MULTIVARDEF_PATTERN,
            Token.fake(AstHelpers.SPECIAL_MULTIVARDEF_PATTERN));
        Expr assign = new Expr.Assign(pattern, Token.fake("="), value);
        return new Definition(AstHelpers.basicEntity(synthetic, List.of(kind)),
            new DefinitionKind.VarDef(new VariableDefinition(Optional.of(assign), Optional.empty())));
    }

    private Stmt forLoop(ForLoop loop) {
        List<Stmt.ForVarOrExpr> init = new ArrayList<>();
        AstNode initializer = loop.getInitializer();
        if (initializer instanceof VariableDeclaration declaration) {
            Attribute kind = declarationKind(declaration);
            for (VariableInitializer variable : declaration.getVariables()) {
                Definition definition = variable(variable, kind);
                init.add(new Stmt.ForVarOrExpr.ForInitVar(definition.entity(),
                    ((DefinitionKind.VarDef) definition.kind()).variable()));
            }
        } else if (initializer != null && !(initializer instanceof EmptyExpression)) {
            init.add(new Stmt.ForVarOrExpr.ForInitExpr(expr(initializer)));
        }
        Stmt.ForHeader header = new Stmt.ForHeader.ForClassic(init, optionalExpr(loop.getCondition()),
            optionalExpr(loop.getIncrement()));
        return new Stmt.For(keyword("for", loop), header, stmt(loop.getBody()));
    }

    private Optional<Expr> optionalExpr(AstNode node) {
        if (node == null || node instanceof EmptyExpression) {
            return Optional.empty();
        }
        return Optional.of(expr(node));
    }

    /**
     * {@code for (x in xs)} and {@code for (x of xs)} both become a for-each over the
     * binding pattern of {@code x}.
     */
    private Stmt forIn(ForInLoop loop) {
        AstNode iterator = loop.getIterator();
        Pattern pattern;
        if (iterator instanceof VariableDeclaration declaration) {
            AstNode target = declaration.getVariables().get(0).getTarget();
            Pattern binder = target instanceof Name name
                ? new Pattern.PatId(ident(name), IdInfo.empty())
                : AstHelpers.exprToPattern(expr(target));
            Token kind = ((Attribute.KeywordAttr) declarationKind(declaration)).keyword().token();
            pattern = new Pattern.OtherPat(Pattern.OtherPatternOp.DECLARATION, List.of(Any.of(kind), Any.of(binder)));
        } else {
            pattern = AstHelpers.exprToPattern(expr(iterator));
        }
        Token in = textToken(loop.isForOf() ? "of" : "in", start(loop) + loop.getInPosition());
        Stmt.ForHeader header = new Stmt.ForHeader.ForEach(pattern, in, expr(loop.getIteratedObject()));
        return new Stmt.For(keyword("for", loop), header, stmt(loop.getBody()));
    }

    private Stmt switchStatement(SwitchStatement switchStatement) {
        List<Stmt.CaseAndBody> cases = new ArrayList<>();
        for (SwitchCase switchCase : switchStatement.getCases()) {
            Stmt.Case label = switchCase.isDefault()
                ? new Stmt.Case.Default(keyword("default", switchCase))
                : new Stmt.Case.CaseEqualExpr(keyword("case", switchCase), expr(switchCase.getExpression()));
            List<Stmt> body = new ArrayList<>();
            if (switchCase.getStatements() != null) {
                switchCase.getStatements().forEach(statement -> body.addAll(stmtAux(statement)));
            }
            cases.add(new Stmt.CaseAndBody(List.of(label), AstHelpers.stmt1(body)));
        }
        return new Stmt.Switch(keyword("switch", switchStatement), Optional.of(expr(switchStatement.getExpression())),
            cases);
    }

    private Stmt tryStatement(TryStatement tryStatement) {
        List<Stmt.Catch> catches = new ArrayList<>();
        for (CatchClause clause : tryStatement.getCatchClauses()) {
            Pattern pattern = clause.getVarName() == null
                ? new Pattern.PatUnderscore(Token.fake("_"))
                : new Pattern.PatId(ident(clause.getVarName()), IdInfo.empty());
            if (clause.getCatchCondition() != null) {
                pattern = new Pattern.PatWhen(pattern, expr(clause.getCatchCondition()));
            }
            catches.add(new Stmt.Catch(keyword("catch", clause), pattern, block(clause.getBody())));
        }
        Optional<Stmt.Finally> finallyClause = Optional.ofNullable(tryStatement.getFinallyBlock())
            .map(block -> new Stmt.Finally(lastTokenBetween("finally", start(tryStatement), start(block)),
                stmt(block)));
        return new Stmt.Try(keyword("try", tryStatement), stmt(tryStatement.getTryBlock()), catches, finallyClause);
    }

    // ==================== Functions ====================

    private Definition functionDefinition(FunctionNode function) {
        Name name = function.getFunctionName();
        Ident ident = name != null ? ident(name) : Ident.fake("anonymous");
        return new Definition(new Entity(ident, functionAttributes(function), List.of(), IdInfo.empty()),
            new DefinitionKind.FuncDef(function(function)));
    }

    private List<Attribute> functionAttributes(FunctionNode function) {
        if (function.isGenerator()) {
            return List.of(Attribute.KeywordAttr.of(KeywordAttribute.GENERATOR, Token.fake("*")));
        }
        return List.of();
    }

    /**
     * Builds the definition shared by declarations, expressions and arrows. A body
     * holding a single statement is that statement.
     */
    private FunctionDefinition function(FunctionNode function) {
        List<Parameter> parameters = new ArrayList<>();
        for (AstNode parameter : function.getParams()) {
            if (parameter instanceof Name name) {
                parameters.add(new Parameter.ParamClassic(new ParameterClassic(Optional.of(ident(name)),
                    Optional.empty(), Optional.empty(), List.of(), IdInfo.empty())));
            } else {
                parameters.add(new Parameter.ParamPattern(AstHelpers.exprToPattern(expr(parameter))));
            }
        }
        return new FunctionDefinition(parameters, Optional.empty(), AstHelpers.stmt1(children(function.getBody())));
    }

    /**
     * Anonymous functions and arrows are lambdas; a function expression with its own
     * name keeps it as a definition.
     */
    private Expr functionExpression(FunctionNode function) {
        if (function.getFunctionName() == null || function.getFunctionType() == FunctionNode.ARROW_FUNCTION) {
            return new Expr.Lambda(function(function));
        }
        return new Expr.OtherExpr(Expr.OtherExprOp.NAMED_FUNCTION, List.of(Any.of(functionDefinition(function))));
    }

    // ==================== Expressions ====================

    Expr expr(AstNode node) {
        if (node instanceof Name name) {
            return name(name);
        }
        if (node instanceof NumberLiteral number) {
            Wrap<String> value = Wrap.of(number.getValue(), tokenAt(number.getValue(), start(number)));
            return new Expr.Lit(INTEGER.matcher(number.getValue()).matches()
                ? new Literal.IntLit(value)
                : new Literal.FloatLit(value));
        }
        if (node instanceof StringLiteral string) {
            return AstHelpers.stringLiteral(string.getValue(), tokenAt(string.getValue(true), start(string)));
        }
        if (node instanceof RegExpLiteral regexp) {
            String text = "/" + regexp.getValue() + "/" + (regexp.getFlags() == null ? "" : regexp.getFlags());
            return new Expr.Lit(new Literal.RegexpLit(Wrap.of(text, tokenAt(text, start(regexp)))));
        }
        if (node instanceof KeywordLiteral keyword) {
            return keywordLiteral(keyword);
        }
        if (node instanceof TemplateLiteral template) {
            return template(template);
        }
        if (node instanceof TaggedTemplateLiteral tagged) {
            return new Expr.Call(expr(tagged.getTarget()),
                Bracket.fake(List.of(AstHelpers.arg(expr(tagged.getTemplateLiteral())))));
        }
        if (node instanceof ParenthesizedExpression parenthesized) {
            return expr(parenthesized.getExpression());
        }
        if (node instanceof ArrayLiteral array) {
            // holes in [a, , b] are empty expressions and read as undefined
            List<Expr> elements = array.getElements().stream().map(this::expr).toList();
            return new Expr.Container(Expr.ContainerKind.ARRAY, bracket(array, "[", elements, "]"));
        }
        if (node instanceof ObjectLiteral object) {
            List<Field> fields = object.getElements().stream().map(this::property).toList();
            return new Expr.RecordLit(bracket(object, "{", fields, "}"));
        }
        if (node instanceof FunctionNode function) {
            return functionExpression(function);
        }
        if (node instanceof PropertyGet property) {
            Token dot = textToken(".", start(property) + property.getOperatorPosition());
            return new Expr.DotAccess(expr(property.getTarget()), dot, new FieldIdent.FId(ident(property.getProperty())));
        }
        if (node instanceof ElementGet element) {
            return new Expr.ArrayAccess(expr(element.getTarget()), expr(element.getElement()));
        }
        if (node instanceof NewExpression creation) {
            List<Argument> arguments = new ArrayList<>();
            arguments.add(AstHelpers.arg(expr(creation.getTarget())));
            creation.getArguments().forEach(argument -> arguments.add(AstHelpers.arg(expr(argument))));
            return new Expr.Call(Expr.IdSpecial.of(Special.Builtin.NEW, keyword("new", creation)),
                callBracket(creation, arguments));
        }
        if (node instanceof FunctionCall call) {
            List<Argument> arguments = call.getArguments().stream().map(argument -> AstHelpers.arg(expr(argument)))
                .toList();
            return new Expr.Call(expr(call.getTarget()), callBracket(call, arguments));
        }
        if (node instanceof Assignment assignment) {
            return assignment(assignment);
        }
        if (node instanceof InfixExpression infix) {
            return infix(infix);
        }
        if (node instanceof UpdateExpression update) {
            return update(update);
        }
        if (node instanceof UnaryExpression unary) {
            return unary(unary);
        }
        if (node instanceof ConditionalExpression conditional) {
            return new Expr.Conditional(expr(conditional.getTestExpression()), expr(conditional.getTrueExpression()),
                expr(conditional.getFalseExpression()));
        }
        if (node instanceof Yield yield) {
            return new Expr.Yield(keyword("yield", yield), Optional.ofNullable(yield.getValue()).map(this::expr),
                yield.getType() != org.mozilla.javascript.Token.YIELD);
        }
        if (node instanceof EmptyExpression) {
            return new Expr.Lit(new Literal.UndefinedLit(Token.fake("undefined")));
        }
        logFallback("expr", node);
        return new Expr.OtherExpr(Expr.OtherExprOp.TODO, childPayload(node));
    }

    /**
     * The normalized direct children of a node with no generic counterpart, or its own
     * token when it has none.
     */
    private List<Any> childPayload(AstNode node) {
        List<Any> payload = new ArrayList<>();
        node.visit(child -> {
            if (child == node) {
                return true;
            }
            payload.add(isStatement(child) ? Any.of(stmt(child)) : Any.of(expr(child)));
            return false;
        });
        if (payload.isEmpty()) {
            payload.add(Any.of(textToken(node.toSource(), start(node))));
        }
        return payload;
    }

    /**
     * Identifiers with a fixed meaning in every JavaScript program.
     */
    private Expr name(Name name) {
        Token token = tokenAt(name.getIdentifier(), start(name));
        return switch (name.getIdentifier()) {
            case "undefined" -> new Expr.Lit(new Literal.UndefinedLit(token));
            case "eval" -> Expr.IdSpecial.of(Special.Builtin.EVAL, token);
            case "require" -> new Expr.OtherExpr(Expr.OtherExprOp.REQUIRE, List.of(Any.of(token)));
            case "exports" -> new Expr.OtherExpr(Expr.OtherExprOp.EXPORTS, List.of(Any.of(token)));
            case "module" -> new Expr.OtherExpr(Expr.OtherExprOp.MODULE, List.of(Any.of(token)));
            case "arguments" -> new Expr.OtherExpr(Expr.OtherExprOp.ARGUMENTS, List.of(Any.of(token)));
            default -> Expr.Id.of(new Ident(name.getIdentifier(), token));
        };
    }

    private Expr keywordLiteral(KeywordLiteral keyword) {
        int type = keyword.getType();
        if (type == org.mozilla.javascript.Token.TRUE || type == org.mozilla.javascript.Token.FALSE) {
            boolean value = type == org.mozilla.javascript.Token.TRUE;
            return new Expr.Lit(new Literal.BoolLit(Wrap.of(value, keyword(String.valueOf(value), keyword))));
        }
        if (type == org.mozilla.javascript.Token.NULL) {
            return new Expr.Lit(new Literal.NullLit(keyword("null", keyword)));
        }
        if (type == org.mozilla.javascript.Token.THIS) {
            return Expr.IdSpecial.of(Special.Builtin.THIS, keyword("this", keyword));
        }
        logFallback("expr", keyword);
        return new Expr.OtherExpr(Expr.OtherExprOp.TODO, childPayload(keyword));
    }

    private Field property(ObjectProperty property) {
        AstNode key = property.getLeft();
        Optional<Ident> name = propertyName(key);
        if (name.isEmpty()) {
            return new Field.FieldDynamic(expr(key), List.of(), expr(property.getRight()));
        }
        if (property.getRight() instanceof FunctionNode function && property.isMethod()) {
            List<Attribute> attributes = new ArrayList<>(functionAttributes(function));
            if (property.isGetterMethod()) {
                attributes.add(Attribute.KeywordAttr.of(KeywordAttribute.GETTER, keyword("get", property)));
            } else if (property.isSetterMethod()) {
                attributes.add(Attribute.KeywordAttr.of(KeywordAttribute.SETTER, keyword("set", property)));
            }
            return new Field.FieldStmt(new Stmt.DefStmt(new Definition(AstHelpers.basicEntity(name.get(), attributes),
                new DefinitionKind.FuncDef(function(function)))));
        }
        return AstHelpers.basicField(name.get(), Optional.of(expr(property.getRight())), Optional.empty());
    }

    private Optional<Ident> propertyName(AstNode key) {
        if (key instanceof Name name) {
            return Optional.of(ident(name));
        }
        if (key instanceof StringLiteral string) {
            return Optional.of(new Ident(string.getValue(), tokenAt(string.getValue(true), start(string))));
        }
        if (key instanceof NumberLiteral number) {
            return Optional.of(new Ident(number.getValue(), tokenAt(number.getValue(), start(number))));
        }
        return Optional.empty();
    }

    private Bracket<List<Argument>> callBracket(FunctionCall call, List<Argument> arguments) {
        Token open = call.getLp() >= 0 ? textToken("(", start(call) + call.getLp()) : Token.fake("(");
        Token close = call.getRp() >= 0 ? textToken(")", start(call) + call.getRp()) : Token.fake(")");
        return new Bracket<>(open, arguments, close);
    }

    /**
     * Template literals concatenate their text chunks and substitutions.
     */
    private Expr template(TemplateLiteral template) {
        List<Argument> parts = new ArrayList<>();
        for (AstNode element : template.getElements()) {
            if (element instanceof TemplateCharacters characters) {
                parts.add(AstHelpers.arg(AstHelpers.stringLiteral(characters.getValue(),
                    tokenAt(characters.getRawValue(), start(characters)))));
            } else {
                parts.add(AstHelpers.arg(expr(element)));
            }
        }
        return AstHelpers.specialCall(Special.Builtin.CONCAT, keyword("`", template), parts);
    }

    private Expr assignment(Assignment assignment) {
        int type = assignment.getOperator();
        String text = AstNode.operatorToString(type);
        Token token = textToken(text, start(assignment) + assignment.getOperatorPosition());
        Expr target = expr(assignment.getLeft());
        Expr value = expr(assignment.getRight());
        if (type == org.mozilla.javascript.Token.ASSIGN) {
            return new Expr.Assign(target, token, value);
        }
        Optional<Operator> operator = compoundOperator(type);
        if (operator.isEmpty()) {
            logFallback("assignment", assignment);
            return new Expr.OtherExpr(Expr.OtherExprOp.TODO, List.of(Any.of(target), Any.of(token), Any.of(value)));
        }
        return new Expr.AssignOp(target, Wrap.of(operator.get(), token), value);
    }

    private static Optional<Operator> compoundOperator(int type) {
        return switch (type) {
            case org.mozilla.javascript.Token.ASSIGN_BITOR -> Optional.of(Operator.BIT_OR);
            case org.mozilla.javascript.Token.ASSIGN_BITXOR -> Optional.of(Operator.BIT_XOR);
            case org.mozilla.javascript.Token.ASSIGN_BITAND -> Optional.of(Operator.BIT_AND);
            case org.mozilla.javascript.Token.ASSIGN_LSH -> Optional.of(Operator.LSL);
            case org.mozilla.javascript.Token.ASSIGN_RSH -> Optional.of(Operator.ASR);
            case org.mozilla.javascript.Token.ASSIGN_URSH -> Optional.of(Operator.LSR);
            case org.mozilla.javascript.Token.ASSIGN_ADD -> Optional.of(Operator.PLUS);
            case org.mozilla.javascript.Token.ASSIGN_SUB -> Optional.of(Operator.MINUS);
            case org.mozilla.javascript.Token.ASSIGN_MUL -> Optional.of(Operator.MULT);
            case org.mozilla.javascript.Token.ASSIGN_DIV -> Optional.of(Operator.DIV);
            case org.mozilla.javascript.Token.ASSIGN_MOD -> Optional.of(Operator.MOD);
            default -> Optional.empty();
        };
    }

    static Optional<Operator> binaryOperator(int type) {
        return switch (type) {
            case org.mozilla.javascript.Token.OR -> Optional.of(Operator.OR);
            case org.mozilla.javascript.Token.AND -> Optional.of(Operator.AND);
            case org.mozilla.javascript.Token.BITOR -> Optional.of(Operator.BIT_OR);
            case org.mozilla.javascript.Token.BITXOR -> Optional.of(Operator.BIT_XOR);
            case org.mozilla.javascript.Token.BITAND -> Optional.of(Operator.BIT_AND);
            case org.mozilla.javascript.Token.EQ -> Optional.of(Operator.EQ);
            case org.mozilla.javascript.Token.NE -> Optional.of(Operator.NOT_EQ);
            case org.mozilla.javascript.Token.SHEQ -> Optional.of(Operator.PHYS_EQ);
            case org.mozilla.javascript.Token.SHNE -> Optional.of(Operator.NOT_PHYS_EQ);
            case org.mozilla.javascript.Token.LT -> Optional.of(Operator.LT);
            case org.mozilla.javascript.Token.LE -> Optional.of(Operator.LT_E);
            case org.mozilla.javascript.Token.GT -> Optional.of(Operator.GT);
            case org.mozilla.javascript.Token.GE -> Optional.of(Operator.GT_E);
            case org.mozilla.javascript.Token.LSH -> Optional.of(Operator.LSL);
            case org.mozilla.javascript.Token.RSH -> Optional.of(Operator.ASR);
            case org.mozilla.javascript.Token.URSH -> Optional.of(Operator.LSR);
            case org.mozilla.javascript.Token.ADD -> Optional.of(Operator.PLUS);
            case org.mozilla.javascript.Token.SUB -> Optional.of(Operator.MINUS);
            case org.mozilla.javascript.Token.MUL -> Optional.of(Operator.MULT);
            case org.mozilla.javascript.Token.DIV -> Optional.of(Operator.DIV);
            case org.mozilla.javascript.Token.MOD -> Optional.of(Operator.MOD);
            default -> Optional.empty();
        };
    }

    private Expr infix(InfixExpression infix) {
        int type = infix.getOperator();
        if (type == org.mozilla.javascript.Token.COMMA) {
            List<Expr> exprs = new ArrayList<>();
            flattenSequence(infix, exprs);
            return new Expr.Seq(exprs);
        }
        String text = AstNode.operatorToString(type);
        Token token = text == null ? Token.fake("op") : textToken(text, start(infix) + infix.getOperatorPosition());
        Expr left = expr(infix.getLeft());
        Expr right = expr(infix.getRight());
        if (type == org.mozilla.javascript.Token.IN) {
            return new Expr.OtherExpr(Expr.OtherExprOp.IN, List.of(Any.of(token), Any.of(left), Any.of(right)));
        }
        if (type == org.mozilla.javascript.Token.INSTANCEOF) {
            return AstHelpers.specialCall(Special.Builtin.INSTANCEOF, token,
                List.of(AstHelpers.arg(left), AstHelpers.arg(right)));
        }
        Optional<Operator> operator = binaryOperator(type);
        if (operator.isEmpty()) {
            logFallback("infix", infix);
            return new Expr.OtherExpr(Expr.OtherExprOp.TODO, List.of(Any.of(left), Any.of(token), Any.of(right)));
        }
        return AstHelpers.opCall(operator.get(), token, List.of(left, right));
    }

    private void flattenSequence(AstNode node, List<Expr> exprs) {
        if (node instanceof InfixExpression infix && !(node instanceof Assignment)
            && infix.getOperator() == org.mozilla.javascript.Token.COMMA) {
            flattenSequence(infix.getLeft(), exprs);
            flattenSequence(infix.getRight(), exprs);
        } else {
            exprs.add(expr(node));
        }
    }

    private Expr update(UpdateExpression update) {
        boolean increment = update.getOperator() == org.mozilla.javascript.Token.INC;
        String text = increment ? "++" : "--";
        boolean postfix = update.isPostfix();
        Token token = postfix ? textToken(text, end(update) - 2) : keyword(text, update);
        Special.IncrDecr special = new Special.IncrDecr(
            increment ? Special.IncrDecr.Kind.INCR : Special.IncrDecr.Kind.DECR,
            postfix ? Special.IncrDecr.Fixity.POSTFIX : Special.IncrDecr.Fixity.PREFIX);
        return AstHelpers.specialCall(special, token, List.of(AstHelpers.arg(expr(update.getOperand()))));
    }

    private Expr unary(UnaryExpression unary) {
        int type = unary.getOperator();
        Expr operand = expr(unary.getOperand());
        return switch (type) {
            case org.mozilla.javascript.Token.NOT -> AstHelpers.opCall(Operator.NOT, keyword("!", unary), List.of(operand));
            case org.mozilla.javascript.Token.BITNOT ->
                AstHelpers.opCall(Operator.BIT_NOT, keyword("~", unary), List.of(operand));
            case org.mozilla.javascript.Token.NEG -> AstHelpers.opCall(Operator.MINUS, keyword("-", unary), List.of(operand));
            case org.mozilla.javascript.Token.POS -> AstHelpers.opCall(Operator.PLUS, keyword("+", unary), List.of(operand));
            case org.mozilla.javascript.Token.TYPEOF ->
                AstHelpers.specialCall(Special.Builtin.TYPEOF, keyword("typeof", unary), List.of(AstHelpers.arg(operand)));
            case org.mozilla.javascript.Token.VOID ->
                new Expr.OtherExpr(Expr.OtherExprOp.VOID, List.of(Any.of(keyword("void", unary)), Any.of(operand)));
            case org.mozilla.javascript.Token.DELPROP ->
                new Expr.OtherExpr(Expr.OtherExprOp.DELETE, List.of(Any.of(keyword("delete", unary)), Any.of(operand)));
            default -> {
                logFallback("unary", unary);
                String symbol = start(unary.getOperand()) > start(unary)
                    ? content.substring(start(unary), start(unary.getOperand())).strip() : "";
                Token token = symbol.isEmpty() ? Token.fake("unary") : keyword(symbol, unary);
                yield new Expr.OtherExpr(Expr.OtherExprOp.TODO, List.of(Any.of(token), Any.of(operand)));
            }
        };
    }
}
