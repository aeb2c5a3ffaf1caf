package com.polyast.core.normalizer.java;

import com.github.javaparser.JavaToken;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.PackageDeclaration;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.AnnotationMemberDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.ArrayAccessExpr;
import com.github.javaparser.ast.expr.ArrayCreationExpr;
import com.github.javaparser.ast.expr.ArrayInitializerExpr;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.CharLiteralExpr;
import com.github.javaparser.ast.expr.ClassExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.InstanceOfExpr;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NormalAnnotationExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.PatternExpr;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.expr.SingleMemberAnnotationExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.SuperExpr;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.expr.TextBlockLiteralExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.ast.expr.TypeExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.modules.ModuleDeclaration;
import com.github.javaparser.ast.stmt.AssertStmt;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.EmptyStmt;
import com.github.javaparser.ast.stmt.ExplicitConstructorInvocationStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.stmt.YieldStmt;
import com.github.javaparser.ast.type.ArrayType;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.IntersectionType;
import com.github.javaparser.ast.type.PrimitiveType;
import com.github.javaparser.ast.type.ReferenceType;
import com.github.javaparser.ast.type.UnionType;
import com.github.javaparser.ast.type.UnknownType;
import com.github.javaparser.ast.type.VarType;
import com.github.javaparser.ast.type.VoidType;
import com.github.javaparser.ast.type.WildcardType;
import com.polyast.core.ast.Any;
import com.polyast.core.ast.Argument;
import com.polyast.core.ast.AstHelpers;
import com.polyast.core.ast.Attribute;
import com.polyast.core.ast.Attribute.KeywordAttribute;
import com.polyast.core.ast.Bracket;
import com.polyast.core.ast.ClassDefinition;
import com.polyast.core.ast.ClassDefinition.ClassKind;
import com.polyast.core.ast.Definition;
import com.polyast.core.ast.DefinitionKind;
import com.polyast.core.ast.Directive;
import com.polyast.core.ast.Entity;
import com.polyast.core.ast.Expr;
import com.polyast.core.ast.Field;
import com.polyast.core.ast.FieldIdent;
import com.polyast.core.ast.FunctionDefinition;
import com.polyast.core.ast.IdInfo;
import com.polyast.core.ast.Ident;
import com.polyast.core.ast.Literal;
import com.polyast.core.ast.Location;
import com.polyast.core.ast.ModuleDefinition;
import com.polyast.core.ast.ModuleName;
import com.polyast.core.ast.Name;
import com.polyast.core.ast.NameInfo;
import com.polyast.core.ast.Operator;
import com.polyast.core.ast.Parameter;
import com.polyast.core.ast.ParameterClassic;
import com.polyast.core.ast.Pattern;
import com.polyast.core.ast.Special;
import com.polyast.core.ast.Stmt;
import com.polyast.core.ast.Token;
import com.polyast.core.ast.Type;
import com.polyast.core.ast.TypeArgument;
import com.polyast.core.ast.TypeDefinition;
import com.polyast.core.ast.TypeParameter;
import com.polyast.core.ast.VariableDefinition;
import com.polyast.core.ast.Wrap;
import com.polyast.core.lang.Language;
import com.polyast.core.lang.SourceFile;
import com.polyast.core.normalizer.AbstractNormalizer;
import com.polyast.core.normalizer.NormalizationException;
import com.polyast.core.normalizer.Normalizer;
import com.polyast.core.normalizer.NormalizerProvider;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Translates JavaParser {@link CompilationUnit} trees into the generic AST.
 *
 * <p>The compilation unit must be parsed with token storage enabled
 * ({@code ParserConfiguration.setStoreTokens(true)}, as done by
 * {@link com.polyast.core.parser.JavaSourceParser}); tokens that cannot be recovered
 * become fake tokens.
 *
 * <p><b>Names and member accesses:</b> without symbol information {@code a.b.c} is
 * ambiguous between a package path, a type and a field chain. Only the last dot is
 * translated as a {@link Expr.DotAccess}; the prefix stays a dotted name
 * ({@link Expr.Id} or {@link Expr.IdQualified}) for a later naming pass to reclassify.
 *
 * <p><b>Arrays:</b> {@code int[][] x} and {@code new int[n][]} both fold into one
 * {@link Type.TyArray} per bracket pair.
 *
 * @since 1.0.0
 */
public class JavaNormalizer extends AbstractNormalizer<CompilationUnit> {

    private static final Comparator<Node> SOURCE_ORDER = Comparator
        .comparing((Node node) -> node.getBegin().map(position -> position.line).orElse(0))
        .thenComparing(node -> node.getBegin().map(position -> position.column).orElse(0));

    public JavaNormalizer(SourceFile sourceFile) {
        super(Language.JAVA, CompilationUnit.class, sourceFile);
    }

    /**
     * SPI entry for {@link JavaNormalizer}.
     */
    public static class Provider implements NormalizerProvider {

        @Override
        public Language language() {
            return Language.JAVA;
        }

        @Override
        public String getDisplayName() {
            return "Java (JavaParser)";
        }

        @Override
        public Normalizer<?> create(SourceFile sourceFile) {
            return new JavaNormalizer(sourceFile);
        }
    }

    // ==================== Entry points ====================

    @Override
    public List<Stmt> program(CompilationUnit unit) {
        List<Stmt> program = new ArrayList<>();
        unit.getPackageDeclaration().ifPresent(declaration -> program.add(packageDirective(declaration)));
        unit.getImports().forEach(declaration -> program.add(importDirective(declaration)));
        unit.getTypes().forEach(type -> program.add(typeDeclaration(type)));
        unit.getModule().ifPresent(module -> program.add(moduleDeclaration(module)));
        return program;
    }

    @Override
    public Any any(Object fragment) {
        if (fragment instanceof CompilationUnit unit) {
            return Any.program(program(unit));
        }
        if (fragment instanceof Statement statement) {
            return Any.of(stmt(statement));
        }
        if (fragment instanceof Expression expression) {
            return Any.of(expr(expression));
        }
        if (fragment instanceof com.github.javaparser.ast.type.Type type) {
            return Any.of(type(type));
        }
        if (fragment instanceof BodyDeclaration<?> member) {
            Stmt stmt = AstHelpers.stmt1(member(member));
            if (stmt instanceof Stmt.DefStmt defStmt) {
                return Any.of(defStmt.definition());
            }
            return Any.of(stmt);
        }
        if (fragment instanceof com.github.javaparser.ast.body.Parameter parameter) {
            return new Any.AParam(parameter(parameter));
        }
        if (fragment instanceof SimpleName name) {
            return Any.of(ident(name));
        }
        if (fragment instanceof List<?> list && list.stream().allMatch(Statement.class::isInstance)) {
            return new Any.AStmts(stmts(list.stream().map(Statement.class::cast).toList()));
        }
        throw new IllegalArgumentException("Not a JavaParser node: "
            + (fragment == null ? "null" : fragment.getClass().getName()));
    }

    // ==================== Tokens and names ====================

    private Token tok(JavaToken token) {
        return token.getRange()
            .map(range -> token(token.getText(), range.begin.line, range.begin.column))
            .orElseGet(() -> Token.fake(token.getText()));
    }

    private Token tok(Optional<JavaToken> token, String fallback) {
        return token.map(this::tok).orElseGet(() -> Token.fake(fallback));
    }

    private Token firstToken(Node node, String fallback) {
        return tok(JavaTokens.first(node), fallback);
    }

    /**
     * The normalized children of a node with no generic counterpart. The node's first
     * token leads the payload unless a child starts with it.
     */
    private List<Any> childPayload(Node node, String fallback) {
        List<Node> children = node.getChildNodes().stream().filter(child -> !(child instanceof Comment)).toList();
        List<Any> payload = new ArrayList<>();
        if (children.stream().noneMatch(child -> child.getBegin().equals(node.getBegin()))) {
            payload.add(Any.of(firstToken(node, fallback)));
        }
        for (Node child : children) {
            if (child instanceof Expression expression) {
                payload.add(Any.of(expr(expression)));
            } else if (child instanceof Statement statement) {
                payload.add(Any.of(stmt(statement)));
            } else if (child instanceof com.github.javaparser.ast.type.Type type) {
                payload.add(Any.of(type(type)));
            } else if (child instanceof BodyDeclaration<?> member) {
                member(member).forEach(stmt -> payload.add(Any.of(stmt)));
            } else if (child instanceof SimpleName name) {
                payload.add(Any.of(ident(name)));
            }
        }
        return payload;
    }

    private Token lastToken(Node node, String fallback) {
        return tok(JavaTokens.last(node), fallback);
    }

    private Token keyword(Node node, String text) {
        return tok(JavaTokens.find(node, text), text);
    }

    /**
     * Returns the statement terminator, or a fake one when the node does not end with
     * {@code ;} (e.g. the body of an expression lambda).
     */
    private Token semicolon(Node node) {
        return JavaTokens.last(node).filter(token -> token.getText().equals(";"))
            .map(this::tok).orElseGet(() -> Token.fake(";"));
    }

    private Location locationOf(Node node) {
        return node.getBegin().map(position -> location(position.line, position.column)).orElse(null);
    }

    private Ident ident(SimpleName name) {
        return new Ident(name.getIdentifier(), firstToken(name, name.getIdentifier()));
    }

    /**
     * Flattens a JavaParser qualified name, outermost qualifier first.
     */
    private List<Ident> dotted(com.github.javaparser.ast.expr.Name name) {
        List<Ident> parts = new ArrayList<>();
        name.getQualifier().ifPresent(qualifier -> parts.addAll(dotted(qualifier)));
        parts.add(new Ident(name.getIdentifier(), lastToken(name, name.getIdentifier())));
        return parts;
    }

    /**
     * Splits a dotted path: the last element is the name, the rest in source order is
     * its qualifier. A single element is a plain identifier.
     *
     * @throws NormalizationException for an empty path
     */
    Expr nameExpr(List<Ident> parts, Node context) {
        if (parts.isEmpty()) {
            throw new NormalizationException("Empty qualified name", locationOf(context));
        }
        if (parts.size() == 1) {
            return Expr.Id.of(parts.get(0));
        }
        return new Expr.IdQualified(qualifiedName(parts), IdInfo.empty());
    }

    private static Name qualifiedName(List<Ident> parts) {
        Ident last = parts.get(parts.size() - 1);
        if (parts.size() == 1) {
            return Name.of(last);
        }
        return new Name(last, NameInfo.qualified(parts.subList(0, parts.size() - 1)));
    }

    /**
     * True for {@code a}, {@code a.b}, {@code a.b.c}: identifier chains that might be a
     * package or type path rather than field accesses.
     */
    private static boolean isNameChain(Expression expression) {
        if (expression instanceof NameExpr) {
            return true;
        }
        if (expression instanceof FieldAccessExpr access) {
            return access.getTypeArguments().isEmpty() && isNameChain(access.getScope());
        }
        return false;
    }

    private List<Ident> nameChain(Expression expression) {
        if (expression instanceof NameExpr name) {
            return new ArrayList<>(List.of(ident(name.getName())));
        }
        FieldAccessExpr access = (FieldAccessExpr) expression;
        List<Ident> parts = nameChain(access.getScope());
        parts.add(ident(access.getName()));
        return parts;
    }

    /**
     * Translates the receiver of a member access, keeping identifier chains as names.
     */
    private Expr receiver(Expression scope) {
        return isNameChain(scope) ? nameExpr(nameChain(scope), scope) : expr(scope);
    }

    // ==================== Directives ====================

    private Stmt packageDirective(PackageDeclaration declaration) {
        return new Stmt.DirectiveStmt(new Directive.Package(firstToken(declaration, "package"),
            dotted(declaration.getName())));
    }

    private Stmt importDirective(ImportDeclaration declaration) {
        Token importToken = firstToken(declaration, "import");
        List<Ident> path = dotted(declaration.getName());
        Directive directive;
        if (declaration.isAsterisk()) {
            directive = new Directive.ImportAll(importToken, new ModuleName.DottedName(path), keyword(declaration, "*"));
        } else if (path.size() == 1) {
            directive = new Directive.ImportAs(importToken, new ModuleName.DottedName(path), Optional.empty());
        } else {
            directive = new Directive.ImportFrom(importToken,
                new ModuleName.DottedName(path.subList(0, path.size() - 1)), path.get(path.size() - 1),
                Optional.empty());
        }
        if (declaration.isStatic()) {
            directive = new Directive.OtherDirective(Directive.OtherDirectiveOp.STATIC_IMPORT,
                List.of(Any.of(directive), Any.of(keyword(declaration, "static"))));
        }
        return new Stmt.DirectiveStmt(directive);
    }

    private Stmt moduleDeclaration(ModuleDeclaration module) {
        List<Ident> name = dotted(module.getName());
        ModuleDefinition definition = new ModuleDefinition.OtherModule(ModuleDefinition.OtherModuleOp.JAVA_MODULE,
            List.of(Any.of(keyword(module, "module")), new Any.ADotted(name)));
        Entity entity = AstHelpers.basicEntity(name.get(name.size() - 1), annotations(module.getAnnotations()));
        return new Stmt.DefStmt(new Definition(entity, new DefinitionKind.ModuleDef(definition)));
    }

    // ==================== Attributes ====================

    /**
     * Merges modifiers and annotations in source order.
     */
    private List<Attribute> attributes(NodeList<Modifier> modifiers, NodeList<AnnotationExpr> annotations) {
        List<Node> nodes = new ArrayList<>(modifiers);
        nodes.addAll(annotations);
        nodes.sort(SOURCE_ORDER);
        List<Attribute> attributes = new ArrayList<>();
        for (Node node : nodes) {
            attributes.add(node instanceof Modifier modifier ? modifier(modifier) : annotation((AnnotationExpr) node));
        }
        return attributes;
    }

    private List<Attribute> annotations(NodeList<AnnotationExpr> annotations) {
        return annotations.stream().map(this::annotation).toList();
    }

    private Attribute modifier(Modifier modifier) {
        Token token = firstToken(modifier, modifier.getKeyword().asString());
        return switch (modifier.getKeyword()) {
            case PUBLIC -> Attribute.KeywordAttr.of(KeywordAttribute.PUBLIC, token);
            case PROTECTED -> Attribute.KeywordAttr.of(KeywordAttribute.PROTECTED, token);
            case PRIVATE -> Attribute.KeywordAttr.of(KeywordAttribute.PRIVATE, token);
            case ABSTRACT -> Attribute.KeywordAttr.of(KeywordAttribute.ABSTRACT, token);
            case STATIC -> Attribute.KeywordAttr.of(KeywordAttribute.STATIC, token);
            case FINAL -> Attribute.KeywordAttr.of(KeywordAttribute.FINAL, token);
            case VOLATILE -> Attribute.KeywordAttr.of(KeywordAttribute.VOLATILE, token);
            case DEFAULT -> otherAttribute(Attribute.OtherAttributeOp.DEFAULT, token);
            case TRANSIENT -> otherAttribute(Attribute.OtherAttributeOp.TRANSIENT, token);
            case SYNCHRONIZED -> otherAttribute(Attribute.OtherAttributeOp.SYNCHRONIZED, token);
            case NATIVE -> otherAttribute(Attribute.OtherAttributeOp.NATIVE, token);
            case STRICTFP -> otherAttribute(Attribute.OtherAttributeOp.STRICT_FP, token);
            case SEALED -> otherAttribute(Attribute.OtherAttributeOp.SEALED, token);
            case NON_SEALED -> otherAttribute(Attribute.OtherAttributeOp.NON_SEALED, token);
            default -> otherAttribute(Attribute.OtherAttributeOp.ANNOT_JAVA_OTHER, token);
        };
    }

    private static Attribute otherAttribute(Attribute.OtherAttributeOp op, Token token) {
        return new Attribute.OtherAttribute(op, List.of(Any.of(token)));
    }

    private Attribute annotation(AnnotationExpr annotation) {
        Token at = firstToken(annotation, "@");
        Name name = qualifiedName(dotted(annotation.getName()));
        Bracket<List<Argument>> arguments;
        if (annotation instanceof SingleMemberAnnotationExpr single) {
            arguments = annotationArguments(annotation,
                List.of(AstHelpers.arg(elementValue(single.getMemberValue()))));
        } else if (annotation instanceof NormalAnnotationExpr normal) {
            List<Argument> pairs = new ArrayList<>();
            for (MemberValuePair pair : normal.getPairs()) {
                pairs.add(new Argument.ArgKwd(ident(pair.getName()), elementValue(pair.getValue())));
            }
            arguments = annotationArguments(annotation, pairs);
        } else {
            // marker annotation
            arguments = Bracket.fake(List.of());
        }
        return new Attribute.NamedAttr(at, name, IdInfo.empty(), arguments);
    }

    private Bracket<List<Argument>> annotationArguments(AnnotationExpr annotation, List<Argument> arguments) {
        Token open = tok(JavaTokens.after(annotation.getName()), "(");
        return new Bracket<>(open, arguments, lastToken(annotation, ")"));
    }

    private Expr elementValue(Expression value) {
        if (value instanceof AnnotationExpr nested) {
            return new Expr.OtherExpr(Expr.OtherExprOp.ANNOT, List.of(Any.of(annotation(nested))));
        }
        if (value instanceof ArrayInitializerExpr array) {
            return new Expr.Container(Expr.ContainerKind.LIST,
                new Bracket<>(firstToken(array, "{"), array.getValues().stream().map(this::elementValue).toList(),
                    lastToken(array, "}")));
        }
        return expr(value);
    }

    // ==================== Types ====================

    Type type(com.github.javaparser.ast.type.Type type) {
        if (type instanceof PrimitiveType primitive) {
            String name = primitive.getType().asString();
            return new Type.TyBuiltin(Wrap.of(name, firstToken(primitive, name)));
        }
        if (type instanceof VoidType) {
            return new Type.TyBuiltin(Wrap.of("void", firstToken(type, "void")));
        }
        if (type instanceof VarType) {
            return new Type.OtherType(Type.OtherTypeOp.VAR, List.of(Any.of(firstToken(type, "var"))));
        }
        if (type instanceof ClassOrInterfaceType classType) {
            return classType(classType);
        }
        if (type instanceof ArrayType array) {
            return arrayOf(array.getArrayLevel(), type(array.getElementType()), array);
        }
        if (type instanceof UnionType union) {
            return foldTypes(union.getElements(), "|", (left, token, right) -> new Type.TyOr(left, token, right));
        }
        if (type instanceof IntersectionType intersection) {
            return foldTypes(intersection.getElements(), "&", (left, token, right) -> new Type.TyAnd(left, token, right));
        }
        logFallback("type", type);
        return new Type.OtherType(Type.OtherTypeOp.TODO, childPayload(type, type.asString()));
    }

    private Optional<Type> optionalType(com.github.javaparser.ast.type.Type type) {
        return type instanceof UnknownType ? Optional.empty() : Optional.of(type(type));
    }

    /**
     * Wraps {@code element} in {@code depth} array types.
     *
     * @throws NormalizationException when {@code depth < 1}; the grammar requires at
     *         least one bracket pair
     */
    Type arrayOf(int depth, Type element, Node context) {
        if (depth < 1) {
            throw new NormalizationException("Array type of depth " + depth, locationOf(context));
        }
        Type result = element;
        for (int i = 0; i < depth; i++) {
            result = new Type.TyArray(Bracket.fake(Optional.empty()), result);
        }
        return result;
    }

    private interface TypeCombiner {
        Type combine(Type left, Token token, Type right);
    }

    private Type foldTypes(NodeList<ReferenceType> elements, String separator, TypeCombiner combiner) {
        Type result = type(elements.get(0));
        for (int i = 1; i < elements.size(); i++) {
            Token token = tok(JavaTokens.after(elements.get(i - 1)), separator);
            result = combiner.combine(result, token, type(elements.get(i)));
        }
        return result;
    }

    private Type classType(ClassOrInterfaceType type) {
        List<ClassOrInterfaceType> segments = new ArrayList<>();
        for (Optional<ClassOrInterfaceType> current = Optional.of(type); current.isPresent();
             current = current.get().getScope()) {
            segments.add(0, current.get());
        }
        List<Ident> parts = segments.stream().map(segment -> ident(segment.getName())).toList();
        List<TypeArgument> qualifierArguments = new ArrayList<>();
        for (ClassOrInterfaceType segment : segments.subList(0, segments.size() - 1)) {
            segment.getTypeArguments().ifPresent(arguments -> qualifierArguments.addAll(typeArguments(arguments)));
        }
        Name name = qualifiedName(parts);
        if (!qualifierArguments.isEmpty()) {
            name = new Name(name.ident(), new NameInfo(name.info().qualifier(), Optional.of(qualifierArguments)));
        }
        Optional<NodeList<com.github.javaparser.ast.type.Type>> arguments = type.getTypeArguments();
        if (arguments.isPresent()) {
            return new Type.TyNameApply(name, typeArguments(arguments.get()));
        }
        return new Type.TyName(name);
    }

    private List<TypeArgument> typeArguments(NodeList<com.github.javaparser.ast.type.Type> arguments) {
        return arguments.stream().map(this::typeArgument).toList();
    }

    private TypeArgument typeArgument(com.github.javaparser.ast.type.Type argument) {
        if (argument instanceof WildcardType wildcard) {
            List<Any> payload = new ArrayList<>();
            payload.add(Any.of(firstToken(wildcard, "?")));
            wildcard.getExtendedType().ifPresent(bound -> {
                payload.add(Any.of(keyword(wildcard, "extends")));
                payload.add(Any.of(type(bound)));
            });
            wildcard.getSuperType().ifPresent(bound -> {
                payload.add(Any.of(keyword(wildcard, "super")));
                payload.add(Any.of(type(bound)));
            });
            return new TypeArgument.OtherTypeArg(TypeArgument.OtherTypeArgumentOp.QUESTION, payload);
        }
        return new TypeArgument.TypeArg(type(argument));
    }

    private List<TypeParameter> typeParameters(NodeList<com.github.javaparser.ast.type.TypeParameter> parameters) {
        return parameters.stream()
            .map(parameter -> new TypeParameter(ident(parameter.getName()),
                parameter.getTypeBound().stream().map(this::type).toList()))
            .toList();
    }

    // ==================== Declarations ====================

    private Stmt typeDeclaration(TypeDeclaration<?> declaration) {
        if (declaration instanceof ClassOrInterfaceDeclaration classDeclaration) {
            return classDeclaration(classDeclaration);
        }
        if (declaration instanceof EnumDeclaration enumDeclaration) {
            return enumDeclaration(enumDeclaration);
        }
        if (declaration instanceof RecordDeclaration recordDeclaration) {
            return recordDeclaration(recordDeclaration);
        }
        if (declaration instanceof AnnotationDeclaration annotationDeclaration) {
            return annotationDeclaration(annotationDeclaration);
        }
        logFallback("declaration", declaration);
        return new Stmt.OtherStmt(Stmt.OtherStmtOp.TODO, childPayload(declaration, "type"));
    }

    private Entity entity(SimpleName name, List<Attribute> attributes, List<TypeParameter> typeParameters) {
        return new Entity(ident(name), attributes, typeParameters, IdInfo.empty());
    }

    private Wrap<ClassKind> classKind(ClassKind kind, TypeDeclaration<?> declaration, String keyword) {
        return Wrap.of(kind, tok(JavaTokens.before(declaration.getName()), keyword));
    }

    /**
     * Brackets the members of {@code owner}; the opening brace is the first one after
     * the declared name.
     */
    private Bracket<List<Field>> classBody(Node owner, SimpleName name, List<Field> fields) {
        Optional<JavaToken> open = JavaTokens.after(name);
        if (open.isPresent() && open.get().getText().equals("(")) {
            open = JavaTokens.closing(open.get()).flatMap(JavaTokens::next);
        }
        open = open.flatMap(token -> JavaTokens.find(token, "{"));
        return new Bracket<>(tok(open, "{"), fields, lastToken(owner, "}"));
    }

    private List<Field> members(List<? extends BodyDeclaration<?>> members) {
        List<Field> fields = new ArrayList<>();
        for (BodyDeclaration<?> member : members) {
            member(member).forEach(stmt -> fields.add(new Field.FieldStmt(stmt)));
        }
        return fields;
    }

    private Stmt classDeclaration(ClassOrInterfaceDeclaration declaration) {
        Entity entity = entity(declaration.getName(),
            attributes(declaration.getModifiers(), declaration.getAnnotations()),
            typeParameters(declaration.getTypeParameters()));
        Wrap<ClassKind> kind = declaration.isInterface()
            ? classKind(ClassKind.INTERFACE, declaration, "interface")
            : classKind(ClassKind.CLASS, declaration, "class");
        ClassDefinition definition = new ClassDefinition(kind,
            declaration.getExtendedTypes().stream().map(this::type).toList(),
            declaration.getImplementedTypes().stream().map(this::type).toList(),
            List.of(),
            classBody(declaration, declaration.getName(), members(declaration.getMembers())));
        return new Stmt.DefStmt(new Definition(entity, new DefinitionKind.ClassDef(definition)));
    }

    /**
     * An enum with plain constants only is a sum type; anything richer (constructor
     * arguments, constant bodies, members, interfaces) is a class of kind
     * {@link ClassKind#ENUM}.
     */
    private Stmt enumDeclaration(EnumDeclaration declaration) {
        Entity entity = entity(declaration.getName(),
            attributes(declaration.getModifiers(), declaration.getAnnotations()), List.of());
        boolean simple = declaration.getMembers().isEmpty() && declaration.getImplementedTypes().isEmpty()
            && declaration.getEntries().stream()
                .allMatch(entry -> entry.getArguments().isEmpty() && entry.getClassBody().isEmpty());
        if (simple) {
            List<TypeDefinition.OrTypeElement> constants = declaration.getEntries().stream()
                .<TypeDefinition.OrTypeElement>map(entry ->
                    new TypeDefinition.OrTypeElement.OrEnum(ident(entry.getName()), Optional.empty()))
                .toList();
            return new Stmt.DefStmt(new Definition(entity,
                new DefinitionKind.TypeDef(new TypeDefinition.OrType(constants))));
        }
        List<Field> fields = new ArrayList<>();
        declaration.getEntries().forEach(entry -> fields.add(new Field.FieldStmt(enumConstant(entry))));
        fields.addAll(members(declaration.getMembers()));
        ClassDefinition definition = new ClassDefinition(classKind(ClassKind.ENUM, declaration, "enum"),
            List.of(), declaration.getImplementedTypes().stream().map(this::type).toList(), List.of(),
            classBody(declaration, declaration.getName(), fields));
        return new Stmt.DefStmt(new Definition(entity, new DefinitionKind.ClassDef(definition)));
    }

    private Stmt enumConstant(EnumConstantDeclaration entry) {
        Ident name = ident(entry.getName());
        TypeDefinition.OrTypeElement element;
        if (entry.getArguments().isEmpty() && entry.getClassBody().isEmpty()) {
            element = new TypeDefinition.OrTypeElement.OrEnum(name, Optional.empty());
        } else {
            List<Any> payload = new ArrayList<>();
            payload.add(Any.of(name));
            entry.getArguments().forEach(argument -> payload.add(Any.of(AstHelpers.arg(expr(argument)))));
            if (!entry.getClassBody().isEmpty()) {
                ClassDefinition body = new ClassDefinition(Wrap.fake(ClassKind.CLASS), List.of(), List.of(), List.of(),
                    classBody(entry, entry.getName(), members(entry.getClassBody())));
                payload.add(Any.of(new Expr.AnonClass(body)));
            }
            element = new TypeDefinition.OrTypeElement.OtherOr(
                TypeDefinition.OtherOrTypeElementOp.ENUM_WITH_ARGUMENTS, payload);
        }
        Entity entity = AstHelpers.basicEntity(name, annotations(entry.getAnnotations()));
        return new Stmt.DefStmt(new Definition(entity,
            new DefinitionKind.TypeDef(new TypeDefinition.OrType(List.of(element)))));
    }

    /**
     * Record components become fields ahead of the declared members.
     */
    private Stmt recordDeclaration(RecordDeclaration declaration) {
        Entity entity = entity(declaration.getName(),
            attributes(declaration.getModifiers(), declaration.getAnnotations()),
            typeParameters(declaration.getTypeParameters()));
        List<Field> fields = new ArrayList<>();
        for (com.github.javaparser.ast.body.Parameter component : declaration.getParameters()) {
            Entity componentEntity = entity(component.getName(),
                attributes(component.getModifiers(), component.getAnnotations()), List.of());
            VariableDefinition variable = new VariableDefinition(Optional.empty(), Optional.of(type(component.getType())));
            fields.add(new Field.FieldStmt(new Stmt.DefStmt(new Definition(componentEntity,
                new DefinitionKind.VarDef(variable)))));
        }
        fields.addAll(members(declaration.getMembers()));
        ClassDefinition definition = new ClassDefinition(classKind(ClassKind.RECORD, declaration, "record"),
            List.of(), declaration.getImplementedTypes().stream().map(this::type).toList(), List.of(),
            classBody(declaration, declaration.getName(), fields));
        return new Stmt.DefStmt(new Definition(entity, new DefinitionKind.ClassDef(definition)));
    }

    private Stmt annotationDeclaration(AnnotationDeclaration declaration) {
        Entity entity = entity(declaration.getName(),
            attributes(declaration.getModifiers(), declaration.getAnnotations()), List.of());
        ClassDefinition definition = new ClassDefinition(classKind(ClassKind.ANNOTATION, declaration, "interface"),
            List.of(), List.of(), List.of(),
            classBody(declaration, declaration.getName(), members(declaration.getMembers())));
        return new Stmt.DefStmt(new Definition(entity, new DefinitionKind.ClassDef(definition)));
    }

    /**
     * Translates a class member. Field declarations with several variables yield one
     * definition per variable.
     */
    private List<Stmt> member(BodyDeclaration<?> member) {
        if (member instanceof FieldDeclaration field) {
            List<Attribute> attributes = attributes(field.getModifiers(), field.getAnnotations());
            return field.getVariables().stream().map(variable -> variableDefinition(variable, attributes)).toList();
        }
        if (member instanceof MethodDeclaration method) {
            return List.of(methodDeclaration(method));
        }
        if (member instanceof ConstructorDeclaration constructor) {
            return List.of(constructorDeclaration(constructor));
        }
        if (member instanceof CompactConstructorDeclaration compact) {
            List<Attribute> attributes = new ArrayList<>(attributes(compact.getModifiers(), compact.getAnnotations()));
            attributes.add(Attribute.KeywordAttr.of(KeywordAttribute.CTOR, Token.fake("ctor")));
            FunctionDefinition function = new FunctionDefinition(List.of(), Optional.empty(), stmt(compact.getBody()));
            return List.of(new Stmt.DefStmt(new Definition(entity(compact.getName(), attributes,
                typeParameters(compact.getTypeParameters())), new DefinitionKind.FuncDef(function))));
        }
        if (member instanceof InitializerDeclaration initializer) {
            return List.of(stmt(initializer.getBody()));
        }
        if (member instanceof TypeDeclaration<?> nested) {
            return List.of(typeDeclaration(nested));
        }
        if (member instanceof AnnotationMemberDeclaration annotationMember) {
            return List.of(annotationMember(annotationMember));
        }
        logFallback("member", member);
        return List.of(new Stmt.OtherStmt(Stmt.OtherStmtOp.TODO, childPayload(member, "member")));
    }

    private Stmt variableDefinition(VariableDeclarator variable, List<Attribute> attributes) {
        Entity entity = entity(variable.getName(), attributes, List.of());
        VariableDefinition definition = new VariableDefinition(variable.getInitializer().map(this::initializer),
            Optional.of(type(variable.getType())));
        return new Stmt.DefStmt(new Definition(entity, new DefinitionKind.VarDef(definition)));
    }

    private Expr initializer(Expression initializer) {
        if (initializer instanceof ArrayInitializerExpr array) {
            return arrayInitializer(array);
        }
        return expr(initializer);
    }

    private Expr arrayInitializer(ArrayInitializerExpr array) {
        return new Expr.Container(Expr.ContainerKind.ARRAY, new Bracket<>(firstToken(array, "{"),
            array.getValues().stream().map(this::initializer).toList(), lastToken(array, "}")));
    }

    private Stmt methodDeclaration(MethodDeclaration method) {
        List<Attribute> attributes = new ArrayList<>(attributes(method.getModifiers(), method.getAnnotations()));
        attributes.addAll(throwsClause(method.getThrownExceptions()));
        List<Parameter> parameters = new ArrayList<>();
        method.getReceiverParameter().ifPresent(receiver -> parameters.add(new Parameter.OtherParam(
            Parameter.OtherParameterOp.RECEIVER,
            List.of(Any.of(type(receiver.getType())), new Any.ADotted(dotted(receiver.getName()))))));
        method.getParameters().forEach(parameter -> parameters.add(parameter(parameter)));
        Stmt body = method.getBody().map(this::stmt).orElseGet(() -> {
            Token semicolon = semicolon(method);
            return new Stmt.Block(new Bracket<>(semicolon, List.of(), semicolon));
        });
        FunctionDefinition function = new FunctionDefinition(parameters, Optional.of(type(method.getType())), body);
        Entity entity = entity(method.getName(), attributes, typeParameters(method.getTypeParameters()));
        return new Stmt.DefStmt(new Definition(entity, new DefinitionKind.FuncDef(function)));
    }

    private Stmt constructorDeclaration(ConstructorDeclaration constructor) {
        List<Attribute> attributes = new ArrayList<>(attributes(constructor.getModifiers(), constructor.getAnnotations()));
        attributes.add(Attribute.KeywordAttr.of(KeywordAttribute.CTOR, Token.fake("ctor")));
        attributes.addAll(throwsClause(constructor.getThrownExceptions()));
        FunctionDefinition function = new FunctionDefinition(
            constructor.getParameters().stream().map(this::parameter).toList(), Optional.empty(),
            stmt(constructor.getBody()));
        Entity entity = entity(constructor.getName(), attributes, typeParameters(constructor.getTypeParameters()));
        return new Stmt.DefStmt(new Definition(entity, new DefinitionKind.FuncDef(function)));
    }

    private List<Attribute> throwsClause(NodeList<ReferenceType> thrown) {
        return thrown.stream()
            .<Attribute>map(type -> new Attribute.OtherAttribute(Attribute.OtherAttributeOp.ANNOT_THROW,
                List.of(Any.of(type(type)))))
            .toList();
    }

    /**
     * Annotation elements are signatures {@code () -> type}; a default value becomes a
     * {@code DEFAULT} attribute.
     */
    private Stmt annotationMember(AnnotationMemberDeclaration member) {
        List<Attribute> attributes = new ArrayList<>(attributes(member.getModifiers(), member.getAnnotations()));
        member.getDefaultValue().ifPresent(value -> attributes.add(new Attribute.OtherAttribute(
            Attribute.OtherAttributeOp.DEFAULT, List.of(Any.of(keyword(member, "default")), Any.of(elementValue(value))))));
        Type signature = new Type.TyFun(List.of(), type(member.getType()));
        return new Stmt.DefStmt(new Definition(entity(member.getName(), attributes, List.of()),
            new DefinitionKind.Signature(signature)));
    }

    Parameter parameter(com.github.javaparser.ast.body.Parameter parameter) {
        List<Attribute> attributes = new ArrayList<>();
        if (parameter.isVarArgs()) {
            attributes.add(Attribute.KeywordAttr.of(KeywordAttribute.VARIADIC, keyword(parameter, "...")));
        }
        attributes.addAll(attributes(parameter.getModifiers(), parameter.getAnnotations()));
        return new Parameter.ParamClassic(new ParameterClassic(Optional.of(ident(parameter.getName())),
            optionalType(parameter.getType()), Optional.empty(), attributes, IdInfo.empty()));
    }

    // ==================== Statements ====================

    private List<Stmt> stmts(List<Statement> statements) {
        List<Stmt> result = new ArrayList<>();
        statements.forEach(statement -> result.addAll(stmtAux(statement)));
        return result;
    }

    Stmt stmt(Statement statement) {
        return AstHelpers.stmt1(stmtAux(statement));
    }

    private Stmt.Block block(BlockStmt block) {
        return new Stmt.Block(new Bracket<>(firstToken(block, "{"), stmts(block.getStatements()),
            lastToken(block, "}")));
    }

    private List<Stmt> stmtAux(Statement statement) {
        if (statement instanceof BlockStmt block) {
            return List.of(block(block));
        }
        if (statement instanceof ExpressionStmt expressionStmt) {
            Expression expression = expressionStmt.getExpression();
            if (expression instanceof VariableDeclarationExpr declaration) {
                return localVariables(declaration);
            }
            return List.of(new Stmt.ExprStmt(expr(expression), semicolon(expressionStmt)));
        }
        if (statement instanceof IfStmt ifStmt) {
            return List.of(new Stmt.If(firstToken(ifStmt, "if"), expr(ifStmt.getCondition()),
                stmt(ifStmt.getThenStmt()), ifStmt.getElseStmt().map(this::stmt)));
        }
        if (statement instanceof WhileStmt whileStmt) {
            return List.of(new Stmt.While(firstToken(whileStmt, "while"), expr(whileStmt.getCondition()),
                stmt(whileStmt.getBody())));
        }
        if (statement instanceof DoStmt doStmt) {
            return List.of(new Stmt.DoWhile(firstToken(doStmt, "do"), stmt(doStmt.getBody()),
                expr(doStmt.getCondition())));
        }
        if (statement instanceof ForStmt forStmt) {
            return List.of(forStmt(forStmt));
        }
        if (statement instanceof ForEachStmt forEach) {
            return List.of(forEachStmt(forEach));
        }
        if (statement instanceof SwitchStmt switchStmt) {
            return List.of(switchStmt(firstToken(switchStmt, "switch"), switchStmt.getSelector(),
                switchStmt.getEntries()));
        }
        if (statement instanceof BreakStmt breakStmt) {
            return List.of(new Stmt.Break(firstToken(breakStmt, "break"),
                AstHelpers.optToLabelIdent(breakStmt.getLabel().map(this::ident))));
        }
        if (statement instanceof ContinueStmt continueStmt) {
            return List.of(new Stmt.Continue(firstToken(continueStmt, "continue"),
                AstHelpers.optToLabelIdent(continueStmt.getLabel().map(this::ident))));
        }
        if (statement instanceof ReturnStmt returnStmt) {
            return List.of(new Stmt.Return(firstToken(returnStmt, "return"), returnStmt.getExpression().map(this::expr)));
        }
        if (statement instanceof LabeledStmt labeled) {
            return List.of(new Stmt.Label(ident(labeled.getLabel()), stmt(labeled.getStatement())));
        }
        if (statement instanceof SynchronizedStmt sync) {
            return List.of(new Stmt.OtherStmtWithStmt(Stmt.OtherStmtWithStmtOp.SYNC, expr(sync.getExpression()),
                block(sync.getBody())));
        }
        if (statement instanceof TryStmt tryStmt) {
            return List.of(tryStmt(tryStmt));
        }
        if (statement instanceof ThrowStmt throwStmt) {
            return List.of(new Stmt.Throw(firstToken(throwStmt, "throw"), expr(throwStmt.getExpression())));
        }
        if (statement instanceof LocalClassDeclarationStmt local) {
            return List.of(typeDeclaration(local.getClassDeclaration()));
        }
        if (statement instanceof LocalRecordDeclarationStmt local) {
            return List.of(typeDeclaration(local.getRecordDeclaration()));
        }
        if (statement instanceof ExplicitConstructorInvocationStmt invocation) {
            return List.of(constructorInvocation(invocation));
        }
        if (statement instanceof AssertStmt assertStmt) {
            return List.of(new Stmt.Assert(firstToken(assertStmt, "assert"), expr(assertStmt.getCheck()),
                assertStmt.getMessage().map(this::expr)));
        }
        if (statement instanceof YieldStmt yield) {
            // yield leaves the enclosing switch expression with a value
            return List.of(new Stmt.Break(firstToken(yield, "yield"),
                new Stmt.LabelIdent.LDynamic(expr(yield.getExpression()))));
        }
        if (statement instanceof EmptyStmt empty) {
            Token semicolon = firstToken(empty, ";");
            return List.of(new Stmt.Block(new Bracket<>(semicolon, List.of(), semicolon)));
        }
        logFallback("stmt", statement);
        return List.of(new Stmt.OtherStmt(Stmt.OtherStmtOp.TODO, childPayload(statement, "stmt")));
    }

    private List<Stmt> localVariables(VariableDeclarationExpr declaration) {
        List<Attribute> attributes = attributes(declaration.getModifiers(), declaration.getAnnotations());
        return declaration.getVariables().stream().map(variable -> variableDefinition(variable, attributes)).toList();
    }

    private Stmt forStmt(ForStmt forStmt) {
        List<Stmt.ForVarOrExpr> init = new ArrayList<>();
        for (Expression expression : forStmt.getInitialization()) {
            if (expression instanceof VariableDeclarationExpr declaration) {
                List<Attribute> attributes = attributes(declaration.getModifiers(), declaration.getAnnotations());
                for (VariableDeclarator variable : declaration.getVariables()) {
                    init.add(new Stmt.ForVarOrExpr.ForInitVar(entity(variable.getName(), attributes, List.of()),
                        new VariableDefinition(variable.getInitializer().map(this::initializer),
                            Optional.of(type(variable.getType())))));
                }
            } else {
                init.add(new Stmt.ForVarOrExpr.ForInitExpr(expr(expression)));
            }
        }
        List<Expr> updates = forStmt.getUpdate().stream().map(this::expr).toList();
        Optional<Expr> next = switch (updates.size()) {
            case 0 -> Optional.empty();
            case 1 -> Optional.of(updates.get(0));
            default -> Optional.of(new Expr.Seq(updates));
        };
        Stmt.ForHeader header = new Stmt.ForHeader.ForClassic(init, forStmt.getCompare().map(this::expr), next);
        return new Stmt.For(firstToken(forStmt, "for"), header, stmt(forStmt.getBody()));
    }

    private Stmt forEachStmt(ForEachStmt forEach) {
        VariableDeclarationExpr declaration = forEach.getVariable();
        VariableDeclarator variable = declaration.getVariables().get(0);
        Pattern pattern = new Pattern.PatVar(type(variable.getType()), Optional.of(ident(variable.getName())),
            IdInfo.empty());
        Token in = tok(JavaTokens.after(declaration), ":");
        Stmt.ForHeader header = new Stmt.ForHeader.ForEach(pattern, in, expr(forEach.getIterable()));
        return new Stmt.For(firstToken(forEach, "for"), header, stmt(forEach.getBody()));
    }

    private Stmt switchStmt(Token token, Expression selector, NodeList<SwitchEntry> entries) {
        List<Stmt.CaseAndBody> cases = new ArrayList<>();
        for (SwitchEntry entry : entries) {
            Token caseToken = firstToken(entry, entry.getLabels().isEmpty() ? "default" : "case");
            List<Stmt.Case> labels = new ArrayList<>();
            if (entry.getLabels().isEmpty()) {
                labels.add(new Stmt.Case.Default(caseToken));
            }
            for (Expression label : entry.getLabels()) {
                labels.add(new Stmt.Case.CasePattern(caseToken, casePattern(label)));
            }
            cases.add(new Stmt.CaseAndBody(labels, AstHelpers.stmt1(stmts(entry.getStatements()))));
        }
        return new Stmt.Switch(token, Optional.of(expr(selector)), cases);
    }

    private Pattern casePattern(Expression label) {
        if (label instanceof PatternExpr pattern) {
            return typePattern(pattern);
        }
        return AstHelpers.exprToPattern(expr(label));
    }

    /**
     * {@code String s} binds {@code s}; record deconstruction patterns have no generic form.
     */
    private Pattern typePattern(PatternExpr pattern) {
        Optional<JavaToken> last = JavaTokens.last(pattern);
        Optional<com.github.javaparser.ast.type.Type> type = pattern.findFirst(com.github.javaparser.ast.type.Type.class);
        if (type.isPresent() && last.isPresent() && last.get().getCategory().isIdentifier()) {
            Ident binder = new Ident(last.get().getText(), tok(last.get()));
            return new Pattern.PatVar(type(type.get()), Optional.of(binder), IdInfo.empty());
        }
        logFallback("pattern", pattern);
        List<Any> payload = new ArrayList<>();
        type.ifPresent(t -> payload.add(Any.of(type(t))));
        payload.add(Any.of(firstToken(pattern, "pattern")));
        return new Pattern.OtherPat(Pattern.OtherPatternOp.TODO, payload);
    }

    /**
     * Resources of a try-with-resources are declared at the start of the try body.
     */
    private Stmt tryStmt(TryStmt tryStmt) {
        Stmt.Block body = block(tryStmt.getTryBlock());
        if (!tryStmt.getResources().isEmpty()) {
            List<Stmt> stmts = new ArrayList<>();
            for (Expression resource : tryStmt.getResources()) {
                if (resource instanceof VariableDeclarationExpr declaration) {
                    stmts.addAll(localVariables(declaration));
                } else {
                    stmts.add(new Stmt.ExprStmt(expr(resource), Token.fake(";")));
                }
            }
            stmts.addAll(body.stmts().value());
            body = new Stmt.Block(body.stmts().withValue(stmts));
        }
        List<Stmt.Catch> catches = new ArrayList<>();
        for (CatchClause clause : tryStmt.getCatchClauses()) {
            com.github.javaparser.ast.body.Parameter parameter = clause.getParameter();
            Pattern pattern = new Pattern.PatVar(type(parameter.getType()), Optional.of(ident(parameter.getName())),
                IdInfo.empty());
            catches.add(new Stmt.Catch(firstToken(clause, "catch"), pattern, block(clause.getBody())));
        }
        Optional<Stmt.Finally> finallyClause = tryStmt.getFinallyBlock()
            .map(block -> new Stmt.Finally(tok(JavaTokens.before(block), "finally"), block(block)));
        return new Stmt.Try(firstToken(tryStmt, "try"), body, catches, finallyClause);
    }

    private Stmt constructorInvocation(ExplicitConstructorInvocationStmt invocation) {
        String keyword = invocation.isThis() ? "this" : "super";
        Expr target = Expr.IdSpecial.of(invocation.isThis() ? Special.Builtin.THIS : Special.Builtin.SUPER,
            keyword(invocation, keyword));
        if (invocation.getExpression().isPresent()) {
            Expression outer = invocation.getExpression().get();
            target = new Expr.DotAccess(expr(outer), tok(JavaTokens.after(outer), "."), new FieldIdent.FDynamic(target));
        }
        Token open = tok(JavaTokens.find(invocation, "("), "(");
        Token close = tok(JavaTokens.last(invocation).flatMap(JavaTokens::previous), ")");
        Expr call = new Expr.Call(target, new Bracket<>(open, arguments(invocation.getArguments()), close));
        return new Stmt.ExprStmt(call, semicolon(invocation));
    }

    // ==================== Expressions ====================

    private List<Argument> arguments(NodeList<Expression> arguments) {
        return arguments.stream().map(argument -> AstHelpers.arg(expr(argument))).toList();
    }

    Expr expr(Expression expression) {
        if (expression instanceof IntegerLiteralExpr literal) {
            return literal(new Literal.IntLit(Wrap.of(literal.getValue(), firstToken(literal, literal.getValue()))));
        }
        if (expression instanceof LongLiteralExpr literal) {
            return literal(new Literal.IntLit(Wrap.of(literal.getValue(), firstToken(literal, literal.getValue()))));
        }
        if (expression instanceof DoubleLiteralExpr literal) {
            return literal(new Literal.FloatLit(Wrap.of(literal.getValue(), firstToken(literal, literal.getValue()))));
        }
        if (expression instanceof CharLiteralExpr literal) {
            return literal(new Literal.CharLit(Wrap.of(literal.getValue(), firstToken(literal, literal.getValue()))));
        }
        if (expression instanceof StringLiteralExpr literal) {
            return AstHelpers.stringLiteral(literal.getValue(), firstToken(literal, literal.getValue()));
        }
        if (expression instanceof TextBlockLiteralExpr literal) {
            return AstHelpers.stringLiteral(literal.getValue(), firstToken(literal, literal.getValue()));
        }
        if (expression instanceof BooleanLiteralExpr literal) {
            String text = String.valueOf(literal.getValue());
            return literal(new Literal.BoolLit(Wrap.of(literal.getValue(), firstToken(literal, text))));
        }
        if (expression instanceof NullLiteralExpr literal) {
            return literal(new Literal.NullLit(firstToken(literal, "null")));
        }
        if (expression instanceof NameExpr name) {
            return Expr.Id.of(ident(name.getName()));
        }
        if (expression instanceof FieldAccessExpr access) {
            return new Expr.DotAccess(receiver(access.getScope()), tok(JavaTokens.after(access.getScope()), "."),
                memberName(access.getName(), access.getTypeArguments()));
        }
        if (expression instanceof MethodCallExpr call) {
            return methodCall(call);
        }
        if (expression instanceof ObjectCreationExpr creation) {
            return objectCreation(creation);
        }
        if (expression instanceof ArrayCreationExpr creation) {
            return arrayCreation(creation);
        }
        if (expression instanceof ArrayInitializerExpr array) {
            return arrayInitializer(array);
        }
        if (expression instanceof ArrayAccessExpr access) {
            return new Expr.ArrayAccess(expr(access.getName()), expr(access.getIndex()));
        }
        if (expression instanceof UnaryExpr unary) {
            return unary(unary);
        }
        if (expression instanceof BinaryExpr binary) {
            Token token = tok(JavaTokens.after(binary.getLeft()), binary.getOperator().asString());
            return AstHelpers.opCall(binaryOperator(binary.getOperator()), token,
                List.of(expr(binary.getLeft()), expr(binary.getRight())));
        }
        if (expression instanceof AssignExpr assign) {
            return assign(assign);
        }
        if (expression instanceof ConditionalExpr conditional) {
            return new Expr.Conditional(expr(conditional.getCondition()), expr(conditional.getThenExpr()),
                expr(conditional.getElseExpr()));
        }
        if (expression instanceof EnclosedExpr enclosed) {
            return expr(enclosed.getInner());
        }
        if (expression instanceof CastExpr cast) {
            return new Expr.Cast(type(cast.getType()), expr(cast.getExpression()));
        }
        if (expression instanceof InstanceOfExpr instanceOf) {
            return instanceOf(instanceOf);
        }
        if (expression instanceof LambdaExpr lambda) {
            List<Parameter> parameters = lambda.getParameters().stream().map(this::parameter).toList();
            return new Expr.Lambda(new FunctionDefinition(parameters, Optional.empty(), stmt(lambda.getBody())));
        }
        if (expression instanceof MethodReferenceExpr reference) {
            return methodReference(reference);
        }
        if (expression instanceof ClassExpr classExpr) {
            return new Expr.OtherExpr(Expr.OtherExprOp.CLASS_LITERAL,
                List.of(Any.of(type(classExpr.getType())), Any.of(lastToken(classExpr, "class"))));
        }
        if (expression instanceof ThisExpr thisExpr) {
            Expr.IdSpecial self = Expr.IdSpecial.of(Special.Builtin.THIS, lastToken(thisExpr, "this"));
            if (thisExpr.getTypeName().isEmpty()) {
                return self;
            }
            com.github.javaparser.ast.expr.Name typeName = thisExpr.getTypeName().get();
            return new Expr.OtherExpr(Expr.OtherExprOp.QUALIFIED_THIS,
                List.of(Any.of(nameExpr(dotted(typeName), typeName)), Any.of(self)));
        }
        if (expression instanceof SuperExpr superExpr) {
            Expr.IdSpecial parent = Expr.IdSpecial.of(Special.Builtin.SUPER, lastToken(superExpr, "super"));
            if (superExpr.getTypeName().isEmpty()) {
                return parent;
            }
            com.github.javaparser.ast.expr.Name typeName = superExpr.getTypeName().get();
            return new Expr.DotAccess(nameExpr(dotted(typeName), typeName), tok(JavaTokens.after(typeName), "."),
                new FieldIdent.FDynamic(parent));
        }
        if (expression instanceof TypeExpr typeExpr) {
            return new Expr.OtherExpr(Expr.OtherExprOp.NAME_OR_CLASS_TYPE, List.of(Any.of(type(typeExpr.getType()))));
        }
        if (expression instanceof SwitchExpr switchExpr) {
            Stmt switchStmt = switchStmt(firstToken(switchExpr, "switch"), switchExpr.getSelector(),
                switchExpr.getEntries());
            return new Expr.OtherExpr(Expr.OtherExprOp.SWITCH_EXPR, List.of(Any.of(switchStmt)));
        }
        if (expression instanceof VariableDeclarationExpr declaration) {
            List<Any> definitions = localVariables(declaration).stream()
                .map(stmt -> Any.of(((Stmt.DefStmt) stmt).definition()))
                .toList();
            return new Expr.OtherExpr(Expr.OtherExprOp.TODO, definitions);
        }
        if (expression instanceof AnnotationExpr annotation) {
            return new Expr.OtherExpr(Expr.OtherExprOp.ANNOT, List.of(Any.of(annotation(annotation))));
        }
        logFallback("expr", expression);
        return new Expr.OtherExpr(Expr.OtherExprOp.TODO, childPayload(expression, "expr"));
    }

    private static Expr literal(Literal literal) {
        return new Expr.Lit(literal);
    }

    private FieldIdent memberName(SimpleName name, Optional<NodeList<com.github.javaparser.ast.type.Type>> typeArguments) {
        if (typeArguments.isPresent()) {
            return new FieldIdent.FName(new Name(ident(name),
                new NameInfo(Optional.empty(), Optional.of(typeArguments(typeArguments.get())))));
        }
        return new FieldIdent.FId(ident(name));
    }

    private Expr methodCall(MethodCallExpr call) {
        Expr callee;
        if (call.getScope().isPresent()) {
            Expression scope = call.getScope().get();
            callee = new Expr.DotAccess(receiver(scope), tok(JavaTokens.after(scope), "."),
                memberName(call.getName(), call.getTypeArguments()));
        } else {
            callee = Expr.Id.of(ident(call.getName()));
        }
        Token open = tok(JavaTokens.after(call.getName()), "(");
        return new Expr.Call(callee, new Bracket<>(open, arguments(call.getArguments()), lastToken(call, ")")));
    }

    /**
     * {@code new T(args)} is a call to the {@code new} special with the type as first
     * argument; an anonymous class body replaces the type by an {@link Expr.AnonClass}
     * extending it.
     */
    private Expr objectCreation(ObjectCreationExpr creation) {
        Token newToken = keyword(creation, "new");
        Type type = type(creation.getType());
        Optional<JavaToken> openParen = JavaTokens.after(creation.getType());
        Optional<JavaToken> closeParen = openParen.flatMap(JavaTokens::closing);
        Optional<Expr> anonymous = creation.getAnonymousClassBody().map(body -> new Expr.AnonClass(
            new ClassDefinition(Wrap.fake(ClassKind.CLASS), List.of(type), List.of(), List.of(),
                new Bracket<>(tok(closeParen.flatMap(JavaTokens::next), "{"), members(body),
                    lastToken(creation, "}")))));
        List<Argument> arguments = new ArrayList<>();
        arguments.add(anonymous.<Argument>map(AstHelpers::arg).orElseGet(() -> new Argument.ArgType(type)));
        arguments.addAll(arguments(creation.getArguments()));
        if (creation.getScope().isPresent()) {
            List<Any> payload = new ArrayList<>();
            payload.add(Any.of(expr(creation.getScope().get())));
            payload.add(Any.of(newToken));
            arguments.forEach(argument -> payload.add(Any.of(argument)));
            return new Expr.OtherExpr(Expr.OtherExprOp.NEW_QUALIFIED_CLASS, payload);
        }
        return new Expr.Call(Expr.IdSpecial.of(Special.Builtin.NEW, newToken),
            new Bracket<>(tok(openParen, "("), arguments, tok(closeParen, ")")));
    }

    /**
     * {@code new int[n][]} calls {@code new} with the folded array type, then the
     * initializer, then the dimension expressions.
     */
    private Expr arrayCreation(ArrayCreationExpr creation) {
        Token newToken = firstToken(creation, "new");
        Type type = arrayOf(creation.getLevels().size(), type(creation.getElementType()), creation);
        List<Argument> arguments = new ArrayList<>();
        arguments.add(new Argument.ArgType(type));
        creation.getInitializer().ifPresent(initializer -> arguments.add(AstHelpers.arg(arrayInitializer(initializer))));
        creation.getLevels().forEach(level -> level.getDimension()
            .ifPresent(dimension -> arguments.add(AstHelpers.arg(expr(dimension)))));
        return AstHelpers.specialCall(Special.Builtin.NEW, newToken, arguments);
    }

    private Expr unary(UnaryExpr unary) {
        Expr operand = expr(unary.getExpression());
        String text = unary.getOperator().asString();
        return switch (unary.getOperator()) {
            case PREFIX_INCREMENT -> incrDecr(Special.IncrDecr.Kind.INCR, Special.IncrDecr.Fixity.PREFIX,
                firstToken(unary, text), operand);
            case PREFIX_DECREMENT -> incrDecr(Special.IncrDecr.Kind.DECR, Special.IncrDecr.Fixity.PREFIX,
                firstToken(unary, text), operand);
            case POSTFIX_INCREMENT -> incrDecr(Special.IncrDecr.Kind.INCR, Special.IncrDecr.Fixity.POSTFIX,
                lastToken(unary, text), operand);
            case POSTFIX_DECREMENT -> incrDecr(Special.IncrDecr.Kind.DECR, Special.IncrDecr.Fixity.POSTFIX,
                lastToken(unary, text), operand);
            case PLUS -> AstHelpers.opCall(Operator.PLUS, firstToken(unary, text), List.of(operand));
            case MINUS -> AstHelpers.opCall(Operator.MINUS, firstToken(unary, text), List.of(operand));
            case LOGICAL_COMPLEMENT -> AstHelpers.opCall(Operator.NOT, firstToken(unary, text), List.of(operand));
            case BITWISE_COMPLEMENT -> AstHelpers.opCall(Operator.BIT_NOT, firstToken(unary, text), List.of(operand));
        };
    }

    private static Expr incrDecr(Special.IncrDecr.Kind kind, Special.IncrDecr.Fixity fixity, Token token, Expr operand) {
        return AstHelpers.specialCall(new Special.IncrDecr(kind, fixity), token, List.of(AstHelpers.arg(operand)));
    }

    static Operator binaryOperator(BinaryExpr.Operator operator) {
        return switch (operator) {
            case OR -> Operator.OR;
            case AND -> Operator.AND;
            case BINARY_OR -> Operator.BIT_OR;
            case BINARY_AND -> Operator.BIT_AND;
            case XOR -> Operator.BIT_XOR;
            case EQUALS -> Operator.EQ;
            case NOT_EQUALS -> Operator.NOT_EQ;
            case LESS -> Operator.LT;
            case GREATER -> Operator.GT;
            case LESS_EQUALS -> Operator.LT_E;
            case GREATER_EQUALS -> Operator.GT_E;
            case LEFT_SHIFT -> Operator.LSL;
            case SIGNED_RIGHT_SHIFT -> Operator.ASR;
            case UNSIGNED_RIGHT_SHIFT -> Operator.LSR;
            case PLUS -> Operator.PLUS;
            case MINUS -> Operator.MINUS;
            case MULTIPLY -> Operator.MULT;
            case DIVIDE -> Operator.DIV;
            case REMAINDER -> Operator.MOD;
        };
    }

    private Expr assign(AssignExpr assign) {
        Token token = tok(JavaTokens.after(assign.getTarget()), assign.getOperator().asString());
        Expr target = expr(assign.getTarget());
        Expr value = expr(assign.getValue());
        Operator operator = switch (assign.getOperator()) {
            case ASSIGN -> null;
            case PLUS -> Operator.PLUS;
            case MINUS -> Operator.MINUS;
            case MULTIPLY -> Operator.MULT;
            case DIVIDE -> Operator.DIV;
            case BINARY_AND -> Operator.BIT_AND;
            case BINARY_OR -> Operator.BIT_OR;
            case XOR -> Operator.BIT_XOR;
            case REMAINDER -> Operator.MOD;
            case LEFT_SHIFT -> Operator.LSL;
            case SIGNED_RIGHT_SHIFT -> Operator.ASR;
            case UNSIGNED_RIGHT_SHIFT -> Operator.LSR;
        };
        if (operator == null) {
            return new Expr.Assign(target, token, value);
        }
        return new Expr.AssignOp(target, Wrap.of(operator, token), value);
    }

    /**
     * {@code e instanceof T} calls the {@code instanceof} special with the value and the
     * type; a binding pattern {@code e instanceof T t} passes the pattern instead of the
     * type.
     */
    private Expr instanceOf(InstanceOfExpr instanceOf) {
        Token token = tok(JavaTokens.after(instanceOf.getExpression()), "instanceof");
        List<Argument> arguments = new ArrayList<>();
        arguments.add(AstHelpers.arg(expr(instanceOf.getExpression())));
        if (instanceOf.getPattern().isPresent()) {
            Pattern pattern = instanceOfPattern(instanceOf, instanceOf.getPattern().get());
            arguments.add(new Argument.ArgOther(Argument.OtherArgumentOp.ARG_PATTERN, List.of(Any.of(pattern))));
        } else {
            arguments.add(new Argument.ArgType(type(instanceOf.getType())));
        }
        return AstHelpers.specialCall(Special.Builtin.INSTANCEOF, token, arguments);
    }

    private Pattern instanceOfPattern(InstanceOfExpr instanceOf, PatternExpr pattern) {
        Optional<JavaToken> last = JavaTokens.last(pattern);
        if (last.isPresent() && last.get().getCategory().isIdentifier()) {
            Ident binder = new Ident(last.get().getText(), tok(last.get()));
            return new Pattern.PatVar(type(instanceOf.getType()), Optional.of(binder), IdInfo.empty());
        }
        return typePattern(pattern);
    }

    private Expr methodReference(MethodReferenceExpr reference) {
        Expression scope = reference.getScope();
        Any target = scope instanceof TypeExpr typeExpr ? Any.of(type(typeExpr.getType())) : Any.of(expr(scope));
        Token separator = tok(JavaTokens.after(scope), "::");
        Ident method = new Ident(reference.getIdentifier(), lastToken(reference, reference.getIdentifier()));
        return new Expr.OtherExpr(Expr.OtherExprOp.METHOD_REF, List.of(target, Any.of(separator), Any.of(method)));
    }
}
