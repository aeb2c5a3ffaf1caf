package com.polyast.core.ast.visitor;

import com.polyast.core.ast.Any;
import com.polyast.core.ast.Location;
import com.polyast.core.ast.Token;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Generic operations built on {@link Visitors} and {@link Mappers}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * List<Token> tokens = AstTraversals.extractTokens(Any.program(program));
 * Any a = AstTraversals.abstractPositionInfo(Any.of(expr1));
 * Any b = AstTraversals.abstractPositionInfo(Any.of(expr2));
 * boolean sameShape = a.equals(b);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class AstTraversals {

    private AstTraversals() {
        // Utility class - no instantiation
    }

    /**
     * Returns every token occurrence of the sub-tree ordered by source position.
     *
     * <p>Tokens without a position (fake or abstract) stay right after the positioned
     * token that precedes them in traversal order, or first when none does.
     *
     * @param any sub-tree
     * @return tokens in source order
     */
    public static List<Token> extractTokens(Any any) {
        List<Token> visited = collectTokens(any);

        List<SortKey> keys = new ArrayList<>(visited.size());
        Location anchor = null;
        for (int i = 0; i < visited.size(); i++) {
            Token token = visited.get(i);
            if (token.isOrigin()) {
                anchor = token.location();
            }
            keys.add(new SortKey(token, anchor, token.isOrigin(), i));
        }
        keys.sort(SortKey.ORDER);
        return keys.stream().map(SortKey::token).toList();
    }

    /**
     * Returns the first and last positioned tokens of the sub-tree, if it has any.
     *
     * @param any sub-tree
     * @return two-element list {@code [min, max]}
     */
    public static Optional<List<Token>> range(Any any) {
        List<Token> origins = collectTokens(any).stream().filter(Token::isOrigin).toList();
        if (origins.isEmpty()) {
            return Optional.empty();
        }
        Comparator<Token> byLocation = Comparator.comparing(Token::location);
        Token min = origins.stream().min(byLocation).orElseThrow();
        Token max = origins.stream().max(byLocation).orElseThrow();
        return Optional.of(List.of(min, max));
    }

    /**
     * Erases every token position in the sub-tree. Structure, token text and the fake
     * flag are preserved, and the operation is idempotent.
     *
     * @param any sub-tree
     * @return position-free copy
     */
    public static Any abstractPositionInfo(Any any) {
        Mapper mapper = Mappers.make(new MapperHooks() {
            @Override
            public Token token(Token token, UnaryOperator<Token> k, Mapper m) {
                return k.apply(token).abstracted();
            }
        });
        return mapper.map(any);
    }

    private static List<Token> collectTokens(Any any) {
        List<Token> tokens = new ArrayList<>();
        Visitors.make(new VisitorHooks() {
            @Override
            public void token(Token token, Consumer<Token> k, Visitor visitor) {
                tokens.add(token);
            }
        }).visit(any);
        return tokens;
    }

    private record SortKey(Token token, Location anchor, boolean origin, int index) {

        // Positionless keys sort after their anchor and before any later origin token.
        static final Comparator<SortKey> ORDER = (a, b) -> {
            Location la = a.origin ? a.token.location() : a.anchor;
            Location lb = b.origin ? b.token.location() : b.anchor;
            if (la == null || lb == null) {
                if (la == null && lb == null) {
                    return Integer.compare(a.index, b.index);
                }
                return la == null ? -1 : 1;
            }
            int byLocation = la.compareTo(lb);
            if (byLocation != 0) {
                return byLocation;
            }
            if (a.origin != b.origin) {
                return a.origin ? -1 : 1;
            }
            return Integer.compare(a.index, b.index);
        };
    }
}
