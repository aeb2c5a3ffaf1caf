package com.polyast.core.dump;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.polyast.core.ast.Any;
import com.polyast.core.ast.IdInfo;
import com.polyast.core.ast.Token;
import com.polyast.core.config.PolyastConfig;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.List;
import java.util.Optional;

/**
 * Renders generic AST fragments as a Jackson JSON tree for debugging.
 *
 * <p>Every node becomes an object whose {@code "node"} member names the family and the
 * variant (e.g. {@code "Expr.Call"}), followed by one member per record component.
 * Optional values render as the value or {@code null}, enumerations as their constant
 * name, and tokens as <code>{"text", "line", "column"}</code>, or with a
 * {@code "fake"}/{@code "abstract"} marker when they carry no position.
 *
 * <p>The output is meant for people; it is not a stable exchange format.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * GastJsonDumper dumper = new GastJsonDumper(true, true);
 * System.out.println(dumper.toJson(Any.program(program)));
 * }</pre>
 *
 * @since 1.0.0
 */
public class GastJsonDumper {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final boolean includeTokens;
    private final ObjectMapper mapper;

    /**
     * @param includeTokens render token positions; when false tokens are omitted
     * @param pretty indent the rendered JSON
     */
    public GastJsonDumper(boolean includeTokens, boolean pretty) {
        this.includeTokens = includeTokens;
        this.mapper = new ObjectMapper();
        if (pretty) {
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
    }

    public static GastJsonDumper fromConfig(PolyastConfig.DumpSettings settings) {
        return new GastJsonDumper(settings.includeTokens(), settings.pretty());
    }

    /**
     * Renders a fragment as JSON text.
     *
     * @param any fragment to render
     * @return JSON document
     */
    public String toJson(Any any) {
        try {
            return mapper.writeValueAsString(toTree(any));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render JSON tree", e);
        }
    }

    /**
     * Renders a fragment, or any value found inside one, as a JSON tree.
     *
     * @param value node, list, optional, token or scalar
     * @return JSON tree
     */
    public JsonNode toTree(Object value) {
        if (value == null) {
            return NODES.nullNode();
        }
        if (value instanceof Token token) {
            return token(token);
        }
        if (value instanceof IdInfo info) {
            return idInfo(info);
        }
        if (value instanceof Optional<?> optional) {
            return optional.map(this::toTree).orElseGet(NODES::nullNode);
        }
        if (value instanceof List<?> list) {
            ArrayNode array = NODES.arrayNode();
            list.forEach(element -> array.add(toTree(element)));
            return array;
        }
        if (value instanceof String text) {
            return NODES.textNode(text);
        }
        if (value instanceof Boolean bool) {
            return NODES.booleanNode(bool);
        }
        if (value instanceof Integer number) {
            return NODES.numberNode(number);
        }
        if (value instanceof Enum<?> constant) {
            return NODES.textNode(constant.name());
        }
        if (value instanceof Record variant) {
            return record(variant);
        }
        return NODES.textNode(String.valueOf(value));
    }

    private JsonNode record(Record variant) {
        ObjectNode object = NODES.objectNode();
        object.put("node", nodeName(variant.getClass()));
        for (RecordComponent component : variant.getClass().getRecordComponents()) {
            Object value = read(component, variant);
            if (!includeTokens && value instanceof Token) {
                continue;
            }
            object.set(component.getName(), toTree(value));
        }
        return object;
    }

    private JsonNode token(Token token) {
        if (!includeTokens) {
            return NODES.textNode(token.text());
        }
        ObjectNode object = NODES.objectNode();
        object.put("text", token.text());
        if (token.isOrigin()) {
            object.put("line", token.location().line());
            object.put("column", token.location().column());
        } else if (token.isFake()) {
            object.put("fake", true);
        } else {
            object.put("abstract", true);
        }
        return object;
    }

    // Empty cells are omitted
    private JsonNode idInfo(IdInfo info) {
        ObjectNode object = NODES.objectNode();
        info.resolved().ifPresent(resolved -> object.set("resolved", toTree(resolved)));
        info.type().ifPresent(type -> object.set("type", toTree(type)));
        info.constLiteral().ifPresent(literal -> object.set("constLiteral", toTree(literal)));
        return object;
    }

    private static Object read(RecordComponent component, Record variant) {
        try {
            return component.getAccessor().invoke(variant);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException("Cannot read " + component.getName() + " of "
                + variant.getClass().getName(), e);
        }
    }

    /**
     * Returns {@code Family.Variant} for nested variants and the simple name otherwise.
     */
    static String nodeName(Class<?> type) {
        Class<?> enclosing = type.getEnclosingClass();
        return enclosing == null ? type.getSimpleName() : enclosing.getSimpleName() + "." + type.getSimpleName();
    }
}
