package io.codemap.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.codemap.ast.RawNode;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Writes raw trees in the JSON encoding read by {@link QuotedJsonReader}.
 */
public class QuotedJsonWriter {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectMapper mapper;

    public QuotedJsonWriter() {
        this(new ObjectMapper());
    }

    public QuotedJsonWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Pretty-print a tree, indenting each nesting level by {@code indent} spaces.
     */
    public String write(RawNode tree, int indent) throws JsonProcessingException {
        if (indent < 0) {
            throw new IllegalArgumentException("indent must not be negative: " + indent);
        }
        DefaultIndenter indenter = new DefaultIndenter(" ".repeat(indent), "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter().withObjectIndenter(indenter);
        printer.indentArraysWith(indenter);
        return mapper.writer(printer).writeValueAsString(toJson(tree));
    }

    public JsonNode toJson(RawNode node) {
        if (node instanceof RawNode.Atom atom) {
            return switch (atom.name()) {
                case "true" -> NODES.booleanNode(true);
                case "false" -> NODES.booleanNode(false);
                case "nil" -> NODES.nullNode();
                default -> NODES.objectNode().put("atom", atom.name());
            };
        } else if (node instanceof RawNode.Literal literal) {
            return literal(literal.value());
        } else if (node instanceof RawNode.ListNode list) {
            ArrayNode array = NODES.arrayNode();
            list.elements().forEach(element -> array.add(toJson(element)));
            return array;
        } else if (node instanceof RawNode.Pair pair) {
            ObjectNode tuple = NODES.objectNode();
            tuple.putArray("tuple").add(toJson(pair.left())).add(toJson(pair.right()));
            return tuple;
        } else if (node instanceof RawNode.Form form) {
            return form(form);
        }
        throw new IllegalStateException("Unknown RawNode type: " + node);
    }

    private ObjectNode form(RawNode.Form form) {
        ObjectNode json = NODES.objectNode();
        if (form.head() instanceof RawNode.Atom atom) {
            json.put("form", atom.name());
        } else {
            json.set("form", toJson(form.head()));
        }

        if (form.position() != null || form.noParens()) {
            ObjectNode meta = json.putObject("meta");
            if (form.position() != null) {
                meta.put("line", form.position().line());
                meta.put("column", form.position().column());
            }
            if (form.noParens()) {
                meta.put("no_parens", true);
            }
        }

        if (form.args() == null) {
            json.putNull("args");
        } else {
            ArrayNode args = json.putArray("args");
            form.args().forEach(arg -> args.add(toJson(arg)));
        }
        return json;
    }

    private static JsonNode literal(Object value) {
        if (value instanceof String text) {
            return NODES.textNode(text);
        } else if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return NODES.numberNode(((Number) value).longValue());
        } else if (value instanceof BigInteger big) {
            return NODES.numberNode(big);
        } else if (value instanceof BigDecimal decimal) {
            return NODES.numberNode(decimal);
        } else if (value instanceof Number number) {
            return NODES.numberNode(number.doubleValue());
        }
        return NODES.textNode(String.valueOf(value));
    }
}
