package io.codemap.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.codemap.ast.RawNode;
import io.codemap.model.Position;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads quoted Elixir trees serialized as JSON.
 * <p>
 * Encoding:
 * <ul>
 *   <li>string, number: literal</li>
 *   <li>{@code true}, {@code false}, {@code null}: the atoms {@code true}, {@code false}, {@code nil}</li>
 *   <li>{@code {"atom": "name"}}: atom</li>
 *   <li>array: list</li>
 *   <li>{@code {"tuple": [a, b]}}: two-element tuple</li>
 *   <li>{@code {"form": head, "meta": {...}, "args": [...] | null}}: a {@code {head, meta, args}} triple,
 *       where a string head is an atom name</li>
 * </ul>
 */
public class QuotedJsonReader {

    private final ObjectMapper mapper;

    public QuotedJsonReader() {
        this(new ObjectMapper());
    }

    public QuotedJsonReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public RawNode read(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        } catch (IOException e) {
            throw new IOException("Cannot read quoted tree " + file + ": " + e.getMessage(), e);
        }
    }

    public RawNode read(InputStream in) throws IOException {
        return convert(mapper.readTree(in));
    }

    public RawNode read(String json) throws IOException {
        return convert(mapper.readTree(json));
    }

    private RawNode convert(JsonNode root) throws IOException {
        if (root == null || root.isMissingNode()) {
            throw new IOException("Empty quoted tree document");
        }
        try {
            return toRawNode(root);
        } catch (MalformedTreeException e) {
            throw new IOException("Invalid quoted tree: " + e.getMessage(), e);
        }
    }

    /**
     * Convert one JSON node.
     *
     * @throws MalformedTreeException if an object matches none of the encodings
     */
    public RawNode toRawNode(JsonNode node) {
        if (node == null || node.isNull()) {
            return RawNode.atom("nil");
        }
        if (node.isBoolean()) {
            return RawNode.atom(node.asText());
        }
        if (node.isTextual()) {
            return new RawNode.Literal(node.textValue());
        }
        if (node.isIntegralNumber()) {
            return new RawNode.Literal(node.canConvertToLong() ? (Object) node.longValue() : node.bigIntegerValue());
        }
        if (node.isNumber()) {
            return new RawNode.Literal(node.doubleValue());
        }
        if (node.isArray()) {
            return new RawNode.ListNode(toRawNodes(node));
        }
        if (node.isObject()) {
            if (node.has("atom")) {
                return RawNode.atom(node.get("atom").asText());
            }
            if (node.has("tuple")) {
                JsonNode elements = node.get("tuple");
                if (!elements.isArray() || elements.size() != 2) {
                    throw new MalformedTreeException("tuple must have exactly two elements");
                }
                return new RawNode.Pair(toRawNode(elements.get(0)), toRawNode(elements.get(1)));
            }
            if (node.has("form")) {
                return toForm(node);
            }
        }
        throw new MalformedTreeException("unrecognized node " + abbreviate(node));
    }

    private RawNode.Form toForm(JsonNode node) {
        JsonNode headNode = node.get("form");
        RawNode head = headNode.isTextual() ? RawNode.atom(headNode.textValue()) : toRawNode(headNode);

        JsonNode meta = node.get("meta");
        Position position = null;
        boolean noParens = false;
        if (meta != null && meta.isObject()) {
            if (meta.has("line")) {
                position = new Position(meta.get("line").asInt(), meta.path("column").asInt(0));
            }
            noParens = meta.path("no_parens").asBoolean(false);
        }

        JsonNode args = node.get("args");
        List<RawNode> argNodes = null;
        if (args != null && !args.isNull()) {
            if (!args.isArray()) {
                throw new MalformedTreeException("form args must be an array or null");
            }
            argNodes = toRawNodes(args);
        }
        return new RawNode.Form(head, position, noParens, argNodes);
    }

    private List<RawNode> toRawNodes(JsonNode array) {
        List<RawNode> result = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            result.add(toRawNode(element));
        }
        return result;
    }

    private static String abbreviate(JsonNode node) {
        List<String> keys = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            keys.add(fields.next().getKey());
        }
        return "with keys " + keys;
    }

    /**
     * JSON that is well-formed but does not encode a quoted tree.
     */
    public static class MalformedTreeException extends RuntimeException {
        public MalformedTreeException(String message) {
            super(message);
        }
    }
}
