package io.codemap.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.codemap.model.Attribute;
import io.codemap.model.Call;
import io.codemap.model.FunctionBlock;
import io.codemap.model.ModuleBlock;

import java.util.List;
import java.util.Map;

/**
 * Prints a normalized module block, as an indented outline or as JSON.
 */
public class BlockOutput {

    private final ObjectMapper mapper;

    public BlockOutput() {
        this.mapper = new ObjectMapper();
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Outline with one line per attribute, clause and call.
     */
    public String renderText(ModuleBlock block) {
        StringBuilder sb = new StringBuilder();
        sb.append("module ").append(block.name()).append('\n');
        for (Attribute attribute : block.attributes()) {
            sb.append("  @").append(attribute.key()).append(' ').append(abbreviate(attribute.value())).append('\n');
        }
        for (FunctionBlock function : block.children()) {
            sb.append("  ").append(function.kind().keyword()).append(' ').append(function.name());
            if (function.parameters() != null) {
                sb.append('(').append(String.join(", ", function.parameters())).append(')');
            }
            if (function.arity() != null) {
                sb.append(" /").append(function.arity());
            }
            sb.append('\n');
            for (Call call : function.calls()) {
                sb.append("    -> ").append(call);
                if (call.position() != null) {
                    sb.append("  @").append(call.position());
                }
                sb.append('\n');
            }
        }
        return sb.toString();
    }

    public String renderJson(ModuleBlock block) throws JsonProcessingException {
        return mapper.writeValueAsString(new JsonBlock(
            block.name().toString(),
            block.attributes().stream()
                .map(a -> Map.of("key", a.key(), "value", a.value()))
                .toList(),
            block.children().stream()
                .map(BlockOutput::toJsonFunction)
                .toList()
        ));
    }

    private static JsonFunction toJsonFunction(FunctionBlock function) {
        return new JsonFunction(
            function.name(),
            function.kind().keyword(),
            function.arity(),
            function.parameters(),
            function.calls().stream()
                .map(c -> new JsonCall(
                    c.module() != null ? c.module().toString() : null,
                    c.name(),
                    c.arity(),
                    c.position() != null ? c.position().line() : null))
                .toList()
        );
    }

    private static String abbreviate(String value) {
        String singleLine = value.replace('\n', ' ').trim();
        return singleLine.length() > 60 ? singleLine.substring(0, 57) + "..." : singleLine;
    }

    public record JsonBlock(String name, List<Map<String, String>> attributes, List<JsonFunction> functions) {}

    public record JsonFunction(String name, String kind, Integer arity, List<String> parameters, List<JsonCall> calls) {}

    public record JsonCall(String module, String name, int arity, Integer line) {}
}
