package io.codemap.output;

import io.codemap.graph.Edge;
import io.codemap.graph.Graph;
import io.codemap.model.FunctionRef;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Renders a call graph as readable text or as a Mermaid flowchart.
 */
public class GraphPresenter {

    // ANSI color codes
    private static final String RESET = "\u001B[0m";
    private static final String CYAN = "\u001B[36m";
    private static final String GREEN = "\u001B[32m";
    private static final String DIM = "\u001B[2m";

    private final boolean useColor;

    public GraphPresenter() {
        this(false);
    }

    public GraphPresenter(boolean useColor) {
        this.useColor = useColor;
    }

    /**
     * Text listing: start, counts, then nodes and edges one per line in graph order.
     */
    public String renderText(Graph graph) {
        StringBuilder sb = new StringBuilder();
        sb.append("Call graph from ").append(color(CYAN, graph.start().signature()));
        if (graph.truncated()) {
            sb.append(color(DIM, " (truncated)"));
        }
        sb.append('\n');
        sb.append("Nodes: ").append(graph.nodeCount()).append('\n');
        sb.append("Edges: ").append(graph.edgeCount()).append('\n');
        sb.append('\n');

        sb.append("Nodes:\n");
        for (FunctionRef node : graph.nodes()) {
            sb.append("- ").append(formatRef(node)).append('\n');
        }
        sb.append('\n');

        sb.append("Edges:\n");
        for (Edge edge : graph.edges()) {
            sb.append("- ").append(formatRef(edge.from()))
                .append(color(DIM, " -> "))
                .append(formatRef(edge.to())).append('\n');
        }
        return sb.toString();
    }

    /**
     * Mermaid {@code graph TD} definition. Node ids are derived from the function signature,
     * so the same graph always renders to the same text.
     */
    public String renderDiagram(Graph graph) {
        Map<FunctionRef, String> ids = new HashMap<>();
        for (FunctionRef node : graph.nodes()) {
            ids.put(node, nodeId(node));
        }

        StringBuilder sb = new StringBuilder("graph TD\n");
        for (FunctionRef node : graph.nodes()) {
            sb.append("  ").append(ids.get(node))
                .append("[\"").append(escapeLabel(node.signature())).append("\"]\n");
        }
        for (Edge edge : graph.edges()) {
            sb.append("  ").append(ids.get(edge.from()))
                .append(" --> ").append(ids.get(edge.to())).append('\n');
        }
        return sb.toString();
    }

    /**
     * Stable node id: {@code node_} followed by the unsigned FNV-1a hash of the signature.
     */
    public static String nodeId(FunctionRef ref) {
        int hash = 0x811c9dc5;
        for (byte b : ref.signature().getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= 0x01000193;
        }
        return "node_" + Integer.toUnsignedString(hash);
    }

    /**
     * Replaces characters Mermaid treats as syntax inside a quoted label.
     */
    public static String escapeLabel(String label) {
        return label
            .replace("\"", "#quot;")
            .replace('[', '(')
            .replace(']', ')');
    }

    private String formatRef(FunctionRef ref) {
        return color(CYAN, ref.module().toString()) + "." + color(GREEN, ref.function()) + "/" + ref.arity();
    }

    private String color(String code, String text) {
        if (useColor) {
            return code + text + RESET;
        }
        return text;
    }
}
