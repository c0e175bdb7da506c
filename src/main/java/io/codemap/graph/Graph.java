package io.codemap.graph;

import io.codemap.model.FunctionRef;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Call graph reachable from one start function.
 * <p>
 * Nodes and edges keep insertion order, which for a built graph is breadth-first discovery order.
 */
public final class Graph {

    private final FunctionRef start;
    private final Set<FunctionRef> nodes;
    private final Set<Edge> edges;
    private final boolean truncated;

    private Graph(FunctionRef start, Set<FunctionRef> nodes, Set<Edge> edges, boolean truncated) {
        this.start = start;
        this.nodes = Collections.unmodifiableSet(new LinkedHashSet<>(nodes));
        this.edges = Collections.unmodifiableSet(new LinkedHashSet<>(edges));
        this.truncated = truncated;
    }

    public FunctionRef start() {
        return start;
    }

    public Set<FunctionRef> nodes() {
        return nodes;
    }

    public Set<Edge> edges() {
        return edges;
    }

    /**
     * True when a traversal budget stopped expansion before the frontier was exhausted.
     */
    public boolean truncated() {
        return truncated;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean hasEdge(FunctionRef from, FunctionRef to) {
        return edges.contains(new Edge(from, to));
    }

    /**
     * Functions called directly by the given node, in edge order.
     */
    public Set<FunctionRef> callees(FunctionRef node) {
        return edges.stream()
            .filter(e -> e.from().equals(node))
            .map(Edge::to)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Functions that call the given node directly, in edge order.
     */
    public Set<FunctionRef> callers(FunctionRef node) {
        return edges.stream()
            .filter(e -> e.to().equals(node))
            .map(Edge::from)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Graph holding only the start node.
     */
    public static Graph of(FunctionRef start) {
        return builder(start).build();
    }

    public static Builder builder(FunctionRef start) {
        return new Builder(start);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Graph other)) return false;
        return start.equals(other.start) && nodes.equals(other.nodes)
            && edges.equals(other.edges) && truncated == other.truncated;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, nodes, edges, truncated);
    }

    @Override
    public String toString() {
        return "Graph[start=" + start + ", nodes=" + nodes.size() + ", edges=" + edges.size()
            + (truncated ? ", truncated" : "") + "]";
    }

    /**
     * Accumulates nodes and edges. Adding an edge adds both endpoints.
     */
    public static class Builder {
        private final FunctionRef start;
        private final Set<FunctionRef> nodes = new LinkedHashSet<>();
        private final Set<Edge> edges = new LinkedHashSet<>();
        private boolean truncated;

        private Builder(FunctionRef start) {
            this.start = Objects.requireNonNull(start, "start");
            nodes.add(start);
        }

        public Builder addNode(FunctionRef node) {
            nodes.add(node);
            return this;
        }

        /**
         * @return true if the edge was not present before
         */
        public boolean addEdge(FunctionRef from, FunctionRef to) {
            nodes.add(from);
            nodes.add(to);
            return edges.add(new Edge(from, to));
        }

        public Builder edge(FunctionRef from, FunctionRef to) {
            addEdge(from, to);
            return this;
        }

        public Builder truncated(boolean truncated) {
            this.truncated = truncated;
            return this;
        }

        public boolean containsEdge(FunctionRef from, FunctionRef to) {
            return edges.contains(new Edge(from, to));
        }

        public int nodeCount() {
            return nodes.size();
        }

        public int edgeCount() {
            return edges.size();
        }

        public Graph build() {
            return new Graph(start, nodes, edges, truncated);
        }
    }
}
