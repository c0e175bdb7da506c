package io.codemap.graph;

import io.codemap.model.Call;
import io.codemap.model.FunctionBlock;
import io.codemap.model.FunctionRef;
import io.codemap.model.ModuleBlock;
import io.codemap.model.ModuleIdentifier;
import io.codemap.store.BlockStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a call graph breadth-first from one start function.
 * <p>
 * The frontier and visited set belong to a single {@link #build} call, so one builder can serve
 * concurrent builds. A function whose module or clause is missing from the store is kept as a
 * node without outgoing edges. Each node is expanded at most once, which bounds the traversal
 * even under direct or mutual recursion.
 * <p>
 * Unqualified calls resolve to a local definition first, then to the {@link KernelImports},
 * then to the caller's module. Calling {@code greet/1} on {@code def greet(n, g \\ "hi")}
 * yields the edge {@code greet/1 -> greet/2}.
 */
public class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private final BlockStore store;
    private final TraversalOptions options;

    public GraphBuilder(BlockStore store) {
        this(store, TraversalOptions.defaults());
    }

    public GraphBuilder(BlockStore store, TraversalOptions options) {
        this.store = store;
        this.options = options != null ? options : TraversalOptions.defaults();
    }

    /**
     * Build the graph reachable from {@code module.function/arity}.
     *
     * @throws TraversalException if the reference is malformed or the build is cancelled
     */
    public Graph build(String module, String function, int arity) throws TraversalException {
        FunctionRef start;
        try {
            start = FunctionRef.of(module, function, arity);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new TraversalException("Invalid start function " + module + "." + function + "/" + arity
                + ": " + e.getMessage(), e);
        }
        return build(start);
    }

    /**
     * Build the graph reachable from {@code start}.
     *
     * @throws TraversalException if {@code start} is null or the build is cancelled
     */
    public Graph build(FunctionRef start) throws TraversalException {
        if (start == null) {
            throw new TraversalException("Start function must not be null");
        }

        Graph.Builder graph = Graph.builder(start);
        Deque<FunctionRef> frontier = new ArrayDeque<>();
        Set<FunctionRef> visited = new HashSet<>();
        frontier.add(start);
        visited.add(start);

        while (!frontier.isEmpty()) {
            if (options.cancelled().getAsBoolean()) {
                throw new TraversalException("Call graph build from " + start + " was cancelled");
            }
            FunctionRef current = frontier.poll();

            for (Call call : outgoingCalls(current)) {
                FunctionRef target = resolve(call, current);
                boolean newEdge = !graph.containsEdge(current, target);

                // a node is only added together with the edge that reaches it
                if (newEdge && options.edgeBudgetReached(graph.edgeCount())) {
                    return truncate(graph, start);
                }
                if (!visited.contains(target)) {
                    if (options.nodeBudgetReached(graph.nodeCount())) {
                        return truncate(graph, start);
                    }
                    visited.add(target);
                    graph.addNode(target);
                    frontier.add(target);
                }
                if (newEdge) {
                    graph.addEdge(current, target);
                }
            }
        }

        return graph.build();
    }

    /**
     * Calls made by every clause of {@code node} that matches its arity, in declaration order.
     * A clause reached through its defaulted parameters contributes a single call to its full
     * arity, which is the function the compiler generates for the shorter arity.
     * Empty when the module or function is unknown or excluded.
     */
    List<Call> outgoingCalls(FunctionRef node) {
        ModuleIdentifier module = node.module();
        if (module.isUnknown() || options.isExcluded(module)) {
            return List.of();
        }
        Optional<ModuleBlock> block = store.lookup(module);
        if (block.isEmpty()) {
            log.debug("No block for module {}, treating {} as a leaf", module, node);
            return List.of();
        }

        List<Call> calls = new ArrayList<>();
        boolean found = false;
        for (FunctionBlock clause : block.get().clauses(node.function())) {
            if (!matchesArity(clause, node.arity(), options.arityMatching())) {
                continue;
            }
            found = true;
            if (clause.arity() != null && node.arity() < clause.arity()) {
                Call delegation = Call.local(node.function(), clause.arity());
                if (!calls.contains(delegation)) {
                    calls.add(delegation);
                }
            } else {
                calls.addAll(clause.calls());
            }
        }
        if (!found) {
            log.debug("No clause of {} matches, treating it as a leaf", node);
        }
        return calls;
    }

    /**
     * Target of a call made from {@code caller}. An unqualified call goes to the caller's module,
     * or to {@code Kernel} when it names a Kernel import the caller does not shadow.
     */
    FunctionRef resolve(Call call, FunctionRef caller) {
        if (call.isQualified()) {
            return call.target(caller.module());
        }
        if (KernelImports.isImported(call.name()) && !definesLocally(caller.module(), call.name(), call.arity())) {
            return new FunctionRef(KernelImports.KERNEL, call.name(), call.arity());
        }
        return call.target(caller.module());
    }

    private boolean definesLocally(ModuleIdentifier module, String function, int arity) {
        return store.lookup(module)
            .map(block -> block.clauses(function).stream()
                .anyMatch(clause -> matchesArity(clause, arity, options.arityMatching())))
            .orElse(false);
    }

    /**
     * Check whether a clause accepts the given arity.
     * An explicit arity wins (defaulted parameters widen it to a range), then the parameter list
     * length, then the policy for clauses that carry neither.
     */
    public static boolean matchesArity(FunctionBlock clause, int arity, ArityMatching policy) {
        if (clause.arity() != null) {
            return arity >= clause.minArity() && arity <= clause.arity();
        }
        if (clause.parameters() != null) {
            return clause.parameters().size() == arity;
        }
        log.debug("Cannot determine arity of {}, policy {}", clause.name(), policy);
        return policy == ArityMatching.LENIENT;
    }

    private Graph truncate(Graph.Builder graph, FunctionRef start) {
        log.info("Call graph from {} truncated at {} nodes, {} edges", start, graph.nodeCount(), graph.edgeCount());
        return graph.truncated(true).build();
    }
}
