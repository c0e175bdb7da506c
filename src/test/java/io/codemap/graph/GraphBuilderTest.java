package io.codemap.graph;

import io.codemap.model.Call;
import io.codemap.model.FunctionBlock;
import io.codemap.model.FunctionKind;
import io.codemap.model.FunctionRef;
import io.codemap.model.ModuleBlock;
import io.codemap.model.ModuleIdentifier;
import io.codemap.source.InMemorySourceProvider;
import io.codemap.store.BlockStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static io.codemap.ast.Quoted.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphBuilderTest {

    private static final ModuleIdentifier MATH = ModuleIdentifier.of("Test.Support.Math");
    private static final ModuleIdentifier KERNEL = ModuleIdentifier.of("Kernel");
    private static final ModuleIdentifier CALLER = ModuleIdentifier.of("Test.Support.Caller");
    private static final ModuleIdentifier CHAIN = ModuleIdentifier.of("Chain");

    private InMemorySourceProvider provider;
    private BlockStore store;

    @BeforeEach
    void setUp() {
        provider = new InMemorySourceProvider();
        store = new BlockStore(provider);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private static FunctionBlock fn(String name, int arity, Call... calls) {
        return FunctionBlock.of(name, arity, List.of(calls));
    }

    private void put(ModuleIdentifier module, FunctionBlock... functions) {
        store.put(ModuleBlock.of(module, List.of(functions)));
    }

    /**
     * Chain.a/0 -> b/0 -> c/0 -> d/0
     */
    private void putChain() {
        put(CHAIN,
                fn("a", 0, Call.local("b", 0)),
                fn("b", 0, Call.local("c", 0)),
                fn("c", 0, Call.local("d", 0)),
                fn("d", 0));
    }

    private static void assertWellFormed(Graph graph) {
        assertThat(graph.nodes()).contains(graph.start());
        for (Edge edge : graph.edges()) {
            assertThat(graph.nodes()).contains(edge.from(), edge.to());
        }
    }

    @Test
    void build_operatorsResolveToKernel() throws Exception {
        provider.add(defmodule("Math",
                def("add", params("a", "b"), call("+", var("a"), var("b"))),
                def("subtract", params("a", "b"), call("-", var("a"), var("b")))));
        store.rescanNow();

        Graph graph = new GraphBuilder(store).build("Math", "add", 2);

        FunctionRef add = FunctionRef.of("Math", "add", 2);
        FunctionRef plus = new FunctionRef(KERNEL, "+", 2);
        assertThat(graph.start()).isEqualTo(add);
        assertThat(graph.nodes()).containsExactly(add, plus);
        assertThat(graph.edges()).containsExactly(new Edge(add, plus));
        assertThat(graph.truncated()).isFalse();
    }

    @Test
    void build_directRecursionIsOneSelfLoop() throws Exception {
        provider.add(defmodule("Caller", def("recursive_call", params(), call("recursive_call"))));
        store.rescanNow();

        Graph graph = new GraphBuilder(store).build("Caller", "recursive_call", 0);

        FunctionRef node = FunctionRef.of("Caller", "recursive_call", 0);
        assertThat(graph.nodes()).containsExactly(node);
        assertThat(graph.edges()).containsExactly(new Edge(node, node));
        assertThat(graph.edges().iterator().next().isSelfLoop()).isTrue();
    }

    @Test
    void build_localDefinitionShadowsKernelImport() throws Exception {
        put(CALLER,
                fn("show", 1, Call.local("inspect", 1), Call.local("inspect", 2), Call.local("render", 1)),
                fn("inspect", 1));

        Graph graph = new GraphBuilder(store).build("Test.Support.Caller", "show", 1);

        assertThat(graph.nodes()).containsExactly(
                new FunctionRef(CALLER, "show", 1),
                new FunctionRef(CALLER, "inspect", 1),
                new FunctionRef(KERNEL, "inspect", 2),
                new FunctionRef(CALLER, "render", 1));
    }

    @Test
    void resolve_matchAndSigilsAreKernelImports() {
        GraphBuilder builder = new GraphBuilder(store);
        FunctionRef caller = new FunctionRef(CALLER, "run", 0);

        assertThat(builder.resolve(Call.local("match?", 2), caller)).isEqualTo(new FunctionRef(KERNEL, "match?", 2));
        assertThat(builder.resolve(Call.local("sigil_S", 2), caller)).isEqualTo(new FunctionRef(KERNEL, "sigil_S", 2));
        assertThat(builder.resolve(Call.local("binding", 0), caller)).isEqualTo(new FunctionRef(KERNEL, "binding", 0));
        assertThat(builder.resolve(Call.local("helper", 1), caller)).isEqualTo(new FunctionRef(CALLER, "helper", 1));
    }

    @Test
    void build_mutualRecursionTerminates() throws Exception {
        put(CALLER,
                fn("ping", 0, Call.local("pong", 0)),
                fn("pong", 0, Call.local("ping", 0)));

        Graph graph = new GraphBuilder(store).build("Test.Support.Caller", "ping", 0);

        FunctionRef ping = new FunctionRef(CALLER, "ping", 0);
        FunctionRef pong = new FunctionRef(CALLER, "pong", 0);
        assertThat(graph.nodes()).containsExactly(ping, pong);
        assertThat(graph.hasEdge(ping, pong)).isTrue();
        assertThat(graph.hasEdge(pong, ping)).isTrue();
        assertThat(graph.edgeCount()).isEqualTo(2);
    }

    @Test
    void build_startWithoutCallsIsSingleNode() throws Exception {
        put(MATH, fn("zero", 0));

        Graph graph = new GraphBuilder(store).build("Test.Support.Math", "zero", 0);

        assertThat(graph).isEqualTo(Graph.of(FunctionRef.of("Test.Support.Math", "zero", 0)));
    }

    @Test
    void build_unknownModuleOrFunctionIsSingleNode() throws Exception {
        put(MATH, fn("add", 2, Call.remote(KERNEL, "+", 2)));
        GraphBuilder builder = new GraphBuilder(store);

        assertThat(builder.build("Nowhere", "run", 0).nodeCount()).isEqualTo(1);
        assertThat(builder.build("Test.Support.Math", "missing", 1).edgeCount()).isZero();
    }

    @Test
    void build_repeatedCallsYieldOneEdge() throws Exception {
        put(CALLER, fn("run", 0,
                Call.local("log", 1),
                Call.remote(CALLER, "log", 1),
                Call.local("log", 1)));

        Graph graph = new GraphBuilder(store).build("Test.Support.Caller", "run", 0);

        // unqualified and self-qualified calls resolve to the same node
        assertThat(graph.nodeCount()).isEqualTo(2);
        assertThat(graph.edgeCount()).isEqualTo(1);
        assertWellFormed(graph);
    }

    @Test
    void build_discoversBreadthFirst() throws Exception {
        put(CALLER,
                fn("root", 0, Call.local("left", 0), Call.local("right", 0)),
                fn("left", 0, Call.local("deep", 0)),
                fn("right", 0),
                fn("deep", 0));

        Graph graph = new GraphBuilder(store).build("Test.Support.Caller", "root", 0);

        assertThat(graph.nodes()).extracting(FunctionRef::function)
                .containsExactly("root", "left", "right", "deep");
        assertThat(graph.callees(FunctionRef.of("Test.Support.Caller", "root", 0)))
                .extracting(FunctionRef::function)
                .containsExactly("left", "right");
        assertThat(graph.callers(FunctionRef.of("Test.Support.Caller", "deep", 0)))
                .extracting(FunctionRef::function)
                .containsExactly("left");
    }

    @Test
    void build_mergesEveryMatchingClause() throws Exception {
        put(CALLER,
                fn("handle", 1, Call.local("on_ok", 1)),
                fn("handle", 1, Call.local("on_error", 1)),
                fn("handle", 2, Call.local("on_other", 2)));

        Graph graph = new GraphBuilder(store).build("Test.Support.Caller", "handle", 1);

        assertThat(graph.nodes()).extracting(FunctionRef::function)
                .containsExactly("handle", "on_ok", "on_error");
    }

    @Test
    void build_defaultedParametersDelegateToFullArity() throws Exception {
        provider.add(defmodule("Greeter",
                def("greet", List.of(var("name"), call("\\\\", var("greeting"), lit("hi"))), null),
                def("greet", params("name", "greeting"), call("format", var("greeting"), var("name"))),
                def("format", params("a", "b"), call("<>", var("a"), var("b")))));
        store.rescanNow();

        Graph graph = new GraphBuilder(store).build("Greeter", "greet", 1);

        FunctionRef greet1 = FunctionRef.of("Greeter", "greet", 1);
        FunctionRef greet2 = FunctionRef.of("Greeter", "greet", 2);
        FunctionRef format = FunctionRef.of("Greeter", "format", 2);
        assertThat(graph.nodes()).containsExactly(greet1, greet2, format, new FunctionRef(KERNEL, "<>", 2));
        assertThat(graph.callees(greet1)).containsExactly(greet2);
        assertThat(graph.callees(greet2)).containsExactly(format);
    }

    @Test
    void build_defaultsInAClauseWithBodyDelegateToo() throws Exception {
        FunctionBlock greet = new FunctionBlock("greet", FunctionKind.DEF, 2, List.of("name", "greeting"), 1,
                List.of(Call.local("format", 2)), null);
        store.put(ModuleBlock.of(CALLER, List.of(greet)));

        Graph graph = new GraphBuilder(store).build("Test.Support.Caller", "greet", 1);

        assertThat(graph.nodes()).extracting(FunctionRef::toString).containsExactly(
                "Test.Support.Caller.greet/1", "Test.Support.Caller.greet/2", "Test.Support.Caller.format/2");
        assertThat(graph.edgeCount()).isEqualTo(2);
    }

    @Test
    void build_arityPolicyForClausesWithoutArity() throws Exception {
        put(CALLER, FunctionBlock.of("legacy", List.of(Call.local("helper", 0))));

        Graph lenient = new GraphBuilder(store).build("Test.Support.Caller", "legacy", 3);
        Graph strict = new GraphBuilder(store, TraversalOptions.defaults().withArityMatching(ArityMatching.STRICT))
                .build("Test.Support.Caller", "legacy", 3);

        assertThat(lenient.edgeCount()).isEqualTo(1);
        assertThat(strict.edgeCount()).isZero();
    }

    @Test
    void matchesArity_prefersExplicitArityThenParameters() {
        FunctionBlock explicit = FunctionBlock.of("f", 2, List.of());
        FunctionBlock paramsOnly = new FunctionBlock("f", FunctionKind.DEF, null, List.of("a"), 0, List.of(), null);
        FunctionBlock neither = FunctionBlock.of("f", List.of());

        assertThat(GraphBuilder.matchesArity(explicit, 2, ArityMatching.STRICT)).isTrue();
        assertThat(GraphBuilder.matchesArity(explicit, 1, ArityMatching.LENIENT)).isFalse();
        assertThat(GraphBuilder.matchesArity(paramsOnly, 1, ArityMatching.STRICT)).isTrue();
        assertThat(GraphBuilder.matchesArity(paramsOnly, 2, ArityMatching.LENIENT)).isFalse();
        assertThat(GraphBuilder.matchesArity(neither, 5, ArityMatching.LENIENT)).isTrue();
        assertThat(GraphBuilder.matchesArity(neither, 5, ArityMatching.STRICT)).isFalse();
    }

    @Test
    void build_nodeBudgetTruncates() throws Exception {
        putChain();

        Graph graph = new GraphBuilder(store, TraversalOptions.defaults().withBudget(2, 0))
                .build("Chain", "a", 0);

        assertThat(graph.truncated()).isTrue();
        assertThat(graph.nodes()).extracting(FunctionRef::function).containsExactly("a", "b");
        assertWellFormed(graph);
    }

    @Test
    void build_edgeBudgetTruncates() throws Exception {
        putChain();

        Graph graph = new GraphBuilder(store, TraversalOptions.defaults().withBudget(0, 1))
                .build("Chain", "a", 0);

        assertThat(graph.truncated()).isTrue();
        assertThat(graph.edgeCount()).isEqualTo(1);
        assertWellFormed(graph);
    }

    @Test
    void build_edgeBudgetLeavesNoUnreachedNodes() throws Exception {
        put(CALLER,
                fn("root", 0, Call.local("left", 0), Call.local("right", 0)),
                fn("left", 0),
                fn("right", 0));

        Graph graph = new GraphBuilder(store, TraversalOptions.defaults().withBudget(0, 1))
                .build("Test.Support.Caller", "root", 0);

        assertThat(graph.truncated()).isTrue();
        assertThat(graph.nodes()).extracting(FunctionRef::function).containsExactly("root", "left");
        for (FunctionRef node : graph.nodes()) {
            if (!node.equals(graph.start())) {
                assertThat(graph.callers(node)).isNotEmpty();
            }
        }
    }

    @Test
    void build_budgetThatFitsDoesNotTruncate() throws Exception {
        putChain();

        Graph graph = new GraphBuilder(store, TraversalOptions.defaults().withBudget(4, 3))
                .build("Chain", "a", 0);

        assertThat(graph.truncated()).isFalse();
        assertThat(graph.nodeCount()).isEqualTo(4);
        assertThat(graph.edgeCount()).isEqualTo(3);
    }

    @Test
    void build_cancellationThrows() {
        putChain();
        AtomicInteger polls = new AtomicInteger();
        TraversalOptions options = TraversalOptions.defaults().withCancellation(() -> polls.incrementAndGet() > 2);

        assertThatThrownBy(() -> new GraphBuilder(store, options).build("Chain", "a", 0))
                .isInstanceOf(TraversalException.class)
                .hasMessageContaining("cancelled");
    }

    @Test
    void build_excludedModulesAreLeaves() throws Exception {
        ModuleIdentifier repo = ModuleIdentifier.of("Ecto.Repo");
        put(CALLER, fn("save", 1, Call.remote(repo, "insert", 1), Call.remote(KERNEL, "inspect", 1)));
        put(repo, fn("insert", 1, Call.local("prepare", 1)));
        put(KERNEL, fn("inspect", 1, Call.local("format", 1)));

        TraversalOptions options = TraversalOptions.defaults().withExcludeModules(List.of("Ecto.", "Kernel"));
        Graph graph = new GraphBuilder(store, options).build("Test.Support.Caller", "save", 1);

        assertThat(graph.nodes()).containsExactly(
                new FunctionRef(CALLER, "save", 1),
                new FunctionRef(repo, "insert", 1),
                new FunctionRef(KERNEL, "inspect", 1));
    }

    @Test
    void isExcluded_matchesPrefixPatternsOnSegmentBoundaries() {
        TraversalOptions options = TraversalOptions.defaults().withExcludeModules(List.of("Ecto.", "Kernel"));

        assertThat(options.isExcluded(ModuleIdentifier.of("Ecto"))).isTrue();
        assertThat(options.isExcluded(ModuleIdentifier.of("Ecto.Changeset"))).isTrue();
        assertThat(options.isExcluded(ModuleIdentifier.of("EctoSql"))).isFalse();
        assertThat(options.isExcluded(ModuleIdentifier.of("Kernel.SpecialForms"))).isFalse();
    }

    @Test
    void build_dynamicCallsAreUnexpandedNodes() throws Exception {
        put(CALLER, fn("dispatch", 1, Call.remote(ModuleIdentifier.UNKNOWN, "run", 1)));

        Graph graph = new GraphBuilder(store).build("Test.Support.Caller", "dispatch", 1);

        assertThat(graph.nodes()).contains(new FunctionRef(ModuleIdentifier.UNKNOWN, "run", 1));
        assertThat(graph.edgeCount()).isEqualTo(1);
    }

    @Test
    void build_isDeterministic() throws Exception {
        putChain();
        put(CALLER, fn("run", 0, Call.remote(CHAIN, "a", 0), Call.remote(MATH, "add", 2)));
        GraphBuilder builder = new GraphBuilder(store);

        Graph first = builder.build("Test.Support.Caller", "run", 0);
        Graph second = builder.build("Test.Support.Caller", "run", 0);

        assertThat(second).isEqualTo(first);
        assertThat(List.copyOf(second.nodes())).isEqualTo(List.copyOf(first.nodes()));
        assertWellFormed(first);
    }

    @Test
    void build_rejectsMalformedStart() {
        GraphBuilder builder = new GraphBuilder(store);

        assertThatThrownBy(() -> builder.build("", "run", 0)).isInstanceOf(TraversalException.class);
        assertThatThrownBy(() -> builder.build("App", " ", 0)).isInstanceOf(TraversalException.class);
        assertThatThrownBy(() -> builder.build("App", "run", -1)).isInstanceOf(TraversalException.class);
        assertThatThrownBy(() -> builder.build(null, "run", 0)).isInstanceOf(TraversalException.class);
        assertThatThrownBy(() -> builder.build((FunctionRef) null)).isInstanceOf(TraversalException.class);
    }

    @Test
    void options_rejectNegativeBudgets() {
        assertThatThrownBy(() -> TraversalOptions.defaults().withBudget(-1, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
