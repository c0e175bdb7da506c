package io.codemap;

import io.codemap.graph.Graph;
import io.codemap.graph.GraphBuilder;
import io.codemap.graph.TraversalException;
import io.codemap.graph.TraversalOptions;
import io.codemap.model.ModuleBlock;
import io.codemap.model.ModuleIdentifier;
import io.codemap.output.GraphPresenter;
import io.codemap.source.SourceProvider;
import io.codemap.store.BlockNotFoundException;
import io.codemap.store.BlockStore;
import io.codemap.store.ScanSummary;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point for embedding: one block store, a graph builder over it, and the renderers.
 * <p>
 * Closing a CodeMap stops its store's writer thread.
 */
public class CodeMap implements AutoCloseable {

    private final BlockStore store;
    private final GraphBuilder graphBuilder;
    private final GraphPresenter presenter;

    public CodeMap(BlockStore store, TraversalOptions options) {
        this.store = store;
        this.graphBuilder = new GraphBuilder(store, options);
        this.presenter = new GraphPresenter();
    }

    /**
     * Create a CodeMap over the given provider. The store starts empty; call {@link #rescan()}.
     */
    public static CodeMap create(SourceProvider provider, TraversalOptions options) {
        return new CodeMap(new BlockStore(provider), options);
    }

    public static CodeMap create(SourceProvider provider) {
        return create(provider, TraversalOptions.defaults());
    }

    public BlockStore store() {
        return store;
    }

    public Optional<ModuleBlock> getBlock(ModuleIdentifier module) {
        return store.lookup(module);
    }

    /**
     * Like {@link #getBlock} but fails when the module is not cached.
     */
    public ModuleBlock requireBlock(ModuleIdentifier module) throws BlockNotFoundException {
        return store.lookup(module).orElseThrow(() -> new BlockNotFoundException(module));
    }

    public Set<ModuleIdentifier> listModules() {
        return store.list();
    }

    /**
     * Trigger a rescan on the store's writer thread.
     */
    public CompletableFuture<ScanSummary> rescan() {
        return store.rescan();
    }

    /**
     * Build the call graph from {@code module.function/arity}.
     * Any failure inside the build is reported as a {@link TraversalException}.
     */
    public Graph buildCallGraph(String module, String function, int arity) throws TraversalException {
        try {
            return graphBuilder.build(module, function, arity);
        } catch (TraversalException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TraversalException("Failed to build call graph: " + e.getMessage(), e);
        }
    }

    public String renderText(Graph graph) {
        return presenter.renderText(graph);
    }

    public String renderDiagram(Graph graph) {
        return presenter.renderDiagram(graph);
    }

    @Override
    public void close() {
        store.close();
    }
}
