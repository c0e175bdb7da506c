package io.codemap.source;

import io.codemap.ast.RawNode;
import io.codemap.model.ModuleIdentifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Source provider backed by trees registered in memory.
 * Registering a module again replaces its tree; the next rescan picks it up.
 */
public class InMemorySourceProvider implements SourceProvider {

    private final Map<ModuleIdentifier, RawNode> modules = new ConcurrentHashMap<>();

    /**
     * Register every {@code defmodule} found in the tree.
     *
     * @return this provider, for chaining
     */
    public InMemorySourceProvider add(RawNode tree) {
        modules.putAll(ModuleLocator.index(tree));
        return this;
    }

    /**
     * Register a tree under an explicit identifier, without looking inside it.
     */
    public InMemorySourceProvider put(ModuleIdentifier module, RawNode tree) {
        modules.put(module, tree);
        return this;
    }

    public InMemorySourceProvider remove(ModuleIdentifier module) {
        modules.remove(module);
        return this;
    }

    @Override
    public Optional<RawNode> resolve(ModuleIdentifier module) {
        return Optional.ofNullable(modules.get(module));
    }

    @Override
    public List<ModuleIdentifier> enumerateModules() {
        List<ModuleIdentifier> result = new ArrayList<>(modules.keySet());
        result.sort(null);
        return result;
    }
}
