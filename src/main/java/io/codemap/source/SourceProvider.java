package io.codemap.source;

import io.codemap.ast.RawNode;
import io.codemap.model.ModuleIdentifier;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Supplies raw module trees to the block store.
 * Implementations must be safe to call from the store's writer thread while other threads read.
 */
public interface SourceProvider {

    /**
     * Returns the {@code defmodule} tree for the given module, if known.
     */
    Optional<RawNode> resolve(ModuleIdentifier module);

    /**
     * Lists every module this provider can resolve.
     *
     * @throws IOException if the underlying sources cannot be listed
     */
    List<ModuleIdentifier> enumerateModules() throws IOException;
}
