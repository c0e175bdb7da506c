package io.codemap.model;

/**
 * Normalized structure of a module or one of its function clauses.
 */
public sealed interface Block permits ModuleBlock, FunctionBlock {

    /**
     * Display name of the block.
     */
    String displayName();

    /**
     * Where the block was declared, or null.
     */
    Position position();
}
