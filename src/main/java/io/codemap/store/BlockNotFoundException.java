package io.codemap.store;

import io.codemap.model.ModuleIdentifier;

/**
 * The requested module is not in the block store.
 */
public class BlockNotFoundException extends Exception {

    private final ModuleIdentifier module;

    public BlockNotFoundException(ModuleIdentifier module) {
        super("No block for module " + module);
        this.module = module;
    }

    public ModuleIdentifier module() {
        return module;
    }
}
