package io.codemap.model;

import java.util.Objects;

/**
 * A call extracted from a function body.
 *
 * @param module   Target module, or null for an unqualified call resolved against the caller's module
 * @param name     Target function name
 * @param arity    Number of arguments, including a piped-in first argument
 * @param position Call site, or null when the tree carried no metadata
 */
public record Call(
    ModuleIdentifier module,
    String name,
    int arity,
    Position position
) {
    public Call {
        Objects.requireNonNull(name, "name");
        if (arity < 0) {
            throw new IllegalArgumentException("Negative arity for " + name + ": " + arity);
        }
    }

    public static Call local(String name, int arity) {
        return new Call(null, name, arity, null);
    }

    public static Call remote(ModuleIdentifier module, String name, int arity) {
        return new Call(module, name, arity, null);
    }

    public boolean isQualified() {
        return module != null;
    }

    /**
     * Same call without its position, for comparing extraction results.
     */
    public Call withoutPosition() {
        return position == null ? this : new Call(module, name, arity, null);
    }

    /**
     * Resolves this call to a graph node, using the caller's module when unqualified.
     */
    public FunctionRef target(ModuleIdentifier callerModule) {
        return new FunctionRef(module != null ? module : callerModule, name, arity);
    }

    @Override
    public String toString() {
        return (module != null ? module + "." : "") + name + "/" + arity;
    }
}
