package io.codemap.model;

import java.util.Objects;

/**
 * Identity of a call graph node.
 *
 * @param module   Defining module
 * @param function Function name
 * @param arity    Argument count
 */
public record FunctionRef(
    ModuleIdentifier module,
    String function,
    int arity
) {
    public FunctionRef {
        Objects.requireNonNull(module, "module");
        if (function == null || function.isBlank()) {
            throw new IllegalArgumentException("Function name must not be blank");
        }
        if (arity < 0) {
            throw new IllegalArgumentException("Arity must not be negative: " + arity);
        }
    }

    public static FunctionRef of(String module, String function, int arity) {
        return new FunctionRef(ModuleIdentifier.of(module), function, arity);
    }

    /**
     * Returns {@code Module.function/arity}.
     */
    public String signature() {
        return module + "." + function + "/" + arity;
    }

    @Override
    public String toString() {
        return signature();
    }
}
