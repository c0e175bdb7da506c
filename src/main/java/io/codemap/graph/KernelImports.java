package io.codemap.graph;

import io.codemap.model.ModuleIdentifier;

import java.util.Set;

/**
 * Functions and macros every module imports from {@code Kernel}.
 * <p>
 * An unqualified call to one of these names targets {@code Kernel} unless the calling
 * module defines a clause of the same name and arity, which shadows the import.
 */
public final class KernelImports {

    public static final ModuleIdentifier KERNEL = ModuleIdentifier.of("Kernel");

    private static final Set<String> OPERATORS = Set.of(
        "+", "-", "*", "/", "++", "--", "<>", "..", "..//",
        "==", "!=", "===", "!==", "<", ">", "<=", ">=", "=~",
        "&&", "||", "!", "and", "or", "not", "in"
    );

    private static final Set<String> FUNCTIONS = Set.of(
        // guards
        "abs", "binary_part", "bit_size", "byte_size", "ceil", "div", "elem", "floor", "hd",
        "is_atom", "is_binary", "is_bitstring", "is_boolean", "is_exception", "is_float",
        "is_function", "is_integer", "is_list", "is_map", "is_map_key", "is_nil", "is_number",
        "is_pid", "is_port", "is_reference", "is_struct", "is_tuple", "length", "map_size",
        "node", "rem", "round", "self", "tl", "trunc", "tuple_size",
        // functions
        "apply", "binding", "exit", "function_exported?", "get_and_update_in", "get_in", "inspect",
        "macro_exported?", "make_ref", "max", "min", "pop_in", "put_elem", "put_in", "send",
        "spawn", "spawn_link", "spawn_monitor", "struct", "struct!", "throw", "to_charlist",
        "to_string", "update_in",
        // macros
        "if", "unless", "raise", "reraise", "then", "tap", "dbg", "match?", "destructure",
        "sigil_c", "sigil_C", "sigil_D", "sigil_N", "sigil_r", "sigil_R",
        "sigil_s", "sigil_S", "sigil_T", "sigil_U", "sigil_w", "sigil_W"
    );

    private KernelImports() {
    }

    public static boolean isImported(String name) {
        return OPERATORS.contains(name) || FUNCTIONS.contains(name);
    }
}
