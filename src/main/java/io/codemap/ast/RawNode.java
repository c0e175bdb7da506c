package io.codemap.ast;

import io.codemap.model.Position;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raw syntax tree of an Elixir module in quoted form.
 * <p>
 * Quoted Elixir is built from {@code {name, meta, args}} triples, two-element tuples,
 * lists and literals. Atoms are kept apart from other literals because they name
 * functions, keyword keys and Erlang modules.
 */
public sealed interface RawNode {

    /**
     * A {@code {head, meta, args}} triple. {@code args} is null for variables and bare names.
     */
    record Form(RawNode head, Position position, boolean noParens, List<RawNode> args) implements RawNode {
        public Form {
            args = args != null ? List.copyOf(args) : null;
        }
    }

    /**
     * A two-element tuple, which quotes to itself (keyword pairs, {@code {:ok, value}}).
     */
    record Pair(RawNode left, RawNode right) implements RawNode {}

    /**
     * A list literal, including keyword lists.
     */
    record ListNode(List<RawNode> elements) implements RawNode {
        public ListNode {
            elements = List.copyOf(elements);
        }
    }

    /**
     * An atom. {@code true}, {@code false} and {@code nil} are atoms too.
     */
    record Atom(String name) implements RawNode {}

    /**
     * A string or number literal.
     */
    record Literal(Object value) implements RawNode {}

    static Atom atom(String name) {
        return new Atom(name);
    }

    static Form form(String name, List<RawNode> args) {
        return new Form(new Atom(name), null, false, args);
    }

    static Form form(String name, Position position, List<RawNode> args) {
        return new Form(new Atom(name), position, false, args);
    }

    /**
     * A variable or bare name such as {@code x} in {@code x |> f()}.
     */
    static Form variable(String name) {
        return new Form(new Atom(name), null, false, null);
    }

    /**
     * Returns the head atom's name when this is a form with an atom head, else null.
     */
    default String formName() {
        if (this instanceof Form f && f.head() instanceof Atom a) {
            return a.name();
        }
        return null;
    }

    /**
     * Check if this is a form with the given atom head.
     */
    default boolean isForm(String name) {
        return name.equals(formName());
    }

    /**
     * Check if this is the given atom.
     */
    default boolean isAtom(String name) {
        return this instanceof Atom a && a.name().equals(name);
    }

    /**
     * Compact source-like rendering, used for attribute values and parameter names.
     */
    default String describe() {
        if (this instanceof Literal l) {
            return String.valueOf(l.value());
        } else if (this instanceof Atom a) {
            return switch (a.name()) {
                case "true", "false", "nil" -> a.name();
                default -> ":" + a.name();
            };
        } else if (this instanceof ListNode list) {
            return list.elements().stream()
                .map(RawNode::describe)
                .collect(Collectors.joining(", ", "[", "]"));
        } else if (this instanceof Pair p) {
            return "{" + p.left().describe() + ", " + p.right().describe() + "}";
        } else if (this instanceof Form f) {
            String name = f.head() instanceof Atom a ? a.name() : f.head().describe();
            if (f.args() == null) {
                return name;
            }
            if ("__aliases__".equals(name)) {
                return f.args().stream()
                    .map(arg -> arg instanceof Atom a ? a.name() : arg.describe())
                    .collect(Collectors.joining("."));
            }
            return f.args().stream()
                .map(RawNode::describe)
                .collect(Collectors.joining(", ", name + "(", ")"));
        }
        throw new IllegalStateException("Unknown RawNode type: " + this.getClass());
    }
}
