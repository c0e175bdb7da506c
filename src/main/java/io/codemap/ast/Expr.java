package io.codemap.ast;

import io.codemap.model.ModuleIdentifier;
import io.codemap.model.Position;

import java.util.List;

/**
 * Normalized expression kinds that call extraction works on.
 * <p>
 * Every raw shape is read into exactly one of these, so extraction rules never
 * depend on the concrete quoted grammar.
 */
public sealed interface Expr {

    /**
     * {@code Mod.func(args)}. {@code module} is already alias-resolved.
     * {@code receiver} holds the receiver expression when the module is only known at runtime.
     */
    record QualifiedCall(ModuleIdentifier module, String name, List<Expr> args, Expr receiver,
                         Position position) implements Expr {
        public QualifiedCall {
            args = List.copyOf(args);
        }
    }

    /**
     * {@code func(args)} without a module.
     */
    record LocalCall(String name, List<Expr> args, Position position) implements Expr {
        public LocalCall {
            args = List.copyOf(args);
        }
    }

    /**
     * {@code source |> target}.
     */
    record Pipeline(Expr source, Expr target) implements Expr {}

    /**
     * {@code with} chain: clause right-hand sides in order, then the success body and optional else body.
     */
    record WithChain(List<Expr> clauses, Expr body, Expr elseBody) implements Expr {
        public WithChain {
            clauses = List.copyOf(clauses);
        }
    }

    /**
     * Tuple elements.
     */
    record Grouping(List<Expr> elements) implements Expr {
        public Grouping {
            elements = List.copyOf(elements);
        }
    }

    /**
     * List elements.
     */
    record Sequence(List<Expr> elements) implements Expr {
        public Sequence {
            elements = List.copyOf(elements);
        }
    }

    /**
     * Statements of a block. Special forms that are not calls keep their operands here.
     */
    record NestedBlock(List<Expr> statements) implements Expr {
        public NestedBlock {
            statements = List.copyOf(statements);
        }
    }

    /**
     * Variables, literals, aliases and anything else that makes no calls.
     */
    record Leaf() implements Expr {}

    Leaf LEAF = new Leaf();
}
