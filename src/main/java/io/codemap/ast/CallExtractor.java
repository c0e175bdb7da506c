package io.codemap.ast;

import io.codemap.model.Call;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens an {@link Expr} tree into the calls it makes, in call-site order.
 * <p>
 * Each call is followed by the calls nested in its arguments.
 */
public final class CallExtractor {

    private CallExtractor() {
    }

    public static List<Call> extract(Expr expr) {
        List<Call> calls = new ArrayList<>();
        collect(expr, calls);
        return calls;
    }

    private static void collect(Expr expr, List<Call> out) {
        if (expr instanceof Expr.QualifiedCall q) {
            out.add(new Call(q.module(), q.name(), q.args().size(), q.position()));
            if (q.receiver() != null) {
                collect(q.receiver(), out);
            }
            collectAll(q.args(), out);
        } else if (expr instanceof Expr.LocalCall l) {
            out.add(new Call(null, l.name(), l.args().size(), l.position()));
            collectAll(l.args(), out);
        } else if (expr instanceof Expr.Pipeline p) {
            collect(p.source(), out);
            collectPipeTarget(p.target(), out);
        } else if (expr instanceof Expr.WithChain w) {
            collectAll(w.clauses(), out);
            collect(w.body(), out);
            if (w.elseBody() != null) {
                collect(w.elseBody(), out);
            }
        } else if (expr instanceof Expr.Grouping g) {
            collectAll(g.elements(), out);
        } else if (expr instanceof Expr.Sequence s) {
            collectAll(s.elements(), out);
        } else if (expr instanceof Expr.NestedBlock b) {
            collectAll(b.statements(), out);
        } else if (!(expr instanceof Expr.Leaf)) {
            throw new IllegalStateException("Unknown Expr type: " + expr.getClass());
        }
    }

    /**
     * The piped value becomes the first argument, so the target's arity is one more than written.
     */
    private static void collectPipeTarget(Expr target, List<Call> out) {
        if (target instanceof Expr.QualifiedCall q) {
            out.add(new Call(q.module(), q.name(), q.args().size() + 1, q.position()));
            if (q.receiver() != null) {
                collect(q.receiver(), out);
            }
            collectAll(q.args(), out);
        } else if (target instanceof Expr.LocalCall l) {
            out.add(new Call(null, l.name(), l.args().size() + 1, l.position()));
            collectAll(l.args(), out);
        } else {
            collect(target, out);
        }
    }

    private static void collectAll(List<Expr> exprs, List<Call> out) {
        for (Expr expr : exprs) {
            collect(expr, out);
        }
    }
}
