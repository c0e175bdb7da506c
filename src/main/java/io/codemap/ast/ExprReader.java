package io.codemap.ast;

import io.codemap.model.ModuleIdentifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads raw function bodies into {@link Expr} trees.
 * <p>
 * Alias resolution happens here, so qualified calls leave the reader with their final module.
 */
public class ExprReader {

    // Operands are scanned, the form itself is not a call
    private static final Set<String> SPECIAL_FORMS = Set.of(
        "=", "fn", "^", "%{}", "%", "<<>>", "::", "case", "cond", "try", "receive", "for", "quote", "unquote"
    );

    private static final Set<String> LEAF_FORMS = Set.of(
        "__aliases__", "@", "__MODULE__", "__ENV__", "__DIR__", "__CALLER__", "__STACKTRACE__",
        // lexical directives name modules, never call them
        "alias", "import", "require"
    );

    private final AliasTable aliases;

    public ExprReader(AliasTable aliases) {
        this.aliases = aliases;
    }

    /**
     * Read one raw node.
     */
    public Expr read(RawNode node) {
        if (node == null) {
            return Expr.LEAF;
        }
        if (node instanceof RawNode.Pair p) {
            return new Expr.Grouping(List.of(read(p.left()), read(p.right())));
        } else if (node instanceof RawNode.ListNode list) {
            return new Expr.Sequence(readAll(list.elements()));
        } else if (node instanceof RawNode.Form f) {
            return readForm(f);
        }
        return Expr.LEAF;
    }

    private Expr readForm(RawNode.Form form) {
        if (form.head() instanceof RawNode.Form head && head.isForm(".")) {
            return readDotCall(head, form);
        }

        String name = form.formName();
        List<RawNode> args = form.args();
        if (name == null) {
            // unquote(name)(args) and similar computed heads
            return args == null ? Expr.LEAF : new Expr.NestedBlock(readAll(args));
        }
        if (args == null || LEAF_FORMS.contains(name)) {
            return Expr.LEAF;
        }

        switch (name) {
            case "__block__":
                return new Expr.NestedBlock(readAll(args));
            case "{}":
                return new Expr.Grouping(readAll(args));
            case "|>":
                if (args.size() == 2) {
                    return new Expr.Pipeline(read(args.get(0)), readPipeTarget(args.get(1)));
                }
                break;
            case "with":
                return readWith(args);
            case "->":
                // [patterns] -> body
                return args.size() == 2 ? new Expr.NestedBlock(List.of(read(args.get(1)))) : Expr.LEAF;
            case "&":
                return readCapture(args);
            default:
                if (SPECIAL_FORMS.contains(name)) {
                    return new Expr.NestedBlock(readAll(args));
                }
        }
        return new Expr.LocalCall(name, readAll(args), form.position());
    }

    /**
     * {@code {{:., _, [target, name]}, _, args}} and {@code {{:., _, [fun]}, _, args}}.
     */
    private Expr readDotCall(RawNode.Form dot, RawNode.Form call) {
        List<RawNode> dotArgs = dot.args() != null ? dot.args() : List.of();
        List<RawNode> callArgs = call.args() != null ? call.args() : List.of();

        if (dotArgs.size() == 1) {
            // fun.(args): not a named call
            List<Expr> parts = new ArrayList<>();
            parts.add(read(dotArgs.get(0)));
            parts.addAll(readAll(callArgs));
            return new Expr.NestedBlock(parts);
        }
        if (dotArgs.size() != 2 || !(dotArgs.get(1) instanceof RawNode.Atom function)) {
            return new Expr.NestedBlock(readAll(callArgs));
        }

        RawNode target = dotArgs.get(0);
        ModuleIdentifier module = staticModule(target);
        if (module != null) {
            return new Expr.QualifiedCall(module, function.name(), readAll(callArgs), null, call.position());
        }
        if (call.noParens() && callArgs.isEmpty()) {
            // map.field
            return read(target);
        }
        return new Expr.QualifiedCall(ModuleIdentifier.UNKNOWN, function.name(), readAll(callArgs),
            read(target), call.position());
    }

    /**
     * Module named by a dot-call target, or null when it is only known at runtime.
     */
    private ModuleIdentifier staticModule(RawNode target) {
        if (target.isForm("__aliases__")) {
            List<String> parts = AliasTable.aliasParts(target, aliases.currentModule());
            if (parts.isEmpty()) {
                return null;
            }
            boolean expandedModule = ((RawNode.Form) target).args().get(0).isForm("__MODULE__");
            return expandedModule ? ModuleIdentifier.of(parts) : aliases.resolve(parts);
        }
        if (target.isForm("__MODULE__")) {
            return aliases.currentModule();
        }
        if (target instanceof RawNode.Atom atom) {
            String name = atom.name();
            return name.startsWith("Elixir.") ? ModuleIdentifier.of(name) : ModuleIdentifier.of(":" + name);
        }
        return null;
    }

    /**
     * Right-hand side of a pipe. A bare name is a call there, {@code x |> f} means {@code f(x)}.
     */
    private Expr readPipeTarget(RawNode node) {
        if (node instanceof RawNode.Form f && f.args() == null && f.formName() != null
                && !LEAF_FORMS.contains(f.formName())) {
            return new Expr.LocalCall(f.formName(), List.of(), f.position());
        }
        return read(node);
    }

    private Expr readWith(List<RawNode> args) {
        List<Expr> clauses = new ArrayList<>();
        Expr body = Expr.LEAF;
        Expr elseBody = null;
        for (RawNode arg : args) {
            if (arg.isForm("<-") && ((RawNode.Form) arg).args().size() == 2) {
                clauses.add(read(((RawNode.Form) arg).args().get(1)));
            } else if (isKeywordList(arg)) {
                for (RawNode entry : ((RawNode.ListNode) arg).elements()) {
                    RawNode.Pair pair = (RawNode.Pair) entry;
                    if (pair.left().isAtom("do")) {
                        body = read(pair.right());
                    } else if (pair.left().isAtom("else")) {
                        elseBody = read(pair.right());
                    }
                }
            } else {
                clauses.add(read(arg));
            }
        }
        return new Expr.WithChain(clauses, body, elseBody);
    }

    // &fun/2 and &Mod.fun/2 are references, &(&1 + 1) is an anonymous function
    private Expr readCapture(List<RawNode> args) {
        if (args.size() == 1 && args.get(0).isForm("/")) {
            return Expr.LEAF;
        }
        return new Expr.NestedBlock(readAll(args));
    }

    private List<Expr> readAll(List<RawNode> nodes) {
        List<Expr> result = new ArrayList<>(nodes.size());
        for (RawNode node : nodes) {
            result.add(read(node));
        }
        return result;
    }

    static boolean isKeywordList(RawNode node) {
        if (!(node instanceof RawNode.ListNode list) || list.elements().isEmpty()) {
            return false;
        }
        for (RawNode element : list.elements()) {
            if (!(element instanceof RawNode.Pair p) || !(p.left() instanceof RawNode.Atom)) {
                return false;
            }
        }
        return true;
    }
}
