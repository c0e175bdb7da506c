package io.codemap.source;

import io.codemap.ast.RawNode;
import io.codemap.model.ModuleIdentifier;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds every {@code defmodule} in a source tree.
 * <p>
 * A module nested inside another is indexed under its full name
 * ({@code defmodule Inner} inside {@code Outer} becomes {@code Outer.Inner}) and its
 * header is rewritten to that name, so normalizing it yields the full identifier.
 */
public final class ModuleLocator {

    private ModuleLocator() {
    }

    public static Map<ModuleIdentifier, RawNode> index(RawNode tree) {
        Map<ModuleIdentifier, RawNode> modules = new LinkedHashMap<>();
        walk(tree, null, modules);
        return modules;
    }

    private static void walk(RawNode node, ModuleIdentifier enclosing, Map<ModuleIdentifier, RawNode> out) {
        if (node instanceof RawNode.Form f) {
            if (f.isForm("defmodule") && f.args() != null && f.args().size() == 2) {
                List<String> parts = aliasAtoms(f.args().get(0));
                if (!parts.isEmpty()) {
                    ModuleIdentifier name = enclosing != null ? enclosing.concat(parts) : ModuleIdentifier.of(parts);
                    out.put(name, enclosing != null ? rename(f, name) : f);
                    walk(f.args().get(1), name, out);
                    return;
                }
            }
            walk(f.head(), enclosing, out);
            if (f.args() != null) {
                for (RawNode arg : f.args()) {
                    walk(arg, enclosing, out);
                }
            }
        } else if (node instanceof RawNode.Pair p) {
            walk(p.left(), enclosing, out);
            walk(p.right(), enclosing, out);
        } else if (node instanceof RawNode.ListNode list) {
            for (RawNode element : list.elements()) {
                walk(element, enclosing, out);
            }
        }
    }

    private static RawNode.Form rename(RawNode.Form module, ModuleIdentifier name) {
        RawNode.Form header = (RawNode.Form) module.args().get(0);
        List<RawNode> segments = new ArrayList<>();
        for (String segment : name.segments()) {
            segments.add(RawNode.atom(segment));
        }
        RawNode.Form renamed = new RawNode.Form(header.head(), header.position(), false, segments);
        return new RawNode.Form(module.head(), module.position(), module.noParens(),
            List.of(renamed, module.args().get(1)));
    }

    private static List<String> aliasAtoms(RawNode node) {
        if (!node.isForm("__aliases__") || ((RawNode.Form) node).args() == null) {
            return List.of();
        }
        List<String> parts = new ArrayList<>();
        for (RawNode arg : ((RawNode.Form) node).args()) {
            if (!(arg instanceof RawNode.Atom a)) {
                return List.of();
            }
            parts.add(a.name());
        }
        return parts;
    }
}
