package io.codemap.ast;

import io.codemap.model.ModuleIdentifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Short name to module mapping built from a module's top-level {@code alias} statements.
 * Lives only while that module is being normalized.
 */
public final class AliasTable {

    private final ModuleIdentifier currentModule;
    private final Map<String, ModuleIdentifier> aliases;

    private AliasTable(ModuleIdentifier currentModule, Map<String, ModuleIdentifier> aliases) {
        this.currentModule = currentModule;
        this.aliases = Collections.unmodifiableMap(aliases);
    }

    public static AliasTable empty(ModuleIdentifier currentModule) {
        return new AliasTable(currentModule, Map.of());
    }

    /**
     * Collect aliases from the given top-level statements.
     * Recognized shapes:
     * <ul>
     *   <li>{@code alias A.B.C} maps {@code C}</li>
     *   <li>{@code alias A.B.C, as: X} maps {@code X}</li>
     *   <li>{@code alias A.B.{C, D}} maps {@code C} and {@code D}</li>
     * </ul>
     * Later declarations of the same short name win.
     */
    public static AliasTable collect(ModuleIdentifier currentModule, List<RawNode> statements) {
        Map<String, ModuleIdentifier> aliases = new LinkedHashMap<>();
        for (RawNode statement : statements) {
            if (!statement.isForm("alias")) {
                continue;
            }
            List<RawNode> args = ((RawNode.Form) statement).args();
            if (args == null || args.isEmpty()) {
                continue;
            }
            RawNode target = unwrapBlock(args.get(0));

            if (target.isForm("__aliases__")) {
                List<String> parts = aliasParts(target, currentModule);
                if (parts.isEmpty()) {
                    continue;
                }
                ModuleIdentifier module = ModuleIdentifier.of(parts);
                String shortName = args.size() > 1 ? asOption(args.get(1)) : null;
                aliases.put(shortName != null ? shortName : module.lastSegment(), module);
            } else if (isMultiAlias(target)) {
                RawNode.Form multi = (RawNode.Form) target;
                RawNode prefixNode = ((RawNode.Form) multi.head()).args().get(0);
                List<String> prefix = aliasParts(prefixNode, currentModule);
                for (RawNode part : multi.args()) {
                    List<String> suffix = aliasParts(part, currentModule);
                    if (prefix.isEmpty() || suffix.isEmpty()) {
                        continue;
                    }
                    ModuleIdentifier module = ModuleIdentifier.of(prefix).concat(suffix);
                    aliases.put(module.lastSegment(), module);
                }
            }
        }
        return new AliasTable(currentModule, aliases);
    }

    /**
     * Resolve the segments of a {@code __aliases__} node.
     * A single segment goes through the table; longer names pass through unchanged.
     */
    public ModuleIdentifier resolve(List<String> parts) {
        if (parts.size() == 1) {
            ModuleIdentifier aliased = aliases.get(parts.get(0));
            if (aliased != null) {
                return aliased;
            }
        }
        return ModuleIdentifier.of(parts);
    }

    public ModuleIdentifier currentModule() {
        return currentModule;
    }

    public Map<String, ModuleIdentifier> entries() {
        return aliases;
    }

    public int size() {
        return aliases.size();
    }

    /**
     * Segments of a {@code __aliases__} node, with a leading {@code __MODULE__} expanded.
     * Returns an empty list when the node is not an alias.
     */
    static List<String> aliasParts(RawNode node, ModuleIdentifier currentModule) {
        if (!node.isForm("__aliases__")) {
            return List.of();
        }
        List<RawNode> args = ((RawNode.Form) node).args();
        if (args == null) {
            return List.of();
        }
        List<String> parts = new ArrayList<>();
        for (RawNode arg : args) {
            if (arg instanceof RawNode.Atom a) {
                parts.add(a.name());
            } else if (arg.isForm("__MODULE__") && currentModule != null && parts.isEmpty()) {
                parts.addAll(currentModule.segments());
            } else {
                return List.of();
            }
        }
        return parts;
    }

    // alias Prefix.{A, B} quotes as {{:., _, [Prefix, :{}]}, _, [A, B]}
    private static boolean isMultiAlias(RawNode node) {
        if (node instanceof RawNode.Form f && f.args() != null && f.head().isForm(".")) {
            List<RawNode> dotArgs = ((RawNode.Form) f.head()).args();
            return dotArgs != null && dotArgs.size() == 2
                && dotArgs.get(0).isForm("__aliases__")
                && dotArgs.get(1).isAtom("{}");
        }
        return false;
    }

    private static RawNode unwrapBlock(RawNode node) {
        if (node.isForm("__block__")) {
            List<RawNode> inner = ((RawNode.Form) node).args();
            if (inner != null && inner.size() == 1) {
                return inner.get(0);
            }
        }
        return node;
    }

    private static String asOption(RawNode options) {
        if (!(options instanceof RawNode.ListNode list)) {
            return null;
        }
        for (RawNode option : list.elements()) {
            if (option instanceof RawNode.Pair p && p.left().isAtom("as")) {
                List<String> parts = aliasParts(p.right(), null);
                if (parts.size() == 1) {
                    return parts.get(0);
                }
            }
        }
        return null;
    }
}
