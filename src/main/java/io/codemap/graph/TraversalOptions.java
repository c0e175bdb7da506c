package io.codemap.graph;

import io.codemap.model.ModuleIdentifier;

import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Controls for one call graph build.
 *
 * @param arityMatching  Policy for clauses without arity information
 * @param maxNodes       Node budget, 0 for unlimited
 * @param maxEdges       Edge budget, 0 for unlimited
 * @param excludeModules Modules that appear as nodes but are never expanded.
 *                       A pattern ending in {@code .} is a prefix match, anything else is exact.
 * @param cancelled      Polled once per expanded node; the build fails once it returns true
 */
public record TraversalOptions(
    ArityMatching arityMatching,
    int maxNodes,
    int maxEdges,
    List<String> excludeModules,
    BooleanSupplier cancelled
) {
    private static final BooleanSupplier NEVER = () -> false;

    public TraversalOptions {
        arityMatching = arityMatching != null ? arityMatching : ArityMatching.LENIENT;
        if (maxNodes < 0 || maxEdges < 0) {
            throw new IllegalArgumentException("Budgets must not be negative");
        }
        excludeModules = excludeModules != null ? List.copyOf(excludeModules) : List.of();
        cancelled = cancelled != null ? cancelled : NEVER;
    }

    public static TraversalOptions defaults() {
        return new TraversalOptions(ArityMatching.LENIENT, 0, 0, List.of(), NEVER);
    }

    public TraversalOptions withArityMatching(ArityMatching matching) {
        return new TraversalOptions(matching, maxNodes, maxEdges, excludeModules, cancelled);
    }

    public TraversalOptions withBudget(int nodes, int edges) {
        return new TraversalOptions(arityMatching, nodes, edges, excludeModules, cancelled);
    }

    public TraversalOptions withExcludeModules(List<String> patterns) {
        return new TraversalOptions(arityMatching, maxNodes, maxEdges, patterns, cancelled);
    }

    public TraversalOptions withCancellation(BooleanSupplier signal) {
        return new TraversalOptions(arityMatching, maxNodes, maxEdges, excludeModules, signal);
    }

    /**
     * Check if a module is excluded from expansion.
     */
    public boolean isExcluded(ModuleIdentifier module) {
        String name = module.toString();
        for (String pattern : excludeModules) {
            if (pattern.endsWith(".")) {
                String prefix = pattern.substring(0, pattern.length() - 1);
                if (name.equals(prefix) || name.startsWith(pattern)) {
                    return true;
                }
            } else if (name.equals(pattern)) {
                return true;
            }
        }
        return false;
    }

    boolean nodeBudgetReached(int nodes) {
        return maxNodes > 0 && nodes >= maxNodes;
    }

    boolean edgeBudgetReached(int edges) {
        return maxEdges > 0 && edges >= maxEdges;
    }
}
