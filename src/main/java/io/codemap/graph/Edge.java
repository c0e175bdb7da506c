package io.codemap.graph;

import io.codemap.model.FunctionRef;

/**
 * Directed call edge.
 *
 * @param from Calling function
 * @param to   Called function
 */
public record Edge(FunctionRef from, FunctionRef to) {

    public boolean isSelfLoop() {
        return from.equals(to);
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}
