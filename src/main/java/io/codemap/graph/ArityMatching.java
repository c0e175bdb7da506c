package io.codemap.graph;

/**
 * What to do with a function clause that carries no arity information at all.
 */
public enum ArityMatching {
    /**
     * Treat the clause as matching, so incomplete metadata never drops edges.
     */
    LENIENT,

    /**
     * Treat the clause as not matching.
     */
    STRICT
}
