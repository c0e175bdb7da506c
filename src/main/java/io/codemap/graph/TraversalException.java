package io.codemap.graph;

/**
 * A call graph could not be built: the start reference was malformed or the build was cancelled.
 */
public class TraversalException extends Exception {

    public TraversalException(String message) {
        super(message);
    }

    public TraversalException(String message, Throwable cause) {
        super(message, cause);
    }
}
