package io.codemap.ast;

/**
 * Raised when a raw tree is not a recognizable module declaration.
 */
public class NormalizationException extends Exception {

    public NormalizationException(String message) {
        super(message);
    }

    public NormalizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
