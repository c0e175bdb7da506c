package io.codemap.model;

/**
 * Source location taken from node metadata.
 *
 * @param line   1-based line, or 0 when unknown
 * @param column 1-based column, or 0 when unknown
 */
public record Position(int line, int column) {

    @Override
    public String toString() {
        return column > 0 ? line + ":" + column : String.valueOf(line);
    }
}
