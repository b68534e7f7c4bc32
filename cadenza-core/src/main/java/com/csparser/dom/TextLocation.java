package com.csparser.dom;

/**
 * A line/column position in the source text. Lines and columns start at 1;
 * {@link #EMPTY} marks a node that has no position.
 */
public record TextLocation(int line, int column) implements Comparable<TextLocation> {

    public static final TextLocation EMPTY = new TextLocation(0, 0);

    public boolean isEmpty() {
        return line <= 0;
    }

    /**
     * Returns the location {@code length} columns further on the same line.
     * Empty locations stay empty.
     */
    public TextLocation advance(int length) {
        if (isEmpty()) {
            return EMPTY;
        }
        return new TextLocation(line, column + length);
    }

    @Override
    public int compareTo(TextLocation other) {
        int result = Integer.compare(line, other.line);
        if (result != 0) {
            return result;
        }
        return Integer.compare(column, other.column);
    }

    @Override
    public String toString() {
        return "(" + line + ", " + column + ")";
    }
}
