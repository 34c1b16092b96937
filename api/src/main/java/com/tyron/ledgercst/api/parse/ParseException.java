package com.tyron.ledgercst.api.parse;

/**
 * Thrown when source text does not match the grammar.
 */
public class ParseException extends RuntimeException {

    private final int line;
    private final int column;

    public ParseException(String message, int line, int column) {
        super(message + " (line " + (line + 1) + ", column " + (column + 1) + ")");
        this.line = line;
        this.column = column;
    }

    /**
     * Zero-based line of the offending input.
     */
    public int getLine() {
        return line;
    }

    /**
     * Zero-based column of the offending input.
     */
    public int getColumn() {
        return column;
    }
}
