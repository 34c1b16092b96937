package com.tyron.ledgercst.api.text;

/**
 * Absolute location inside a text: character offset plus zero-based line and column.
 * <p>
 * Positions are also used as extents: {@link #ofText(String)} describes how far a
 * piece of text advances the cursor. Addition is therefore not commutative; adding an
 * extent that spans a line break resets the column instead of summing it.
 */
public record Position(int offset, int line, int column) {

    public static final Position ZERO = new Position(0, 0, 0);

    public Position {
        if (offset < 0 || line < 0 || column < 0) {
            throw new IllegalArgumentException("negative position: offset=" + offset + " line=" + line + " column=" + column);
        }
    }

    /**
     * Returns the position reached by advancing this position by {@code extent}.
     */
    public Position plus(Position extent) {
        if (extent.line > 0) {
            return new Position(offset + extent.offset, line + extent.line, extent.column);
        }
        return new Position(offset + extent.offset, line, column + extent.column);
    }

    /**
     * Extent of {@code text}: its length, the number of line breaks in it and the
     * length of its last line.
     */
    public static Position ofText(String text) {
        int lines = 0;
        int lastBreak = -1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                lines++;
                lastBreak = i;
            }
        }
        return new Position(text.length(), lines, text.length() - lastBreak - 1);
    }
}
