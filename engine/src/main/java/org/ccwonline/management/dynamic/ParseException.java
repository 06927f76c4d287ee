package org.ccwonline.management.dynamic;

/**
 * Exception thrown when a dynamic expression cannot be parsed or compiled.
 *
 * The position is the 0-based character offset into the expression text,
 * suitable for caret-style diagnostics.
 */
public class ParseException extends RuntimeException {

    private final int position;

    public ParseException(String message, int position) {
        super(message + " (at index " + position + ")");
        this.position = position;
    }

    public int getPosition() {
        return position;
    }

    /**
     * Renders the expression text with a caret under the failing position.
     */
    public String caret(String text) {
        int column = Math.max(0, Math.min(position, text.length()));
        return text + System.lineSeparator() + " ".repeat(column) + "^";
    }
}
