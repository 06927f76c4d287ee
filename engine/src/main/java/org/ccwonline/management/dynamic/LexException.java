package org.ccwonline.management.dynamic;

/**
 * Thrown when the expression text contains an invalid character sequence
 * or an unterminated literal.
 */
public class LexException extends ParseException {

    public LexException(String message, int position) {
        super(message, position);
    }
}
