package org.ccwonline.management.dynamic.parser;

/**
 * A scanned token.
 *
 * @param id   The token kind
 * @param text The source text of the token
 * @param pos  The 0-based offset of the token in the expression text
 */
public record Token(TokenId id, String text, int pos) {

    @Override
    public String toString() {
        return id == TokenId.EOF ? "end of expression" : "'" + text + "'";
    }
}
