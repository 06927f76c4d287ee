package org.ccwonline.management.query;

import org.ccwonline.management.dynamic.parser.Lexer;
import org.ccwonline.management.dynamic.parser.Token;
import org.ccwonline.management.dynamic.parser.TokenId;

/**
 * Rewrites positional placeholders so that textual clauses can be joined.
 */
final class Placeholders {

    private Placeholders() {
    }

    /**
     * Shifts every {@code @n} or {@code {n}} placeholder outside string literals by the
     * given offset, writing it back as {@code @(n+offset)}.
     */
    static String renumber(String text, int offset) {
        if (offset == 0) {
            return text;
        }
        Lexer lexer = new Lexer(text);
        StringBuilder sb = new StringBuilder(text.length() + 8);
        int last = 0;
        while (lexer.tokenId() != TokenId.EOF) {
            Token token = lexer.token();
            String name = lexer.stringVal();
            if (token.id() == TokenId.IDENTIFIER && isPositional(name)) {
                int index = Integer.parseInt(name.substring(1));
                sb.append(text, last, token.pos()).append('@').append(index + offset);
                last = token.pos() + token.text().length();
            }
            lexer.nextToken();
        }
        return sb.append(text, last, text.length()).toString();
    }

    private static boolean isPositional(String name) {
        if (name == null || name.length() < 2 || name.charAt(0) != '@') {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            if (!Character.isDigit(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
