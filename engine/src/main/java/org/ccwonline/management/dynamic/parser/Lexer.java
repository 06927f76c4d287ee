package org.ccwonline.management.dynamic.parser;

import org.ccwonline.management.dynamic.LexException;

/**
 * Expression tokenizer with SavePoint backtracking.
 *
 * Tokens are produced on demand by {@link #nextToken()}; the lexer is primed with the
 * first token on construction.
 */
public final class Lexer {

    private final String text;
    private int pos;
    private char ch;

    // Current token state
    private Token token;
    private String stringVal;

    public Lexer(String text) {
        this.text = text;
        this.pos = 0;
        this.ch = pos < text.length() ? text.charAt(pos) : '\0';
        nextToken();
    }

    // ==================== SavePoint for Backtracking ====================

    public record SavePoint(int pos, Token token, String stringVal) {}

    public SavePoint mark() {
        return new SavePoint(pos, token, stringVal);
    }

    public void reset(SavePoint sp) {
        this.pos = sp.pos;
        this.token = sp.token;
        this.stringVal = sp.stringVal;
        this.ch = pos < text.length() ? text.charAt(pos) : '\0';
    }

    // ==================== Token Access ====================

    public Token token() {
        return token;
    }

    public TokenId tokenId() {
        return token.id();
    }

    /**
     * @return The identifier name or the unescaped string literal value of the current token
     */
    public String stringVal() {
        return stringVal;
    }

    public int tokenPos() {
        return token.pos();
    }

    public String text() {
        return text;
    }

    // ==================== Scanning ====================

    public void nextToken() {
        while (Character.isWhitespace(ch)) advance();

        int start = pos;
        stringVal = null;

        if (pos >= text.length()) {
            token = new Token(TokenId.EOF, "", text.length());
            return;
        }

        TokenId id;
        if (isIdentifierStart(ch)) {
            id = scanIdentifier(start);
        } else if (ch == '"' || ch == '\'') {
            id = scanString(start);
        } else if (isDigit(ch)) {
            id = scanNumber();
        } else if (ch == '{' && isPlaceholder()) {
            id = scanPlaceholder(start);
        } else {
            id = scanOperator(start);
        }
        token = new Token(id, text.substring(start, pos), start);
    }

    private TokenId scanIdentifier(int start) {
        long h = TokenId.FNV_OFFSET;
        do {
            char c = ch;
            if (c >= 'A' && c <= 'Z') {
                c = (char) (c + 32);
            }
            h ^= c;
            h *= TokenId.FNV_PRIME;
            advance();
        } while (isIdentifierPart(ch));

        stringVal = text.substring(start, pos);
        TokenId kw = text.charAt(start) == '@' ? null : TokenId.keyword(h);
        return kw != null ? kw : TokenId.IDENTIFIER;
    }

    // {0} is an alternative spelling of @0
    private boolean isPlaceholder() {
        int i = pos + 1;
        while (i < text.length() && isDigit(text.charAt(i))) i++;
        return i > pos + 1 && i < text.length() && text.charAt(i) == '}';
    }

    private TokenId scanPlaceholder(int start) {
        advance(); // {
        while (isDigit(ch)) advance();
        stringVal = "@" + text.substring(start + 1, pos);
        advance(); // }
        return TokenId.IDENTIFIER;
    }

    private TokenId scanString(int start) {
        char quote = ch;
        advance();
        StringBuilder sb = new StringBuilder();
        while (true) {
            if (pos >= text.length()) {
                throw new LexException("Unterminated string literal", text.length());
            }
            if (ch == quote) {
                if (peek() == quote) {
                    sb.append(quote);
                    advance();
                    advance();
                    continue;
                }
                advance();
                break;
            }
            sb.append(ch);
            advance();
        }
        stringVal = sb.toString();
        if (quote == '\'') {
            if (stringVal.length() != 1) {
                throw new LexException("Character literal must contain exactly one character", start);
            }
            return TokenId.CHAR_LITERAL;
        }
        return TokenId.STRING_LITERAL;
    }

    private TokenId scanNumber() {
        if (ch == '0' && (peek() == 'x' || peek() == 'X')) {
            advance();
            advance();
            if (!isHexDigit(ch)) {
                throw new LexException("Invalid hexadecimal literal", pos);
            }
            while (isHexDigit(ch)) advance();
            scanIntegerSuffix();
            return TokenId.INTEGER_LITERAL;
        }

        boolean real = false;
        while (isDigit(ch)) advance();

        if (ch == '.' && isDigit(peek())) {
            real = true;
            advance();
            while (isDigit(ch)) advance();
        }
        if (ch == 'e' || ch == 'E') {
            real = true;
            advance();
            if (ch == '+' || ch == '-') advance();
            if (!isDigit(ch)) {
                throw new LexException("Digit expected in exponent", pos);
            }
            while (isDigit(ch)) advance();
        }
        if (isRealSuffix(ch)) {
            advance();
            return TokenId.REAL_LITERAL;
        }
        if (!real) {
            scanIntegerSuffix();
            return TokenId.INTEGER_LITERAL;
        }
        return TokenId.REAL_LITERAL;
    }

    // L, U, UL, LU
    private void scanIntegerSuffix() {
        char upper = Character.toUpperCase(ch);
        if (upper == 'L' || upper == 'U') {
            advance();
            char next = Character.toUpperCase(ch);
            if ((next == 'L' || next == 'U') && next != upper) {
                advance();
            }
        }
    }

    private TokenId scanOperator(int start) {
        char c = ch;
        advance();
        switch (c) {
            case '!' -> {
                if (ch == '=') { advance(); return TokenId.NOT_EQUAL; }
                return TokenId.EXCLAMATION;
            }
            case '%' -> { return TokenId.PERCENT; }
            case '&' -> {
                if (ch == '&') { advance(); return TokenId.DOUBLE_AMPERSAND; }
                return TokenId.AMPERSAND;
            }
            case '|' -> {
                if (ch == '|') { advance(); return TokenId.DOUBLE_BAR; }
                throw new LexException("Expected | after |", start);
            }
            case '(' -> { return TokenId.OPEN_PAREN; }
            case ')' -> { return TokenId.CLOSE_PAREN; }
            case '*' -> { return TokenId.ASTERISK; }
            case '+' -> { return TokenId.PLUS; }
            case ',' -> { return TokenId.COMMA; }
            case '-' -> { return TokenId.MINUS; }
            case '.' -> { return TokenId.DOT; }
            case '/' -> { return TokenId.SLASH; }
            case ':' -> { return TokenId.COLON; }
            case '<' -> {
                if (ch == '=') { advance(); return TokenId.LESS_EQUAL; }
                if (ch == '>') { advance(); return TokenId.NOT_EQUAL; }
                return TokenId.LESS_THAN;
            }
            case '=' -> {
                if (ch == '=') { advance(); return TokenId.DOUBLE_EQUAL; }
                return TokenId.EQUAL;
            }
            case '>' -> {
                if (ch == '=') { advance(); return TokenId.GREATER_EQUAL; }
                return TokenId.GREATER_THAN;
            }
            case '?' -> { return TokenId.QUESTION; }
            case '[' -> { return TokenId.OPEN_BRACKET; }
            case ']' -> { return TokenId.CLOSE_BRACKET; }
            case '{' -> { return TokenId.OPEN_BRACE; }
            case '}' -> { return TokenId.CLOSE_BRACE; }
            default -> throw new LexException("Syntax error '" + c + "'", start);
        }
    }

    // ==================== Helpers ====================

    private void advance() {
        pos++;
        ch = pos < text.length() ? text.charAt(pos) : '\0';
    }

    private char peek() {
        return pos + 1 < text.length() ? text.charAt(pos + 1) : '\0';
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '@' || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isRealSuffix(char c) {
        char upper = Character.toUpperCase(c);
        return upper == 'F' || upper == 'D' || upper == 'M';
    }
}
