package org.ccwonline.management.dynamic.parser;

/**
 * Token kinds of the expression language, with pre-computed hashes for keyword lookup.
 */
public enum TokenId {
    // Literals
    EOF,
    IDENTIFIER,
    STRING_LITERAL,     // "text" or 'text'
    CHAR_LITERAL,       // 'c'
    INTEGER_LITERAL,    // 123, 0x1F, 10L
    REAL_LITERAL,       // 1.5, 2e3, 1.5M

    // Keywords (case-insensitive)
    IT, IIF, NEW, TRUE, FALSE, NULL,
    AND, OR, NOT, MOD, AS,
    ASC, ASCENDING, DESC, DESCENDING,

    // Operators
    EXCLAMATION,        // !
    PERCENT,            // %
    AMPERSAND,          // &
    DOUBLE_AMPERSAND,   // &&
    DOUBLE_BAR,         // ||
    ASTERISK,           // *
    PLUS,               // +
    MINUS,              // -
    SLASH,              // /
    EQUAL,              // =
    DOUBLE_EQUAL,       // ==
    NOT_EQUAL,          // != or <>
    LESS_THAN,          // <
    LESS_EQUAL,         // <=
    GREATER_THAN,       // >
    GREATER_EQUAL,      // >=
    QUESTION,           // ?
    COLON,              // :
    DOT,                // .
    COMMA,              // ,

    // Brackets
    OPEN_PAREN,         // (
    CLOSE_PAREN,        // )
    OPEN_BRACKET,       // [
    CLOSE_BRACKET,      // ]
    OPEN_BRACE,         // {
    CLOSE_BRACE,        // }
    ;

    public static final long FNV_PRIME = 0x100000001b3L;
    public static final long FNV_OFFSET = 0xcbf29ce484222325L;

    private static final TokenId[] KEYWORDS = {
        IT, IIF, NEW, TRUE, FALSE, NULL, AND, OR, NOT, MOD, AS, ASC, ASCENDING, DESC, DESCENDING
    };

    private final long hash;

    TokenId() {
        this.hash = fnv1a64(this.name());
    }

    /**
     * FNV-1a 64-bit hash (case-insensitive via lowercase).
     */
    public static long fnv1a64(String s) {
        long h = FNV_OFFSET;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c >= 'A' && c <= 'Z') {
                c = (char) (c + 32);
            }
            h ^= c;
            h *= FNV_PRIME;
        }
        return h;
    }

    /**
     * Lookup keyword by hash. Returns null if not a keyword.
     */
    public static TokenId keyword(long hash) {
        for (TokenId t : KEYWORDS) {
            if (t.hash == hash) return t;
        }
        return null;
    }

    public boolean isKeyword() {
        return ordinal() >= IT.ordinal() && ordinal() <= DESCENDING.ordinal();
    }
}
