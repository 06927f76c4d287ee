package org.ccwonline.management.dynamic.parser;

import org.ccwonline.management.dynamic.LexException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Lexer Tests")
class LexerTest {

    private static List<TokenId> ids(String text) {
        Lexer lexer = new Lexer(text);
        List<TokenId> ids = new ArrayList<>();
        while (lexer.tokenId() != TokenId.EOF) {
            ids.add(lexer.tokenId());
            lexer.nextToken();
        }
        return ids;
    }

    @Nested
    @DisplayName("Identifiers and keywords")
    class Identifiers {

        @Test
        @DisplayName("Keywords are case-insensitive")
        void testKeywords() {
            assertEquals(List.of(TokenId.NOT, TokenId.IT, TokenId.AND, TokenId.NULL, TokenId.OR, TokenId.TRUE),
                    ids("Not IT and NULL or True"));
        }

        @Test
        @DisplayName("Property names are identifiers")
        void testIdentifier() {
            Lexer lexer = new Lexer("ConferenceId");
            assertEquals(TokenId.IDENTIFIER, lexer.tokenId());
            assertEquals("ConferenceId", lexer.stringVal());
            assertEquals(0, lexer.tokenPos());
        }

        @Test
        @DisplayName("@-prefixed names are never keywords")
        void testAtIdentifier() {
            Lexer lexer = new Lexer("@and");
            assertEquals(TokenId.IDENTIFIER, lexer.tokenId());
            assertEquals("@and", lexer.stringVal());
        }

        @Test
        @DisplayName("{n} is read as the placeholder @n")
        void testBracePlaceholder() {
            Lexer lexer = new Lexer("Status = {12}");
            lexer.nextToken();
            lexer.nextToken();
            assertEquals(TokenId.IDENTIFIER, lexer.tokenId());
            assertEquals("@12", lexer.stringVal());
            assertEquals("{12}", lexer.token().text());
            assertEquals(9, lexer.tokenPos());
        }
    }

    @Nested
    @DisplayName("Literals")
    class Literals {

        @Test
        @DisplayName("Doubled quotes escape the quote character")
        void testStringEscape() {
            Lexer lexer = new Lexer("\"say \"\"hi\"\"\"");
            assertEquals(TokenId.STRING_LITERAL, lexer.tokenId());
            assertEquals("say \"hi\"", lexer.stringVal());
        }

        @Test
        @DisplayName("Single-quoted literal of one character is a char")
        void testCharLiteral() {
            Lexer lexer = new Lexer("'x'");
            assertEquals(TokenId.CHAR_LITERAL, lexer.tokenId());
            assertEquals("x", lexer.stringVal());
        }

        @Test
        @DisplayName("Single-quoted literal of several characters is rejected")
        void testBadCharLiteral() {
            LexException e = assertThrows(LexException.class, () -> ids("Name == 'abc'"));
            assertEquals(8, e.getPosition());
            assertTrue(e.getMessage().endsWith("(at index 8)"), e.getMessage());
        }

        @Test
        @DisplayName("Unterminated string reports the end of the text")
        void testUnterminatedString() {
            String text = "Name == \"abc";
            Lexer lexer = new Lexer(text);
            lexer.nextToken();
            LexException e = assertThrows(LexException.class, lexer::nextToken);
            assertEquals(text.length(), e.getPosition());
        }

        @ParameterizedTest
        @ValueSource(strings = {"42", "0x2A", "42L", "42UL"})
        @DisplayName("Integer literal forms")
        void testIntegers(String text) {
            Lexer lexer = new Lexer(text);
            assertEquals(TokenId.INTEGER_LITERAL, lexer.tokenId());
            assertEquals(text, lexer.token().text());
        }

        @ParameterizedTest
        @ValueSource(strings = {"1.5", "1e10", "2.5E-3", "3F", "4.25M", "7D"})
        @DisplayName("Real literal forms")
        void testReals(String text) {
            Lexer lexer = new Lexer(text);
            assertEquals(TokenId.REAL_LITERAL, lexer.tokenId());
            assertEquals(text, lexer.token().text());
        }

        @Test
        @DisplayName("Member access on an integer is not a real literal")
        void testDotAfterInteger() {
            assertEquals(List.of(TokenId.INTEGER_LITERAL, TokenId.DOT, TokenId.IDENTIFIER), ids("1.ToString"));
        }
    }

    @Nested
    @DisplayName("Operators")
    class Operators {

        @Test
        @DisplayName("Two-character operators")
        void testCompoundOperators() {
            assertEquals(List.of(TokenId.DOUBLE_EQUAL, TokenId.NOT_EQUAL, TokenId.NOT_EQUAL, TokenId.LESS_EQUAL,
                            TokenId.GREATER_EQUAL, TokenId.DOUBLE_AMPERSAND, TokenId.DOUBLE_BAR),
                    ids("== != <> <= >= && ||"));
        }

        @Test
        @DisplayName("Single-character operators")
        void testSimpleOperators() {
            assertEquals(List.of(TokenId.EXCLAMATION, TokenId.PERCENT, TokenId.AMPERSAND, TokenId.ASTERISK,
                            TokenId.PLUS, TokenId.MINUS, TokenId.SLASH, TokenId.EQUAL, TokenId.LESS_THAN,
                            TokenId.GREATER_THAN, TokenId.QUESTION, TokenId.COLON, TokenId.DOT, TokenId.COMMA),
                    ids("! % & * + - / = < > ? : . ,"));
        }

        @Test
        @DisplayName("Brackets")
        void testBrackets() {
            assertEquals(List.of(TokenId.OPEN_PAREN, TokenId.CLOSE_PAREN, TokenId.OPEN_BRACKET,
                            TokenId.CLOSE_BRACKET, TokenId.OPEN_BRACE, TokenId.CLOSE_BRACE),
                    ids("( ) [ ] { }"));
        }

        @Test
        @DisplayName("A single bar is rejected at its position")
        void testSingleBar() {
            Lexer lexer = new Lexer("a | b");
            LexException e = assertThrows(LexException.class, lexer::nextToken);
            assertEquals(2, e.getPosition());
        }

        @Test
        @DisplayName("Unknown characters are rejected")
        void testUnknownCharacter() {
            assertThrows(LexException.class, () -> new Lexer("#"));
        }
    }

    @Nested
    @DisplayName("SavePoint Tests")
    class SavePoints {

        @Test
        @DisplayName("Reset restores the marked token")
        void testMarkReset() {
            Lexer lexer = new Lexer("a + b");
            Lexer.SavePoint mark = lexer.mark();
            lexer.nextToken();
            lexer.nextToken();
            assertEquals("b", lexer.stringVal());

            lexer.reset(mark);
            assertEquals(TokenId.IDENTIFIER, lexer.tokenId());
            assertEquals("a", lexer.stringVal());
            lexer.nextToken();
            assertEquals(TokenId.PLUS, lexer.tokenId());
        }

        @Test
        @DisplayName("End of input is positioned at the text length")
        void testEofPosition() {
            Lexer lexer = new Lexer("ab  ");
            lexer.nextToken();
            assertEquals(TokenId.EOF, lexer.tokenId());
            assertEquals(4, lexer.tokenPos());
        }
    }
}
