package com.acme.finops.ottl.lang;

import com.acme.finops.ottl.ConfigException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LexerTest {

    @Test
    void shouldTokenizeComparisonWithPositions() throws Exception {
        List<Token> tokens = Lexer.tokenize("name != \"x\"");

        assertEquals(4, tokens.size());
        assertEquals(TokenType.IDENT, tokens.get(0).type());
        assertEquals(TokenType.COMPARISON, tokens.get(1).type());
        assertEquals("!=", tokens.get(1).text());
        assertEquals(5, tokens.get(1).position());
        assertEquals(TokenType.STRING, tokens.get(2).type());
        assertEquals("x", tokens.get(2).text());
        assertEquals(TokenType.EOF, tokens.get(3).type());
    }

    @Test
    void shouldDecodeStringEscapes() throws Exception {
        List<Token> tokens = Lexer.tokenize("\"a\\\"b\\\\c\\n\"");

        assertEquals("a\"b\\c\n", tokens.get(0).text());
    }

    @Test
    void shouldDistinguishIntFloatAndBytes() throws Exception {
        List<Token> tokens = Lexer.tokenize("42 1.5 .5 2e3 0xCAFE");

        assertEquals(TokenType.INT, tokens.get(0).type());
        assertEquals(TokenType.FLOAT, tokens.get(1).type());
        assertEquals(TokenType.FLOAT, tokens.get(2).type());
        assertEquals(TokenType.FLOAT, tokens.get(3).type());
        assertEquals(TokenType.BYTES, tokens.get(4).type());
        assertEquals("CAFE", tokens.get(4).text());
    }

    @Test
    void shouldNeverFoldSignIntoNumber() throws Exception {
        List<Token> tokens = Lexer.tokenize("-1");

        assertEquals(TokenType.MINUS, tokens.get(0).type());
        assertEquals(TokenType.INT, tokens.get(1).type());
    }

    @Test
    void shouldReportUnterminatedString() {
        ConfigException e = assertThrows(ConfigException.class, () -> Lexer.tokenize("set(x, \"abc)"));

        assertTrue(e.getMessage().contains("unterminated string literal"));
        assertEquals(7, e.position());
    }

    @Test
    void shouldRejectUnexpectedCharacter() {
        ConfigException e = assertThrows(ConfigException.class, () -> Lexer.tokenize("a # b"));

        assertTrue(e.getMessage().contains("unexpected character '#'"));
        assertEquals(2, e.position());
    }

    @Test
    void shouldRejectMalformedNumbers() {
        assertThrows(ConfigException.class, () -> Lexer.tokenize("12abc"));
        assertThrows(ConfigException.class, () -> Lexer.tokenize("1e"));
        assertThrows(ConfigException.class, () -> Lexer.tokenize("0x"));
    }
}
