package org.vain.lexer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<LexerToken> tokenize(String input) {
        return new Lexer("test.vain", input).tokenize();
    }

    private static List<LexerTokenType> types(String input) {
        List<LexerTokenType> types = new ArrayList<>();
        for (LexerToken token : tokenize(input)) {
            types.add(token.type);
        }
        return types;
    }

    @Test
    public void testDeclaration() {
        List<LexerToken> tokens = tokenize("const x = 42\n");
        assertEquals(List.of(LexerTokenType.CONST, LexerTokenType.IDENTIFIER, LexerTokenType.EQUAL,
                LexerTokenType.INT, LexerTokenType.NEWLINE, LexerTokenType.EOF), types("const x = 42\n"));
        assertEquals("x", tokens.get(1).text);
        assertEquals("42", tokens.get(3).text);
    }

    @Test
    public void testPositions() {
        List<LexerToken> tokens = tokenize("let a = 1\n  b");
        LexerToken b = tokens.get(5);
        assertEquals("b", b.text);
        assertEquals(2, b.position.line);
        assertEquals(2, b.position.col);
        assertEquals("2:3", b.position.toString());
    }

    @Test
    public void testCommentKeepsHash() {
        List<LexerToken> tokens = tokenize("x # note\n");
        assertEquals(LexerTokenType.COMMENT, tokens.get(1).type);
        assertEquals("# note", tokens.get(1).text);
    }

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "==     ; EQ_EQ",
            "==?    ; EQ_EQ_CI",
            "!=?    ; NEQ_CI",
            ">=     ; GT_EQ",
            "<?     ; LT_CI",
            "=~     ; MATCH",
            "!~?    ; NO_MATCH_CI",
            "is     ; IS",
            "is?    ; IS_CI",
            "isnot  ; IS_NOT",
            "isnot? ; IS_NOT_CI",
            "||     ; OR_OR",
            "&&     ; AND_AND",
            "->     ; ARROW",
            "...    ; DOT_DOT_DOT",
            "|      ; PIPE",
    })
    public void testOperators(String text, LexerTokenType expected) {
        List<LexerToken> tokens = tokenize(text);
        assertEquals(expected, tokens.get(0).type);
        assertEquals(text, tokens.get(0).text);
        assertEquals(LexerTokenType.EOF, tokens.get(1).type);
    }

    @Test
    public void testNumbers() {
        assertEquals(LexerTokenType.INT, tokenize("0x1F").get(0).type);
        assertEquals(LexerTokenType.FLOAT, tokenize("1.5e-3").get(0).type);
        assertEquals("1.5e-3", tokenize("1.5e-3").get(0).text);
        // "1." is an int followed by a dot
        assertEquals(List.of(LexerTokenType.INT, LexerTokenType.DOT, LexerTokenType.IDENTIFIER, LexerTokenType.EOF),
                types("1.x"));
    }

    @Test
    public void testInvalidNumber() {
        List<LexerToken> tokens = tokenize("12ab");
        assertEquals(1, tokens.size());
        assertEquals(LexerTokenType.ERROR, tokens.get(0).type);
        assertEquals("[lex] test.vain:1:1: invalid number literal", tokens.get(0).text);
    }

    @Test
    public void testStrings() {
        List<LexerToken> tokens = tokenize("'it''s' \"a\\\"b\"");
        assertEquals(LexerTokenType.STRING, tokens.get(0).type);
        assertEquals("'it''s'", tokens.get(0).text);
        assertEquals("\"a\\\"b\"", tokens.get(1).text);
    }

    @Test
    public void testUnterminatedStringStopsTheStream() {
        List<LexerToken> tokens = tokenize("let s = 'abc\nlet t = 1");
        LexerToken last = tokens.get(tokens.size() - 1);
        assertEquals(LexerTokenType.ERROR, last.type);
        assertEquals("[lex] test.vain:1:9: unterminated string literal", last.text);
    }

    @Test
    public void testUnknownCharacter() {
        LexerToken last = tokenize("x = ^").get(2);
        assertEquals(LexerTokenType.ERROR, last.type);
        assertEquals("[lex] test.vain:1:5: unknown token \"^\"", last.text);
    }

    @Test
    public void testNextTokenReturnsNullAfterEof() {
        Lexer lexer = new Lexer("test.vain", "x");
        assertEquals(LexerTokenType.IDENTIFIER, lexer.nextToken().type);
        assertEquals(LexerTokenType.EOF, lexer.nextToken().type);
        assertNull(lexer.nextToken());
    }

    @Test
    public void testAutoloadIdentifier() {
        List<LexerToken> tokens = tokenize("foo#bar#baz()");
        assertEquals(LexerTokenType.IDENTIFIER, tokens.get(0).type);
        assertEquals("foo#bar#baz", tokens.get(0).text);
    }

    @Test
    public void testUnicodeIdentifier() {
        List<LexerToken> tokens = tokenize("const ñandú = 1");
        assertEquals(LexerTokenType.IDENTIFIER, tokens.get(1).type);
        assertEquals("ñandú", tokens.get(1).text);
    }

    @Test
    public void testSigils() {
        List<LexerToken> tokens = tokenize("&g:tabstop $HOME @a @");
        assertEquals(LexerTokenType.OPTION, tokens.get(0).type);
        assertEquals("&g:tabstop", tokens.get(0).text);
        assertEquals(LexerTokenType.ENV, tokens.get(1).type);
        assertEquals("$HOME", tokens.get(1).text);
        assertEquals(LexerTokenType.REGISTER, tokens.get(2).type);
        assertEquals("@a", tokens.get(2).text);
        assertEquals("@", tokens.get(3).text);
    }

    @Test
    public void testKeywordsAndLiterals() {
        assertEquals(List.of(LexerTokenType.FOR, LexerTokenType.IDENTIFIER, LexerTokenType.IN,
                        LexerTokenType.BOOL, LexerTokenType.NONE, LexerTokenType.EOF),
                types("for x in true null"));
    }
}
