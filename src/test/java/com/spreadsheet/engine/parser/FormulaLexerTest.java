package com.spreadsheet.engine.parser;

import com.spreadsheet.engine.exceptions.FormulaSyntaxException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class FormulaLexerTest {

    private static List<TokenType> types(String source) {
        return FormulaLexer.tokenize(source).stream().map(Token::getType).collect(Collectors.toList());
    }

    @Test
    void testArithmeticTokens() {
        List<Token> tokens = FormulaLexer.tokenize("A1 + 2.5*b3");
        assertEquals(List.of(TokenType.CELL_REFERENCE, TokenType.OPERATOR, TokenType.NUMBER,
                TokenType.OPERATOR, TokenType.CELL_REFERENCE, TokenType.EOF), types("A1 + 2.5*b3"));
        assertEquals("A1", tokens.get(0).getLexeme());
        assertEquals("2.5", tokens.get(2).getLexeme());
        // references are upper-cased
        assertEquals("B3", tokens.get(4).getLexeme());
        assertEquals(3, tokens.get(1).getPosition());
    }

    @Test
    void testFunctionCallWithRange() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.LEFT_PAREN, TokenType.CELL_REFERENCE,
                TokenType.COLON, TokenType.CELL_REFERENCE, TokenType.COMMA, TokenType.NUMBER,
                TokenType.RIGHT_PAREN, TokenType.EOF), types("sum(A1:A3, 4)"));
        assertEquals("SUM", FormulaLexer.tokenize("sum(A1)").get(0).getLexeme());
    }

    @Test
    void testNameThatLooksLikeReferenceIsFunctionBeforeParen() {
        List<Token> tokens = FormulaLexer.tokenize("LOG10(5)");
        assertEquals(TokenType.IDENTIFIER, tokens.get(0).getType());
        assertEquals("LOG10", tokens.get(0).getLexeme());

        assertEquals(TokenType.CELL_REFERENCE, FormulaLexer.tokenize("LOG10").get(0).getType());
    }

    @Test
    void testNumbersWithExponent() {
        List<Token> tokens = FormulaLexer.tokenize("1.5e3 .25 7E-2");
        assertEquals("1.5e3", tokens.get(0).getLexeme());
        assertEquals(".25", tokens.get(1).getLexeme());
        assertEquals("7E-2", tokens.get(2).getLexeme());
    }

    @Test
    void testStringsWithEitherQuoteAndEscapes() {
        List<Token> tokens = FormulaLexer.tokenize("\"say \"\"hi\"\"\" 'it''s'");
        assertEquals(TokenType.STRING, tokens.get(0).getType());
        assertEquals("say \"hi\"", tokens.get(0).getLexeme());
        assertEquals("it's", tokens.get(1).getLexeme());
    }

    @Test
    void testAbsoluteReferences() {
        Token token = FormulaLexer.tokenize("$a$1").get(0);
        assertEquals(TokenType.CELL_REFERENCE, token.getType());
        assertEquals("$A$1", token.getLexeme());
    }

    @Test
    void testUnterminatedStringFails() {
        FormulaSyntaxException e = assertThrows(FormulaSyntaxException.class,
                () -> FormulaLexer.tokenize("\"abc"));
        assertTrue(e.getMessage().contains("Unterminated"));
    }

    @Test
    void testUnexpectedCharacterFails() {
        assertThrows(FormulaSyntaxException.class, () -> FormulaLexer.tokenize("1 & 2"));
        assertThrows(FormulaSyntaxException.class, () -> FormulaLexer.tokenize("A$$1"));
    }

    @Test
    void testEmptyInputIsJustEof() {
        assertEquals(List.of(TokenType.EOF), types("   "));
        assertEquals(List.of(TokenType.EOF), types(null));
    }
}
