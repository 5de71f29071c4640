package com.spreadsheet.engine.parser;

import java.util.Objects;

/**
 * One lexeme of a formula. For strings the lexeme is the unquoted content;
 * identifiers and cell references are upper-cased.
 */
public final class Token {
    private final TokenType type;
    private final String lexeme;
    private final int position;

    public Token(TokenType type, String lexeme, int position) {
        this.type = type;
        this.lexeme = lexeme;
        this.position = position;
    }

    public TokenType getType() {
        return type;
    }

    public String getLexeme() {
        return lexeme;
    }

    /**
     * Offset of the first character of this token in the formula body.
     */
    public int getPosition() {
        return position;
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    public boolean isOperator(String symbol) {
        return type == TokenType.OPERATOR && lexeme.equals(symbol);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token token = (Token) o;
        return position == token.position && type == token.type && lexeme.equals(token.lexeme);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, lexeme, position);
    }

    @Override
    public String toString() {
        return type + "('" + lexeme + "'@" + position + ")";
    }
}
