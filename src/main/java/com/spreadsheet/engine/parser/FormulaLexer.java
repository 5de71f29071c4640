package com.spreadsheet.engine.parser;

import com.spreadsheet.engine.exceptions.FormulaSyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Splits a formula body (the text after the leading '=') into tokens.
 * <p>
 * Recognizes decimal numbers (with an optional exponent), single- or double-quoted
 * strings (a doubled quote escapes itself), identifiers, cell references such as
 * A1 or $B$2, and the symbols {@code + - * / ^ % ( ) : ,}.
 * Throws {@link FormulaSyntaxException} on anything else; the parser turns that
 * into an ErrorNode.
 */
public final class FormulaLexer {

    private static final Pattern CELL_REFERENCE = Pattern.compile("\\$?[A-Za-z]+\\$?[0-9]+");
    private static final String OPERATORS = "+-*/^%";

    private final String source;
    private int position;

    private FormulaLexer(String source) {
        this.source = source;
    }

    public static List<Token> tokenize(String source) {
        return new FormulaLexer(source == null ? "" : source).run();
    }

    private List<Token> run() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (position >= source.length()) {
                tokens.add(new Token(TokenType.EOF, "", position));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        char ch = source.charAt(position);
        int start = position;

        if (isDigit(ch) || (ch == '.' && position + 1 < source.length()
                && isDigit(source.charAt(position + 1)))) {
            return number();
        }
        if (ch == '"' || ch == '\'') {
            return string(ch);
        }
        if (Character.isLetter(ch) || ch == '_' || ch == '$') {
            return word();
        }
        if (OPERATORS.indexOf(ch) >= 0) {
            position++;
            return new Token(TokenType.OPERATOR, String.valueOf(ch), start);
        }
        position++;
        switch (ch) {
            case '(':
                return new Token(TokenType.LEFT_PAREN, "(", start);
            case ')':
                return new Token(TokenType.RIGHT_PAREN, ")", start);
            case ':':
                return new Token(TokenType.COLON, ":", start);
            case ',':
                return new Token(TokenType.COMMA, ",", start);
            default:
                throw new FormulaSyntaxException("Unexpected character '" + ch + "' at position " + start, start);
        }
    }

    private Token number() {
        int start = position;
        consumeDigits();
        if (peek() == '.') {
            position++;
            consumeDigits();
        }
        char marker = peek();
        if (marker == 'e' || marker == 'E') {
            int mark = position;
            position++;
            if (peek() == '+' || peek() == '-') {
                position++;
            }
            if (isDigit(peek())) {
                consumeDigits();
            } else {
                // Not an exponent after all, e.g. "2E" is left for the next token
                position = mark;
            }
        }
        return new Token(TokenType.NUMBER, source.substring(start, position), start);
    }

    private Token string(char quote) {
        int start = position;
        position++;
        StringBuilder text = new StringBuilder();
        while (position < source.length()) {
            char ch = source.charAt(position);
            if (ch == quote) {
                if (position + 1 < source.length() && source.charAt(position + 1) == quote) {
                    text.append(quote);
                    position += 2;
                    continue;
                }
                position++;
                return new Token(TokenType.STRING, text.toString(), start);
            }
            text.append(ch);
            position++;
        }
        throw new FormulaSyntaxException("Unterminated string starting at position " + start, start);
    }

    private Token word() {
        int start = position;
        while (position < source.length()) {
            char ch = source.charAt(position);
            if (Character.isLetterOrDigit(ch) || ch == '_' || ch == '$' || ch == '.') {
                position++;
            } else {
                break;
            }
        }
        String word = source.substring(start, position);
        String upper = word.toUpperCase(Locale.ROOT);

        // LOG10( and friends look like references but are function names
        if (CELL_REFERENCE.matcher(word).matches() && nextNonWhitespace() != '(') {
            return new Token(TokenType.CELL_REFERENCE, upper, start);
        }
        if (word.indexOf('$') >= 0) {
            throw new FormulaSyntaxException("Invalid cell reference '" + word + "' at position " + start, start);
        }
        return new Token(TokenType.IDENTIFIER, upper, start);
    }

    private void consumeDigits() {
        while (position < source.length() && isDigit(source.charAt(position))) {
            position++;
        }
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private void skipWhitespace() {
        while (position < source.length() && Character.isWhitespace(source.charAt(position))) {
            position++;
        }
    }

    private char peek() {
        return position < source.length() ? source.charAt(position) : '\0';
    }

    private char nextNonWhitespace() {
        int i = position;
        while (i < source.length() && Character.isWhitespace(source.charAt(i))) {
            i++;
        }
        return i < source.length() ? source.charAt(i) : '\0';
    }
}
