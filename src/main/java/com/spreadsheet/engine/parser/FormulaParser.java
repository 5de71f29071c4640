package com.spreadsheet.engine.parser;

import com.spreadsheet.engine.exceptions.FormulaSyntaxException;
import com.spreadsheet.engine.exceptions.InvalidCellReferenceException;
import com.spreadsheet.engine.models.CellAddress;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for formula text.
 * <p>
 * Grammar, lowest precedence first:
 * <pre>
 * formula    := '=' expression EOF
 * expression := term (('+' | '-') term)*
 * term       := power (('*' | '/' | '%') power)*
 * power      := unary ('^' unary)*
 * unary      := ('-' | '+') unary | primary
 * primary    := NUMBER | STRING | CELL_REFERENCE | IDENTIFIER '(' arguments ')' | '(' expression ')'
 * argument   := CELL_REFERENCE ':' CELL_REFERENCE | expression
 * </pre>
 * Ranges are legal only as a whole function argument. {@link #parse(String)} never
 * throws: malformed input comes back as an {@link ErrorNode}.
 */
public final class FormulaParser {

    static final int MAX_NESTING = 256;

    private final List<Token> tokens;
    private int index;
    private int depth;

    private FormulaParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses formula text, which must start with '='.
     */
    public static Node parse(String source) {
        if (source == null) {
            return new ErrorNode("Formula is empty");
        }
        String trimmed = source.trim();
        if (!trimmed.startsWith("=")) {
            return new ErrorNode("Formula must begin with '='");
        }
        return parseBody(trimmed.substring(1));
    }

    /**
     * Parses the text after the leading '='.
     */
    private static Node parseBody(String body) {
        try {
            List<Token> tokens = FormulaLexer.tokenize(body);
            if (tokens.get(0).is(TokenType.EOF)) {
                return new ErrorNode("Formula is empty");
            }
            FormulaParser parser = new FormulaParser(tokens);
            Node node = parser.expression();
            Token trailing = parser.current();
            if (!trailing.is(TokenType.EOF)) {
                throw unexpected(trailing);
            }
            return node;
        } catch (FormulaSyntaxException e) {
            return new ErrorNode(e.getMessage());
        }
    }

    private Node expression() {
        Node node = term();
        while (current().isOperator("+") || current().isOperator("-")) {
            String operator = advance().getLexeme();
            node = new BinaryOperationNode(operator, node, term());
        }
        return node;
    }

    private Node term() {
        Node node = power();
        while (current().isOperator("*") || current().isOperator("/") || current().isOperator("%")) {
            String operator = advance().getLexeme();
            node = new BinaryOperationNode(operator, node, power());
        }
        return node;
    }

    private Node power() {
        Node node = unary();
        while (current().isOperator("^")) {
            advance();
            node = new BinaryOperationNode("^", node, unary());
        }
        return node;
    }

    private Node unary() {
        if (current().isOperator("-") || current().isOperator("+")) {
            String operator = advance().getLexeme();
            enter();
            Node operand = unary();
            depth--;
            return new UnaryOperationNode(operator, operand);
        }
        return primary();
    }

    private Node primary() {
        Token token = current();
        switch (token.getType()) {
            case NUMBER:
                advance();
                return new NumberNode(Double.parseDouble(token.getLexeme()));
            case STRING:
                advance();
                return new StringNode(token.getLexeme());
            case CELL_REFERENCE:
                advance();
                if (current().is(TokenType.COLON)) {
                    throw new FormulaSyntaxException(
                            "Range at position " + token.getPosition() + " is only allowed as a function argument",
                            token.getPosition());
                }
                return cellReference(token);
            case IDENTIFIER:
                advance();
                return functionCall(token);
            case LEFT_PAREN: {
                advance();
                enter();
                Node inner = expression();
                expect(TokenType.RIGHT_PAREN, "Expected ')'");
                depth--;
                return inner;
            }
            default:
                throw unexpected(token);
        }
    }

    private Node functionCall(Token name) {
        if (!current().is(TokenType.LEFT_PAREN)) {
            throw new FormulaSyntaxException(
                    "Expected '(' after function name " + name.getLexeme(), name.getPosition());
        }
        advance();
        enter();
        List<Node> arguments = new ArrayList<>();
        if (!current().is(TokenType.RIGHT_PAREN)) {
            arguments.add(argument());
            while (current().is(TokenType.COMMA)) {
                advance();
                arguments.add(argument());
            }
        }
        expect(TokenType.RIGHT_PAREN, "Expected ')' to close arguments of " + name.getLexeme());
        depth--;
        return new FunctionCallNode(name.getLexeme(), arguments);
    }

    private Node argument() {
        if (current().is(TokenType.CELL_REFERENCE) && peek(1).is(TokenType.COLON)) {
            Token start = advance();
            advance();
            Token end = current();
            if (!end.is(TokenType.CELL_REFERENCE)) {
                throw new FormulaSyntaxException(
                        "Expected cell reference after ':' at position " + end.getPosition(), end.getPosition());
            }
            advance();
            Token after = current();
            if (!after.is(TokenType.COMMA) && !after.is(TokenType.RIGHT_PAREN)) {
                throw new FormulaSyntaxException(
                        "Range " + start.getLexeme() + ":" + end.getLexeme()
                                + " cannot be used as an operand at position " + after.getPosition(),
                        after.getPosition());
            }
            return new RangeNode(cellReference(start), cellReference(end));
        }
        return expression();
    }

    private static CellReferenceNode cellReference(Token token) {
        String lexeme = token.getLexeme();
        boolean absoluteColumn = lexeme.startsWith("$");
        String body = absoluteColumn ? lexeme.substring(1) : lexeme;
        int digitStart = 0;
        while (digitStart < body.length() && Character.isLetter(body.charAt(digitStart))) {
            digitStart++;
        }
        String letters = body.substring(0, digitStart);
        String rest = body.substring(digitStart);
        boolean absoluteRow = rest.startsWith("$");
        String digits = absoluteRow ? rest.substring(1) : rest;
        try {
            return new CellReferenceNode(CellAddress.parse(letters + digits), absoluteColumn, absoluteRow);
        } catch (InvalidCellReferenceException e) {
            throw new FormulaSyntaxException(
                    "Invalid cell reference " + lexeme + " at position " + token.getPosition(), token.getPosition());
        }
    }

    private void enter() {
        depth++;
        if (depth > MAX_NESTING) {
            throw new FormulaSyntaxException("Formula is nested too deeply", current().getPosition());
        }
    }

    private void expect(TokenType type, String message) {
        Token token = current();
        if (!token.is(type)) {
            String found = token.is(TokenType.EOF) ? "end of formula" : "'" + token.getLexeme() + "'";
            throw new FormulaSyntaxException(
                    message + " but found " + found + " at position " + token.getPosition(), token.getPosition());
        }
        advance();
    }

    private static FormulaSyntaxException unexpected(Token token) {
        if (token.is(TokenType.EOF)) {
            return new FormulaSyntaxException("Unexpected end of formula", token.getPosition());
        }
        return new FormulaSyntaxException(
                "Unexpected token '" + token.getLexeme() + "' at position " + token.getPosition(), token.getPosition());
    }

    private Token current() {
        return tokens.get(index);
    }

    private Token peek(int offset) {
        int target = Math.min(index + offset, tokens.size() - 1);
        return tokens.get(target);
    }

    private Token advance() {
        Token token = tokens.get(index);
        if (index < tokens.size() - 1) {
            index++;
        }
        return token;
    }
}
