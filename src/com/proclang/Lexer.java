package com.proclang;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

public class Lexer {
    private final String input;
    private int position;
    private int line;
    private int column;

    public static final Set<String> KEYWORDS = Set.of(
        "fn", "end", "if", "then", "else", "fi", "let", "apply", "true", "false",
        "quit", "print", "procedure", "endproc", "call", "do", "od", "and", "or");

    public Lexer(String input) {
        this.input = input;
        this.position = 0;
        this.line = 1;
        this.column = 1;
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();

        while (position < input.length()) {
            char current = input.charAt(position);

            if (Character.isWhitespace(current)) {
                skipWhitespace();
                continue;
            }

            if (Character.isDigit(current)) {
                tokens.add(readNumber());
                continue;
            }

            if (Character.isLetter(current)) {
                tokens.add(readIdentifierOrKeyword());
                continue;
            }

            Token operator = readOperator();
            if (operator != null) {
                tokens.add(operator);
                continue;
            }

            throw new ParseError(line, column, "\"" + current + "\"", Collections.emptyList());
        }

        tokens.add(new Token(Token.EOF, "", line, column));
        return tokens;
    }

    private void skipWhitespace() {
        while (position < input.length() && Character.isWhitespace(input.charAt(position))) {
            if (input.charAt(position) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            position++;
        }
    }

    private Token readNumber() {
        int start = position;
        int startColumn = column;

        while (position < input.length() && Character.isDigit(input.charAt(position))) {
            position++;
            column++;
        }

        String value = input.substring(start, position);
        try {
            Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ParseError(line, startColumn, "\"" + value + "\"",
                List.of("an integer between 0 and " + Long.MAX_VALUE));
        }

        return new Token(Token.INT, value, line, startColumn);
    }

    // Identifiers are letters only, so "x1" lexes as an identifier followed by an integer.
    private Token readIdentifierOrKeyword() {
        int start = position;
        int startColumn = column;

        while (position < input.length() && Character.isLetter(input.charAt(position))) {
            position++;
            column++;
        }

        String value = input.substring(start, position);

        if (KEYWORDS.contains(value)) {
            return new Token(value.toUpperCase(), value, line, startColumn);
        } else {
            return new Token(Token.ID, value, line, startColumn);
        }
    }

    private Token readOperator() {
        char current = input.charAt(position);
        int startColumn = column;

        // Two-character operators
        if (position + 1 < input.length()) {
            String twoChar = input.substring(position, position + 2);
            switch (twoChar) {
                case ":=":
                case "==":
                case "/=":
                case ">=":
                case "<=":
                    position += 2;
                    column += 2;
                    return new Token(twoChar, twoChar, line, startColumn);
            }
        }

        // Single-character operators
        switch (current) {
            case '+':
            case '-':
            case '*':
            case '/':
            case '>':
            case '<':
            case '[':
            case ']':
            case '(':
            case ')':
            case ',':
            case ';':
                position++;
                column++;
                return new Token(String.valueOf(current), String.valueOf(current), line, startColumn);
        }

        return null;
    }
}
