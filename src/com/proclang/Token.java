package com.proclang;

public class Token {
    public static final String INT = "INT";
    public static final String ID = "ID";
    public static final String EOF = "EOF";

    private final String type;
    private final String value;
    private final int line;
    private final int column;

    public Token(String type, String value, int line, int column) {
        this.type = type;
        this.value = value;
        this.line = line;
        this.column = column;
    }

    public String getType() {
        return type;
    }

    public String getValue() {
        return value;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean is(String type) {
        return this.type.equals(type);
    }

    public String describe() {
        if (is(EOF)) {
            return "end of input";
        }
        return "\"" + value + "\"";
    }

    @Override
    public String toString() {
        return type + "(" + value + ")@" + line + ":" + column;
    }
}
