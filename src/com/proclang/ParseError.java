package com.proclang;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

public class ParseError extends RuntimeException {
    private final int line;
    private final int column;
    private final String unexpected;
    private final List<String> expected;

    public ParseError(int line, int column, String unexpected, Collection<String> expected) {
        super(format(line, column, unexpected, expected));
        this.line = line;
        this.column = column;
        this.unexpected = unexpected;
        this.expected = Collections.unmodifiableList(new ArrayList<>(expected));
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public String getUnexpected() {
        return unexpected;
    }

    public List<String> getExpected() {
        return expected;
    }

    private static String format(int line, int column, String unexpected, Collection<String> expected) {
        StringBuilder sb = new StringBuilder();
        sb.append("parse error at (line ").append(line).append(", column ").append(column).append("):");
        sb.append(" unexpected ").append(unexpected);

        if (!expected.isEmpty()) {
            sb.append("; expecting ");
            List<String> items = new ArrayList<>(expected);
            for (int i = 0; i < items.size(); i++) {
                if (i > 0) {
                    sb.append(i == items.size() - 1 ? " or " : ", ");
                }
                sb.append(items.get(i));
            }
        }

        return sb.toString();
    }
}
