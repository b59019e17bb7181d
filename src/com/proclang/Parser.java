package com.proclang;

import com.proclang.ast.Exp;
import com.proclang.ast.Stmt;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class Parser {
    private static final List<String> STATEMENT_STARTS =
        List.of("QUIT", "PRINT", "IF", "PROCEDURE", "CALL", "DO", Token.ID);
    private static final List<String> EXPRESSION_STARTS =
        List.of(Token.INT, "FN", "IF", "LET", "TRUE", "FALSE", "APPLY", Token.ID, "(");

    private final List<Token> tokens;
    private int position = 0;

    private int furthest = -1;
    private final Set<String> expected = new LinkedHashSet<>();

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static Program parse(String source) {
        return new Parser(new Lexer(source).tokenize()).parseProgram();
    }

    public static Stmt parseStatement(String source) {
        return new Parser(new Lexer(source).tokenize()).parseStatement();
    }

    public static Exp parseExpression(String source) {
        return new Parser(new Lexer(source).tokenize()).parseExpression();
    }

    public Program parseProgram() {
        List<Stmt> statements = new ArrayList<>();

        while (!atEnd()) {
            statements.add(parseStatement());
        }

        return new Program(statements);
    }

    public boolean atEnd() {
        return current().is(Token.EOF);
    }

    public int getPosition() {
        return position;
    }

    // Statements

    public Stmt parseStatement() {
        switch (current().getType()) {
            case "QUIT":
                return parseQuit();
            case "PRINT":
                return parsePrint();
            case "IF":
                return parseIfStatement();
            case "PROCEDURE":
                return parseProcedure();
            case "CALL":
                return parseCall();
            case "DO":
                return parseSequence();
            case Token.ID:
                return parseAssignment();
            default:
                for (String start : STATEMENT_STARTS) {
                    noteExpected(describe(start));
                }
                throw error();
        }
    }

    private Stmt parseQuit() {
        symbol("QUIT");
        symbol(";");
        return Stmt.Quit.INSTANCE;
    }

    private Stmt parsePrint() {
        symbol("PRINT");
        Exp value = parseExpression();
        symbol(";");
        return new Stmt.Print(value);
    }

    private Stmt parseIfStatement() {
        symbol("IF");
        Exp condition = parseExpression();
        symbol("THEN");
        Stmt consequence = parseStatement();
        symbol("ELSE");
        Stmt alternative = parseStatement();
        symbol("FI");
        return new Stmt.If(condition, consequence, alternative);
    }

    private Stmt parseProcedure() {
        symbol("PROCEDURE");
        String name = identifier();
        symbol("(");
        List<String> parameters = identifierList(",");
        symbol(")");
        Stmt body = parseStatement();
        symbol("ENDPROC");
        return new Stmt.Procedure(name, parameters, body);
    }

    private Stmt parseCall() {
        symbol("CALL");
        String name = identifier();
        symbol("(");
        List<Exp> arguments = expressionList();
        symbol(")");
        symbol(";");
        return new Stmt.Call(name, arguments);
    }

    private Stmt parseSequence() {
        symbol("DO");
        List<Stmt> statements = new ArrayList<>();
        statements.add(parseStatement());

        while (STATEMENT_STARTS.contains(current().getType())) {
            statements.add(parseStatement());
        }
        for (String start : STATEMENT_STARTS) {
            noteExpected(describe(start));
        }

        symbol("OD");
        symbol(";");
        return new Stmt.Sequence(statements);
    }

    private Stmt parseAssignment() {
        String name = identifier();
        symbol(":=");
        Exp value = parseExpression();
        symbol(";");
        return new Stmt.Assign(name, value);
    }

    // Expressions, lowest precedence first

    public Exp parseExpression() {
        return parseOr();
    }

    private Exp parseOr() {
        Exp left = parseAnd();

        while (current().is("OR")) {
            advance();
            Exp right = parseAnd();
            left = new Exp.BoolBinOp("or", left, right);
        }
        noteExpected(describe("OR"));

        return left;
    }

    private Exp parseAnd() {
        Exp left = parseComparison();

        while (current().is("AND")) {
            advance();
            Exp right = parseComparison();
            left = new Exp.BoolBinOp("and", left, right);
        }
        noteExpected(describe("AND"));

        return left;
    }

    private Exp parseComparison() {
        Exp left = parseAdditive();

        while (isComparisonOperator(current().getType())) {
            String operator = current().getType();
            advance();
            Exp right = parseAdditive();
            left = new Exp.CompareBinOp(operator, left, right);
        }
        noteExpected("a comparison operator");

        return left;
    }

    private Exp parseAdditive() {
        Exp left = parseMultiplicative();

        while (current().is("+") || current().is("-")) {
            String operator = current().getType();
            advance();
            Exp right = parseMultiplicative();
            left = new Exp.IntBinOp(operator, left, right);
        }
        noteExpected(describe("+"));
        noteExpected(describe("-"));

        return left;
    }

    private Exp parseMultiplicative() {
        Exp left = parseAtom();

        while (current().is("*") || current().is("/")) {
            String operator = current().getType();
            advance();
            Exp right = parseAtom();
            left = new Exp.IntBinOp(operator, left, right);
        }
        noteExpected(describe("*"));
        noteExpected(describe("/"));

        return left;
    }

    private Exp parseAtom() {
        Token token = current();

        switch (token.getType()) {
            case Token.INT:
                advance();
                return new Exp.IntLiteral(Long.parseLong(token.getValue()));

            case "FN":
                return parseFunction();

            case "IF":
                return parseIfExpression();

            case "LET":
                return parseLet();

            case "TRUE":
                advance();
                return new Exp.BoolLiteral(true);

            case "FALSE":
                advance();
                return new Exp.BoolLiteral(false);

            case "APPLY":
                return parseApply();

            case Token.ID:
                advance();
                return new Exp.Variable(token.getValue());

            case "(":
                return parens();

            default:
                for (String start : EXPRESSION_STARTS) {
                    noteExpected(describe(start));
                }
                throw error();
        }
    }

    private Exp parseFunction() {
        symbol("FN");
        symbol("[");
        List<String> parameters = identifierList(",");
        symbol("]");
        Exp body = parseExpression();
        symbol("END");
        return new Exp.Function(parameters, body);
    }

    private Exp parseIfExpression() {
        symbol("IF");
        Exp condition = parseExpression();
        symbol("THEN");
        Exp consequence = parseExpression();
        symbol("ELSE");
        Exp alternative = parseExpression();
        symbol("FI");
        return new Exp.If(condition, consequence, alternative);
    }

    private Exp parseLet() {
        symbol("LET");
        symbol("[");

        List<Exp.Binding> bindings = new ArrayList<>();
        if (current().is(Token.ID)) {
            bindings.add(parseBinding());
            while (current().is(";")) {
                advance();
                bindings.add(parseBinding());
            }
        } else {
            noteExpected(describe(Token.ID));
        }

        symbol("]");
        Exp body = parseExpression();
        symbol("END");
        return new Exp.Let(bindings, body);
    }

    private Exp.Binding parseBinding() {
        String name = identifier();
        symbol(":=");
        Exp init = parseExpression();
        return new Exp.Binding(name, init);
    }

    private Exp parseApply() {
        symbol("APPLY");
        Exp callee = parseExpression();
        symbol("(");
        List<Exp> arguments = expressionList();
        symbol(")");
        return new Exp.Apply(callee, arguments);
    }

    private Exp parens() {
        symbol("(");
        Exp inner = parseExpression();
        symbol(")");
        return inner;
    }

    // Lexical helpers

    private List<String> identifierList(String separator) {
        List<String> names = new ArrayList<>();

        if (current().is(Token.ID)) {
            names.add(identifier());
            while (current().is(separator)) {
                advance();
                names.add(identifier());
            }
            noteExpected(describe(separator));
        } else {
            noteExpected(describe(Token.ID));
        }

        return names;
    }

    private List<Exp> expressionList() {
        List<Exp> expressions = new ArrayList<>();

        if (EXPRESSION_STARTS.contains(current().getType())) {
            expressions.add(parseExpression());
            while (current().is(",")) {
                advance();
                expressions.add(parseExpression());
            }
            noteExpected(describe(","));
        } else {
            noteExpected("an expression");
        }

        return expressions;
    }

    private String identifier() {
        return symbol(Token.ID).getValue();
    }

    private Token symbol(String type) {
        Token token = current();
        if (!token.is(type)) {
            noteExpected(describe(type));
            throw error();
        }
        advance();
        return token;
    }

    private boolean isComparisonOperator(String type) {
        return "<".equals(type) || ">".equals(type) || "<=".equals(type)
            || ">=".equals(type) || "==".equals(type) || "/=".equals(type);
    }

    private static String describe(String type) {
        switch (type) {
            case Token.INT:
                return "an integer";
            case Token.ID:
                return "an identifier";
            default:
                return "\"" + type.toLowerCase() + "\"";
        }
    }

    private void noteExpected(String description) {
        if (position > furthest) {
            furthest = position;
            expected.clear();
        }
        if (position == furthest) {
            expected.add(description);
        }
    }

    private ParseError error() {
        Token token = tokens.get(furthest);
        return new ParseError(token.getLine(), token.getColumn(), token.describe(), expected);
    }

    private Token current() {
        return tokens.get(position);
    }

    private void advance() {
        if (position < tokens.size() - 1) {
            position++;
        }
    }
}
