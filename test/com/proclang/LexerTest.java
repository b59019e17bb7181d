package com.proclang;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

public class LexerTest {

    private static List<String> types(String source) {
        List<String> types = new ArrayList<>();
        for (Token token : new Lexer(source).tokenize()) {
            types.add(token.getType());
        }
        return types;
    }

    @Test
    public void keywordsAreReservedAndIdentifiersAreLettersOnly() {
        assertThat(types("fn endproc ends x1"),
            is(List.of("FN", "ENDPROC", "ID", "ID", "INT", "EOF")));
    }

    @Test
    public void twoCharacterOperatorsWinOverTheirPrefixes() {
        assertThat(types("a <= b >= c < d > e == f /= g / h := 1"),
            is(List.of("ID", "<=", "ID", ">=", "ID", "<", "ID", ">", "ID", "==", "ID", "/=",
                "ID", "/", "ID", ":=", "INT", "EOF")));
    }

    @Test
    public void whitespaceIsInsignificant() {
        assertThat(types("print(1+2);"), is(types("  print ( 1 +\n 2 ) ;  ")));
    }

    @Test
    public void tokensCarryLineAndColumn() {
        List<Token> tokens = new Lexer("x := 1;\n  print x;").tokenize();

        Token print = tokens.get(4);
        assertThat(print.getValue(), is("print"));
        assertThat(print.getLine(), is(2));
        assertThat(print.getColumn(), is(3));

        Token eof = tokens.get(tokens.size() - 1);
        assertThat(eof.getType(), is(Token.EOF));
        assertThat(eof.describe(), is("end of input"));
    }

    @Test
    public void unknownCharacterIsAParseError() {
        try {
            new Lexer("x := 1 @ 2;").tokenize();
            fail("expected a parse error");
        } catch (ParseError e) {
            assertThat(e.getLine(), is(1));
            assertThat(e.getColumn(), is(8));
            assertThat(e.getUnexpected(), is("\"@\""));
        }
    }

    @Test
    public void loneEqualsSignIsNotAnOperator() {
        try {
            new Lexer("x = 1;").tokenize();
            fail("expected a parse error");
        } catch (ParseError e) {
            assertThat(e.getColumn(), is(3));
        }
    }

    @Test
    public void integerTooLargeForSixtyFourBitsIsAParseError() {
        try {
            new Lexer("print 99999999999999999999;").tokenize();
            fail("expected a parse error");
        } catch (ParseError e) {
            assertThat(e.getColumn(), is(7));
        }
    }

    @Test
    public void keywordTokenRecordsItsPosition() {
        Token token = new Lexer("\n  apply").tokenize().get(0);
        assertThat(token.getType(), is("APPLY"));
        assertThat(token.getLine(), is(2));
        assertThat(token.getColumn(), is(3));
    }
}
