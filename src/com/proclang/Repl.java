package com.proclang;

import com.proclang.ast.Stmt;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;

public class Repl {
    static final String WELCOME = "Welcome to your interpreter!";
    static final String PROMPT = "> ";
    static final String FAREWELL = "Bye!";

    private final BufferedReader in;
    private final PrintStream out;
    private final Session session;

    public Repl(BufferedReader in, PrintStream out) {
        this(in, out, new Session());
    }

    public Repl(BufferedReader in, PrintStream out, Session session) {
        this.in = in;
        this.out = out;
        this.session = session;
    }

    public void run() throws IOException {
        out.println(WELCOME);

        while (true) {
            out.print(PROMPT);
            out.flush();

            String line = in.readLine();
            if (line == null) {
                out.println();
                return;
            }
            if (line.isBlank()) {
                continue;
            }

            Stmt statement;
            try {
                statement = Parser.parseStatement(line);
            } catch (ParseError e) {
                out.println(e.getMessage());
                continue;
            } catch (StackOverflowError e) {
                out.println(Val.exn(Session.STACK_OVERFLOW));
                continue;
            }

            if (statement instanceof Stmt.Quit) {
                out.println(FAREWELL);
                return;
            }

            out.println(session.execute(statement));
        }
    }
}
