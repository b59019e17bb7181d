package com.proclang;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

public class CLI {
    private static final String USAGE = "Usage: <bin> | <bin> <file>";

    public static void main(String[] args) {
        try {
            if (args.length == 0) {
                handleRepl();
            } else if (args.length == 1) {
                handleRun(args[0]);
            } else {
                System.err.println(USAGE);
                System.exit(1);
            }
        } catch (Exception e) {
            System.out.println("[Error] " + e.getMessage());
            System.exit(1);
        }
    }

    private static void handleRepl() throws IOException {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        new Repl(in, System.out).run();
    }

    // A file is run as a whole; only statements that produce output print a line.
    private static void handleRun(String filename) throws IOException {
        String content = Files.readString(Paths.get(filename));
        Program program;
        try {
            program = Parser.parse(content);
        } catch (StackOverflowError e) {
            System.out.println("[Error] " + Session.STACK_OVERFLOW);
            System.exit(1);
            return;
        }

        Session session = new Session();
        for (String output : session.execute(program)) {
            if (!output.isEmpty()) {
                System.out.println(output);
            }
        }
    }
}
