package com.proclang;

import com.proclang.ast.Stmt;
import java.util.ArrayList;
import java.util.List;

public class Session {
    static final String STACK_OVERFLOW = "Stack overflow";

    private final Interpreter interpreter;
    private PersistentMap<String, Stmt.Procedure> penv = PersistentMap.empty();
    private PersistentMap<String, Val> env = PersistentMap.empty();

    public Session() {
        this(new Interpreter());
    }

    public Session(Interpreter interpreter) {
        this.interpreter = interpreter;
    }

    /**
     * Runs one statement and keeps its environments. Runaway recursion is
     * reported as an exception value and leaves the environments untouched.
     */
    public String execute(Stmt statement) {
        Interpreter.Result result;
        try {
            result = interpreter.exec(statement, penv, env);
        } catch (StackOverflowError e) {
            return Val.exn(STACK_OVERFLOW).toString();
        }

        penv = result.getPenv();
        env = result.getEnv();
        return result.getOutput();
    }

    public List<String> execute(Program program) {
        List<String> outputs = new ArrayList<>();
        for (Stmt statement : program.getStatements()) {
            if (statement instanceof Stmt.Quit) {
                break;
            }
            outputs.add(execute(statement));
        }
        return outputs;
    }

    public PersistentMap<String, Stmt.Procedure> getPenv() {
        return penv;
    }

    public PersistentMap<String, Val> getEnv() {
        return env;
    }
}
