package com.proclang;

import com.proclang.ast.Stmt;
import java.util.List;

public class Program {
    private final List<Stmt> statements;

    public Program(List<Stmt> statements) {
        this.statements = List.copyOf(statements);
    }

    public List<Stmt> getStatements() {
        return statements;
    }
}
