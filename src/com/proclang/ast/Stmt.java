package com.proclang.ast;

import java.util.List;
import java.util.Objects;

public abstract class Stmt implements Node {
    public static final String ASSIGN = "Assign";
    public static final String PRINT = "Print";
    public static final String QUIT = "Quit";
    public static final String IF = "If";
    public static final String PROCEDURE = "Procedure";
    public static final String CALL = "Call";
    public static final String SEQUENCE = "Sequence";

    private Stmt() {
    }

    public static final class Assign extends Stmt {
        private final String name;
        private final Exp value;

        public Assign(String name, Exp value) {
            this.name = name;
            this.value = value;
        }

        public String getName() {
            return name;
        }

        public Exp getValue() {
            return value;
        }

        @Override
        public String getType() {
            return ASSIGN;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Assign)) return false;
            Assign other = (Assign) obj;
            return name.equals(other.name) && value.equals(other.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, value);
        }

        @Override
        public String toString() {
            return name + " := " + value + ";";
        }
    }

    public static final class Print extends Stmt {
        private final Exp value;

        public Print(Exp value) {
            this.value = value;
        }

        public Exp getValue() {
            return value;
        }

        @Override
        public String getType() {
            return PRINT;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Print && ((Print) obj).value.equals(value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(PRINT, value);
        }

        @Override
        public String toString() {
            return "print " + value + ";";
        }
    }

    public static final class Quit extends Stmt {
        public static final Quit INSTANCE = new Quit();

        private Quit() {
        }

        @Override
        public String getType() {
            return QUIT;
        }

        @Override
        public String toString() {
            return "quit;";
        }
    }

    public static final class If extends Stmt {
        private final Exp condition;
        private final Stmt consequence;
        private final Stmt alternative;

        public If(Exp condition, Stmt consequence, Stmt alternative) {
            this.condition = condition;
            this.consequence = consequence;
            this.alternative = alternative;
        }

        public Exp getCondition() {
            return condition;
        }

        public Stmt getConsequence() {
            return consequence;
        }

        public Stmt getAlternative() {
            return alternative;
        }

        @Override
        public String getType() {
            return IF;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof If)) return false;
            If other = (If) obj;
            return condition.equals(other.condition)
                && consequence.equals(other.consequence)
                && alternative.equals(other.alternative);
        }

        @Override
        public int hashCode() {
            return Objects.hash(condition, consequence, alternative);
        }

        @Override
        public String toString() {
            return "if " + condition + " then " + consequence + " else " + alternative + " fi";
        }
    }

    public static final class Procedure extends Stmt {
        private final String name;
        private final List<String> parameters;
        private final Stmt body;

        public Procedure(String name, List<String> parameters, Stmt body) {
            this.name = name;
            this.parameters = List.copyOf(parameters);
            this.body = body;
        }

        public String getName() {
            return name;
        }

        public List<String> getParameters() {
            return parameters;
        }

        public Stmt getBody() {
            return body;
        }

        @Override
        public String getType() {
            return PROCEDURE;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Procedure)) return false;
            Procedure other = (Procedure) obj;
            return name.equals(other.name) && parameters.equals(other.parameters) && body.equals(other.body);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, parameters, body);
        }

        @Override
        public String toString() {
            return "procedure " + name + "(" + Exp.join(parameters, ", ") + ") " + body + " endproc";
        }
    }

    public static final class Call extends Stmt {
        private final String name;
        private final List<Exp> arguments;

        public Call(String name, List<Exp> arguments) {
            this.name = name;
            this.arguments = List.copyOf(arguments);
        }

        public String getName() {
            return name;
        }

        public List<Exp> getArguments() {
            return arguments;
        }

        @Override
        public String getType() {
            return CALL;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Call)) return false;
            Call other = (Call) obj;
            return name.equals(other.name) && arguments.equals(other.arguments);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, arguments);
        }

        @Override
        public String toString() {
            return "call " + name + "(" + Exp.join(arguments, ", ") + ");";
        }
    }

    public static final class Sequence extends Stmt {
        private final List<Stmt> statements;

        public Sequence(List<Stmt> statements) {
            this.statements = List.copyOf(statements);
        }

        public List<Stmt> getStatements() {
            return statements;
        }

        @Override
        public String getType() {
            return SEQUENCE;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Sequence && ((Sequence) obj).statements.equals(statements);
        }

        @Override
        public int hashCode() {
            return Objects.hash(SEQUENCE, statements);
        }

        @Override
        public String toString() {
            return "do " + Exp.join(statements, " ") + " od;";
        }
    }
}
