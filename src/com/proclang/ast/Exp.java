package com.proclang.ast;

import java.util.List;
import java.util.Objects;

public abstract class Exp implements Node {
    public static final String INT_LITERAL = "IntLiteral";
    public static final String BOOL_LITERAL = "BoolLiteral";
    public static final String FUNCTION = "Function";
    public static final String LET = "Let";
    public static final String APPLY = "Apply";
    public static final String IF = "If";
    public static final String INT_BIN_OP = "IntBinOp";
    public static final String BOOL_BIN_OP = "BoolBinOp";
    public static final String COMPARE_BIN_OP = "CompareBinOp";
    public static final String VARIABLE = "Variable";

    private Exp() {
    }

    static String join(List<?> items, String separator) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) sb.append(separator);
            sb.append(items.get(i));
        }
        return sb.toString();
    }

    public static final class IntLiteral extends Exp {
        private final long value;

        public IntLiteral(long value) {
            this.value = value;
        }

        public long getValue() {
            return value;
        }

        @Override
        public String getType() {
            return INT_LITERAL;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof IntLiteral && ((IntLiteral) obj).value == value;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(value);
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    public static final class BoolLiteral extends Exp {
        private final boolean value;

        public BoolLiteral(boolean value) {
            this.value = value;
        }

        public boolean getValue() {
            return value;
        }

        @Override
        public String getType() {
            return BOOL_LITERAL;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof BoolLiteral && ((BoolLiteral) obj).value == value;
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }

        @Override
        public String toString() {
            return String.valueOf(value);
        }
    }

    public static final class Function extends Exp {
        private final List<String> parameters;
        private final Exp body;

        public Function(List<String> parameters, Exp body) {
            this.parameters = List.copyOf(parameters);
            this.body = body;
        }

        public List<String> getParameters() {
            return parameters;
        }

        public Exp getBody() {
            return body;
        }

        @Override
        public String getType() {
            return FUNCTION;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Function)) return false;
            Function other = (Function) obj;
            return parameters.equals(other.parameters) && body.equals(other.body);
        }

        @Override
        public int hashCode() {
            return Objects.hash(parameters, body);
        }

        @Override
        public String toString() {
            return "fn [" + join(parameters, ", ") + "] " + body + " end";
        }
    }

    public static final class Binding {
        private final String name;
        private final Exp init;

        public Binding(String name, Exp init) {
            this.name = name;
            this.init = init;
        }

        public String getName() {
            return name;
        }

        public Exp getInit() {
            return init;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Binding)) return false;
            Binding other = (Binding) obj;
            return name.equals(other.name) && init.equals(other.init);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, init);
        }

        @Override
        public String toString() {
            return name + " := " + init;
        }
    }

    public static final class Let extends Exp {
        private final List<Binding> bindings;
        private final Exp body;

        public Let(List<Binding> bindings, Exp body) {
            this.bindings = List.copyOf(bindings);
            this.body = body;
        }

        public List<Binding> getBindings() {
            return bindings;
        }

        public Exp getBody() {
            return body;
        }

        @Override
        public String getType() {
            return LET;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Let)) return false;
            Let other = (Let) obj;
            return bindings.equals(other.bindings) && body.equals(other.body);
        }

        @Override
        public int hashCode() {
            return Objects.hash(bindings, body);
        }

        @Override
        public String toString() {
            return "let [" + join(bindings, "; ") + "] " + body + " end";
        }
    }

    public static final class Apply extends Exp {
        private final Exp callee;
        private final List<Exp> arguments;

        public Apply(Exp callee, List<Exp> arguments) {
            this.callee = callee;
            this.arguments = List.copyOf(arguments);
        }

        public Exp getCallee() {
            return callee;
        }

        public List<Exp> getArguments() {
            return arguments;
        }

        @Override
        public String getType() {
            return APPLY;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Apply)) return false;
            Apply other = (Apply) obj;
            return callee.equals(other.callee) && arguments.equals(other.arguments);
        }

        @Override
        public int hashCode() {
            return Objects.hash(callee, arguments);
        }

        @Override
        public String toString() {
            return "apply " + callee + " (" + join(arguments, ", ") + ")";
        }
    }

    public static final class If extends Exp {
        private final Exp condition;
        private final Exp consequence;
        private final Exp alternative;

        public If(Exp condition, Exp consequence, Exp alternative) {
            this.condition = condition;
            this.consequence = consequence;
            this.alternative = alternative;
        }

        public Exp getCondition() {
            return condition;
        }

        public Exp getConsequence() {
            return consequence;
        }

        public Exp getAlternative() {
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

    public abstract static class BinOp extends Exp {
        private final String operator;
        private final Exp left;
        private final Exp right;

        BinOp(String operator, Exp left, Exp right) {
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        public String getOperator() {
            return operator;
        }

        public Exp getLeft() {
            return left;
        }

        public Exp getRight() {
            return right;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (obj == null || obj.getClass() != getClass()) return false;
            BinOp other = (BinOp) obj;
            return operator.equals(other.operator) && left.equals(other.left) && right.equals(other.right);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getType(), operator, left, right);
        }

        @Override
        public String toString() {
            return "(" + left + " " + operator + " " + right + ")";
        }
    }

    public static final class IntBinOp extends BinOp {
        public IntBinOp(String operator, Exp left, Exp right) {
            super(operator, left, right);
        }

        @Override
        public String getType() {
            return INT_BIN_OP;
        }
    }

    public static final class BoolBinOp extends BinOp {
        public BoolBinOp(String operator, Exp left, Exp right) {
            super(operator, left, right);
        }

        @Override
        public String getType() {
            return BOOL_BIN_OP;
        }
    }

    public static final class CompareBinOp extends BinOp {
        public CompareBinOp(String operator, Exp left, Exp right) {
            super(operator, left, right);
        }

        @Override
        public String getType() {
            return COMPARE_BIN_OP;
        }
    }

    public static final class Variable extends Exp {
        private final String name;

        public Variable(String name) {
            this.name = name;
        }

        public String getName() {
            return name;
        }

        @Override
        public String getType() {
            return VARIABLE;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Variable && ((Variable) obj).name.equals(name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return name;
        }
    }
}
