package com.proclang;

import com.proclang.ast.Exp;
import com.proclang.ast.Stmt;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.LongBinaryOperator;

public class Interpreter {
    static final String DIVISION_BY_ZERO = "Division by 0";
    static final String NO_MATCH = "No match in env";
    static final String CANNOT_LIFT = "Cannot lift";
    static final String NOT_A_BOOL = "Condition is not a Bool";
    static final String NON_CLOSURE = "Apply to non-closure";
    static final String ARITY_MISMATCH = "Argument count mismatch";

    private interface BoolOperator {
        boolean apply(boolean left, boolean right);
    }

    private interface CompareOperator {
        boolean apply(long left, long right);
    }

    // Integer division floors, so -7 / 2 is -4.
    private static final Map<String, LongBinaryOperator> INT_OPS = Map.of(
        "+", (x, y) -> x + y,
        "-", (x, y) -> x - y,
        "*", (x, y) -> x * y,
        "/", Math::floorDiv);

    private static final Map<String, BoolOperator> BOOL_OPS = Map.of(
        "and", (x, y) -> x && y,
        "or", (x, y) -> x || y);

    private static final Map<String, CompareOperator> COMP_OPS = Map.of(
        "<", (x, y) -> x < y,
        ">", (x, y) -> x > y,
        "<=", (x, y) -> x <= y,
        ">=", (x, y) -> x >= y,
        "/=", (x, y) -> x != y,
        "==", (x, y) -> x == y);

    public static final class Result {
        private final String output;
        private final PersistentMap<String, Stmt.Procedure> penv;
        private final PersistentMap<String, Val> env;

        public Result(String output, PersistentMap<String, Stmt.Procedure> penv, PersistentMap<String, Val> env) {
            this.output = output;
            this.penv = penv;
            this.env = env;
        }

        public String getOutput() {
            return output;
        }

        public PersistentMap<String, Stmt.Procedure> getPenv() {
            return penv;
        }

        public PersistentMap<String, Val> getEnv() {
            return env;
        }
    }

    // Expressions

    public Val eval(Exp expression, PersistentMap<String, Val> env) {
        switch (expression.getType()) {
            case Exp.INT_LITERAL:
                return Val.of(((Exp.IntLiteral) expression).getValue());

            case Exp.BOOL_LITERAL:
                return Val.of(((Exp.BoolLiteral) expression).getValue());

            case Exp.VARIABLE: {
                Val value = env.get(((Exp.Variable) expression).getName());
                return value == null ? Val.exn(NO_MATCH) : value;
            }

            case Exp.INT_BIN_OP:
                return evaluateIntOp((Exp.IntBinOp) expression, env);

            case Exp.BOOL_BIN_OP:
                return evaluateBoolOp((Exp.BoolBinOp) expression, env);

            case Exp.COMPARE_BIN_OP:
                return evaluateCompareOp((Exp.CompareBinOp) expression, env);

            case Exp.IF:
                return evaluateIf((Exp.If) expression, env);

            case Exp.FUNCTION: {
                Exp.Function function = (Exp.Function) expression;
                return new Val.CloVal(function.getParameters(), function.getBody(), env);
            }

            case Exp.APPLY:
                return evaluateApply((Exp.Apply) expression, env);

            case Exp.LET:
                return evaluateLet((Exp.Let) expression, env);

            default:
                throw new IllegalArgumentException("Unknown expression type: " + expression.getType());
        }
    }

    private Val evaluateIntOp(Exp.IntBinOp op, PersistentMap<String, Val> env) {
        String operator = op.getOperator();
        if ("/".equals(operator) && op.getRight().equals(new Exp.IntLiteral(0))) {
            return Val.exn(DIVISION_BY_ZERO);
        }

        LongBinaryOperator function = INT_OPS.get(operator);
        if (function == null) {
            return Val.exn(NO_MATCH);
        }

        Val left = eval(op.getLeft(), env);
        Val right = eval(op.getRight(), env);
        if (!(left instanceof Val.IntVal) || !(right instanceof Val.IntVal)) {
            return Val.exn(CANNOT_LIFT);
        }

        long x = ((Val.IntVal) left).getValue();
        long y = ((Val.IntVal) right).getValue();
        // A divisor that only evaluates to zero is caught here as well as the literal case above.
        if ("/".equals(operator) && y == 0) {
            return Val.exn(DIVISION_BY_ZERO);
        }

        return Val.of(function.applyAsLong(x, y));
    }

    private Val evaluateBoolOp(Exp.BoolBinOp op, PersistentMap<String, Val> env) {
        BoolOperator function = BOOL_OPS.get(op.getOperator());
        if (function == null) {
            return Val.exn(NO_MATCH);
        }

        Val left = eval(op.getLeft(), env);
        Val right = eval(op.getRight(), env);
        if (!(left instanceof Val.BoolVal) || !(right instanceof Val.BoolVal)) {
            return Val.exn(CANNOT_LIFT);
        }

        return Val.of(function.apply(((Val.BoolVal) left).getValue(), ((Val.BoolVal) right).getValue()));
    }

    private Val evaluateCompareOp(Exp.CompareBinOp op, PersistentMap<String, Val> env) {
        CompareOperator function = COMP_OPS.get(op.getOperator());
        if (function == null) {
            return Val.exn(NO_MATCH);
        }

        Val left = eval(op.getLeft(), env);
        Val right = eval(op.getRight(), env);
        if (!(left instanceof Val.IntVal) || !(right instanceof Val.IntVal)) {
            return Val.exn(CANNOT_LIFT);
        }

        return Val.of(function.apply(((Val.IntVal) left).getValue(), ((Val.IntVal) right).getValue()));
    }

    private Val evaluateIf(Exp.If ifExpr, PersistentMap<String, Val> env) {
        Val condition = eval(ifExpr.getCondition(), env);

        if (Val.BoolVal.TRUE.equals(condition)) {
            return eval(ifExpr.getConsequence(), env);
        } else if (Val.BoolVal.FALSE.equals(condition)) {
            return eval(ifExpr.getAlternative(), env);
        }
        return Val.exn(NOT_A_BOOL);
    }

    private Val evaluateApply(Exp.Apply apply, PersistentMap<String, Val> env) {
        Val callee = eval(apply.getCallee(), env);
        if (!(callee instanceof Val.CloVal)) {
            return Val.exn(NON_CLOSURE);
        }

        Val.CloVal closure = (Val.CloVal) callee;
        List<Val> arguments = evaluateAll(apply.getArguments(), env);

        PersistentMap<String, Val> callEnv = bind(closure.getParameters(), arguments, closure.getEnv());
        if (callEnv == null) {
            return Val.exn(ARITY_MISMATCH);
        }

        return eval(closure.getBody(), callEnv);
    }

    private Val evaluateLet(Exp.Let let, PersistentMap<String, Val> env) {
        List<String> names = new ArrayList<>();
        List<Val> values = new ArrayList<>();

        // Every initializer sees the outer environment, not the earlier bindings.
        for (Exp.Binding binding : let.getBindings()) {
            names.add(binding.getName());
            values.add(eval(binding.getInit(), env));
        }

        return eval(let.getBody(), bind(names, values, env));
    }

    private List<Val> evaluateAll(List<Exp> expressions, PersistentMap<String, Val> env) {
        List<Val> values = new ArrayList<>();
        for (Exp expression : expressions) {
            values.add(eval(expression, env));
        }
        return values;
    }

    /**
     * Binds values to names positionally on top of {@code env}. Values beyond the
     * last name are dropped; returns null when there are fewer values than names.
     */
    static PersistentMap<String, Val> bind(List<String> names, List<Val> values, PersistentMap<String, Val> env) {
        if (values.size() < names.size()) {
            return null;
        }

        PersistentMap<String, Val> result = env;
        for (int i = 0; i < names.size(); i++) {
            result = result.assoc(names.get(i), values.get(i));
        }
        return result;
    }

    // Statements

    public Result exec(Stmt statement, PersistentMap<String, Stmt.Procedure> penv, PersistentMap<String, Val> env) {
        switch (statement.getType()) {
            case Stmt.PRINT:
                return new Result(eval(((Stmt.Print) statement).getValue(), env).toString(), penv, env);

            case Stmt.ASSIGN: {
                Stmt.Assign assign = (Stmt.Assign) statement;
                Val value = eval(assign.getValue(), env);
                return new Result("", penv, env.assoc(assign.getName(), value));
            }

            case Stmt.IF:
                return executeIf((Stmt.If) statement, penv, env);

            case Stmt.SEQUENCE:
                return executeSequence((Stmt.Sequence) statement, penv, env);

            case Stmt.PROCEDURE: {
                Stmt.Procedure procedure = (Stmt.Procedure) statement;
                return new Result("", penv.assoc(procedure.getName(), procedure), env);
            }

            case Stmt.CALL:
                return executeCall((Stmt.Call) statement, penv, env);

            case Stmt.QUIT:
                // Leaving the loop is the driver's job; here quit is a no-op.
                return new Result("", penv, env);

            default:
                throw new IllegalArgumentException("Unknown statement type: " + statement.getType());
        }
    }

    private Result executeIf(Stmt.If ifStmt, PersistentMap<String, Stmt.Procedure> penv, PersistentMap<String, Val> env) {
        Val condition = eval(ifStmt.getCondition(), env);

        if (Val.BoolVal.TRUE.equals(condition)) {
            return exec(ifStmt.getConsequence(), penv, env);
        } else if (Val.BoolVal.FALSE.equals(condition)) {
            return exec(ifStmt.getAlternative(), penv, env);
        }
        return new Result(Val.exn(NOT_A_BOOL).toString(), penv, env);
    }

    private Result executeSequence(Stmt.Sequence sequence, PersistentMap<String, Stmt.Procedure> penv,
                                   PersistentMap<String, Val> env) {
        StringBuilder output = new StringBuilder();
        PersistentMap<String, Stmt.Procedure> currentPenv = penv;
        PersistentMap<String, Val> currentEnv = env;

        for (Stmt statement : sequence.getStatements()) {
            Result result = exec(statement, currentPenv, currentEnv);
            output.append(result.getOutput());
            currentPenv = result.getPenv();
            currentEnv = result.getEnv();
        }

        return new Result(output.toString(), currentPenv, currentEnv);
    }

    /**
     * Procedures capture nothing: the body runs in the caller's environment
     * extended with the parameters, and its bindings stay visible afterwards.
     */
    private Result executeCall(Stmt.Call call, PersistentMap<String, Stmt.Procedure> penv,
                               PersistentMap<String, Val> env) {
        Stmt.Procedure procedure = penv.get(call.getName());
        if (procedure == null) {
            return new Result("Procedure " + call.getName() + " undefined", penv, env);
        }

        List<Val> arguments = evaluateAll(call.getArguments(), env);
        PersistentMap<String, Val> callEnv = bind(procedure.getParameters(), arguments, env);
        if (callEnv == null) {
            return new Result(Val.exn(ARITY_MISMATCH).toString(), penv, env);
        }

        return exec(procedure.getBody(), penv, callEnv);
    }
}
