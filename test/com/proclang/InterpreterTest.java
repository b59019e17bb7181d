package com.proclang;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.junit.Assert.assertThat;

import com.proclang.ast.Exp;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

/**
 * Expression evaluation.
 */
public class InterpreterTest {
    private Interpreter interpreter;
    private PersistentMap<String, Val> env;

    @Before
    public void setUp() {
        interpreter = new Interpreter();
        env = PersistentMap.empty();
    }

    private Val eval(String source) {
        return interpreter.eval(Parser.parseExpression(source), env);
    }

    @Test
    public void literalsEvaluateToThemselves() {
        assertThat(eval("42"), is(Val.of(42)));
        assertThat(eval("true"), is(Val.of(true)));
        assertThat(eval("false"), is(Val.of(false)));
    }

    @Test
    public void variablesAreLookedUpInTheEnvironment() {
        env = env.assoc("x", Val.of(7));

        assertThat(eval("x"), is(Val.of(7)));
        assertThat(eval("y"), is(Val.exn("No match in env")));
    }

    @Test
    public void arithmetic() {
        assertThat(eval("1 + 2 * 3"), is(Val.of(7)));
        assertThat(eval("10 - 4 - 3"), is(Val.of(3)));
        assertThat(eval("7 / 2"), is(Val.of(3)));
    }

    @Test
    public void integerDivisionRoundsTowardNegativeInfinity() {
        assertThat(eval("(0 - 7) / 2"), is(Val.of(-4)));
        assertThat(eval("7 / (0 - 2)"), is(Val.of(-4)));
    }

    @Test
    public void divisionMatchesIntegerDivisionForNonZeroDivisors() {
        for (long a = -9; a <= 9; a++) {
            for (long b = -4; b <= 4; b++) {
                if (b == 0) continue;
                Exp division = new Exp.IntBinOp("/", new Exp.IntLiteral(a), new Exp.IntLiteral(b));
                assertThat(interpreter.eval(division, env), is(Val.of(Math.floorDiv(a, b))));
            }
        }
    }

    @Test
    public void divisionByLiteralZeroIsAnExceptionWhateverTheDividend() {
        assertThat(eval("1 / 0"), is(Val.exn("Division by 0")));
        assertThat(eval("true / 0"), is(Val.exn("Division by 0")));
        assertThat(eval("undefined / 0"), is(Val.exn("Division by 0")));
    }

    @Test
    public void divisionByAComputedZeroIsAnExceptionToo() {
        assertThat(eval("let [z := 0] 1 / z end"), is(Val.exn("Division by 0")));
        assertThat(eval("1 / (2 - 2)"), is(Val.exn("Division by 0")));
    }

    @Test
    public void nonIntegerOperandsCannotBeLifted() {
        assertThat(eval("1 + true"), is(Val.exn("Cannot lift")));
        assertThat(eval("(1 / 0) + 1"), is(Val.exn("Cannot lift")));
        assertThat(eval("1 < false"), is(Val.exn("Cannot lift")));
        assertThat(eval("1 and true"), is(Val.exn("Cannot lift")));
    }

    @Test
    public void booleanOperators() {
        assertThat(eval("true and false"), is(Val.of(false)));
        assertThat(eval("true or false"), is(Val.of(true)));
        assertThat(eval("false or false and true"), is(Val.of(false)));
    }

    @Test
    public void comparisonOperators() {
        assertThat(eval("1 < 2"), is(Val.of(true)));
        assertThat(eval("2 > 2"), is(Val.of(false)));
        assertThat(eval("2 <= 2"), is(Val.of(true)));
        assertThat(eval("1 >= 2"), is(Val.of(false)));
        assertThat(eval("3 == 3"), is(Val.of(true)));
        assertThat(eval("3 /= 3"), is(Val.of(false)));
    }

    @Test
    public void chainedComparisonComparesABooleanAndFails() {
        assertThat(eval("1 < 2 < 3"), is(Val.exn("Cannot lift")));
    }

    @Test
    public void unknownOperatorInAHandBuiltTree() {
        Exp modulo = new Exp.IntBinOp("%", new Exp.IntLiteral(1), new Exp.IntLiteral(2));
        assertThat(interpreter.eval(modulo, env), is(Val.exn("No match in env")));
    }

    @Test
    public void ifSelectsABranchOnlyForBooleans() {
        assertThat(eval("if 1 < 2 then 10 else 20 fi"), is(Val.of(10)));
        assertThat(eval("if false then 10 else 20 fi"), is(Val.of(20)));
        assertThat(eval("if 0 then 10 else 20 fi"), is(Val.exn("Condition is not a Bool")));
    }

    @Test
    public void ifDoesNotEvaluateTheBranchNotTaken() {
        assertThat(eval("if true then 1 else 1 / 0 fi"), is(Val.of(1)));
    }

    @Test
    public void functionLiteralCapturesTheCurrentEnvironment() {
        env = env.assoc("y", Val.of(3));

        Val closure = eval("fn [x] x + y end");

        assertThat(closure, instanceOf(Val.CloVal.class));
        assertThat(((Val.CloVal) closure).getEnv(), is(env));
        assertThat(((Val.CloVal) closure).getParameters(), is(List.of("x")));
    }

    @Test
    public void applyBindsArgumentsInTheCapturedEnvironment() {
        assertThat(eval("apply (fn [x] x + 1 end) (4)"), is(Val.of(5)));
        assertThat(eval("let [y := 10] apply (let [y := 1] fn [x] x + y end end) (y) end"), is(Val.of(11)));
    }

    @Test
    public void zeroParameterClosureRunsInExactlyItsCapturedEnvironment() {
        env = env.assoc("x", Val.of(1));
        Val closure = eval("fn [] x end");

        env = env.assoc("x", Val.of(2));
        PersistentMap<String, Val> callerEnv = env.assoc("f", closure);

        assertThat(interpreter.eval(Parser.parseExpression("apply f ()"), callerEnv), is(Val.of(1)));
    }

    @Test
    public void extraArgumentsAreDropped() {
        assertThat(eval("apply (fn [x] x end) (1, 2, 3)"), is(Val.of(1)));
    }

    @Test
    public void missingArgumentsAreAnArityException() {
        assertThat(eval("apply (fn [x, y] x end) (1)"), is(Val.exn("Argument count mismatch")));
    }

    @Test
    public void applyingANonClosureIsAnException() {
        assertThat(eval("apply 3 (1)"), is(Val.exn("Apply to non-closure")));
    }

    @Test
    public void closuresAreFirstClass() {
        Val result = eval("let [twice := fn [f, x] apply f (apply f (x)) end;"
            + " inc := fn [n] n + 1 end] apply twice (inc, 5) end");

        assertThat(result, is(Val.of(7)));
    }

    @Test
    public void letInitializersAllSeeTheOuterEnvironment() {
        env = env.assoc("x", Val.of(1));

        assertThat(eval("let [x := 10; y := x] y end"), is(Val.of(1)));
        assertThat(eval("let [x := 10; y := x] x end"), is(Val.of(10)));
    }

    @Test
    public void letBindingIsOnlyVisibleInItsBody() {
        Exp let = Parser.parseExpression("let [x := 5] x * 2 end");

        assertThat(interpreter.eval(let, env), is(Val.of(10)));
        assertThat(interpreter.eval(let, env), is(Val.of(10)));
        assertThat(env.containsKey("x"), is(false));
        assertThat(eval("x"), is(Val.exn("No match in env")));
    }

    @Test
    public void closuresCompareStructurally() {
        assertThat(eval("fn [x] x end"), is(eval("fn [x] x end")));
        assertThat(eval("fn [x] x end"), is(not(eval("fn [y] y end"))));
        assertThat(eval("let [a := 1] fn [x] x end end"), is(not(eval("fn [x] x end"))));
    }

    @Test
    public void exceptionsAreOrdinaryValues() {
        assertThat(eval("let [e := 1 / 0] e end"), is(Val.exn("Division by 0")));
        assertThat(eval("apply (fn [e] 7 end) (1 / 0)"), is(Val.of(7)));
    }
}
