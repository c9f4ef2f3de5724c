package io.github.eutro.phpir.test;

import io.github.eutro.phpir.bound.BoundExpression;
import io.github.eutro.phpir.bound.Exprs;
import io.github.eutro.phpir.bound.TypeRef;
import io.github.eutro.phpir.bound.Variable;
import io.github.eutro.phpir.ext.CommonExts;
import io.github.eutro.phpir.ops.Operation;
import io.github.eutro.phpir.ops.PhpOps;
import org.junit.jupiter.api.Test;

import static io.github.eutro.phpir.test.Utils.call;
import static io.github.eutro.phpir.test.Utils.contains;
import static io.github.eutro.phpir.test.Utils.rewrite;
import static org.junit.jupiter.api.Assertions.*;

public class SimplifyExpressionsTest {
    private final Variable x = Variable.local("x");
    private final Variable y = Variable.local("y");

    private static void assertBoolCastOf(BoundExpression expected, BoundExpression actual) {
        assertSame(TypeRef.BOOL, PhpOps.CONVERT.argNullable(actual.op), () -> "not a (bool) cast: " + actual);
        assertSame(expected, actual.arg(0));
    }

    private static void assertBoolLiteral(boolean expected, BoundExpression actual) {
        assertSame(PhpOps.LITERAL, actual.op.key, () -> "not a literal: " + actual);
        assertEquals(expected, actual.constantValue());
    }

    @Test
    void testConstantConditionSelectsBranch() {
        for (boolean c : new boolean[]{true, false}) {
            BoundExpression a = call("a");
            BoundExpression b = call("b");
            BoundExpression result = rewrite(Exprs.conditional(Exprs.bool(c), a, b));
            assertSame(c ? a : b, result);
        }
    }

    @Test
    void testTruthyConstantConditionSelectsBranch() {
        BoundExpression a = call("a");
        BoundExpression b = call("b");
        assertSame(b, rewrite(Exprs.conditional(Exprs.str("0"), a, b)));
        assertSame(a, rewrite(Exprs.conditional(Exprs.integer(3), a, b)));
    }

    @Test
    void testConditionWithEffectsIsKept() {
        BoundExpression condition = call("check").withConstantValue(true);
        BoundExpression expr = Exprs.conditional(condition, Exprs.ref(x), Exprs.ref(y));
        assertSame(expr, rewrite(expr));
    }

    @Test
    void testConditionalToBoolCast() {
        BoundExpression condition = Exprs.ref(x);
        BoundExpression result = rewrite(Exprs.conditional(condition, Exprs.bool(true), Exprs.bool(false)));
        assertBoolCastOf(condition, result);
    }

    @Test
    void testConditionalToNegation() {
        BoundExpression condition = Exprs.ref(x);
        BoundExpression result = rewrite(Exprs.conditional(condition, Exprs.bool(false), Exprs.bool(true)));
        assertSame(Operation.LOGIC_NEGATION, PhpOps.UNARY.argNullable(result.op));
        assertSame(condition, result.arg(0));
    }

    @Test
    void testNegatedConditionalToBoolCast() {
        BoundExpression inner = Exprs.ref(x);
        BoundExpression result = rewrite(Exprs.conditional(Exprs.not(inner), Exprs.bool(false), Exprs.bool(true)));
        assertBoolCastOf(inner, result);
    }

    @Test
    void testElvisIsKept() {
        BoundExpression expr = Exprs.elvis(Exprs.ref(x), Exprs.bool(false));
        assertSame(expr, rewrite(expr));
    }

    @Test
    void testFalseAndDropsRight() {
        BoundExpression rhs = call("sideEffect");
        BoundExpression result = rewrite(Exprs.binary(Operation.AND, Exprs.bool(false), rhs));
        assertBoolLiteral(false, result);
        assertFalse(contains(result, rhs));
    }

    @Test
    void testTrueOrDropsRight() {
        BoundExpression rhs = call("sideEffect");
        BoundExpression result = rewrite(Exprs.binary(Operation.OR, Exprs.bool(true), rhs));
        assertBoolLiteral(true, result);
        assertFalse(contains(result, rhs));
    }

    @Test
    void testTrueAndKeepsRight() {
        BoundExpression rhs = Exprs.ref(y);
        assertBoolCastOf(rhs, rewrite(Exprs.binary(Operation.AND, Exprs.bool(true), rhs)));
        BoundExpression call = call("sideEffect");
        assertBoolCastOf(call, rewrite(Exprs.binary(Operation.OR, Exprs.bool(false), call)));
    }

    @Test
    void testBoolValuedOperandIsNotCast() {
        BoundExpression comparison = Exprs.binary(Operation.LESS_THAN, Exprs.ref(x), Exprs.ref(y));
        assertSame(comparison, rewrite(Exprs.binary(Operation.AND, Exprs.bool(true), comparison)));
    }

    @Test
    void testKnownRightOperand() {
        BoundExpression lhs = Exprs.ref(x);
        assertBoolCastOf(lhs, rewrite(Exprs.binary(Operation.AND, lhs, Exprs.bool(true))));
        assertBoolCastOf(lhs, rewrite(Exprs.binary(Operation.OR, lhs, Exprs.bool(false))));
    }

    @Test
    void testLeftMustStillBeEvaluated() {
        BoundExpression and = Exprs.binary(Operation.AND, Exprs.ref(x), Exprs.bool(false));
        assertSame(and, rewrite(and));
        BoundExpression or = Exprs.binary(Operation.OR, Exprs.ref(x), Exprs.bool(true));
        assertSame(or, rewrite(or));
    }

    @Test
    void testKnownLeftWithEffects() {
        BoundExpression lhs = call("check").withConstantValue(true);
        BoundExpression and = Exprs.binary(Operation.AND, lhs, Exprs.ref(y));
        assertSame(and, rewrite(and));

        BoundExpression falsy = call("check").withConstantValue(false);
        BoundExpression rhs = call("other");
        BoundExpression result = rewrite(Exprs.binary(Operation.AND, falsy, rhs));
        assertSame(falsy, result);
        assertFalse(contains(result, rhs));

        BoundExpression zero = call("count").withConstantValue(0L);
        BoundExpression cast = rewrite(Exprs.binary(Operation.AND, zero, rhs));
        assertBoolCastOf(zero, cast);
        assertEquals(false, cast.constantValue());
    }

    @Test
    void testDoubleNegation() {
        BoundExpression operand = Exprs.ref(x);
        assertBoolCastOf(operand, rewrite(Exprs.not(Exprs.not(operand))));
    }

    @Test
    void testDoubleNegationRewritesOperand() {
        BoundExpression a = Exprs.ref(x);
        BoundExpression operand = Exprs.conditional(Exprs.bool(true), a, Exprs.ref(y));
        assertBoolCastOf(a, rewrite(Exprs.not(Exprs.not(operand))));
    }

    @Test
    void testCopyOfTemporaryIsDropped() {
        BoundExpression sum = Exprs.binary(Operation.ADD, Exprs.ref(x), Exprs.ref(y));
        assertSame(sum, rewrite(Exprs.copyValue(sum)));
    }

    @Test
    void testCopyOfVariableIsKept() {
        BoundExpression copy = Exprs.copyValue(Exprs.ref(x));
        assertSame(copy, rewrite(copy));

        BoundExpression value = Exprs.ref(y);
        value.attachExt(CommonExts.IS_DEEPLY_COPIED, false);
        assertSame(value, rewrite(Exprs.copyValue(value)));
    }
}
