package io.github.eutro.phpir.passes.opts;

import io.github.eutro.phpir.bound.BoundExpression;
import io.github.eutro.phpir.bound.Exprs;
import io.github.eutro.phpir.bound.TypeRef;
import io.github.eutro.phpir.ops.Operation;
import io.github.eutro.phpir.ops.PhpOps;
import io.github.eutro.phpir.passes.rewrite.RewriteContext;
import io.github.eutro.phpir.util.PhpValues;
import io.github.eutro.phpir.util.Purity;
import org.jetbrains.annotations.Nullable;

/**
 * Boolean simplifications of conditional and logical expressions,
 * and removal of copies that aren't needed.
 * <p>
 * Every method returns the replacement for the expression, or null if it doesn't apply.
 * A subexpression is only ever dropped if it is {@link Purity#isPure(BoundExpression) pure},
 * or if PHP would not have evaluated it anyway.
 */
public class SimplifyExpressions {
    /**
     * A singleton instance of these rules.
     */
    public static final SimplifyExpressions INSTANCE = new SimplifyExpressions();

    /**
     * Simplify {@code c ? a : b}:
     * <ul>
     *     <li>{@code true ? a : b} to {@code a}, and {@code false ? a : b} to {@code b};</li>
     *     <li>{@code c ? true : false} to {@code (bool)c};</li>
     *     <li>{@code c ? false : true} to {@code !c}.</li>
     * </ul>
     * {@code c ?: b} is left alone.
     *
     * @param ctx The rewriter.
     * @param x   The conditional, with rewritten children.
     * @return The replacement, or null.
     */
    public @Nullable BoundExpression simplifyConditional(RewriteContext ctx, BoundExpression x) {
        if (x.op.key != PhpOps.CONDITIONAL.key || x.args().size() != 3) return null;
        BoundExpression condition = x.arg(0);
        BoundExpression ifTrue = x.arg(1);
        BoundExpression ifFalse = x.arg(2);

        Boolean condValue = PhpValues.knownBool(condition);
        if (condValue != null && Purity.isPure(condition)) {
            return (condValue ? ifTrue : ifFalse).withAccessOf(x);
        }

        Boolean trueValue = pureBoolConstant(ifTrue);
        Boolean falseValue = pureBoolConstant(ifFalse);
        if (trueValue == null || falseValue == null || trueValue.equals(falseValue)) return null;
        return (trueValue ? toBool(condition) : negate(condition)).withAccessOf(x);
    }

    /**
     * Simplify {@code &&} and {@code ||} with a statically known operand:
     * <ul>
     *     <li>{@code false && r} to {@code false}, and {@code true || r} to {@code true};</li>
     *     <li>{@code true && r} and {@code false || r} to {@code (bool)r};</li>
     *     <li>{@code l && true} and {@code l || false} to {@code (bool)l}.</li>
     * </ul>
     * {@code l && false} and {@code l || true} are not simplified here, since {@code l}
     * must still be evaluated.
     *
     * @param ctx The rewriter.
     * @param x   The binary expression, with rewritten children.
     * @return The replacement, or null.
     */
    public @Nullable BoundExpression simplifyLogical(RewriteContext ctx, BoundExpression x) {
        Operation operation = PhpOps.BINARY.argNullable(x.op);
        if (operation != Operation.AND && operation != Operation.OR) return null;
        boolean isAnd = operation == Operation.AND;
        BoundExpression left = x.arg(0);
        BoundExpression right = x.arg(1);

        Boolean leftValue = PhpValues.knownBool(left);
        if (leftValue != null) {
            if (leftValue != isAnd) {
                // the right operand is never evaluated
                return toBool(left).withAccessOf(x);
            }
            if (!Purity.isPure(left)) return null;
            return toBool(right).withAccessOf(x);
        }

        Boolean rightValue = PhpValues.knownBool(right);
        if (rightValue != null && rightValue == isAnd && Purity.isPure(right)) {
            return toBool(left).withAccessOf(x);
        }
        return null;
    }

    /**
     * Simplify {@code !!x} to {@code (bool)x}.
     *
     * @param ctx          The rewriter.
     * @param x            The outer negation.
     * @param visitOperand Whether {@code x} still has to be rewritten, which is
     *                     then done with {@link RewriteContext#accept(BoundExpression)}.
     * @return The replacement, or null.
     */
    public @Nullable BoundExpression simplifyDoubleNegation(RewriteContext ctx, BoundExpression x, boolean visitOperand) {
        if (!isNegation(x) || !isNegation(x.arg(0))) return null;
        BoundExpression operand = x.arg(0).arg(0);
        if (visitOperand) {
            operand = ctx.accept(operand);
        }
        return toBool(operand).withAccessOf(x);
    }

    /**
     * Drop a copy of a value that is not deeply copied anyway.
     *
     * @param ctx The rewriter.
     * @param x   The copy, with its operand rewritten.
     * @return The replacement, or null.
     */
    public @Nullable BoundExpression elideCopy(RewriteContext ctx, BoundExpression x) {
        if (x.op.key != PhpOps.COPY_VALUE.key) return null;
        BoundExpression value = x.arg(0);
        if (value.isDeeplyCopied()) return null;
        return value.withAccessOf(x);
    }

    private static boolean isNegation(BoundExpression x) {
        return PhpOps.UNARY.argNullable(x.op) == Operation.LOGIC_NEGATION;
    }

    private static @Nullable Boolean pureBoolConstant(BoundExpression x) {
        if (!x.hasConstantValue() || !Purity.isPure(x)) return null;
        return PhpValues.asBool(x.constantValue());
    }

    /**
     * Get {@code x} converted to a boolean, without adding a conversion that does nothing.
     */
    static BoundExpression toBool(BoundExpression x) {
        if (Exprs.isBoolValued(x)) return x;
        Boolean value = PhpValues.knownBool(x);
        if (value != null && Purity.isPure(x)) return Exprs.bool(value);
        BoundExpression converted = Exprs.convert(TypeRef.BOOL, x);
        if (value != null) converted.withConstantValue(value);
        return converted;
    }

    private static BoundExpression negate(BoundExpression x) {
        if (isNegation(x)) return toBool(x.arg(0));
        BoundExpression negated = Exprs.not(x);
        Boolean value = PhpValues.knownBool(x);
        if (value != null) negated.withConstantValue(!value);
        return negated;
    }
}
