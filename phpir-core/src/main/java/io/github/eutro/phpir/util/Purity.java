package io.github.eutro.phpir.util;

import io.github.eutro.phpir.bound.BoundExpression;
import io.github.eutro.phpir.bound.TypeRef;
import io.github.eutro.phpir.ext.CommonExts;
import io.github.eutro.phpir.ops.Operation;
import io.github.eutro.phpir.ops.PhpOps;

/**
 * Decides whether evaluating an expression can have observable side effects,
 * and so whether a rewrite may drop it.
 */
public class Purity {
    /**
     * Whether evaluating {@code expr} has no observable side effects.
     * <p>
     * The node itself must be pure, through {@link CommonExts#IS_PURE} on it, its operation
     * or its key, or through its operator, and so must all of its children.
     *
     * @param expr The expression.
     * @return Whether it is provably pure.
     */
    public static boolean isPure(BoundExpression expr) {
        Boolean marked = expr.getNullable(CommonExts.IS_PURE);
        if (marked == null) marked = isOperationPure(expr);
        if (!marked) return false;
        for (BoundExpression arg : expr.args()) {
            if (!isPure(arg)) return false;
        }
        return true;
    }

    private static boolean isOperationPure(BoundExpression expr) {
        Operation operation = PhpOps.BINARY.argNullable(expr.op);
        if (operation == null) operation = PhpOps.UNARY.argNullable(expr.op);
        if (operation != null) return operation.isPure();
        // (bool) never calls user code, unlike (string) on objects
        return PhpOps.CONVERT.argNullable(expr.op) == TypeRef.BOOL;
    }
}
