package io.github.eutro.phpir.passes.rewrite;

import io.github.eutro.phpir.bound.BoundExpression;
import org.jetbrains.annotations.Nullable;

/**
 * A local rewrite of a single expression, whose children have already been rewritten.
 * <p>
 * Rules hold no state of their own, so the same rule may run for many routines at once.
 */
@FunctionalInterface
public interface ExpressionRule {
    /**
     * Try to rewrite an expression.
     *
     * @param ctx The rewriter running the rule.
     * @param x   The expression.
     * @return The replacement, or null if the rule does not apply.
     */
    @Nullable BoundExpression rewrite(RewriteContext ctx, BoundExpression x);
}
