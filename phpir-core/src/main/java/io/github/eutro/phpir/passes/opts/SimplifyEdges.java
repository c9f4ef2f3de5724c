package io.github.eutro.phpir.passes.opts;

import io.github.eutro.phpir.bound.BoundAccess;
import io.github.eutro.phpir.bound.BoundBlock;
import io.github.eutro.phpir.bound.BoundExpression;
import io.github.eutro.phpir.bound.Edge;
import io.github.eutro.phpir.ops.Operation;
import io.github.eutro.phpir.ops.PhpOps;
import io.github.eutro.phpir.passes.rewrite.RewriteContext;
import io.github.eutro.phpir.util.PhpValues;
import io.github.eutro.phpir.util.Purity;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Folds conditional edges whose outcome is known at compile time.
 * <p>
 * The target that can no longer be taken is reported to the rewriter, which
 * reports the declarations in it if nothing else reaches it. When the guard has
 * effects, the edge stays conditional, with both targets the same block and the
 * guard evaluated only for its effects.
 */
public class SimplifyEdges {
    /**
     * A singleton instance of this rule.
     */
    public static final SimplifyEdges INSTANCE = new SimplifyEdges();

    /**
     * Try to simplify a conditional edge.
     *
     * @param ctx  The rewriter.
     * @param edge The edge, with its guard already rewritten.
     * @return The replacement, or null if the edge can't be simplified.
     */
    public @Nullable Edge simplify(RewriteContext ctx, Edge edge) {
        if (!edge.isConditional()) return null;
        BoundExpression guard = Objects.requireNonNull(edge.getCondition());
        BoundBlock trueTarget = edge.trueTarget();
        BoundBlock falseTarget = edge.falseTarget();

        Boolean value = PhpValues.knownBool(guard);
        if (value != null && Purity.isPure(guard)) {
            ctx.notePossiblyUnreachable(value ? falseTarget : trueTarget);
            return Edge.br(value ? trueTarget : falseTarget);
        }

        // if (l && false), if (l || true)
        Boolean outcome = shortCircuitOutcome(guard);
        if (outcome != null) {
            BoundExpression left = guard.arg(0);
            while (shortCircuitOutcome(left) != null) {
                left = left.arg(0);
            }
            return alwaysTo(ctx, left, outcome, trueTarget, falseTarget);
        }

        if (value != null && trueTarget != falseTarget) {
            return alwaysTo(ctx, guard, value, trueTarget, falseTarget);
        }
        return null;
    }

    private static Edge alwaysTo(
            RewriteContext ctx,
            BoundExpression effects,
            boolean outcome,
            BoundBlock trueTarget,
            BoundBlock falseTarget
    ) {
        ctx.notePossiblyUnreachable(outcome ? falseTarget : trueTarget);
        BoundBlock target = outcome ? trueTarget : falseTarget;
        return Edge.cond(effects.withAccess(BoundAccess.NONE), target, target);
    }

    /**
     * Get the value of {@code l && r} with a pure {@code r} known to be false, or
     * {@code l || r} with a pure {@code r} known to be true.
     */
    private static @Nullable Boolean shortCircuitOutcome(BoundExpression x) {
        Operation operation = PhpOps.BINARY.argNullable(x.op);
        if (operation != Operation.AND && operation != Operation.OR) return null;
        BoundExpression right = x.arg(1);
        Boolean rightValue = PhpValues.knownBool(right);
        if (rightValue == null || !Purity.isPure(right)) return null;
        if (operation == Operation.AND && !rightValue) return false;
        if (operation == Operation.OR && rightValue) return true;
        return null;
    }
}
