package io.github.eutro.phpir.bound;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.eutro.phpir.ext.DelegatingExtHolder;
import io.github.eutro.phpir.ext.ExtContainer;
import io.github.eutro.phpir.ops.Op;
import io.github.eutro.phpir.ops.PhpOps;
import io.github.eutro.phpir.util.F;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The edge that ends a {@link BoundBlock}: the operation,
 * the guard for conditional edges, and the jump targets.
 */
public final class Edge extends DelegatingExtHolder {
    public final Op op;
    @Nullable
    private final BoundExpression condition;
    /**
     * The jump targets of this edge. The semantics of the order depend on the operation.
     */
    public final List<BoundBlock> targets;

    public Edge(Op op, @Nullable BoundExpression condition, List<BoundBlock> targets) {
        this.op = Preconditions.checkNotNull(op, "op");
        this.condition = condition;
        this.targets = ImmutableList.copyOf(targets);
        Preconditions.checkArgument(
                (op.key == PhpOps.BR_COND.key) == (condition != null),
                "%s with condition %s", op, condition
        );
    }

    /**
     * Construct an unconditional jump to a block.
     *
     * @param target The jump target.
     * @return The edge.
     */
    public static Edge br(BoundBlock target) {
        return new Edge(PhpOps.BR, null, ImmutableList.of(target));
    }

    /**
     * Construct a conditional jump.
     *
     * @param condition   The guard.
     * @param trueTarget  The target if the guard is truthy.
     * @param falseTarget The target otherwise.
     * @return The edge.
     */
    public static Edge cond(BoundExpression condition, BoundBlock trueTarget, BoundBlock falseTarget) {
        return new Edge(PhpOps.BR_COND, condition, Arrays.asList(trueTarget, falseTarget));
    }

    /**
     * Construct an edge that leaves the routine.
     *
     * @return The edge.
     */
    public static Edge exit() {
        return new Edge(PhpOps.EXIT, null, ImmutableList.of());
    }

    @Override
    protected ExtContainer getDelegate() {
        return op;
    }

    public boolean isConditional() {
        return op.key == PhpOps.BR_COND.key;
    }

    public @Nullable BoundExpression getCondition() {
        return condition;
    }

    public BoundBlock trueTarget() {
        Preconditions.checkState(isConditional(), "not a conditional edge: %s", this);
        return targets.get(0);
    }

    public BoundBlock falseTarget() {
        Preconditions.checkState(isConditional(), "not a conditional edge: %s", this);
        return targets.get(1);
    }

    /**
     * Get this edge with a different guard.
     *
     * @param newCondition The new guard.
     * @return The edge, {@code this} if the guard is identical.
     */
    public Edge withCondition(@Nullable BoundExpression newCondition) {
        if (newCondition == condition) return this;
        Edge copy = new Edge(op, newCondition, targets);
        copy.copyExtsFrom(this);
        return copy;
    }

    /**
     * Get a copy of this edge with every target mapped through {@code remap}.
     *
     * @param remap The mapping from old to new blocks.
     * @return The new edge.
     */
    public Edge remapTargets(F<BoundBlock, BoundBlock> remap) {
        List<BoundBlock> newTargets = new ArrayList<>(targets.size());
        for (BoundBlock target : targets) {
            newTargets.add(remap.apply(target));
        }
        Edge copy = new Edge(op, condition, newTargets);
        copy.copyExtsFrom(this);
        return copy;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(op);
        if (condition != null) {
            sb.append(' ').append(condition);
        }
        if (!targets.isEmpty()) {
            sb.append(" ->");
            for (BoundBlock target : targets) {
                sb.append(' ').append(target.toTargetString());
            }
        }
        return sb.toString();
    }
}
