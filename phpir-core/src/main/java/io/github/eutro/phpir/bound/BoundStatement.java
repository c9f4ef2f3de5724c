package io.github.eutro.phpir.bound;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.eutro.phpir.ext.DelegatingExtHolder;
import io.github.eutro.phpir.ext.ExtContainer;
import io.github.eutro.phpir.ops.Op;

import java.util.Arrays;
import java.util.List;

/**
 * A statement of a {@link BoundBlock}: an {@link Op operation} and the expressions it evaluates.
 */
public final class BoundStatement extends DelegatingExtHolder {
    public final Op op;
    private final ImmutableList<BoundExpression> args;

    public BoundStatement(Op op, List<BoundExpression> args) {
        this.op = Preconditions.checkNotNull(op, "op");
        this.args = ImmutableList.copyOf(args);
    }

    public BoundStatement(Op op, BoundExpression... args) {
        this(op, Arrays.asList(args));
    }

    @Override
    protected ExtContainer getDelegate() {
        return op;
    }

    public List<BoundExpression> args() {
        return args;
    }

    /**
     * Get this statement with different expressions.
     *
     * @param newArgs The new expressions.
     * @return The statement, {@code this} if every expression is identical.
     */
    public BoundStatement update(List<BoundExpression> newArgs) {
        if (newArgs.size() == args.size()) {
            boolean same = true;
            for (int i = 0; i < newArgs.size(); i++) {
                if (newArgs.get(i) != args.get(i)) {
                    same = false;
                    break;
                }
            }
            if (same) return this;
        }
        BoundStatement copy = new BoundStatement(op, newArgs);
        copy.copyExtsFrom(this);
        return copy;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(op);
        for (BoundExpression arg : args) {
            sb.append(' ').append(arg);
        }
        return sb.toString();
    }
}
