package io.github.eutro.phpir.ops;

import io.github.eutro.phpir.bound.BoundAccess;
import io.github.eutro.phpir.bound.BoundExpression;
import io.github.eutro.phpir.ext.DelegatingExtHolder;
import io.github.eutro.phpir.ext.ExtContainer;

import java.util.Arrays;
import java.util.List;

/**
 * An operation: an {@link OpKey operation key} and any immediates.
 */
public /* virtual */ class Op extends DelegatingExtHolder {
    /**
     * The key of this operation.
     */
    public final OpKey key;

    public Op(OpKey key) {
        this.key = key;
    }

    @Override
    protected ExtContainer getDelegate() {
        return key;
    }

    @Override
    public String toString() {
        return key.toString();
    }

    /**
     * Create an expression node of this operation.
     *
     * @param access The access of the node.
     * @param args   The children.
     * @return The node.
     */
    public BoundExpression expr(BoundAccess access, List<BoundExpression> args) {
        return new BoundExpression(this, args, access);
    }

    /**
     * Create an expression node of this operation.
     *
     * @param access The access of the node.
     * @param args   The children.
     * @return The node.
     */
    public BoundExpression expr(BoundAccess access, BoundExpression... args) {
        return expr(access, Arrays.asList(args));
    }
}
