package io.github.eutro.phpir.bound;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.eutro.phpir.ext.CommonExts;
import io.github.eutro.phpir.ext.DelegatingExtHolder;
import io.github.eutro.phpir.ext.ExtContainer;
import io.github.eutro.phpir.ops.Op;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A node of the bound expression tree: an {@link Op operation}, its children,
 * and the {@link BoundAccess access} of its context.
 * <p>
 * Nodes are never mutated once built, except for their exts. Rewriting
 * produces new nodes, see {@link #update(List)} and {@link #withAccess(BoundAccess)}.
 */
public final class BoundExpression extends DelegatingExtHolder {
    public final Op op;
    private final ImmutableList<BoundExpression> args;
    private final BoundAccess access;

    public BoundExpression(Op op, List<BoundExpression> args, BoundAccess access) {
        this.op = Preconditions.checkNotNull(op, "op");
        this.args = ImmutableList.copyOf(args);
        this.access = Preconditions.checkNotNull(access, "access");
    }

    @Override
    protected ExtContainer getDelegate() {
        return op;
    }

    public List<BoundExpression> args() {
        return args;
    }

    public BoundExpression arg(int i) {
        return args.get(i);
    }

    public BoundAccess access() {
        return access;
    }

    /**
     * Get this node with a different access, keeping its exts.
     *
     * @param access The new access.
     * @return The node, {@code this} if the access is unchanged.
     */
    public BoundExpression withAccess(BoundAccess access) {
        if (this.access.equals(access)) return this;
        BoundExpression copy = new BoundExpression(op, args, access);
        copy.copyExtsFrom(this);
        return copy;
    }

    /**
     * Get this node with the access of another, e.g. one it replaces.
     *
     * @param other The other node.
     * @return The node.
     */
    public BoundExpression withAccessOf(BoundExpression other) {
        return withAccess(other.access);
    }

    /**
     * Get this node with different children, keeping its exts.
     *
     * @param newArgs The new children.
     * @return The node, {@code this} if every child is identical.
     */
    public BoundExpression update(List<BoundExpression> newArgs) {
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
        BoundExpression copy = new BoundExpression(op, newArgs, access);
        copy.copyExtsFrom(this);
        return copy;
    }

    /**
     * Whether the statically known value of this node has been computed.
     *
     * @return Whether it has.
     */
    public boolean hasConstantValue() {
        return getNullable(CommonExts.CONSTANT_VALUE) != null;
    }

    /**
     * Get the statically known value of this node. This is null both for an unknown
     * value and for a known {@code NULL}, use {@link #hasConstantValue()} to tell them apart.
     *
     * @return The value.
     */
    public @Nullable Object constantValue() {
        return CommonExts.takeNull(getNullable(CommonExts.CONSTANT_VALUE));
    }

    /**
     * Set the statically known value of this node.
     *
     * @param value The value, may be null for PHP's {@code NULL}.
     * @return this
     */
    public BoundExpression withConstantValue(@Nullable Object value) {
        attachExt(CommonExts.CONSTANT_VALUE, CommonExts.fillNull(value));
        return this;
    }

    /**
     * Whether the value of this node must be deep copied when it is stored.
     *
     * @return Whether it must.
     */
    public boolean isDeeplyCopied() {
        return CommonExts.IS_DEEPLY_COPIED.getOrDefault(this, true);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('(').append(op);
        for (BoundExpression arg : args) {
            sb.append(' ').append(arg);
        }
        return sb.append(')').toString();
    }
}
